package com.bko.delegation.config;

import java.util.*;

/**
 * Configuration for the tools a worker may see.
 * Engine-owned operation names are always denied; per-role lists narrow the remaining set further.
 */
public class AgentToolsConfig {

    /**
     * Tool names never exposed to workers, in addition to the engine's own operation names.
     */
    private List<String> denied = new ArrayList<>();

    /**
     * Allow-lists for specific worker roles (keyed by normalized role name). An absent or empty entry allows every safe tool.
     */
    private Map<String, List<String>> workers = new HashMap<>();

    public AgentToolsConfig() {}

    public List<String> getDenied() { return denied; }
    public void setDenied(List<String> denied) { this.denied = denied != null ? denied : new ArrayList<>(); }

    public Map<String, List<String>> getWorkers() { return workers; }

    public void setWorkers(Map<String, List<String>> workers) {
        if (workers == null) {
            this.workers = new HashMap<>();
            return;
        }
        Map<String, List<String>> normalized = new HashMap<>();
        workers.forEach((role, tools) -> {
            if (role != null && tools != null) {
                normalized.put(role.trim().toLowerCase(Locale.ROOT), tools);
            }
        });
        this.workers = normalized;
    }

    /**
     * Resolve the allow-list for a worker role; empty means no role-specific restriction.
     */
    public List<String> getToolsForWorkerRole(String role) {
        if (role == null) {
            return List.of();
        }
        List<String> configured = workers.get(role.trim().toLowerCase(Locale.ROOT));
        if (configured == null) {
            return List.of();
        }
        return configured.stream().filter(Objects::nonNull).map(String::trim).filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT)).distinct().toList();
    }
}
