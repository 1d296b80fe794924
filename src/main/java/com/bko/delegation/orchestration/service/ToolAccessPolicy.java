package com.bko.delegation.orchestration.service;

import com.bko.delegation.config.AgentToolsConfig;
import com.bko.delegation.config.DelegationProperties;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

import static com.bko.delegation.orchestration.OrchestrationConstants.ENGINE_TOOL_NAMES;

/**
 * Decides which tool names a worker may see.
 * The engine's own operations and the configured deny-list are never exposed; a per-role allow-list
 * (delegation.tools.workers) narrows the remaining set when present.
 */
@Service
public class ToolAccessPolicy {

    private final DelegationProperties properties;

    public ToolAccessPolicy(DelegationProperties properties) {
        this.properties = properties;
    }

    public boolean permits(@Nullable String toolName, @Nullable String role) {
        if (!StringUtils.hasText(toolName) || isDenied(toolName)) {
            return false;
        }
        List<String> allowed = properties.getTools().getToolsForWorkerRole(role);
        return allowed.isEmpty() || matchesAny(toolName, allowed);
    }

    public boolean isDenied(String toolName) {
        return matchesAny(toolName, deniedNames());
    }

    Set<String> deniedNames() {
        AgentToolsConfig cfg = properties.getTools();
        Set<String> denied = new LinkedHashSet<>(ENGINE_TOOL_NAMES);
        cfg.getDenied().stream()
                .filter(Objects::nonNull)
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(s -> s.toLowerCase(Locale.ROOT))
                .forEach(denied::add);
        return denied;
    }

    /**
     * Case-insensitive match that also accepts server-qualified names such as {@code fs.read_file},
     * {@code fs/read_file} or {@code fs:read_file}.
     */
    static boolean matchesAny(String toolName, Collection<String> names) {
        String name = toolName.trim().toLowerCase(Locale.ROOT);
        if (names.contains(name)) {
            return true;
        }
        if (names.contains(stripPrefix(name))) {
            return true;
        }
        for (String candidate : names) {
            if (name.endsWith("." + candidate) || name.endsWith("/" + candidate) || name.endsWith(":" + candidate)) {
                return true;
            }
        }
        return false;
    }

    static String stripPrefix(String name) {
        int dot = name.lastIndexOf('.');
        int slash = name.lastIndexOf('/');
        int colon = name.lastIndexOf(':');
        int idx = Math.max(dot, Math.max(slash, colon));
        if (idx < 0 || idx + 1 >= name.length()) {
            return name;
        }
        return name.substring(idx + 1);
    }
}
