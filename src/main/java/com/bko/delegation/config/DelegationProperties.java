package com.bko.delegation.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "delegation")
public class DelegationProperties {

    private SessionLimits session = new SessionLimits();
    private QualityConfig quality = new QualityConfig();
    private ExecutionConfig execution = new ExecutionConfig();
    private AgentToolsConfig tools = new AgentToolsConfig();
    private RolesConfig roles = new RolesConfig();

    public static class SessionLimits {
        private int maxTotalCalls = 50;
        private int maxDepth = 2;
        private int maxParallelAgents = 5;
        private int maxConcurrentAgents = 10;
        private int loopRepeatThreshold = 3;
        private Duration timeout = Duration.ofMinutes(30);

        public int getMaxTotalCalls() { return maxTotalCalls; }
        public void setMaxTotalCalls(int maxTotalCalls) { this.maxTotalCalls = maxTotalCalls; }
        public int getMaxDepth() { return maxDepth; }
        public void setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; }
        public int getMaxParallelAgents() { return maxParallelAgents; }
        public void setMaxParallelAgents(int maxParallelAgents) { this.maxParallelAgents = maxParallelAgents; }
        public int getMaxConcurrentAgents() { return maxConcurrentAgents; }
        public void setMaxConcurrentAgents(int maxConcurrentAgents) { this.maxConcurrentAgents = maxConcurrentAgents; }
        public int getLoopRepeatThreshold() { return loopRepeatThreshold; }
        public void setLoopRepeatThreshold(int loopRepeatThreshold) { this.loopRepeatThreshold = loopRepeatThreshold; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout != null ? timeout : Duration.ofMinutes(30); }
    }

    public static class QualityConfig {
        private double defaultThreshold = 0.70;
        private int maxRefinementAttempts = 3;
        private double trendMinDelta = 0.05;
        private List<String> technicalRoles = new ArrayList<>(List.of(
                "Security Engineer", "Software Engineer", "DevOps Engineer", "Database Architect", "Test Engineer"));
        private Map<String, Double> roleThresholds = new HashMap<>(Map.of(
                "security engineer", 0.80,
                "software architect", 0.75,
                "database architect", 0.75,
                "test engineer", 0.75));

        public double getDefaultThreshold() { return defaultThreshold; }
        public void setDefaultThreshold(double defaultThreshold) { this.defaultThreshold = defaultThreshold; }
        public int getMaxRefinementAttempts() { return maxRefinementAttempts; }
        public void setMaxRefinementAttempts(int maxRefinementAttempts) { this.maxRefinementAttempts = maxRefinementAttempts; }
        public double getTrendMinDelta() { return trendMinDelta; }
        public void setTrendMinDelta(double trendMinDelta) { this.trendMinDelta = trendMinDelta; }
        public List<String> getTechnicalRoles() { return technicalRoles; }

        public void setTechnicalRoles(List<String> technicalRoles) {
            if (technicalRoles == null) {
                return;
            }
            this.technicalRoles = new ArrayList<>(technicalRoles);
        }

        public Map<String, Double> getRoleThresholds() { return roleThresholds; }

        public void setRoleThresholds(Map<String, Double> roleThresholds) {
            if (roleThresholds == null) {
                return;
            }
            Map<String, Double> normalized = new HashMap<>();
            roleThresholds.forEach((role, value) -> {
                if (role != null && value != null) {
                    normalized.put(role.trim().toLowerCase(Locale.ROOT), value);
                }
            });
            this.roleThresholds = normalized;
        }

        public double thresholdFor(String role) {
            if (role == null) {
                return defaultThreshold;
            }
            Double override = roleThresholds.get(role.trim().toLowerCase(Locale.ROOT));
            return override != null ? override : defaultThreshold;
        }

        public boolean isTechnicalRole(String role) {
            if (role == null) {
                return false;
            }
            return technicalRoles.stream().anyMatch(r -> r.equalsIgnoreCase(role.trim()));
        }
    }

    public static class ExecutionConfig {
        private int maxIterations = 50;
        private int circuitBreakerThreshold = 5;
        private int workerConcurrency = 5;
        private Duration workerTimeout = Duration.ofMinutes(10);
        private Duration toolCallTimeout = Duration.ofSeconds(60);
        private String model;

        public int getMaxIterations() { return maxIterations; }
        public void setMaxIterations(int maxIterations) { this.maxIterations = maxIterations; }
        public int getCircuitBreakerThreshold() { return circuitBreakerThreshold; }
        public void setCircuitBreakerThreshold(int circuitBreakerThreshold) { this.circuitBreakerThreshold = circuitBreakerThreshold; }
        public int getWorkerConcurrency() { return workerConcurrency; }
        public void setWorkerConcurrency(int workerConcurrency) { this.workerConcurrency = workerConcurrency; }
        public Duration getWorkerTimeout() { return workerTimeout; }
        public void setWorkerTimeout(Duration workerTimeout) { this.workerTimeout = workerTimeout != null ? workerTimeout : Duration.ofMinutes(10); }
        public Duration getToolCallTimeout() { return toolCallTimeout; }
        public void setToolCallTimeout(Duration toolCallTimeout) { this.toolCallTimeout = toolCallTimeout != null ? toolCallTimeout : Duration.ofSeconds(60); }
        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }
    }

    public static class RolesConfig {
        private String location = "classpath:roles/*.role.md";

        public String getLocation() { return location; }

        public void setLocation(String location) {
            if (location == null || location.isBlank()) {
                return;
            }
            this.location = location;
        }
    }

    @PostConstruct
    public void validate() {
        requireRange("delegation.session.max-total-calls", session.getMaxTotalCalls(), 1, 100);
        requireRange("delegation.session.max-depth", session.getMaxDepth(), 0, 10);
        requireRange("delegation.session.max-parallel-agents", session.getMaxParallelAgents(), 1, 5);
        requireRange("delegation.session.max-concurrent-agents", session.getMaxConcurrentAgents(), 1, 1000);
        requireRange("delegation.session.loop-repeat-threshold", session.getLoopRepeatThreshold(), 1, 100);
        requireRange("delegation.quality.max-refinement-attempts", quality.getMaxRefinementAttempts(), 1, 10);
        requireRange("delegation.execution.max-iterations", execution.getMaxIterations(), 1, 500);
        requireRange("delegation.execution.circuit-breaker-threshold", execution.getCircuitBreakerThreshold(), 1, 50);
        requireRange("delegation.execution.worker-concurrency", execution.getWorkerConcurrency(), 1, 64);
        if (quality.getDefaultThreshold() < 0.0 || quality.getDefaultThreshold() > 1.0) {
            throw new IllegalStateException("delegation.quality.default-threshold must be within [0, 1] but was "
                    + quality.getDefaultThreshold());
        }
        quality.getRoleThresholds().forEach((role, value) -> {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalStateException("delegation.quality.role-thresholds[" + role
                        + "] must be within [0, 1] but was " + value);
            }
        });
    }

    private static void requireRange(String key, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalStateException(key + " must be within [" + min + ", " + max + "] but was " + value);
        }
    }

    public SessionLimits getSession() {
        return session;
    }

    public void setSession(SessionLimits session) {
        this.session = session != null ? session : new SessionLimits();
    }

    public QualityConfig getQuality() {
        return quality;
    }

    public void setQuality(QualityConfig quality) {
        this.quality = quality != null ? quality : new QualityConfig();
    }

    public ExecutionConfig getExecution() {
        return execution;
    }

    public void setExecution(ExecutionConfig execution) {
        this.execution = execution != null ? execution : new ExecutionConfig();
    }

    public AgentToolsConfig getTools() {
        return tools;
    }

    public void setTools(AgentToolsConfig tools) {
        this.tools = tools != null ? tools : new AgentToolsConfig();
    }

    public RolesConfig getRoles() {
        return roles;
    }

    public void setRoles(RolesConfig roles) {
        this.roles = roles != null ? roles : new RolesConfig();
    }
}
