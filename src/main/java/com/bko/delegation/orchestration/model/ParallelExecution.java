package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;

public record ParallelExecution(
        String coordinatorSessionId,
        int totalAgents,
        int successfulAgents,
        int failedAgents,
        long totalExecutionTimeMs,
        @Nullable String coordinationContext,
        Instant completedAt
) {
}
