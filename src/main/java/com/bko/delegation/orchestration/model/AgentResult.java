package com.bko.delegation.orchestration.model;

import com.bko.delegation.error.ErrorCode;
import org.springframework.lang.Nullable;

public record AgentResult(
        String agentId,
        String role,
        AgentStatus status,
        long executionTimeMs,
        @Nullable String sessionId,
        @Nullable WorkerResponse response,
        @Nullable String error,
        @Nullable ErrorCode errorCode
) {
}
