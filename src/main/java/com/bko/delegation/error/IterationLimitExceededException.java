package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

public class IterationLimitExceededException extends OrchestrationException {

    public IterationLimitExceededException(String message, @Nullable String sessionId, Map<String, Object> counters, String remediation) {
        super(ErrorCode.ITERATION_LIMIT_EXCEEDED, message, sessionId, counters, remediation);
    }
}
