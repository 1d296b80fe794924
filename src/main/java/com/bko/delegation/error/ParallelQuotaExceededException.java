package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

public class ParallelQuotaExceededException extends OrchestrationException {

    public ParallelQuotaExceededException(String message, @Nullable String sessionId, Map<String, Object> counters, String remediation) {
        super(ErrorCode.PARALLEL_QUOTA_EXCEEDED, message, sessionId, counters, remediation);
    }
}
