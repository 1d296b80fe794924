package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

public class RefinementCapExceededException extends OrchestrationException {

    public RefinementCapExceededException(String message, @Nullable String sessionId, Map<String, Object> counters, String remediation) {
        super(ErrorCode.REFINEMENT_CAP_EXCEEDED, message, sessionId, counters, remediation);
    }
}
