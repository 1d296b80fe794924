package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

public class DepthExceededException extends OrchestrationException {

    public DepthExceededException(String message, @Nullable String sessionId, Map<String, Object> counters, String remediation) {
        super(ErrorCode.DEPTH_EXCEEDED, message, sessionId, counters, remediation);
    }
}
