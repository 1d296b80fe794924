package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

public class SessionLimitExceededException extends OrchestrationException {

    public SessionLimitExceededException(String message, @Nullable String sessionId, Map<String, Object> counters, String remediation) {
        super(ErrorCode.SESSION_LIMIT_EXCEEDED, message, sessionId, counters, remediation);
    }
}
