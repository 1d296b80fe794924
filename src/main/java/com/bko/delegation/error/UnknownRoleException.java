package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

public class UnknownRoleException extends OrchestrationException {

    public UnknownRoleException(String message, @Nullable String sessionId, Map<String, Object> counters, String remediation) {
        super(ErrorCode.UNKNOWN_ROLE, message, sessionId, counters, remediation);
    }
}
