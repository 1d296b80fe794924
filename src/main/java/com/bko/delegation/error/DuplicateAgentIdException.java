package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

public class DuplicateAgentIdException extends OrchestrationException {

    public DuplicateAgentIdException(String message, @Nullable String sessionId, Map<String, Object> counters, String remediation) {
        super(ErrorCode.DUPLICATE_AGENT_ID, message, sessionId, counters, remediation);
    }
}
