package com.bko.delegation.error;

import java.util.Map;

public class SessionNotFoundException extends OrchestrationException {

    public SessionNotFoundException(String sessionId) {
        super(ErrorCode.SESSION_NOT_FOUND, "Session not found: " + sessionId, sessionId, Map.of(),
                "Sessions expire after the configured idle timeout; start a new delegation.");
    }
}
