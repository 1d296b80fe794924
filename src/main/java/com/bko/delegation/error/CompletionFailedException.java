package com.bko.delegation.error;

import java.util.Map;

public class CompletionFailedException extends OrchestrationException {

    public CompletionFailedException(String message, String sessionId, Map<String, Object> counters, Throwable cause) {
        super(ErrorCode.COMPLETION_FAILED, message, sessionId, counters,
                "Check the model provider configuration (API key, base URL, model name) and retry.", cause);
    }
}
