package com.bko.delegation.error;

import java.util.Map;

public class ParseRecoveryExhaustedException extends OrchestrationException {

    public ParseRecoveryExhaustedException(String message) {
        super(ErrorCode.PARSE_RECOVERY_EXHAUSTED, message, null, Map.of(),
                "Provide the worker response as non-empty text.");
    }
}
