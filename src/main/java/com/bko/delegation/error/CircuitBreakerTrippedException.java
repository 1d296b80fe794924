package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

public class CircuitBreakerTrippedException extends OrchestrationException {

    public CircuitBreakerTrippedException(String message,
                                          String sessionId,
                                          Map<String, Object> counters,
                                          String remediation,
                                          @Nullable ToolExecutionFailedException lastFailure) {
        super(ErrorCode.CIRCUIT_BREAKER_TRIPPED, message, sessionId, counters, remediation, lastFailure);
    }
}
