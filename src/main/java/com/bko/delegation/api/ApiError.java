package com.bko.delegation.api;

import java.time.Instant;
import java.util.Map;

public record ApiError(
        String error,
        String message,
        String sessionId,
        Map<String, Object> counters,
        String remediation,
        Instant timestamp
) {
}
