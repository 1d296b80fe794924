package com.bko.delegation.orchestration.model;

import java.time.Instant;
import java.util.List;

public record RefinementState(
        String sessionId,
        String role,
        int attemptNumber,
        List<Double> scoreHistory,
        QualityTrend trend,
        String reason,
        Instant lastAttemptAt
) {
}
