package com.bko.delegation.orchestration.model;

public record RefinementOutcome(
        boolean successful,
        double improvement,
        QualityTrend trend,
        boolean shouldContinue
) {
}
