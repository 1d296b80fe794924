package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

public record RefinementDecision(
        boolean needsRefinement,
        @Nullable String refinementPrompt,
        int attemptNumber,
        @Nullable QualityTrend trend,
        int maxAttempts,
        @Nullable String reason
) {
    public static RefinementDecision notNeeded(String reason, int attemptNumber, int maxAttempts) {
        return new RefinementDecision(false, null, attemptNumber, null, maxAttempts, reason);
    }
}
