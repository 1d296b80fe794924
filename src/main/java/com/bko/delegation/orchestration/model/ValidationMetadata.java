package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

public record ValidationMetadata(
        long validationTimeMs,
        String role,
        @Nullable String sessionId,
        String validatorVersion,
        int rulesApplied
) {
}
