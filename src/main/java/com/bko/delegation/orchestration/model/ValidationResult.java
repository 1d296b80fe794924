package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

public record ValidationResult(
        QualityAssessment assessment,
        FormatValidation formatValidation,
        LegacyQuality legacyQuality,
        @Nullable RefinementDecision refinement,
        ValidationMetadata metadata
) {
}
