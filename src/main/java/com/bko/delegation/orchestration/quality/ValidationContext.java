package com.bko.delegation.orchestration.quality;

import org.springframework.lang.Nullable;

/**
 * What a worker response is judged against.
 */
public record ValidationContext(
        String role,
        String requirements,
        String qualityCriteria,
        @Nullable String expectedDeliverables
) {
    public ValidationContext {
        role = role == null || role.isBlank() ? "default" : role.trim();
        requirements = requirements == null ? "" : requirements;
        qualityCriteria = qualityCriteria == null ? "" : qualityCriteria;
    }

    public boolean expects(String deliverable) {
        return expectedDeliverables != null && expectedDeliverables.toLowerCase().contains(deliverable.toLowerCase());
    }
}
