package com.bko.delegation.orchestration.model;

import java.util.List;

/**
 * Flat summary for callers that only need a score and a verdict.
 */
public record LegacyQuality(
        double score,
        boolean passed,
        List<String> issues,
        List<String> recommendations,
        ConfidenceLevel confidence
) {
    public static LegacyQuality from(QualityAssessment assessment) {
        return new LegacyQuality(assessment.overallScore(), assessment.passed(), assessment.criticalIssues(),
                assessment.recommendations(), assessment.confidence());
    }
}
