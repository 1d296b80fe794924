package com.bko.delegation.orchestration.model;

import java.util.List;
import java.util.Map;

/**
 * Scores are on a 0..1 scale. {@code passed} holds only when the score reaches the threshold
 * and no critical rule failed.
 */
public record QualityAssessment(
        double overallScore,
        double threshold,
        boolean passed,
        Map<String, Double> categoryScores,
        List<RuleResult> ruleResults,
        List<String> criticalIssues,
        List<String> recommendations,
        List<String> refinementSuggestions,
        boolean canRefine,
        ConfidenceLevel confidence,
        long processingTimeMs
) {
}
