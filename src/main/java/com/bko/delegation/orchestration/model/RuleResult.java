package com.bko.delegation.orchestration.model;

public record RuleResult(
        String rule,
        String category,
        boolean passed,
        double score,
        Severity severity,
        String feedback
) {
}
