package com.bko.delegation.orchestration.quality;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.orchestration.model.ConfidenceLevel;
import com.bko.delegation.orchestration.model.QualityAssessment;
import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores worker responses against the registered {@link QualityRule}s.
 * <p>
 * Rule points are normalized to 0..1. The overall score is the weight-averaged rule score, category scores are
 * the plain mean of their rules, and a response passes only when it reaches the role threshold with no
 * critical rule failure.
 */
@Service
@Slf4j
public class QualityValidator {

    private final List<QualityRule> rules;
    private final DelegationProperties properties;

    public QualityValidator(List<QualityRule> rules, DelegationProperties properties) {
        this.rules = List.copyOf(rules);
        this.properties = properties;
    }

    public QualityAssessment validate(WorkerResponse response, ValidationContext context) {
        long start = System.currentTimeMillis();
        List<QualityRule> applicable = applicableRules(context.role());
        List<RuleResult> results = new ArrayList<>();
        for (QualityRule rule : applicable) {
            results.add(evaluate(rule, response, context));
        }

        double threshold = properties.getQuality().thresholdFor(context.role());
        double overall = weightedScore(results, applicable);
        List<String> critical = results.stream()
                .filter(r -> !r.passed() && r.severity() == Severity.CRITICAL)
                .map(RuleResult::feedback)
                .toList();
        boolean improvable = results.stream().anyMatch(r -> !r.passed() && r.severity() != Severity.CRITICAL);
        boolean canRefine = improvable || overall > threshold * 0.8;
        List<String> suggestions = canRefine
                ? results.stream()
                        .filter(r -> !r.passed() && r.severity() != Severity.CRITICAL)
                        .map(r -> "Improve " + r.category() + ": " + r.feedback())
                        .toList()
                : List.of();

        QualityAssessment assessment = new QualityAssessment(
                overall,
                threshold,
                overall >= threshold && critical.isEmpty(),
                categoryScores(results),
                results,
                critical,
                recommendations(results, context.role()),
                suggestions,
                canRefine,
                confidence(results, overall),
                Math.max(1, System.currentTimeMillis() - start));
        log.info("Quality validation completed. role={}, score={}, threshold={}, passed={}, rules={}",
                context.role(), String.format(Locale.ROOT, "%.2f", overall), threshold, assessment.passed(), results.size());
        return assessment;
    }

    public List<QualityRule> applicableRules(String role) {
        boolean technical = properties.getQuality().isTechnicalRole(role);
        String normalized = role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
        return rules.stream()
                .filter(rule -> technical || !rule.technicalOnly())
                .filter(rule -> !rule.excludedRoles().contains(normalized))
                .toList();
    }

    private RuleResult evaluate(QualityRule rule, WorkerResponse response, ValidationContext context) {
        try {
            return rule.evaluate(response, context);
        } catch (RuntimeException ex) {
            log.warn("Quality rule execution failed. rule={}, error={}", rule.name(), ex.getMessage());
            return new RuleResult(rule.name(), rule.category(), false, 0.0, Severity.MINOR,
                    "Rule evaluation failed: " + rule.name());
        }
    }

    private static double weightedScore(List<RuleResult> results, List<QualityRule> rules) {
        double weighted = 0;
        double totalWeight = 0;
        for (int i = 0; i < results.size(); i++) {
            double weight = rules.get(i).weight();
            weighted += results.get(i).score() * weight;
            totalWeight += weight;
        }
        return totalWeight > 0 ? weighted / totalWeight : 0.0;
    }

    private static Map<String, Double> categoryScores(List<RuleResult> results) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (RuleResult result : results) {
            double[] sum = sums.computeIfAbsent(result.category(), k -> new double[2]);
            sum[0] += result.score();
            sum[1] += 1;
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        sums.forEach((category, sum) -> scores.put(category, sum[0] / sum[1]));
        return scores;
    }

    private List<String> recommendations(List<RuleResult> results, String role) {
        List<String> recommendations = new ArrayList<>();
        for (RuleResult result : results) {
            if (!result.passed()) {
                recommendations.add(result.feedback());
            }
        }
        boolean roleSpecific = properties.getQuality().getRoleThresholds()
                .containsKey(role.trim().toLowerCase(Locale.ROOT));
        if (!recommendations.isEmpty() && roleSpecific) {
            recommendations.add("Consider the specific requirements for " + role + " when refining the response.");
        }
        return recommendations;
    }

    private static ConfidenceLevel confidence(List<RuleResult> results, double score) {
        if (results.isEmpty()) {
            return ConfidenceLevel.LOW;
        }
        long passed = results.stream().filter(RuleResult::passed).count();
        double successRate = (double) passed / results.size();
        if (score >= 0.85 && successRate >= 0.9) {
            return ConfidenceLevel.HIGH;
        }
        if (score >= 0.6 && successRate >= 0.7) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }
}
