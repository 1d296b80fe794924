package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.quality.QualityRule;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

abstract class AbstractQualityRule implements QualityRule {

    private final String name;
    private final String category;
    private final double weight;

    AbstractQualityRule(String name, String category, double weight) {
        this.name = name;
        this.category = category;
        this.weight = weight;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String category() {
        return category;
    }

    @Override
    public double weight() {
        return weight;
    }

    /**
     * Score is given in points out of 100.
     */
    RuleResult result(boolean passed, int points, Severity severity, String feedback) {
        int bounded = Math.max(0, Math.min(100, points));
        return new RuleResult(name, category, passed, bounded / 100.0, severity, feedback);
    }

    static String analysisAndRecommendations(WorkerResponse response) {
        String analysis = response.deliverables().analysis();
        String recommendations = String.join(" ", response.deliverables().recommendations());
        return (analysis == null ? "" : analysis) + " " + recommendations;
    }

    static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    static int countContained(List<String> terms, String lowerText) {
        int count = 0;
        for (String term : terms) {
            if (lowerText.contains(term.toLowerCase())) {
                count++;
            }
        }
        return count;
    }
}
