package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.quality.ValidationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Penalizes hedging vocabulary and rewards concrete technical terms and actionable instructions.
 */
@Component
@Order(8)
public class ConcreteAnalysisDepthRule extends AbstractQualityRule {

    private static final List<String> VAGUE_TERMS = List.of(
            "security vulnerabilities", "performance issues", "best practices",
            "code quality", "optimization opportunities", "potential problems",
            "may have", "could be", "might contain", "generally", "typically",
            "standard practices", "common issues", "usual problems");
    private static final List<String> SPECIFIC_TERMS = List.of(
            "algorithm", "function", "method", "variable", "parameter",
            "injection", "xss", "csrf", "jwt", "sql", "nosql",
            "middleware", "controller", "service", "repository",
            "index", "query", "schema", "migration", "constraint",
            "dependency", "import", "export", "configuration");
    private static final List<String> ACTIONABLE = List.of(
            "change line", "modify function", "update configuration",
            "add validation", "remove code", "refactor method",
            "fix query", "update schema", "install package");

    public ConcreteAnalysisDepthRule() {
        super("concrete_analysis_depth", "specificity", 0.3);
    }

    @Override
    public boolean technicalOnly() {
        return true;
    }

    @Override
    public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
        String text = analysisAndRecommendations(response).toLowerCase(Locale.ROOT);
        int points = 0;
        List<String> issues = new ArrayList<>();

        int vagueness = countContained(VAGUE_TERMS, text);
        if (vagueness <= 2) {
            points += 40;
        } else if (vagueness <= 5) {
            points += 20;
        } else {
            issues.add("too many vague terms used (" + vagueness + " found)");
        }
        int specificity = countContained(SPECIFIC_TERMS, text);
        if (specificity >= 5) {
            points += 40;
        } else if (specificity >= 3) {
            points += 25;
        } else {
            issues.add("insufficient technical specificity (" + specificity + " technical terms)");
        }
        int actionable = countContained(ACTIONABLE, text);
        if (actionable >= 2) {
            points += 20;
        } else if (actionable >= 1) {
            points += 10;
        } else {
            issues.add("lacks actionable recommendations");
        }

        String feedback = issues.isEmpty()
                ? "Good analysis depth: " + specificity + " technical terms, " + actionable + " actionable recommendations"
                : "Analysis depth issues: " + String.join(", ", issues) + ". Vagueness: " + vagueness + " vague terms.";
        return result(points >= 60, points, points < 40 ? Severity.CRITICAL : Severity.IMPORTANT, feedback);
    }
}
