package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.quality.ValidationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Content depth plus how many words of the requirements the response actually addresses.
 */
@Component
@Order(5)
public class ResponseQualityRule extends AbstractQualityRule {

    public ResponseQualityRule() {
        super("response_quality", "content", 0.2);
    }

    @Override
    public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
        int points = 0;
        List<String> issues = new ArrayList<>();
        String analysis = response.deliverables().analysis();
        if (analysis.length() > 500) {
            points += 30;
        } else if (analysis.length() > 200) {
            points += 20;
        } else {
            issues.add("analysis lacks depth");
        }
        int recommendations = response.deliverables().recommendations().size();
        if (recommendations >= 3) {
            points += 25;
        } else if (recommendations >= 1) {
            points += 15;
        } else {
            issues.add("insufficient recommendations");
        }
        points += (int) Math.round(alignment(context.requirements(), analysisAndRecommendations(response)) * 45);

        String feedback = issues.isEmpty()
                ? "Response content meets quality standards"
                : "Content quality issues: " + String.join(", ", issues);
        return result(points >= 70, points, Severity.IMPORTANT, feedback);
    }

    static double alignment(String requirements, String responseText) {
        List<String> words = Arrays.stream(requirements.toLowerCase(Locale.ROOT).split("\\s+"))
                .filter(word -> !word.isBlank())
                .toList();
        if (words.isEmpty()) {
            return 1.0;
        }
        String text = responseText.toLowerCase(Locale.ROOT);
        long matched = words.stream().filter(text::contains).count();
        return (double) matched / words.size();
    }
}
