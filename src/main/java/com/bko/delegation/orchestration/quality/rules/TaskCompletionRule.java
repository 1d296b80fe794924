package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.ResponseMetadata;
import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.quality.ValidationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
@Order(4)
public class TaskCompletionRule extends AbstractQualityRule {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*(\\d+)");
    private static final long MAX_REASONABLE_MILLIS = 300_000;

    public TaskCompletionRule() {
        super("task_completion_assessment", "completion", 0.2);
    }

    @Override
    public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
        ResponseMetadata metadata = response.metadata();
        int points = switch (metadata.completionStatus()) {
            case COMPLETE -> 50;
            case PARTIAL -> 30;
            case FAILED -> 0;
        };
        points += switch (metadata.confidenceLevel()) {
            case HIGH -> 30;
            case MEDIUM -> 20;
            case LOW -> 10;
        };
        long millis = processingMillis(metadata.processingTime());
        if (millis > 0 && millis < MAX_REASONABLE_MILLIS) {
            points += 20;
        }
        boolean passed = points >= 70;
        return result(passed, points, points < 40 ? Severity.IMPORTANT : Severity.MINOR,
                passed ? "Task completion indicators are satisfactory"
                        : "Task completion assessment indicates potential issues");
    }

    static long processingMillis(String processingTime) {
        if (processingTime == null) {
            return 0;
        }
        Matcher matcher = LEADING_NUMBER.matcher(processingTime);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Long.parseLong(matcher.group(1));
        } catch (NumberFormatException ex) {
            return 0;
        }
    }
}
