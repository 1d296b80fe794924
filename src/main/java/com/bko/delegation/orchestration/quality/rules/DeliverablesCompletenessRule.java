package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.Deliverables;
import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.parsing.WorkerResponseAssembler;
import com.bko.delegation.orchestration.quality.ValidationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@Order(2)
public class DeliverablesCompletenessRule extends AbstractQualityRule {

    public DeliverablesCompletenessRule() {
        super("deliverables_completeness", "completeness", 0.25);
    }

    @Override
    public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
        Deliverables deliverables = response.deliverables();
        int points = 0;
        List<String> issues = new ArrayList<>();

        if (!response.isDefaulted(WorkerResponseAssembler.FIELD_ANALYSIS) && deliverables.analysis().length() > 100) {
            points += 40;
        } else {
            issues.add("analysis is missing or too brief");
        }
        if (!deliverables.recommendations().isEmpty()) {
            points += 30;
        } else {
            issues.add("recommendations are missing");
        }
        if (!deliverables.documents().isEmpty()) {
            points += 30;
        } else if (context.expects("documents")) {
            issues.add("expected documents are missing");
        } else {
            points += 30;
        }

        String feedback = issues.isEmpty()
                ? "All required deliverables are present"
                : "Deliverables incomplete: " + String.join(", ", issues);
        return result(points >= 70, points, points < 40 ? Severity.CRITICAL : Severity.IMPORTANT, feedback);
    }
}
