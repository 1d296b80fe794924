package com.bko.delegation.orchestration.quality.rules;

import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.Severity;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.parsing.WorkerResponseAssembler;
import com.bko.delegation.orchestration.quality.ValidationContext;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rewards the sections the worker actually produced. Sections filled in during normalization do not count.
 */
@Component
@Order(1)
public class FormatComplianceRule extends AbstractQualityRule {

    public FormatComplianceRule() {
        super("format_compliance", "format", 0.2);
    }

    @Override
    public RuleResult evaluate(WorkerResponse response, ValidationContext context) {
        int points = (response.isDefaulted(WorkerResponseAssembler.FIELD_DELIVERABLES) ? 0 : 40)
                + (response.isDefaulted(WorkerResponseAssembler.FIELD_MEMORY_OPERATIONS) ? 0 : 30)
                + (response.isDefaulted(WorkerResponseAssembler.FIELD_METADATA) ? 0 : 30);
        boolean passed = points >= 80;
        return result(passed, points, points < 50 ? Severity.CRITICAL : Severity.IMPORTANT,
                passed ? "Response format is valid" : "Response structure is incomplete - missing required sections");
    }
}
