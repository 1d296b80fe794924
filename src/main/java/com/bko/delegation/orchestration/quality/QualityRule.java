package com.bko.delegation.orchestration.quality;

import com.bko.delegation.orchestration.model.RuleResult;
import com.bko.delegation.orchestration.model.WorkerResponse;

import java.util.Set;

/**
 * One scoring rule. Implementations compute points out of 100; the validator normalizes them.
 */
public interface QualityRule {

    String name();

    String category();

    double weight();

    RuleResult evaluate(WorkerResponse response, ValidationContext context);

    /**
     * Rules that only make sense for roles producing code-level analysis.
     */
    default boolean technicalOnly() {
        return false;
    }

    /**
     * Lower-case role names the rule never applies to.
     */
    default Set<String> excludedRoles() {
        return Set.of();
    }
}
