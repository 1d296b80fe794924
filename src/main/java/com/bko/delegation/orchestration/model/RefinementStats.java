package com.bko.delegation.orchestration.model;

import java.util.Map;

public record RefinementStats(
        int totalRefinements,
        Map<String, Integer> roleBreakdown,
        double averageImprovement,
        double successRate
) {
}
