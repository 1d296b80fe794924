package com.bko.delegation.orchestration.model;

import java.util.List;

public record BatchSummary(
        boolean allSuccessful,
        boolean partialSuccess,
        boolean totalFailure,
        String fastestAgentId,
        String slowestAgentId,
        long minExecutionTimeMs,
        long maxExecutionTimeMs,
        long averageExecutionTimeMs
) {
    public static BatchSummary of(List<AgentResult> results) {
        if (results.isEmpty()) {
            return new BatchSummary(false, false, true, "", "", 0, 0, 0);
        }
        long succeeded = results.stream().filter(r -> r.status() == AgentStatus.SUCCESS).count();
        long failed = results.size() - succeeded;
        AgentResult fastest = results.get(0);
        AgentResult slowest = results.get(0);
        long total = 0;
        for (AgentResult result : results) {
            if (result.executionTimeMs() < fastest.executionTimeMs()) {
                fastest = result;
            }
            if (result.executionTimeMs() > slowest.executionTimeMs()) {
                slowest = result;
            }
            total += result.executionTimeMs();
        }
        return new BatchSummary(
                failed == 0,
                succeeded > 0 && failed > 0,
                succeeded == 0,
                fastest.agentId(),
                slowest.agentId(),
                fastest.executionTimeMs(),
                slowest.executionTimeMs(),
                Math.round((double) total / results.size()));
    }
}
