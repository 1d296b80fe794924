package com.bko.delegation.orchestration.model;

import java.util.List;

public record BatchResult(
        ParallelExecution parallelExecution,
        List<AgentResult> agentResults,
        BatchSummary summary
) {
}
