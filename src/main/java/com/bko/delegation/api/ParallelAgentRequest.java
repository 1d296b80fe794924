package com.bko.delegation.api;

import com.bko.delegation.orchestration.model.AgentSpec;
import jakarta.validation.constraints.NotBlank;

public record ParallelAgentRequest(
        @NotBlank String agentId,
        @NotBlank String role,
        @NotBlank String task,
        String context,
        String expectedDeliverables
) {
    public AgentSpec toSpec() {
        return new AgentSpec(agentId, role, task, context, expectedDeliverables);
    }
}
