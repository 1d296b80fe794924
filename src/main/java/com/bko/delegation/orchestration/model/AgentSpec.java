package com.bko.delegation.orchestration.model;

public record AgentSpec(
        String agentId,
        String role,
        String task,
        String context,
        String expectedDeliverables
) {
}
