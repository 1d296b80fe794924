package com.bko.delegation.orchestration.model;

public record TaskSpec(
        String role,
        String task,
        String context,
        String expectedDeliverables
) {
}
