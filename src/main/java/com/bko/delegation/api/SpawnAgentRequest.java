package com.bko.delegation.api;

import jakarta.validation.constraints.NotBlank;

public record SpawnAgentRequest(
        @NotBlank String role,
        @NotBlank String task,
        String context,
        String expectedDeliverables,
        String parentSessionId
) {
}
