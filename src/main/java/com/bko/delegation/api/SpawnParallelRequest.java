package com.bko.delegation.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record SpawnParallelRequest(
        @NotNull @Size(min = 1, max = 5) List<@Valid ParallelAgentRequest> agents,
        String coordinationContext
) {
}
