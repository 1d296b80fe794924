package com.bko.delegation.orchestration.roles;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * A worker role loaded from a role file.
 *
 * @param tools            tool names the role declares an affinity for; informational only
 * @param qualityThreshold threshold override from the front matter, if any
 */
public record RoleDefinition(
        String name,
        String description,
        String instructions,
        List<String> tools,
        @Nullable Double qualityThreshold,
        String source
) {
    public RoleDefinition {
        tools = tools == null ? List.of() : List.copyOf(tools);
    }
}
