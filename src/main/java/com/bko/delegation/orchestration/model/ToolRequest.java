package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * A tool invocation requested by a worker, from either a native tool call or an inline JSON request.
 */
public record ToolRequest(String tool, Map<String, Object> arguments, @Nullable String callId) {

    public ToolRequest {
        arguments = arguments == null ? Map.of() : arguments;
    }

    public boolean isNative() {
        return callId != null;
    }
}
