package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

public record ToolResult(boolean success, @Nullable String content, @Nullable String error, String serverId) {

    public static ToolResult success(String content, String serverId) {
        return new ToolResult(true, content, null, serverId);
    }

    public static ToolResult failure(String error, String serverId) {
        return new ToolResult(false, null, error, serverId);
    }
}
