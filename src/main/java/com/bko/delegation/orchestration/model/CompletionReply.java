package com.bko.delegation.orchestration.model;

import java.util.List;

public record CompletionReply(String content, List<ToolRequest> toolCalls) {

    public CompletionReply {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static CompletionReply text(String content) {
        return new CompletionReply(content, List.of());
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
