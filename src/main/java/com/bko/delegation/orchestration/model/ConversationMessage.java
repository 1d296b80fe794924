package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * One entry of a worker conversation, independent of the model provider's message types.
 */
public record ConversationMessage(
        Kind kind,
        String content,
        List<ToolRequest> toolRequests,
        @Nullable String toolCallId,
        @Nullable String toolName
) {
    public enum Kind { SYSTEM, USER, ASSISTANT, TOOL }

    public ConversationMessage {
        content = content == null ? "" : content;
        toolRequests = toolRequests == null ? List.of() : List.copyOf(toolRequests);
    }

    public static ConversationMessage system(String content) {
        return new ConversationMessage(Kind.SYSTEM, content, List.of(), null, null);
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Kind.USER, content, List.of(), null, null);
    }

    public static ConversationMessage assistant(String content, List<ToolRequest> toolRequests) {
        return new ConversationMessage(Kind.ASSISTANT, content, toolRequests, null, null);
    }

    public static ConversationMessage toolResult(String callId, String toolName, String content) {
        return new ConversationMessage(Kind.TOOL, content, List.of(), callId, toolName);
    }
}
