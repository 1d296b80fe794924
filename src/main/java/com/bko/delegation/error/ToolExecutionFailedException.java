package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

public class ToolExecutionFailedException extends OrchestrationException {

    private final String toolName;
    private final Map<String, Object> arguments;

    public ToolExecutionFailedException(String toolName,
                                        Map<String, Object> arguments,
                                        String message,
                                        @Nullable String sessionId,
                                        @Nullable Throwable cause) {
        super(ErrorCode.TOOL_EXECUTION_FAILED,
                "Tool \"" + toolName + "\" failed: " + message,
                sessionId,
                Map.of("tool", toolName),
                "Verify the tool name and arguments against the available tool list.",
                cause);
        this.toolName = toolName;
        this.arguments = arguments == null ? Map.of() : new LinkedHashMap<>(arguments);
    }

    public String getToolName() {
        return toolName;
    }

    public Map<String, Object> getArguments() {
        return arguments;
    }
}
