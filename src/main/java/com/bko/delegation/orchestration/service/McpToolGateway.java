package com.bko.delegation.orchestration.service;

import com.bko.delegation.orchestration.api.ToolGateway;
import com.bko.delegation.orchestration.model.ToolDescriptor;
import com.bko.delegation.orchestration.model.ToolResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.bko.delegation.orchestration.OrchestrationConstants.SERVER_LOCAL;
import static com.bko.delegation.orchestration.OrchestrationConstants.SERVER_MCP;
import static com.bko.delegation.orchestration.OrchestrationConstants.TOOL_NOT_FOUND;

/**
 * Tool layer backed by the registered {@link ToolCallbackProvider} beans, typically the MCP client's.
 */
@Service
@Slf4j
public class McpToolGateway implements ToolGateway {

    private final ObjectProvider<ToolCallbackProvider> toolCallbackProviders;
    private final ToolAccessPolicy toolAccessPolicy;
    private final JsonProcessingService jsonProcessingService;

    public McpToolGateway(ObjectProvider<ToolCallbackProvider> toolCallbackProviders,
                          ToolAccessPolicy toolAccessPolicy,
                          JsonProcessingService jsonProcessingService) {
        this.toolCallbackProviders = toolCallbackProviders;
        this.toolAccessPolicy = toolAccessPolicy;
        this.jsonProcessingService = jsonProcessingService;
    }

    @Override
    public List<ToolDescriptor> listSafeTools(@Nullable String role) {
        List<ToolDescriptor> descriptors = new ArrayList<>();
        safeCallbacks(role).forEach((name, entry) -> {
            ToolDefinition def = entry.callback().getToolDefinition();
            descriptors.add(new ToolDescriptor(name, nullToEmpty(def.description()), nullToEmpty(def.inputSchema()),
                    entry.serverId()));
        });
        return descriptors;
    }

    @Override
    public ToolResult callTool(String name, Map<String, Object> arguments) {
        Map<String, ServerCallback> safe = safeCallbacks(null);
        ServerCallback entry = safe.get(name);
        if (entry == null) {
            return ToolResult.failure(TOOL_NOT_FOUND + ": " + name, SERVER_LOCAL);
        }
        String input;
        try {
            input = jsonProcessingService.toCompactJson(arguments == null ? Map.of() : arguments);
        } catch (JsonProcessingException ex) {
            return ToolResult.failure("Arguments could not be serialized: " + ex.getOriginalMessage(), entry.serverId());
        }
        try {
            String output = entry.callback().call(input);
            return ToolResult.success(output == null ? "" : output, entry.serverId());
        } catch (RuntimeException ex) {
            log.warn("Tool call failed. tool={}, serverId={}, error={}", name, entry.serverId(), ex.getMessage());
            String message = StringUtils.hasText(ex.getMessage()) ? ex.getMessage() : ex.getClass().getSimpleName();
            return ToolResult.failure(message, entry.serverId());
        }
    }

    private Map<String, ServerCallback> safeCallbacks(@Nullable String role) {
        Map<String, ServerCallback> callbacks = new LinkedHashMap<>();
        toolCallbackProviders.orderedStream().forEach(provider -> {
            String serverId = provider.getClass().getName().toLowerCase(Locale.ROOT).contains("mcp") ? SERVER_MCP : SERVER_LOCAL;
            ToolCallback[] filtered = new FilteringToolCallbackProvider(provider, toolAccessPolicy, role).getToolCallbacks();
            for (ToolCallback callback : filtered) {
                String name = FilteringToolCallbackProvider.toolName(callback);
                if (!name.isEmpty()) {
                    callbacks.putIfAbsent(name, new ServerCallback(callback, serverId));
                }
            }
        });
        return callbacks;
    }

    private static String nullToEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }

    private record ServerCallback(ToolCallback callback, String serverId) {
    }
}
