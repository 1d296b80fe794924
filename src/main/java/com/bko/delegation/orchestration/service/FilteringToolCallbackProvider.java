package com.bko.delegation.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A ToolCallbackProvider wrapper that only exposes the delegate's callbacks the access policy permits for a role.
 */
@Slf4j
public class FilteringToolCallbackProvider implements ToolCallbackProvider {

    private final ToolCallbackProvider delegate;
    private final ToolAccessPolicy policy;
    private final String role;

    public FilteringToolCallbackProvider(ToolCallbackProvider delegate, ToolAccessPolicy policy, @Nullable String role) {
        this.delegate = delegate;
        this.policy = policy;
        this.role = role;
    }

    @Override
    public ToolCallback[] getToolCallbacks() {
        if (delegate == null) return new ToolCallback[0];
        ToolCallback[] callbacks = delegate.getToolCallbacks();
        if (callbacks == null || callbacks.length == 0) return new ToolCallback[0];
        ToolCallback[] filtered = Arrays.stream(callbacks)
                .filter(cb -> policy.permits(toolName(cb), role))
                .toArray(ToolCallback[]::new);
        if (filtered.length < callbacks.length && log.isDebugEnabled()) {
            log.debug("Tool filtering removed callbacks. role={}, kept={}, available={}",
                    role, describeCallbacks(filtered), describeCallbacks(callbacks));
        }
        return filtered;
    }

    static String toolName(@Nullable ToolCallback cb) {
        if (cb == null) return "";
        ToolDefinition def = cb.getToolDefinition();
        if (def == null || !StringUtils.hasText(def.name())) return "";
        return def.name().trim();
    }

    private static List<String> describeCallbacks(ToolCallback[] callbacks) {
        List<String> names = new ArrayList<>();
        for (ToolCallback cb : callbacks) {
            String name = toolName(cb);
            if (!name.isBlank()) names.add(name);
        }
        return names;
    }
}
