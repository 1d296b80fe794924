package com.bko.delegation.orchestration.service;

import com.bko.delegation.orchestration.model.ToolDescriptor;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Advertises a tool to the model without making it executable by the framework.
 * Tool execution stays with the delegation engine's conversation loop.
 */
final class DescriptorToolCallback implements ToolCallback {

    private final ToolDefinition definition;

    DescriptorToolCallback(ToolDescriptor descriptor) {
        this.definition = ToolDefinition.builder()
                .name(descriptor.name())
                .description(descriptor.description().isBlank() ? descriptor.name() : descriptor.description())
                .inputSchema(descriptor.inputSchema().isBlank() ? "{\"type\":\"object\",\"properties\":{}}" : descriptor.inputSchema())
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        throw new UnsupportedOperationException("Tool " + definition.name() + " is executed by the delegation engine");
    }
}
