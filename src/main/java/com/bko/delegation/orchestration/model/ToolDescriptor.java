package com.bko.delegation.orchestration.model;

/**
 * @param inputSchema JSON schema of the tool arguments, as text
 */
public record ToolDescriptor(String name, String description, String inputSchema, String serverId) {
}
