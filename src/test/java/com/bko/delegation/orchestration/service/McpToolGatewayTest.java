package com.bko.delegation.orchestration.service;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.orchestration.model.ToolDescriptor;
import com.bko.delegation.orchestration.model.ToolResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class McpToolGatewayTest {

    private ToolCallback readFile;
    private ToolCallback spawnAgent;
    private ToolCallback shadowedReadFile;
    private McpToolGateway gateway;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        readFile = callback("read_file", "Read a file");
        spawnAgent = callback("spawn_agent", "Delegate work");
        shadowedReadFile = callback("read_file", "Second server copy");
        ToolCallbackProvider first = () -> new ToolCallback[]{readFile, spawnAgent};
        ToolCallback gitStatus = callback("git_status", null);
        ToolCallbackProvider second = () -> new ToolCallback[]{shadowedReadFile, gitStatus};
        ObjectProvider<ToolCallbackProvider> providers = mock(ObjectProvider.class);
        when(providers.orderedStream()).thenAnswer(invocation -> Stream.of(first, second));

        DelegationProperties properties = new DelegationProperties();
        properties.getTools().setWorkers(Map.of("Technical Writer", List.of("read_file")));
        gateway = new McpToolGateway(providers, new ToolAccessPolicy(properties),
                new JsonProcessingService(new ObjectMapper()));
    }

    @Test
    void testListSafeTools_HidesEngineOperationsAndDuplicates() {
        List<ToolDescriptor> tools = gateway.listSafeTools("Software Engineer");

        assertEquals(List.of("read_file", "git_status"), tools.stream().map(ToolDescriptor::name).toList());
        assertEquals("Read a file", tools.get(0).description());
        assertEquals("", tools.get(1).description());
    }

    @Test
    void testListSafeTools_RoleAllowList() {
        List<ToolDescriptor> tools = gateway.listSafeTools("Technical Writer");

        assertEquals(1, tools.size());
        assertEquals("read_file", tools.get(0).name());
    }

    @Test
    void testCallTool_PassesCompactArguments() {
        when(readFile.call("{\"path\":\"README.md\"}")).thenReturn("# Title");

        ToolResult result = gateway.callTool("read_file", Map.of("path", "README.md"));

        assertTrue(result.success());
        assertEquals("# Title", result.content());
        verify(shadowedReadFile, never()).call(anyString());
    }

    @Test
    void testCallTool_UnknownOrDeniedTool() {
        ToolResult unknown = gateway.callTool("format_disk", Map.of());
        ToolResult denied = gateway.callTool("spawn_agent", Map.of());

        assertFalse(unknown.success());
        assertEquals("Tool not found: format_disk", unknown.error());
        assertEquals("Tool not found: spawn_agent", denied.error());
        verify(spawnAgent, never()).call(anyString());
    }

    @Test
    void testCallTool_CallbackFailureBecomesResult() {
        when(readFile.call(anyString())).thenThrow(new IllegalStateException("server disconnected"));

        ToolResult result = gateway.callTool("read_file", Map.of());

        assertFalse(result.success());
        assertEquals("server disconnected", result.error());
    }

    private static ToolCallback callback(String name, String description) {
        ToolDefinition definition = mock(ToolDefinition.class);
        when(definition.name()).thenReturn(name);
        when(definition.description()).thenReturn(description);
        when(definition.inputSchema()).thenReturn("{}");
        ToolCallback callback = mock(ToolCallback.class);
        when(callback.getToolDefinition()).thenReturn(definition);
        return callback;
    }
}
