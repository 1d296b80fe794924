package com.bko.delegation.orchestration.service;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.error.CompletionFailedException;
import com.bko.delegation.error.ErrorCode;
import com.bko.delegation.error.IterationLimitExceededException;
import com.bko.delegation.orchestration.api.CompletionGateway;
import com.bko.delegation.orchestration.api.ToolGateway;
import com.bko.delegation.orchestration.model.CompletionReply;
import com.bko.delegation.orchestration.model.CompletionStatus;
import com.bko.delegation.orchestration.model.ConfidenceLevel;
import com.bko.delegation.orchestration.model.ConversationMessage;
import com.bko.delegation.orchestration.model.TaskSpec;
import com.bko.delegation.orchestration.model.ToolDescriptor;
import com.bko.delegation.orchestration.model.ToolRequest;
import com.bko.delegation.orchestration.model.ToolResult;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.parsing.ResilientJsonParser;
import com.bko.delegation.orchestration.parsing.WorkerResponseAssembler;
import com.bko.delegation.orchestration.roles.RoleDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentInvocationServiceImplTest {

    private static final String FINAL_ANSWER = """
            {"deliverables": {"analysis": "Session ids are not rotated after login.", "recommendations": ["Rotate ids"]},
             "memory_operations": [],
             "metadata": {"chatmode": "Security Engineer", "task_completion_status": "complete", "confidence_level": "high"}}
            """;
    private static final String INLINE_READ = "{\"tool\": \"read_file\", \"arguments\": {\"path\": \"src/Auth.java\"}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RoleDefinition role = new RoleDefinition("Security Engineer", "Finds vulnerabilities",
            "You are an application security specialist.", List.of(), 0.80, "test");
    private final TaskSpec task = new TaskSpec("Security Engineer", "Audit the login flow", "", "");

    private CompletionGateway completionGateway;
    private ToolGateway toolGateway;
    private DelegationProperties properties;
    private ExecutorService toolExecutor;
    private AgentInvocationServiceImpl service;

    @BeforeEach
    void setUp() {
        completionGateway = mock(CompletionGateway.class);
        toolGateway = mock(ToolGateway.class);
        properties = new DelegationProperties();
        toolExecutor = Executors.newCachedThreadPool();
        when(toolGateway.listSafeTools(anyString()))
                .thenReturn(List.of(new ToolDescriptor("read_file", "Read a file", null, "mcp")));
        service = new AgentInvocationServiceImpl(
                completionGateway,
                toolGateway,
                new WorkerPromptService(properties, objectMapper),
                new ToolCallExtractor(objectMapper),
                new ToolErrorAdvisor(),
                new ResilientJsonParser(objectMapper),
                new WorkerResponseAssembler(objectMapper),
                new JsonProcessingService(objectMapper),
                new OrchestrationMetricsService(),
                properties,
                toolExecutor);
    }

    @AfterEach
    void tearDown() {
        toolExecutor.shutdownNow();
    }

    @Test
    void testInvoke_DirectAnswer() {
        when(completionGateway.complete(anyList(), anyList())).thenReturn(CompletionReply.text(FINAL_ANSWER));

        WorkerResponse response = service.invoke(role, task, "session-1", null);

        assertNull(response.failure());
        assertEquals("Session ids are not rotated after login.", response.deliverables().analysis());
        assertEquals("Security Engineer", response.metadata().role());
        assertEquals(CompletionStatus.COMPLETE, response.metadata().completionStatus());
        assertTrue(response.metadata().processingTime().endsWith("ms"));
        verify(toolGateway, never()).callTool(anyString(), anyMap());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testInvoke_InlineToolRequestIsExecuted() {
        when(completionGateway.complete(anyList(), anyList()))
                .thenReturn(CompletionReply.text("Let me read it.\n" + INLINE_READ), CompletionReply.text(FINAL_ANSWER));
        when(toolGateway.callTool(eq("read_file"), anyMap())).thenReturn(ToolResult.success("class Auth {}", "mcp"));

        WorkerResponse response = service.invoke(role, task, "session-1", "agent-a");

        assertNull(response.failure());
        verify(toolGateway).callTool("read_file", Map.of("path", "src/Auth.java"));
        ArgumentCaptor<List<ConversationMessage>> history = ArgumentCaptor.forClass(List.class);
        verify(completionGateway, times(2)).complete(history.capture(), anyList());
        List<ConversationMessage> second = history.getAllValues().get(1);
        assertEquals(4, second.size());
        assertEquals(ConversationMessage.Kind.ASSISTANT, second.get(2).kind());
        ConversationMessage toolResult = second.get(3);
        assertEquals(ConversationMessage.Kind.USER, toolResult.kind());
        assertTrue(toolResult.content().startsWith("Tool \"read_file\" result:"));
        assertTrue(toolResult.content().contains("class Auth {}"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testInvoke_NativeToolCallGetsToolMessage() {
        ToolRequest call = new ToolRequest("read_file", Map.of("path", "pom.xml"), "call-1");
        when(completionGateway.complete(anyList(), anyList()))
                .thenReturn(new CompletionReply("", List.of(call)), CompletionReply.text(FINAL_ANSWER));
        when(toolGateway.callTool(eq("read_file"), anyMap())).thenReturn(ToolResult.success("<project/>", "mcp"));

        service.invoke(role, task, "session-1", null);

        ArgumentCaptor<List<ConversationMessage>> history = ArgumentCaptor.forClass(List.class);
        verify(completionGateway, times(2)).complete(history.capture(), anyList());
        ConversationMessage toolMessage = history.getAllValues().get(1).get(3);
        assertEquals(ConversationMessage.Kind.TOOL, toolMessage.kind());
        assertEquals("call-1", toolMessage.toolCallId());
        assertEquals("read_file", toolMessage.toolName());
        assertEquals("<project/>", toolMessage.content());
    }

    @Test
    void testInvoke_CircuitBreakerReturnsFailedResponse() {
        when(completionGateway.complete(anyList(), anyList()))
                .thenReturn(CompletionReply.text("{\"tool\": \"delete_everything\", \"arguments\": {}}"));

        WorkerResponse response = service.invoke(role, task, "session-1", null);

        assertNotNull(response.failure());
        assertEquals(ErrorCode.CIRCUIT_BREAKER_TRIPPED, response.failure().code());
        assertEquals(5, response.failure().counters().get("consecutiveFailures"));
        assertEquals(5, response.failure().counters().get("iterations"));
        assertEquals(CompletionStatus.FAILED, response.metadata().completionStatus());
        assertEquals(ConfidenceLevel.LOW, response.metadata().confidenceLevel());
        assertTrue(response.deliverables().analysis().startsWith("Sub-agent execution aborted:"));
        verify(completionGateway, times(5)).complete(anyList(), anyList());
        verify(toolGateway, never()).callTool(anyString(), anyMap());
    }

    @Test
    void testInvoke_SuccessfulCallResetsFailureCount() {
        CompletionReply unknown = CompletionReply.text("{\"tool\": \"nope\"}");
        CompletionReply read = CompletionReply.text(INLINE_READ);
        when(completionGateway.complete(anyList(), anyList())).thenReturn(
                unknown, unknown, unknown, unknown, read, unknown, unknown, unknown, unknown,
                CompletionReply.text(FINAL_ANSWER));
        when(toolGateway.callTool(eq("read_file"), anyMap())).thenReturn(ToolResult.success("ok", "mcp"));

        WorkerResponse response = service.invoke(role, task, "session-1", null);

        assertNull(response.failure());
        assertEquals(CompletionStatus.COMPLETE, response.metadata().completionStatus());
    }

    @Test
    void testInvoke_FailingToolTripsBreaker() {
        properties.getExecution().setCircuitBreakerThreshold(2);
        when(completionGateway.complete(anyList(), anyList())).thenReturn(CompletionReply.text(INLINE_READ));
        when(toolGateway.callTool(eq("read_file"), anyMap())).thenReturn(ToolResult.failure("EACCES", "mcp"));

        WorkerResponse response = service.invoke(role, task, "session-1", null);

        assertEquals(ErrorCode.CIRCUIT_BREAKER_TRIPPED, response.failure().code());
        assertTrue(response.failure().message().contains("EACCES"));
        verify(toolGateway, times(2)).callTool(eq("read_file"), anyMap());
    }

    @Test
    void testInvoke_IterationLimit() {
        properties.getExecution().setMaxIterations(3);
        when(completionGateway.complete(anyList(), anyList())).thenReturn(CompletionReply.text(INLINE_READ));
        when(toolGateway.callTool(eq("read_file"), anyMap())).thenReturn(ToolResult.success("ok", "mcp"));

        IterationLimitExceededException ex = assertThrows(IterationLimitExceededException.class,
                () -> service.invoke(role, task, "session-1", null));

        assertEquals(3, ex.getCounters().get("iterations"));
        assertEquals(3, ex.getCounters().get("maxIterations"));
        assertEquals("session-1", ex.getSessionId());
    }

    @Test
    void testInvoke_CompletionErrorIsWrapped() {
        when(completionGateway.complete(anyList(), anyList())).thenThrow(new IllegalStateException("connection reset"));

        CompletionFailedException ex = assertThrows(CompletionFailedException.class,
                () -> service.invoke(role, task, "session-1", null));

        assertEquals(ErrorCode.COMPLETION_FAILED, ex.getCode());
        assertTrue(ex.getMessage().contains("connection reset"));
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    void testInvoke_BlankAnswerBecomesFailedResponse() {
        when(completionGateway.complete(anyList(), anyList())).thenReturn(CompletionReply.text("  "));

        WorkerResponse response = service.invoke(role, task, "session-1", null);

        assertEquals(ErrorCode.PARSE_RECOVERY_EXHAUSTED, response.failure().code());
        assertEquals(CompletionStatus.FAILED, response.metadata().completionStatus());
    }

    @Test
    void testInvoke_SlowToolTimesOut() {
        properties.getExecution().setToolCallTimeout(java.time.Duration.ofMillis(50));
        properties.getExecution().setCircuitBreakerThreshold(1);
        when(completionGateway.complete(anyList(), anyList())).thenReturn(CompletionReply.text(INLINE_READ));
        when(toolGateway.callTool(eq("read_file"), any())).thenAnswer(invocation -> {
            Thread.sleep(2000);
            return ToolResult.success("late", "mcp");
        });

        WorkerResponse response = service.invoke(role, task, "session-1", null);

        assertEquals(ErrorCode.CIRCUIT_BREAKER_TRIPPED, response.failure().code());
        assertTrue(response.failure().message().contains("timed out"));
    }
}
