package com.bko.delegation.orchestration.service;

import static com.bko.delegation.orchestration.OrchestrationConstants.*;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.error.CircuitBreakerTrippedException;
import com.bko.delegation.error.CompletionFailedException;
import com.bko.delegation.error.IterationLimitExceededException;
import com.bko.delegation.error.OrchestrationException;
import com.bko.delegation.error.ParseRecoveryExhaustedException;
import com.bko.delegation.error.ToolExecutionFailedException;
import com.bko.delegation.orchestration.api.AgentInvocationService;
import com.bko.delegation.orchestration.api.CompletionGateway;
import com.bko.delegation.orchestration.api.ToolGateway;
import com.bko.delegation.orchestration.model.CompletionReply;
import com.bko.delegation.orchestration.model.CompletionStatus;
import com.bko.delegation.orchestration.model.ConfidenceLevel;
import com.bko.delegation.orchestration.model.ConversationMessage;
import com.bko.delegation.orchestration.model.Deliverables;
import com.bko.delegation.orchestration.model.FailureDetail;
import com.bko.delegation.orchestration.model.ResponseMetadata;
import com.bko.delegation.orchestration.model.TaskSpec;
import com.bko.delegation.orchestration.model.ToolDescriptor;
import com.bko.delegation.orchestration.model.ToolRequest;
import com.bko.delegation.orchestration.model.ToolResult;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.parsing.ParseOutcome;
import com.bko.delegation.orchestration.parsing.ResilientJsonParser;
import com.bko.delegation.orchestration.parsing.WorkerResponseAssembler;
import com.bko.delegation.orchestration.roles.RoleDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one worker conversation: the model is asked for a turn, requested tools are executed and their results
 * appended, until the model answers without a tool request. Consecutive tool failures trip a circuit breaker and
 * the number of turns is capped.
 */
@Service
@Slf4j
public class AgentInvocationServiceImpl implements AgentInvocationService {

    private final CompletionGateway completionGateway;
    private final ToolGateway toolGateway;
    private final WorkerPromptService workerPromptService;
    private final ToolCallExtractor toolCallExtractor;
    private final ToolErrorAdvisor toolErrorAdvisor;
    private final ResilientJsonParser parser;
    private final WorkerResponseAssembler assembler;
    private final JsonProcessingService jsonProcessingService;
    private final OrchestrationMetricsService metricsService;
    private final DelegationProperties properties;
    private final ExecutorService toolExecutor;

    public AgentInvocationServiceImpl(CompletionGateway completionGateway,
                                      ToolGateway toolGateway,
                                      WorkerPromptService workerPromptService,
                                      ToolCallExtractor toolCallExtractor,
                                      ToolErrorAdvisor toolErrorAdvisor,
                                      ResilientJsonParser parser,
                                      WorkerResponseAssembler assembler,
                                      JsonProcessingService jsonProcessingService,
                                      OrchestrationMetricsService metricsService,
                                      DelegationProperties properties,
                                      @Qualifier("toolExecutor") ExecutorService toolExecutor) {
        this.completionGateway = completionGateway;
        this.toolGateway = toolGateway;
        this.workerPromptService = workerPromptService;
        this.toolCallExtractor = toolCallExtractor;
        this.toolErrorAdvisor = toolErrorAdvisor;
        this.parser = parser;
        this.assembler = assembler;
        this.jsonProcessingService = jsonProcessingService;
        this.metricsService = metricsService;
        this.properties = properties;
        this.toolExecutor = toolExecutor;
    }

    @Override
    public WorkerResponse invoke(RoleDefinition role, TaskSpec task, String sessionId, @Nullable String agentId) {
        long started = System.nanoTime();
        List<ToolDescriptor> tools = toolGateway.listSafeTools(role.name());
        String systemPrompt = workerPromptService.workerSystemPrompt(role, task, sessionId, tools);
        log.info("Worker invocation started. role={}, sessionId={}, agentId={}, tools={}",
                role.name(), sessionId, agentId, tools.size());

        WorkerCallResult result;
        try {
            result = converse(role, sessionId, systemPrompt, tools);
        } catch (CircuitBreakerTrippedException ex) {
            metricsService.recordBreakerTrip(role.name());
            return failedResponse(role, ex, elapsedMillis(started));
        }

        ParseOutcome outcome;
        try {
            outcome = parser.parse(result.output());
        } catch (ParseRecoveryExhaustedException ex) {
            log.warn("Worker returned an empty answer. role={}, sessionId={}, iterations={}",
                    role.name(), sessionId, result.iterations());
            return failedResponse(role, ex, elapsedMillis(started));
        }
        if (outcome.recovered()) {
            log.info("Worker output needed recovery. role={}, sessionId={}, fixes={}",
                    role.name(), sessionId, outcome.fixesApplied());
        }
        WorkerResponse response = assembler.assemble(outcome, role.name());
        long elapsed = elapsedMillis(started);
        ResponseMetadata metadata = response.metadata();
        log.info("Worker invocation finished. role={}, sessionId={}, iterations={}, toolCalls={}, toolFailures={}, "
                        + "status={}, elapsedMs={}",
                role.name(), sessionId, result.iterations(), result.toolCallCount(), result.toolFailureCount(),
                metadata.completionStatus().wireValue(), elapsed);
        return response.withMetadata(new ResponseMetadata(role.name(), metadata.completionStatus(),
                metadata.confidenceLevel(), elapsed + "ms"));
    }

    WorkerCallResult converse(RoleDefinition role, String sessionId, String systemPrompt, List<ToolDescriptor> tools) {
        ToolCallAudit audit = new ToolCallAudit(role.name(), sessionId);
        Set<String> offered = new LinkedHashSet<>();
        tools.forEach(tool -> offered.add(tool.name()));

        List<ConversationMessage> history = new ArrayList<>();
        history.add(ConversationMessage.system(systemPrompt));
        history.add(ConversationMessage.user(WORKER_KICKOFF_MESSAGE));

        int maxIterations = properties.getExecution().getMaxIterations();
        int threshold = properties.getExecution().getCircuitBreakerThreshold();
        int consecutiveFailures = 0;
        for (int iteration = 1; iteration <= maxIterations; iteration++) {
            metricsService.recordCompletionRequest(PURPOSE_WORKER_TURN, role.name());
            CompletionReply reply = complete(history, tools, sessionId, iteration, consecutiveFailures);
            List<ToolRequest> requests = reply.hasToolCalls()
                    ? reply.toolCalls()
                    : toolCallExtractor.extract(reply.content()).map(List::of).orElse(List.of());
            if (requests.isEmpty()) {
                return new WorkerCallResult(reply.content(), audit, iteration);
            }

            history.add(ConversationMessage.assistant(reply.content(), requests));
            List<ToolResult> results = executeAll(requests, offered, audit);
            for (int i = 0; i < requests.size(); i++) {
                ToolRequest request = requests.get(i);
                ToolResult result = results.get(i);
                if (result.success()) {
                    consecutiveFailures = 0;
                    history.add(resultMessage(request, result.content() == null ? "" : result.content()));
                    continue;
                }
                consecutiveFailures++;
                ToolExecutionFailedException failure = new ToolExecutionFailedException(
                        request.tool(), request.arguments(), result.error(), sessionId, null);
                log.warn("Tool call failed. role={}, sessionId={}, tool={}, consecutiveFailures={}, error={}",
                        role.name(), sessionId, request.tool(), consecutiveFailures, result.error());
                history.add(resultMessage(request, toolErrorAdvisor.advise(request.tool(), result.error(), offered)));
                if (consecutiveFailures >= threshold) {
                    throw new CircuitBreakerTrippedException(
                            "Circuit breaker tripped after " + consecutiveFailures
                                    + " consecutive tool failures; last failure: " + failure.getMessage(),
                            sessionId,
                            counters(iteration, maxIterations, consecutiveFailures, threshold),
                            "Check that the tool servers are reachable and that the task can be done with the listed tools.",
                            failure);
                }
            }
        }
        throw new IterationLimitExceededException(
                "Worker did not produce a final answer within " + maxIterations + " iterations",
                sessionId,
                counters(maxIterations, maxIterations, consecutiveFailures, threshold),
                "Simplify or split the task, or increase delegation.execution.max-iterations.");
    }

    private CompletionReply complete(List<ConversationMessage> history, List<ToolDescriptor> tools, String sessionId,
                                     int iteration, int consecutiveFailures) {
        try {
            return completionGateway.complete(List.copyOf(history), tools);
        } catch (OrchestrationException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            Map<String, Object> counters = new LinkedHashMap<>();
            counters.put("iteration", iteration);
            counters.put("consecutiveFailures", consecutiveFailures);
            throw new CompletionFailedException("Completion request failed: " + ex.getMessage(), sessionId, counters, ex);
        }
    }

    private List<ToolResult> executeAll(List<ToolRequest> requests, Set<String> offered, ToolCallAudit audit) {
        Duration timeout = properties.getExecution().getToolCallTimeout();
        List<CompletableFuture<ToolResult>> futures = new ArrayList<>(requests.size());
        for (ToolRequest request : requests) {
            futures.add(CompletableFuture.supplyAsync(() -> callTool(request, offered), toolExecutor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> ToolResult.failure(describe(ex, timeout), SERVER_LOCAL)));
        }
        List<ToolResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ToolRequest request = requests.get(i);
            ToolResult result = futures.get(i).join();
            audit.recordCall(request.tool(), jsonProcessingService.toJson(request.arguments()),
                    result.success() ? result.content() : result.error(), result.success());
            metricsService.recordToolCall(request.tool(), result.success());
            results.add(result);
        }
        return results;
    }

    private ToolResult callTool(ToolRequest request, Set<String> offered) {
        if (!offered.contains(request.tool())) {
            return ToolResult.failure(TOOL_NOT_FOUND + ": " + request.tool(), SERVER_LOCAL);
        }
        return toolGateway.callTool(request.tool(), request.arguments());
    }

    private static ConversationMessage resultMessage(ToolRequest request, String content) {
        if (request.isNative()) {
            return ConversationMessage.toolResult(request.callId(), request.tool(), content);
        }
        return ConversationMessage.user(String.format(TOOL_RESULT_MESSAGE, request.tool(), content));
    }

    private static String describe(Throwable ex, Duration timeout) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return "Tool call timed out after " + timeout.toSeconds() + "s";
        }
        return StringUtils.hasText(cause.getMessage()) ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private WorkerResponse failedResponse(RoleDefinition role, OrchestrationException ex, long elapsedMillis) {
        Deliverables deliverables = new Deliverables(
                "Sub-agent execution aborted: " + ex.getMessage(),
                List.of(ex.getRemediation()),
                List.of(),
                null,
                Map.of());
        ResponseMetadata metadata = new ResponseMetadata(role.name(), CompletionStatus.FAILED, ConfidenceLevel.LOW,
                elapsedMillis + "ms");
        return new WorkerResponse(deliverables, List.of(), metadata, null, FailureDetail.from(ex), List.of());
    }

    private static Map<String, Object> counters(int iterations, int maxIterations, int consecutiveFailures, int threshold) {
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("iterations", iterations);
        counters.put("maxIterations", maxIterations);
        counters.put("consecutiveFailures", consecutiveFailures);
        counters.put("circuitBreakerThreshold", threshold);
        return counters;
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
