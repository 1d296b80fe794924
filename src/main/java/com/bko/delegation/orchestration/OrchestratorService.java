package com.bko.delegation.orchestration;

import static com.bko.delegation.orchestration.OrchestrationConstants.*;

import com.bko.delegation.config.DelegationProperties;
import com.bko.delegation.error.DuplicateAgentIdException;
import com.bko.delegation.error.OrchestrationException;
import com.bko.delegation.error.ParallelQuotaExceededException;
import com.bko.delegation.logging.DelegationMdc;
import com.bko.delegation.orchestration.api.AgentInvocationService;
import com.bko.delegation.orchestration.model.AgentResult;
import com.bko.delegation.orchestration.model.AgentSpec;
import com.bko.delegation.orchestration.model.AgentStatus;
import com.bko.delegation.orchestration.model.BatchResult;
import com.bko.delegation.orchestration.model.BatchSummary;
import com.bko.delegation.orchestration.model.FormatValidation;
import com.bko.delegation.orchestration.model.GlobalStats;
import com.bko.delegation.orchestration.model.LegacyQuality;
import com.bko.delegation.orchestration.model.ParallelExecution;
import com.bko.delegation.orchestration.model.QualityAssessment;
import com.bko.delegation.orchestration.model.RefinementDecision;
import com.bko.delegation.orchestration.model.RefinementState;
import com.bko.delegation.orchestration.model.RefinementStats;
import com.bko.delegation.orchestration.model.SessionStats;
import com.bko.delegation.orchestration.model.TaskSpec;
import com.bko.delegation.orchestration.model.ValidationMetadata;
import com.bko.delegation.orchestration.model.ValidationResult;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.parsing.ParseOutcome;
import com.bko.delegation.orchestration.parsing.ResilientJsonParser;
import com.bko.delegation.orchestration.parsing.WorkerResponseAssembler;
import com.bko.delegation.orchestration.quality.QualityValidator;
import com.bko.delegation.orchestration.quality.RefinementManager;
import com.bko.delegation.orchestration.quality.ValidationContext;
import com.bko.delegation.orchestration.roles.RoleDefinition;
import com.bko.delegation.orchestration.roles.RoleRegistry;
import com.bko.delegation.orchestration.roles.RoleSummary;
import com.bko.delegation.orchestration.service.OrchestrationMetricsService;
import com.bko.delegation.orchestration.service.TaskSpecificationValidator;
import com.bko.delegation.orchestration.session.SessionLedger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry points of the delegation engine: spawn one worker, spawn a batch in parallel, validate a worker's output
 * and read session statistics.
 */
@Service
@Slf4j
public class OrchestratorService {

    private final SessionLedger sessionLedger;
    private final RoleRegistry roleRegistry;
    private final AgentInvocationService agentInvocationService;
    private final TaskSpecificationValidator taskSpecificationValidator;
    private final ResilientJsonParser parser;
    private final WorkerResponseAssembler assembler;
    private final QualityValidator qualityValidator;
    private final RefinementManager refinementManager;
    private final OrchestrationMetricsService metricsService;
    private final DelegationProperties properties;
    private final ExecutorService workerExecutor;

    public OrchestratorService(SessionLedger sessionLedger,
                               RoleRegistry roleRegistry,
                               AgentInvocationService agentInvocationService,
                               TaskSpecificationValidator taskSpecificationValidator,
                               ResilientJsonParser parser,
                               WorkerResponseAssembler assembler,
                               QualityValidator qualityValidator,
                               RefinementManager refinementManager,
                               OrchestrationMetricsService metricsService,
                               DelegationProperties properties,
                               @Qualifier("workerExecutor") ExecutorService workerExecutor) {
        this.sessionLedger = sessionLedger;
        this.roleRegistry = roleRegistry;
        this.agentInvocationService = agentInvocationService;
        this.taskSpecificationValidator = taskSpecificationValidator;
        this.parser = parser;
        this.assembler = assembler;
        this.qualityValidator = qualityValidator;
        this.refinementManager = refinementManager;
        this.metricsService = metricsService;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
    }

    /**
     * Delegates one task to a worker of the given role.
     * <p>
     * Without a parent the call opens a fresh root session. With a parent, a child session one level deeper is
     * opened and the call is accounted to the parent as well, so repeated identical delegations from the same
     * parent are caught by loop detection.
     */
    public WorkerResponse spawnAgent(String role,
                                     String task,
                                     @Nullable String context,
                                     @Nullable String expectedDeliverables,
                                     @Nullable String parentSessionId) {
        taskSpecificationValidator.validate(task, context, parentSessionId);
        if (parentSessionId != null) {
            sessionLedger.checkCanSpawn(parentSessionId);
        }
        String sessionId = sessionLedger.createSession(parentSessionId != null, parentSessionId);
        String spawner = parentSessionId != null ? parentSessionId : sessionId;
        if (parentSessionId == null) {
            sessionLedger.checkCanSpawn(sessionId);
        }
        reserveOrThrow(1, spawner);
        try {
            RoleDefinition definition = roleRegistry.getRole(role);
            TaskSpec spec = new TaskSpec(definition.name(), task, context, expectedDeliverables);
            String fingerprint = sessionLedger.generateTaskHash(task, nullToEmpty(context), definition.name());
            sessionLedger.trackAgentCall(spawner, definition.name(), fingerprint, false);
            if (!spawner.equals(sessionId)) {
                sessionLedger.trackAgentCall(sessionId, definition.name(), fingerprint, false);
            }
            metricsService.recordSpawn(definition.name(), 1);
            DelegationMdc.setWorker(sessionId, definition.name(), null);
            return agentInvocationService.invoke(definition, spec, sessionId, null);
        } finally {
            DelegationMdc.clear();
            sessionLedger.releaseCapacity(1);
        }
    }

    /**
     * Runs up to {@code delegation.session.max-parallel-agents} workers concurrently under one coordinator session.
     * A failing member never fails the batch; it is reported with its own status.
     */
    public BatchResult spawnAgentsParallel(List<AgentSpec> agents, @Nullable String coordinationContext) {
        long started = System.nanoTime();
        int count = agents == null ? 0 : agents.size();
        if (!sessionLedger.canSpawnParallelAgents(count)) {
            GlobalStats global = sessionLedger.getGlobalStats();
            Map<String, Object> counters = new LinkedHashMap<>();
            counters.put("requestedAgents", count);
            counters.put("maxParallelAgents", properties.getSession().getMaxParallelAgents());
            counters.put("agentsInFlight", global.agentsInFlight());
            counters.put("maxConcurrentAgents", properties.getSession().getMaxConcurrentAgents());
            throw new ParallelQuotaExceededException(
                    "Cannot spawn " + count + " parallel agents", null, counters,
                    "Request between 1 and " + properties.getSession().getMaxParallelAgents()
                            + " agents, or wait for running workers to finish.");
        }
        List<String> duplicates = duplicateIds(agents);
        if (!duplicates.isEmpty()) {
            throw new DuplicateAgentIdException(
                    "Agent ids must be unique within a batch; duplicated: " + String.join(", ", duplicates),
                    null, Map.of("duplicates", duplicates.size()),
                    "Give every agent in the batch its own agentId.");
        }
        reserveOrThrow(count, null);
        String coordinatorId = sessionLedger.createSession(false, null);
        metricsService.recordSpawn("batch", count);
        log.info("Parallel batch started. coordinatorSessionId={}, agents={}", coordinatorId, count);

        Duration timeout = properties.getExecution().getWorkerTimeout();
        List<CompletableFuture<AgentResult>> futures = new ArrayList<>(count);
        for (AgentSpec spec : agents) {
            futures.add(submitMember(spec, coordinatorId, timeout));
        }
        List<AgentResult> results = futures.stream().map(CompletableFuture::join).toList();

        long totalMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        int succeeded = (int) results.stream().filter(r -> r.status() == AgentStatus.SUCCESS).count();
        ParallelExecution execution = new ParallelExecution(coordinatorId, count, succeeded, count - succeeded,
                totalMillis, coordinationContext, Instant.now());
        log.info("Parallel batch finished. coordinatorSessionId={}, successful={}, failed={}, elapsedMs={}",
                coordinatorId, succeeded, count - succeeded, totalMillis);
        return new BatchResult(execution, results, BatchSummary.of(results));
    }

    private CompletableFuture<AgentResult> submitMember(AgentSpec spec, String coordinatorId, Duration timeout) {
        try {
            return CompletableFuture.supplyAsync(() -> runMember(spec, coordinatorId), workerExecutor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> timedOutOrCrashed(spec, ex, timeout));
        } catch (RejectedExecutionException ex) {
            sessionLedger.releaseCapacity(1);
            log.warn("Worker pool rejected batch member. agentId={}, coordinatorSessionId={}", spec.agentId(), coordinatorId);
            return CompletableFuture.completedFuture(new AgentResult(spec.agentId(), spec.role(), AgentStatus.FAILED,
                    0, null, null, "Worker pool rejected the task: " + ex.getMessage(), null));
        }
    }

    private AgentResult runMember(AgentSpec spec, String coordinatorId) {
        long started = System.nanoTime();
        String memberSessionId = null;
        String roleName = spec.role();
        try {
            taskSpecificationValidator.validate(spec.task(), spec.context(), coordinatorId);
            memberSessionId = sessionLedger.createSession(true, coordinatorId);
            RoleDefinition definition = roleRegistry.getRole(spec.role());
            roleName = definition.name();
            String fingerprint = sessionLedger.generateTaskHash(spec.task(), nullToEmpty(spec.context()), roleName);
            sessionLedger.trackAgentCall(coordinatorId, roleName, fingerprint, false);
            sessionLedger.trackAgentCall(memberSessionId, roleName, fingerprint, false);
            DelegationMdc.setWorker(memberSessionId, roleName, spec.agentId());
            WorkerResponse response = agentInvocationService.invoke(definition,
                    new TaskSpec(roleName, spec.task(), spec.context(), spec.expectedDeliverables()),
                    memberSessionId, spec.agentId());
            long elapsed = elapsedMillis(started);
            if (response.failure() != null) {
                return new AgentResult(spec.agentId(), roleName, AgentStatus.FAILED, elapsed, memberSessionId, response,
                        response.failure().message(), response.failure().code());
            }
            return new AgentResult(spec.agentId(), roleName, AgentStatus.SUCCESS, elapsed, memberSessionId, response,
                    null, null);
        } catch (OrchestrationException ex) {
            log.warn("Batch member failed. agentId={}, role={}, code={}, message={}",
                    spec.agentId(), roleName, ex.getCode(), ex.getMessage());
            return new AgentResult(spec.agentId(), roleName, AgentStatus.FAILED, elapsedMillis(started),
                    memberSessionId, null, ex.getMessage(), ex.getCode());
        } catch (RuntimeException ex) {
            log.error("Batch member crashed. agentId={}, role={}", spec.agentId(), roleName, ex);
            return new AgentResult(spec.agentId(), roleName, AgentStatus.FAILED, elapsedMillis(started),
                    memberSessionId, null, ex.getMessage(), null);
        } finally {
            DelegationMdc.clear();
            sessionLedger.releaseCapacity(1);
        }
    }

    private AgentResult timedOutOrCrashed(AgentSpec spec, Throwable ex, Duration timeout) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            log.warn("Batch member timed out. agentId={}, role={}, timeout={}", spec.agentId(), spec.role(), timeout);
            return new AgentResult(spec.agentId(), spec.role(), AgentStatus.FAILED, timeout.toMillis(), null, null,
                    "Agent timed out after " + timeout.toSeconds() + "s", null);
        }
        log.error("Batch member failed unexpectedly. agentId={}, role={}", spec.agentId(), spec.role(), cause);
        return new AgentResult(spec.agentId(), spec.role(), AgentStatus.FAILED, 0, null, null, cause.getMessage(), null);
    }

    /**
     * Parses raw worker output, scores it and, when refinement is enabled and the session allows it, issues a
     * refinement instruction and records the attempt.
     */
    public ValidationResult validateOutput(String rawResponse,
                                           String requirements,
                                           String qualityCriteria,
                                           @Nullable String role,
                                           @Nullable String sessionId,
                                           boolean enableRefinement) {
        long started = System.nanoTime();
        String effectiveRole = StringUtils.hasText(role) ? role.trim() : DEFAULT_ROLE;
        ParseOutcome outcome = parser.parse(rawResponse);
        WorkerResponse response = assembler.assemble(outcome, StringUtils.hasText(role) ? effectiveRole : null);
        List<String> issues = assembler.validateStructure(outcome.structure());
        if (!issues.isEmpty()) {
            log.warn("Worker response structure issues. role={}, sessionId={}, issues={}", effectiveRole, sessionId, issues);
        }

        ValidationContext context = new ValidationContext(effectiveRole, requirements, qualityCriteria, null);
        QualityAssessment assessment = qualityValidator.validate(response, context);
        FormatValidation format = new FormatValidation(
                issues.isEmpty(),
                !outcome.fallback() && outcome.structure().path("deliverables").isObject(),
                response.memoryOperations().size(),
                assembler.metadataComplete(outcome),
                issues,
                outcome.fixesApplied());

        RefinementDecision refinement = enableRefinement
                ? refinementDecision(assessment, context, sessionId, requirements, rawResponse)
                : null;
        metricsService.recordValidation(effectiveRole, assessment.overallScore(), assessment.passed());
        ValidationMetadata metadata = new ValidationMetadata(
                elapsedMillis(started),
                effectiveRole,
                sessionId,
                VALIDATOR_VERSION,
                qualityValidator.applicableRules(effectiveRole).size());
        return new ValidationResult(assessment, format, LegacyQuality.from(assessment), refinement, metadata);
    }

    private RefinementDecision refinementDecision(QualityAssessment assessment,
                                                  ValidationContext context,
                                                  @Nullable String sessionId,
                                                  String originalTask,
                                                  String priorResponse) {
        int max = refinementManager.maxAttempts();
        if (!StringUtils.hasText(sessionId)) {
            return RefinementDecision.notNeeded("No session supplied; refinement is tracked per session", 0, max);
        }
        if (!sessionLedger.hasSession(sessionId)) {
            return RefinementDecision.notNeeded("Unknown or expired session: " + sessionId, 0, max);
        }
        int attempts = sessionLedger.getRefinementCount(sessionId, context.role());
        if (assessment.passed()) {
            return RefinementDecision.notNeeded(NO_REFINEMENT_NEEDED, attempts, max);
        }
        if (!refinementManager.needsRefinement(assessment, context, sessionId)) {
            Optional<RefinementState> state = sessionLedger.getRefinementState(sessionId, context.role());
            String reason;
            if (!assessment.canRefine()) {
                reason = "Response is not refinable; regenerate it from scratch";
            } else if (attempts >= max) {
                reason = "Maximum refinement attempts reached";
            } else {
                reason = "Refinement is not improving quality";
            }
            return new RefinementDecision(false, null, attempts, state.map(RefinementState::trend).orElse(null), max, reason);
        }
        String prompt = refinementManager.generateRefinementPrompt(assessment, context, originalTask, priorResponse);
        String reason = String.format(Locale.ROOT, "Score %.2f below threshold %.2f",
                assessment.overallScore(), assessment.threshold());
        RefinementState state = refinementManager.trackRefinementAttempt(sessionId, context.role(),
                assessment.overallScore(), reason);
        metricsService.recordRefinement(context.role(), state.attemptNumber());
        return new RefinementDecision(true, prompt, state.attemptNumber(), state.trend(), max, reason);
    }

    public SessionStats getSessionStats(String sessionId) {
        return sessionLedger.getSessionStats(sessionId);
    }

    public GlobalStats getGlobalStats() {
        return sessionLedger.getGlobalStats();
    }

    public RefinementStats getRefinementStats(String sessionId) {
        return refinementManager.getRefinementStats(sessionId);
    }

    public List<RoleSummary> listRoles() {
        return roleRegistry.listRoles();
    }

    private void reserveOrThrow(int count, @Nullable String sessionId) {
        if (sessionLedger.reserveCapacity(count)) {
            return;
        }
        GlobalStats global = sessionLedger.getGlobalStats();
        Map<String, Object> counters = new LinkedHashMap<>();
        counters.put("requestedAgents", count);
        counters.put("agentsInFlight", global.agentsInFlight());
        counters.put("maxConcurrentAgents", properties.getSession().getMaxConcurrentAgents());
        throw new ParallelQuotaExceededException(
                "Global worker capacity exhausted", sessionId, counters,
                "Wait for running workers to finish or increase delegation.session.max-concurrent-agents.");
    }

    private static List<String> duplicateIds(List<AgentSpec> agents) {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (AgentSpec spec : agents) {
            if (!seen.add(spec.agentId())) {
                duplicates.add(spec.agentId());
            }
        }
        return new ArrayList<>(duplicates);
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    private static String nullToEmpty(@Nullable String value) {
        return value == null ? "" : value;
    }
}
