package com.bko.delegation.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.concurrent.atomic.AtomicLong;

@Service
@Slf4j
public class OrchestrationMetricsService {

    private final AtomicLong spawnCount = new AtomicLong();
    private final AtomicLong completionRequestCount = new AtomicLong();
    private final AtomicLong toolCallCount = new AtomicLong();
    private final AtomicLong toolFailureCount = new AtomicLong();
    private final AtomicLong breakerTripCount = new AtomicLong();
    private final AtomicLong validationCount = new AtomicLong();
    private final AtomicLong refinementCount = new AtomicLong();

    public void recordSpawn(String role, int agents) {
        long total = spawnCount.addAndGet(agents);
        log.info("Spawning {} worker(s) (role={}). Total workers spawned={}.", agents, role, total);
    }

    public void recordCompletionRequest(String purpose, @Nullable String role) {
        long count = completionRequestCount.incrementAndGet();
        if (StringUtils.hasText(role)) {
            log.debug("LLM request #{} sent (purpose={}, role={}).", count, purpose, role);
        } else {
            log.debug("LLM request #{} sent (purpose={}).", count, purpose);
        }
    }

    public void recordToolCall(String toolName, boolean success) {
        toolCallCount.incrementAndGet();
        if (!success) {
            long failures = toolFailureCount.incrementAndGet();
            log.debug("Tool call failed (tool={}). Total tool failures={}.", toolName, failures);
        }
    }

    public void recordBreakerTrip(String role) {
        long trips = breakerTripCount.incrementAndGet();
        log.warn("Tool circuit breaker tripped (role={}). Total trips={}.", role, trips);
    }

    public void recordValidation(String role, double score, boolean passed) {
        long count = validationCount.incrementAndGet();
        log.info("Validation #{} completed (role={}, score={}, passed={}).", count, role, String.format(java.util.Locale.ROOT, "%.2f", score), passed);
    }

    public void recordRefinement(String role, int attempt) {
        long count = refinementCount.incrementAndGet();
        log.info("Refinement requested (role={}, attempt={}). Total refinements={}.", role, attempt, count);
    }

    public long spawnCount() {
        return spawnCount.get();
    }

    public long toolFailureCount() {
        return toolFailureCount.get();
    }

    public void logSummary() {
        log.info("Delegation stats: spawns={}, completionRequests={}, toolCalls={}, toolFailures={}, breakerTrips={}, "
                        + "validations={}, refinements={}.",
                spawnCount.get(), completionRequestCount.get(), toolCallCount.get(), toolFailureCount.get(),
                breakerTripCount.get(), validationCount.get(), refinementCount.get());
    }
}
