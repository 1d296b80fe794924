package com.bko.delegation.orchestration.api;

import com.bko.delegation.orchestration.model.TaskSpec;
import com.bko.delegation.orchestration.model.WorkerResponse;
import com.bko.delegation.orchestration.roles.RoleDefinition;
import org.springframework.lang.Nullable;

/**
 * Runs one worker invocation: composes the worker instructions, drives the tool-calling conversation and
 * parses the terminal answer.
 */
public interface AgentInvocationService {

    /**
     * Executes a task with the given role inside an existing session.
     *
     * @param role The role whose instructions the worker receives.
     * @param task The task, context and expected deliverables.
     * @param sessionId The session the invocation is accounted to.
     * @param agentId Caller-supplied id of a parallel batch member, or null for single spawns.
     * @return The normalized worker response. A tripped tool circuit breaker yields a {@code failed} response
     * carrying the failure detail rather than an exception.
     * @throws com.bko.delegation.error.TemplateRenderingFailedException if the instructions cannot be composed.
     * @throws com.bko.delegation.error.IterationLimitExceededException if the worker never produces a final answer.
     * @throws com.bko.delegation.error.CompletionFailedException if the model provider call fails.
     */
    WorkerResponse invoke(RoleDefinition role, TaskSpec task, String sessionId, @Nullable String agentId);
}
