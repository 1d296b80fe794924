package com.bko.delegation.api;

import com.bko.delegation.orchestration.OrchestratorService;
import com.bko.delegation.orchestration.model.BatchResult;
import com.bko.delegation.orchestration.model.ValidationResult;
import com.bko.delegation.orchestration.model.WorkerResponse;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/agents")
public class AgentController {

    private final OrchestratorService orchestratorService;

    public AgentController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @PostMapping("/spawn")
    public WorkerResponse spawn(@Valid @RequestBody SpawnAgentRequest request) {
        return orchestratorService.spawnAgent(request.role(), request.task(), request.context(),
                request.expectedDeliverables(), request.parentSessionId());
    }

    @PostMapping("/spawn-parallel")
    public BatchResult spawnParallel(@Valid @RequestBody SpawnParallelRequest request) {
        var specs = request.agents().stream().map(ParallelAgentRequest::toSpec).toList();
        return orchestratorService.spawnAgentsParallel(specs, request.coordinationContext());
    }

    @PostMapping("/validate")
    public ValidationResult validate(@Valid @RequestBody ValidateOutputRequest request) {
        return orchestratorService.validateOutput(request.response(), request.requirements(), request.qualityCriteria(),
                request.role(), request.sessionId(), request.refinementEnabled());
    }
}
