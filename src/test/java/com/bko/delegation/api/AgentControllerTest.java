package com.bko.delegation.api;

import com.bko.delegation.error.InvalidTaskSpecificationException;
import com.bko.delegation.error.ParallelQuotaExceededException;
import com.bko.delegation.orchestration.OrchestratorService;
import com.bko.delegation.orchestration.model.AgentResult;
import com.bko.delegation.orchestration.model.AgentStatus;
import com.bko.delegation.orchestration.model.BatchResult;
import com.bko.delegation.orchestration.model.BatchSummary;
import com.bko.delegation.orchestration.model.CompletionStatus;
import com.bko.delegation.orchestration.model.ConfidenceLevel;
import com.bko.delegation.orchestration.model.Deliverables;
import com.bko.delegation.orchestration.model.ParallelExecution;
import com.bko.delegation.orchestration.model.ResponseMetadata;
import com.bko.delegation.orchestration.model.WorkerResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AgentController.class)
class AgentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrchestratorService orchestratorService;

    @Test
    void testSpawn() throws Exception {
        when(orchestratorService.spawnAgent(eq("Security Engineer"), eq("Audit login"), isNull(), isNull(), isNull()))
                .thenReturn(response());

        mockMvc.perform(post("/api/agents/spawn")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"Security Engineer\", \"task\": \"Audit login\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deliverables.analysis").value("Looks fine"))
                .andExpect(jsonPath("$.metadata.completionStatus").value("complete"))
                .andExpect(jsonPath("$.metadata.confidenceLevel").value("high"));
    }

    @Test
    void testSpawn_MissingTaskIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/agents/spawn")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"Security Engineer\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"))
                .andExpect(jsonPath("$.message").value(containsString("task")));

        verify(orchestratorService, never()).spawnAgent(any(), any(), any(), any(), any());
    }

    @Test
    void testSpawn_InvalidTaskMapsToBadRequest() throws Exception {
        when(orchestratorService.spawnAgent(any(), any(), any(), any(), any()))
                .thenThrow(new InvalidTaskSpecificationException("Task description contains tool call mentions",
                        null, List.of("read_file"), "Describe WHAT needs to be done"));

        mockMvc.perform(post("/api/agents/spawn")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"role\": \"Software Engineer\", \"task\": \"use read_file\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_TASK_SPECIFICATION"))
                .andExpect(jsonPath("$.remediation").value("Describe WHAT needs to be done"));
    }

    @Test
    void testSpawnParallel() throws Exception {
        AgentResult result = new AgentResult("a1", "Test Engineer", AgentStatus.SUCCESS, 12, "s-1", response(), null, null);
        BatchResult batch = new BatchResult(
                new ParallelExecution("coord", 1, 1, 0, 15, "ctx", Instant.parse("2025-01-01T00:00:00Z")),
                List.of(result),
                BatchSummary.of(List.of(result)));
        when(orchestratorService.spawnAgentsParallel(anyList(), eq("ctx"))).thenReturn(batch);

        mockMvc.perform(post("/api/agents/spawn-parallel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agents\": [{\"agentId\": \"a1\", \"role\": \"Test Engineer\", \"task\": \"Find gaps\"}],"
                                + " \"coordinationContext\": \"ctx\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.parallelExecution.coordinatorSessionId").value("coord"))
                .andExpect(jsonPath("$.agentResults[0].status").value("success"))
                .andExpect(jsonPath("$.summary.allSuccessful").value(true));
    }

    @Test
    void testSpawnParallel_TooManyAgentsIsBadRequest() throws Exception {
        StringBuilder agents = new StringBuilder();
        for (int i = 0; i < 6; i++) {
            if (i > 0) {
                agents.append(',');
            }
            agents.append("{\"agentId\": \"a").append(i).append("\", \"role\": \"Test Engineer\", \"task\": \"t\"}");
        }

        mockMvc.perform(post("/api/agents/spawn-parallel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agents\": [" + agents + "]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    void testSpawnParallel_QuotaMapsToConflict() throws Exception {
        when(orchestratorService.spawnAgentsParallel(anyList(), any()))
                .thenThrow(new ParallelQuotaExceededException("Global worker capacity exhausted", "coord",
                        Map.of("agentsInFlight", 10), "Wait for running workers to finish"));

        mockMvc.perform(post("/api/agents/spawn-parallel")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agents\": [{\"agentId\": \"a1\", \"role\": \"Test Engineer\", \"task\": \"t\"}]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("PARALLEL_QUOTA_EXCEEDED"))
                .andExpect(jsonPath("$.sessionId").value("coord"))
                .andExpect(jsonPath("$.counters.agentsInFlight").value(10));
    }

    @Test
    void testValidate_RefinementDefaultsToEnabled() throws Exception {
        mockMvc.perform(post("/api/agents/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"response\": \"{}\", \"requirements\": \"r\", \"qualityCriteria\": \"q\"}"))
                .andExpect(status().isOk());

        verify(orchestratorService).validateOutput(eq("{}"), eq("r"), eq("q"), isNull(), isNull(), eq(true));
    }

    @Test
    void testValidate_MissingResponseIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/agents/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"requirements\": \"r\", \"qualityCriteria\": \"q\"}"))
                .andExpect(status().isBadRequest());

        verify(orchestratorService, never()).validateOutput(any(), any(), any(), any(), any(), anyBoolean());
    }

    private static WorkerResponse response() {
        return new WorkerResponse(
                new Deliverables("Looks fine", List.of("Ship it"), List.of(), null, Map.of()),
                List.of(),
                new ResponseMetadata("Security Engineer", CompletionStatus.COMPLETE, ConfidenceLevel.HIGH, "10ms"),
                null,
                null,
                List.of());
    }
}
