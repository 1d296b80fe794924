package com.bko.delegation.api;

import com.bko.delegation.error.SessionNotFoundException;
import com.bko.delegation.orchestration.OrchestratorService;
import com.bko.delegation.orchestration.model.GlobalStats;
import com.bko.delegation.orchestration.model.RefinementStats;
import com.bko.delegation.orchestration.model.SessionStats;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrchestratorService orchestratorService;

    @Test
    void testStats_Global() throws Exception {
        when(orchestratorService.getGlobalStats()).thenReturn(new GlobalStats(3, 2, 1, 17, 0));

        mockMvc.perform(get("/api/sessions/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalActiveSessions").value(3))
                .andExpect(jsonPath("$.subAgentSessions").value(2))
                .andExpect(jsonPath("$.totalCallsAcrossAllSessions").value(17));

        verify(orchestratorService, never()).getSessionStats(anyString());
    }

    @Test
    void testStats_Session() throws Exception {
        Instant now = Instant.parse("2025-01-01T10:00:00Z");
        when(orchestratorService.getSessionStats("s-1")).thenReturn(new SessionStats(
                "s-1", true, "root", 1, 4, 50, Map.of("Test Engineer", 4), Map.of(), false, 0, 0, now, now));

        mockMvc.perform(get("/api/sessions/stats").param("sessionId", "s-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sessionId").value("s-1"))
                .andExpect(jsonPath("$.parentId").value("root"))
                .andExpect(jsonPath("$.currentDepth").value(1))
                .andExpect(jsonPath("$.roleCalls['Test Engineer']").value(4));
    }

    @Test
    void testStats_UnknownSessionIsNotFound() throws Exception {
        when(orchestratorService.getSessionStats("missing")).thenThrow(new SessionNotFoundException("missing"));

        mockMvc.perform(get("/api/sessions/stats").param("sessionId", "missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("SESSION_NOT_FOUND"))
                .andExpect(jsonPath("$.sessionId").value("missing"));
    }

    @Test
    void testRefinements() throws Exception {
        when(orchestratorService.getRefinementStats("s-1"))
                .thenReturn(new RefinementStats(2, Map.of("Security Engineer", 2), 0.1, 0.5));

        mockMvc.perform(get("/api/sessions/s-1/refinements"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalRefinements").value(2))
                .andExpect(jsonPath("$.roleBreakdown['Security Engineer']").value(2))
                .andExpect(jsonPath("$.successRate").value(0.5));
    }
}
