package com.bko.delegation.api;

import com.bko.delegation.orchestration.OrchestratorService;
import com.bko.delegation.orchestration.roles.RoleSummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(RoleController.class)
class RoleControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private OrchestratorService orchestratorService;

    @Test
    void testListRoles() throws Exception {
        when(orchestratorService.listRoles()).thenReturn(List.of(
                new RoleSummary("Security Engineer", "Finds vulnerabilities", List.of("read_file"), 0.80),
                new RoleSummary("Technical Writer", "Writes docs", List.of(), 0.70)));

        mockMvc.perform(get("/api/roles"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].name").value("Security Engineer"))
                .andExpect(jsonPath("$[0].tools[0]").value("read_file"))
                .andExpect(jsonPath("$[1].qualityThreshold").value(0.7));
    }
}
