package com.bko.delegation.api;

import com.bko.delegation.orchestration.OrchestratorService;
import com.bko.delegation.orchestration.roles.RoleSummary;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/roles")
public class RoleController {

    private final OrchestratorService orchestratorService;

    public RoleController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    @GetMapping
    public List<RoleSummary> listRoles() {
        return orchestratorService.listRoles();
    }
}
