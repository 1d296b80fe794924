package com.bko.delegation.api;

import com.bko.delegation.orchestration.OrchestratorService;
import com.bko.delegation.orchestration.model.RefinementStats;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private final OrchestratorService orchestratorService;

    public SessionController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    /**
     * Statistics of one session, or global statistics when no session id is given.
     */
    @GetMapping("/stats")
    public Object stats(@RequestParam(required = false) String sessionId) {
        if (StringUtils.hasText(sessionId)) {
            return orchestratorService.getSessionStats(sessionId);
        }
        return orchestratorService.getGlobalStats();
    }

    @GetMapping("/{sessionId}/refinements")
    public RefinementStats refinements(@PathVariable String sessionId) {
        return orchestratorService.getRefinementStats(sessionId);
    }
}
