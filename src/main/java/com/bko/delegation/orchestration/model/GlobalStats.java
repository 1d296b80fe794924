package com.bko.delegation.orchestration.model;

public record GlobalStats(
        int totalActiveSessions,
        int subAgentSessions,
        int primaryAgentSessions,
        long totalCallsAcrossAllSessions,
        int agentsInFlight
) {
}
