package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.Map;

public record SessionStats(
        String sessionId,
        boolean subAgent,
        @Nullable String parentId,
        int currentDepth,
        int totalCalls,
        int maxCalls,
        Map<String, Integer> roleCalls,
        Map<String, Integer> refinementCounts,
        boolean loopDetected,
        long durationMinutes,
        long minutesSinceLastActivity,
        Instant createdAt,
        Instant lastActivity
) {
}
