package com.bko.delegation.orchestration.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tool calls made during one worker invocation. Safe for the concurrent calls of a single turn.
 */
@Slf4j
public final class ToolCallAudit {

    private static final int MAX_SNIPPET = 2000;

    private final AtomicLong count = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final List<ToolCallRecord> calls = Collections.synchronizedList(new ArrayList<>());
    private final String role;
    private final String sessionId;

    public ToolCallAudit(@Nullable String role, @Nullable String sessionId) {
        this.role = role;
        this.sessionId = sessionId;
    }

    void recordCall(@Nullable String name, @Nullable String input, @Nullable String output, boolean success) {
        count.incrementAndGet();
        if (!success) {
            failures.incrementAndGet();
        }
        String safeName = StringUtils.hasText(name) ? name : "unknown";
        calls.add(new ToolCallRecord(safeName, truncate(input), truncate(output), success));
        log.info("Tool call: name={}, role={}, sessionId={}, success={}, inputSnippet={}",
                safeName, role, sessionId, success, truncate(input));
    }

    int count() {
        long value = count.get();
        return value > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }

    int failureCount() {
        long value = failures.get();
        return value > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) value;
    }

    List<ToolCallRecord> snapshot() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    private String truncate(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return "";
        }
        return JsonProcessingService.truncate(value, MAX_SNIPPET);
    }
}
