package com.bko.delegation.orchestration.service;

/**
 * Terminal text of a worker conversation together with what it took to get there.
 */
public record WorkerCallResult(String output, ToolCallAudit audit, int iterations) {
    public int toolCallCount() {
        return audit == null ? 0 : audit.count();
    }

    public int toolFailureCount() {
        return audit == null ? 0 : audit.failureCount();
    }
}
