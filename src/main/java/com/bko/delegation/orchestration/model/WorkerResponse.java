package com.bko.delegation.orchestration.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Normalized structured output of a worker.
 *
 * @param defaultedFields fields that were absent in the worker's output and filled with low-confidence defaults
 * @param failure set when the invocation was aborted (e.g. by the tool circuit breaker)
 */
public record WorkerResponse(
        Deliverables deliverables,
        List<MemoryOperation> memoryOperations,
        ResponseMetadata metadata,
        @Nullable ToolRequest toolRequest,
        @Nullable FailureDetail failure,
        List<String> defaultedFields
) {
    public WorkerResponse {
        memoryOperations = memoryOperations == null ? List.of() : List.copyOf(memoryOperations);
        defaultedFields = defaultedFields == null ? List.of() : List.copyOf(defaultedFields);
    }

    public boolean isDefaulted(String field) {
        return defaultedFields.contains(field);
    }

    public WorkerResponse withMetadata(ResponseMetadata updated) {
        return new WorkerResponse(deliverables, memoryOperations, updated, toolRequest, failure, defaultedFields);
    }
}
