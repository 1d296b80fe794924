package com.bko.delegation.error;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    DEPTH_EXCEEDED(HttpStatus.CONFLICT),
    PARALLEL_QUOTA_EXCEEDED(HttpStatus.CONFLICT),
    SESSION_LIMIT_EXCEEDED(HttpStatus.CONFLICT),
    DUPLICATE_AGENT_ID(HttpStatus.BAD_REQUEST),
    INVALID_TASK_SPECIFICATION(HttpStatus.BAD_REQUEST),
    UNKNOWN_ROLE(HttpStatus.BAD_REQUEST),
    TEMPLATE_RENDERING_FAILED(HttpStatus.INTERNAL_SERVER_ERROR),
    TOOL_EXECUTION_FAILED(HttpStatus.BAD_GATEWAY),
    CIRCUIT_BREAKER_TRIPPED(HttpStatus.BAD_GATEWAY),
    ITERATION_LIMIT_EXCEEDED(HttpStatus.BAD_GATEWAY),
    COMPLETION_FAILED(HttpStatus.BAD_GATEWAY),
    REFINEMENT_CAP_EXCEEDED(HttpStatus.CONFLICT),
    PARSE_RECOVERY_EXHAUSTED(HttpStatus.UNPROCESSABLE_ENTITY),
    SESSION_NOT_FOUND(HttpStatus.NOT_FOUND);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
