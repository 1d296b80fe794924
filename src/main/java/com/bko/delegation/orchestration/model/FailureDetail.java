package com.bko.delegation.orchestration.model;

import com.bko.delegation.error.ErrorCode;
import com.bko.delegation.error.OrchestrationException;

import java.util.Map;

public record FailureDetail(
        ErrorCode code,
        String message,
        Map<String, Object> counters,
        String remediation
) {
    public static FailureDetail from(OrchestrationException ex) {
        return new FailureDetail(ex.getCode(), ex.getMessage(), ex.getCounters(), ex.getRemediation());
    }
}
