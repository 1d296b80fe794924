package com.bko.delegation.orchestration.model;

public record ResponseMetadata(
        String role,
        CompletionStatus completionStatus,
        ConfidenceLevel confidenceLevel,
        String processingTime
) {
}
