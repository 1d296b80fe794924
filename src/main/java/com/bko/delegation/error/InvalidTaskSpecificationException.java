package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.List;
import java.util.Map;

public class InvalidTaskSpecificationException extends OrchestrationException {

    private final List<String> detectedPatterns;

    public InvalidTaskSpecificationException(String message,
                                             @Nullable String sessionId,
                                             List<String> detectedPatterns,
                                             String remediation) {
        super(ErrorCode.INVALID_TASK_SPECIFICATION, message, sessionId,
                Map.of("detectedPatterns", detectedPatterns.size()), remediation);
        this.detectedPatterns = List.copyOf(detectedPatterns);
    }

    public List<String> getDetectedPatterns() {
        return detectedPatterns;
    }
}
