package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Map;

/**
 * Worker instructions could not be composed. Indicates a configuration defect and is never retried.
 */
public class TemplateRenderingFailedException extends OrchestrationException {

    public TemplateRenderingFailedException(String message, @Nullable String sessionId, @Nullable Throwable cause) {
        super(ErrorCode.TEMPLATE_RENDERING_FAILED, message, sessionId, Map.of(),
                "Check the role definition file and the worker prompt template for missing values.", cause);
    }
}
