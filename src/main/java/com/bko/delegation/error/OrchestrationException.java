package com.bko.delegation.error;

import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every failure the delegation engine reports to its caller.
 * <p>
 * Each instance names the session it happened in (when one exists), the counters
 * relevant to the limit that was hit, and a concrete remediation hint.
 */
public class OrchestrationException extends RuntimeException {

    private final ErrorCode code;
    private final String sessionId;
    private final Map<String, Object> counters;
    private final String remediation;

    public OrchestrationException(ErrorCode code,
                                  String message,
                                  @Nullable String sessionId,
                                  @Nullable Map<String, Object> counters,
                                  String remediation) {
        this(code, message, sessionId, counters, remediation, null);
    }

    public OrchestrationException(ErrorCode code,
                                  String message,
                                  @Nullable String sessionId,
                                  @Nullable Map<String, Object> counters,
                                  String remediation,
                                  @Nullable Throwable cause) {
        super(message, cause);
        this.code = code;
        this.sessionId = sessionId;
        this.counters = counters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(counters));
        this.remediation = remediation;
    }

    public ErrorCode getCode() {
        return code;
    }

    @Nullable
    public String getSessionId() {
        return sessionId;
    }

    public Map<String, Object> getCounters() {
        return counters;
    }

    public String getRemediation() {
        return remediation;
    }
}
