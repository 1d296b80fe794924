package com.bko.delegation.logging;

import org.slf4j.MDC;
import org.springframework.lang.Nullable;

/**
 * MDC keys that correlate log lines with a delegation session.
 */
public final class DelegationMdc {

    public static final String SESSION_ID = "sessionId";
    public static final String ROLE = "role";
    public static final String AGENT_ID = "agentId";

    private DelegationMdc() {}

    public static void setWorker(String sessionId, String role, @Nullable String agentId) {
        MDC.put(SESSION_ID, sessionId);
        MDC.put(ROLE, role);
        if (agentId != null) {
            MDC.put(AGENT_ID, agentId);
        }
    }

    public static void clear() {
        MDC.remove(SESSION_ID);
        MDC.remove(ROLE);
        MDC.remove(AGENT_ID);
    }
}
