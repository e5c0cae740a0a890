package com.arbiter.core.logging;

import org.slf4j.MDC;

/**
 * Arbiter MDC keys for structured logging. The log pattern prints both.
 */
public final class MdcContext {

    public static final String COORDINATION_ID = "coordinationId";
    public static final String AGENT_ID = "agentId";

    private MdcContext() {}

    public static void setCoordination(String coordinationId) {
        MDC.put(COORDINATION_ID, coordinationId);
    }

    public static void setAgent(String coordinationId, String agentId) {
        MDC.put(COORDINATION_ID, coordinationId);
        MDC.put(AGENT_ID, agentId);
    }

    public static void clearAgent() {
        MDC.remove(AGENT_ID);
    }

    public static void clear() {
        MDC.remove(COORDINATION_ID);
        MDC.remove(AGENT_ID);
    }
}
