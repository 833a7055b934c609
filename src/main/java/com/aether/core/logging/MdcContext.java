package com.aether.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Aether-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void setMission(String agentId, String missionId) {
        MDC.put("agentId", agentId);
        if (missionId != null) {
            MDC.put("missionId", missionId);
        } else {
            MDC.remove("missionId");
        }
    }

    public static void clear() {
        MDC.remove("agentId");
        MDC.remove("missionId");
    }
}
