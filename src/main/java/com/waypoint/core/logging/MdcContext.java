package com.waypoint.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Waypoint MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setMission(String missionId) {
        MDC.put("missionId", missionId);
    }

    public static void setPhase(String missionId, String phase) {
        MDC.put("missionId", missionId);
        MDC.put("phase", phase);
    }

    public static void clear() {
        MDC.remove("missionId");
        MDC.remove("phase");
    }
}
