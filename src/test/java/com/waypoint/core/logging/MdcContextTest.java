package com.waypoint.core.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("setMission sets only the mission key")
    void setMission() {
        MdcContext.setMission("WYPT-2026-0001");

        assertEquals("WYPT-2026-0001", MDC.get("missionId"));
        assertNull(MDC.get("phase"));
    }

    @Test
    @DisplayName("setPhase sets mission and phase")
    void setPhase() {
        MdcContext.setPhase("WYPT-2026-0001", "NEED_VERIFICATION");

        assertEquals("WYPT-2026-0001", MDC.get("missionId"));
        assertEquals("NEED_VERIFICATION", MDC.get("phase"));
    }

    @Test
    @DisplayName("clear removes the Waypoint keys and leaves others alone")
    void clear() {
        MDC.put("requestId", "abc");
        MdcContext.setPhase("WYPT-2026-0001", "DONE");

        MdcContext.clear();

        assertNull(MDC.get("missionId"));
        assertNull(MDC.get("phase"));
        assertEquals("abc", MDC.get("requestId"));
    }
}
