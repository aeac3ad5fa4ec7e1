package com.waypoint.core.model;

/**
 * Phases of the verification and repair loop.
 */
public enum MissionPhase {
    NEED_PLAN,
    NEED_LOGIC,
    NEED_CONSISTENCY,
    NEED_VERIFICATION,
    NEED_ARBITRATION,
    NEED_TRAIL_CHECK,
    DONE,
    FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED;
    }
}
