package com.waypoint.core.model;

import java.io.Serializable;

/**
 * Plan-side and logic-side task counts for one consistency check.
 */
public record ConsistencyReport(int planTaskCount, int logicTaskCount) implements Serializable {

    public boolean consistent() {
        return planTaskCount == logicTaskCount;
    }

    /**
     * Positive when the logic describes more transitions than the plan has tasks.
     */
    public int delta() {
        return logicTaskCount - planTaskCount;
    }

    public String correctiveMessage() {
        int d = delta();
        String direction = d > 0 ? "too many" : "too few";
        return "The mission plan contains " + planTaskCount + " tasks but your LTL produces "
                + logicTaskCount + " transitions, " + Math.abs(d) + " " + direction
                + ". Regenerate the LTL so every task and branch of the plan appears exactly once.";
    }
}
