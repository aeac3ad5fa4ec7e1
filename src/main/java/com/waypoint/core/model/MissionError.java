package com.waypoint.core.model;

import java.io.Serializable;

/**
 * A recorded failure of one phase attempt.
 */
public record MissionError(ErrorCategory category, MissionPhase phase, String message) implements Serializable {

    @Override
    public String toString() {
        return "[" + category + " @ " + phase + "] " + message;
    }
}
