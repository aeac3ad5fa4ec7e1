package com.waypoint.core.logic;

/**
 * Thrown when a random walk cannot reach an accepting state: the current state has no
 * edge other than self-loops, or the walk exceeded its step bound.
 */
public class SamplerDeadlockException extends RuntimeException {

    private final int state;

    public SamplerDeadlockException(String message, int state) {
        super(message);
        this.state = state;
    }

    public int getState() {
        return state;
    }
}
