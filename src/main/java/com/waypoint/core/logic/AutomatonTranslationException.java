package com.waypoint.core.logic;

/**
 * Thrown when a formula cannot be translated into an automaton.
 * The logic is regenerated with the translator's message as feedback.
 */
public class AutomatonTranslationException extends RuntimeException {
    public AutomatonTranslationException(String message) {
        super(message);
    }

    public AutomatonTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
