package com.waypoint.core.compiler;

/**
 * Thrown when generated plan text is malformed: not XML, missing attributes,
 * or failing schema validation. The message is fed back to the plan generator.
 */
public class PlanParseException extends RuntimeException {
    public PlanParseException(String message) {
        super(message);
    }

    public PlanParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
