package com.waypoint.core.verification;

/**
 * Thrown when an external checker tool cannot be started or is interrupted.
 */
public class CheckerProcessException extends RuntimeException {
    public CheckerProcessException(String message, Throwable cause) {
        super(message, cause);
    }
}
