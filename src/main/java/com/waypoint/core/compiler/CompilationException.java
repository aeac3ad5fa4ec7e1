package com.waypoint.core.compiler;

/**
 * Thrown when a task plan cannot be turned into a verification model.
 * Not recoverable by regenerating: the mission is failed.
 */
public class CompilationException extends RuntimeException {
    public CompilationException(String message) {
        super(message);
    }

    public CompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
