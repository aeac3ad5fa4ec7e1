package com.waypoint.core.llm;

/**
 * Thrown when a generator's answer does not contain the expected fenced block.
 */
public class GeneratorOutputException extends RuntimeException {
    public GeneratorOutputException(String message) {
        super(message);
    }
}
