package com.waypoint.core.logic;

/**
 * Thrown when generated logic text has no usable formula or malformed macro lines.
 */
public class LogicParseException extends RuntimeException {
    public LogicParseException(String message) {
        super(message);
    }
}
