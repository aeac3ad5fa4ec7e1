package com.waypoint.transport;

/**
 * Thrown when a verified plan cannot be delivered to the robot.
 */
public class TransportException extends RuntimeException {
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
