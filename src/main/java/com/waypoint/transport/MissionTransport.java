package com.waypoint.transport;

import java.nio.file.Path;

/**
 * Delivers a verified plan file to the robot-side executor.
 */
public interface MissionTransport {

    /**
     * @throws TransportException if the file could not be delivered
     */
    void send(Path file);
}
