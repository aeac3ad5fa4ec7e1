package com.waypoint.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a mission runs.
 *
 * @param eventType {@code mission.created}, {@code phase.entered}, {@code phase.retry},
 *                  {@code mission.completed} or {@code mission.failed}
 * @param missionId the mission this event belongs to
 * @param phase     phase the event relates to (nullable for mission-level events)
 * @param payload   arbitrary key-value data
 * @param timestamp when the event occurred
 */
public record MissionEvent(
    String eventType,
    String missionId,
    String phase,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static MissionEvent of(String eventType, String missionId, String phase, Map<String, Object> payload) {
        return new MissionEvent(eventType, missionId, phase, payload, Instant.now());
    }
}
