package com.waypoint.core.engine;

/**
 * Per-request choices for one mission run.
 *
 * @param maxRetries  retry budget shared by all phases
 * @param schemaName  robot platform whose plan schema applies; blank for the default schema
 * @param sendToRobot whether a verified plan is handed to the transport
 */
public record MissionOptions(int maxRetries, String schemaName, boolean sendToRobot) {

    public MissionOptions {
        schemaName = schemaName == null ? "" : schemaName.strip();
    }

    public static MissionOptions withRetries(int maxRetries) {
        return new MissionOptions(maxRetries, "", true);
    }
}
