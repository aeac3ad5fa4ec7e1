package com.waypoint.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON response for mission endpoints.
 */
public record MissionResponse(
    @JsonProperty("mission_id") String missionId,
    String request,
    String phase,
    boolean running,
    @JsonProperty("retry_count") int retryCount,
    @JsonProperty("max_retries") int maxRetries,
    String schema,
    @JsonProperty("send_to_robot") boolean sendToRobot,
    @JsonProperty("failure_category") String failureCategory,
    @JsonProperty("artifact_path") String artifactPath,
    boolean transmitted,
    @JsonProperty("sample_runs") List<String> sampleRuns,
    List<ErrorResponse> errors
) {

    public record ErrorResponse(String category, String phase, String message) {}
}
