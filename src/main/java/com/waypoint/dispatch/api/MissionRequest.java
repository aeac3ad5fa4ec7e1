package com.waypoint.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/v1/missions.
 *
 * @param request     natural-language mission request
 * @param maxRetries  retry budget for this mission; nullable, defaults to the configured budget
 * @param schema      robot platform from {@code waypoint.plan.schemas}; nullable, defaults to the default schema
 * @param sendToRobot whether to deliver the verified plan; nullable, defaults to true
 */
public record MissionRequest(
    String request,
    @JsonProperty("max_retries") Integer maxRetries,
    String schema,
    @JsonProperty("send_to_robot") Boolean sendToRobot
) {}
