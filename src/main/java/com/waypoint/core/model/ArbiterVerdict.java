package com.waypoint.core.model;

import java.io.Serializable;

/**
 * The arbiter's judgement on sampled example runs.
 *
 * @param approved    true if the runs describe the requested mission
 * @param explanation reasoning, fed back to the logic generator on rejection
 */
public record ArbiterVerdict(boolean approved, String explanation) implements Serializable {}
