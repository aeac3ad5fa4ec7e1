package com.waypoint.core.llm;

import com.waypoint.core.model.ArbiterVerdict;

import java.util.List;

/**
 * Judges whether sampled runs of the logic specification describe the requested mission.
 */
public interface MissionArbiter {

    ArbiterVerdict judge(String request, List<String> runs);
}
