package com.waypoint.core.nodes;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.llm.MissionArbiter;
import com.waypoint.core.logic.AutomatonSampler;
import com.waypoint.core.logic.SamplerDeadlockException;
import com.waypoint.core.model.ArbiterVerdict;
import com.waypoint.core.model.Automaton;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.state.MissionState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * NeedArbitration: samples example runs of the logic and asks the arbiter whether they
 * describe the requested mission.
 */
@Component
public class ArbitrateNode {

    private final AutomatonSampler sampler;
    private final MissionArbiter arbiter;
    private final int sampleCount;
    private final PhaseTransitions transitions;

    public ArbitrateNode(AutomatonSampler sampler, MissionArbiter arbiter, WaypointProperties properties,
                         PhaseTransitions transitions) {
        this.sampler = sampler;
        this.arbiter = arbiter;
        this.sampleCount = properties.getLogic().getSampleRuns();
        this.transitions = transitions;
    }

    public Map<String, Object> apply(MissionState state) {
        transitions.enter(state, MissionPhase.NEED_ARBITRATION);
        Automaton automaton = state.automaton()
                .orElseThrow(() -> new IllegalStateException("No automaton in state for mission " + state.missionId()));

        List<String> runs;
        try {
            runs = sampler.sampleRuns(automaton, sampleCount);
        } catch (SamplerDeadlockException e) {
            return transitions.retry(state, MissionPhase.NEED_ARBITRATION, MissionPhase.NEED_LOGIC,
                    ErrorCategory.GENERATION_ERROR,
                    "Your specification has no accepting run from state " + e.getState() + ": " + e.getMessage());
        }

        ArbiterVerdict verdict;
        try {
            verdict = arbiter.judge(state.request(), runs);
        } catch (RuntimeException e) {
            return transitions.retry(state, MissionPhase.NEED_ARBITRATION, MissionPhase.NEED_LOGIC,
                    ErrorCategory.GENERATION_ERROR,
                    "The example runs of your specification could not be judged: " + PhaseTransitions.describe(e),
                    Map.of("sampleRuns", runs));
        }
        if (!verdict.approved()) {
            return transitions.retry(state, MissionPhase.NEED_ARBITRATION, MissionPhase.NEED_LOGIC,
                    ErrorCategory.ARBITRATION_REJECTION,
                    "Example runs of your specification were rejected: " + verdict.explanation(),
                    Map.of("sampleRuns", runs));
        }
        return transitions.advance(state, MissionPhase.NEED_TRAIL_CHECK, Map.of("sampleRuns", runs));
    }
}
