package com.waypoint.core.nodes;

import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.model.VerificationResult;
import com.waypoint.core.state.MissionState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * NeedTrailCheck: with the logic approved, a counterexample from verification is blamed on the
 * plan and fed back to the plan generator.
 */
@Component
public class CheckTrailNode {

    private final PhaseTransitions transitions;

    public CheckTrailNode(PhaseTransitions transitions) {
        this.transitions = transitions;
    }

    public Map<String, Object> apply(MissionState state) {
        transitions.enter(state, MissionPhase.NEED_TRAIL_CHECK);
        var result = state.verificationResult().orElse(null);
        if (result != null && result.outcome() == VerificationResult.Outcome.VIOLATION) {
            return transitions.retry(state, MissionPhase.NEED_TRAIL_CHECK, MissionPhase.NEED_PLAN,
                    ErrorCategory.VERIFICATION_VIOLATION,
                    "Your mission plan violates the mission specification. Fix the plan. Spin counterexample:\n"
                            + result.counterexampleText());
        }
        return transitions.advance(state, MissionPhase.DONE);
    }
}
