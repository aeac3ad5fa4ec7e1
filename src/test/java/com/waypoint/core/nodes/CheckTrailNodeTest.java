package com.waypoint.core.nodes;

import com.waypoint.core.events.EventBus;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.model.VerificationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CheckTrailNodeTest {

    private final CheckTrailNode node = new CheckTrailNode(NodeFixtures.transitions(new EventBus()));

    @Test
    @DisplayName("a passed verification finishes the mission")
    void passed() {
        var result = node.apply(NodeFixtures.state(Map.of(
                "verificationResult", VerificationResult.passed(Path.of("m.pml")))));

        assertEquals(MissionPhase.DONE.name(), result.get("phase"));
    }

    @Test
    @DisplayName("a counterexample sends the plan back for repair")
    void violation() {
        var result = node.apply(NodeFixtures.state(Map.of("retryCount", 2,
                "verificationResult", VerificationResult.violation(Path.of("m.pml"), "1: proc 0 (:init:) line 12"))));

        assertEquals(MissionPhase.NEED_PLAN.name(), result.get("phase"));
        assertEquals(3, result.get("retryCount"));
        assertEquals(ErrorCategory.VERIFICATION_VIOLATION, NodeFixtures.singleError(result).category());
        assertTrue(((String) result.get("feedback")).endsWith("Spin counterexample:\n1: proc 0 (:init:) line 12"));
    }
}
