package com.waypoint.core.graph;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionError;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.nodes.ArbitrateNode;
import com.waypoint.core.nodes.CheckConsistencyNode;
import com.waypoint.core.nodes.CheckTrailNode;
import com.waypoint.core.nodes.FailNode;
import com.waypoint.core.nodes.GenerateLogicNode;
import com.waypoint.core.nodes.GeneratePlanNode;
import com.waypoint.core.nodes.TransmitNode;
import com.waypoint.core.nodes.VerifyMissionNode;
import com.waypoint.core.state.MissionState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the routing of the verification and repair loop, with every phase node mocked.
 */
class MissionGraphTest {

    private GeneratePlanNode planNode;
    private GenerateLogicNode logicNode;
    private CheckConsistencyNode consistencyNode;
    private VerifyMissionNode verifyNode;
    private ArbitrateNode arbitrateNode;
    private CheckTrailNode trailNode;
    private TransmitNode transmitNode;
    private FailNode failNode;
    private MissionGraph graph;

    @BeforeEach
    void setUp() throws Exception {
        planNode = mock(GeneratePlanNode.class);
        logicNode = mock(GenerateLogicNode.class);
        consistencyNode = mock(CheckConsistencyNode.class);
        verifyNode = mock(VerifyMissionNode.class);
        arbitrateNode = mock(ArbitrateNode.class);
        trailNode = mock(CheckTrailNode.class);
        transmitNode = mock(TransmitNode.class);
        failNode = mock(FailNode.class);

        when(planNode.apply(any())).thenReturn(Map.of("phase", "NEED_LOGIC", "planText", "<root/>"));
        when(logicNode.apply(any())).thenReturn(Map.of("phase", "NEED_CONSISTENCY", "logicText", "ltl { p }"));
        when(consistencyNode.apply(any())).thenReturn(Map.of("phase", "NEED_VERIFICATION"));
        when(verifyNode.apply(any())).thenReturn(Map.of("phase", "NEED_ARBITRATION"));
        when(arbitrateNode.apply(any())).thenReturn(Map.of("phase", "NEED_TRAIL_CHECK"));
        when(trailNode.apply(any())).thenReturn(Map.of("phase", "DONE"));
        when(transmitNode.apply(any())).thenReturn(Map.of("phase", "DONE", "transmitted", true));
        when(failNode.apply(any())).thenReturn(Map.of("phase", "FAILED"));

        graph = new MissionGraph(planNode, logicNode, consistencyNode, verifyNode, arbitrateNode,
                trailNode, transmitNode, failNode, new WaypointProperties());
    }

    private MissionState run(int maxRetries) throws Exception {
        var input = new HashMap<String, Object>();
        input.put("missionId", "WYPT-GRAPH");
        input.put("request", "Survey the orchard");
        input.put("phase", MissionPhase.NEED_PLAN.name());
        input.put("retryCount", 0);
        input.put("maxRetries", maxRetries);
        return graph.getCompiledGraph().invoke(input).orElseThrow();
    }

    private static Map<String, Object> retryTo(MissionState state, MissionPhase next, ErrorCategory category) {
        return Map.of(
                "phase", next.name(),
                "retryCount", state.retryCount() + 1,
                "feedback", category.name(),
                "errors", List.of(new MissionError(category, state.phase(), category.name())));
    }

    // -- Full runs ----------------------------------------------------------

    @Test
    @DisplayName("graph compiles")
    void graphCompiles() {
        assertNotNull(graph.getCompiledGraph());
    }

    @Test
    @DisplayName("a mission that passes every phase is transmitted")
    void happyPath() throws Exception {
        var state = run(5);

        assertEquals(MissionPhase.DONE, state.phase());
        assertTrue(state.transmitted());
        assertEquals(0, state.retryCount());
        verify(transmitNode).apply(any());
        verify(failNode, never()).apply(any());
    }

    @Test
    @DisplayName("a consistency mismatch regenerates only the logic")
    void mismatchRegeneratesLogic() throws Exception {
        var calls = new AtomicInteger();
        when(consistencyNode.apply(any())).thenAnswer(invocation -> {
            MissionState state = invocation.getArgument(0);
            return calls.getAndIncrement() == 0
                    ? retryTo(state, MissionPhase.NEED_LOGIC, ErrorCategory.CONSISTENCY_MISMATCH)
                    : Map.of("phase", "NEED_VERIFICATION");
        });

        var state = run(5);

        assertEquals(MissionPhase.DONE, state.phase());
        assertEquals(1, state.retryCount());
        assertEquals(1, state.errors().size());
        verify(planNode, times(1)).apply(any());
        verify(logicNode, times(2)).apply(any());
    }

    @Test
    @DisplayName("a counterexample sends the mission back to plan generation")
    void counterexampleRegeneratesPlan() throws Exception {
        var calls = new AtomicInteger();
        when(trailNode.apply(any())).thenAnswer(invocation -> {
            MissionState state = invocation.getArgument(0);
            return calls.getAndIncrement() == 0
                    ? retryTo(state, MissionPhase.NEED_PLAN, ErrorCategory.VERIFICATION_VIOLATION)
                    : Map.of("phase", "DONE");
        });

        var state = run(5);

        assertEquals(MissionPhase.DONE, state.phase());
        verify(planNode, times(2)).apply(any());
        verify(trailNode, times(2)).apply(any());
    }

    @Test
    @DisplayName("running out of retries ends in the fail node")
    void budgetExhausted() throws Exception {
        when(consistencyNode.apply(any())).thenAnswer(invocation -> retryTo(
                invocation.getArgument(0), MissionPhase.NEED_LOGIC, ErrorCategory.CONSISTENCY_MISMATCH));

        var state = run(3);

        assertEquals(MissionPhase.FAILED, state.phase());
        assertEquals(3, state.retryCount());
        assertEquals(3, state.errors().size());
        verify(logicNode, times(3)).apply(any());
        verify(failNode).apply(any());
        verify(verifyNode, never()).apply(any());
    }

    @Test
    @DisplayName("a compilation error fails immediately")
    void compilationErrorIsFatal() throws Exception {
        when(logicNode.apply(any())).thenReturn(Map.of(
                "phase", "FAILED",
                "failureCategory", ErrorCategory.COMPILATION_ERROR.name()));

        var state = run(5);

        assertEquals(MissionPhase.FAILED, state.phase());
        assertEquals(ErrorCategory.COMPILATION_ERROR, state.failureCategory().orElseThrow());
        verify(consistencyNode, never()).apply(any());
        verify(failNode).apply(any());
    }

    // -- Routing ------------------------------------------------------------

    @Nested
    @DisplayName("route")
    class Route {

        private MissionState state(MissionPhase phase, int retryCount) {
            return new MissionState(Map.of("phase", phase.name(), "retryCount", retryCount, "maxRetries", 2));
        }

        @Test
        @DisplayName("each open phase routes to its node")
        void phasesRouteToNodes() {
            assertEquals(MissionGraph.GENERATE_PLAN, graph.route(state(MissionPhase.NEED_PLAN, 0)));
            assertEquals(MissionGraph.GENERATE_LOGIC, graph.route(state(MissionPhase.NEED_LOGIC, 0)));
            assertEquals(MissionGraph.CHECK_CONSISTENCY, graph.route(state(MissionPhase.NEED_CONSISTENCY, 0)));
            assertEquals(MissionGraph.VERIFY_MISSION, graph.route(state(MissionPhase.NEED_VERIFICATION, 0)));
            assertEquals(MissionGraph.ARBITRATE, graph.route(state(MissionPhase.NEED_ARBITRATION, 1)));
            assertEquals(MissionGraph.CHECK_TRAIL, graph.route(state(MissionPhase.NEED_TRAIL_CHECK, 1)));
        }

        @Test
        @DisplayName("terminal phases route to their terminal nodes regardless of budget")
        void terminalPhases() {
            assertEquals(MissionGraph.TRANSMIT, graph.route(state(MissionPhase.DONE, 2)));
            assertEquals(MissionGraph.FAIL, graph.route(state(MissionPhase.FAILED, 0)));
        }

        @Test
        @DisplayName("an exhausted budget routes to fail")
        void exhaustedBudget() {
            assertEquals(MissionGraph.FAIL, graph.route(state(MissionPhase.NEED_LOGIC, 2)));
        }
    }
}
