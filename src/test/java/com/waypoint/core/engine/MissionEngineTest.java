package com.waypoint.core.engine;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.MissionEvent;
import com.waypoint.core.graph.MissionGraph;
import com.waypoint.core.llm.GeneratorSessions;
import com.waypoint.core.metrics.WaypointMetrics;
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
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for the MissionEngine service.
 * Uses a real graph with mocked phase nodes.
 */
class MissionEngineTest {

    private GeneratePlanNode planNode;
    private GeneratorSessions sessions;
    private EventBus eventBus;
    private SimpleMeterRegistry registry;
    private WaypointProperties properties;
    private MissionEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        planNode = mock(GeneratePlanNode.class);
        var logicNode = mock(GenerateLogicNode.class);
        var consistencyNode = mock(CheckConsistencyNode.class);
        var verifyNode = mock(VerifyMissionNode.class);
        var arbitrateNode = mock(ArbitrateNode.class);
        var trailNode = mock(CheckTrailNode.class);
        var transmitNode = mock(TransmitNode.class);
        var failNode = mock(FailNode.class);

        when(planNode.apply(any())).thenReturn(Map.of("phase", "NEED_LOGIC", "planText", "<root/>"));
        when(logicNode.apply(any())).thenReturn(Map.of("phase", "NEED_CONSISTENCY"));
        when(consistencyNode.apply(any())).thenReturn(Map.of("phase", "NEED_VERIFICATION"));
        when(verifyNode.apply(any())).thenReturn(Map.of("phase", "NEED_ARBITRATION"));
        when(arbitrateNode.apply(any())).thenReturn(Map.of("phase", "NEED_TRAIL_CHECK"));
        when(trailNode.apply(any())).thenReturn(Map.of("phase", "DONE"));
        when(transmitNode.apply(any())).thenReturn(Map.of("phase", "DONE", "artifactPath", "logs/mission.xml"));
        when(failNode.apply(any())).thenReturn(Map.of("phase", "FAILED"));

        properties = new WaypointProperties();
        var graph = new MissionGraph(planNode, logicNode, consistencyNode, verifyNode, arbitrateNode,
                trailNode, transmitNode, failNode, properties);

        sessions = mock(GeneratorSessions.class);
        eventBus = new EventBus();
        registry = new SimpleMeterRegistry();
        engine = new MissionEngine(graph, sessions, eventBus, new WaypointMetrics(registry), properties);
    }

    @Test
    @DisplayName("runMission drives the request to Done and records the result")
    void runsToDone() {
        MissionState state = engine.runMission("WYPT-2026-0042", "Survey the orchard", 4);

        assertEquals("WYPT-2026-0042", state.missionId());
        assertEquals("Survey the orchard", state.request());
        assertEquals(4, state.maxRetries());
        assertEquals(MissionPhase.DONE, state.phase());
        assertEquals("logs/mission.xml", state.artifactPath());
        assertEquals(1.0, registry.find("waypoint.missions.total").tag("phase", "DONE").counter().count());
    }

    @Test
    @DisplayName("the mission.created event carries the request and budget")
    void publishesCreated() {
        List<MissionEvent> events = new ArrayList<>();
        eventBus.subscribe("WYPT-2026-0042", events::add);

        engine.runMission("WYPT-2026-0042", "Survey the orchard", 4);

        assertEquals("mission.created", events.get(0).eventType());
        assertEquals(4, events.get(0).payload().get("maxRetries"));
    }

    @Test
    @DisplayName("generator sessions and log context are released even when a node throws")
    void cleansUpOnFailure() {
        when(planNode.apply(any())).thenThrow(new IllegalStateException("LLM unreachable"));

        assertThrows(RuntimeException.class, () -> engine.runMission("WYPT-2026-0043", "Survey", 3));

        verify(sessions).close("WYPT-2026-0043");
        assertNull(MDC.get("missionId"));
    }

    @Test
    @DisplayName("the chosen platform and delivery choice are seeded into the mission state")
    void seedsOptions() {
        properties.getPlan().getSchemas().put("clearpath_husky", "schemas/clearpath_husky.xsd");

        MissionState state = engine.runMission("WYPT-2026-0044", "Survey the orchard",
                new MissionOptions(2, "clearpath_husky", false));

        assertEquals("clearpath_husky", state.schemaName());
        assertFalse(state.sendToRobot());
        assertEquals(2, state.maxRetries());
        verify(planNode).apply(argThat(s -> s.schemaName().equals("clearpath_husky") && !s.sendToRobot()));
    }

    @Test
    @DisplayName("an unknown platform is rejected before the graph runs")
    void unknownPlatform() {
        var e = assertThrows(IllegalArgumentException.class, () -> engine.runMission("WYPT-2026-0045",
                "Survey the orchard", new MissionOptions(2, "bd_spot", true)));

        assertEquals("Unrecognized schema: bd_spot", e.getMessage());
        verifyNoInteractions(planNode, sessions);
    }

    @Test
    @DisplayName("runMission without an ID uses the configured retry budget")
    void defaultBudget() {
        MissionState state = engine.runMission("Survey the orchard");

        assertTrue(state.missionId().startsWith("WYPT-"));
        assertEquals(5, state.maxRetries());
        verify(sessions).close(state.missionId());
    }

    @Test
    @DisplayName("generated mission IDs are unique and zero padded")
    void generatesIds() {
        String first = engine.generateMissionId();
        String second = engine.generateMissionId();

        assertTrue(first.matches("WYPT-\\d{4}-\\d{4}"), first);
        assertNotEquals(first, second);
    }
}
