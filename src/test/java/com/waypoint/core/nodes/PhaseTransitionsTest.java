package com.waypoint.core.nodes;

import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.MissionEvent;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionPhase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PhaseTransitionsTest {

    private final List<MissionEvent> events = new ArrayList<>();
    private SimpleMeterRegistry registry;
    private PhaseTransitions transitions;

    @BeforeEach
    void setUp() {
        var eventBus = new EventBus();
        eventBus.subscribeAll(events::add);
        registry = new SimpleMeterRegistry();
        transitions = new PhaseTransitions(eventBus, new WaypointMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("enter tags the log context with the mission and phase")
    void enterSetsMdc() {
        transitions.enter(NodeFixtures.state(Map.of()), MissionPhase.NEED_VERIFICATION);

        assertEquals("WYPT-TEST", MDC.get("missionId"));
        assertEquals("NEED_VERIFICATION", MDC.get("phase"));
    }

    @Test
    @DisplayName("advance clears feedback and keeps the node's own updates")
    void advance() {
        var state = NodeFixtures.state(Map.of("feedback", "old complaint"));

        var result = transitions.advance(state, MissionPhase.NEED_LOGIC, Map.of("planText", "<root/>"));

        assertEquals("NEED_LOGIC", result.get("phase"));
        assertEquals("", result.get("feedback"));
        assertEquals("<root/>", result.get("planText"));
        assertFalse(result.containsKey("retryCount"));
        assertEquals("phase.entered", events.get(0).eventType());
        assertEquals("NEED_LOGIC", events.get(0).phase());
    }

    @Test
    @DisplayName("retry consumes one attempt and records the error against the failing phase")
    void retry() {
        var state = NodeFixtures.state(Map.of("retryCount", 1));

        var result = transitions.retry(state, MissionPhase.NEED_CONSISTENCY, MissionPhase.NEED_LOGIC,
                ErrorCategory.CONSISTENCY_MISMATCH, "2 too many");

        assertEquals("NEED_LOGIC", result.get("phase"));
        assertEquals(2, result.get("retryCount"));
        assertEquals("2 too many", result.get("feedback"));
        var error = NodeFixtures.singleError(result);
        assertEquals(MissionPhase.NEED_CONSISTENCY, error.phase());
        assertEquals("phase.retry", events.get(0).eventType());
        assertEquals(2, events.get(0).payload().get("retryCount"));
        assertEquals(1.0, registry.get("waypoint.retries.total")
                .tag("phase", "NEED_CONSISTENCY")
                .tag("category", "CONSISTENCY_MISMATCH")
                .counter().count());
    }

    @Test
    @DisplayName("fail goes straight to Failed without consuming budget")
    void fail() {
        var result = transitions.fail(NodeFixtures.state(Map.of()), MissionPhase.NEED_LOGIC,
                ErrorCategory.COMPILATION_ERROR, "Unsupported node kind: Inverter");

        assertEquals("FAILED", result.get("phase"));
        assertEquals("COMPILATION_ERROR", result.get("failureCategory"));
        assertFalse(result.containsKey("retryCount"));
        assertTrue(events.isEmpty());
    }
}
