package com.waypoint.core.engine;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.MissionEvent;
import com.waypoint.core.graph.MissionGraph;
import com.waypoint.core.llm.GeneratorSessions;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.state.MissionState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one mission request through the compiled graph.
 * <p>
 * Generates the mission ID, seeds the initial state, invokes the graph and discards the
 * mission's generator conversations once it finishes.
 */
@Service
public class MissionEngine {

    private static final Logger log = LoggerFactory.getLogger(MissionEngine.class);
    private static final AtomicInteger MISSION_COUNTER = new AtomicInteger(0);

    private final MissionGraph missionGraph;
    private final GeneratorSessions sessions;
    private final EventBus eventBus;
    private final WaypointMetrics metrics;
    private final WaypointProperties properties;

    public MissionEngine(MissionGraph missionGraph, GeneratorSessions sessions, EventBus eventBus,
                         WaypointMetrics metrics, WaypointProperties properties) {
        this.missionGraph = missionGraph;
        this.sessions = sessions;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    public MissionState runMission(String request) {
        return runMission(generateMissionId(), request, properties.getPipeline().getMaxRetries());
    }

    public MissionState runMission(String missionId, String request, int maxRetries) {
        return runMission(missionId, request, MissionOptions.withRetries(maxRetries));
    }

    /**
     * @param missionId the mission ID to use (e.g. from the REST controller)
     * @param request   the natural-language mission request
     * @param options   retry budget, robot platform and delivery choice
     * @return the final graph state, in phase DONE or FAILED
     * @throws IllegalArgumentException if {@code options} names a platform with no configured schema
     */
    public MissionState runMission(String missionId, String request, MissionOptions options) {
        if (!options.schemaName().isEmpty() && !isKnownSchema(options.schemaName())) {
            throw new IllegalArgumentException("Unrecognized schema: " + options.schemaName());
        }
        int maxRetries = options.maxRetries();
        MdcContext.setMission(missionId);
        try {
            log.info("Starting mission {} (max retries {}, schema {}, send {}): {}", missionId, maxRetries,
                    options.schemaName().isEmpty() ? "default" : options.schemaName(), options.sendToRobot(), request);
            eventBus.publish(MissionEvent.of("mission.created", missionId, null,
                    Map.of("request", request, "maxRetries", maxRetries)));

            Map<String, Object> initialState = Map.of(
                    "missionId", missionId,
                    "request", request,
                    "phase", MissionPhase.NEED_PLAN.name(),
                    "retryCount", 0,
                    "maxRetries", maxRetries,
                    "schemaName", options.schemaName(),
                    "sendToRobot", options.sendToRobot());

            var config = RunnableConfig.builder()
                    .threadId(missionId)
                    .build();

            var state = missionGraph.getCompiledGraph()
                    .invoke(initialState, config)
                    .orElseThrow(() -> new IllegalStateException(
                            "Graph execution returned empty state for mission " + missionId));

            log.info("Mission {} finished in {} after {} retr{}", missionId, state.phase(),
                    state.retryCount(), state.retryCount() == 1 ? "y" : "ies");
            metrics.recordMissionResult(state.phase().name());
            metrics.recordRetriesUsed(state.retryCount());
            return state;
        } finally {
            sessions.close(missionId);
            MdcContext.clear();
        }
    }

    private boolean isKnownSchema(String schemaName) {
        return properties.getPlan().getSchemas().containsKey(schemaName);
    }

    /**
     * Generates a unique mission ID in the format WYPT-YYYY-NNNN.
     */
    public String generateMissionId() {
        int count = MISSION_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("WYPT-%d-%04d", year, count);
    }
}
