package com.waypoint.core.nodes;

import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.MissionEvent;
import com.waypoint.core.logging.MdcContext;
import com.waypoint.core.metrics.WaypointMetrics;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionError;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.state.MissionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the state updates every phase node returns, so retry accounting, feedback,
 * events and metrics are handled the same way in each phase.
 */
@Component
public class PhaseTransitions {

    private static final Logger log = LoggerFactory.getLogger(PhaseTransitions.class);

    private final EventBus eventBus;
    private final WaypointMetrics metrics;

    public PhaseTransitions(EventBus eventBus, WaypointMetrics metrics) {
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Marks the start of a node's work for logging.
     */
    public void enter(MissionState state, MissionPhase phase) {
        MdcContext.setPhase(state.missionId(), phase.name());
        log.info("Entering {} (attempt budget used {}/{})", phase, state.retryCount(), state.maxRetries());
    }

    /**
     * Success: move to {@code next} and clear the corrective feedback.
     */
    public Map<String, Object> advance(MissionState state, MissionPhase next, Map<String, Object> updates) {
        var result = new HashMap<String, Object>(updates);
        result.put("phase", next.name());
        result.put("feedback", "");
        eventBus.publish(MissionEvent.of("phase.entered", state.missionId(), next.name(), Map.of()));
        return result;
    }

    public Map<String, Object> advance(MissionState state, MissionPhase next) {
        return advance(state, next, Map.of());
    }

    /**
     * Recoverable failure: consume one retry, record the error and move to {@code next}
     * with {@code message} as the feedback for its generator.
     */
    public Map<String, Object> retry(MissionState state, MissionPhase failedIn, MissionPhase next,
                                     ErrorCategory category, String message) {
        return retry(state, failedIn, next, category, message, Map.of());
    }

    public Map<String, Object> retry(MissionState state, MissionPhase failedIn, MissionPhase next,
                                     ErrorCategory category, String message, Map<String, Object> updates) {
        int retries = state.retryCount() + 1;
        log.warn("{} failed ({}), retry {}/{} via {}: {}", failedIn, category, retries, state.maxRetries(), next, message);
        metrics.recordRetry(failedIn.name(), category.name());
        eventBus.publish(MissionEvent.of("phase.retry", state.missionId(), failedIn.name(),
                Map.of("category", category.name(), "next", next.name(), "retryCount", retries)));

        var result = new HashMap<String, Object>(updates);
        result.put("phase", next.name());
        result.put("retryCount", retries);
        result.put("feedback", message);
        result.put("errors", List.of(new MissionError(category, failedIn, message)));
        return result;
    }

    /**
     * Unrecoverable failure: go straight to Failed.
     */
    public Map<String, Object> fail(MissionState state, MissionPhase failedIn, ErrorCategory category, String message) {
        log.error("{} failed permanently ({}): {}", failedIn, category, message);
        return Map.of(
                "phase", MissionPhase.FAILED.name(),
                "failureCategory", category.name(),
                "errors", List.of(new MissionError(category, failedIn, message)));
    }

    /**
     * Feedback text for an unexpected collaborator failure, e.g. a provider error.
     */
    static String describe(RuntimeException e) {
        String type = e.getClass().getSimpleName();
        return e.getMessage() != null ? type + ": " + e.getMessage() : type;
    }
}
