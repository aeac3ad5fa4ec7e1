package com.waypoint.core.nodes;

import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.MissionEvent;
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
 * Failed: terminal state. Reached on a compilation error or when the retry budget runs out.
 */
@Component
public class FailNode {

    private static final Logger log = LoggerFactory.getLogger(FailNode.class);

    private final EventBus eventBus;

    public FailNode(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(MissionState state) {
        var updates = new HashMap<String, Object>();
        updates.put("phase", MissionPhase.FAILED.name());

        ErrorCategory category = state.failureCategory().orElse(ErrorCategory.RETRY_BUDGET_EXHAUSTED);
        if (state.failureCategory().isEmpty()) {
            String message = "Retry budget of " + state.maxRetries() + " exhausted while in " + state.phase();
            log.error(message);
            updates.put("failureCategory", category.name());
            updates.put("errors", List.of(new MissionError(category, state.phase(), message)));
        }

        eventBus.publish(MissionEvent.of("mission.failed", state.missionId(), state.phase().name(),
                Map.of("category", category.name(), "retryCount", state.retryCount())));
        return updates;
    }
}
