package com.waypoint.core.nodes;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.events.MissionEvent;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionError;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.state.MissionState;
import com.waypoint.transport.MissionTransport;
import com.waypoint.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Done: writes the verified plan to the log directory and hands it to the transport, unless
 * transport is disabled or the mission opted out of delivery. A delivery failure is reported,
 * not retried.
 */
@Component
public class TransmitNode {

    private static final Logger log = LoggerFactory.getLogger(TransmitNode.class);

    private final MissionTransport transport;
    private final boolean transportEnabled;
    private final Path logDirectory;
    private final EventBus eventBus;

    public TransmitNode(MissionTransport transport, WaypointProperties properties, EventBus eventBus) {
        this.transport = transport;
        this.transportEnabled = properties.getTransport().isEnabled();
        this.logDirectory = Path.of(properties.getVerification().getLogDirectory());
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(MissionState state) {
        Path artifact = writePlan(state);
        var updates = new HashMap<String, Object>();
        updates.put("phase", MissionPhase.DONE.name());
        updates.put("artifactPath", artifact.toString());

        boolean transmitted = false;
        if (transportEnabled && state.sendToRobot()) {
            try {
                transport.send(artifact);
                transmitted = true;
            } catch (TransportException e) {
                updates.put("errors", List.of(new MissionError(ErrorCategory.TRANSPORT_ERROR, MissionPhase.DONE, e.getMessage())));
            }
        } else if (!transportEnabled) {
            log.info("Transport disabled, plan kept at {}", artifact);
        } else {
            log.info("Mission {} asked not to send the plan, kept at {}", state.missionId(), artifact);
        }
        updates.put("transmitted", transmitted);

        eventBus.publish(MissionEvent.of("mission.completed", state.missionId(), MissionPhase.DONE.name(),
                Map.of("artifactPath", artifact.toString(), "transmitted", transmitted,
                        "retryCount", state.retryCount())));
        return updates;
    }

    private Path writePlan(MissionState state) {
        try {
            Files.createDirectories(logDirectory);
            Path file = logDirectory.resolve("mission-" + state.missionId() + ".xml");
            Files.writeString(file, state.planText(), StandardCharsets.UTF_8);
            log.info("Verified plan written to {}", file);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write verified plan to " + logDirectory, e);
        }
    }
}
