package com.waypoint.dispatch.cli;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.MissionEngine;
import com.waypoint.core.engine.MissionOptions;
import com.waypoint.core.events.EventBus;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.state.MissionState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: waypoint mission "&lt;request&gt;"
 * <p>
 * Runs a mission request through the generate / verify / repair loop and reports where the
 * verified plan was written, or why the mission failed.
 */
@Command(name = "mission", mixinStandardHelpOptions = true, description = "Plan and verify a mission")
@Component
public class MissionCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Natural language mission request")
    private String request;

    @Option(names = {"--max-retries", "-r"}, description = "Retry budget shared by all phases (default: configured)")
    private Integer maxRetries;

    @Option(names = {"--schema", "-s"}, description = "Robot platform whose plan schema applies (default: configured schema)")
    private String schema;

    @Option(names = "--no-send", description = "Keep the verified plan local instead of sending it to the robot")
    private boolean noSend;

    @Option(names = {"--watch", "-w"}, description = "Print pipeline events as they happen")
    private boolean watch;

    private final MissionEngine missionEngine;
    private final EventBus eventBus;
    private final WaypointProperties properties;

    public MissionCommand(MissionEngine missionEngine, EventBus eventBus, WaypointProperties properties) {
        this.missionEngine = missionEngine;
        this.eventBus = eventBus;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        int budget = maxRetries != null ? maxRetries : properties.getPipeline().getMaxRetries();
        if (budget < 1) {
            ConsoleOutput.error("--max-retries must be at least 1");
            return 2;
        }
        String schemaName = schema != null ? schema.strip() : "";
        if (!schemaName.isEmpty() && !properties.getPlan().getSchemas().containsKey(schemaName)) {
            ConsoleOutput.error("Unrecognized schema: " + schemaName + " (configured: "
                    + String.join(", ", properties.getPlan().getSchemas().keySet()) + ")");
            return 2;
        }

        String missionId = missionEngine.generateMissionId();
        EventBus.Subscription subscription = watch
                ? eventBus.subscribe(missionId, event -> ConsoleOutput.watchEvent(
                        event.eventType(), event.phase() != null ? event.phase() + " " + event.payload() : String.valueOf(event.payload())))
                : null;

        ConsoleOutput.info("Mission " + missionId + ": " + request);
        MissionState finalState;
        try {
            finalState = missionEngine.runMission(missionId, request, new MissionOptions(budget, schemaName, !noSend));
        } catch (Exception e) {
            ConsoleOutput.error("Mission failed: " + ConsoleOutput.rootCauseMessage(e));
            return 1;
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        if (!finalState.errors().isEmpty()) {
            ConsoleOutput.section("Attempts that failed (" + finalState.errors().size() + "):");
            finalState.errors().forEach(ConsoleOutput::missionError);
        }

        System.out.println();
        if (finalState.phase() == MissionPhase.DONE) {
            ConsoleOutput.success("Mission verified after " + finalState.retryCount() + " retr"
                    + (finalState.retryCount() == 1 ? "y" : "ies") + ". Plan: " + finalState.artifactPath());
            if (finalState.transmitted()) {
                ConsoleOutput.success("Plan transmitted to robot.");
            }
            return 0;
        }
        ConsoleOutput.error("Mission failed: "
                + finalState.failureCategory().map(Enum::name).orElse("UNKNOWN"));
        return 1;
    }
}
