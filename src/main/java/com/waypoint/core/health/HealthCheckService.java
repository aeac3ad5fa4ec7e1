package com.waypoint.core.health;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.graph.MissionGraph;
import com.waypoint.core.verification.CheckerProcessException;
import com.waypoint.core.verification.CheckerProcessRunner;
import com.waypoint.core.verification.ProcessOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);
    private static final Duration VERSION_TIMEOUT = Duration.ofSeconds(10);

    private final MissionGraph missionGraph;
    private final CheckerProcessRunner runner;
    private final WaypointProperties properties;

    public HealthCheckService(@Autowired(required = false) MissionGraph missionGraph,
                              CheckerProcessRunner runner,
                              WaypointProperties properties) {
        this.missionGraph = missionGraph;
        this.runner = runner;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGraph());
        results.add(checkTool("spin", properties.getVerification().getSpinBinary(), "-V"));
        results.add(checkTool("ltl2tgba", properties.getLogic().getLtl2tgbaBinary(), "--version"));
        return results;
    }

    private HealthStatus checkGraph() {
        if (missionGraph != null) {
            return new HealthStatus("graph", HealthStatus.Status.UP,
                    "Graph compiled and available", Map.of());
        }
        return new HealthStatus("graph", HealthStatus.Status.DOWN,
                "Graph not available", Map.of());
    }

    private HealthStatus checkTool(String component, String binary, String versionFlag) {
        try {
            ProcessOutcome outcome = runner.run(List.of(binary, versionFlag), Path.of("."), VERSION_TIMEOUT);
            if (outcome.succeeded()) {
                String version = outcome.output().lines().findFirst().orElse("").trim();
                return new HealthStatus(component, HealthStatus.Status.UP,
                        binary + " available", Map.of("version", version));
            }
            return new HealthStatus(component, HealthStatus.Status.DEGRADED,
                    binary + " exited with code " + outcome.exitCode(), Map.of());
        } catch (CheckerProcessException e) {
            log.warn("{} health check failed: {}", component, e.getMessage());
            return new HealthStatus(component, HealthStatus.Status.DOWN,
                    binary + " not runnable: " + e.getMessage(), Map.of());
        }
    }
}
