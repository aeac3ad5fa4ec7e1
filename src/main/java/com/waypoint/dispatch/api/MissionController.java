package com.waypoint.dispatch.api;

import com.waypoint.core.config.WaypointProperties;
import com.waypoint.core.engine.MissionEngine;
import com.waypoint.core.engine.MissionOptions;
import com.waypoint.core.model.ErrorCategory;
import com.waypoint.core.model.MissionError;
import com.waypoint.core.model.MissionPhase;
import com.waypoint.core.state.MissionState;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * REST controller for mission lifecycle operations.
 * <p>
 * Missions run one at a time on a single worker thread: the checker writes its artifacts into
 * a shared work directory and the console arbiter reads standard input. Submissions made while
 * a mission runs wait in NeedPlan until the worker reaches them.
 */
@RestController
@RequestMapping("/api/v1/missions")
public class MissionController {

    private static final Logger log = LoggerFactory.getLogger(MissionController.class);

    private final MissionEngine missionEngine;
    private final WaypointProperties properties;

    /** In-memory store of running/completed mission states, keyed by missionId. */
    private final ConcurrentHashMap<String, MissionState> missionStates = new ConcurrentHashMap<>();

    private final ConcurrentHashMap<String, CompletableFuture<MissionState>> missionFutures = new ConcurrentHashMap<>();

    private final ExecutorService missionExecutor;

    @Autowired
    public MissionController(MissionEngine missionEngine, WaypointProperties properties) {
        this(missionEngine, properties, Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mission-worker");
            t.setDaemon(true);
            return t;
        }));
    }

    MissionController(MissionEngine missionEngine, WaypointProperties properties, ExecutorService missionExecutor) {
        this.missionEngine = missionEngine;
        this.properties = properties;
        this.missionExecutor = missionExecutor;
    }

    @PreDestroy
    void stopWorker() {
        missionExecutor.shutdown();
        try {
            if (!missionExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                missionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            missionExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * POST /api/v1/missions: submit a new mission. Queued behind any running mission.
     */
    @PostMapping
    public ResponseEntity<Map<String, String>> submitMission(@RequestBody MissionRequest request) {
        if (request.request() == null || request.request().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Request text is required"));
        }
        int maxRetries = request.maxRetries() != null
                ? request.maxRetries()
                : properties.getPipeline().getMaxRetries();
        if (maxRetries < 1) {
            return ResponseEntity.badRequest().body(Map.of("error", "max_retries must be at least 1"));
        }
        String schemaName = request.schema() != null ? request.schema().strip() : "";
        if (!schemaName.isEmpty() && !properties.getPlan().getSchemas().containsKey(schemaName)) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unrecognized schema: " + schemaName));
        }
        var options = new MissionOptions(maxRetries, schemaName,
                request.sendToRobot() == null || request.sendToRobot());

        String missionId = missionEngine.generateMissionId();
        log.info("Accepted mission {}, queued for execution", missionId);

        missionStates.put(missionId, new MissionState(Map.of(
                "missionId", missionId,
                "request", request.request(),
                "phase", MissionPhase.NEED_PLAN.name(),
                "maxRetries", maxRetries,
                "schemaName", options.schemaName(),
                "sendToRobot", options.sendToRobot()
        )));

        CompletableFuture<MissionState> future = CompletableFuture.supplyAsync(() -> {
            try {
                MissionState result = missionEngine.runMission(missionId, request.request(), options);
                missionStates.put(missionId, result);
                return result;
            } catch (Exception e) {
                log.error("Mission {} failed", missionId, e);
                MissionState failedState = new MissionState(Map.of(
                        "missionId", missionId,
                        "request", request.request(),
                        "phase", MissionPhase.FAILED.name(),
                        "maxRetries", maxRetries,
                        "failureCategory", ErrorCategory.INTERNAL_ERROR.name(),
                        "errors", List.of(new MissionError(ErrorCategory.INTERNAL_ERROR, MissionPhase.FAILED,
                                e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()))
                ));
                missionStates.put(missionId, failedState);
                return failedState;
            }
        }, missionExecutor);
        missionFutures.put(missionId, future);
        future.whenComplete((state, error) -> missionFutures.remove(missionId));

        return ResponseEntity.accepted().body(Map.of(
                "mission_id", missionId,
                "phase", MissionPhase.NEED_PLAN.name()
        ));
    }

    /**
     * GET /api/v1/missions: list all tracked missions.
     */
    @GetMapping
    public ResponseEntity<List<MissionResponse>> listMissions() {
        return ResponseEntity.ok(missionStates.values().stream().map(this::toResponse).toList());
    }

    /**
     * GET /api/v1/missions/schemas: robot platforms a mission may choose.
     */
    @GetMapping("/schemas")
    public ResponseEntity<Map<String, List<String>>> listSchemas() {
        return ResponseEntity.ok(Map.of("schemas", List.copyOf(properties.getPlan().getSchemas().keySet())));
    }

    /**
     * GET /api/v1/missions/{id}: mission phase, retries and errors.
     */
    @GetMapping("/{id}")
    public ResponseEntity<MissionResponse> getMission(@PathVariable String id) {
        MissionState state = missionStates.get(id);
        if (state == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(toResponse(state));
    }

    private MissionResponse toResponse(MissionState state) {
        return new MissionResponse(
                state.missionId(),
                state.request(),
                state.phase().name(),
                missionFutures.containsKey(state.missionId()),
                state.retryCount(),
                state.maxRetries(),
                state.schemaName().isEmpty() ? null : state.schemaName(),
                state.sendToRobot(),
                state.failureCategory().map(Enum::name).orElse(null),
                state.artifactPath().isEmpty() ? null : state.artifactPath(),
                state.transmitted(),
                state.sampleRuns(),
                state.errors().stream()
                        .map(e -> new MissionResponse.ErrorResponse(
                                e.category().name(), e.phase().name(), e.message()))
                        .toList()
        );
    }
}
