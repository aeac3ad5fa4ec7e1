package com.waypoint.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.waypoint.core.health.HealthCheckService;
import com.waypoint.core.health.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * GET /api/v1/health: whether the mission graph is built and the external checker tools run.
 * <p>
 * A mission can only be verified when both spin and ltl2tgba answer their version check, which
 * is reported as {@code verification_ready}. The endpoint is 503 only when a component is DOWN.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {

    static final List<String> VERIFICATION_TOOLS = List.of("spin", "ltl2tgba");

    private final HealthCheckService healthCheckService;

    public HealthController(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @GetMapping
    public ResponseEntity<HealthResponse> health() {
        Map<String, ComponentHealth> components = new LinkedHashMap<>();
        for (HealthStatus check : healthCheckService.checkAll()) {
            components.put(check.component(), new ComponentHealth(check.status().name(), check.detail(),
                    check.metadata().get("version")));
        }

        boolean down = components.values().stream().anyMatch(c -> HealthStatus.Status.DOWN.name().equals(c.status()));
        boolean verificationReady = VERIFICATION_TOOLS.stream()
                .map(components::get)
                .allMatch(c -> c != null && HealthStatus.Status.UP.name().equals(c.status()));

        var body = new HealthResponse(down ? "DOWN" : "UP", verificationReady, components);
        return ResponseEntity.status(down ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK).body(body);
    }

    public record HealthResponse(
        String status,
        @JsonProperty("verification_ready") boolean verificationReady,
        Map<String, ComponentHealth> components
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ComponentHealth(String status, String detail, String version) {}
}
