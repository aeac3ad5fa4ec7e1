package com.waypoint.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for mission runs.
 */
@Service
public class WaypointMetrics {

    private final MeterRegistry registry;

    public WaypointMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordMissionResult(String phase) {
        Counter.builder("waypoint.missions.total")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordRetry(String phase, String category) {
        Counter.builder("waypoint.retries.total")
                .description("Failed phase attempts that consumed retry budget")
                .tag("phase", phase)
                .tag("category", category)
                .register(registry)
                .increment();
    }

    public void recordVerification(String outcome, long ms) {
        Counter.builder("waypoint.verification.outcomes")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("waypoint.verification.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordConsistencyDelta(int delta) {
        DistributionSummary.builder("waypoint.consistency.delta")
                .description("Logic transitions minus plan tasks, per check")
                .register(registry)
                .record(Math.abs(delta));
    }

    public void recordRetriesUsed(int retries) {
        DistributionSummary.builder("waypoint.missions.retries_used")
                .register(registry)
                .record(retries);
    }
}
