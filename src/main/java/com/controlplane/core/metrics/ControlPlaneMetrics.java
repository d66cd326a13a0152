package com.controlplane.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for mission orchestration.
 */
@Service
public class ControlPlaneMetrics {

    private final MeterRegistry registry;

    public ControlPlaneMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageTransition(String stage) {
        Counter.builder("controlplane.stage.transitions")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordStageRollback(String stage) {
        Counter.builder("controlplane.stage.rollbacks")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordMissionResult(String status) {
        Counter.builder("controlplane.missions.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordLoopExit(String status, int attempts) {
        Counter.builder("controlplane.execution_loop.exits")
                .tag("status", status)
                .register(registry)
                .increment();
        DistributionSummary.builder("controlplane.execution_loop.attempts")
                .register(registry)
                .record(attempts);
    }

    public void recordActionResult(String toolkit, String status, long ms) {
        Timer.builder("controlplane.action.duration")
                .tag("toolkit", toolkit)
                .tag("status", status)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRateLimitRetry(String toolkit) {
        Counter.builder("controlplane.action.rate_limit_retries")
                .tag("toolkit", toolkit)
                .register(registry)
                .increment();
    }

    public void recordValidation(String category, String status) {
        Counter.builder("controlplane.safeguard.validations")
                .tag("category", category)
                .tag("status", status)
                .register(registry)
                .increment();
    }

    // --- Session store ---

    public void recordSessionFlush(String reason) {
        Counter.builder("controlplane.session.flushes")
                .description("Durable session writes that succeeded")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordVersionConflict() {
        Counter.builder("controlplane.session.version_conflicts")
                .description("Conditional writes rejected because another writer advanced the version")
                .register(registry)
                .increment();
    }

    public void recordFlushRetryScheduled() {
        Counter.builder("controlplane.session.flush_retries")
                .description("Outage retries scheduled after transport failures")
                .register(registry)
                .increment();
    }

    public void recordQueueDrop() {
        Counter.builder("controlplane.session.queue_drops")
                .description("Snapshots dropped from a full write queue")
                .register(registry)
                .increment();
    }
}
