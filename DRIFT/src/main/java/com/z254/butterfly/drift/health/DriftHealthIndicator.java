package com.z254.butterfly.drift.health;

import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.AttributionBatchResult;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Health indicator for DRIFT service.
 * <p>
 * Reports the outcome of the last scan cycle. A cycle aborted by a fatal
 * error (stage, commit or push failure) turns the service down until a later
 * cycle succeeds.
 */
@Component
public class DriftHealthIndicator implements ReactiveHealthIndicator {

    private final DriftProperties driftProperties;

    private final AtomicReference<Instant> lastCycleAt = new AtomicReference<>();
    private final AtomicReference<AttributionBatchResult> lastResult = new AtomicReference<>();
    private final AtomicReference<String> lastError = new AtomicReference<>();

    public DriftHealthIndicator(DriftProperties driftProperties) {
        this.driftProperties = driftProperties;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth);
    }

    private Health checkHealth() {
        Map<String, Object> details = new HashMap<>();
        details.put("scanIntervalMinutes", driftProperties.getScanIntervalMinutes());
        details.put("lastCycleAt", lastCycleAt.get() != null ? lastCycleAt.get().toString() : "NEVER");

        AttributionBatchResult result = lastResult.get();
        if (result != null) {
            details.put("lastBatchId", result.getBatchId());
            details.put("lastBatchCommitted", result.getCommittedCount());
            details.put("lastBatchSkipped", result.getSkipped());
        }

        String error = lastError.get();
        if (error != null) {
            details.put("lastError", error);
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }

    public void recordSuccess(AttributionBatchResult result, Instant at) {
        lastCycleAt.set(at);
        lastResult.set(result);
        lastError.set(null);
    }

    public void recordFailure(Throwable error, Instant at) {
        lastCycleAt.set(at);
        lastError.set(error.getMessage());
    }
}
