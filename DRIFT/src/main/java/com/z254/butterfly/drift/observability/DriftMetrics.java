package com.z254.butterfly.drift.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for DRIFT service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Change attribution (processed, skipped, manual, unattributed)</li>
 *     <li>Degraded lookups (audit log, automation runs)</li>
 *     <li>Notifications and pushed commits</li>
 * </ul>
 */
@Component
public class DriftMetrics {

    private final MeterRegistry meterRegistry;

    @Getter
    private final Counter changesCommitted;
    @Getter
    private final Counter changesSkipped;
    @Getter
    private final Counter manualChanges;
    @Getter
    private final Counter unattributedChanges;
    @Getter
    private final Counter auditLogFailures;
    @Getter
    private final Counter automationRunFailures;
    @Getter
    private final Counter commitsPushed;
    @Getter
    private final Counter batchesFailed;
    private final Timer batchDuration;
    private final Map<String, Counter> notificationFailures = new ConcurrentHashMap<>();

    public DriftMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.changesCommitted = Counter.builder("drift.changes.committed")
                .description("Changes attributed and committed")
                .register(meterRegistry);
        this.changesSkipped = Counter.builder("drift.changes.skipped")
                .description("Detected changes without a pending diff")
                .register(meterRegistry);
        this.manualChanges = Counter.builder("drift.changes.manual")
                .description("Changes done by a non-automation account")
                .register(meterRegistry);
        this.unattributedChanges = Counter.builder("drift.changes.unattributed")
                .description("Changes with no identified changer")
                .register(meterRegistry);
        this.auditLogFailures = Counter.builder("drift.auditlog.failures")
                .description("Failed audit log queries")
                .register(meterRegistry);
        this.automationRunFailures = Counter.builder("drift.automation.failures")
                .description("Failed automation run lookups")
                .register(meterRegistry);
        this.commitsPushed = Counter.builder("drift.commits.pushed")
                .description("Commits pushed to the remote")
                .register(meterRegistry);
        this.batchesFailed = Counter.builder("drift.batches.failed")
                .description("Attribution batches aborted by a fatal error")
                .register(meterRegistry);
        this.batchDuration = Timer.builder("drift.batch.duration")
                .description("Attribution batch duration")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    public void recordNotificationFailure(String notifier) {
        notificationFailures.computeIfAbsent(notifier, name -> Counter.builder("drift.notifications.failed")
                .description("Failed change notifications")
                .tag("notifier", name)
                .register(meterRegistry))
                .increment();
    }

    public void recordCommitsPushed(long count) {
        commitsPushed.increment(count);
    }

    public void recordBatchDuration(Duration duration) {
        batchDuration.record(duration);
    }
}
