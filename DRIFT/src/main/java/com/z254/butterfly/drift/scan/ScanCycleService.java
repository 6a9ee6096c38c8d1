package com.z254.butterfly.drift.scan;

import com.z254.butterfly.drift.attribution.ChangeAttributor;
import com.z254.butterfly.drift.domain.model.AttributionBatchResult;
import com.z254.butterfly.drift.domain.model.Change;
import com.z254.butterfly.drift.health.DriftHealthIndicator;
import com.z254.butterfly.drift.vcs.VersionControl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One scan cycle: detect changed snapshot files and attribute them.
 * <p>
 * Only one cycle runs at a time since the attributor owns the working tree
 * for the duration of a batch.
 */
@Slf4j
@Service
public class ScanCycleService {

    private final VersionControl versionControl;
    private final ChangeAttributor changeAttributor;
    private final DriftHealthIndicator healthIndicator;
    private final Clock clock;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ScanCycleService(VersionControl versionControl,
                            ChangeAttributor changeAttributor,
                            DriftHealthIndicator healthIndicator,
                            Clock clock) {
        this.versionControl = versionControl;
        this.changeAttributor = changeAttributor;
        this.healthIndicator = healthIndicator;
        this.clock = clock;
    }

    /**
     * @throws ScanInProgressException when another cycle is running
     */
    public AttributionBatchResult runCycle() {
        if (!running.compareAndSet(false, true)) {
            throw new ScanInProgressException();
        }
        try {
            List<Change> changes = versionControl.detectChanges();
            log.info("Detected {} changed snapshot files", changes.size());
            AttributionBatchResult result = changeAttributor.process(changes);
            healthIndicator.recordSuccess(result, clock.instant());
            return result;
        } catch (RuntimeException e) {
            healthIndicator.recordFailure(e, clock.instant());
            throw e;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }
}
