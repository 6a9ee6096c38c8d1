package com.z254.butterfly.drift.scan;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Runs a scan cycle every scan interval.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "drift.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ScanCycleScheduler {

    private final ScanCycleService scanCycleService;

    public ScanCycleScheduler(ScanCycleService scanCycleService) {
        this.scanCycleService = scanCycleService;
    }

    @Scheduled(fixedDelayString = "${drift.scan-interval-minutes}",
            initialDelayString = "${drift.scheduler.initial-delay-minutes:1}",
            timeUnit = TimeUnit.MINUTES)
    public void scheduledCycle() {
        try {
            scanCycleService.runCycle();
        } catch (ScanInProgressException e) {
            log.info("Skipping scheduled scan: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled scan cycle failed, files are retried on the next cycle", e);
        }
    }
}
