package com.z254.butterfly.drift.api.v1;

import com.z254.butterfly.drift.api.dto.ScanResponse;
import com.z254.butterfly.drift.domain.model.AttributionBatchResult;
import com.z254.butterfly.drift.scan.ScanCycleService;
import com.z254.butterfly.drift.scan.ScanInProgressException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * REST API controller for on-demand scan cycles.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/scans")
@Tag(name = "Scans", description = "Change detection and attribution cycles")
public class ScanController {

    private final ScanCycleService scanCycleService;
    private final Clock clock;

    public ScanController(ScanCycleService scanCycleService, Clock clock) {
        this.scanCycleService = scanCycleService;
        this.clock = clock;
    }

    @PostMapping
    @Operation(summary = "Run scan cycle",
            description = "Detect changed snapshot files, attribute, commit, push and notify them")
    public Mono<ResponseEntity<ScanResponse>> runScan() {
        return Mono.fromCallable(scanCycleService::runCycle)
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(toResponse(result)))
                .onErrorResume(ScanInProgressException.class, e -> Mono.just(
                        ResponseEntity.status(HttpStatus.CONFLICT).body(ScanResponse.builder()
                                .status("REJECTED")
                                .error(e.getMessage())
                                .build())))
                .onErrorResume(e -> !(e instanceof ScanInProgressException), e -> {
                    log.error("Scan cycle failed", e);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                            .body(ScanResponse.builder()
                                    .status("FAILED")
                                    .error(e.getMessage())
                                    .completedAt(clock.instant())
                                    .build()));
                });
    }

    private ScanResponse toResponse(AttributionBatchResult result) {
        return ScanResponse.builder()
                .status("COMPLETED")
                .batchId(result.getBatchId())
                .detected(result.getDetected())
                .skipped(result.getSkipped())
                .committed(result.getCommitted().stream()
                        .map(change -> ScanResponse.CommittedChange.builder()
                                .file(change.filePath())
                                .commitId(change.getCommitId())
                                .manual(change.isManual())
                                .changers(change.getChangers())
                                .build())
                        .toList())
                .pushedCommits(result.getPushedCommits())
                .completedAt(clock.instant())
                .build();
    }
}
