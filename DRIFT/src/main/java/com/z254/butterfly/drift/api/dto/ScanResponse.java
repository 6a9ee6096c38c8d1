package com.z254.butterfly.drift.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a triggered scan cycle.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ScanResponse {
    private String status;
    private String batchId;
    private Integer detected;
    private Integer skipped;
    private List<CommittedChange> committed;
    private Long pushedCommits;
    private String error;
    private Instant completedAt;

    @Data
    @Builder
    public static class CommittedChange {
        private String file;
        private String commitId;
        private boolean manual;
        private List<String> changers;
    }
}
