package com.z254.butterfly.drift.domain.model;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one attribution batch.
 */
@Data
@Builder
public class AttributionBatchResult {

    private String batchId;

    private Instant referenceTime;

    private int detected;

    private int skipped;

    @Builder.Default
    private List<Change> committed = new ArrayList<>();

    /** Commits pushed to the remote after the batch */
    private long pushedCommits;

    public int getCommittedCount() {
        return committed.size();
    }
}
