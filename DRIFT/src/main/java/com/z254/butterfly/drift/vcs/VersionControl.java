package com.z254.butterfly.drift.vcs;

import com.z254.butterfly.drift.domain.model.Change;

import java.util.List;

/**
 * Version control operations on the configuration snapshot working tree.
 * <p>
 * Every operation may fail with {@link VersionControlException}.
 */
public interface VersionControl {

    /**
     * Snapshot files modified or added since the last commit.
     */
    List<Change> detectChanges();

    void stagePath(String path);

    /**
     * Whether the staged content of the path differs from the last commit.
     */
    boolean hasPendingDiff(String path);

    /**
     * Commit staged content.
     *
     * @return the new commit id
     */
    String commit(String message);

    /**
     * Diff between the last commit and its parent.
     */
    String diffLastCommit();

    /**
     * Local commits not yet on the remote branch.
     */
    long commitsAheadOfRemote();

    /**
     * Total number of commits reachable from HEAD.
     */
    long totalCommitCount();

    void push();
}
