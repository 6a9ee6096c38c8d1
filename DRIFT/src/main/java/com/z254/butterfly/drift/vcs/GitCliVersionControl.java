package com.z254.butterfly.drift.vcs;

import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.Change;
import com.z254.butterfly.drift.domain.model.Provider;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link VersionControl} backed by the git command line.
 * <p>
 * Snapshot files follow {@code <provider>/<resourceType>/<projectId>.yaml};
 * anything else in the working tree is ignored by change detection.
 */
@Slf4j
public class GitCliVersionControl implements VersionControl {

    private static final String SNAPSHOT_EXTENSION = ".yaml";

    private final GitCommandRunner git;
    private final DriftProperties.Git config;

    public GitCliVersionControl(GitCommandRunner git, DriftProperties.Git config) {
        this.git = git;
        this.config = config;
    }

    public GitCliVersionControl(DriftProperties.Git config) {
        this(new GitCommandRunner(Path.of(config.getDirectory()), config.getCommandTimeout()), config);
    }

    @Override
    public List<Change> detectChanges() {
        String status = git.run("status", "--porcelain=v1", "-z", "--untracked-files=all");
        Set<Change> changes = new LinkedHashSet<>();
        for (String path : statusPaths(status)) {
            parseSnapshotPath(path).ifPresentOrElse(changes::add,
                    () -> log.warn("Ignoring non-snapshot path in working tree: {}", path));
        }
        log.info("Detected {} changed snapshot file(s)", changes.size());
        return new ArrayList<>(changes);
    }

    /**
     * Paths of NUL-terminated {@code status --porcelain -z} records. Paths are
     * verbatim there; a rename or copy record carries its new path and is
     * followed by a record holding only the original path.
     */
    static List<String> statusPaths(String status) {
        List<String> paths = new ArrayList<>();
        String[] records = status.split("\0");
        for (int i = 0; i < records.length; i++) {
            String record = records[i];
            if (record.length() < 4) {
                continue;
            }
            paths.add(record.substring(3));
            if (isRenameOrCopy(record.charAt(0)) || isRenameOrCopy(record.charAt(1))) {
                i++;
            }
        }
        return paths;
    }

    @Override
    public void stagePath(String path) {
        git.run("--literal-pathspecs", "add", "--all", "--", path);
    }

    @Override
    public boolean hasPendingDiff(String path) {
        GitCommandRunner.Result result = git.runAllowingFailure(
                "--literal-pathspecs", "diff", "--cached", "--quiet", "--", path);
        return switch (result.exitCode()) {
            case 0 -> false;
            case 1 -> true;
            default -> throw new VersionControlException("git diff --cached failed for '%s': %s"
                    .formatted(path, result.output().trim()));
        };
    }

    @Override
    public String commit(String message) {
        List<String> args = new ArrayList<>();
        if (config.getAuthorName() != null && config.getAuthorEmail() != null) {
            args.addAll(List.of("-c", "user.name=" + config.getAuthorName(),
                    "-c", "user.email=" + config.getAuthorEmail()));
        }
        args.addAll(List.of("commit", "-m", message));
        git.run(args.toArray(new String[0]));
        return git.run("rev-parse", "HEAD").trim();
    }

    @Override
    public String diffLastCommit() {
        return git.run("show", "--format=", "--patch", "HEAD");
    }

    @Override
    public long commitsAheadOfRemote() {
        return parseCount(git.run("rev-list", "--count",
                config.getRemote() + "/" + config.getBranch() + "..HEAD"));
    }

    @Override
    public long totalCommitCount() {
        return parseCount(git.run("rev-list", "--count", "HEAD"));
    }

    @Override
    public void push() {
        git.run("push", config.getRemote(), "HEAD:" + config.getBranch());
    }

    private static boolean isRenameOrCopy(char status) {
        return status == 'R' || status == 'C';
    }

    static Optional<Change> parseSnapshotPath(String path) {
        String[] segments = path.split("/");
        if (segments.length != 3 || !segments[2].endsWith(SNAPSHOT_EXTENSION)) {
            return Optional.empty();
        }
        String projectId = segments[2].substring(0, segments[2].length() - SNAPSHOT_EXTENSION.length());
        if (segments[1].isEmpty() || projectId.isEmpty()) {
            return Optional.empty();
        }
        return Provider.fromDirectory(segments[0])
                .map(provider -> Change.of(provider, segments[1], projectId));
    }

    private static long parseCount(String output) {
        try {
            return Long.parseLong(output.trim());
        } catch (NumberFormatException e) {
            throw new VersionControlException("Unexpected commit count output: " + output.trim(), e);
        }
    }
}
