package com.z254.butterfly.drift.vcs;

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs git commands in a working tree and captures their combined output.
 */
@Slf4j
public class GitCommandRunner {

    private final Path workdir;
    private final Duration timeout;

    public GitCommandRunner(Path workdir, Duration timeout) {
        this.workdir = workdir;
        this.timeout = timeout != null && !timeout.isNegative() && !timeout.isZero()
                ? timeout
                : Duration.ofMinutes(2);
    }

    /**
     * Run a git command, failing on a non-zero exit code.
     */
    public String run(String... args) {
        Result result = runAllowingFailure(args);
        if (result.exitCode() != 0) {
            throw new VersionControlException("git %s failed: %s"
                    .formatted(String.join(" ", args), result.output().trim()));
        }
        return result.output();
    }

    /**
     * Run a git command and return its exit code with its output.
     */
    public Result runAllowingFailure(String... args) {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add("git");
        command.addAll(List.of(args));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.directory(workdir.toFile());
        builder.redirectErrorStream(true);
        builder.environment().put("GIT_TERMINAL_PROMPT", "0");
        builder.environment().putIfAbsent("LC_ALL", "C");

        log.debug("Running {} in {}", String.join(" ", command), workdir);
        try {
            Process process = builder.start();
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            Thread reader = new Thread(() -> {
                try (InputStream in = process.getInputStream()) {
                    in.transferTo(output);
                } catch (IOException ex) {
                    log.debug("Failed to read git output: {}", ex.getMessage());
                }
            }, "git-output-reader");
            reader.setDaemon(true);
            reader.start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                reader.join(TimeUnit.SECONDS.toMillis(5));
                throw new VersionControlException("git %s timed out after %d seconds"
                        .formatted(String.join(" ", args), timeout.toSeconds()));
            }
            reader.join(TimeUnit.SECONDS.toMillis(5));
            return new Result(process.exitValue(), output.toString(StandardCharsets.UTF_8));
        } catch (IOException ex) {
            throw new VersionControlException("Failed to start git " + String.join(" ", args), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new VersionControlException("git " + String.join(" ", args) + " interrupted", ex);
        }
    }

    public record Result(int exitCode, String output) {
    }
}
