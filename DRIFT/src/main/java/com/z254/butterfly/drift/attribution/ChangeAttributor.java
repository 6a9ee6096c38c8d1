package com.z254.butterfly.drift.attribution;

import com.z254.butterfly.drift.audit.AuditLogCorrelator;
import com.z254.butterfly.drift.automation.AutomationRunException;
import com.z254.butterfly.drift.automation.AutomationRunSource;
import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.AttributionBatchResult;
import com.z254.butterfly.drift.domain.model.AuditLogEntry;
import com.z254.butterfly.drift.domain.model.AutomationRun;
import com.z254.butterfly.drift.domain.model.Change;
import com.z254.butterfly.drift.notify.NotificationDispatcher;
import com.z254.butterfly.drift.observability.DriftMetrics;
import com.z254.butterfly.drift.observability.DriftStructuredLogger;
import com.z254.butterfly.drift.observability.DriftStructuredLogger.ChangeEventType;
import com.z254.butterfly.drift.vcs.VersionControl;
import com.z254.butterfly.drift.vcs.VersionControlException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Attributes drifted snapshot files to their changers and records each one as
 * a commit.
 * <p>
 * Changes are processed strictly in order, one commit per change. Staging,
 * committing and pushing failures abort the batch with a
 * {@link ChangeAttributionException}; commits made before the failure stay.
 * Audit log, automation run and notification failures only reduce the detail
 * of the commit message.
 */
@Slf4j
@Service
public class ChangeAttributor {

    static final String MANUAL_NOTE = "\n MANUAL change done by ";
    static final String AUTOMATION_NOTE = "\n Terraform change done by ";
    static final String RUN_NOTE = "\n Related TF run ";
    static final String TICKET_NOTE = "\n Related ticket ";
    static final String UNIDENTIFIED_NOTE = "\n Unable to identify changer";
    static final String UNKNOWN_USER_NOTE = "\n Change done by unknown user ";

    private final VersionControl versionControl;
    private final AuditLogCorrelator auditLogCorrelator;
    private final ChangerClassifier changerClassifier;
    private final TicketExtractor ticketExtractor;
    private final AutomationRunSource automationRunSource;
    private final NotificationDispatcher notificationDispatcher;
    private final DriftProperties driftProperties;
    private final DriftMetrics metrics;
    private final DriftStructuredLogger structuredLogger;
    private final Clock clock;

    public ChangeAttributor(VersionControl versionControl,
                            AuditLogCorrelator auditLogCorrelator,
                            ChangerClassifier changerClassifier,
                            TicketExtractor ticketExtractor,
                            Optional<AutomationRunSource> automationRunSource,
                            NotificationDispatcher notificationDispatcher,
                            DriftProperties driftProperties,
                            DriftMetrics metrics,
                            DriftStructuredLogger structuredLogger,
                            Clock clock) {
        this.versionControl = versionControl;
        this.auditLogCorrelator = auditLogCorrelator;
        this.changerClassifier = changerClassifier;
        this.ticketExtractor = ticketExtractor;
        this.automationRunSource = automationRunSource.orElse(null);
        this.notificationDispatcher = notificationDispatcher;
        this.driftProperties = driftProperties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        if (this.automationRunSource == null) {
            log.info("No automation run source configured, automation changes are not enriched");
        }
    }

    public AttributionBatchResult process(List<Change> changes) {
        return process(changes, null);
    }

    /**
     * Attribute, commit and notify each change, then push the new commits.
     *
     * @param changes detected changes, processed in list order
     * @param referenceTime time the changes are looked up from; the current
     *                      time truncated to seconds when null
     * @throws ChangeAttributionException when staging, committing or pushing fails
     */
    public AttributionBatchResult process(List<Change> changes, Instant referenceTime) {
        String batchId = UUID.randomUUID().toString();
        Instant started = clock.instant();
        AttributionBatchResult result = AttributionBatchResult.builder()
                .batchId(batchId)
                .referenceTime(referenceTime)
                .detected(changes.size())
                .build();

        try (var scope = structuredLogger.withBatchId(batchId)) {
            structuredLogger.logChangeEvent(ChangeEventType.BATCH_STARTED, "Attribution batch started",
                    Map.of("changes", changes.size()));
            try {
                for (Change change : changes) {
                    processChange(change, referenceTime, result);
                }
                result.setPushedCommits(pushPendingCommits());
            } catch (ChangeAttributionException e) {
                metrics.getBatchesFailed().increment();
                structuredLogger.logChangeEvent(ChangeEventType.BATCH_FAILED, e.getMessage(), Map.of(
                        "committed", result.getCommittedCount(),
                        "skipped", result.getSkipped()));
                throw e;
            }
            structuredLogger.logChangeEvent(ChangeEventType.BATCH_COMPLETED, "Attribution batch completed", Map.of(
                    "detected", result.getDetected(),
                    "committed", result.getCommittedCount(),
                    "skipped", result.getSkipped(),
                    "pushed", result.getPushedCommits()));
            return result;
        } finally {
            metrics.recordBatchDuration(Duration.between(started, clock.instant()));
        }
    }

    private void processChange(Change change, Instant referenceTime, AttributionBatchResult result) {
        String path = change.filePath();
        try (var scope = structuredLogger.withContext(Map.of(
                DriftStructuredLogger.MDC_CHANGE_FILE, path,
                DriftStructuredLogger.MDC_PROVIDER, change.getProvider().getDirectory()))) {

            try {
                versionControl.stagePath(path);
            } catch (VersionControlException e) {
                throw new ChangeAttributionException("Issue adding file '" + path + "' in Git", e);
            }

            if (!hasPendingDiff(path)) {
                result.setSkipped(result.getSkipped() + 1);
                metrics.getChangesSkipped().increment();
                structuredLogger.logChangeEvent(ChangeEventType.SKIPPED,
                        "No difference for detected change, skipping", Map.of("file", path));
                return;
            }

            Instant reference = referenceTime != null ? referenceTime : now();
            attribute(change, reference);

            try {
                change.setCommitId(versionControl.commit(change.getMessage()));
            } catch (VersionControlException e) {
                throw new ChangeAttributionException("Issue committing file '" + path + "' in Git", e);
            }
            change.setDiff(lastCommitDiff(path));
            result.getCommitted().add(change);
            metrics.getChangesCommitted().increment();
            structuredLogger.logChangeEvent(ChangeEventType.COMMITTED, "Change committed", Map.of(
                    "file", path,
                    "commitId", change.getCommitId(),
                    "manual", change.isManual(),
                    "changers", String.join(",", change.getChangers())));

            notificationDispatcher.dispatch(change);
        }
    }

    /**
     * Build the commit message of a change from its audit log entries.
     */
    void attribute(Change change, Instant referenceTime) {
        StringBuilder message = new StringBuilder(header(change));
        int window = driftProperties.getScanIntervalMinutes();

        for (AuditLogEntry entry : auditLogEntries(change, referenceTime, window)) {
            if (!entry.hasChanger()) {
                log.info("Missing changer in audit log entry for change {}: {}", change.filePath(), entry);
                continue;
            }

            String identity = entry.getChanger();
            Optional<ChangerClassifier.Classification> classification = changerClassifier.classify(identity);
            if (classification.isEmpty()) {
                log.warn("Issue retrieving changer login from '{}'", identity);
                if (change.addChanger(identity)) {
                    message.append(UNKNOWN_USER_NOTE).append('\'').append(identity).append('\'');
                }
                continue;
            }

            String login = classification.get().login();
            if (!change.addChanger(login)) {
                log.debug("Skipping lookup for already seen changer '{}'", login);
                continue;
            }

            if (classification.get().manual()) {
                change.setManual(true);
                log.info("Manual change performed by '{}' detected", login);
                message.append(MANUAL_NOTE).append(login);
            } else {
                message.append(AUTOMATION_NOTE).append(login);
                appendAutomationContext(message, login, referenceTime, window);
            }
        }

        if (change.getChangers().isEmpty()) {
            message.append(UNIDENTIFIED_NOTE);
            metrics.getUnattributedChanges().increment();
            structuredLogger.logChangeEvent(ChangeEventType.UNATTRIBUTED, "Unable to identify changer",
                    Map.of("file", change.filePath()));
        } else {
            if (change.isManual()) {
                metrics.getManualChanges().increment();
            }
            structuredLogger.logChangeEvent(ChangeEventType.ATTRIBUTED, "Changer identified", Map.of(
                    "file", change.filePath(),
                    "manual", change.isManual(),
                    "changers", String.join(",", change.getChangers())));
        }
        change.setMessage(message.toString());
    }

    private List<AuditLogEntry> auditLogEntries(Change change, Instant referenceTime, int window) {
        try {
            return auditLogCorrelator.correlate(change, referenceTime, window);
        } catch (RuntimeException e) {
            metrics.getAuditLogFailures().increment();
            structuredLogger.logChangeEvent(ChangeEventType.AUDIT_LOG_FAILED, "Issue getting audit log entries",
                    Map.of("file", change.filePath(), "error", String.valueOf(e.getMessage())));
            return Collections.emptyList();
        }
    }

    private void appendAutomationContext(StringBuilder message, String login, Instant referenceTime, int window) {
        if (automationRunSource == null) {
            return;
        }
        List<AutomationRun> runs;
        try {
            log.info("Retrieving automation runs for service account '{}'", login);
            runs = automationRunSource.runsFor(login, referenceTime, window);
        } catch (AutomationRunException e) {
            metrics.getAutomationRunFailures().increment();
            structuredLogger.logChangeEvent(ChangeEventType.AUTOMATION_LOOKUP_FAILED,
                    "Issue retrieving automation runs", Map.of("login", login, "error", String.valueOf(e.getMessage())));
            return;
        }

        for (AutomationRun run : runs) {
            if (!run.isChangeRelevant()) {
                continue;
            }
            message.append(RUN_NOTE).append(automationRunSource.runUrl(run));
            if (ticketExtractor.isEnabled()) {
                ticketExtractor.extractTicketUrl(run.getMessage())
                        .ifPresent(url -> message.append(TICKET_NOTE).append(url));
            }
        }
    }

    private boolean hasPendingDiff(String path) {
        try {
            return versionControl.hasPendingDiff(path);
        } catch (VersionControlException e) {
            log.warn("Issue checking pending diff for '{}', treating it as changed: {}", path, e.getMessage());
            return true;
        }
    }

    private String lastCommitDiff(String path) {
        try {
            return versionControl.diffLastCommit();
        } catch (VersionControlException e) {
            log.warn("Issue getting diff of commit for '{}': {}", path, e.getMessage());
            return "";
        }
    }

    /**
     * Push local commits; the pending count falls back to the total commit
     * count and then to one when the remote cannot be compared.
     */
    private long pushPendingCommits() {
        long pending;
        try {
            pending = versionControl.commitsAheadOfRemote();
        } catch (VersionControlException e) {
            log.warn("Issue counting commits ahead of remote: {}", e.getMessage());
            try {
                pending = versionControl.totalCommitCount();
            } catch (VersionControlException e2) {
                log.warn("Issue counting commits, assuming one pending commit: {}", e2.getMessage());
                pending = 1;
            }
        }
        if (pending == 0) {
            log.debug("No commits to push");
            return 0;
        }
        try {
            versionControl.push();
        } catch (VersionControlException e) {
            throw new ChangeAttributionException("Issue pushing changes to Git remote", e);
        }
        metrics.recordCommitsPushed(pending);
        structuredLogger.logChangeEvent(ChangeEventType.PUSHED, "Commits pushed", Map.of("commits", pending));
        return pending;
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.SECONDS);
    }

    static String header(Change change) {
        return titleCase(change.getResourceType()) + " updated in " + change.getProjectId();
    }

    /**
     * Upper-case the first letter of every run of letters and lower-case the rest.
     */
    static String titleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean previousLetter = false;
        for (char c : value.toCharArray()) {
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }
}
