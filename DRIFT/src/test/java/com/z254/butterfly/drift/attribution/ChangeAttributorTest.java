package com.z254.butterfly.drift.attribution;

import com.z254.butterfly.drift.audit.AuditLogCorrelator;
import com.z254.butterfly.drift.audit.AuditLogException;
import com.z254.butterfly.drift.automation.AutomationRunException;
import com.z254.butterfly.drift.automation.AutomationRunSource;
import com.z254.butterfly.drift.automation.UnknownChangerException;
import com.z254.butterfly.drift.config.DriftProperties;
import com.z254.butterfly.drift.domain.model.AttributionBatchResult;
import com.z254.butterfly.drift.domain.model.AuditLogEntry;
import com.z254.butterfly.drift.domain.model.AutomationRun;
import com.z254.butterfly.drift.domain.model.Change;
import com.z254.butterfly.drift.domain.model.Provider;
import com.z254.butterfly.drift.domain.model.RunStatus;
import com.z254.butterfly.drift.notify.NotificationDispatcher;
import com.z254.butterfly.drift.observability.DriftMetrics;
import com.z254.butterfly.drift.observability.DriftStructuredLogger;
import com.z254.butterfly.drift.vcs.VersionControl;
import com.z254.butterfly.drift.vcs.VersionControlException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ChangeAttributor}.
 */
@ExtendWith(MockitoExtension.class)
class ChangeAttributorTest {

    private static final Instant REFERENCE = Instant.parse("2024-03-01T12:00:00Z");
    private static final String NETWORK_FILE = "gcp/network/p1.yaml";

    @Mock
    private VersionControl versionControl;
    @Mock
    private AuditLogCorrelator auditLogCorrelator;
    @Mock
    private AutomationRunSource automationRunSource;
    @Mock
    private NotificationDispatcher notificationDispatcher;

    private DriftProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ChangeAttributor attributor;

    @BeforeEach
    void setUp() {
        properties = new DriftProperties();
        properties.setAutomationAccountPattern("^svc-.*");
        properties.setScanIntervalMinutes(30);
        meterRegistry = new SimpleMeterRegistry();
        attributor = newAttributor(new TicketExtractor("(TEST_\\d+)", "https://tickets.example.com/browse"),
                Optional.of(automationRunSource));
    }

    private ChangeAttributor newAttributor(TicketExtractor ticketExtractor,
                                           Optional<AutomationRunSource> runSource) {
        return new ChangeAttributor(versionControl, auditLogCorrelator,
                new ChangerClassifier(properties.getAutomationAccountPattern()), ticketExtractor,
                runSource, notificationDispatcher, properties, new DriftMetrics(meterRegistry),
                new DriftStructuredLogger(), Clock.fixed(REFERENCE.plusMillis(750), ZoneOffset.UTC));
    }

    private void givenCommittable(String path) {
        when(versionControl.hasPendingDiff(path)).thenReturn(true);
        when(versionControl.commit(anyString())).thenReturn("c0ffee");
        when(versionControl.diffLastCommit()).thenReturn("-a: 1\n+a: 2");
    }

    private static AuditLogEntry entry(String changer) {
        return AuditLogEntry.builder()
                .resourceName("projects/p1/global/networks/default")
                .resourceType("gce_network")
                .changer(changer)
                .timestamp(REFERENCE.minusSeconds(120))
                .methodName("v1.compute.networks.patch")
                .build();
    }

    private static AutomationRun run(String runId, RunStatus status, String message) {
        return AutomationRun.builder()
                .runId(runId)
                .status(status)
                .message(message)
                .applyTime(REFERENCE.minusSeconds(300))
                .organization("o")
                .workspace("w")
                .build();
    }

    @Nested
    @DisplayName("Attribution scenarios")
    class Scenarios {

        @Test
        void manualChangeIsMarkedAndNamesLogin() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30)).thenReturn(List.of(entry("alice@example.com")));
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            AttributionBatchResult result = attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage()).isEqualTo("Network updated in p1\n MANUAL change done by alice");
            assertThat(change.isManual()).isTrue();
            assertThat(change.getChangers()).containsExactly("alice");
            assertThat(change.getCommitId()).isEqualTo("c0ffee");
            assertThat(change.getDiff()).isEqualTo("-a: 1\n+a: 2");
            assertThat(result.getCommitted()).containsExactly(change);
            assertThat(result.getPushedCommits()).isEqualTo(1);
            verify(versionControl).commit("Network updated in p1\n MANUAL change done by alice");
            verify(notificationDispatcher).dispatch(change);
            verify(versionControl).push();
            verifyNoInteractions(automationRunSource);
        }

        @Test
        void automationChangeIsEnrichedWithRunAndTicket() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenReturn(List.of(entry("svc-terraform@proj.iam")));
            AutomationRun run = run("r1", RunStatus.APPLIED, "Apply TEST_99 network changes");
            when(automationRunSource.runsFor("svc-terraform", REFERENCE, 30)).thenReturn(List.of(run));
            when(automationRunSource.runUrl(run)).thenReturn("https://tf.example.com/app/o/workspaces/w/runs/r1");
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.isManual()).isFalse();
            assertThat(change.getMessage())
                    .startsWith("Network updated in p1\n Terraform change done by svc-terraform")
                    .contains("\n Related TF run https://tf.example.com/app/o/workspaces/w/runs/r1")
                    .endsWith("\n Related ticket https://tickets.example.com/browse/TEST-99");
        }

        @Test
        void noPendingDiffSkipsAuditQueryAndCommit() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            when(versionControl.hasPendingDiff(NETWORK_FILE)).thenReturn(false);
            when(versionControl.commitsAheadOfRemote()).thenReturn(0L);

            AttributionBatchResult result = attributor.process(List.of(change), REFERENCE);

            verify(versionControl).stagePath(NETWORK_FILE);
            verifyNoInteractions(auditLogCorrelator, notificationDispatcher);
            verify(versionControl, never()).commit(anyString());
            verify(versionControl, never()).push();
            assertThat(result.getSkipped()).isEqualTo(1);
            assertThat(result.getCommitted()).isEmpty();
            assertThat(meterRegistry.counter("drift.changes.skipped").count()).isEqualTo(1.0);
        }

        @Test
        void auditLogFailureDegradesToUnidentifiedChanger() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenThrow(new AuditLogException("connection refused"));
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            AttributionBatchResult result = attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage()).endsWith("Unable to identify changer");
            assertThat(change.isManual()).isFalse();
            assertThat(result.getCommittedCount()).isEqualTo(1);
            assertThat(meterRegistry.counter("drift.auditlog.failures").count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Changer handling")
    class Changers {

        @Test
        void noAuditEntriesLeavesChangeUnattributed() {
            Change change = Change.of(Provider.AZURE, "virtualNetworks", "sub-1");
            givenCommittable("azure/virtualNetworks/sub-1.yaml");
            when(auditLogCorrelator.correlate(change, REFERENCE, 30)).thenReturn(List.of());
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage()).isEqualTo("Virtualnetworks updated in sub-1\n Unable to identify changer");
            assertThat(change.isManual()).isFalse();
            assertThat(meterRegistry.counter("drift.changes.unattributed").count()).isEqualTo(1.0);
        }

        @Test
        void entriesWithoutChangerAreIgnored() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenReturn(List.of(entry(null), entry(""), entry("bob@example.com")));
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.getChangers()).containsExactly("bob");
            assertThat(change.getMessage()).isEqualTo("Network updated in p1\n MANUAL change done by bob");
        }

        @Test
        void repeatedChangerIsProcessedOnce() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30)).thenReturn(List.of(
                    entry("svc-terraform@proj.iam"), entry("svc-terraform@proj.iam"), entry("alice@example.com")));
            when(automationRunSource.runsFor("svc-terraform", REFERENCE, 30)).thenReturn(List.of());
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            verify(automationRunSource).runsFor("svc-terraform", REFERENCE, 30);
            assertThat(change.getChangers()).containsExactly("svc-terraform", "alice");
            assertThat(change.getMessage()).isEqualTo("Network updated in p1"
                    + "\n Terraform change done by svc-terraform"
                    + "\n MANUAL change done by alice");
            assertThat(change.isManual()).isTrue();
        }

        @Test
        void identityWithoutLoginIsRecordedAsUnknownUser() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenReturn(List.of(entry("@example.com"), entry("@example.com")));
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage())
                    .isEqualTo("Network updated in p1\n Change done by unknown user '@example.com'");
            assertThat(change.getChangers()).containsExactly("@example.com");
            assertThat(change.isManual()).isFalse();
        }

        @Test
        void automationPatternIsMatchedAgainstFullIdentity() {
            properties.setAutomationAccountPattern(".*@automation\\.iam$");
            attributor = newAttributor(new TicketExtractor(null, null), Optional.empty());
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenReturn(List.of(entry("deployer@automation.iam")));
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.isManual()).isFalse();
            assertThat(change.getMessage()).isEqualTo("Network updated in p1\n Terraform change done by deployer");
        }
    }

    @Nested
    @DisplayName("Automation run enrichment")
    class AutomationRuns {

        @Test
        void unknownServiceAccountOnlyAddsAutomationNote() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenReturn(List.of(entry("svc-other@proj.iam")));
            when(automationRunSource.runsFor("svc-other", REFERENCE, 30))
                    .thenThrow(new UnknownChangerException("svc-other"));
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage()).isEqualTo("Network updated in p1\n Terraform change done by svc-other");
            assertThat(meterRegistry.counter("drift.automation.failures").count()).isEqualTo(1.0);
        }

        @Test
        void runLookupFailureMovesToNextEntry() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30)).thenReturn(List.of(
                    entry("svc-a@proj.iam"), entry("svc-b@proj.iam")));
            when(automationRunSource.runsFor("svc-a", REFERENCE, 30))
                    .thenThrow(new AutomationRunException("Issue getting workspace ID for workspace w"));
            AutomationRun run = run("r2", RunStatus.ERRORED, "no ticket here");
            when(automationRunSource.runsFor("svc-b", REFERENCE, 30)).thenReturn(List.of(run));
            when(automationRunSource.runUrl(run)).thenReturn("https://tf/app/o/workspaces/w/runs/r2");
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage()).isEqualTo("Network updated in p1"
                    + "\n Terraform change done by svc-a"
                    + "\n Terraform change done by svc-b"
                    + "\n Related TF run https://tf/app/o/workspaces/w/runs/r2");
        }

        @Test
        void irrelevantRunsAreNotLinked() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenReturn(List.of(entry("svc-terraform@proj.iam")));
            when(automationRunSource.runsFor("svc-terraform", REFERENCE, 30))
                    .thenReturn(List.of(run("r3", RunStatus.DISCARDED, "TEST_1")));
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage()).doesNotContain("Related");
        }

        @Test
        void ticketExtractionIsSkippedWhenNotConfigured() {
            attributor = newAttributor(new TicketExtractor("(TEST_\\d+)", null), Optional.of(automationRunSource));
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenReturn(List.of(entry("svc-terraform@proj.iam")));
            AutomationRun run = run("r1", RunStatus.APPLIED, "TEST_1234");
            when(automationRunSource.runsFor("svc-terraform", REFERENCE, 30)).thenReturn(List.of(run));
            when(automationRunSource.runUrl(run)).thenReturn("https://tf/app/o/workspaces/w/runs/r1");
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage()).contains("Related TF run").doesNotContain("Related ticket");
        }

        @Test
        void ticketUnderscoreBecomesHyphen() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30))
                    .thenReturn(List.of(entry("svc-terraform@proj.iam")));
            AutomationRun run = run("r1", RunStatus.APPLIED, "Merge branch TEST_1234");
            when(automationRunSource.runsFor("svc-terraform", REFERENCE, 30)).thenReturn(List.of(run));
            when(automationRunSource.runUrl(run)).thenReturn("https://tf/app/o/workspaces/w/runs/r1");
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change), REFERENCE);

            assertThat(change.getMessage()).endsWith("/TEST-1234");
        }
    }

    @Nested
    @DisplayName("Failures and push")
    class FailuresAndPush {

        @Test
        void stagingFailureAbortsBatchKeepingEarlierCommits() {
            Change first = Change.of(Provider.GCP, "network", "p1");
            Change second = Change.of(Provider.GCP, "network", "p2");
            Change third = Change.of(Provider.GCP, "network", "p3");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(first, REFERENCE, 30)).thenReturn(List.of());
            doThrow(new VersionControlException("index.lock exists"))
                    .when(versionControl).stagePath("gcp/network/p2.yaml");

            assertThatThrownBy(() -> attributor.process(List.of(first, second, third), REFERENCE))
                    .isInstanceOf(ChangeAttributionException.class)
                    .hasMessage("Issue adding file 'gcp/network/p2.yaml' in Git")
                    .hasCauseInstanceOf(VersionControlException.class);

            assertThat(first.getCommitId()).isEqualTo("c0ffee");
            verify(versionControl, never()).stagePath("gcp/network/p3.yaml");
            verify(versionControl, never()).push();
            assertThat(meterRegistry.counter("drift.batches.failed").count()).isEqualTo(1.0);
        }

        @Test
        void commitFailureIsFatal() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            when(versionControl.hasPendingDiff(NETWORK_FILE)).thenReturn(true);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30)).thenReturn(List.of());
            when(versionControl.commit(anyString())).thenThrow(new VersionControlException("nothing to commit"));

            assertThatThrownBy(() -> attributor.process(List.of(change), REFERENCE))
                    .isInstanceOf(ChangeAttributionException.class)
                    .hasMessageContaining(NETWORK_FILE);
            verifyNoInteractions(notificationDispatcher);
        }

        @Test
        void pendingDiffCheckFailureTreatsFileAsChanged() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            when(versionControl.hasPendingDiff(NETWORK_FILE)).thenThrow(new VersionControlException("bad revision"));
            when(auditLogCorrelator.correlate(change, REFERENCE, 30)).thenReturn(List.of());
            when(versionControl.commit(anyString())).thenReturn("c0ffee");
            when(versionControl.diffLastCommit()).thenReturn("");
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            AttributionBatchResult result = attributor.process(List.of(change), REFERENCE);

            assertThat(result.getCommittedCount()).isEqualTo(1);
        }

        @Test
        void pushFallsBackToTotalCommitCount() {
            when(versionControl.commitsAheadOfRemote()).thenThrow(new VersionControlException("unknown revision"));
            when(versionControl.totalCommitCount()).thenReturn(3L);

            AttributionBatchResult result = attributor.process(List.of(), REFERENCE);

            assertThat(result.getPushedCommits()).isEqualTo(3);
            verify(versionControl).push();
        }

        @Test
        void pushAssumesOneCommitWhenCountingFails() {
            when(versionControl.commitsAheadOfRemote()).thenThrow(new VersionControlException("unknown revision"));
            when(versionControl.totalCommitCount()).thenThrow(new VersionControlException("no HEAD"));

            AttributionBatchResult result = attributor.process(List.of(), REFERENCE);

            assertThat(result.getPushedCommits()).isEqualTo(1);
            verify(versionControl).push();
        }

        @Test
        void pushFailureIsFatal() {
            when(versionControl.commitsAheadOfRemote()).thenReturn(2L);
            doThrow(new VersionControlException("rejected"))
                    .when(versionControl).push();

            assertThatThrownBy(() -> attributor.process(List.of(), REFERENCE))
                    .isInstanceOf(ChangeAttributionException.class)
                    .hasMessage("Issue pushing changes to Git remote");
        }

        @Test
        void changesAreCommittedInDetectionOrder() {
            Change first = Change.of(Provider.GCP, "network", "p1");
            Change second = Change.of(Provider.AZURE, "subnets", "s1");
            givenCommittable(NETWORK_FILE);
            when(versionControl.hasPendingDiff("azure/subnets/s1.yaml")).thenReturn(true);
            when(auditLogCorrelator.correlate(any(Change.class), eq(REFERENCE), anyInt())).thenReturn(List.of());
            when(versionControl.commitsAheadOfRemote()).thenReturn(2L);

            attributor.process(List.of(first, second), REFERENCE);

            InOrder order = inOrder(versionControl, notificationDispatcher);
            order.verify(versionControl).stagePath(NETWORK_FILE);
            order.verify(versionControl).commit("Network updated in p1\n Unable to identify changer");
            order.verify(notificationDispatcher).dispatch(first);
            order.verify(versionControl).stagePath("azure/subnets/s1.yaml");
            order.verify(versionControl).commit("Subnets updated in s1\n Unable to identify changer");
            order.verify(notificationDispatcher).dispatch(second);
            order.verify(versionControl).push();
        }

        @Test
        void missingReferenceTimeUsesCurrentSecond() {
            Change change = Change.of(Provider.GCP, "network", "p1");
            givenCommittable(NETWORK_FILE);
            when(auditLogCorrelator.correlate(change, REFERENCE, 30)).thenReturn(List.of());
            when(versionControl.commitsAheadOfRemote()).thenReturn(1L);

            attributor.process(List.of(change));

            verify(auditLogCorrelator).correlate(change, REFERENCE, 30);
        }
    }

    @Test
    void titleCaseCapitalizesEveryWord() {
        assertThat(ChangeAttributor.titleCase("network")).isEqualTo("Network");
        assertThat(ChangeAttributor.titleCase("vpn_gateways")).isEqualTo("Vpn_Gateways");
        assertThat(ChangeAttributor.titleCase("firewallRules")).isEqualTo("Firewallrules");
    }
}
