package com.z254.butterfly.drift.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for DRIFT service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Change attribution (scan interval, automation account and ticket patterns)</li>
 *     <li>Git working tree holding the configuration snapshots</li>
 *     <li>Audit log sources (GCP Cloud Logging, Azure Activity Log)</li>
 *     <li>Terraform run lookup</li>
 *     <li>Slack and Jira notifications</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "drift")
public class DriftProperties {

    /** Interval between scans, also the audit log and run relevance window */
    @NotNull
    @Positive
    private Integer scanIntervalMinutes;

    /** Anchored regex matched against the full changer identity */
    @NotBlank
    private String automationAccountPattern;

    /** Regex with a single capture group locating a ticket id in a run message */
    private String ticketPattern;

    /** Ticketing system base URL, ticket ids are appended to it */
    private String ticketBaseUrl;

    @Valid
    private final Git git = new Git();
    @Valid
    private final AuditLog auditLog = new AuditLog();
    private final Terraform terraform = new Terraform();
    private final Slack slack = new Slack();
    private final Jira jira = new Jira();
    private final Scheduler scheduler = new Scheduler();

    public boolean isTicketEnrichmentEnabled() {
        return hasText(ticketPattern) && hasText(ticketBaseUrl);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    /**
     * Git working tree configuration.
     */
    @Data
    public static class Git {
        @NotBlank
        private String directory = "config-snapshots";

        private String remote = "origin";

        private String branch = "master";

        /** Upper bound for a single git command */
        private Duration commandTimeout = Duration.ofMinutes(2);

        /** Optional commit author, git config is used when absent */
        private String authorName;
        private String authorEmail;
    }

    /**
     * Audit log sources.
     */
    @Data
    public static class AuditLog {
        /** Entries fetched per query, most recent first */
        @Positive
        private int pageSize = 6;

        /** Resource type name to provider audit log resource type, e.g. networks -> gce_network */
        private Map<String, String> resourceTypes = new HashMap<>();

        private final Gcp gcp = new Gcp();
        private final Azure azure = new Azure();

        public String logResourceTypeFor(String resourceType) {
            return resourceTypes.getOrDefault(resourceType, resourceType);
        }

        @Data
        public static class Gcp {
            private boolean enabled = true;
            private String baseUrl = "https://logging.googleapis.com";
            /** Static bearer token, the metadata server is used when absent */
            private String accessToken;
            private String metadataUrl = "http://metadata.google.internal/computeMetadata/v1/instance/service-accounts/default/token";
            private Duration timeout = Duration.ofSeconds(30);
        }

        @Data
        public static class Azure {
            private boolean enabled = true;
            private String baseUrl = "https://management.azure.com";
            private String apiVersion = "2015-04-01";
            /** Static bearer token, the instance metadata service is used when absent */
            private String accessToken;
            private String metadataUrl = "http://169.254.169.254/metadata/identity/oauth2/token";
            private String resource = "https://management.azure.com/";
            private Duration timeout = Duration.ofSeconds(30);
        }
    }

    /**
     * Terraform Cloud/Enterprise run lookup.
     */
    @Data
    public static class Terraform {
        /** Terraform instance URL, run lookup is disabled when absent */
        private String url;

        @Positive
        private int runLimit = 10;

        /** Changer login to Terraform organization and workspaces */
        private Map<String, WorkspaceMapping> serviceAccounts = new HashMap<>();

        /** Terraform organization to API token */
        private Map<String, String> orgTokens = new HashMap<>();

        /** JSON file with an organization to token object, merged over orgTokens */
        private String tokenFile;

        private Duration timeout = Duration.ofSeconds(30);

        @Data
        public static class WorkspaceMapping {
            private String org;
            private List<String> workspaces = new ArrayList<>();
        }
    }

    /**
     * Slack change notifications.
     */
    @Data
    public static class Slack {
        private boolean enabled = false;
        private String baseUrl = "https://slack.com/api";
        private String token;
        private String channelId;
        /** Base URL of repository commits, commit ids are appended to it */
        private String repoCommitUrl;
    }

    /**
     * Jira tickets for manual changes.
     */
    @Data
    public static class Jira {
        private boolean enabled = false;
        private String url;
        private String projectKey;
        private String issueType = "Task";
        private String username;
        private String token;
        /** Tickets are only created for project ids matching this regex */
        private String projectIdFilter;
        /** Additional issue fields sent as-is */
        private Map<String, Object> fields = new HashMap<>();
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
        /** Delay before the first scheduled cycle */
        private int initialDelayMinutes = 1;
    }
}
