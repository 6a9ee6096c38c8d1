package com.z254.butterfly.drift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * DRIFT - Configuration Drift Attribution for the BUTTERFLY Ecosystem.
 *
 * <p>DRIFT provides:
 * <ul>
 *   <li>Change detection - Modified snapshot files in a Git working tree</li>
 *   <li>Attribution - Changers from GCP and Azure audit logs, human or automation</li>
 *   <li>Enrichment - Terraform runs and related tickets for automation changes</li>
 *   <li>Notification - Slack messages and Jira issues for committed changes</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class DriftApplication {

    public static void main(String[] args) {
        SpringApplication.run(DriftApplication.class, args);
    }
}
