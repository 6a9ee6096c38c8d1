package com.z254.butterfly.drift.config;

import com.z254.butterfly.drift.vcs.GitCliVersionControl;
import com.z254.butterfly.drift.vcs.VersionControl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Infrastructure beans for DRIFT service.
 */
@Slf4j
@Configuration
public class DriftConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean(VersionControl.class)
    public VersionControl versionControl(DriftProperties driftProperties) {
        DriftProperties.Git git = driftProperties.getGit();
        log.info("Using Git working tree {} (remote={}, branch={})",
                git.getDirectory(), git.getRemote(), git.getBranch());
        return new GitCliVersionControl(git);
    }
}
