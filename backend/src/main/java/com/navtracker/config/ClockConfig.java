package com.navtracker.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Reference clock. Its zone decides which calendar day a refresh belongs to.
 */
@Configuration
@EnableConfigurationProperties({ SnapshotProperties.class, RefreshProperties.class })
public class ClockConfig {

    @Bean
    public Clock referenceClock(SnapshotProperties snapshotProperties) {
        return Clock.system(ZoneId.of(snapshotProperties.getReferenceZone()));
    }
}
