package com.navtracker.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Snapshot day boundary and portfolio performance inputs. Documented in application.yml under navtracker.snapshot.
 */
@ConfigurationProperties(prefix = "navtracker.snapshot")
@Getter
@Setter
public class SnapshotProperties {

    /**
     * Zone whose calendar days bucket snapshots and position history (e.g. UTC, America/New_York).
     */
    private String referenceZone = "UTC";

    /**
     * Annual risk-free rate (fraction) subtracted in the Sharpe ratio of portfolio performance.
     */
    private double riskFreeRate = 0.05;
}
