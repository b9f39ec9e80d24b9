package com.navtracker.apy;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * APY calculation policy. Documented in application.yml under navtracker.apy.
 */
@ConfigurationProperties(prefix = "navtracker.apy")
@Getter
@Setter
public class ApyProperties {

    /**
     * Lookback window in days when the caller does not pass one (1 = compare with yesterday).
     */
    private int defaultPeriodDays = 1;

    /**
     * Absolute APY (percent) above which a result is flagged low confidence.
     */
    private double sanityCeilingPercent = 100.0;

    /**
     * Results are capped at this APY (percent); compounding short windows can otherwise overflow.
     */
    private double maxReportedApyPercent = 100_000.0;

    /**
     * A result is a statistical outlier when it is farther than this many MADs from the median of the other results.
     */
    private double outlierMadMultiplier = 5.0;

    /**
     * Floor for the MAD (percentage points) so near-identical peers do not flag tiny differences.
     */
    private double outlierMinDeviation = 1.0;

    /**
     * Minimum number of other results needed before the statistical outlier check applies.
     */
    private int outlierMinSample = 3;

    /**
     * Largest distance in calendar days between consecutive history points still counted as continuous.
     */
    private int maxGapDays = 1;

    /**
     * Number of most recent daily snapshots read when computing token price APYs.
     */
    private int tokenSnapshotLimit = 100;
}
