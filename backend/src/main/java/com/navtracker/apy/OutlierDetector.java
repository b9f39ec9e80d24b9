package com.navtracker.apy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Median / median-absolute-deviation test of one value against its peers.
 */
final class OutlierDetector {

    private final double madMultiplier;
    private final double minDeviation;
    private final int minSample;

    OutlierDetector(double madMultiplier, double minDeviation, int minSample) {
        this.madMultiplier = madMultiplier;
        this.minDeviation = minDeviation;
        this.minSample = minSample;
    }

    /**
     * True when {@code value} is farther than multiplier × max(MAD, minDeviation) from the median of {@code peers}.
     * Always false with fewer than minSample peers.
     */
    boolean isOutlier(double value, List<Double> peers) {
        if (peers.size() < minSample) {
            return false;
        }
        double median = median(peers);
        List<Double> deviations = new ArrayList<>(peers.size());
        for (double peer : peers) {
            deviations.add(Math.abs(peer - median));
        }
        double mad = Math.max(median(deviations), minDeviation);
        return Math.abs(value - median) > madMultiplier * mad;
    }

    static double median(List<Double> values) {
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        int n = sorted.size();
        if (n == 0) {
            return 0.0;
        }
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2.0;
    }
}
