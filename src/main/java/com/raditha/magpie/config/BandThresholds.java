package com.raditha.magpie.config;

import com.raditha.magpie.model.Band;

/**
 * Cut points that map a combined score to a confidence band.
 * A score belongs to the strongest band whose cut point it reaches.
 *
 * @param critical Minimum score for CRITICAL
 * @param high     Minimum score for HIGH
 * @param medium   Minimum score for MEDIUM
 * @param low      Minimum score for LOW; anything below is NONE
 */
public record BandThresholds(
        double critical,
        double high,
        double medium,
        double low) {

    public BandThresholds {
        checkRange("critical", critical);
        checkRange("high", high);
        checkRange("medium", medium);
        checkRange("low", low);
        if (!(critical > high && high > medium && medium > low)) {
            throw new IllegalArgumentException(String.format(
                    "Band thresholds must be strictly decreasing (critical > high > medium > low), got %.2f, %.2f, %.2f, %.2f",
                    critical, high, medium, low));
        }
    }

    public static BandThresholds defaults() {
        return new BandThresholds(0.95, 0.80, 0.70, 0.60);
    }

    public Band classify(double score) {
        if (score >= critical) {
            return Band.CRITICAL;
        }
        if (score >= high) {
            return Band.HIGH;
        }
        if (score >= medium) {
            return Band.MEDIUM;
        }
        if (score >= low) {
            return Band.LOW;
        }
        return Band.NONE;
    }

    private static void checkRange(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " threshold must be between 0.0 and 1.0, got " + value);
        }
    }
}
