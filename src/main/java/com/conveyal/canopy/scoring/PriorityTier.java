package com.conveyal.canopy.scoring;

import com.conveyal.canopy.PlantabilityConfig;

import java.util.Locale;

/** Ordered priority bands a plantable pixel's score falls into, most urgent first. */
public enum PriorityTier {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    public static PriorityTier classify (double score, PlantabilityConfig config) {
        if (score >= config.criticalCutoff) return CRITICAL;
        if (score >= config.highCutoff) return HIGH;
        if (score >= config.mediumCutoff) return MEDIUM;
        return LOW;
    }

    public String label () {
        return name().toLowerCase(Locale.ROOT);
    }
}
