package com.conveyal.canopy.geometry;

import com.google.common.collect.ImmutableMap;

import java.util.Locale;
import java.util.Map;

/**
 * Street traffic classes, from quietest to busiest. Each tier is buffered by its own distance before rasterizing the
 * street mask, so a motorway excludes a much wider corridor from planting than a footpath.
 */
public enum TrafficTier {
    PEDESTRIAN,
    LOW,
    MEDIUM,
    HIGH;

    // OSM highway values. Anything else, including a missing tag, is treated as a low traffic street.
    private static final Map<String, TrafficTier> HIGHWAY_CLASSES = ImmutableMap.<String, TrafficTier>builder()
            .put("footway", PEDESTRIAN)
            .put("pedestrian", PEDESTRIAN)
            .put("path", PEDESTRIAN)
            .put("steps", PEDESTRIAN)
            .put("cycleway", PEDESTRIAN)
            .put("corridor", PEDESTRIAN)
            .put("bridleway", PEDESTRIAN)
            .put("residential", LOW)
            .put("living_street", LOW)
            .put("service", LOW)
            .put("unclassified", LOW)
            .put("track", LOW)
            .put("road", LOW)
            .put("tertiary", MEDIUM)
            .put("tertiary_link", MEDIUM)
            .put("secondary", MEDIUM)
            .put("secondary_link", MEDIUM)
            .put("primary", HIGH)
            .put("primary_link", HIGH)
            .put("trunk", HIGH)
            .put("trunk_link", HIGH)
            .put("motorway", HIGH)
            .put("motorway_link", HIGH)
            .build();

    public static TrafficTier classify (String highwayClass) {
        if (highwayClass == null) return LOW;
        TrafficTier tier = HIGHWAY_CLASSES.get(highwayClass.trim().toLowerCase(Locale.ROOT));
        return tier == null ? LOW : tier;
    }

    /** Whether streets of this tier are considered to have walkable frontage, and so contribute to the sidewalk mask. */
    public boolean hasSidewalk () {
        return this == PEDESTRIAN || this == LOW;
    }
}
