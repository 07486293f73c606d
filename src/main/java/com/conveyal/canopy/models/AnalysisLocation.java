package com.conveyal.canopy.models;

/**
 * Identifies the place a raster and its map features were acquired for. Inputs and results of a batch are keyed by
 * this descriptor.
 */
public class AnalysisLocation {
    public final String name;
    public final double latitude;
    public final double longitude;
    public final String description;

    public AnalysisLocation (String name, double latitude, double longitude) {
        this(name, latitude, longitude, null);
    }

    public AnalysisLocation (String name, double latitude, double longitude, String description) {
        this.name = name;
        this.latitude = latitude;
        this.longitude = longitude;
        this.description = description;
    }

    @Override
    public String toString () {
        return String.format("%s (%.6f, %.6f)", name, latitude, longitude);
    }
}
