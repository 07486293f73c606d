package com.conveyal.canopy.features;

import com.conveyal.canopy.raster.BooleanGrid;
import com.conveyal.canopy.raster.FloatGrid;

/**
 * What can be read from the color channels of a raster alone: where vegetation is, where shadows are, and how shaded
 * each pixel is on a continuous scale.
 */
public class DetectedFeatures {

    public final BooleanGrid vegetation;

    public final BooleanGrid shadow;

    /** 0 is full sun, 1 is full shade. Smoothed, and distinct from the binary shadow mask. */
    public final FloatGrid shadowIntensity;

    /** Green-red normalized difference, in [-1, 1]. */
    public final FloatGrid ndvi;

    public DetectedFeatures (BooleanGrid vegetation, BooleanGrid shadow, FloatGrid shadowIntensity, FloatGrid ndvi) {
        int width = vegetation.width;
        int height = vegetation.height;
        shadow.checkShape(width, height, "Shadow mask");
        shadowIntensity.checkShape(width, height, "Shadow intensity");
        ndvi.checkShape(width, height, "NDVI grid");
        this.vegetation = vegetation;
        this.shadow = shadow;
        this.shadowIntensity = shadowIntensity;
        this.ndvi = ndvi;
    }
}
