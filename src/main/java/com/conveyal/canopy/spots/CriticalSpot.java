package com.conveyal.canopy.spots;

import com.conveyal.canopy.models.GeoCoordinate;
import com.conveyal.canopy.raster.PixelCoordinate;

/**
 * A connected region of critical priority pixels, summarized as one representative point with its size and score.
 */
public class CriticalSpot {

    /** Unique within one run, numbered from 1 in raster scan order of each region's first pixel. */
    public final int id;

    public final PixelCoordinate pixelCentroid;

    public final GeoCoordinate coordinate;

    /** Mean final score over the region's pixels. */
    public final double meanScore;

    public final int pixelCount;

    public final double areaSquareMeters;

    public CriticalSpot (int id, PixelCoordinate pixelCentroid, GeoCoordinate coordinate, double meanScore,
                         int pixelCount, double areaSquareMeters) {
        this.id = id;
        this.pixelCentroid = pixelCentroid;
        this.coordinate = coordinate;
        this.meanScore = meanScore;
        this.pixelCount = pixelCount;
        this.areaSquareMeters = areaSquareMeters;
    }

    @Override
    public String toString () {
        return String.format("Spot %d at %s, score %.1f over %d pixels", id, coordinate, meanScore, pixelCount);
    }
}
