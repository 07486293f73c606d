package com.conveyal.canopy.models;

import com.conveyal.canopy.PlantabilityException;
import com.conveyal.canopy.geometry.LocalProjection;

/**
 * A geographic bounding box in WGS84 degrees. Construction fails on inverted or degenerate boxes, since every pixel to
 * geographic conversion divides by the extent.
 */
public class GeoBounds {
    public final double north, east, south, west;

    public GeoBounds (double north, double east, double south, double west) {
        if (!isFinite(north) || !isFinite(east) || !isFinite(south) || !isFinite(west)) {
            throw PlantabilityException.precondition("Bounding box coordinates must be finite.");
        }
        if (north <= south || east <= west) {
            throw PlantabilityException.precondition(String.format(
                    "Bounding box is inverted or degenerate: north %f south %f east %f west %f", north, south, east, west));
        }
        if (north > 90 || south < -90 || east > 180 || west < -180) {
            throw PlantabilityException.precondition("Bounding box lies outside WGS84 coordinate ranges.");
        }
        this.north = north;
        this.east = east;
        this.south = south;
        this.west = west;
    }

    /**
     * The box covered by an image of the given pixel dimensions centered on a point, at a known ground resolution.
     * This is how bounds are derived for static map imagery requested by center and zoom.
     */
    public static GeoBounds aroundCenter (double lat, double lon, int width, int height, double metersPerPixel) {
        LocalProjection projection = new LocalProjection(lat, lon);
        double halfWidthMeters = width * metersPerPixel / 2;
        double halfHeightMeters = height * metersPerPixel / 2;
        return new GeoBounds(
                projection.latitude(halfHeightMeters),
                projection.longitude(halfWidthMeters),
                projection.latitude(-halfHeightMeters),
                projection.longitude(-halfWidthMeters)
        );
    }

    public double centerLat () {
        return (north + south) / 2;
    }

    public double centerLon () {
        return (east + west) / 2;
    }

    public boolean contains (double lat, double lon) {
        return lat >= south && lat <= north && lon >= west && lon <= east;
    }

    private static boolean isFinite (double d) {
        return !Double.isNaN(d) && !Double.isInfinite(d);
    }

    @Override
    public boolean equals (Object other) {
        if (!GeoBounds.class.isInstance(other)) return false;
        GeoBounds o = (GeoBounds) other;
        // Exact, with 0.0 and -0.0 distinct as in hashCode.
        return Double.compare(north, o.north) == 0 && Double.compare(east, o.east) == 0 &&
                Double.compare(south, o.south) == 0 && Double.compare(west, o.west) == 0;
    }

    public boolean equals (Object other, double tolerance) {
        if (!GeoBounds.class.isInstance(other)) return false;
        GeoBounds o = (GeoBounds) other;
        return Math.abs(north - o.north) <= tolerance && Math.abs(east - o.east) <= tolerance &&
                Math.abs(south - o.south) <= tolerance && Math.abs(west - o.west) <= tolerance;
    }

    @Override
    public int hashCode () {
        int result = Double.hashCode(north);
        result = 31 * result + Double.hashCode(east);
        result = 31 * result + Double.hashCode(south);
        return 31 * result + Double.hashCode(west);
    }

    @Override
    public String toString () {
        return String.format("[N %.6f E %.6f S %.6f W %.6f]", north, east, south, west);
    }
}
