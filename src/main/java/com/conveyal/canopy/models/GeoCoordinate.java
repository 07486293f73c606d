package com.conveyal.canopy.models;

/** A WGS84 latitude/longitude pair. */
public class GeoCoordinate {
    public final double latitude;
    public final double longitude;

    public GeoCoordinate (double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    @Override
    public boolean equals (Object other) {
        if (!(other instanceof GeoCoordinate)) return false;
        GeoCoordinate o = (GeoCoordinate) other;
        return Double.compare(latitude, o.latitude) == 0 && Double.compare(longitude, o.longitude) == 0;
    }

    @Override
    public int hashCode () {
        return 31 * Double.hashCode(latitude) + Double.hashCode(longitude);
    }

    @Override
    public String toString () {
        return String.format("(%.6f, %.6f)", latitude, longitude);
    }
}
