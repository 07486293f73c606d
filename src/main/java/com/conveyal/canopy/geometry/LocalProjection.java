package com.conveyal.canopy.geometry;

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;

/**
 * A locally planar metric coordinate system centered on a point: x is meters east of the center, y is meters north.
 * This is an equirectangular approximation, which is accurate to well under a pixel over the few hundred meters a
 * single satellite tile covers, and it keeps buffer distances and pixel distances in the same units.
 */
public class LocalProjection {

    /** WGS84 equatorial radius. */
    public static final double EARTH_RADIUS_METERS = 6_378_137;

    public static final double METERS_PER_DEGREE_LAT = EARTH_RADIUS_METERS * Math.PI / 180;

    public final double centerLat;

    public final double centerLon;

    private final double metersPerDegreeLon;

    public LocalProjection (double centerLat, double centerLon) {
        this.centerLat = centerLat;
        this.centerLon = centerLon;
        this.metersPerDegreeLon = METERS_PER_DEGREE_LAT * Math.cos(Math.toRadians(centerLat));
    }

    public double x (double lon) {
        return (lon - centerLon) * metersPerDegreeLon;
    }

    public double y (double lat) {
        return (lat - centerLat) * METERS_PER_DEGREE_LAT;
    }

    public double longitude (double x) {
        return centerLon + x / metersPerDegreeLon;
    }

    public double latitude (double y) {
        return centerLat + y / METERS_PER_DEGREE_LAT;
    }

    /** Return a copy of a lon/lat geometry with its coordinates in meters relative to the center. */
    public Geometry project (Geometry geographic) {
        Geometry projected = geographic.copy();
        projected.apply(new CoordinateSequenceFilter() {
            @Override
            public void filter (CoordinateSequence seq, int i) {
                seq.setOrdinate(i, CoordinateSequence.X, x(seq.getOrdinate(i, CoordinateSequence.X)));
                seq.setOrdinate(i, CoordinateSequence.Y, y(seq.getOrdinate(i, CoordinateSequence.Y)));
            }

            @Override
            public boolean isDone () {
                return false;
            }

            @Override
            public boolean isGeometryChanged () {
                return true;
            }
        });
        projected.geometryChanged();
        return projected;
    }
}
