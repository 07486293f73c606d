package com.conveyal.canopy.raster;

import com.conveyal.canopy.geometry.LocalProjection;
import com.conveyal.canopy.models.GeoBounds;
import com.conveyal.canopy.models.GeoCoordinate;
import com.conveyal.canopy.models.RasterBuffer;
import org.locationtech.jts.geom.Coordinate;

/**
 * Converts between pixel positions of a raster, geographic coordinates and the local metric plane centered on the
 * raster. Pixel to geographic conversion is linear in both axes: longitude increases left to right across the box,
 * latitude decreases top to bottom since pixel rows grow downward.
 */
public class Georeference {

    public final int width;

    public final int height;

    public final GeoBounds bounds;

    public final double metersPerPixel;

    public final LocalProjection projection;

    // Edges of the raster in the local metric plane.
    private final double westMeters, eastMeters, southMeters, northMeters;

    public Georeference (int width, int height, GeoBounds bounds, double metersPerPixel) {
        this.width = width;
        this.height = height;
        this.bounds = bounds;
        this.metersPerPixel = metersPerPixel;
        this.projection = new LocalProjection(bounds.centerLat(), bounds.centerLon());
        this.westMeters = projection.x(bounds.west);
        this.eastMeters = projection.x(bounds.east);
        this.southMeters = projection.y(bounds.south);
        this.northMeters = projection.y(bounds.north);
    }

    public static Georeference of (RasterBuffer raster) {
        return new Georeference(raster.width, raster.height, raster.bounds, raster.metersPerPixel);
    }

    public GeoCoordinate pixelToGeo (PixelCoordinate pixel) {
        double lon = bounds.west + pixel.x / width * (bounds.east - bounds.west);
        double lat = bounds.north - pixel.y / height * (bounds.north - bounds.south);
        return new GeoCoordinate(lat, lon);
    }

    /** Geographic coordinate of the center of a pixel. */
    public GeoCoordinate pixelToGeo (int x, int y) {
        return pixelToGeo(PixelCoordinate.centerOf(x, y));
    }

    public PixelCoordinate geoToPixel (double lat, double lon) {
        double x = (lon - bounds.west) / (bounds.east - bounds.west) * width;
        double y = (bounds.north - lat) / (bounds.north - bounds.south) * height;
        return new PixelCoordinate(x, y);
    }

    public PixelCoordinate geoToPixel (GeoCoordinate coordinate) {
        return geoToPixel(coordinate.latitude, coordinate.longitude);
    }

    /** Position in pixel space of a point in the local metric plane. */
    public PixelCoordinate metricToPixel (double xMeters, double yMeters) {
        double x = (xMeters - westMeters) / (eastMeters - westMeters) * width;
        double y = (northMeters - yMeters) / (northMeters - southMeters) * height;
        return new PixelCoordinate(x, y);
    }

    /** The point in the local metric plane at the center of the given pixel. */
    public Coordinate pixelCenterMetric (int x, int y) {
        double mx = westMeters + (x + 0.5) / width * (eastMeters - westMeters);
        double my = northMeters - (y + 0.5) / height * (northMeters - southMeters);
        return new Coordinate(mx, my);
    }

    /** Width of one pixel in the local metric plane, which may differ slightly from the nominal ground resolution. */
    public double pixelWidthMeters () {
        return (eastMeters - westMeters) / width;
    }

    public double pixelHeightMeters () {
        return (northMeters - southMeters) / height;
    }
}
