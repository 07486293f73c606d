package com.conveyal.canopy.geometry;

/**
 * Ground resolution of web map imagery. Static satellite tiles are requested by center point and zoom level, so the
 * meters per pixel of the resulting raster follow from the standard 256 pixel web Mercator tile pyramid.
 */
public abstract class WebMercator {

    public static final int TILE_SIZE_PIXELS = 256;

    /** Meters per pixel at the equator at zoom level zero. */
    public static final double EQUATOR_METERS_PER_PIXEL_ZOOM_0 =
            2 * Math.PI * LocalProjection.EARTH_RADIUS_METERS / TILE_SIZE_PIXELS;

    /**
     * @param scale the image scale factor requested from the map service (2 for high density images), which packs
     *              that many image pixels into one tile pixel.
     */
    public static double metersPerPixel (double lat, int zoom, int scale) {
        if (zoom < 0 || zoom > 24 || scale < 1) {
            throw new IllegalArgumentException("Zoom must be in 0..24 and scale at least 1.");
        }
        return EQUATOR_METERS_PER_PIXEL_ZOOM_0 * Math.cos(Math.toRadians(lat)) / Math.pow(2, zoom) / scale;
    }

    public static double metersPerPixel (double lat, int zoom) {
        return metersPerPixel(lat, zoom, 1);
    }
}
