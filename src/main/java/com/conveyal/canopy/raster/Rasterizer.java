package com.conveyal.canopy.raster;

import org.locationtech.jts.algorithm.locate.IndexedPointInAreaLocator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Location;
import org.locationtech.jts.geom.Polygonal;

import java.util.Collection;
import java.util.Collections;

/**
 * Burns polygonal geometry in the local metric plane into a pixel mask. A pixel is set when its center falls inside
 * or on the boundary of a polygon. Only the pixels under each geometry's envelope are tested, using an indexed
 * point-in-polygon locator, so large rasters with many small footprints stay cheap.
 *
 * Non-polygonal geometry has no area and is skipped; lines must be buffered before rasterizing.
 */
public abstract class Rasterizer {

    public static BooleanGrid rasterize (Collection<? extends Geometry> geometries, Georeference georeference) {
        BooleanGrid mask = new BooleanGrid(georeference.width, georeference.height);
        for (Geometry geometry : geometries) {
            burn(geometry, georeference, mask);
        }
        return mask;
    }

    public static BooleanGrid rasterize (Geometry geometry, Georeference georeference) {
        return rasterize(Collections.singletonList(geometry), georeference);
    }

    private static void burn (Geometry geometry, Georeference georeference, BooleanGrid mask) {
        if (geometry == null || geometry.isEmpty() || !(geometry instanceof Polygonal)) return;
        Envelope env = geometry.getEnvelopeInternal();
        // North west and south east corners of the envelope in pixel space.
        PixelCoordinate topLeft = georeference.metricToPixel(env.getMinX(), env.getMaxY());
        PixelCoordinate bottomRight = georeference.metricToPixel(env.getMaxX(), env.getMinY());
        int minX = Math.max(0, topLeft.column());
        int minY = Math.max(0, topLeft.row());
        int maxX = Math.min(mask.width - 1, bottomRight.column());
        int maxY = Math.min(mask.height - 1, bottomRight.row());
        if (minX > maxX || minY > maxY) return;

        IndexedPointInAreaLocator locator = new IndexedPointInAreaLocator(geometry);
        for (int y = minY; y <= maxY; y++) {
            for (int x = minX; x <= maxX; x++) {
                if (mask.get(x, y)) continue;
                Coordinate center = georeference.pixelCenterMetric(x, y);
                if (locator.locate(center) != Location.EXTERIOR) {
                    mask.set(x, y, true);
                }
            }
        }
    }
}
