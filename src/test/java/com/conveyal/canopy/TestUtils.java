package com.conveyal.canopy;

import com.conveyal.canopy.models.AnalysisLocation;
import com.conveyal.canopy.models.GeoBounds;
import com.conveyal.canopy.models.GeoCoordinate;
import com.conveyal.canopy.models.LocationInput;
import com.conveyal.canopy.models.RasterBuffer;
import com.conveyal.canopy.models.VectorFeature;
import com.conveyal.canopy.models.VectorFeatureCollection;
import com.conveyal.canopy.raster.Georeference;
import com.conveyal.canopy.raster.PixelCoordinate;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.util.Arrays;

/**
 * Builders for small synthetic rasters and map features. Geometry is described in pixel coordinates of the raster it
 * belongs to and converted to longitude and latitude here, so tests can reason about which pixels are covered.
 */
public class TestUtils {

    public static final double CENTER_LAT = 40.7128;
    public static final double CENTER_LON = -74.0060;

    /** Pavement gray: too bright for shadow, too neutral for vegetation. */
    public static final int GRAY = 0x969BA0;

    /** Bright green canopy, NDVI about 0.41. */
    public static final int GREEN = 0x64F050;

    /** Dark neutral pixel, a shadow candidate. */
    public static final int DARK = 0x282828;

    public static final GeometryFactory GEOMETRY_FACTORY = new GeometryFactory();

    /** A config that applies no alignment correction, so features land exactly where they are drawn. */
    public static PlantabilityConfig identityAlignmentConfig () {
        return PlantabilityConfig.defaults()
                .with("alignment-scale", "1")
                .with("alignment-offset-north-m", "0")
                .with("alignment-offset-east-m", "0");
    }

    public static GeoBounds bounds (int width, int height, double metersPerPixel) {
        return GeoBounds.aroundCenter(CENTER_LAT, CENTER_LON, width, height, metersPerPixel);
    }

    public static RasterBuffer uniformRaster (int width, int height, int rgb, double metersPerPixel) {
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, rgb);
        return new RasterBuffer(width, height, pixels, bounds(width, height, metersPerPixel), metersPerPixel);
    }

    /** Copy of a raster with a rectangle of pixels [x0, x1) x [y0, y1) set to one color. */
    public static RasterBuffer withRectangle (RasterBuffer raster, int x0, int y0, int x1, int y1, int rgb) {
        int[] pixels = new int[raster.width * raster.height];
        for (int y = 0; y < raster.height; y++) {
            for (int x = 0; x < raster.width; x++) {
                boolean inside = x >= x0 && x < x1 && y >= y0 && y < y1;
                pixels[y * raster.width + x] = inside ? rgb : raster.rgb(x, y);
            }
        }
        return new RasterBuffer(raster.width, raster.height, pixels, raster.bounds, raster.metersPerPixel);
    }

    public static Coordinate lonLat (RasterBuffer raster, double px, double py) {
        GeoCoordinate geo = Georeference.of(raster).pixelToGeo(new PixelCoordinate(px, py));
        return new Coordinate(geo.longitude, geo.latitude);
    }

    /** A building footprint covering the pixel rectangle [x0, x1) x [y0, y1). */
    public static Polygon rectangle (RasterBuffer raster, double x0, double y0, double x1, double y1) {
        return GEOMETRY_FACTORY.createPolygon(new Coordinate[] {
                lonLat(raster, x0, y0),
                lonLat(raster, x1, y0),
                lonLat(raster, x1, y1),
                lonLat(raster, x0, y1),
                lonLat(raster, x0, y0)
        });
    }

    public static LineString line (RasterBuffer raster, double x0, double y0, double x1, double y1) {
        return GEOMETRY_FACTORY.createLineString(new Coordinate[] {
                lonLat(raster, x0, y0),
                lonLat(raster, x1, y1)
        });
    }

    public static Point point (RasterBuffer raster, double px, double py) {
        return GEOMETRY_FACTORY.createPoint(lonLat(raster, px, py));
    }

    public static LocationInput input (String name, RasterBuffer raster, VectorFeature... features) {
        AnalysisLocation location = new AnalysisLocation(name, raster.bounds.centerLat(), raster.bounds.centerLon());
        return new LocationInput(location, raster, new VectorFeatureCollection(Arrays.asList(features)));
    }

    /**
     * A footway along the middle of a 50 m square image with a building set back north of it. With no alignment
     * correction, the ten pixel rows between the building and the footway corridor form one critical region.
     */
    public static LocationInput streetWithBuilding () {
        RasterBuffer raster = uniformRaster(100, 100, GRAY, 0.5);
        return input("Footway", raster,
                VectorFeature.street(line(raster, 0, 50, 100, 50), "footway"),
                VectorFeature.building(rectangle(raster, 20, 10, 80, 20)));
    }
}
