package com.conveyal.canopy.masks;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.features.DetectedFeatures;
import com.conveyal.canopy.geometry.AlignedGeometry;
import com.conveyal.canopy.geometry.TrafficTier;
import com.conveyal.canopy.models.RasterBuffer;
import com.conveyal.canopy.raster.BooleanGrid;
import com.conveyal.canopy.raster.DistanceTransform;
import com.conveyal.canopy.raster.FloatGrid;
import com.conveyal.canopy.raster.Georeference;
import com.conveyal.canopy.raster.Rasterizer;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.operation.union.UnaryUnionOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Turns aligned map geometry into pixel masks. Building footprints are rasterized as they are. Streets are lines, so
 * each traffic tier is first buffered by its own distance in the metric plane, and the buffered tiers are unioned into
 * a single street area. Sidewalks are approximated by a narrow buffer around the streets that have walkable frontage.
 * Distance fields to the nearest sidewalk and building pixel are then computed in meters.
 */
public class MaskGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(MaskGenerator.class);

    public static FeatureMasks generate (
            AlignedGeometry aligned, RasterBuffer raster, DetectedFeatures detected, PlantabilityConfig config
    ) {
        detected.vegetation.checkShape(raster.width, raster.height, "Vegetation mask");
        Georeference georeference = Georeference.of(raster);

        BooleanGrid buildings = Rasterizer.rasterize(aligned.buildings, georeference);

        List<Geometry> bufferedStreets = new ArrayList<>();
        for (TrafficTier tier : TrafficTier.values()) {
            bufferedStreets.addAll(buffer(aligned.streets(tier), aligned.bufferDistance(tier)));
        }
        BooleanGrid streets = rasterizeUnion(bufferedStreets, georeference);

        BooleanGrid sidewalks = rasterizeUnion(buffer(aligned.sidewalkStreets(), config.sidewalkBufferMeters), georeference);

        FloatGrid sidewalkDistance = DistanceTransform.meters(sidewalks, raster.metersPerPixel);
        FloatGrid buildingDistance = DistanceTransform.meters(buildings, raster.metersPerPixel);

        FeatureMasks masks = new FeatureMasks(detected, buildings, streets, sidewalks, sidewalkDistance, buildingDistance);
        LOG.info("Masks cover {} building, {} street and {} sidewalk pixels; {} of {} pixels are plantable",
                buildings.count(), streets.count(), sidewalks.count(),
                raster.pixelCount() - masks.nonPlantable.count(), raster.pixelCount());
        return masks;
    }

    /** Buffer every geometry by the same distance in meters. A zero distance keeps only polygonal area. */
    static List<Geometry> buffer (Collection<Geometry> geometries, double distanceMeters) {
        List<Geometry> buffered = new ArrayList<>(geometries.size());
        for (Geometry geometry : geometries) {
            Geometry b = geometry.buffer(distanceMeters);
            if (!b.isEmpty()) buffered.add(b);
        }
        return buffered;
    }

    /**
     * Union the geometries before rasterizing so overlapping buffers at intersections are tested once. An empty
     * collection simply yields an empty mask.
     */
    static BooleanGrid rasterizeUnion (Collection<Geometry> geometries, Georeference georeference) {
        if (geometries.isEmpty()) {
            return new BooleanGrid(georeference.width, georeference.height);
        }
        Geometry union = UnaryUnionOp.union(geometries);
        if (union == null) {
            return new BooleanGrid(georeference.width, georeference.height);
        }
        List<Geometry> parts = new ArrayList<>(union.getNumGeometries());
        for (int i = 0; i < union.getNumGeometries(); i++) parts.add(union.getGeometryN(i));
        return Rasterizer.rasterize(parts, georeference);
    }
}
