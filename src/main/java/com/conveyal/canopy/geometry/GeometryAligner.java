package com.conveyal.canopy.geometry;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.models.RasterBuffer;
import com.conveyal.canopy.models.VectorFeature;
import com.conveyal.canopy.models.VectorFeatureCollection;
import com.conveyal.canopy.raster.Georeference;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Polygonal;
import org.locationtech.jts.geom.Puntal;
import org.locationtech.jts.geom.util.AffineTransformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Brings map features into register with a satellite raster. The two sources disagree systematically: map geometry
 * around a center point comes out too small and shifted. We project into a local metric plane centered on the raster,
 * scale about that center, then translate by a fixed offset in meters. Both corrections come from configuration.
 *
 * Malformed features are dropped with a warning rather than failing the run; an empty or partly empty result just
 * yields empty masks downstream.
 */
public class GeometryAligner {

    private static final Logger LOG = LoggerFactory.getLogger(GeometryAligner.class);

    public static AlignedGeometry align (RasterBuffer raster, VectorFeatureCollection features, PlantabilityConfig config) {
        if (features == null) {
            LOG.warn("Map features are missing for this raster, continuing with none.");
            features = VectorFeatureCollection.empty();
        }
        LocalProjection projection = Georeference.of(raster).projection;

        // The center of the raster is the origin of the local plane, so scaling about the center is a plain scale.
        AffineTransformation correction = AffineTransformation
                .scaleInstance(config.alignmentScale, config.alignmentScale)
                .translate(config.alignmentOffsetEastMeters, config.alignmentOffsetNorthMeters);

        List<Geometry> buildings = new ArrayList<>();
        Map<TrafficTier, List<Geometry>> streets = new EnumMap<>(TrafficTier.class);
        for (TrafficTier tier : TrafficTier.values()) streets.put(tier, new ArrayList<>());
        List<Coordinate> amenities = new ArrayList<>();
        int dropped = 0;

        for (VectorFeature feature : features.features) {
            String problem = checkWellFormed(feature);
            if (problem != null) {
                LOG.warn("Dropping malformed feature {}: {}", feature, problem);
                dropped++;
                continue;
            }
            Geometry aligned = correction.transform(projection.project(feature.geometry));
            switch (feature.type) {
                case BUILDING:
                    buildings.add(aligned);
                    break;
                case STREET:
                    streets.get(TrafficTier.classify(feature.trafficClass)).add(aligned);
                    break;
                case AMENITY:
                    if (aligned instanceof Polygonal) {
                        amenities.add(aligned.getInteriorPoint().getCoordinate());
                    } else {
                        for (Coordinate c : aligned.getCoordinates()) amenities.add(c);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unhandled feature type " + feature.type);
            }
        }

        if (features.isEmpty()) {
            LOG.warn("No map features for this raster, all geometry masks will be empty.");
        }
        AlignedGeometry result = new AlignedGeometry(projection, buildings, streets, config.bufferDistances(), amenities,
                dropped, config.alignmentScale, config.alignmentOffsetNorthMeters, config.alignmentOffsetEastMeters);
        LOG.info("Aligned {} buildings, {} streets ({} pedestrian, {} low, {} medium, {} high) and {} amenities, dropped {}",
                result.buildings.size(), result.streetCount(),
                result.streets(TrafficTier.PEDESTRIAN).size(), result.streets(TrafficTier.LOW).size(),
                result.streets(TrafficTier.MEDIUM).size(), result.streets(TrafficTier.HIGH).size(),
                result.amenities.size(), dropped);
        return result;
    }

    /** @return a description of what is wrong with the feature's geometry, or null if it can be used. */
    static String checkWellFormed (VectorFeature feature) {
        Geometry g = feature.geometry;
        if (g == null || g.isEmpty()) return "empty geometry";
        switch (feature.type) {
            case BUILDING:
                if (!(g instanceof Polygonal)) return "building footprint is a " + g.getGeometryType();
                if (g.getArea() <= 0) return "zero area footprint";
                if (!g.isValid()) return "invalid or self-intersecting footprint";
                return null;
            case STREET:
                if (g instanceof Lineal) {
                    return g.getLength() > 0 ? null : "zero length street";
                }
                if (g instanceof Polygonal) {
                    if (g.getArea() <= 0) return "zero area street";
                    return g.isValid() ? null : "invalid or self-intersecting street area";
                }
                return "street is a " + g.getGeometryType();
            case AMENITY:
                if (g instanceof Puntal) return null;
                if (g instanceof Polygonal) return g.isValid() ? null : "invalid amenity area";
                return "amenity is a " + g.getGeometryType();
            default:
                return "unknown feature type";
        }
    }
}
