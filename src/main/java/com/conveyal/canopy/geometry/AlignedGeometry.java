package com.conveyal.canopy.geometry;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Map features after projection into the local metric plane of one raster and after the scale and offset correction
 * that lines them up with the imagery. Streets are split into traffic tiers, each of which carries the buffer distance
 * it will be expanded by. Any of the lists may be empty.
 */
public class AlignedGeometry {

    /** The projection whose plane all geometries here are expressed in. Its center is the raster center. */
    public final LocalProjection projection;

    public final List<Geometry> buildings;

    public final Map<TrafficTier, List<Geometry>> streets;

    public final Map<TrafficTier, Double> bufferDistances;

    /** Points of interest, in the same metric plane. */
    public final List<Coordinate> amenities;

    /** Number of input features that were malformed and left out. */
    public final int droppedFeatures;

    public final double scale;
    public final double offsetNorthMeters;
    public final double offsetEastMeters;

    public AlignedGeometry (
            LocalProjection projection,
            List<Geometry> buildings,
            Map<TrafficTier, List<Geometry>> streets,
            Map<TrafficTier, Double> bufferDistances,
            List<Coordinate> amenities,
            int droppedFeatures,
            double scale,
            double offsetNorthMeters,
            double offsetEastMeters
    ) {
        this.projection = projection;
        this.buildings = ImmutableList.copyOf(buildings);
        Map<TrafficTier, List<Geometry>> tiers = new EnumMap<>(TrafficTier.class);
        for (TrafficTier tier : TrafficTier.values()) {
            List<Geometry> tierStreets = streets.get(tier);
            tiers.put(tier, tierStreets == null ? ImmutableList.of() : ImmutableList.copyOf(tierStreets));
        }
        this.streets = ImmutableMap.copyOf(tiers);
        this.bufferDistances = ImmutableMap.copyOf(bufferDistances);
        this.amenities = ImmutableList.copyOf(amenities);
        this.droppedFeatures = droppedFeatures;
        this.scale = scale;
        this.offsetNorthMeters = offsetNorthMeters;
        this.offsetEastMeters = offsetEastMeters;
    }

    public List<Geometry> streets (TrafficTier tier) {
        return streets.get(tier);
    }

    public double bufferDistance (TrafficTier tier) {
        return bufferDistances.get(tier);
    }

    /** All street geometries whose tier has walkable frontage. */
    public List<Geometry> sidewalkStreets () {
        List<Geometry> result = new ArrayList<>();
        for (TrafficTier tier : TrafficTier.values()) {
            if (tier.hasSidewalk()) result.addAll(streets.get(tier));
        }
        return result;
    }

    public int streetCount () {
        return streets.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty () {
        return buildings.isEmpty() && amenities.isEmpty() && streetCount() == 0;
    }
}
