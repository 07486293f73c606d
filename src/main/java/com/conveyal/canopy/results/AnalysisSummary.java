package com.conveyal.canopy.results;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The portable result of analyzing one location. Every field is a primitive, a String, or a nested object or
 * collection of them, so it serializes to JSON without custom serializers. Instances are built only by
 * {@link SummaryAssembler}.
 */
public class AnalysisSummary {

    public LocationInfo location;

    /** In descending priority. */
    public List<Spot> criticalSpots = new ArrayList<>();

    public Coverage coverage;

    public ComponentAverages componentAverages;

    /** Keyed by lowercase tier label, from critical down to low. */
    public Map<String, TierShare> tierDistribution = new LinkedHashMap<>();

    public StreetNetwork streetNetwork;

    public Metadata metadata;

    public static class LocationInfo {
        public String name;
        public double latitude;
        public double longitude;
        public String description;
    }

    public static class Spot {
        public int id;
        public double latitude;
        public double longitude;
        public double priorityScore;
        public double areaSquareMeters;
        public int pixelCount;
        public double pixelX;
        public double pixelY;
        public String googleMapsUrl;
        public String streetViewUrl;
    }

    public static class AreaShare {
        public double areaSquareMeters;
        public double percent;
    }

    public static class Coverage {
        public AreaShare building;
        public AreaShare vegetation;
        public AreaShare shadow;
        public AreaShare street;
        public AreaShare sidewalk;
        public AreaShare plantable;
    }

    public static class ComponentAverage {
        /** Mean over plantable pixels, zero when there are none. */
        public double average;
        public double maxPoints;
    }

    public static class ComponentAverages {
        public ComponentAverage sidewalkProximity;
        public ComponentAverage buildingCooling;
        public ComponentAverage sunExposure;
        public ComponentAverage amenityDensity;
        public ComponentAverage total;
    }

    public static class TierShare {
        public int pixels;
        public double areaSquareMeters;
        /** Relative to all pixels, not only plantable ones. */
        public double percent;
    }

    public static class StreetNetwork {
        /** Keyed by lowercase traffic tier. */
        public Map<String, Integer> streetsByTier = new LinkedHashMap<>();
        public int sidewalkStreets;
        public int amenities;
    }

    public static class Metadata {
        /** ISO-8601, UTC. */
        public String timestamp;
        public double alignmentScale;
        public double alignmentOffsetNorthMeters;
        public double alignmentOffsetEastMeters;
        public int imageWidth;
        public int imageHeight;
        public double metersPerPixel;
        public int droppedFeatures;
    }
}
