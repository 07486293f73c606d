package com.conveyal.canopy.results;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.PlantabilityException;
import com.conveyal.canopy.analysis.PipelineResult;
import com.conveyal.canopy.geometry.AlignedGeometry;
import com.conveyal.canopy.geometry.TrafficTier;
import com.conveyal.canopy.masks.FeatureMasks;
import com.conveyal.canopy.models.AnalysisLocation;
import com.conveyal.canopy.raster.BooleanGrid;
import com.conveyal.canopy.raster.FloatGrid;
import com.conveyal.canopy.raster.Georeference;
import com.conveyal.canopy.scoring.PriorityTier;
import com.conveyal.canopy.scoring.ScoreGrid;
import com.conveyal.canopy.spots.CriticalSpot;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * The one place where grids, geometries and spots become plain numbers and strings. Any NaN or infinite value that
 * would reach the summary is rejected here with a SERIALIZATION error rather than written out.
 */
public abstract class SummaryAssembler {

    public static AnalysisSummary assemble (PipelineResult result, PlantabilityConfig config, Clock clock) {
        Georeference georef = result.georeference;
        FeatureMasks masks = result.masks;
        ScoreGrid grid = result.scoreGrid;
        double pixelArea = georef.metersPerPixel * georef.metersPerPixel;
        int totalPixels = georef.width * georef.height;

        AnalysisSummary summary = new AnalysisSummary();
        summary.location = location(result.location);

        for (CriticalSpot spot : result.spots) {
            AnalysisSummary.Spot s = new AnalysisSummary.Spot();
            s.id = spot.id;
            s.latitude = finite("spot latitude", spot.coordinate.latitude);
            s.longitude = finite("spot longitude", spot.coordinate.longitude);
            s.priorityScore = finite("spot score", spot.meanScore);
            s.areaSquareMeters = finite("spot area", spot.areaSquareMeters);
            s.pixelCount = spot.pixelCount;
            s.pixelX = finite("spot pixel x", spot.pixelCentroid.x);
            s.pixelY = finite("spot pixel y", spot.pixelCentroid.y);
            s.googleMapsUrl = googleMapsUrl(s.latitude, s.longitude);
            s.streetViewUrl = streetViewUrl(s.latitude, s.longitude);
            summary.criticalSpots.add(s);
        }

        BooleanGrid plantable = masks.plantable();
        AnalysisSummary.Coverage coverage = new AnalysisSummary.Coverage();
        coverage.building = share(masks.buildings.count(), totalPixels, pixelArea);
        coverage.vegetation = share(masks.vegetation.count(), totalPixels, pixelArea);
        coverage.shadow = share(masks.shadow.count(), totalPixels, pixelArea);
        coverage.street = share(masks.streets.count(), totalPixels, pixelArea);
        coverage.sidewalk = share(masks.sidewalks.count(), totalPixels, pixelArea);
        coverage.plantable = share(plantable.count(), totalPixels, pixelArea);
        summary.coverage = coverage;

        AnalysisSummary.ComponentAverages averages = new AnalysisSummary.ComponentAverages();
        averages.sidewalkProximity = average("sidewalk", grid.components.sidewalk, plantable, config.sidewalkMaxPoints);
        averages.buildingCooling = average("building", grid.components.building, plantable, config.buildingMaxPoints);
        averages.sunExposure = average("sun", grid.components.sun, plantable, config.sunMaxPoints);
        averages.amenityDensity = average("amenity", grid.components.amenity, plantable, config.amenityMaxPoints);
        averages.total = average("total", grid.scores, plantable, config.maxTotalPoints());
        summary.componentAverages = averages;

        for (PriorityTier tier : PriorityTier.values()) {
            int pixels = grid.tierCount(tier);
            AnalysisSummary.AreaShare area = share(pixels, totalPixels, pixelArea);
            AnalysisSummary.TierShare share = new AnalysisSummary.TierShare();
            share.pixels = pixels;
            share.areaSquareMeters = area.areaSquareMeters;
            share.percent = area.percent;
            summary.tierDistribution.put(tier.label(), share);
        }

        AlignedGeometry aligned = result.aligned;
        AnalysisSummary.StreetNetwork network = new AnalysisSummary.StreetNetwork();
        for (TrafficTier tier : TrafficTier.values()) {
            network.streetsByTier.put(tier.name().toLowerCase(Locale.ROOT), aligned.streets(tier).size());
        }
        network.sidewalkStreets = aligned.sidewalkStreets().size();
        network.amenities = aligned.amenities.size();
        summary.streetNetwork = network;

        AnalysisSummary.Metadata metadata = new AnalysisSummary.Metadata();
        metadata.timestamp = DateTimeFormatter.ISO_INSTANT.format(Instant.now(clock));
        metadata.alignmentScale = finite("alignment scale", aligned.scale);
        metadata.alignmentOffsetNorthMeters = finite("alignment offset north", aligned.offsetNorthMeters);
        metadata.alignmentOffsetEastMeters = finite("alignment offset east", aligned.offsetEastMeters);
        metadata.imageWidth = georef.width;
        metadata.imageHeight = georef.height;
        metadata.metersPerPixel = finite("resolution", georef.metersPerPixel);
        metadata.droppedFeatures = aligned.droppedFeatures;
        summary.metadata = metadata;
        return summary;
    }

    public static String googleMapsUrl (double lat, double lon) {
        return String.format(Locale.ROOT, "https://www.google.com/maps/search/?api=1&query=%.6f,%.6f", lat, lon);
    }

    public static String streetViewUrl (double lat, double lon) {
        return String.format(Locale.ROOT,
                "https://www.google.com/maps/@?api=1&map_action=pano&viewpoint=%.6f,%.6f", lat, lon);
    }

    private static AnalysisSummary.LocationInfo location (AnalysisLocation location) {
        AnalysisSummary.LocationInfo info = new AnalysisSummary.LocationInfo();
        if (location != null) {
            info.name = location.name;
            info.latitude = finite("location latitude", location.latitude);
            info.longitude = finite("location longitude", location.longitude);
            info.description = location.description;
        }
        return info;
    }

    private static AnalysisSummary.AreaShare share (int pixels, int totalPixels, double pixelArea) {
        AnalysisSummary.AreaShare share = new AnalysisSummary.AreaShare();
        share.areaSquareMeters = finite("area", pixels * pixelArea);
        share.percent = totalPixels == 0 ? 0 : finite("percentage", 100.0 * pixels / totalPixels);
        return share;
    }

    private static AnalysisSummary.ComponentAverage average (String what, FloatGrid grid, BooleanGrid mask,
                                                             double maxPoints) {
        AnalysisSummary.ComponentAverage average = new AnalysisSummary.ComponentAverage();
        average.average = mask.isEmpty() ? 0 : finite(what + " average", grid.meanWhere(mask));
        average.maxPoints = finite(what + " maximum", maxPoints);
        return average;
    }

    static double finite (String what, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw PlantabilityException.serialization(
                    String.format("Non-finite value %s for %s cannot be written to the summary", value, what));
        }
        return value;
    }
}
