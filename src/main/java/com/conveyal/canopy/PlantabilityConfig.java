package com.conveyal.canopy;

import com.conveyal.canopy.geometry.TrafficTier;
import com.conveyal.canopy.scoring.ScoreBands;
import com.google.common.collect.ImmutableMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Every tunable constant of the plantability pipeline: alignment correction, detection thresholds, buffer distances,
 * scoring bands and weights, tier cutoffs and minimum cluster sizes. An instance is immutable and is passed explicitly
 * to each pipeline stage; nothing reads configuration from static state.
 *
 * We intentionally don't hard-code any defaults here. Defaults are shipped in the classpath resource
 * canopy-defaults.properties, and callers may overlay their own properties file or individual keys on top of them.
 * Several of these values differ between historical revisions of the scoring model, which is why all of them are
 * named keys rather than literals.
 */
public class PlantabilityConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PlantabilityConfig.class);

    public static final String DEFAULTS_RESOURCE = "canopy-defaults.properties";

    /** The properties this config was parsed from, kept so that overrides can produce a modified copy. */
    private final Properties properties;

    // Alignment between the vector map data and the imagery.
    public final double alignmentScale;
    public final double alignmentOffsetNorthMeters;
    public final double alignmentOffsetEastMeters;

    // Detection of vegetation and shadow from color channels. Brightness thresholds are on the 0-255 value channel.
    public final double ndviThreshold;
    public final double minVegetationBrightness;
    public final double shadowDarkThreshold;
    public final double shadowDesaturationThreshold;
    public final int shadowMinClusterPixels;
    public final double shadowBlurSigmaPixels;

    // Street buffering, in meters.
    private final Map<TrafficTier, Double> bufferDistances;
    public final double sidewalkBufferMeters;

    // Scoring.
    public final ScoreBands sidewalkBands;
    public final ScoreBands buildingBands;
    public final ScoreBands sunBands;
    public final double amenityRadiusMeters;
    public final double sidewalkMaxPoints;
    public final double buildingMaxPoints;
    public final double sunMaxPoints;
    public final double amenityMaxPoints;

    // Classification into priority tiers. A pixel belongs to the highest tier whose cutoff its score reaches.
    public final double criticalCutoff;
    public final double highCutoff;
    public final double mediumCutoff;

    // Extraction of critical spots.
    public final int minClusterPixels;

    private PlantabilityConfig (Properties properties) {
        this.properties = properties;
        Set<String> missingKeys = new TreeSet<>();

        alignmentScale = getDouble("alignment-scale", missingKeys);
        alignmentOffsetNorthMeters = getDouble("alignment-offset-north-m", missingKeys);
        alignmentOffsetEastMeters = getDouble("alignment-offset-east-m", missingKeys);

        ndviThreshold = getDouble("ndvi-threshold", missingKeys);
        minVegetationBrightness = getDouble("min-vegetation-brightness", missingKeys);
        shadowDarkThreshold = getDouble("shadow-dark-threshold", missingKeys);
        shadowDesaturationThreshold = getDouble("shadow-desaturation-threshold", missingKeys);
        shadowMinClusterPixels = getInt("shadow-min-cluster-px", missingKeys);
        shadowBlurSigmaPixels = getDouble("shadow-blur-sigma-px", missingKeys);

        Map<TrafficTier, Double> buffers = new EnumMap<>(TrafficTier.class);
        buffers.put(TrafficTier.PEDESTRIAN, getDouble("buffer-pedestrian-m", missingKeys));
        buffers.put(TrafficTier.LOW, getDouble("buffer-low-m", missingKeys));
        buffers.put(TrafficTier.MEDIUM, getDouble("buffer-medium-m", missingKeys));
        buffers.put(TrafficTier.HIGH, getDouble("buffer-high-m", missingKeys));
        bufferDistances = ImmutableMap.copyOf(buffers);
        sidewalkBufferMeters = getDouble("sidewalk-buffer-m", missingKeys);

        sidewalkBands = getBands("sidewalk-bands", missingKeys);
        buildingBands = getBands("building-bands", missingKeys);
        sunBands = getBands("sun-bands", missingKeys);
        amenityRadiusMeters = getDouble("amenity-radius-m", missingKeys);
        sidewalkMaxPoints = getDouble("sidewalk-max-points", missingKeys);
        buildingMaxPoints = getDouble("building-max-points", missingKeys);
        sunMaxPoints = getDouble("sun-max-points", missingKeys);
        amenityMaxPoints = getDouble("amenity-max-points", missingKeys);

        criticalCutoff = getDouble("critical-cutoff", missingKeys);
        highCutoff = getDouble("high-cutoff", missingKeys);
        mediumCutoff = getDouble("medium-cutoff", missingKeys);

        minClusterPixels = getInt("min-cluster-px", missingKeys);

        if (!missingKeys.isEmpty()) {
            LOG.error("You must provide these configuration properties: {}", String.join(", ", missingKeys));
            throw PlantabilityException.configuration("Missing configuration properties: " + String.join(", ", missingKeys));
        }
        validate();
    }

    /** Load the defaults shipped on the classpath. */
    public static PlantabilityConfig defaults () {
        return fromProperties(new Properties());
    }

    /** Overlay the given properties on the shipped defaults. */
    public static PlantabilityConfig fromProperties (Properties overrides) {
        Properties merged = loadDefaults();
        merged.putAll(overrides);
        return new PlantabilityConfig(merged);
    }

    /** Overlay a properties file on the shipped defaults. */
    public static PlantabilityConfig load (File file) {
        Properties overrides = new Properties();
        try (InputStream is = new FileInputStream(file)) {
            overrides.load(is);
        } catch (IOException e) {
            throw PlantabilityException.configuration("Could not read config file '" + file + "': " + e.getMessage());
        }
        LOG.info("Loaded {} configuration overrides from {}", overrides.size(), file);
        return fromProperties(overrides);
    }

    private static Properties loadDefaults () {
        Properties defaults = new Properties();
        try (InputStream is = PlantabilityConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (is == null) {
                throw PlantabilityException.configuration("Default configuration " + DEFAULTS_RESOURCE + " is not on the classpath.");
            }
            defaults.load(is);
        } catch (IOException e) {
            throw PlantabilityException.configuration("Could not read default configuration: " + e.getMessage());
        }
        return defaults;
    }

    /** Return a new config identical to this one except for a single key. */
    public PlantabilityConfig with (String key, String value) {
        Properties copy = new Properties();
        copy.putAll(properties);
        copy.setProperty(key, value);
        return new PlantabilityConfig(copy);
    }

    public PlantabilityConfig with (String key, double value) {
        return with(key, Double.toString(value));
    }

    /** Integer keys such as cluster sizes must be written without a decimal point to parse. */
    public PlantabilityConfig with (String key, int value) {
        return with(key, Integer.toString(value));
    }

    public double bufferDistance (TrafficTier tier) {
        return bufferDistances.get(tier);
    }

    public Map<TrafficTier, Double> bufferDistances () {
        return bufferDistances;
    }

    /** The largest raw score any pixel can reach, the sum of the four component maxima. */
    public double maxTotalPoints () {
        return sidewalkMaxPoints + buildingMaxPoints + sunMaxPoints + amenityMaxPoints;
    }

    private void validate () {
        if (!(alignmentScale > 0) || Double.isInfinite(alignmentScale)) {
            throw PlantabilityException.configuration("alignment-scale must be a positive number, was " + alignmentScale);
        }
        if (shadowMinClusterPixels < 0 || minClusterPixels < 1) {
            throw PlantabilityException.configuration("Cluster sizes must be non-negative and min-cluster-px at least 1.");
        }
        if (shadowBlurSigmaPixels < 0 || amenityRadiusMeters < 0 || sidewalkBufferMeters < 0) {
            throw PlantabilityException.configuration("Blur sigma, amenity radius and sidewalk buffer must not be negative.");
        }
        for (Map.Entry<TrafficTier, Double> entry : bufferDistances.entrySet()) {
            if (entry.getValue() < 0) {
                throw PlantabilityException.configuration("Buffer distance for " + entry.getKey() + " is negative.");
            }
        }
        checkBandsWithinMaximum("sidewalk-bands", sidewalkBands, sidewalkMaxPoints);
        checkBandsWithinMaximum("building-bands", buildingBands, buildingMaxPoints);
        checkBandsWithinMaximum("sun-bands", sunBands, sunMaxPoints);
        if (amenityMaxPoints < 0) {
            throw PlantabilityException.configuration("amenity-max-points must not be negative.");
        }
        if (!(mediumCutoff < highCutoff && highCutoff < criticalCutoff)) {
            throw PlantabilityException.configuration(String.format(
                    "Tier cutoffs must be strictly increasing, got medium %s, high %s, critical %s",
                    mediumCutoff, highCutoff, criticalCutoff));
        }
        if (criticalCutoff > maxTotalPoints()) {
            LOG.warn("critical-cutoff {} exceeds the maximum attainable score {}, no critical spots can be found.",
                    criticalCutoff, maxTotalPoints());
        }
    }

    private static void checkBandsWithinMaximum (String key, ScoreBands bands, double maxPoints) {
        if (bands.maxPoints() > maxPoints) {
            throw PlantabilityException.configuration(String.format(
                    "%s awards up to %s points but the component maximum is %s", key, bands.maxPoints(), maxPoints));
        }
    }

    private String getProperty (String key, Set<String> missingKeys) {
        String value = properties.getProperty(key);
        if (value == null || value.trim().isEmpty()) {
            missingKeys.add(key);
            return null;
        }
        return value.trim();
    }

    private double getDouble (String key, Set<String> missingKeys) {
        String value = getProperty(key, missingKeys);
        if (value == null) return Double.NaN;
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw PlantabilityException.configuration("Configuration option " + key + " is not a number: " + value);
        }
    }

    private int getInt (String key, Set<String> missingKeys) {
        String value = getProperty(key, missingKeys);
        if (value == null) return 0;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw PlantabilityException.configuration("Configuration option " + key + " is not an integer: " + value);
        }
    }

    private ScoreBands getBands (String key, Set<String> missingKeys) {
        String value = getProperty(key, missingKeys);
        // A placeholder keeps construction going so that all missing keys are reported together.
        if (value == null) return new ScoreBands(new double[] {0}, new double[] {0});
        return ScoreBands.parse(value);
    }
}
