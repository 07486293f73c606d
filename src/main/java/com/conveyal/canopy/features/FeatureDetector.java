package com.conveyal.canopy.features;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.models.RasterBuffer;
import com.conveyal.canopy.raster.BooleanGrid;
import com.conveyal.canopy.raster.ConnectedComponents;
import com.conveyal.canopy.raster.FloatGrid;
import com.conveyal.canopy.raster.GaussianBlur;
import com.conveyal.canopy.raster.Morphology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detects vegetation and shadow from the RGB channels of a satellite image, with no map data involved.
 *
 * Ordinary aerial imagery has no near infrared band, so vegetation is found with a visible-light stand-in for NDVI:
 * the normalized difference of the green and red channels. Shadows are pixels that are both dark and desaturated;
 * dense tree canopy is also dark, so anything already classified as vegetation is never a shadow.
 */
public class FeatureDetector {

    private static final Logger LOG = LoggerFactory.getLogger(FeatureDetector.class);

    /** Keeps the normalized difference defined for black pixels. */
    public static final double NDVI_EPSILON = 1e-6;

    /** Radius of the square structuring element used to close the masks, i.e. a 3x3 kernel. */
    public static final int CLOSING_RADIUS = 1;

    public static DetectedFeatures detect (RasterBuffer raster, PlantabilityConfig config) {
        int width = raster.width;
        int height = raster.height;
        FloatGrid ndvi = new FloatGrid(width, height);
        FloatGrid darkness = new FloatGrid(width, height);
        BooleanGrid vegetation = new BooleanGrid(width, height);
        BooleanGrid shadowCandidates = new BooleanGrid(width, height);

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = raster.red(x, y);
                int g = raster.green(x, y);
                int b = raster.blue(x, y);
                double value = value(r, g, b);
                double pixelNdvi = ndvi(r, g);
                ndvi.set(x, y, (float) pixelNdvi);
                darkness.set(x, y, (float) (1 - value / 255));
                if (pixelNdvi > config.ndviThreshold && value > config.minVegetationBrightness) {
                    vegetation.set(x, y, true);
                }
                if (value < config.shadowDarkThreshold && saturation(r, g, b) < config.shadowDesaturationThreshold) {
                    shadowCandidates.set(x, y, true);
                }
            }
        }

        vegetation = Morphology.close(vegetation, CLOSING_RADIUS);

        // Vegetation is excluded before closing so that the closing cannot grow shadows back over canopy edges.
        BooleanGrid shadow = Morphology.close(shadowCandidates.andNot(vegetation), CLOSING_RADIUS).andNot(vegetation);
        shadow = ConnectedComponents.label(shadow).withoutRegionsSmallerThan(config.shadowMinClusterPixels);

        FloatGrid shadowIntensity = GaussianBlur.blur(darkness, config.shadowBlurSigmaPixels);
        shadowIntensity.clip(0, 1);
        ndvi.clip(-1, 1);

        LOG.info("Detected vegetation on {} of {} pixels and shadow on {}",
                vegetation.count(), raster.pixelCount(), shadow.count());
        return new DetectedFeatures(vegetation, shadow, shadowIntensity, ndvi);
    }

    /** Green-red normalized difference vegetation index of one pixel. */
    public static double ndvi (int red, int green) {
        return (green - red) / (green + red + NDVI_EPSILON);
    }

    /** HSV value (brightness) channel, 0-255. */
    public static double value (int red, int green, int blue) {
        return Math.max(red, Math.max(green, blue));
    }

    /** HSV saturation, 0-1. Black has zero saturation. */
    public static double saturation (int red, int green, int blue) {
        int max = Math.max(red, Math.max(green, blue));
        int min = Math.min(red, Math.min(green, blue));
        return max == 0 ? 0 : (max - min) / (double) max;
    }
}
