package com.conveyal.canopy.scoring;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.geometry.AlignedGeometry;
import com.conveyal.canopy.masks.FeatureMasks;
import com.conveyal.canopy.models.RasterBuffer;
import com.conveyal.canopy.raster.FloatGrid;
import com.conveyal.canopy.raster.Georeference;
import com.conveyal.canopy.raster.PixelCoordinate;
import org.locationtech.jts.geom.Coordinate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scores every pixel for tree planting priority from four factors, each capped at a configured maximum:
 *
 * sidewalk proximity - trees next to walkways shade the most pedestrians, banded on distance to the nearest sidewalk.
 * building cooling   - banded on distance to the nearest building, highest in a middle range: right against a wall
 *                      there is no room for a canopy, far away there is no facade to cool.
 * sun exposure       - unshaded pixels gain the most from new shade, banded on shadow intensity.
 * amenity density    - Gaussian weighted count of nearby points of interest, normalized so the busiest pixel gets the
 *                      full amenity points.
 *
 * This is a pure function of its inputs. Identical masks, geometry and configuration always give an identical grid.
 */
public class PriorityCalculator {

    private static final Logger LOG = LoggerFactory.getLogger(PriorityCalculator.class);

    public static ScoreGrid calculate (
            FeatureMasks masks, AlignedGeometry aligned, RasterBuffer raster, PlantabilityConfig config
    ) {
        masks.vegetation.checkShape(raster.width, raster.height, "Feature masks");
        ComponentScores components = new ComponentScores(
                banded(masks.sidewalkDistance, config.sidewalkBands, config.sidewalkMaxPoints),
                banded(masks.buildingDistance, config.buildingBands, config.buildingMaxPoints),
                banded(masks.shadowIntensity, config.sunBands, config.sunMaxPoints),
                amenityDensity(aligned.amenities, Georeference.of(raster), config)
        );
        ScoreGrid grid = new ScoreGrid(components, masks.nonPlantable, config);
        LOG.info("Scored {} plantable pixels: {} critical, {} high, {} medium, {} low",
                grid.plantableCount(), grid.tierCount(PriorityTier.CRITICAL), grid.tierCount(PriorityTier.HIGH),
                grid.tierCount(PriorityTier.MEDIUM), grid.tierCount(PriorityTier.LOW));
        return grid;
    }

    /** Look up the points for every pixel's measurement, capped at the component maximum. */
    static FloatGrid banded (FloatGrid measurement, ScoreBands bands, double maxPoints) {
        FloatGrid points = new FloatGrid(measurement.width, measurement.height);
        for (int i = 0; i < measurement.size(); i++) {
            points.set(i, (float) Math.min(bands.lookup(measurement.get(i)), maxPoints));
        }
        return points;
    }

    /**
     * Kernel density of amenities: each amenity adds a Gaussian bump with standard deviation of half the search radius,
     * truncated at the radius. The density is then scaled so its maximum equals the amenity points. With no amenities
     * in range, the component is zero everywhere.
     */
    static FloatGrid amenityDensity (List<Coordinate> amenities, Georeference georeference, PlantabilityConfig config) {
        int width = georeference.width;
        int height = georeference.height;
        FloatGrid points = new FloatGrid(width, height);
        double radius = config.amenityRadiusMeters / georeference.metersPerPixel;
        if (amenities.isEmpty() || radius <= 0 || config.amenityMaxPoints <= 0) return points;

        double sigma = radius / 2;
        double twoSigmaSquared = 2 * sigma * sigma;
        double[] density = new double[width * height];
        for (Coordinate amenity : amenities) {
            PixelCoordinate center = georeference.metricToPixel(amenity.x, amenity.y);
            int minX = Math.max(0, (int) Math.floor(center.x - radius));
            int maxX = Math.min(width - 1, (int) Math.ceil(center.x + radius));
            int minY = Math.max(0, (int) Math.floor(center.y - radius));
            int maxY = Math.min(height - 1, (int) Math.ceil(center.y + radius));
            for (int y = minY; y <= maxY; y++) {
                for (int x = minX; x <= maxX; x++) {
                    double dx = x + 0.5 - center.x;
                    double dy = y + 0.5 - center.y;
                    double d2 = dx * dx + dy * dy;
                    if (d2 > radius * radius) continue;
                    density[y * width + x] += Math.exp(-d2 / twoSigmaSquared);
                }
            }
        }

        double max = 0;
        for (double d : density) max = Math.max(max, d);
        if (max <= 0) return points;
        for (int i = 0; i < density.length; i++) {
            points.set(i, (float) (density[i] / max * config.amenityMaxPoints));
        }
        return points;
    }
}
