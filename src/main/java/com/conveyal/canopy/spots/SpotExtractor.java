package com.conveyal.canopy.spots;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.raster.BooleanGrid;
import com.conveyal.canopy.raster.ConnectedComponents;
import com.conveyal.canopy.raster.Georeference;
import com.conveyal.canopy.raster.PixelCoordinate;
import com.conveyal.canopy.scoring.PriorityTier;
import com.conveyal.canopy.scoring.ScoreGrid;
import gnu.trove.list.array.TIntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Reduces the critical tier of a score grid to a short list of places to plant. Each 8-connected region of critical
 * pixels that is large enough to matter becomes one spot at its centroid. Regions smaller than the configured minimum
 * are dropped as noise.
 */
public class SpotExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(SpotExtractor.class);

    /** Highest mean score first, then lowest id, so the order is fully determined by the grid. */
    public static final Comparator<CriticalSpot> PRIORITY_ORDER =
            Comparator.comparingDouble((CriticalSpot s) -> s.meanScore).reversed().thenComparingInt(s -> s.id);

    public static List<CriticalSpot> extract (ScoreGrid grid, Georeference georeference, PlantabilityConfig config) {
        BooleanGrid critical = grid.tierMask(PriorityTier.CRITICAL);
        critical.checkShape(georeference.width, georeference.height, "Critical tier mask");
        ConnectedComponents components = ConnectedComponents.label(critical);

        double pixelArea = georeference.metersPerPixel * georeference.metersPerPixel;
        List<CriticalSpot> spots = new ArrayList<>();
        int skipped = 0;
        for (int label = 1; label <= components.count(); label++) {
            TIntArrayList pixels = components.pixels(label);
            if (pixels.size() < config.minClusterPixels) {
                skipped++;
                continue;
            }
            double sumX = 0, sumY = 0, sumScore = 0;
            for (int j = 0; j < pixels.size(); j++) {
                int i = pixels.get(j);
                int x = i % grid.width;
                int y = i / grid.width;
                // Pixel centers, so a single pixel region has its centroid in the middle of the pixel.
                sumX += x + 0.5;
                sumY += y + 0.5;
                sumScore += grid.scores.get(i);
            }
            int n = pixels.size();
            PixelCoordinate centroid = new PixelCoordinate(sumX / n, sumY / n);
            spots.add(new CriticalSpot(spots.size() + 1, centroid, georeference.pixelToGeo(centroid),
                    sumScore / n, n, n * pixelArea));
        }
        spots.sort(PRIORITY_ORDER);
        LOG.info("Found {} critical spots, skipped {} regions smaller than {} pixels",
                spots.size(), skipped, config.minClusterPixels);
        return spots;
    }
}
