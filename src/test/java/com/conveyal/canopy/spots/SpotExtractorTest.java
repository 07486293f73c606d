package com.conveyal.canopy.spots;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.TestUtils;
import com.conveyal.canopy.raster.BooleanGrid;
import com.conveyal.canopy.raster.FloatGrid;
import com.conveyal.canopy.raster.Georeference;
import com.conveyal.canopy.scoring.ComponentScores;
import com.conveyal.canopy.scoring.ScoreGrid;
import org.junit.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;

public class SpotExtractorTest {

    private static final int SIZE = 40;

    private final PlantabilityConfig config = PlantabilityConfig.defaults();

    private final Georeference georeference = new Georeference(SIZE, SIZE, TestUtils.bounds(SIZE, SIZE, 0.5), 0.5);

    private final FloatGrid sidewalk = new FloatGrid(SIZE, SIZE);
    private final FloatGrid building = new FloatGrid(SIZE, SIZE);
    private final FloatGrid sun = new FloatGrid(SIZE, SIZE);
    private final FloatGrid amenity = new FloatGrid(SIZE, SIZE);

    /** Give the pixels [x0, x1) x [y0, y1) the full sidewalk, building and sun points plus some amenity points. */
    private void block (int x0, int y0, int x1, int y1, float amenityPoints) {
        for (int y = y0; y < y1; y++) {
            for (int x = x0; x < x1; x++) {
                sidewalk.set(x, y, 35);
                building.set(x, y, 25);
                sun.set(x, y, 20);
                amenity.set(x, y, amenityPoints);
            }
        }
    }

    private List<CriticalSpot> extract () {
        ScoreGrid grid = new ScoreGrid(new ComponentScores(sidewalk, building, sun, amenity),
                new BooleanGrid(SIZE, SIZE), config);
        return SpotExtractor.extract(grid, georeference, config);
    }

    @Test
    public void spotsAreOrderedByScoreAndSmallRegionsDropped () {
        block(2, 2, 7, 7, 0);       // 25 pixels scoring 80
        block(20, 20, 26, 26, 10);  // 36 pixels scoring 90
        block(2, 30, 5, 33, 10);    // 9 pixels, below the minimum cluster size

        List<CriticalSpot> spots = extract();
        assertThat(spots.size(), equalTo(2));

        CriticalSpot first = spots.get(0);
        assertThat(first.id, equalTo(2));
        assertThat(first.meanScore, closeTo(90, 1e-6));
        assertThat(first.pixelCount, equalTo(36));
        assertThat(first.areaSquareMeters, closeTo(9, 1e-9));
        assertThat(first.pixelCentroid.x, closeTo(23, 1e-9));
        assertThat(first.pixelCentroid.y, closeTo(23, 1e-9));

        CriticalSpot second = spots.get(1);
        assertThat(second.id, equalTo(1));
        assertThat(second.meanScore, closeTo(80, 1e-6));
        assertThat(second.pixelCentroid.x, closeTo(4.5, 1e-9));
        assertThat(second.coordinate, equalTo(georeference.pixelToGeo(4, 4)));
    }

    @Test
    public void equalScoresKeepScanOrder () {
        block(30, 2, 36, 8, 5);
        block(2, 20, 8, 26, 5);
        List<CriticalSpot> spots = extract();
        assertThat(spots.size(), equalTo(2));
        assertThat(spots.get(0).id, equalTo(1));
        assertThat(spots.get(0).pixelCentroid.x, closeTo(33, 1e-9));
        assertThat(spots.get(1).id, equalTo(2));
    }

    @Test
    public void noCriticalPixelsMeansNoSpots () {
        block(0, 0, SIZE, SIZE, 0);
        // Everything scores 80 but a higher cutoff puts it all in the high tier.
        ScoreGrid grid = new ScoreGrid(new ComponentScores(sidewalk, building, sun, amenity),
                new BooleanGrid(SIZE, SIZE), config.with("critical-cutoff", "85"));
        assertThat(SpotExtractor.extract(grid, georeference, config), empty());
    }
}
