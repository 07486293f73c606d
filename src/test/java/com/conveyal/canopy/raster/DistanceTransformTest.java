package com.conveyal.canopy.raster;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;

public class DistanceTransformTest {

    @Test
    public void distancesAreEuclideanBetweenPixelCenters () {
        BooleanGrid mask = new BooleanGrid(7, 5);
        mask.set(2, 2, true);
        FloatGrid d = DistanceTransform.pixels(mask);
        assertThat((double) d.get(2, 2), closeTo(0, 0));
        assertThat((double) d.get(6, 2), closeTo(4, 1e-6));
        assertThat((double) d.get(4, 4), closeTo(Math.sqrt(8), 1e-6));
        assertThat((double) d.get(0, 0), closeTo(Math.sqrt(8), 1e-6));
    }

    @Test
    public void nearestOfSeveralPixelsWins () {
        BooleanGrid mask = new BooleanGrid(10, 1);
        mask.set(0, 0, true);
        mask.set(9, 0, true);
        FloatGrid d = DistanceTransform.pixels(mask);
        assertThat((double) d.get(3, 0), closeTo(3, 1e-6));
        assertThat((double) d.get(6, 0), closeTo(3, 1e-6));
    }

    @Test
    public void emptyMaskIsInfinitelyFar () {
        FloatGrid d = DistanceTransform.meters(new BooleanGrid(4, 4), 0.5);
        for (int i = 0; i < d.size(); i++) {
            assertThat(Float.isInfinite(d.get(i)), equalTo(true));
        }
    }

    @Test
    public void metersScaleWithResolution () {
        BooleanGrid mask = new BooleanGrid(20, 20);
        mask.set(0, 10, true);
        FloatGrid d = DistanceTransform.meters(mask, 0.5);
        assertThat((double) d.get(10, 10), closeTo(5, 1e-6));
        assertThat((double) d.get(11, 10), closeTo(5.5, 1e-6));
    }
}
