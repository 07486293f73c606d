package com.conveyal.canopy.spots;

import com.conveyal.canopy.models.GeoCoordinate;
import com.conveyal.canopy.raster.PixelCoordinate;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.nullValue;

public class SpotEvaluationRunnerTest {

    private static CriticalSpot spot (int id, double lat) {
        return new CriticalSpot(id, new PixelCoordinate(0.5, 0.5), new GeoCoordinate(lat, -74), 85, 30, 7.5);
    }

    private final List<CriticalSpot> spots = Arrays.asList(spot(1, 40.1), spot(2, 40.2), spot(3, 40.3));

    @Test
    public void oneFailingSpotDoesNotStopTheOthers () {
        SpotEvaluator evaluator = coordinate -> {
            if (coordinate.latitude == 40.2) throw new IOException("no imagery");
            return ImmutableMap.of("trees", 2);
        };
        List<SpotEvaluation> evaluations = new SpotEvaluationRunner(evaluator).evaluate(spots, 10);

        assertThat(evaluations.size(), equalTo(3));
        assertThat(evaluations.get(0).isSuccess(), equalTo(true));
        assertThat(evaluations.get(0).fields.get("trees"), equalTo((Object) 2));
        assertThat(evaluations.get(1).isSuccess(), equalTo(false));
        assertThat(evaluations.get(1).spotId, equalTo(2));
        assertThat(evaluations.get(1).error, equalTo("IOException: no imagery"));
        assertThat(evaluations.get(2).error, nullValue());
    }

    @Test
    public void onlyLeadingSpotsAreEvaluated () {
        List<SpotEvaluation> evaluations = new SpotEvaluationRunner(c -> ImmutableMap.of()).evaluate(spots, 2);
        assertThat(evaluations.size(), equalTo(2));
        assertThat(evaluations.get(1).spotId, equalTo(2));
    }

    @Test
    public void missingEvaluatorEvaluatesNothing () {
        assertThat(new SpotEvaluationRunner(null).evaluate(spots, 5), empty());
    }
}
