package com.conveyal.canopy.spots;

import com.conveyal.canopy.models.GeoCoordinate;

import java.util.Map;

/**
 * An optional, external assessment of a single spot on the ground, for example from street level imagery. It is
 * invoked by callers after the score grid and spot list already exist and can never change them.
 */
public interface SpotEvaluator {

    /**
     * @return context fields describing the spot, such as counts of existing trees or obstacles.
     * @throws Exception if the evaluation could not be made. Callers treat this as "no evaluation" for that spot.
     */
    Map<String, Object> evaluateSpot (GeoCoordinate coordinate) throws Exception;
}
