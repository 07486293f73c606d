package com.conveyal.canopy.spots;

import com.google.common.collect.ImmutableMap;

import java.util.Map;

/** The outcome of evaluating one spot: either context fields or the reason there are none. */
public class SpotEvaluation {

    public final int spotId;

    public final Map<String, Object> fields;

    /** Null when the evaluation succeeded. */
    public final String error;

    private SpotEvaluation (int spotId, Map<String, Object> fields, String error) {
        this.spotId = spotId;
        this.fields = fields;
        this.error = error;
    }

    public static SpotEvaluation succeeded (int spotId, Map<String, Object> fields) {
        return new SpotEvaluation(spotId, fields == null ? ImmutableMap.of() : ImmutableMap.copyOf(fields), null);
    }

    public static SpotEvaluation failed (int spotId, String error) {
        return new SpotEvaluation(spotId, ImmutableMap.of(), error);
    }

    public boolean isSuccess () {
        return error == null;
    }
}
