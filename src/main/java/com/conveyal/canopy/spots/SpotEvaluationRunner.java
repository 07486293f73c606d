package com.conveyal.canopy.spots;

import org.apache.commons.lang.exception.ExceptionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a {@link SpotEvaluator} over the leading spots of a finished analysis. Each spot is evaluated independently:
 * a failure is recorded for that spot and the remaining spots are still evaluated. The spot list itself is only read.
 */
public class SpotEvaluationRunner {

    private static final Logger LOG = LoggerFactory.getLogger(SpotEvaluationRunner.class);

    private final SpotEvaluator evaluator;

    public SpotEvaluationRunner (SpotEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    /** Evaluate at most maxSpots spots, in the order given (normally descending priority). */
    public List<SpotEvaluation> evaluate (List<CriticalSpot> spots, int maxSpots) {
        List<SpotEvaluation> evaluations = new ArrayList<>();
        if (evaluator == null) {
            LOG.info("No spot evaluator configured, skipping ground evaluation.");
            return evaluations;
        }
        int n = Math.min(Math.max(maxSpots, 0), spots.size());
        for (int i = 0; i < n; i++) {
            CriticalSpot spot = spots.get(i);
            try {
                evaluations.add(SpotEvaluation.succeeded(spot.id, evaluator.evaluateSpot(spot.coordinate)));
            } catch (Exception e) {
                LOG.warn("Evaluation of spot {} at {} failed: {}", spot.id, spot.coordinate, e.toString());
                evaluations.add(SpotEvaluation.failed(spot.id, ExceptionUtils.getRootCauseMessage(e)));
            }
        }
        LOG.info("Evaluated {} spots, {} succeeded", evaluations.size(),
                evaluations.stream().filter(SpotEvaluation::isSuccess).count());
        return evaluations;
    }
}
