package com.conveyal.canopy.scoring;

import com.conveyal.canopy.PlantabilityException;

import java.util.Arrays;

/**
 * A discrete lookup table turning a continuous measurement (a distance in meters, a shadow intensity) into points.
 * Bands are given as ascending upper bounds, each with the points awarded to values at or below that bound and above
 * the previous one. Values beyond the last bound score zero. Points need not be monotonic, which is what allows the
 * building cooling zone to have a sweet spot.
 *
 * The textual form used in configuration files is a comma separated list of upper:points pairs, e.g. "5:35,10:25".
 */
public class ScoreBands {

    private final double[] upperBounds;

    private final double[] points;

    public ScoreBands (double[] upperBounds, double[] points) {
        if (upperBounds.length != points.length || upperBounds.length == 0) {
            throw PlantabilityException.configuration("Score bands need one points value per upper bound.");
        }
        for (int i = 0; i < upperBounds.length; i++) {
            if (Double.isNaN(upperBounds[i]) || Double.isNaN(points[i]) || points[i] < 0) {
                throw PlantabilityException.configuration("Invalid score band " + upperBounds[i] + ":" + points[i]);
            }
            if (i > 0 && upperBounds[i] <= upperBounds[i - 1]) {
                throw PlantabilityException.configuration("Score band upper bounds must be strictly increasing.");
            }
        }
        this.upperBounds = upperBounds.clone();
        this.points = points.clone();
    }

    public static ScoreBands parse (String text) {
        if (text == null || text.trim().isEmpty()) {
            throw PlantabilityException.configuration("Score bands must not be empty.");
        }
        String[] pairs = text.split(",");
        double[] upper = new double[pairs.length];
        double[] pts = new double[pairs.length];
        for (int i = 0; i < pairs.length; i++) {
            String[] parts = pairs[i].trim().split(":");
            if (parts.length != 2) {
                throw PlantabilityException.configuration("Score band '" + pairs[i] + "' is not of the form upper:points");
            }
            try {
                upper[i] = Double.parseDouble(parts[0].trim());
                pts[i] = Double.parseDouble(parts[1].trim());
            } catch (NumberFormatException e) {
                throw PlantabilityException.configuration("Score band '" + pairs[i] + "' is not numeric");
            }
        }
        return new ScoreBands(upper, pts);
    }

    /** The points for the first band whose upper bound is at least the given value, or zero past the last band. */
    public double lookup (double value) {
        if (Double.isNaN(value)) return 0;
        for (int i = 0; i < upperBounds.length; i++) {
            if (value <= upperBounds[i]) return points[i];
        }
        return 0;
    }

    public double maxPoints () {
        double max = 0;
        for (double p : points) max = Math.max(max, p);
        return max;
    }

    public int size () {
        return upperBounds.length;
    }

    public double upperBound (int band) {
        return upperBounds[band];
    }

    public double points (int band) {
        return points[band];
    }

    @Override
    public String toString () {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < upperBounds.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(upperBounds[i]).append(':').append(points[i]);
        }
        return sb.toString();
    }

    @Override
    public boolean equals (Object other) {
        if (!(other instanceof ScoreBands)) return false;
        ScoreBands o = (ScoreBands) other;
        return Arrays.equals(upperBounds, o.upperBounds) && Arrays.equals(points, o.points);
    }

    @Override
    public int hashCode () {
        return 31 * Arrays.hashCode(upperBounds) + Arrays.hashCode(points);
    }
}
