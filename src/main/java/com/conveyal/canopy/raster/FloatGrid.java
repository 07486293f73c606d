package com.conveyal.canopy.raster;

import com.conveyal.canopy.PlantabilityException;

import java.util.Arrays;

/**
 * One float value per pixel, row major from the top left. Used for continuous features (NDVI, shadow intensity),
 * distance fields and score grids.
 */
public class FloatGrid {

    public final int width;

    public final int height;

    private final float[] values;

    public FloatGrid (int width, int height) {
        if (width <= 0 || height <= 0) {
            throw PlantabilityException.precondition("Grid dimensions must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.values = new float[width * height];
    }

    public static FloatGrid filled (int width, int height, float value) {
        FloatGrid grid = new FloatGrid(width, height);
        Arrays.fill(grid.values, value);
        return grid;
    }

    public float get (int x, int y) {
        return values[y * width + x];
    }

    public float get (int index) {
        return values[index];
    }

    public void set (int x, int y, float value) {
        values[y * width + x] = value;
    }

    public void set (int index, float value) {
        values[index] = value;
    }

    public int size () {
        return values.length;
    }

    public FloatGrid copy () {
        FloatGrid copy = new FloatGrid(width, height);
        System.arraycopy(values, 0, copy.values, 0, values.length);
        return copy;
    }

    /** Clamp every value into [min, max] in place. NaN becomes min. */
    public void clip (float min, float max) {
        for (int i = 0; i < values.length; i++) {
            float v = values[i];
            if (Float.isNaN(v) || v < min) values[i] = min;
            else if (v > max) values[i] = max;
        }
    }

    public float max () {
        float max = Float.NEGATIVE_INFINITY;
        for (float v : values) if (v > max) max = v;
        return max;
    }

    /** Mean of the values at pixels where the mask is true, or zero if the mask is empty. */
    public double meanWhere (BooleanGrid mask) {
        mask.checkShape(width, height, "Averaging mask");
        double sum = 0;
        int n = 0;
        for (int i = mask.nextSet(0); i >= 0; i = mask.nextSet(i + 1)) {
            sum += values[i];
            n++;
        }
        return n == 0 ? 0 : sum / n;
    }

    public void checkShape (int expectedWidth, int expectedHeight, String what) {
        PlantabilityException.checkSameShape(what, width, height, expectedWidth, expectedHeight);
    }

    @Override
    public boolean equals (Object other) {
        if (!(other instanceof FloatGrid)) return false;
        FloatGrid o = (FloatGrid) other;
        return width == o.width && height == o.height && Arrays.equals(values, o.values);
    }

    @Override
    public int hashCode () {
        return 31 * (31 * width + height) + Arrays.hashCode(values);
    }
}
