package com.conveyal.canopy.raster;

/**
 * Exact Euclidean distance transform: for every pixel, the distance to the nearest true pixel of a mask. This uses the
 * separable lower envelope of parabolas algorithm of Felzenszwalb and Huttenlocher ("Distance Transforms of Sampled
 * Functions", 2012), one pass down the columns and one along the rows, linear in the number of pixels.
 *
 * Distances are measured between pixel centers, so pixels inside the mask have distance zero. If the mask has no
 * true pixels at all, every distance is positive infinity.
 */
public abstract class DistanceTransform {

    // Stands in for infinity inside the envelope computation, where real infinities would produce NaN.
    private static final double FAR = 1e20;

    /** Distances in pixels. */
    public static FloatGrid pixels (BooleanGrid mask) {
        int width = mask.width;
        int height = mask.height;
        if (mask.isEmpty()) {
            return FloatGrid.filled(width, height, Float.POSITIVE_INFINITY);
        }
        double[] squared = new double[width * height];
        for (int i = 0; i < squared.length; i++) {
            squared[i] = mask.get(i) ? 0 : FAR;
        }

        int n = Math.max(width, height);
        double[] f = new double[n];
        double[] d = new double[n];
        int[] v = new int[n];
        double[] z = new double[n + 1];

        // Columns.
        for (int x = 0; x < width; x++) {
            for (int y = 0; y < height; y++) f[y] = squared[y * width + x];
            transform1d(f, height, d, v, z);
            for (int y = 0; y < height; y++) squared[y * width + x] = d[y];
        }
        // Rows.
        for (int y = 0; y < height; y++) {
            System.arraycopy(squared, y * width, f, 0, width);
            transform1d(f, width, d, v, z);
            System.arraycopy(d, 0, squared, y * width, width);
        }

        FloatGrid result = new FloatGrid(width, height);
        for (int i = 0; i < squared.length; i++) {
            result.set(i, (float) Math.sqrt(squared[i]));
        }
        return result;
    }

    /** Distances in meters, given the ground size of one pixel. */
    public static FloatGrid meters (BooleanGrid mask, double metersPerPixel) {
        FloatGrid distances = pixels(mask);
        for (int i = 0; i < distances.size(); i++) {
            distances.set(i, (float) (distances.get(i) * metersPerPixel));
        }
        return distances;
    }

    /**
     * One dimensional squared distance transform of the sampled function f over its first n entries, written to d.
     * v holds the locations of the parabolas in the lower envelope and z the boundaries between them.
     */
    private static void transform1d (double[] f, int n, double[] d, int[] v, double[] z) {
        int k = 0;
        v[0] = 0;
        z[0] = Double.NEGATIVE_INFINITY;
        z[1] = Double.POSITIVE_INFINITY;
        for (int q = 1; q < n; q++) {
            double s = intersection(f, q, v[k]);
            while (s <= z[k]) {
                k--;
                s = intersection(f, q, v[k]);
            }
            k++;
            v[k] = q;
            z[k] = s;
            z[k + 1] = Double.POSITIVE_INFINITY;
        }
        k = 0;
        for (int q = 0; q < n; q++) {
            while (z[k + 1] < q) k++;
            double dq = q - v[k];
            d[q] = dq * dq + f[v[k]];
        }
    }

    private static double intersection (double[] f, int q, int p) {
        return ((f[q] + (double) q * q) - (f[p] + (double) p * p)) / (2.0 * q - 2.0 * p);
    }
}
