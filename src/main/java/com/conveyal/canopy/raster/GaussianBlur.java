package com.conveyal.canopy.raster;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Separable Gaussian smoothing. The kernel extends three standard deviations each way and is normalized to sum to
 * one; pixels beyond the edge take the value of the nearest edge pixel, so a uniform grid stays uniform.
 */
public abstract class GaussianBlur {

    public static FloatGrid blur (FloatGrid input, double sigma) {
        checkArgument(sigma >= 0, "Gaussian sigma must not be negative.");
        if (sigma == 0) return input.copy();
        double[] kernel = kernel(sigma);
        int radius = kernel.length / 2;
        int width = input.width;
        int height = input.height;

        FloatGrid horizontal = new FloatGrid(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = -radius; k <= radius; k++) {
                    int sx = clamp(x + k, width);
                    sum += kernel[k + radius] * input.get(sx, y);
                }
                horizontal.set(x, y, (float) sum);
            }
        }
        FloatGrid result = new FloatGrid(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = -radius; k <= radius; k++) {
                    int sy = clamp(y + k, height);
                    sum += kernel[k + radius] * horizontal.get(x, sy);
                }
                result.set(x, y, (float) sum);
            }
        }
        return result;
    }

    static double[] kernel (double sigma) {
        int radius = Math.max(1, (int) Math.ceil(3 * sigma));
        double[] kernel = new double[2 * radius + 1];
        double total = 0;
        for (int i = -radius; i <= radius; i++) {
            double w = Math.exp(-(i * i) / (2 * sigma * sigma));
            kernel[i + radius] = w;
            total += w;
        }
        for (int i = 0; i < kernel.length; i++) kernel[i] /= total;
        return kernel;
    }

    private static int clamp (int i, int size) {
        return i < 0 ? 0 : (i >= size ? size - 1 : i);
    }
}
