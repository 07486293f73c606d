package com.conveyal.canopy.raster;

/**
 * A continuous position in pixel space: x increases to the right (east) and y downward (south). Pixel (i, j) covers
 * [i, i+1) x [j, j+1), so its center is at (i + 0.5, j + 0.5).
 */
public class PixelCoordinate {
    public final double x;
    public final double y;

    public PixelCoordinate (double x, double y) {
        this.x = x;
        this.y = y;
    }

    public static PixelCoordinate centerOf (int x, int y) {
        return new PixelCoordinate(x + 0.5, y + 0.5);
    }

    /** Column of the pixel containing this position. */
    public int column () {
        return (int) Math.floor(x);
    }

    /** Row of the pixel containing this position. */
    public int row () {
        return (int) Math.floor(y);
    }

    @Override
    public String toString () {
        return String.format("(%.2f, %.2f)", x, y);
    }
}
