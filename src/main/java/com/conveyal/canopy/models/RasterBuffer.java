package com.conveyal.canopy.models;

import com.conveyal.canopy.PlantabilityException;

import java.awt.image.BufferedImage;

/**
 * An RGB satellite image together with the geographic box it covers and its ground resolution. Pixels are stored row
 * major from the top left (north west) corner, each packed as 0xRRGGBB. Instances are immutable: the pixel array is
 * copied on the way in and never handed out.
 */
public class RasterBuffer {

    public final int width;

    public final int height;

    public final GeoBounds bounds;

    /** Ground distance covered by one pixel edge, in meters. */
    public final double metersPerPixel;

    private final int[] rgb;

    public RasterBuffer (int width, int height, int[] rgb, GeoBounds bounds, double metersPerPixel) {
        if (width <= 0 || height <= 0) {
            throw PlantabilityException.precondition("Raster dimensions must be positive, got " + width + "x" + height);
        }
        if (rgb == null || rgb.length != width * height) {
            throw PlantabilityException.precondition("Raster pixel array does not match its " + width + "x" + height + " dimensions.");
        }
        if (bounds == null) {
            throw PlantabilityException.precondition("Raster has no bounding box.");
        }
        if (!(metersPerPixel > 0) || Double.isInfinite(metersPerPixel)) {
            throw PlantabilityException.precondition("Ground resolution must be a positive number of meters per pixel.");
        }
        this.width = width;
        this.height = height;
        this.rgb = rgb.clone();
        this.bounds = bounds;
        this.metersPerPixel = metersPerPixel;
    }

    /** Copy the pixels of an already decoded image. Any alpha channel is discarded. */
    public static RasterBuffer fromImage (BufferedImage image, GeoBounds bounds, double metersPerPixel) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = image.getRGB(0, 0, width, height, null, 0, width);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] &= 0xFFFFFF;
        }
        return new RasterBuffer(width, height, pixels, bounds, metersPerPixel);
    }

    public int red (int x, int y) {
        return (rgb[index(x, y)] >> 16) & 0xFF;
    }

    public int green (int x, int y) {
        return (rgb[index(x, y)] >> 8) & 0xFF;
    }

    public int blue (int x, int y) {
        return rgb[index(x, y)] & 0xFF;
    }

    public int rgb (int x, int y) {
        return rgb[index(x, y)];
    }

    public int pixelCount () {
        return width * height;
    }

    /** Area covered by a single pixel in square meters. */
    public double pixelAreaSquareMeters () {
        return metersPerPixel * metersPerPixel;
    }

    private int index (int x, int y) {
        return y * width + x;
    }
}
