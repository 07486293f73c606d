package com.conveyal.canopy.raster;

import com.conveyal.canopy.PlantabilityException;

import java.util.BitSet;

/**
 * A mask with one true or false value per pixel, stored row major in a BitSet.
 */
public class BooleanGrid {

    public final int width;

    public final int height;

    private final BitSet bits;

    public BooleanGrid (int width, int height) {
        if (width <= 0 || height <= 0) {
            throw PlantabilityException.precondition("Grid dimensions must be positive, got " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.bits = new BitSet(width * height);
    }

    public boolean get (int x, int y) {
        return bits.get(y * width + x);
    }

    public boolean get (int index) {
        return bits.get(index);
    }

    public void set (int x, int y, boolean value) {
        bits.set(y * width + x, value);
    }

    public void set (int index, boolean value) {
        bits.set(index, value);
    }

    public boolean contains (int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public int count () {
        return bits.cardinality();
    }

    public boolean isEmpty () {
        return bits.isEmpty();
    }

    public int size () {
        return width * height;
    }

    /** Index of the first set pixel at or after the given index, or -1. */
    public int nextSet (int fromIndex) {
        return bits.nextSetBit(fromIndex);
    }

    public BooleanGrid copy () {
        BooleanGrid copy = new BooleanGrid(width, height);
        copy.bits.or(bits);
        return copy;
    }

    /** A new grid true wherever this one or any of the others is true. */
    public BooleanGrid or (BooleanGrid... others) {
        BooleanGrid result = copy();
        for (BooleanGrid other : others) {
            result.checkSameShape(other, "Combined mask");
            result.bits.or(other.bits);
        }
        return result;
    }

    public BooleanGrid andNot (BooleanGrid other) {
        checkSameShape(other, "Subtracted mask");
        BooleanGrid result = copy();
        result.bits.andNot(other.bits);
        return result;
    }

    public BooleanGrid not () {
        BooleanGrid result = copy();
        result.bits.flip(0, width * height);
        return result;
    }

    public void checkSameShape (BooleanGrid other, String what) {
        PlantabilityException.checkSameShape(what, other.width, other.height, width, height);
    }

    public void checkShape (int expectedWidth, int expectedHeight, String what) {
        PlantabilityException.checkSameShape(what, width, height, expectedWidth, expectedHeight);
    }

    @Override
    public boolean equals (Object other) {
        if (!(other instanceof BooleanGrid)) return false;
        BooleanGrid o = (BooleanGrid) other;
        return width == o.width && height == o.height && bits.equals(o.bits);
    }

    @Override
    public int hashCode () {
        return 31 * (31 * width + height) + bits.hashCode();
    }
}
