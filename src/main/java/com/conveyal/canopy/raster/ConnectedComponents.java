package com.conveyal.canopy.raster;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;
import java.util.List;

/**
 * Labels the 8-connected regions of true pixels in a mask. Regions are numbered from 1 in raster scan order of their
 * first (top left most) pixel, so labeling is deterministic for a given mask. Label 0 is background.
 */
public class ConnectedComponents {

    public final int width;

    public final int height;

    private final int[] labels;

    /** Sorted pixel indexes of each region, at position label - 1. */
    private final List<TIntArrayList> regions = new ArrayList<>();

    private ConnectedComponents (int width, int height) {
        this.width = width;
        this.height = height;
        this.labels = new int[width * height];
    }

    public static ConnectedComponents label (BooleanGrid mask) {
        ConnectedComponents components = new ConnectedComponents(mask.width, mask.height);
        TIntArrayList stack = new TIntArrayList();
        for (int start = mask.nextSet(0); start >= 0; start = mask.nextSet(start + 1)) {
            if (components.labels[start] != 0) continue;
            int label = components.regions.size() + 1;
            TIntArrayList pixels = new TIntArrayList();
            components.labels[start] = label;
            stack.add(start);
            while (!stack.isEmpty()) {
                int i = stack.removeAt(stack.size() - 1);
                pixels.add(i);
                int x = i % mask.width;
                int y = i / mask.width;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int nx = x + dx;
                        int ny = y + dy;
                        if ((dx == 0 && dy == 0) || !mask.contains(nx, ny)) continue;
                        int n = ny * mask.width + nx;
                        if (mask.get(n) && components.labels[n] == 0) {
                            components.labels[n] = label;
                            stack.add(n);
                        }
                    }
                }
            }
            pixels.sort();
            components.regions.add(pixels);
        }
        return components;
    }

    /** Number of regions found. */
    public int count () {
        return regions.size();
    }

    public int labelAt (int x, int y) {
        return labels[y * width + x];
    }

    /** Number of pixels in the region with the given label (1-based). */
    public int size (int label) {
        return regions.get(label - 1).size();
    }

    /** Sorted pixel indexes of the region with the given label (1-based). */
    public TIntArrayList pixels (int label) {
        return regions.get(label - 1);
    }

    /** A copy of the mask keeping only regions of at least the given number of pixels. */
    public BooleanGrid withoutRegionsSmallerThan (int minPixels) {
        BooleanGrid result = new BooleanGrid(width, height);
        for (TIntArrayList region : regions) {
            if (region.size() < minPixels) continue;
            for (int j = 0; j < region.size(); j++) result.set(region.get(j), true);
        }
        return result;
    }
}
