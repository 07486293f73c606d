package com.conveyal.canopy.raster;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Binary morphology with a square structuring element. Neighbors outside the grid are ignored rather than treated as
 * false, so a closing never removes pixels that were set, even along the edges of the image.
 */
public abstract class Morphology {

    public static BooleanGrid dilate (BooleanGrid mask, int radius) {
        checkArgument(radius >= 0, "Structuring element radius must not be negative.");
        BooleanGrid result = new BooleanGrid(mask.width, mask.height);
        for (int i = mask.nextSet(0); i >= 0; i = mask.nextSet(i + 1)) {
            int x = i % mask.width;
            int y = i / mask.width;
            for (int dy = -radius; dy <= radius; dy++) {
                for (int dx = -radius; dx <= radius; dx++) {
                    if (mask.contains(x + dx, y + dy)) result.set(x + dx, y + dy, true);
                }
            }
        }
        return result;
    }

    public static BooleanGrid erode (BooleanGrid mask, int radius) {
        checkArgument(radius >= 0, "Structuring element radius must not be negative.");
        BooleanGrid result = new BooleanGrid(mask.width, mask.height);
        for (int i = mask.nextSet(0); i >= 0; i = mask.nextSet(i + 1)) {
            int x = i % mask.width;
            int y = i / mask.width;
            boolean keep = true;
            for (int dy = -radius; dy <= radius && keep; dy++) {
                for (int dx = -radius; dx <= radius; dx++) {
                    if (mask.contains(x + dx, y + dy) && !mask.get(x + dx, y + dy)) {
                        keep = false;
                        break;
                    }
                }
            }
            if (keep) result.set(i, true);
        }
        return result;
    }

    /** Dilation followed by erosion: fills holes and gaps narrower than the structuring element. */
    public static BooleanGrid close (BooleanGrid mask, int radius) {
        return erode(dilate(mask, radius), radius);
    }
}
