package com.conveyal.canopy.scoring;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.raster.BooleanGrid;
import com.conveyal.canopy.raster.FloatGrid;

/**
 * Per-pixel priority scores for one raster. The raw score is the sum of the four components. The final score is the
 * raw score with every non-plantable pixel forced to zero; the override is applied after summation and the raw grid is
 * kept, so a zero can always be traced back to either a poor location or an exclusion.
 *
 * Each plantable pixel is labeled with a priority tier. Non-plantable pixels have no tier.
 */
public class ScoreGrid {

    private static final byte NO_TIER = -1;

    private static final PriorityTier[] TIERS = PriorityTier.values();

    public final int width;

    public final int height;

    public final ComponentScores components;

    public final FloatGrid raw;

    public final FloatGrid scores;

    public final BooleanGrid nonPlantable;

    private final byte[] tiers;

    public ScoreGrid (ComponentScores components, BooleanGrid nonPlantable, PlantabilityConfig config) {
        this.width = components.width();
        this.height = components.height();
        nonPlantable.checkShape(width, height, "Non-plantable mask");
        this.components = components;
        this.nonPlantable = nonPlantable;
        this.raw = new FloatGrid(width, height);
        this.scores = new FloatGrid(width, height);
        this.tiers = new byte[width * height];

        for (int i = 0; i < raw.size(); i++) {
            raw.set(i, components.sum(i));
        }
        raw.clip(0, (float) config.maxTotalPoints());

        for (int i = 0; i < raw.size(); i++) {
            if (nonPlantable.get(i)) {
                scores.set(i, 0);
                tiers[i] = NO_TIER;
            } else {
                float score = raw.get(i);
                scores.set(i, score);
                tiers[i] = (byte) PriorityTier.classify(score, config).ordinal();
            }
        }
    }

    public float score (int x, int y) {
        return scores.get(x, y);
    }

    /** The tier of a pixel, or null if the pixel is not plantable. */
    public PriorityTier tier (int x, int y) {
        byte t = tiers[y * width + x];
        return t == NO_TIER ? null : TIERS[t];
    }

    public BooleanGrid tierMask (PriorityTier tier) {
        BooleanGrid mask = new BooleanGrid(width, height);
        for (int i = 0; i < tiers.length; i++) {
            if (tiers[i] == tier.ordinal()) mask.set(i, true);
        }
        return mask;
    }

    public int tierCount (PriorityTier tier) {
        int count = 0;
        for (byte t : tiers) if (t == tier.ordinal()) count++;
        return count;
    }

    public int plantableCount () {
        return width * height - nonPlantable.count();
    }
}
