package com.conveyal.canopy.scoring;

import com.conveyal.canopy.raster.FloatGrid;

/** The four independently computed factor grids that add up to a pixel's raw priority score. */
public class ComponentScores {

    public final FloatGrid sidewalk;
    public final FloatGrid building;
    public final FloatGrid sun;
    public final FloatGrid amenity;

    public ComponentScores (FloatGrid sidewalk, FloatGrid building, FloatGrid sun, FloatGrid amenity) {
        building.checkShape(sidewalk.width, sidewalk.height, "Building component");
        sun.checkShape(sidewalk.width, sidewalk.height, "Sun component");
        amenity.checkShape(sidewalk.width, sidewalk.height, "Amenity component");
        this.sidewalk = sidewalk;
        this.building = building;
        this.sun = sun;
        this.amenity = amenity;
    }

    public int width () {
        return sidewalk.width;
    }

    public int height () {
        return sidewalk.height;
    }

    /** Component sum at one pixel, always added in the same order so repeated runs agree to the bit. */
    public float sum (int index) {
        return sidewalk.get(index) + building.get(index) + sun.get(index) + amenity.get(index);
    }
}
