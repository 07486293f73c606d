package com.conveyal.canopy.masks;

import com.conveyal.canopy.features.DetectedFeatures;
import com.conveyal.canopy.raster.BooleanGrid;
import com.conveyal.canopy.raster.FloatGrid;

/**
 * Every per-pixel layer the priority calculation needs, all with the raster's exact dimensions: the features detected
 * from color plus the masks rasterized from map geometry and the distance fields derived from them.
 */
public class FeatureMasks {

    public final int width;
    public final int height;

    public final BooleanGrid vegetation;
    public final BooleanGrid shadow;
    public final FloatGrid shadowIntensity;
    public final FloatGrid ndvi;

    public final BooleanGrid buildings;
    public final BooleanGrid streets;
    public final BooleanGrid sidewalks;

    /** Pixels where nothing can be planted: buildings, streets and existing vegetation. */
    public final BooleanGrid nonPlantable;

    /** Meters from each pixel to the nearest sidewalk pixel, infinite if there are no sidewalks. */
    public final FloatGrid sidewalkDistance;

    /** Meters from each pixel to the nearest building pixel, infinite if there are no buildings. */
    public final FloatGrid buildingDistance;

    public FeatureMasks (
            DetectedFeatures detected,
            BooleanGrid buildings,
            BooleanGrid streets,
            BooleanGrid sidewalks,
            FloatGrid sidewalkDistance,
            FloatGrid buildingDistance
    ) {
        this.width = detected.vegetation.width;
        this.height = detected.vegetation.height;
        buildings.checkShape(width, height, "Building mask");
        streets.checkShape(width, height, "Street mask");
        sidewalks.checkShape(width, height, "Sidewalk mask");
        sidewalkDistance.checkShape(width, height, "Sidewalk distance field");
        buildingDistance.checkShape(width, height, "Building distance field");
        this.vegetation = detected.vegetation;
        this.shadow = detected.shadow;
        this.shadowIntensity = detected.shadowIntensity;
        this.ndvi = detected.ndvi;
        this.buildings = buildings;
        this.streets = streets;
        this.sidewalks = sidewalks;
        this.sidewalkDistance = sidewalkDistance;
        this.buildingDistance = buildingDistance;
        this.nonPlantable = buildings.or(streets, vegetation);
    }

    public BooleanGrid plantable () {
        return nonPlantable.not();
    }
}
