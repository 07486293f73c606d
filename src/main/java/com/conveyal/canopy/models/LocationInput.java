package com.conveyal.canopy.models;

/** Everything needed to analyze one location, already fetched: the place, its imagery and its map features. */
public class LocationInput {
    public final AnalysisLocation location;
    public final RasterBuffer raster;
    public final VectorFeatureCollection features;

    public LocationInput (AnalysisLocation location, RasterBuffer raster, VectorFeatureCollection features) {
        this.location = location;
        this.raster = raster;
        this.features = features;
    }
}
