package com.conveyal.canopy.models;

import com.google.common.collect.ImmutableList;

import java.util.Collection;
import java.util.List;

/**
 * The buildings, streets and points of interest fetched for one location. Order carries no meaning. The collection may
 * be empty when the map source had nothing for the area, which the pipeline treats as a normal (if degraded) input.
 */
public class VectorFeatureCollection {

    public final List<VectorFeature> features;

    public VectorFeatureCollection (Collection<VectorFeature> features) {
        this.features = ImmutableList.copyOf(features);
    }

    public static VectorFeatureCollection empty () {
        return new VectorFeatureCollection(ImmutableList.of());
    }

    public boolean isEmpty () {
        return features.isEmpty();
    }

    public int size () {
        return features.size();
    }
}
