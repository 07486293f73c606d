package com.conveyal.canopy.models;

import org.locationtech.jts.geom.Geometry;

/**
 * A single map feature as delivered by the acquisition collaborator, in geographic coordinates (x = longitude,
 * y = latitude). Streets carry their traffic class, which is the OSM highway tag value.
 */
public class VectorFeature {

    public enum Type {
        BUILDING,
        STREET,
        AMENITY
    }

    public final Type type;
    public final Geometry geometry;
    public final String trafficClass;
    public final String id;

    public VectorFeature (Type type, Geometry geometry, String trafficClass, String id) {
        this.type = type;
        this.geometry = geometry;
        this.trafficClass = trafficClass;
        this.id = id;
    }

    public static VectorFeature building (Geometry geometry) {
        return new VectorFeature(Type.BUILDING, geometry, null, null);
    }

    public static VectorFeature street (Geometry geometry, String trafficClass) {
        return new VectorFeature(Type.STREET, geometry, trafficClass, null);
    }

    public static VectorFeature amenity (Geometry geometry) {
        return new VectorFeature(Type.AMENITY, geometry, null, null);
    }

    @Override
    public String toString () {
        String label = id == null ? type.name() : type.name() + " " + id;
        return trafficClass == null ? label : label + " (" + trafficClass + ")";
    }
}
