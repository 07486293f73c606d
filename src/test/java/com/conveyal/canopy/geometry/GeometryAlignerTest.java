package com.conveyal.canopy.geometry;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.TestUtils;
import com.conveyal.canopy.models.RasterBuffer;
import com.conveyal.canopy.models.VectorFeature;
import com.conveyal.canopy.models.VectorFeatureCollection;
import com.conveyal.canopy.raster.Georeference;
import org.junit.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import java.util.Arrays;

import static com.conveyal.canopy.TestUtils.GEOMETRY_FACTORY;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;

public class GeometryAlignerTest {

    private final RasterBuffer raster = TestUtils.uniformRaster(100, 100, TestUtils.GRAY, 0.5);

    @Test
    public void emptyFeaturesGiveEmptyGeometry () {
        AlignedGeometry aligned = GeometryAligner.align(raster, VectorFeatureCollection.empty(),
                PlantabilityConfig.defaults());
        assertThat(aligned.isEmpty(), equalTo(true));
        assertThat(aligned.droppedFeatures, equalTo(0));
    }

    @Test
    public void scaleIsAboutCenterThenOffsetApplied () {
        LocalProjection projection = Georeference.of(raster).projection;
        Point amenity = GEOMETRY_FACTORY.createPoint(new Coordinate(projection.longitude(10), projection.latitude(20)));
        AlignedGeometry aligned = GeometryAligner.align(raster,
                new VectorFeatureCollection(Arrays.asList(VectorFeature.amenity(amenity))), PlantabilityConfig.defaults());

        Coordinate c = aligned.amenities.get(0);
        // 10 m east scaled by 1.95 then shifted 10 m west, 20 m north scaled then shifted 5 m south.
        assertThat(c.x, closeTo(10 * 1.95 - 10, 1e-6));
        assertThat(c.y, closeTo(20 * 1.95 - 5, 1e-6));
        assertThat(aligned.scale, closeTo(1.95, 0));
    }

    @Test
    public void malformedFeaturesAreDroppedAndCounted () {
        Coordinate a = TestUtils.lonLat(raster, 10, 10);
        Coordinate b = TestUtils.lonLat(raster, 20, 10);
        Coordinate c = TestUtils.lonLat(raster, 10, 20);
        Coordinate d = TestUtils.lonLat(raster, 20, 20);
        // Edges cross in the middle.
        Polygon bowtie = GEOMETRY_FACTORY.createPolygon(new Coordinate[] { a, d, b, c, a });
        Polygon good = TestUtils.rectangle(raster, 30, 30, 40, 40);

        AlignedGeometry aligned = GeometryAligner.align(raster, new VectorFeatureCollection(Arrays.asList(
                VectorFeature.building(bowtie),
                VectorFeature.building(good),
                VectorFeature.building(TestUtils.line(raster, 0, 0, 5, 5)),
                VectorFeature.street(GEOMETRY_FACTORY.createLineString(new Coordinate[0]), "primary")
        )), TestUtils.identityAlignmentConfig());

        assertThat(aligned.buildings.size(), equalTo(1));
        assertThat(aligned.streetCount(), equalTo(0));
        assertThat(aligned.droppedFeatures, equalTo(3));
    }

    @Test
    public void streetsAreGroupedByTrafficTier () {
        AlignedGeometry aligned = GeometryAligner.align(raster, new VectorFeatureCollection(Arrays.asList(
                VectorFeature.street(TestUtils.line(raster, 0, 10, 100, 10), "footway"),
                VectorFeature.street(TestUtils.line(raster, 0, 20, 100, 20), "residential"),
                VectorFeature.street(TestUtils.line(raster, 0, 30, 100, 30), "secondary"),
                VectorFeature.street(TestUtils.line(raster, 0, 40, 100, 40), "motorway"),
                VectorFeature.street(TestUtils.line(raster, 0, 50, 100, 50), null)
        )), PlantabilityConfig.defaults());

        assertThat(aligned.streets(TrafficTier.PEDESTRIAN).size(), equalTo(1));
        assertThat(aligned.streets(TrafficTier.LOW).size(), equalTo(2));
        assertThat(aligned.streets(TrafficTier.MEDIUM).size(), equalTo(1));
        assertThat(aligned.streets(TrafficTier.HIGH).size(), equalTo(1));
        assertThat(aligned.sidewalkStreets().size(), equalTo(3));
        assertThat(aligned.bufferDistance(TrafficTier.HIGH), closeTo(25, 0));
    }

    @Test
    public void polygonalAmenityBecomesOnePoint () {
        AlignedGeometry aligned = GeometryAligner.align(raster, new VectorFeatureCollection(Arrays.asList(
                VectorFeature.amenity(TestUtils.rectangle(raster, 40, 40, 60, 60))
        )), TestUtils.identityAlignmentConfig());

        assertThat(aligned.amenities.size(), equalTo(1));
        // The square is centered on the raster, which is the origin of the local plane.
        assertThat(aligned.amenities.get(0).x, closeTo(0, 1e-3));
        assertThat(aligned.amenities.get(0).y, closeTo(0, 1e-3));
    }

    @Test
    public void missingFeaturesAreTreatedAsNone () {
        AlignedGeometry aligned = GeometryAligner.align(raster, null, TestUtils.identityAlignmentConfig());
        assertThat(aligned.isEmpty(), equalTo(true));
        assertThat(aligned.droppedFeatures, equalTo(0));
    }
}
