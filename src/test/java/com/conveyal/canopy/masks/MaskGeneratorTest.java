package com.conveyal.canopy.masks;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.TestUtils;
import com.conveyal.canopy.features.DetectedFeatures;
import com.conveyal.canopy.features.FeatureDetector;
import com.conveyal.canopy.geometry.AlignedGeometry;
import com.conveyal.canopy.geometry.GeometryAligner;
import com.conveyal.canopy.models.RasterBuffer;
import com.conveyal.canopy.models.VectorFeature;
import com.conveyal.canopy.models.VectorFeatureCollection;
import org.junit.Test;

import java.util.Arrays;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.equalTo;

public class MaskGeneratorTest {

    private final PlantabilityConfig config = TestUtils.identityAlignmentConfig();

    private final RasterBuffer raster = TestUtils.uniformRaster(100, 100, TestUtils.GRAY, 1);

    private FeatureMasks masks (VectorFeature... features) {
        AlignedGeometry aligned = GeometryAligner.align(raster, new VectorFeatureCollection(Arrays.asList(features)), config);
        DetectedFeatures detected = FeatureDetector.detect(raster, config);
        return MaskGenerator.generate(aligned, raster, detected, config);
    }

    @Test
    public void buildingFootprintIsRasterized () {
        FeatureMasks masks = masks(VectorFeature.building(TestUtils.rectangle(raster, 10, 10, 20, 20)));
        assertThat(masks.buildings.count(), equalTo(100));
        assertThat(masks.nonPlantable.count(), equalTo(100));
        assertThat((double) masks.buildingDistance.get(15, 15), closeTo(0, 0));
        assertThat((double) masks.buildingDistance.get(25, 15), closeTo(6, 1e-5));
    }

    @Test
    public void streetWidthDependsOnTrafficTier () {
        FeatureMasks low = masks(VectorFeature.street(TestUtils.line(raster, 0, 50, 100, 50), "residential"));
        FeatureMasks high = masks(VectorFeature.street(TestUtils.line(raster, 0, 50, 100, 50), "primary"));
        // 10 m either side of the center line, 1 m pixels.
        assertThat(low.streets.count(), equalTo(2000));
        // 25 m either side.
        assertThat(high.streets.count(), equalTo(5000));
    }

    @Test
    public void onlyQuietStreetsProduceSidewalks () {
        FeatureMasks low = masks(VectorFeature.street(TestUtils.line(raster, 0, 50, 100, 50), "residential"));
        FeatureMasks high = masks(VectorFeature.street(TestUtils.line(raster, 0, 50, 100, 50), "primary"));
        assertThat(low.sidewalks.count(), equalTo(1000));
        assertThat((double) low.sidewalkDistance.get(50, 30), closeTo(15, 1e-5));
        assertThat(high.sidewalks.isEmpty(), equalTo(true));
        assertThat(Float.isInfinite(high.sidewalkDistance.get(50, 30)), equalTo(true));
    }

    @Test
    public void noGeometryGivesEmptyMasks () {
        FeatureMasks masks = masks();
        assertThat(masks.buildings.isEmpty(), equalTo(true));
        assertThat(masks.streets.isEmpty(), equalTo(true));
        assertThat(masks.sidewalks.isEmpty(), equalTo(true));
        assertThat(masks.plantable().count(), equalTo(10000));
    }
}
