package com.conveyal.canopy;

import com.conveyal.canopy.geometry.TrafficTier;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Properties;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.Assert.fail;

public class PlantabilityConfigTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void defaultsAreLoadedFromClasspath () {
        PlantabilityConfig config = PlantabilityConfig.defaults();
        assertThat(config.alignmentScale, closeTo(1.95, 1e-12));
        assertThat(config.alignmentOffsetNorthMeters, closeTo(-5, 1e-12));
        assertThat(config.alignmentOffsetEastMeters, closeTo(-10, 1e-12));
        assertThat(config.bufferDistance(TrafficTier.HIGH), closeTo(25, 1e-12));
        assertThat(config.bufferDistance(TrafficTier.PEDESTRIAN), closeTo(5, 1e-12));
        assertThat(config.maxTotalPoints(), closeTo(90, 1e-12));
        assertThat(config.minClusterPixels, equalTo(20));
        assertThat(config.sidewalkBands.lookup(5), closeTo(35, 1e-12));
    }

    @Test
    public void overridesReturnNewConfig () {
        PlantabilityConfig defaults = PlantabilityConfig.defaults();
        PlantabilityConfig changed = defaults.with("ndvi-threshold", 0.1).with("min-cluster-px", "50");
        assertThat(changed.ndviThreshold, closeTo(0.1, 1e-12));
        assertThat(changed.minClusterPixels, equalTo(50));
        assertThat(defaults.ndviThreshold, closeTo(0.2, 1e-12));
    }

    @Test
    public void missingKeysAreReportedTogether () {
        Properties overrides = new Properties();
        overrides.setProperty("ndvi-threshold", " ");
        overrides.setProperty("high-cutoff", "");
        try {
            PlantabilityConfig.fromProperties(overrides);
            fail("Blank values should be treated as missing.");
        } catch (PlantabilityException e) {
            assertThat(e.type, equalTo(PlantabilityException.TYPE.CONFIGURATION));
            assertThat(e.getMessage(), containsString("ndvi-threshold"));
            assertThat(e.getMessage(), containsString("high-cutoff"));
        }
    }

    @Test
    public void cutoffsMustIncrease () {
        try {
            PlantabilityConfig.defaults().with("high-cutoff", "85");
            fail("High cutoff above critical cutoff should be rejected.");
        } catch (PlantabilityException e) {
            assertThat(e.type, equalTo(PlantabilityException.TYPE.CONFIGURATION));
        }
    }

    @Test
    public void bandsMayNotExceedComponentMaximum () {
        try {
            PlantabilityConfig.defaults().with("sidewalk-bands", "5:40,10:28");
            fail("Band awarding more than the sidewalk maximum should be rejected.");
        } catch (PlantabilityException e) {
            assertThat(e.getMessage(), containsString("sidewalk-bands"));
        }
    }

    @Test
    public void unparseableNumberIsConfigurationError () {
        try {
            PlantabilityConfig.defaults().with("alignment-scale", "large");
            fail("Non-numeric scale should be rejected.");
        } catch (PlantabilityException e) {
            assertThat(e.type, equalTo(PlantabilityException.TYPE.CONFIGURATION));
            assertThat(e.getMessage(), containsString("alignment-scale"));
        }
    }

    @Test
    public void integerOverridesParseAsIntegers () {
        PlantabilityConfig changed = PlantabilityConfig.defaults()
                .with("min-cluster-px", 50)
                .with("shadow-min-cluster-px", 10);
        assertThat(changed.minClusterPixels, equalTo(50));
        assertThat(changed.shadowMinClusterPixels, equalTo(10));
    }

    @Test
    public void fileOverridesAreLaidOverDefaults () throws IOException {
        File file = folder.newFile("canopy.properties");
        Properties properties = new Properties();
        properties.setProperty("min-cluster-px", "12");
        properties.setProperty("sidewalk-buffer-m", "2.5");
        try (OutputStream os = new FileOutputStream(file)) {
            properties.store(os, null);
        }
        PlantabilityConfig config = PlantabilityConfig.load(file);
        assertThat(config.minClusterPixels, equalTo(12));
        assertThat(config.sidewalkBufferMeters, closeTo(2.5, 0));
        assertThat(config.ndviThreshold, closeTo(0.2, 1e-12));
    }

    @Test
    public void unreadableFileIsConfigurationError () {
        File missing = new File(folder.getRoot(), "absent.properties");
        try {
            PlantabilityConfig.load(missing);
            fail("A missing config file should be rejected.");
        } catch (PlantabilityException e) {
            assertThat(e.type, equalTo(PlantabilityException.TYPE.CONFIGURATION));
            assertThat(e.getMessage(), containsString("absent.properties"));
        }
    }
}
