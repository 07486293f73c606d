package com.conveyal.canopy.analysis;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.PlantabilityException;
import com.conveyal.canopy.features.DetectedFeatures;
import com.conveyal.canopy.features.FeatureDetector;
import com.conveyal.canopy.geometry.AlignedGeometry;
import com.conveyal.canopy.geometry.GeometryAligner;
import com.conveyal.canopy.masks.FeatureMasks;
import com.conveyal.canopy.masks.MaskGenerator;
import com.conveyal.canopy.models.LocationInput;
import com.conveyal.canopy.models.RasterBuffer;
import com.conveyal.canopy.raster.Georeference;
import com.conveyal.canopy.scoring.PriorityCalculator;
import com.conveyal.canopy.scoring.ScoreGrid;
import com.conveyal.canopy.spots.CriticalSpot;
import com.conveyal.canopy.spots.SpotExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the five stages for one location, strictly in order and on the calling thread: align the map features to the
 * image, detect vegetation and shadow, build the masks, score every pixel, and extract critical spots. Nothing is kept
 * between runs, so any number of pipelines may run concurrently on separate threads.
 */
public abstract class PlantabilityPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(PlantabilityPipeline.class);

    public static PipelineResult run (LocationInput input, PlantabilityConfig config) {
        return run(input, config, Deadline.none());
    }

    public static PipelineResult run (LocationInput input, PlantabilityConfig config, Deadline deadline) {
        if (input == null || input.raster == null) {
            throw PlantabilityException.precondition("A location run needs a raster.");
        }
        RasterBuffer raster = input.raster;
        Georeference georeference = Georeference.of(raster);
        String name = input.location == null ? "(unnamed)" : input.location.name;
        LOG.info("Analyzing {}: {}x{} pixels at {} m/px", name, raster.width, raster.height, raster.metersPerPixel);
        long start = System.currentTimeMillis();

        deadline.check("alignment");
        long t = System.currentTimeMillis();
        AlignedGeometry aligned = GeometryAligner.align(raster, input.features, config);
        LOG.info("Alignment took {} ms", System.currentTimeMillis() - t);

        deadline.check("feature detection");
        t = System.currentTimeMillis();
        DetectedFeatures detected = FeatureDetector.detect(raster, config);
        LOG.info("Feature detection took {} ms", System.currentTimeMillis() - t);

        deadline.check("mask generation");
        t = System.currentTimeMillis();
        FeatureMasks masks = MaskGenerator.generate(aligned, raster, detected, config);
        LOG.info("Mask generation took {} ms", System.currentTimeMillis() - t);

        deadline.check("scoring");
        t = System.currentTimeMillis();
        ScoreGrid scoreGrid = PriorityCalculator.calculate(masks, aligned, raster, config);
        LOG.info("Scoring took {} ms", System.currentTimeMillis() - t);

        deadline.check("spot extraction");
        t = System.currentTimeMillis();
        List<CriticalSpot> spots = SpotExtractor.extract(scoreGrid, georeference, config);
        LOG.info("Spot extraction took {} ms", System.currentTimeMillis() - t);

        // A run that finished after its deadline is still a timeout, partial or late results are not reported.
        deadline.check("summary");
        LOG.info("Finished {} in {} ms with {} critical spots", name, System.currentTimeMillis() - start, spots.size());
        return new PipelineResult(input.location, georeference, aligned, masks, scoreGrid, spots);
    }
}
