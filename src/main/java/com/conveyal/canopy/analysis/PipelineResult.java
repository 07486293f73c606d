package com.conveyal.canopy.analysis;

import com.conveyal.canopy.geometry.AlignedGeometry;
import com.conveyal.canopy.masks.FeatureMasks;
import com.conveyal.canopy.models.AnalysisLocation;
import com.conveyal.canopy.raster.Georeference;
import com.conveyal.canopy.scoring.ScoreGrid;
import com.conveyal.canopy.spots.CriticalSpot;
import com.google.common.collect.ImmutableList;

import java.util.List;

/** Everything one location run produced, before conversion to the portable summary. */
public class PipelineResult {

    public final AnalysisLocation location;

    public final Georeference georeference;

    public final AlignedGeometry aligned;

    public final FeatureMasks masks;

    public final ScoreGrid scoreGrid;

    /** In descending priority. */
    public final List<CriticalSpot> spots;

    public PipelineResult (AnalysisLocation location, Georeference georeference, AlignedGeometry aligned,
                           FeatureMasks masks, ScoreGrid scoreGrid, List<CriticalSpot> spots) {
        this.location = location;
        this.georeference = georeference;
        this.aligned = aligned;
        this.masks = masks;
        this.scoreGrid = scoreGrid;
        this.spots = ImmutableList.copyOf(spots);
    }
}
