package com.conveyal.canopy.analysis;

import com.conveyal.canopy.models.AnalysisLocation;
import com.conveyal.canopy.results.AnalysisSummary;
import org.apache.commons.lang.exception.ExceptionUtils;

/**
 * The batch-level record of one location: its summary when the run succeeded, otherwise the reason it did not.
 */
public class LocationResult {

    public final AnalysisLocation location;

    public final RunStatus status;

    /** Null unless status is SUCCESS. */
    public final AnalysisSummary summary;

    /** Null when status is SUCCESS. */
    public final String error;

    private LocationResult (AnalysisLocation location, RunStatus status, AnalysisSummary summary, String error) {
        this.location = location;
        this.status = status;
        this.summary = summary;
        this.error = error;
    }

    public static LocationResult success (AnalysisLocation location, AnalysisSummary summary) {
        return new LocationResult(location, RunStatus.SUCCESS, summary, null);
    }

    public static LocationResult failed (AnalysisLocation location, Throwable t) {
        return new LocationResult(location, RunStatus.FAILED, null, ExceptionUtils.getRootCauseMessage(t));
    }

    public static LocationResult timeout (AnalysisLocation location, String message) {
        return new LocationResult(location, RunStatus.TIMEOUT, null, message);
    }

    public boolean isSuccess () {
        return status == RunStatus.SUCCESS;
    }

    @Override
    public String toString () {
        String name = location == null ? "(unnamed)" : location.name;
        return error == null ? name + ": " + status : name + ": " + status + " (" + error + ")";
    }
}
