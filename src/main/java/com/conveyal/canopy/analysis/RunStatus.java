package com.conveyal.canopy.analysis;

/** How a single location run in a batch ended. */
public enum RunStatus {
    SUCCESS,
    FAILED,
    TIMEOUT
}
