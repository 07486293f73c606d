package com.conveyal.canopy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The single unchecked exception type raised by the plantability core. The type tells callers (chiefly the batch
 * runner) whether the failure is a programmer error that must fail the whole location run, or a timeout.
 * Recoverable conditions such as malformed map features never reach this class, they are logged and counted.
 */
public class PlantabilityException extends RuntimeException {
    private static final Logger LOG = LoggerFactory.getLogger(PlantabilityException.class);

    public final TYPE type;

    public enum TYPE {
        CONFIGURATION,
        PRECONDITION,
        SERIALIZATION,
        TIMEOUT;
    }

    public static PlantabilityException configuration (String message) {
        return new PlantabilityException(TYPE.CONFIGURATION, message);
    }

    public static PlantabilityException precondition (String message) {
        return new PlantabilityException(TYPE.PRECONDITION, message);
    }

    public static PlantabilityException serialization (String message) {
        return new PlantabilityException(TYPE.SERIALIZATION, message);
    }

    public static PlantabilityException serialization (String message, Throwable cause) {
        return new PlantabilityException(TYPE.SERIALIZATION, message, cause);
    }

    public static PlantabilityException timeout (String message) {
        return new PlantabilityException(TYPE.TIMEOUT, message);
    }

    /**
     * Fail with a PRECONDITION error unless two grids have identical dimensions. Every per-pixel grid derived from a
     * raster must share its exact shape, there is no resampling anywhere in the pipeline.
     */
    public static void checkSameShape (String what, int width, int height, int expectedWidth, int expectedHeight) {
        if (width != expectedWidth || height != expectedHeight) {
            throw precondition(String.format("%s has dimensions %dx%d but the raster is %dx%d",
                    what, width, height, expectedWidth, expectedHeight));
        }
    }

    public PlantabilityException (TYPE type, String message) {
        super(message);
        this.type = type;
    }

    public PlantabilityException (TYPE type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        LOG.debug("Wrapping {} as {}", cause.getClass().getSimpleName(), type);
    }

    public boolean isTimeout () {
        return type == TYPE.TIMEOUT;
    }
}
