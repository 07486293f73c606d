package com.conveyal.canopy.analysis;

import com.conveyal.canopy.PlantabilityException;
import com.google.common.math.LongMath;

import java.util.concurrent.TimeUnit;

/**
 * A point in time after which a location run must give up. Checked between pipeline stages, so a stage already under
 * way is allowed to finish before the run is abandoned.
 */
public class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE);

    /** In System.nanoTime() units, or Long.MAX_VALUE for no limit. */
    private final long expiresAtNanos;

    private Deadline (long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after (long duration, TimeUnit unit) {
        if (duration < 0) throw new IllegalArgumentException("Timeout must not be negative: " + duration);
        long expiresAt = LongMath.saturatedAdd(System.nanoTime(), unit.toNanos(duration));
        return expiresAt == Long.MAX_VALUE ? NONE : new Deadline(expiresAt);
    }

    public static Deadline none () {
        return NONE;
    }

    public boolean isExpired () {
        return expiresAtNanos != Long.MAX_VALUE && System.nanoTime() - expiresAtNanos >= 0;
    }

    /** Throw a TIMEOUT error naming the stage about to start if the deadline has passed. */
    public void check (String stage) {
        if (isExpired()) {
            throw PlantabilityException.timeout("Deadline passed before stage: " + stage);
        }
    }
}
