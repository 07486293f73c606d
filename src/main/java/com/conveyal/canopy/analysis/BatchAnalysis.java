package com.conveyal.canopy.analysis;

import com.conveyal.canopy.PlantabilityConfig;
import com.conveyal.canopy.PlantabilityException;
import com.conveyal.canopy.models.AnalysisLocation;
import com.conveyal.canopy.models.LocationInput;
import com.conveyal.canopy.results.AnalysisSummary;
import com.conveyal.canopy.results.SummaryAssembler;
import com.google.common.base.Preconditions;
import com.google.common.math.LongMath;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Analyzes many locations on a fixed pool of worker threads, one task per location. Locations share nothing but the
 * immutable configuration. A location that fails or runs out of time is recorded as such and never stops the others.
 * Results come back in the same order as the inputs.
 */
public class BatchAnalysis implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(BatchAnalysis.class);

    /** Extra time a task gets past its own deadline before the batch stops waiting and cancels it. */
    public static final long GRACE_MILLIS = 5_000;

    /** How often to look again at a task that is still queued behind others. */
    private static final long QUEUED_POLL_MILLIS = 100;

    private final PlantabilityConfig config;

    /** Zero or negative for no limit. */
    private final long timeoutMillis;

    private final Clock clock;

    private final ExecutorService executor;

    public BatchAnalysis (PlantabilityConfig config, int threads, long timeoutMillis) {
        this(config, threads, timeoutMillis, Clock.systemUTC());
    }

    public BatchAnalysis (PlantabilityConfig config, int threads, long timeoutMillis, Clock clock) {
        Preconditions.checkArgument(threads > 0, "Thread count must be positive.");
        this.config = Preconditions.checkNotNull(config);
        this.timeoutMillis = timeoutMillis;
        this.clock = clock;
        this.executor = Executors.newFixedThreadPool(threads,
                new ThreadFactoryBuilder().setDaemon(true).setNameFormat("canopy-worker-%d").build());
    }

    /** Tracks when a task actually started running, since it may sit in the queue first. */
    private class LocationTask {
        final LocationInput input;
        final AtomicLong startedAt = new AtomicLong(0);
        Future<AnalysisSummary> future;

        LocationTask (LocationInput input) {
            this.input = input;
        }

        AnalysisSummary call () {
            startedAt.set(System.currentTimeMillis());
            Deadline deadline = timeoutMillis > 0 ? Deadline.after(timeoutMillis, TimeUnit.MILLISECONDS) : Deadline.none();
            PipelineResult result = PlantabilityPipeline.run(input, config, deadline);
            return SummaryAssembler.assemble(result, config, clock);
        }
    }

    public List<LocationResult> run (List<LocationInput> inputs) {
        LOG.info("Starting batch of {} locations", inputs.size());
        List<LocationTask> tasks = new ArrayList<>();
        for (LocationInput input : inputs) {
            LocationTask task = new LocationTask(input);
            task.future = executor.submit(task::call);
            tasks.add(task);
        }
        List<LocationResult> results = new ArrayList<>();
        for (LocationTask task : tasks) {
            results.add(await(task));
        }
        long succeeded = results.stream().filter(LocationResult::isSuccess).count();
        LOG.info("Batch finished: {} of {} locations succeeded", succeeded, results.size());
        return results;
    }

    private LocationResult await (LocationTask task) {
        AnalysisLocation location = task.input == null ? null : task.input.location;
        try {
            while (true) {
                long started = task.startedAt.get();
                try {
                    if (timeoutMillis <= 0) {
                        return LocationResult.success(location, task.future.get());
                    } else if (started == 0) {
                        return LocationResult.success(location,
                                task.future.get(QUEUED_POLL_MILLIS, TimeUnit.MILLISECONDS));
                    } else {
                        long giveUpAt = LongMath.saturatedAdd(LongMath.saturatedAdd(started, timeoutMillis), GRACE_MILLIS);
                        long remaining = giveUpAt - System.currentTimeMillis();
                        return LocationResult.success(location,
                                task.future.get(Math.max(remaining, 0), TimeUnit.MILLISECONDS));
                    }
                } catch (TimeoutException e) {
                    if (started != 0) {
                        task.future.cancel(true);
                        LOG.error("Location {} did not finish within {} ms, cancelled.", location, timeoutMillis);
                        return LocationResult.timeout(location,
                                String.format("Analysis did not finish within %d ms", timeoutMillis));
                    }
                }
            }
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PlantabilityException && ((PlantabilityException) cause).isTimeout()) {
                LOG.error("Location {} timed out: {}", location, cause.getMessage());
                return LocationResult.timeout(location, cause.getMessage());
            }
            LOG.error("Location {} failed", location, cause);
            return LocationResult.failed(location, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.future.cancel(true);
            return LocationResult.failed(location, e);
        }
    }

    @Override
    public void close () {
        executor.shutdownNow();
    }
}
