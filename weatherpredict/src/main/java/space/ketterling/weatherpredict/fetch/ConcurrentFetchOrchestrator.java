/*
* Copyright 2025 Taylor Ketterling
* Concurrent historical fetch for WeatherPredict, a historical point weather prediction service.
*
* Fans out one task per requested year onto a fixed pool of five workers, bounds the whole
* fetch by a deadline and backfills anything unfinished with climatology so that every
* requested year comes back with a record.
*/

package space.ketterling.weatherpredict.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.weatherpredict.archive.RemoteArchiveClient;
import space.ketterling.weatherpredict.cache.CacheStore;
import space.ketterling.weatherpredict.climatology.ClimatologyEstimator;
import space.ketterling.weatherpredict.metrics.ExternalApiMetrics;
import space.ketterling.weatherpredict.model.EmptySampleException;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resolves one record per year through cache, remote archive and climatology.
 *
 * <p>
 * The worker pool is fixed at {@link #WORKERS} threads and shared by every
 * request: the upstream archive answers with server errors under heavier
 * concurrency.
 * </p>
 */
public final class ConcurrentFetchOrchestrator implements HistoricalDataProvider, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConcurrentFetchOrchestrator.class);

    /** Maximum simultaneous year fetches. */
    public static final int WORKERS = 5;

    /** Metric: success = real data (cache or archive), failure = climatology fallback. */
    public static final String RESOLUTION_METRIC = "YEAR_RESOLUTION";

    static final String DEADLINE_REASON = "deadline exceeded";

    private final CacheStore cache;
    private final RemoteArchiveClient remote;
    private final ClimatologyEstimator estimator;
    private final Duration deadline;
    private final Clock clock;
    private final ExecutorService pool;

    public ConcurrentFetchOrchestrator(CacheStore cache, RemoteArchiveClient remote, ClimatologyEstimator estimator,
            Duration deadline, Clock clock) {
        if (deadline == null || deadline.isZero() || deadline.isNegative())
            throw new IllegalArgumentException("deadline must be positive");
        this.cache = cache;
        this.remote = remote;
        this.estimator = estimator;
        this.deadline = deadline;
        this.clock = clock;
        AtomicInteger n = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(WORKERS, r -> {
            Thread t = new Thread(r, "weather-fetch-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public String name() {
        return "archive:" + remote.serviceName();
    }

    @Override
    public Sample fetch(double lat, double lon, int month, int day, int yearsBack) {
        FetchRequests.validate(lat, lon, month, day, yearsBack);
        List<Integer> years = FetchRequests.years(clock, yearsBack);

        List<YearFetchTask> tasks = new ArrayList<>(years.size());
        for (int year : years) {
            tasks.add(new YearFetchTask(lat, lon, FetchRequests.dateFor(year, month, day), day, cache, remote,
                    estimator));
        }

        long t0 = System.currentTimeMillis();
        List<Future<YearResult>> futures;
        try {
            // invokeAll returns futures in task order and cancels whatever is unfinished at the deadline
            futures = pool.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Fetch interrupted for ({}, {}), backfilling every year with climatology", lat, lon);
            futures = List.of();
        }

        List<YearResult> results = new ArrayList<>(tasks.size());
        int fromCache = 0;
        int fromArchive = 0;
        int fallbacks = 0;
        for (int i = 0; i < tasks.size(); i++) {
            YearFetchTask task = tasks.get(i);
            YearResult r = i < futures.size() ? collect(futures.get(i), task) : null;
            if (r == null) {
                log.warn("Year {} not resolved within {}, using climatology", years.get(i), deadline);
                r = task.fallback(DEADLINE_REASON);
            }
            switch (r.origin()) {
                case CACHE -> fromCache++;
                case ARCHIVE -> fromArchive++;
                default -> fallbacks++;
            }
            ExternalApiMetrics.record(RESOLUTION_METRIC, !r.isFallback());
            results.add(r);
        }

        if (results.isEmpty()) {
            throw new EmptySampleException("No historical data could be resolved");
        }

        log.info("Fetched {} years for ({}, {}) {}-{}: cache={} archive={} climatology={} in {} ms",
                results.size(), lat, lon, month, day, fromCache, fromArchive, fallbacks,
                System.currentTimeMillis() - t0);
        return new Sample(results, yearsBack);
    }

    /**
     * Reads a completed future; null means the task did not finish in time.
     */
    private YearResult collect(Future<YearResult> f, YearFetchTask task) {
        if (f.isCancelled())
            return null;
        try {
            return f.get();
        } catch (CancellationException e) {
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Year task failed unexpectedly: {}", cause.toString());
            return task.fallback("task failed: " + cause.getMessage());
        }
    }

    /**
     * Logs a warning when a full wave of archive calls (one per worker) would
     * not finish inside the overall deadline.
     */
    public static boolean checkTimeoutBudget(Duration callTimeout, Duration deadline) {
        long waveMs = callTimeout.toMillis() * WORKERS;
        if (waveMs >= deadline.toMillis()) {
            log.warn("Archive timeout {} x {} workers = {} ms is not under the fetch deadline {}",
                    callTimeout, WORKERS, waveMs, deadline);
            return false;
        }
        return true;
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("weather-fetch pool did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
