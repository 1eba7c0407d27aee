package space.ketterling.weatherpredict.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.weatherpredict.archive.RemoteArchiveClient;
import space.ketterling.weatherpredict.cache.CacheKey;
import space.ketterling.weatherpredict.cache.CacheStore;
import space.ketterling.weatherpredict.climatology.ClimatologyEstimator;
import space.ketterling.weatherpredict.model.ObservationRecord;

import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Resolves a single year: cache, then remote archive, then climatology.
 *
 * <p>
 * Always returns a record. Remote and cache problems are logged and turned
 * into a tagged fallback instead of propagating.
 * </p>
 */
final class YearFetchTask implements Callable<YearResult> {
    private static final Logger log = LoggerFactory.getLogger(YearFetchTask.class);

    private final double lat;
    private final double lon;
    private final LocalDate date;
    private final int requestedDay;
    private final CacheStore cache;
    private final RemoteArchiveClient remote;
    private final ClimatologyEstimator estimator;

    YearFetchTask(double lat, double lon, LocalDate date, int requestedDay, CacheStore cache,
            RemoteArchiveClient remote, ClimatologyEstimator estimator) {
        this.lat = lat;
        this.lon = lon;
        this.date = date;
        this.requestedDay = requestedDay;
        this.cache = cache;
        this.remote = remote;
        this.estimator = estimator;
    }

    @Override
    public YearResult call() {
        MDC.put("year", Integer.toString(date.getYear()));
        try {
            return resolve();
        } finally {
            MDC.remove("year");
        }
    }

    private YearResult resolve() {
        CacheKey key = CacheKey.of(lat, lon, date);

        Optional<ObservationRecord> cached = lookup(key);
        if (cached.isPresent() && cached.get().year() == date.getYear()) {
            log.debug("cache hit date={} key={}", date, key);
            return YearResult.ok(cached.get(), YearResult.Origin.CACHE);
        }
        if (cached.isPresent()) {
            log.warn("Cache entry key={} holds year {} for {}, treating as miss", key, cached.get().year(), date);
        }

        try {
            ObservationRecord rec = remote.fetchDay(lat, lon, date);
            if (rec.year() != date.getYear()) {
                throw new IllegalStateException(
                        "archive returned year " + rec.year() + " for " + date);
            }
            store(key, rec);
            return YearResult.ok(rec, YearResult.Origin.ARCHIVE);
        } catch (Exception e) {
            log.warn("Archive fetch failed for {} at ({}, {}), using climatology: {}", date, lat, lon,
                    e.getMessage());
            return fallback(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    /**
     * Climatology record for this task's year.
     */
    YearResult fallback(String reason) {
        return YearResult.fallback(estimate(lat, lon, date, requestedDay, estimator), reason);
    }

    static ObservationRecord estimate(double lat, double lon, LocalDate date, int requestedDay,
            ClimatologyEstimator estimator) {
        return estimator.estimate(lat, lon, date.getMonthValue(), requestedDay, date.getYear());
    }

    private Optional<ObservationRecord> lookup(CacheKey key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Cache read failed for key={}, treating as miss: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void store(CacheKey key, ObservationRecord rec) {
        try {
            cache.put(key, rec);
        } catch (RuntimeException e) {
            log.warn("Cache write failed for key={}: {}", key, e.getMessage());
        }
    }
}
