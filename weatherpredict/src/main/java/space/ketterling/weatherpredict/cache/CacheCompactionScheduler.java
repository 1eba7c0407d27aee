package space.ketterling.weatherpredict.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodically bounds the number of cache files on long-running services.
 */
public final class CacheCompactionScheduler {
    private static final Logger log = LoggerFactory.getLogger(CacheCompactionScheduler.class);

    private final ScheduledExecutorService exec = Executors
            .newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cache-compaction");
                t.setDaemon(true);
                return t;
            });

    private final FileCacheStore cache;
    private final int maxEntries;
    private final Duration interval;
    private ScheduledFuture<?> task;

    public CacheCompactionScheduler(FileCacheStore cache, int maxEntries, Duration interval) {
        this.cache = cache;
        this.maxEntries = maxEntries;
        this.interval = interval;
    }

    public void start() {
        if (maxEntries <= 0 || interval.isZero() || interval.isNegative()) {
            log.info("Cache compaction disabled (maxEntries={}, interval={})", maxEntries, interval);
            return;
        }
        task = exec.scheduleWithFixedDelay(safe("cacheCompaction", () -> cache.compact(maxEntries)),
                interval.toSeconds(), interval.toSeconds(), TimeUnit.SECONDS);
        log.info("Cache compaction scheduled every {} (maxEntries={})", interval, maxEntries);
    }

    public void stop() {
        if (task != null)
            task.cancel(true);
        exec.shutdownNow();
        try {
            if (!exec.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("cache-compaction did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Runs one compaction pass now, on the caller's thread.
     */
    void runOnce() {
        safe("cacheCompaction", () -> cache.compact(maxEntries)).run();
    }

    private Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
