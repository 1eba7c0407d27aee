package space.ketterling.weatherpredict.metrics;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Process-wide outcome counters for outbound calls and year resolutions
 * (POWER, YEAR_RESOLUTION).
 *
 * <p>
 * Each service keeps one bucket per minute over a rolling 60-minute window;
 * the snapshot derives a coarse health status from the failure share.
 * </p>
 */
public final class ExternalApiMetrics {
    static final int WINDOW_MINUTES = 60;
    private static final Map<String, MinuteBuckets> SERVICES = new ConcurrentHashMap<>();
    private static volatile LongSupplier clockMillis = System::currentTimeMillis;

    private ExternalApiMetrics() {
    }

    /**
     * Records one outcome for a named service. Blank names are ignored.
     */
    public static void record(String service, boolean success) {
        if (service == null || service.isBlank())
            return;
        SERVICES.computeIfAbsent(service, k -> new MinuteBuckets()).record(nowMinute(), success);
    }

    /**
     * Current window totals for every service seen so far, ordered by name.
     */
    public static SortedMap<String, ServiceSnapshot> snapshot() {
        long now = nowMinute();
        SortedMap<String, ServiceSnapshot> out = new TreeMap<>();
        SERVICES.forEach((name, buckets) -> out.put(name, buckets.snapshot(now)));
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    // test hooks
    static void useClock(LongSupplier millis) {
        clockMillis = millis;
    }

    static void clear() {
        SERVICES.clear();
        clockMillis = System::currentTimeMillis;
    }

    private static long nowMinute() {
        return clockMillis.getAsLong() / 60_000L;
    }

    /**
     * Totals for one service over the window.
     *
     * @param status {@code no-data}, {@code ok}, {@code degraded} (10% or more
     *               failures) or {@code down} (50% or more)
     */
    public record ServiceSnapshot(long calls, long failures, double failurePct, String status) {

        static ServiceSnapshot of(long calls, long failures) {
            double pct = calls == 0 ? 0.0 : failures * 100.0 / calls;
            String status;
            if (calls == 0) {
                status = "no-data";
            } else if (pct >= 50.0) {
                status = "down";
            } else if (pct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new ServiceSnapshot(calls, failures, pct, status);
        }
    }

    /**
     * Ring of per-minute counters, slot reused once its minute falls out of the
     * window.
     */
    private static final class MinuteBuckets {
        private final long[] minute = new long[WINDOW_MINUTES];
        private final long[] calls = new long[WINDOW_MINUTES];
        private final long[] failures = new long[WINDOW_MINUTES];

        synchronized void record(long nowMin, boolean success) {
            int slot = (int) Math.floorMod(nowMin, (long) WINDOW_MINUTES);
            if (minute[slot] != nowMin) {
                minute[slot] = nowMin;
                calls[slot] = 0L;
                failures[slot] = 0L;
            }
            calls[slot]++;
            if (!success)
                failures[slot]++;
        }

        synchronized ServiceSnapshot snapshot(long nowMin) {
            long c = 0L;
            long f = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                if (calls[i] == 0L || nowMin - minute[i] >= WINDOW_MINUTES)
                    continue;
                c += calls[i];
                f += failures[i];
            }
            return ServiceSnapshot.of(c, f);
        }
    }
}
