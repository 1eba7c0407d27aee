package space.ketterling.weatherpredict.fetch;

import space.ketterling.weatherpredict.model.ObservationRecord;

/**
 * Outcome of resolving one year: a real observation, or a climatology
 * fallback with the reason the real one was unavailable.
 */
public record YearResult(int year, ObservationRecord record, Origin origin, String fallbackReason) {

    public enum Origin {
        CACHE,
        ARCHIVE,
        CLIMATOLOGY
    }

    public static YearResult ok(ObservationRecord record, Origin origin) {
        if (origin == Origin.CLIMATOLOGY)
            throw new IllegalArgumentException("climatology records are fallbacks");
        return new YearResult(record.year(), record, origin, null);
    }

    public static YearResult fallback(ObservationRecord record, String reason) {
        return new YearResult(record.year(), record, Origin.CLIMATOLOGY, reason);
    }

    public boolean isFallback() {
        return origin == Origin.CLIMATOLOGY;
    }
}
