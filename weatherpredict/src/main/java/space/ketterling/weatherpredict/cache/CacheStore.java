package space.ketterling.weatherpredict.cache;

import space.ketterling.weatherpredict.model.ObservationRecord;

import java.util.Optional;

/**
 * Durable key to record store for resolved observations.
 *
 * <p>
 * Implementations must not throw from either method: an unreadable entry is a
 * miss and a failed write is logged and dropped. Concurrent puts for the same
 * key are last-write-wins and must never leave a torn entry behind.
 * </p>
 */
public interface CacheStore {

    Optional<ObservationRecord> get(CacheKey key);

    void put(CacheKey key, ObservationRecord record);

    /**
     * Number of stored entries, or -1 if unknown.
     */
    default int size() {
        return -1;
    }
}
