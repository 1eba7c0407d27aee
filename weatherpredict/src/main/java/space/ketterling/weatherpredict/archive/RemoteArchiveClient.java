package space.ketterling.weatherpredict.archive;

import space.ketterling.weatherpredict.model.ObservationRecord;

import java.time.LocalDate;

/**
 * Fetches one day's observation for a coordinate from a remote archive.
 *
 * <p>
 * Calls may be slow or fail. Any failure is reported as a
 * {@link RemoteFetchException}; a returned record is always a success.
 * </p>
 */
public interface RemoteArchiveClient {

    ObservationRecord fetchDay(double lat, double lon, LocalDate date) throws RemoteFetchException;

    /**
     * Name used when recording call outcomes.
     */
    String serviceName();
}
