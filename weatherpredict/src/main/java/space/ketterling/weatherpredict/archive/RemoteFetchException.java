package space.ketterling.weatherpredict.archive;

/**
 * Reaching or decoding the remote archive failed for one day.
 */
public class RemoteFetchException extends Exception {
    public RemoteFetchException(String message) {
        super(message);
    }

    public RemoteFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
