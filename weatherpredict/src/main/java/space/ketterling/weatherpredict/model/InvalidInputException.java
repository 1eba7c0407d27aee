package space.ketterling.weatherpredict.model;

/**
 * Bad coordinates, calendar fields or date text. Reported to the caller as is
 * and never retried.
 */
public class InvalidInputException extends IllegalArgumentException {
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
