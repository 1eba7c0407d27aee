package space.ketterling.weatherpredict.model;

/**
 * No year could be resolved, so there is nothing to predict from.
 */
public class EmptySampleException extends IllegalStateException {
    public EmptySampleException(String message) {
        super(message);
    }
}
