package space.ketterling.weatherpredict.predict;

import space.ketterling.weatherpredict.fetch.Sample;

import java.time.LocalDate;
import java.util.Map;

/**
 * Everything produced for one request. Not persisted.
 *
 * @param statistics per-variable summary keyed by wire name, in a stable order
 */
public record PredictionResult(
        double latitude,
        double longitude,
        LocalDate targetDate,
        PointPrediction prediction,
        double confidence,
        Map<String, VariableStats> statistics,
        Analysis analysis,
        Sample sample) {
}
