package space.ketterling.weatherpredict.predict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.weatherpredict.climatology.ClimatologyEstimator;
import space.ketterling.weatherpredict.fetch.FetchRequests;
import space.ketterling.weatherpredict.fetch.HistoricalDataProvider;
import space.ketterling.weatherpredict.fetch.Sample;
import space.ketterling.weatherpredict.model.InvalidInputException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Random;

/**
 * Entry point used by the HTTP layer: validate, fetch the sample, predict.
 */
public final class PredictionService {
    private static final Logger log = LoggerFactory.getLogger(PredictionService.class);
    public static final String DATE_FORMAT_MESSAGE = "targetDate must use format YYYY-MM-DD";

    private final StatisticalPredictionEngine engine;
    private final int yearsBack;

    public PredictionService(StatisticalPredictionEngine engine, int yearsBack) {
        if (yearsBack <= 0)
            throw new IllegalArgumentException("yearsBack must be positive");
        this.engine = engine;
        this.yearsBack = yearsBack;
    }

    public int yearsBack() {
        return yearsBack;
    }

    /**
     * Predicts for an ISO {@code YYYY-MM-DD} date string.
     */
    public PredictionResult predictForPoint(double lat, double lon, String targetDate,
            HistoricalDataProvider provider) {
        return predictForPoint(lat, lon, parseDate(targetDate), provider);
    }

    public PredictionResult predictForPoint(double lat, double lon, LocalDate targetDate,
            HistoricalDataProvider provider) {
        if (targetDate == null)
            throw new InvalidInputException(DATE_FORMAT_MESSAGE);
        if (!FetchRequests.isLatLonValid(lat, lon))
            throw new InvalidInputException("lat or lon out of range");

        int month = targetDate.getMonthValue();
        int day = targetDate.getDayOfMonth();
        long t0 = System.currentTimeMillis();

        Sample sample = provider.fetch(lat, lon, month, day, yearsBack);
        Random rnd = new Random(ClimatologyEstimator.seedFor(lat, lon, month, day));
        PredictionResult result = engine.predict(lat, lon, targetDate, sample, rnd);

        log.info("Prediction for ({}, {}) on {} via {}: {} confidence={} in {} ms", lat, lon, targetDate,
                provider.name(), result.prediction().weatherType().wireName(), result.confidence(),
                System.currentTimeMillis() - t0);
        return result;
    }

    static LocalDate parseDate(String s) {
        if (s == null || s.isBlank())
            throw new InvalidInputException(DATE_FORMAT_MESSAGE);
        try {
            return LocalDate.parse(s.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidInputException(DATE_FORMAT_MESSAGE, e);
        }
    }
}
