/*
* Copyright 2025 Taylor Ketterling
* Statistical prediction engine for WeatherPredict, a historical point weather prediction service.
*
* Reduces a multi-year sample for one calendar day into a single-day prediction: per-variable
* statistics, a noisy point estimate clamped to physical ranges, a weather category, rain and
* snow probabilities, heat index and a confidence score.
*/

package space.ketterling.weatherpredict.predict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.weatherpredict.fetch.Sample;
import space.ketterling.weatherpredict.model.EmptySampleException;
import space.ketterling.weatherpredict.model.ObservationRecord;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.ToDoubleFunction;

import static space.ketterling.weatherpredict.model.ObservationRecord.clamp;

/**
 * Pure reduction from a {@link Sample} to a {@link PredictionResult}. Holds no
 * state between calls; randomness comes from the caller's {@link Random}.
 */
public final class StatisticalPredictionEngine {
    private static final Logger log = LoggerFactory.getLogger(StatisticalPredictionEngine.class);

    static final double NOISE_SCALE = 0.3;
    static final double PRECIP_NOISE_SCALE = 0.5;

    private final ConfidencePolicy confidencePolicy;
    private final TrendAnalyzer trends;

    public StatisticalPredictionEngine(ConfidencePolicy confidencePolicy) {
        this.confidencePolicy = confidencePolicy;
        this.trends = new TrendAnalyzer();
    }

    public ConfidencePolicy confidencePolicy() {
        return confidencePolicy;
    }

    /**
     * Builds a prediction for {@code targetDate} at (lat, lon) from the sample.
     *
     * @throws EmptySampleException if the sample has no records
     */
    public PredictionResult predict(double lat, double lon, LocalDate targetDate, Sample sample, Random rnd) {
        if (sample == null || sample.isEmpty()) {
            throw new EmptySampleException("Could not obtain historical data");
        }
        List<ObservationRecord> records = sample.records();

        VariableStats temperature = stats(records, ObservationRecord::temperatureC, false);
        VariableStats humidity = stats(records, ObservationRecord::humidityPct, false);
        VariableStats windSpeed = stats(records, ObservationRecord::windSpeedMs, false);
        VariableStats precipitation = stats(records, ObservationRecord::precipitationMm, true);
        VariableStats cloudCover = stats(records, ObservationRecord::cloudCoverPct, false);
        VariableStats pressure = stats(records, ObservationRecord::pressureHpa, false);
        VariableStats dewPoint = stats(records, ObservationRecord::dewPointC, false);
        VariableStats uvIndex = stats(records, ObservationRecord::uvIndex, false);
        VariableStats feelsLike = stats(records, ObservationRecord::feelsLikeC, false);

        // mean plus a little day-to-day variability, then physical ranges
        double temp = clamp(noisy(temperature, NOISE_SCALE, rnd), -50, 60);
        double hum = clamp(noisy(humidity, NOISE_SCALE, rnd), 0, 100);
        double wind = clamp(noisy(windSpeed, NOISE_SCALE, rnd), 0, 50);
        double precip = Math.max(0, noisy(precipitation, PRECIP_NOISE_SCALE, rnd));
        double cloud = clamp(noisy(cloudCover, NOISE_SCALE, rnd), 0, 100);
        double pres = clamp(noisy(pressure, NOISE_SCALE, rnd), 950, 1050);
        double dew = noisy(dewPoint, NOISE_SCALE, rnd);
        double uv = clamp(noisy(uvIndex, NOISE_SCALE, rnd), 0, 11);
        double feels = noisy(feelsLike, NOISE_SCALE, rnd);
        // 359.96 rounds to 360.0, which is north again
        double windDir = ObservationRecord.normalizeDegrees(
                round1(WeatherMath.circularMean(column(records, ObservationRecord::windDirectionDeg))));

        WeatherCategory category = WeatherCategory.classify(temp, hum, precip, cloud, wind);
        PrecipitationOdds odds = PrecipitationOdds.of(temp, hum, precip);
        double heatIndex = WeatherMath.heatIndex(temp, hum);
        double confidence = confidencePolicy.score(sample.size(), sample.yearsRequested(), temperature.std(),
                humidity.std());

        PointPrediction prediction = new PointPrediction(
                round1(temp),
                round1(hum),
                round1(wind),
                windDir,
                WeatherMath.compass(windDir),
                round1(precip),
                round1(heatIndex),
                WeatherMath.describeConditions(temp, hum, precip),
                category,
                round1(cloud),
                round1(pres),
                round1(dew),
                round1(uv),
                round1(feels),
                round1(odds.rainPct()),
                round1(odds.snowPct()));

        Map<String, VariableStats> statistics = new LinkedHashMap<>();
        statistics.put("temperature", temperature.rounded());
        statistics.put("humidity", humidity.rounded());
        statistics.put("windSpeed", windSpeed.rounded());
        statistics.put("precipitation", precipitation.rounded());
        statistics.put("cloudCover", cloudCover.rounded());
        statistics.put("pressure", pressure.rounded());
        statistics.put("dewPoint", dewPoint.rounded());
        statistics.put("uvIndex", uvIndex.rounded());
        statistics.put("feelsLike", feelsLike.rounded());

        double roundedConfidence = round1(confidence);
        double slope = TrendAnalyzer.slope(sample.years(), column(records, ObservationRecord::temperatureC));
        int degraded = sample.degradedYears().size();
        Analysis analysis = new Analysis(
                sample.size(),
                records.size(),
                sample.degradedYears(),
                Math.round(slope * 1000.0) / 1000.0,
                trends.trendText(sample.size(), slope, temperature, humidity, windSpeed, precipitation),
                trends.notes(lat, lon, records.size(), roundedConfidence, degraded));

        log.debug("Predicted {} for ({}, {}) on {}: temp={} confidence={} degradedYears={}", category.wireName(),
                lat, lon, targetDate, prediction.temperatureC(), roundedConfidence, degraded);

        return new PredictionResult(lat, lon, targetDate, prediction, roundedConfidence, statistics, analysis,
                sample);
    }

    private static VariableStats stats(List<ObservationRecord> records, ToDoubleFunction<ObservationRecord> f,
            boolean withTotal) {
        return VariableStats.of(column(records, f), withTotal);
    }

    private static double[] column(List<ObservationRecord> records, ToDoubleFunction<ObservationRecord> f) {
        return records.stream().mapToDouble(f).toArray();
    }

    private static double noisy(VariableStats s, double scale, Random rnd) {
        return s.mean() + rnd.nextGaussian() * s.std() * scale;
    }

    static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
