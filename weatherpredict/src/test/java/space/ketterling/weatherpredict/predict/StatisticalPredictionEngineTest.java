package space.ketterling.weatherpredict.predict;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.weatherpredict.fetch.Sample;
import space.ketterling.weatherpredict.fetch.YearResult;
import space.ketterling.weatherpredict.model.EmptySampleException;
import space.ketterling.weatherpredict.model.ObservationRecord;
import space.ketterling.weatherpredict.model.TestRecords;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class StatisticalPredictionEngineTest {
    private static final LocalDate TARGET = LocalDate.of(2026, 7, 4);

    private final StatisticalPredictionEngine engine =
            new StatisticalPredictionEngine(ConfidencePolicy.WEIGHTED_BLEND);

    private static Sample archiveSample(List<ObservationRecord> records, int requested) {
        List<YearResult> results = new ArrayList<>();
        for (ObservationRecord r : records) {
            results.add(YearResult.ok(r, YearResult.Origin.ARCHIVE));
        }
        return new Sample(results, requested);
    }

    @Test
    @DisplayName("Should refuse an empty sample")
    void testEmptySample() {
        Sample empty = new Sample(List.of(), 10);

        EmptySampleException e = assertThrows(EmptySampleException.class,
                () -> engine.predict(0, 0, TARGET, empty, new Random(1)));
        assertEquals("Could not obtain historical data", e.getMessage());
    }

    @Test
    @DisplayName("Should reproduce a constant history exactly with full confidence")
    void testConstantHistory() {
        List<ObservationRecord> records = new ArrayList<>();
        for (int y = 2015; y < 2025; y++) {
            records.add(TestRecords.of(y, 20, 50, 3, y % 2 == 0 ? 350 : 10, 0));
        }

        PredictionResult r = engine.predict(40.71, -74.01, TARGET, archiveSample(records, 10), new Random(1));
        PointPrediction p = r.prediction();

        assertEquals(20.0, p.temperatureC());
        assertEquals(50.0, p.humidity());
        assertEquals(3.0, p.windSpeed());
        assertEquals(0.0, p.precipitation());
        assertEquals(0.0, p.windDirection());
        assertEquals("N", p.windCompass());
        assertEquals(WeatherCategory.SUNNY, p.weatherType());
        assertEquals("Warm, dry, clear", p.conditions());
        assertEquals(100.0, r.confidence());
        assertEquals(0.0, r.statistics().get("temperature").std());
        assertEquals(10, r.analysis().yearsAnalyzed());
        assertEquals(0.0, r.analysis().trendSlopePerYear());
    }

    @Test
    @DisplayName("Should expose statistics for every variable in a stable order")
    void testStatisticsKeys() {
        PredictionResult r = engine.predict(0, 0, TARGET, archiveSample(varied(), 10), new Random(3));

        assertEquals(List.of("temperature", "humidity", "windSpeed", "precipitation", "cloudCover", "pressure",
                "dewPoint", "uvIndex", "feelsLike"), new ArrayList<>(r.statistics().keySet()));
        assertNotNull(r.statistics().get("precipitation").total());
        assertNull(r.statistics().get("temperature").total());
    }

    @Test
    @DisplayName("Should be deterministic for the same generator seed")
    void testDeterministic() {
        Sample sample = archiveSample(varied(), 10);

        PredictionResult a = engine.predict(10, 10, TARGET, sample, new Random(99));
        PredictionResult b = engine.predict(10, 10, TARGET, sample, new Random(99));

        assertEquals(a.prediction(), b.prediction());
        assertEquals(a.confidence(), b.confidence());
    }

    @Test
    @DisplayName("Should keep predicted values inside physical ranges")
    void testRanges() {
        Sample sample = archiveSample(varied(), 10);
        for (long seed = 0; seed < 200; seed++) {
            PointPrediction p = engine.predict(10, 10, TARGET, sample, new Random(seed)).prediction();

            assertTrue(p.precipitation() >= 0);
            assertTrue(p.humidity() >= 0 && p.humidity() <= 100);
            assertTrue(p.cloudCover() >= 0 && p.cloudCover() <= 100);
            assertTrue(p.uvIndex() >= 0 && p.uvIndex() <= 11);
            assertTrue(p.pressure() >= 950 && p.pressure() <= 1050);
            assertTrue(p.windDirection() >= 0 && p.windDirection() < 360);
            assertTrue(p.rainProbability() + p.snowProbability() <= 100.0001);
        }
    }

    @Test
    @DisplayName("Should report degraded years and lower sufficiency for a partial sample")
    void testDegradedYears() {
        List<YearResult> results = new ArrayList<>();
        results.add(YearResult.ok(TestRecords.mild(2020), YearResult.Origin.CACHE));
        results.add(YearResult.fallback(TestRecords.mild(2021), "deadline exceeded"));
        Sample sample = new Sample(results, 4);

        PredictionResult r = engine.predict(0, 0, TARGET, sample, new Random(1));

        assertEquals(List.of(2021), r.analysis().degradedYears());
        assertEquals(80.0, r.confidence());
        assertTrue(r.analysis().notes().contains("1 of 2 years were estimated"));
    }

    @Test
    @DisplayName("Should use the configured confidence policy")
    void testStdPenaltyPolicy() {
        StatisticalPredictionEngine penalty = new StatisticalPredictionEngine(ConfidencePolicy.STD_PENALTY);
        Sample sample = archiveSample(varied(), 10);

        PredictionResult r = penalty.predict(0, 0, TARGET, sample, new Random(1));
        VariableStats t = r.statistics().get("temperature");
        VariableStats h = r.statistics().get("humidity");

        double expected = ConfidencePolicy.STD_PENALTY.score(10, 10,
                VariableStats.of(varied().stream().mapToDouble(ObservationRecord::temperatureC).toArray(), false)
                        .std(),
                VariableStats.of(varied().stream().mapToDouble(ObservationRecord::humidityPct).toArray(), false)
                        .std());
        assertEquals(StatisticalPredictionEngine.round1(expected), r.confidence());
        assertTrue(t.std() > 0 && h.std() > 0);
    }

    private static List<ObservationRecord> varied() {
        List<ObservationRecord> out = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            out.add(TestRecords.of(2015 + i, 18 + i * 0.7, 45 + (i % 4) * 8, 2 + i % 3, 30 * i, i % 3 == 0 ? 6 : 0.4));
        }
        return out;
    }
}
