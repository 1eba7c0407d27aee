package space.ketterling.weatherpredict.climatology;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.weatherpredict.model.ObservationRecord;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ClimatologyEstimatorTest {
    private final ClimatologyEstimator estimator = new ClimatologyEstimator();

    @Test
    @DisplayName("Should be reproducible for the same point, day and year")
    void testDeterministic() {
        ObservationRecord a = estimator.estimate(40.71, -74.01, 7, 4, 2020);
        ObservationRecord b = estimator.estimate(40.71, -74.01, 7, 4, 2020);

        assertEquals(a, b);
        assertEquals(2020, a.year());
    }

    @Test
    @DisplayName("Should keep every field in its physical range")
    void testRanges() {
        Random rnd = new Random(7);
        double[] lats = { -85, -45, -10, 0, 15, 33, 48, 62, 89 };
        for (double lat : lats) {
            for (int month = 1; month <= 12; month++) {
                ObservationRecord r = estimator.estimate(lat, lat * 2, month, 2000 + month, rnd);

                assertTrue(r.humidityPct() >= 20 && r.humidityPct() <= 100, "humidity " + r);
                assertTrue(r.cloudCoverPct() >= 0 && r.cloudCoverPct() <= 100, "cloud " + r);
                assertTrue(r.uvIndex() >= 0 && r.uvIndex() <= 11, "uv " + r);
                assertTrue(r.windSpeedMs() >= 0, "wind " + r);
                assertTrue(r.precipitationMm() >= 0, "precip " + r);
                assertTrue(r.windDirectionDeg() >= 0 && r.windDirectionDeg() < 360, "dir " + r);
                assertTrue(r.temperatureMaxC() >= r.temperatureC() + 1.9, "max " + r);
                assertTrue(r.temperatureMinC() <= r.temperatureC() - 1.9, "min " + r);
                assertEquals(14, r.hourOfMax());
                assertEquals(6, r.hourOfMin());
            }
        }
    }

    @Test
    @DisplayName("Should run the southern hemisphere six months out of phase")
    void testSouthernHemisphereShift() {
        assertEquals(7, ClimatologyEstimator.effectiveMonth(-30, 1));
        assertEquals(12, ClimatologyEstimator.effectiveMonth(-30, 6));
        assertEquals(1, ClimatologyEstimator.effectiveMonth(30, 1));
        assertEquals(ClimatologyEstimator.seasonalFactor(30, 7), ClimatologyEstimator.seasonalFactor(-30, 1),
                1e-12);
    }

    @Test
    @DisplayName("Should make the tropics in July warmer than the Arctic in January")
    void testZonesOrderTemperature() {
        Random rnd = new Random(42);
        double tropical = 0;
        double polar = 0;
        for (int y = 0; y < 50; y++) {
            tropical += estimator.estimate(5, 100, 7, 2000 + y, rnd).temperatureC();
            polar += estimator.estimate(80, 100, 1, 2000 + y, rnd).temperatureC();
        }
        assertTrue(tropical / 50 > polar / 50 + 30);
    }

    @Test
    @DisplayName("Should apply wind chill and humidity adjustments to feels-like")
    void testFeelsLike() {
        assertEquals(0.0, ClimatologyEstimator.feelsLike(5, 50, 10), 1e-9);
        assertEquals(34.0, ClimatologyEstimator.feelsLike(30, 60, 2), 1e-9);
        assertEquals(20.0, ClimatologyEstimator.feelsLike(20, 50, 3), 1e-9);
    }

    @Test
    @DisplayName("Should key seeds on point and day")
    void testSeeds() {
        long seed = ClimatologyEstimator.seedFor(40.71, -74.01, 7, 4);
        assertEquals(seed, ClimatologyEstimator.seedFor(40.71, -74.01, 7, 4));
        assertNotEquals(seed, ClimatologyEstimator.seedFor(40.71, -74.01, 7, 5));
        assertNotEquals(ClimatologyEstimator.seedFor(40.71, -74.01, 7, 4, 2019),
                ClimatologyEstimator.seedFor(40.71, -74.01, 7, 4, 2020));
    }

    @Test
    @DisplayName("Should treat longitudes near the meridians as coastal")
    void testCoastal() {
        assertTrue(ClimatologyEstimator.isCoastal(-10));
        assertTrue(ClimatologyEstimator.isCoastal(170));
        assertFalse(ClimatologyEstimator.isCoastal(-74));
    }

    @Test
    @DisplayName("Should raise the precipitation rate for wet seasons")
    void testPrecipitationRate() {
        assertEquals(2.5, ClimatologyEstimator.precipitationRate(80, 50, 0.5), 1e-9);
        assertEquals(2.5 * 1.8, ClimatologyEstimator.precipitationRate(80, 10, 0.5), 1e-9);
        assertEquals(1.0 * 1.5, ClimatologyEstimator.precipitationRate(60, 40, -0.5), 1e-9);
        assertEquals(0.3, ClimatologyEstimator.precipitationRate(40, 60, 0), 1e-9);
    }
}
