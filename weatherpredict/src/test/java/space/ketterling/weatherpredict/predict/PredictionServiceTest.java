package space.ketterling.weatherpredict.predict;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import space.ketterling.weatherpredict.climatology.ClimatologyEstimator;
import space.ketterling.weatherpredict.climatology.ClimatologyProvider;
import space.ketterling.weatherpredict.fetch.HistoricalDataProvider;
import space.ketterling.weatherpredict.fetch.Sample;
import space.ketterling.weatherpredict.model.EmptySampleException;
import space.ketterling.weatherpredict.model.InvalidInputException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PredictionServiceTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC);

    @Mock
    private HistoricalDataProvider emptyProvider;

    private final PredictionService service =
            new PredictionService(new StatisticalPredictionEngine(ConfidencePolicy.WEIGHTED_BLEND), 5);
    private final ClimatologyProvider climatology = new ClimatologyProvider(new ClimatologyEstimator(), CLOCK);

    @Test
    @DisplayName("Should predict New York on July 4th from five synthetic years")
    void testNewYork() {
        PredictionResult r = service.predictForPoint(40.71, -74.01, "2026-07-04", climatology);

        assertEquals(LocalDate.of(2026, 7, 4), r.targetDate());
        assertEquals(List.of(2020, 2021, 2022, 2023, 2024), r.sample().years());
        assertEquals(5, r.analysis().yearsAnalyzed());
        assertEquals(5, r.analysis().dataPoints());
        assertTrue(r.confidence() >= 0 && r.confidence() <= 100);
        assertTrue(r.prediction().temperatureC() > 5 && r.prediction().temperatureC() < 40);
        assertNotNull(r.prediction().weatherType());
    }

    @Test
    @DisplayName("Should return the same prediction for a repeated request")
    void testRepeatable() {
        PredictionResult a = service.predictForPoint(40.71, -74.01, "2026-07-04", climatology);
        PredictionResult b = service.predictForPoint(40.71, -74.01, "2026-07-04", climatology);

        assertEquals(a.prediction(), b.prediction());
        assertEquals(a.confidence(), b.confidence());
    }

    @Test
    @DisplayName("Should reject a malformed date")
    void testBadDate() {
        InvalidInputException e = assertThrows(InvalidInputException.class,
                () -> service.predictForPoint(40.71, -74.01, "2026/07/04", climatology));
        assertEquals(PredictionService.DATE_FORMAT_MESSAGE, e.getMessage());
        assertThrows(InvalidInputException.class,
                () -> service.predictForPoint(40.71, -74.01, (String) null, climatology));
        assertThrows(InvalidInputException.class,
                () -> service.predictForPoint(40.71, -74.01, "2026-02-30", climatology));
    }

    @Test
    @DisplayName("Should reject coordinates out of range before fetching")
    void testBadCoordinates() {
        assertThrows(InvalidInputException.class,
                () -> service.predictForPoint(100, 0, "2026-07-04", emptyProvider));
        verifyNoInteractions(emptyProvider);
    }

    @Test
    @DisplayName("Should surface an empty sample")
    void testEmptySample() {
        when(emptyProvider.fetch(10, 10, 7, 4, 5)).thenReturn(new Sample(List.of(), 5));

        assertThrows(EmptySampleException.class,
                () -> service.predictForPoint(10, 10, "2026-07-04", emptyProvider));
    }

    @Test
    @DisplayName("Should require a positive year count")
    void testYearsBack() {
        assertThrows(IllegalArgumentException.class,
                () -> new PredictionService(new StatisticalPredictionEngine(ConfidencePolicy.WEIGHTED_BLEND), 0));
    }
}
