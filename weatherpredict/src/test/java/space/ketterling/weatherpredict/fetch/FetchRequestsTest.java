package space.ketterling.weatherpredict.fetch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import space.ketterling.weatherpredict.model.EmptySampleException;
import space.ketterling.weatherpredict.model.InvalidInputException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FetchRequestsTest {

    @Test
    @DisplayName("Should list the past years in ascending order, excluding the current one")
    void testYears() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);

        assertEquals(List.of(2022, 2023, 2024), FetchRequests.years(clock, 3));
    }

    @Test
    @DisplayName("Should map Feb 29 to Feb 28 in common years")
    void testLeapDay() {
        assertEquals(LocalDate.of(2023, 2, 28), FetchRequests.dateFor(2023, 2, 29));
        assertEquals(LocalDate.of(2024, 2, 29), FetchRequests.dateFor(2024, 2, 29));
        assertEquals(LocalDate.of(2023, 4, 30), FetchRequests.dateFor(2023, 4, 31));
    }

    @Test
    @DisplayName("Should reject out-of-range input")
    void testValidate() {
        assertThrows(InvalidInputException.class, () -> FetchRequests.validate(-90.5, 0, 1, 1, 1));
        assertThrows(InvalidInputException.class, () -> FetchRequests.validate(0, 180.5, 1, 1, 1));
        assertThrows(InvalidInputException.class, () -> FetchRequests.validate(Double.NaN, 0, 1, 1, 1));
        assertThrows(InvalidInputException.class, () -> FetchRequests.validate(0, 0, 0, 1, 1));
        assertThrows(InvalidInputException.class, () -> FetchRequests.validate(0, 0, 1, 32, 1));
        assertThrows(EmptySampleException.class, () -> FetchRequests.validate(0, 0, 1, 1, -1));
        assertDoesNotThrow(() -> FetchRequests.validate(90, -180, 12, 31, 1));
    }
}
