package space.ketterling.weatherpredict.cache;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {
    private static final LocalDate DAY = LocalDate.of(2020, 7, 4);

    @Test
    @DisplayName("Should produce the same key for coordinates that round to the same hundredth")
    void testRoundsCoordinates() {
        assertEquals(CacheKey.of(40.7128, -74.0060, DAY), CacheKey.of(40.7131, -74.0055, DAY));
        assertNotEquals(CacheKey.of(40.714, -74.0, DAY), CacheKey.of(40.716, -74.0, DAY));
    }

    @Test
    @DisplayName("Should separate dates")
    void testDateIsPartOfKey() {
        assertNotEquals(CacheKey.of(10, 10, DAY), CacheKey.of(10, 10, DAY.plusYears(1)));
    }

    @Test
    @DisplayName("Should treat -0.00 and 0.00 alike")
    void testNegativeZero() {
        assertEquals(CacheKey.of(-0.001, 0.001, DAY), CacheKey.of(0.0, 0.0, DAY));
        assertEquals(0.0, CacheKey.round2(-0.004));
    }

    @Test
    @DisplayName("Should be a lowercase SHA-256 hex digest")
    void testDigestShape() {
        String digest = CacheKey.of(1, 2, DAY).digest();
        assertEquals(64, digest.length());
        assertTrue(digest.matches("[0-9a-f]+"));
    }
}
