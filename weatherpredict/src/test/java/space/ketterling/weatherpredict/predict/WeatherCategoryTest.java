package space.ketterling.weatherpredict.predict;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeatherCategoryTest {

    @Test
    @DisplayName("Should pick the first matching category in priority order")
    void testPriority() {
        assertEquals(WeatherCategory.STORMY, WeatherCategory.classify(0, 95, 12, 90, 16));
        assertEquals(WeatherCategory.SNOWY, WeatherCategory.classify(1, 95, 3, 90, 2));
        assertEquals(WeatherCategory.RAINY, WeatherCategory.classify(15, 95, 6, 90, 16));
        assertEquals(WeatherCategory.FOGGY, WeatherCategory.classify(10, 95, 1, 90, 2));
        assertEquals(WeatherCategory.CLOUDY, WeatherCategory.classify(10, 70, 1, 70, 2));
        assertEquals(WeatherCategory.SUNNY, WeatherCategory.classify(25, 40, 0, 20, 3));
    }

    @Test
    @DisplayName("Should use strict thresholds")
    void testBoundaries() {
        assertEquals(WeatherCategory.RAINY, WeatherCategory.classify(10, 50, 10.5, 20, 15));
        assertEquals(WeatherCategory.SUNNY, WeatherCategory.classify(10, 90, 5, 60, 3));
        assertEquals(WeatherCategory.SUNNY, WeatherCategory.classify(2, 50, 2, 10, 3));
    }

    @Test
    @DisplayName("Should render lower-case wire names")
    void testWireName() {
        assertEquals("stormy", WeatherCategory.STORMY.wireName());
        assertEquals("sunny", WeatherCategory.SUNNY.wireName());
    }
}
