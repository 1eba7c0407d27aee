package space.ketterling.weatherpredict.predict;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConfidencePolicyTest {

    @Test
    @DisplayName("Should blend sufficiency with temperature and humidity consistency")
    void testWeightedBlend() {
        assertEquals(100.0, ConfidencePolicy.WEIGHTED_BLEND.score(10, 10, 0, 0), 1e-9);
        assertEquals(80.0, ConfidencePolicy.WEIGHTED_BLEND.score(5, 10, 0, 0), 1e-9);
        assertEquals(40.0, ConfidencePolicy.WEIGHTED_BLEND.score(10, 10, 20, 40), 1e-9);
        assertEquals(100.0, ConfidencePolicy.WEIGHTED_BLEND.score(12, 10, 0, 0), 1e-9);
    }

    @Test
    @DisplayName("Should penalize spread without going negative")
    void testStdPenalty() {
        assertEquals(75.0, ConfidencePolicy.STD_PENALTY.score(10, 10, 10, 10), 1e-9);
        assertEquals(0.0, ConfidencePolicy.STD_PENALTY.score(10, 10, 100, 100), 1e-9);
    }
}
