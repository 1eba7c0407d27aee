package space.ketterling.weatherpredict.predict;

import java.util.List;

/**
 * Narrative that accompanies a prediction.
 */
public record Analysis(
        int yearsAnalyzed,
        int dataPoints,
        List<Integer> degradedYears,
        double trendSlopePerYear,
        String trends,
        String notes) {
}
