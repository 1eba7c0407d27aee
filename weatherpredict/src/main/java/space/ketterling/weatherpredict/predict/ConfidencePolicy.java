package space.ketterling.weatherpredict.predict;

/**
 * How sample size and spread turn into a 0-100 confidence score.
 */
public enum ConfidencePolicy {
    /**
     * {@code 0.4 * sufficiency + 0.3 * temperature consistency + 0.3 * humidity consistency}.
     */
    WEIGHTED_BLEND {
        @Override
        public double score(int sampleSize, int yearsRequested, double tempStd, double humidityStd) {
            double sufficiency = yearsRequested <= 0 ? 1.0 : Math.min((double) sampleSize / yearsRequested, 1.0);
            double tempConsistency = Math.max(0, 1 - tempStd / 10);
            double humidityConsistency = Math.max(0, 1 - humidityStd / 20);
            return clamp(100 * (0.4 * sufficiency + 0.3 * tempConsistency + 0.3 * humidityConsistency));
        }
    },

    /**
     * Average of {@code 100 - 3 * tempStd} and {@code 100 - 2 * humidityStd}.
     */
    STD_PENALTY {
        @Override
        public double score(int sampleSize, int yearsRequested, double tempStd, double humidityStd) {
            double temp = Math.max(0, 100 - tempStd * 3);
            double humid = Math.max(0, 100 - humidityStd * 2);
            return clamp((temp + humid) / 2);
        }
    };

    public abstract double score(int sampleSize, int yearsRequested, double tempStd, double humidityStd);

    private static double clamp(double v) {
        return Math.max(0, Math.min(100, v));
    }
}
