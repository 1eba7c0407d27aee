package space.ketterling.weatherpredict.predict;

/**
 * Summary of one variable across the sample. {@code total} is only set for
 * precipitation.
 */
public record VariableStats(double mean, double std, double min, double max, Double total) {

    /**
     * Mean, sample standard deviation (n - 1; 0 for fewer than two values),
     * min and max.
     */
    public static VariableStats of(double[] values, boolean withTotal) {
        if (values.length == 0)
            throw new IllegalArgumentException("no values");
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            sum += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        double mean = sum / values.length;
        double std = 0;
        if (values.length > 1) {
            double ss = 0;
            for (double v : values) {
                ss += (v - mean) * (v - mean);
            }
            std = Math.sqrt(ss / (values.length - 1));
        }
        return new VariableStats(mean, std, min, max, withTotal ? sum : null);
    }

    /**
     * Copy rounded to two decimals for display.
     */
    public VariableStats rounded() {
        return new VariableStats(round2(mean), round2(std), round2(min), round2(max),
                total == null ? null : round2(total));
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
