package space.ketterling.weatherpredict.predict;

import java.util.List;
import java.util.Locale;

/**
 * Builds the trend text and notes shown next to a prediction.
 */
public final class TrendAnalyzer {
    static final double TREND_THRESHOLD = 0.1;

    /**
     * Least-squares slope of temperature against year; 0 when undefined.
     */
    public static double slope(List<Integer> years, double[] temps) {
        int n = years.size();
        if (n < 2 || temps.length != n)
            return 0.0;
        double mx = 0;
        double my = 0;
        for (int i = 0; i < n; i++) {
            mx += years.get(i);
            my += temps[i];
        }
        mx /= n;
        my /= n;
        double sxy = 0;
        double sxx = 0;
        for (int i = 0; i < n; i++) {
            double dx = years.get(i) - mx;
            sxy += dx * (temps[i] - my);
            sxx += dx * dx;
        }
        return sxx == 0 ? 0.0 : sxy / sxx;
    }

    public String trendText(int yearCount, double slope, VariableStats temperature, VariableStats humidity,
            VariableStats windSpeed, VariableStats precipitation) {
        String trend;
        if (yearCount < 2) {
            trend = "Insufficient data to determine trend.";
        } else if (slope > TREND_THRESHOLD) {
            trend = String.format(Locale.ROOT,
                    "A warming trend of approximately %.2f°C per year is observed.", Math.abs(slope));
        } else if (slope < -TREND_THRESHOLD) {
            trend = String.format(Locale.ROOT,
                    "A cooling trend of approximately %.2f°C per year is observed.", Math.abs(slope));
        } else {
            trend = "Temperature has remained relatively stable.";
        }

        int precipChance = precipitation.mean() > 0
                ? (int) Math.min(precipitation.mean() / 5 * 100, 100)
                : 10;
        String humidityLevel = humidity.mean() > 70 ? "high" : humidity.mean() > 50 ? "moderate" : "low";

        return String.format(Locale.ROOT,
                "Based on analysis of the last %d years, a consistent pattern is observed for this date. "
                        + "The historical average temperature is %.1f°C with a standard deviation of %.1f°C. "
                        + "%s "
                        + "Humidity tends to be %s (average %.1f%%) "
                        + "and there is a %d%% probability of precipitation based on historical data. "
                        + "Prevailing winds have an average speed of %.1f m/s.",
                yearCount, temperature.mean(), temperature.std(), trend, humidityLevel, humidity.mean(),
                precipChance, windSpeed.mean());
    }

    public String notes(double lat, double lon, int dataPoints, double confidence, int degradedYears) {
        StringBuilder sb = new StringBuilder();
        sb.append("This prediction was generated by statistical analysis of historical patterns. ");
        sb.append(String.format(Locale.ROOT, "%d data points were analyzed for coordinates (Lat: %.2f, Lon: %.2f). ",
                dataPoints, lat, lon));
        sb.append(String.format(Locale.ROOT,
                "The confidence level of %.1f%% reflects the size and consistency of the historical data. ",
                confidence));
        if (degradedYears > 0) {
            sb.append(String.format(Locale.ROOT,
                    "%d of %d years were estimated from climatology because archive data was unavailable. ",
                    degradedYears, dataPoints));
        }
        sb.append("Check updated forecasts closer to the target date.");
        return sb.toString();
    }
}
