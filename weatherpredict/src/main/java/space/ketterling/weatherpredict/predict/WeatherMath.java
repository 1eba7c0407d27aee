package space.ketterling.weatherpredict.predict;

import java.util.ArrayList;
import java.util.List;

/**
 * Small meteorological helpers used when shaping a prediction.
 */
public final class WeatherMath {
    private static final String[] COMPASS = { "N", "NE", "E", "SE", "S", "SW", "W", "NW" };

    private WeatherMath() {
    }

    /**
     * Heat index in Celsius using the Rothfusz regression. Below 80F or 40%
     * humidity the regression does not apply and the temperature is returned.
     */
    public static double heatIndex(double tempC, double humidityPct) {
        double t = tempC * 9.0 / 5.0 + 32;
        double rh = humidityPct;
        if (t < 80 || rh < 40)
            return tempC;

        double hi = -42.379
                + 2.04901523 * t
                + 10.14333127 * rh
                - 0.22475541 * t * rh
                - 0.00683783 * t * t
                - 0.05481717 * rh * rh
                + 0.00122874 * t * t * rh
                + 0.00085282 * t * rh * rh
                - 0.00000199 * t * t * rh * rh;
        return (hi - 32) * 5.0 / 9.0;
    }

    /**
     * Eight-point compass name for a bearing in degrees.
     */
    public static String compass(double deg) {
        int idx = (int) Math.floor((deg + 22.5) / 45.0) % 8;
        if (idx < 0)
            idx += 8;
        return COMPASS[idx];
    }

    /**
     * Short human description, e.g. "Warm, humid, partly cloudy".
     */
    public static String describeConditions(double tempC, double humidityPct, double precipMm) {
        List<String> parts = new ArrayList<>(3);

        if (tempC < 10) {
            parts.add("Cold");
        } else if (tempC < 20) {
            parts.add("Mild");
        } else if (tempC < 30) {
            parts.add("Warm");
        } else {
            parts.add("Hot");
        }

        if (precipMm > 5) {
            parts.add("rainy");
        } else if (precipMm > 1) {
            parts.add("drizzly");
        } else if (humidityPct > 80) {
            parts.add("very humid");
        } else if (humidityPct > 60) {
            parts.add("humid");
        } else {
            parts.add("dry");
        }

        // humidity stands in for sky cover here
        if (humidityPct > 80) {
            parts.add("overcast");
        } else if (humidityPct > 60) {
            parts.add("partly cloudy");
        } else {
            parts.add("clear");
        }

        return String.join(", ", parts);
    }

    /**
     * Circular mean of bearings in degrees, in [0, 360).
     */
    public static double circularMean(double[] degrees) {
        double s = 0;
        double c = 0;
        for (double d : degrees) {
            double r = Math.toRadians(d);
            s += Math.sin(r);
            c += Math.cos(r);
        }
        double mean = Math.toDegrees(Math.atan2(s, c));
        double out = mean % 360.0;
        if (out < 0)
            out += 360.0;
        return out >= 360.0 ? 0.0 : out;
    }
}
