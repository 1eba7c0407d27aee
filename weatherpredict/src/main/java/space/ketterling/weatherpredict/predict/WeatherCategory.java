package space.ketterling.weatherpredict.predict;

import java.util.Locale;

/**
 * Coarse weather type, chosen by a strict priority chain (first match wins).
 */
public enum WeatherCategory {
    STORMY,
    SNOWY,
    RAINY,
    FOGGY,
    CLOUDY,
    SUNNY;

    /**
     * Classifies predicted conditions. Order matters: a wet, windy, freezing day
     * is stormy, not snowy.
     */
    public static WeatherCategory classify(double tempC, double humidityPct, double precipMm, double cloudCoverPct,
            double windSpeedMs) {
        if (precipMm > 10 && windSpeedMs > 15)
            return STORMY;
        if (tempC < 2 && precipMm > 2)
            return SNOWY;
        if (precipMm > 5)
            return RAINY;
        if (humidityPct > 90)
            return FOGGY;
        if (cloudCoverPct > 60)
            return CLOUDY;
        return SUNNY;
    }

    /**
     * Lower-case name used on the wire.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
