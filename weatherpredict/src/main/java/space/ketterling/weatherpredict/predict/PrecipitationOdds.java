package space.ketterling.weatherpredict.predict;

/**
 * Rain and snow probabilities in percent.
 */
public record PrecipitationOdds(double rainPct, double snowPct) {

    /**
     * Humidity contributes up to 70 points and precipitation up to 30; below
     * 5C part of the rain chance becomes snow, growing as it gets colder.
     */
    public static PrecipitationOdds of(double tempC, double humidityPct, double precipMm) {
        double humidityFactor = clamp(humidityPct - 30, 0, 70);

        double precipFactor;
        if (precipMm < 5) {
            precipFactor = precipMm * 2;
        } else if (precipMm < 15) {
            precipFactor = 10 + (precipMm - 5) * 1.5;
        } else {
            precipFactor = Math.min(30, 25 + (precipMm - 15) * 0.5);
        }

        double rain = clamp(humidityFactor + precipFactor, 0, 100);
        double snow = 0;
        if (tempC < 5) {
            snow = rain * (5 - tempC) / 5;
            rain = Math.max(0, rain - snow);
        }
        return new PrecipitationOdds(clamp(rain, 0, 100), clamp(snow, 0, 100));
    }

    private static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }
}
