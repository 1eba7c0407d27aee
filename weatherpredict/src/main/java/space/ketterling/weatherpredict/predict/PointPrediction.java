package space.ketterling.weatherpredict.predict;

/**
 * Predicted conditions for the target day, rounded to one decimal.
 */
public record PointPrediction(
        double temperatureC,
        double humidity,
        double windSpeed,
        double windDirection,
        String windCompass,
        double precipitation,
        double heatIndex,
        String conditions,
        WeatherCategory weatherType,
        double cloudCover,
        double pressure,
        double dewPoint,
        double uvIndex,
        double feelsLike,
        double rainProbability,
        double snowProbability) {
}
