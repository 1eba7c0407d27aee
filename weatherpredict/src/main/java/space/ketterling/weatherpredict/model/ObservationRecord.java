package space.ketterling.weatherpredict.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One year's weather observation for a point and calendar day.
 *
 * <p>
 * Records come from three places: a decoded archive response, a decoded cache
 * entry, or the climatology estimator. Bounded fields are clamped here so every
 * path produces a value inside its documented range.
 * </p>
 */
public record ObservationRecord(
        @JsonProperty("year") int year,
        @JsonProperty("temperatureC") double temperatureC,
        @JsonProperty("temperatureMax") double temperatureMaxC,
        @JsonProperty("temperatureMin") double temperatureMinC,
        @JsonProperty("temperatureAvg") double temperatureAvgC,
        @JsonProperty("hourMax") int hourOfMax,
        @JsonProperty("hourMin") int hourOfMin,
        @JsonProperty("humidity") double humidityPct,
        @JsonProperty("windSpeed") double windSpeedMs,
        @JsonProperty("windDirection") double windDirectionDeg,
        @JsonProperty("precipitation") double precipitationMm,
        @JsonProperty("cloudCover") double cloudCoverPct,
        @JsonProperty("pressure") double pressureHpa,
        @JsonProperty("dewPoint") double dewPointC,
        @JsonProperty("uvIndex") double uvIndex,
        @JsonProperty("feelsLike") double feelsLikeC) {

    public ObservationRecord {
        requireFinite("temperatureC", temperatureC);
        requireFinite("temperatureMax", temperatureMaxC);
        requireFinite("temperatureMin", temperatureMinC);
        requireFinite("temperatureAvg", temperatureAvgC);
        requireFinite("humidity", humidityPct);
        requireFinite("windSpeed", windSpeedMs);
        requireFinite("windDirection", windDirectionDeg);
        requireFinite("precipitation", precipitationMm);
        requireFinite("cloudCover", cloudCoverPct);
        requireFinite("pressure", pressureHpa);
        requireFinite("dewPoint", dewPointC);
        requireFinite("uvIndex", uvIndex);
        requireFinite("feelsLike", feelsLikeC);

        hourOfMax = Math.max(0, Math.min(23, hourOfMax));
        hourOfMin = Math.max(0, Math.min(23, hourOfMin));
        humidityPct = clamp(humidityPct, 0.0, 100.0);
        windSpeedMs = Math.max(0.0, windSpeedMs);
        windDirectionDeg = normalizeDegrees(windDirectionDeg);
        precipitationMm = Math.max(0.0, precipitationMm);
        cloudCoverPct = clamp(cloudCoverPct, 0.0, 100.0);
        uvIndex = Math.max(0.0, uvIndex);
    }

    /**
     * Clamps a value into [min, max].
     */
    public static double clamp(double v, double min, double max) {
        return Math.max(min, Math.min(max, v));
    }

    /**
     * Reduces an angle in degrees into [0, 360).
     */
    public static double normalizeDegrees(double deg) {
        double d = deg % 360.0;
        if (d < 0)
            d += 360.0;
        // -1e-15 % 360 + 360 rounds to 360.0
        return d >= 360.0 ? 0.0 : d;
    }

    private static void requireFinite(String field, double v) {
        if (!Double.isFinite(v)) {
            throw new IllegalArgumentException("Non-finite value for " + field + ": " + v);
        }
    }
}
