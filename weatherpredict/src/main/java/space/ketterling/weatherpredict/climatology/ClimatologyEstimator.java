package space.ketterling.weatherpredict.climatology;

import space.ketterling.weatherpredict.model.ObservationRecord;

import java.util.Random;

import static space.ketterling.weatherpredict.model.ObservationRecord.clamp;

/**
 * Produces a plausible synthetic daily record from latitude, longitude and
 * month when no real observation is available.
 *
 * <p>
 * The shape follows simple seasonal physics: a latitudinal zone sets the base
 * temperature and its seasonal swing, the southern hemisphere runs six months
 * out of phase, and humidity, wind, precipitation and the derived fields all
 * key off the temperature draw. Randomness comes only from the {@link Random}
 * passed in, so calls are reentrant and reproducible for a given seed.
 * </p>
 */
public final class ClimatologyEstimator {
    static final int DEFAULT_HOUR_MAX = 14;
    static final int DEFAULT_HOUR_MIN = 6;

    /**
     * Estimates one day of weather. Never fails.
     */
    public ObservationRecord estimate(double lat, double lon, int month, int year, Random rnd) {
        double absLat = Math.min(90.0, Math.abs(lat));
        Zone zone = Zone.forLatitude(absLat);
        double seasonal = seasonalFactor(lat, month);
        boolean coastal = isCoastal(lon);

        // year-to-year anomaly plus daily noise
        double temp = zone.baseTemp(absLat) + seasonal * zone.amplitude
                + gaussian(rnd, 0, 1.5) + gaussian(rnd, 0, 2);

        double humidityBase = 70 - (temp - 15) * 1.5;
        if (coastal)
            humidityBase += 10;
        double humidity = clamp(humidityBase + gaussian(rnd, 0, 8), 20, 100);

        double windBase = 5 + Math.abs(absLat - 45) * 0.1;
        if (coastal)
            windBase += 3;
        double windSpeed = Math.max(0, windBase + gaussian(rnd, 0, 3));

        double windDir;
        if (absLat > 30 && absLat < 60) {
            windDir = gaussian(rnd, 270, 45);
        } else {
            windDir = rnd.nextDouble() * 360.0;
        }

        double precipitation = exponential(rnd, precipitationRate(humidity, absLat, seasonal));

        double cloudCover = clamp(humidity * 0.8 + gaussian(rnd, 0, 15), 0, 100);
        double pressure = 1013 - absLat * 0.5 + gaussian(rnd, 0, 10);
        double dewPoint = temp - (100 - humidity) / 5;
        double uv = clamp(11 - absLat / 9 + seasonal * 2 - (cloudCover / 100) * 5, 0, 11);
        double feelsLike = feelsLike(temp, humidity, windSpeed);

        double tMax = temp + 2 + Math.abs(rnd.nextGaussian()) * 2;
        double tMin = temp - 2 - Math.abs(rnd.nextGaussian()) * 2;

        return new ObservationRecord(
                year,
                round1(temp),
                round1(tMax),
                round1(tMin),
                round1(temp),
                DEFAULT_HOUR_MAX,
                DEFAULT_HOUR_MIN,
                round1(humidity),
                round1(windSpeed),
                round1(ObservationRecord.normalizeDegrees(windDir)),
                round1(precipitation),
                round1(cloudCover),
                round1(pressure),
                round1(dewPoint),
                round1(uv),
                round1(feelsLike));
    }

    /**
     * Estimates with a generator seeded from the point, day and year.
     */
    public ObservationRecord estimate(double lat, double lon, int month, int day, int year) {
        return estimate(lat, lon, month, year, new Random(seedFor(lat, lon, month, day, year)));
    }

    /**
     * Seed for a request: stable for the same point and calendar day.
     */
    public static long seedFor(double lat, double lon, int month, int day) {
        return (long) Math.abs(lat * 1000 + lon * 100 + month * 10 + day);
    }

    /**
     * Seed for one year of a request, so fallback years differ from each other.
     */
    public static long seedFor(double lat, double lon, int month, int day, int year) {
        return seedFor(lat, lon, month, day) * 31L + year;
    }

    /**
     * {@code sin(2*pi*(m - 3)/12)} with the month shifted by six in the south.
     */
    public static double seasonalFactor(double lat, int month) {
        return Math.sin(2 * Math.PI * (effectiveMonth(lat, month) - 3) / 12.0);
    }

    static int effectiveMonth(double lat, int month) {
        if (lat >= 0)
            return month;
        int m = (month + 6) % 12;
        return m == 0 ? 12 : m;
    }

    /**
     * Longitudes near the date line or the prime meridian count as near an ocean.
     */
    static boolean isCoastal(double lon) {
        double a = Math.abs(lon);
        return a > 150 || a < 30;
    }

    static double precipitationRate(double humidity, double absLat, double seasonal) {
        double rate;
        if (humidity > 70) {
            rate = 2.5;
        } else if (humidity > 50) {
            rate = 1.0;
        } else {
            rate = 0.3;
        }

        // wet tropical summers, wet Mediterranean winters
        if (absLat < 35 && seasonal > 0) {
            rate *= 1.8;
        } else if (absLat > 35 && absLat < 45 && seasonal < 0) {
            rate *= 1.5;
        }
        return rate;
    }

    /**
     * Wind chill below 10C with wind, a simple humidity bump above 27C,
     * otherwise the air temperature.
     */
    public static double feelsLike(double temp, double humidity, double windSpeed) {
        if (temp < 10 && windSpeed > 5)
            return temp - windSpeed * 0.5;
        if (temp > 27 && humidity > 40)
            return temp + (humidity - 40) * 0.2;
        return temp;
    }

    private static double gaussian(Random rnd, double mean, double sd) {
        return mean + rnd.nextGaussian() * sd;
    }

    /**
     * Exponential draw with the given mean.
     */
    private static double exponential(Random rnd, double mean) {
        return -mean * Math.log(1.0 - rnd.nextDouble());
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    /**
     * Latitude zones with their base temperature and seasonal amplitude.
     */
    enum Zone {
        TROPICAL(23.5, 5),
        SUBTROPICAL(35, 8),
        TEMPERATE(50, 12),
        SUBPOLAR(66.5, 15),
        POLAR(90, 20);

        final double upperBound;
        final double amplitude;

        Zone(double upperBound, double amplitude) {
            this.upperBound = upperBound;
            this.amplitude = amplitude;
        }

        static Zone forLatitude(double absLat) {
            for (Zone z : values()) {
                if (absLat < z.upperBound)
                    return z;
            }
            return POLAR;
        }

        double baseTemp(double absLat) {
            return switch (this) {
                case TROPICAL -> 25 + (23.5 - absLat) * 0.3;
                case SUBTROPICAL -> 20 + (35 - absLat) * 0.4;
                case TEMPERATE -> 12 + (50 - absLat) * 0.5;
                case SUBPOLAR -> 5 + (66.5 - absLat) * 0.3;
                case POLAR -> -10;
            };
        }
    }
}
