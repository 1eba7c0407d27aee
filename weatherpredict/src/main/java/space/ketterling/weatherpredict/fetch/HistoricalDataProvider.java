package space.ketterling.weatherpredict.fetch;

/**
 * Source of multi-year samples for a point and calendar day.
 */
public interface HistoricalDataProvider {

    /**
     * Returns one record per year in {@code [currentYear - yearsBack, currentYear)},
     * ordered by year.
     *
     * <p>
     * Throws {@code InvalidInputException} for out-of-range coordinates or
     * calendar fields and {@code EmptySampleException} when no year can be
     * resolved.
     * </p>
     */
    Sample fetch(double lat, double lon, int month, int day, int yearsBack);

    /**
     * Short name shown in health output.
     */
    String name();
}
