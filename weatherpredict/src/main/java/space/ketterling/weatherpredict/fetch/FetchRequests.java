package space.ketterling.weatherpredict.fetch;

import space.ketterling.weatherpredict.model.EmptySampleException;
import space.ketterling.weatherpredict.model.InvalidInputException;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Validation and calendar helpers shared by the data providers.
 */
public final class FetchRequests {

    private FetchRequests() {
    }

    /**
     * Rejects out-of-range inputs before any work is scheduled.
     */
    public static void validate(double lat, double lon, int month, int day, int yearsBack) {
        if (!isLatLonValid(lat, lon)) {
            throw new InvalidInputException("lat or lon out of range: " + lat + ", " + lon);
        }
        if (month < 1 || month > 12) {
            throw new InvalidInputException("month out of range: " + month);
        }
        if (day < 1 || day > 31) {
            throw new InvalidInputException("day out of range: " + day);
        }
        if (yearsBack <= 0) {
            throw new EmptySampleException("yearsBack must be positive, got " + yearsBack);
        }
    }

    public static boolean isLatLonValid(double lat, double lon) {
        return Double.isFinite(lat) && Double.isFinite(lon)
                && lat >= -90 && lat <= 90 && lon >= -180 && lon <= 180;
    }

    /**
     * Years {@code [current - yearsBack, current)} in ascending order.
     */
    public static List<Integer> years(Clock clock, int yearsBack) {
        int current = LocalDate.now(clock).getYear();
        List<Integer> out = new ArrayList<>(yearsBack);
        for (int y = current - yearsBack; y < current; y++) {
            out.add(y);
        }
        return out;
    }

    /**
     * The calendar day in {@code year}; days past the end of the month (Feb 29
     * in common years) resolve to the month's last day.
     */
    public static LocalDate dateFor(int year, int month, int day) {
        int last = YearMonth.of(year, month).lengthOfMonth();
        return LocalDate.of(year, month, Math.min(day, last));
    }
}
