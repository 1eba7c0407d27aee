package space.ketterling.weatherpredict.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.Locale;

/**
 * Deterministic cache key for a (coordinate, date) pair.
 *
 * <p>
 * Coordinates are rounded to 0.01 degrees before hashing, so nearby repeated
 * queries land on the same entry.
 * </p>
 */
public record CacheKey(String digest) {

    public CacheKey {
        if (digest == null || digest.isBlank())
            throw new IllegalArgumentException("digest must not be blank");
    }

    /**
     * Derives the key for a point and day.
     */
    public static CacheKey of(double lat, double lon, LocalDate date) {
        String raw = String.format(Locale.ROOT, "%.2f,%.2f,%s", round2(lat), round2(lon), date);
        return new CacheKey(sha256Hex(raw));
    }

    /**
     * Rounds half-up to two decimal places.
     */
    static double round2(double v) {
        double r = Math.round(v * 100.0) / 100.0;
        // keep -0.00 and 0.00 on the same key
        return r == 0.0 ? 0.0 : r;
    }

    private static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] hash = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(Character.forDigit((b >> 4) & 0xF, 16));
                sb.append(Character.forDigit(b & 0xF, 16));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(e);
        }
    }

    @Override
    public String toString() {
        return digest;
    }
}
