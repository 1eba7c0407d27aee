package space.ketterling.weatherpredict.config;

import space.ketterling.weatherpredict.predict.ConfidencePolicy;

import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, the remote archive,
 * the local cache, the fetch deadline and prediction.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,
        String allowedOrigins,

        // Data source: "climatology" or "archive"
        String dataProvider,

        // Remote archive
        String archiveBaseUrl,
        String archiveUsername,
        String archivePassword,
        Duration archiveTimeout,
        int archiveMaxAttempts,

        // Cache
        String cacheDir,
        int cacheMaxEntries,
        Duration cacheCompaction,

        // Fetch + prediction
        Duration fetchDeadline,
        int yearsBack,
        ConfidencePolicy confidencePolicy,

        // Time
        ZoneId clockZoneId) {

    public static final String PROVIDER_CLIMATOLOGY = "climatology";
    public static final String PROVIDER_ARCHIVE = "archive";

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception ignored) {
            // defaults below cover every key
        }
        return fromProperties(p);
    }

    /**
     * Builds a config from the given properties, still letting env and -D
     * values win.
     */
    static AppConfig fromProperties(Properties p) {
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));
        String origins = envOr(p, "ALLOWED_ORIGINS", "api.allowedOrigins", "*");

        String provider = envOr(p, "DATA_PROVIDER", "data.provider", PROVIDER_CLIMATOLOGY).trim()
                .toLowerCase(Locale.ROOT);
        if (!PROVIDER_CLIMATOLOGY.equals(provider) && !PROVIDER_ARCHIVE.equals(provider)) {
            throw new IllegalStateException(
                    "Unsupported data provider '" + provider + "'. Use 'climatology' or 'archive'.");
        }

        // Archive
        String baseUrl = requireNonBlank(envOr(p, "ARCHIVE_BASE_URL", "archive.baseUrl",
                "https://power.larc.nasa.gov"));
        String user = envOr(p, "EARTHDATA_USERNAME", "archive.username", "");
        String pass = envOr(p, "EARTHDATA_PASSWORD", "archive.password", "");
        Duration timeout = Duration.parse(envOr(p, "ARCHIVE_TIMEOUT", "archive.timeout", "PT8S"));
        int maxAttempts = Integer.parseInt(envOr(p, "ARCHIVE_MAX_ATTEMPTS", "archive.maxAttempts", "2"));

        // Cache
        String cacheDir = requireNonBlank(envOr(p, "CACHE_DIR", "cache.dir", "./data/cache"));
        int cacheMax = Integer.parseInt(envOr(p, "CACHE_MAX_ENTRIES", "cache.maxEntries", "50000"));
        Duration compaction = Duration.parse(envOr(p, "SCHED_CACHE_COMPACTION", "schedule.cacheCompaction", "PT6H"));

        // Fetch + prediction
        Duration deadline = Duration.parse(envOr(p, "FETCH_DEADLINE", "fetch.deadline", "PT60S"));
        int yearsBack = Integer.parseInt(envOr(p, "PREDICTION_YEARS_BACK", "prediction.yearsBack", "10"));
        if (yearsBack <= 0) {
            throw new IllegalStateException("prediction.yearsBack must be positive, got " + yearsBack);
        }
        ConfidencePolicy policy = ConfidencePolicy.valueOf(
                envOr(p, "CONFIDENCE_POLICY", "prediction.confidencePolicy", "WEIGHTED_BLEND").trim()
                        .toUpperCase(Locale.ROOT));

        ZoneId zoneId = ZoneId.of(envOr(p, "CLOCK_ZONE", "clock.zone", "UTC"));

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                port,
                origins,

                provider,

                baseUrl,
                user,
                pass,
                timeout,
                Math.max(1, maxAttempts),

                cacheDir,
                cacheMax,
                compaction,

                deadline,
                yearsBack,
                policy,

                zoneId);
    }

    public boolean useArchive() {
        return PROVIDER_ARCHIVE.equals(dataProvider);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    @Override
    public String toString() {
        return "AppConfig[apiPort=" + apiPort + ", dataProvider=" + dataProvider + ", archiveBaseUrl="
                + archiveBaseUrl + ", archiveUser=" + archiveUsername + ", cacheDir=" + cacheDir
                + ", fetchDeadline=" + fetchDeadline + ", yearsBack=" + yearsBack + ", confidencePolicy="
                + confidencePolicy + "]";
    }
}
