/*
* Copyright 2025 Taylor Ketterling
* NASA POWER client for WeatherPredict, a historical point weather prediction service.
* Utilizes Java HttpClient for requests to the POWER hourly point API
* and Jackson for JSON processing.
*/

package space.ketterling.weatherpredict.power;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.weatherpredict.archive.ArchiveCredentials;
import space.ketterling.weatherpredict.archive.RemoteArchiveClient;
import space.ketterling.weatherpredict.archive.RemoteFetchException;
import space.ketterling.weatherpredict.climatology.ClimatologyEstimator;
import space.ketterling.weatherpredict.config.AppConfig;
import space.ketterling.weatherpredict.metrics.ExternalApiMetrics;
import space.ketterling.weatherpredict.model.ObservationRecord;
import space.ketterling.weatherpredict.predict.WeatherMath;

import java.net.URI;
import java.net.http.*;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * HTTP client for the NASA POWER hourly point API.
 *
 * <p>
 * Fetches the hourly series for one day and reduces it to a daily
 * {@link ObservationRecord}. Includes bounded retries and a simple circuit
 * breaker so a failing upstream turns into fast fallbacks instead of piling
 * up timeouts.
 * </p>
 */
public final class PowerArchiveClient implements RemoteArchiveClient {
    private static final Logger log = LoggerFactory.getLogger(PowerArchiveClient.class);

    static final String SERVICE = "POWER";
    static final String PARAMETERS = "T2M,RH2M,WS10M,WD10M,PRECTOTCORR,CLOUD_AMT,PS,T2MDEW,ALLSKY_SFC_UV_INDEX";
    static final double FILL_VALUE = -999.0;
    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    // circuit breaker defaults: 5 failures inside 60s opens it for 5 minutes
    static final int CB_THRESHOLD = 5;
    static final long CB_WINDOW_MS = 60_000L;
    static final long CB_COOL_DOWN_MS = 300_000L;

    private final HttpClient http;
    private final ObjectMapper om;
    private final String baseUrl;
    private final ArchiveCredentials credentials;
    private final Duration timeout;
    private final int maxAttempts;
    private final long initialBackoffMs;

    // Circuit-breaker state, per client
    private int cbFailureCount = 0;
    private long cbFirstFailureTs = 0L;
    private long cbOpenUntil = 0L;

    /**
     * Creates a POWER client using app config and a shared {@link ObjectMapper}.
     */
    public PowerArchiveClient(AppConfig cfg, ObjectMapper om, ArchiveCredentials credentials) {
        this(HttpClient.newBuilder()
                .connectTimeout(cfg.archiveTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build(),
                om, cfg.archiveBaseUrl(), credentials, cfg.archiveTimeout(), cfg.archiveMaxAttempts(), 500L);
    }

    PowerArchiveClient(HttpClient http, ObjectMapper om, String baseUrl, ArchiveCredentials credentials,
            Duration timeout, int maxAttempts, long initialBackoffMs) {
        this.http = http;
        this.om = om;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.credentials = credentials == null ? ArchiveCredentials.none() : credentials;
        this.timeout = timeout;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialBackoffMs = initialBackoffMs;
    }

    @Override
    public String serviceName() {
        return SERVICE;
    }

    @Override
    public ObservationRecord fetchDay(double lat, double lon, LocalDate date) throws RemoteFetchException {
        JsonNode root = getJson(dayUrl(lat, lon, date));
        return decodeDay(root, date);
    }

    /**
     * Hourly point request for a single day in local solar time.
     */
    String dayUrl(double lat, double lon, LocalDate date) {
        String day = date.format(DAY);
        return baseUrl + "/api/temporal/hourly/point"
                + "?parameters=" + PARAMETERS
                + "&community=RE"
                + String.format(Locale.ROOT, "&latitude=%.4f&longitude=%.4f", lat, lon)
                + "&start=" + day
                + "&end=" + day
                + "&format=JSON"
                + "&time-standard=LST";
    }

    /**
     * Executes a GET request and parses the response as JSON with retries.
     */
    private JsonNode getJson(String url) throws RemoteFetchException {
        long backoffMs = initialBackoffMs;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (isCircuitOpen()) {
                throw new RemoteFetchException("POWER circuit-breaker open, skipping request");
            }

            HttpRequest.Builder rb = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Accept", "application/json")
                    .GET();
            if (credentials.isPresent()) {
                rb.header("Authorization", credentials.basicAuthHeader());
            }

            try {
                log.debug("POWER request attempt={} -> {}", attempt, url);
                HttpResponse<String> resp = http.send(rb.build(), HttpResponse.BodyHandlers.ofString());
                int code = resp.statusCode();
                if (code >= 200 && code < 300) {
                    ExternalApiMetrics.record(SERVICE, true);
                    recordSuccess();
                    return om.readTree(resp.body());
                }

                ExternalApiMetrics.record(SERVICE, false);
                recordFailure();
                if (code != 429 && (code < 500 || code >= 600)) {
                    // non-retryable failure
                    throw new RemoteFetchException("POWER request failed: " + code + " url=" + url);
                }
                if (attempt == maxAttempts) {
                    throw new RemoteFetchException(
                            "POWER request failed after " + attempt + " attempts: " + code + " url=" + url);
                }
                long retryAfterMs = retryAfterMs(resp);
                log.warn("POWER transient failure code={} attempt={} url={}", code, attempt, url);
                pause(Math.max(backoffMs, retryAfterMs));
            } catch (RemoteFetchException e) {
                throw e;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteFetchException("POWER request interrupted", e);
            } catch (Exception e) {
                log.warn("POWER request exception attempt={} url={} err={}", attempt, url, e.getMessage());
                ExternalApiMetrics.record(SERVICE, false);
                recordFailure();
                if (attempt == maxAttempts) {
                    throw new RemoteFetchException("POWER request failed: " + e.getMessage(), e);
                }
                pause(backoffMs);
            }
            backoffMs *= 2;
        }
        throw new RemoteFetchException("POWER request failed after retries: " + url);
    }

    /**
     * Reduces the hourly series for {@code date} to one daily record.
     */
    ObservationRecord decodeDay(JsonNode root, LocalDate date) throws RemoteFetchException {
        JsonNode params = root.path("properties").path("parameter");
        if (!params.isObject()) {
            throw new RemoteFetchException("POWER response has no parameter block for " + date);
        }
        String prefix = date.format(DAY);

        TreeMap<Integer, Double> t2m = required(params, "T2M", prefix, date);
        TreeMap<Integer, Double> rh = required(params, "RH2M", prefix, date);
        TreeMap<Integer, Double> ws = required(params, "WS10M", prefix, date);
        TreeMap<Integer, Double> wd = required(params, "WD10M", prefix, date);
        TreeMap<Integer, Double> prcp = required(params, "PRECTOTCORR", prefix, date);
        TreeMap<Integer, Double> cloud = series(params, "CLOUD_AMT", prefix);
        TreeMap<Integer, Double> ps = series(params, "PS", prefix);
        TreeMap<Integer, Double> dew = series(params, "T2MDEW", prefix);
        TreeMap<Integer, Double> uv = series(params, "ALLSKY_SFC_UV_INDEX", prefix);

        Map.Entry<Integer, Double> max = null;
        Map.Entry<Integer, Double> min = null;
        for (Map.Entry<Integer, Double> e : t2m.entrySet()) {
            if (max == null || e.getValue() > max.getValue())
                max = e;
            if (min == null || e.getValue() < min.getValue())
                min = e;
        }

        double temp = mean(t2m);
        double humidity = mean(rh);
        double wind = mean(ws);
        double direction = WeatherMath.circularMean(wd.values().stream().mapToDouble(Double::doubleValue).toArray());
        double precipitation = prcp.values().stream().mapToDouble(Double::doubleValue).sum();
        double cloudCover = cloud.isEmpty() ? humidity * 0.8 : mean(cloud);
        // POWER reports surface pressure in kPa
        double pressure = ps.isEmpty() ? 1013.25 : mean(ps) * 10.0;
        double dewPoint = dew.isEmpty() ? temp - (100 - humidity) / 5 : mean(dew);
        double uvIndex = uv.isEmpty() ? 0 : uv.values().stream().mapToDouble(Double::doubleValue).max().orElse(0);

        return new ObservationRecord(
                date.getYear(),
                round1(temp),
                round1(max.getValue()),
                round1(min.getValue()),
                round1(temp),
                max.getKey(),
                min.getKey(),
                round1(humidity),
                round1(wind),
                round1(direction),
                round1(precipitation),
                round1(cloudCover),
                round1(pressure),
                round1(dewPoint),
                round1(uvIndex),
                round1(ClimatologyEstimator.feelsLike(temp, humidity, wind)));
    }

    private static TreeMap<Integer, Double> required(JsonNode params, String name, String prefix, LocalDate date)
            throws RemoteFetchException {
        TreeMap<Integer, Double> s = series(params, name, prefix);
        if (s.isEmpty()) {
            throw new RemoteFetchException("POWER response missing " + name + " for " + date);
        }
        return s;
    }

    /**
     * Hour to value for one parameter on one day, fill values dropped.
     */
    private static TreeMap<Integer, Double> series(JsonNode params, String name, String prefix) {
        TreeMap<Integer, Double> out = new TreeMap<>();
        JsonNode node = params.get(name);
        if (node == null || !node.isObject())
            return out;
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            String key = e.getKey();
            if (key.length() != 10 || !key.startsWith(prefix))
                continue;
            JsonNode v = e.getValue();
            if (!v.isNumber())
                continue;
            double d = v.asDouble();
            if (d <= FILL_VALUE + 0.5 || !Double.isFinite(d))
                continue;
            try {
                out.put(Integer.parseInt(key.substring(8, 10)), d);
            } catch (NumberFormatException ignored) {
                // not an hourly key
            }
        }
        return out;
    }

    private static double mean(Map<Integer, Double> s) {
        return s.values().stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }

    private static long retryAfterMs(HttpResponse<?> resp) {
        String ra = resp.headers().firstValue("Retry-After").orElse(null);
        if (ra == null)
            return 0L;
        try {
            return Long.parseLong(ra.trim()) * 1000L;
        } catch (NumberFormatException nfe) {
            // HTTP-date form, fall back to exponential backoff
            return 0L;
        }
    }

    /**
     * Backoff wait; an interrupt keeps the flag set and aborts the request.
     */
    private static void pause(long ms) throws RemoteFetchException {
        if (ms <= 0)
            return;
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteFetchException("POWER request interrupted", e);
        }
    }

    /**
     * Returns true if the circuit breaker is currently open.
     */
    synchronized boolean isCircuitOpen() {
        if (cbOpenUntil == 0L)
            return false;
        if (System.currentTimeMillis() > cbOpenUntil) {
            // cooldown expired -> close circuit
            cbOpenUntil = 0L;
            cbFailureCount = 0;
            cbFirstFailureTs = 0L;
            return false;
        }
        return true;
    }

    /**
     * Records a failed request and opens the circuit if failures exceed the
     * threshold.
     */
    private synchronized void recordFailure() {
        long now = System.currentTimeMillis();
        if (cbFirstFailureTs == 0L || (now - cbFirstFailureTs) > CB_WINDOW_MS) {
            cbFirstFailureTs = now;
            cbFailureCount = 1;
        } else {
            cbFailureCount += 1;
        }

        if (cbOpenUntil == 0L && cbFailureCount >= CB_THRESHOLD) {
            cbOpenUntil = now + CB_COOL_DOWN_MS;
            log.warn("POWER circuit-breaker OPEN due to {} failures within {}ms; open until {}", cbFailureCount,
                    CB_WINDOW_MS, cbOpenUntil);
        }
    }

    /**
     * Resets circuit breaker state after a successful request.
     */
    private synchronized void recordSuccess() {
        cbFailureCount = 0;
        cbFirstFailureTs = 0L;
        if (cbOpenUntil != 0L) {
            cbOpenUntil = 0L;
            log.info("POWER circuit-breaker CLOSED after successful request");
        }
    }
}
