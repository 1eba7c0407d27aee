/*
* Copyright 2025 Taylor Ketterling
* API Server for WeatherPredict, a historical point weather prediction service.
* utilizes Javalin for the HTTP server and exposes the prediction endpoint.
* uses Jackson for JSON processing.
*/

package space.ketterling.weatherpredict.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.weatherpredict.cache.CacheStore;
import space.ketterling.weatherpredict.config.AppConfig;
import space.ketterling.weatherpredict.fetch.HistoricalDataProvider;
import space.ketterling.weatherpredict.model.EmptySampleException;
import space.ketterling.weatherpredict.model.InvalidInputException;
import space.ketterling.weatherpredict.predict.PredictionService;

import java.util.Arrays;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final PredictionService predictions;
    private final HistoricalDataProvider provider;
    private final CacheStore cache;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, PredictionService predictions,
            HistoricalDataProvider provider, CacheStore cache) {
        this.cfg = cfg;
        this.om = om;
        this.predictions = predictions;
        this.provider = provider;
        this.cache = cache;
    }

    /**
     * Builds the Javalin app with every route registered, without binding a port.
     */
    public Javalin create() {
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> {
                String[] hosts = allowedHosts(cfg.allowedOrigins());
                if (hosts.length == 0) {
                    r.anyHost();
                } else {
                    r.allowHost(hosts[0], Arrays.copyOfRange(hosts, 1, hosts.length));
                }
            }));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(InvalidInputException.class, (e, ctx) -> badRequest(ctx, "invalid_input", e));
        app.exception(EmptySampleException.class, (e, ctx) -> badRequest(ctx, "empty_sample", e));
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesPredict.register(this);
        ApiRoutesMetrics.register(this);
        return app;
    }

    /**
     * Parses the comma-separated origin list; empty means any host.
     */
    static String[] allowedHosts(String origins) {
        if (origins == null || origins.trim().equals("*"))
            return new String[0];
        return Arrays.stream(origins.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toArray(String[]::new);
    }

    public void start() {
        log.info("Starting API server on port {} (provider={})", cfg.apiPort(), provider.name());
        create().start(cfg.apiPort());
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    private void badRequest(Context ctx, String code, RuntimeException e) {
        log.info("Rejected {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
        ctx.status(400).json(om.createObjectNode()
                .put("error", code)
                .put("message", e.getMessage()));
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    PredictionService predictions() {
        return predictions;
    }

    HistoricalDataProvider provider() {
        return provider;
    }

    CacheStore cache() {
        return cache;
    }
}
