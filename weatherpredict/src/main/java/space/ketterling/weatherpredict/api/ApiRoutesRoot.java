package space.ketterling.weatherpredict.api;

import io.javalin.Javalin;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("service", "weatherpredict");
            out.put("status", "ok");
            out.put("provider", api.provider().name());
            out.put("endpoints", List.of(
                    "GET /health",
                    "POST /api/weather/predict {latitude, longitude, targetDate}",
                    "GET /api/metrics/external"));
            ctx.json(out);
        });

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());
            out.put("provider", api.provider().name());
            out.put("yearsBack", api.predictions().yearsBack());
            out.put("cacheEntries", api.cache().size());
            ctx.json(out);
        });
    }
}
