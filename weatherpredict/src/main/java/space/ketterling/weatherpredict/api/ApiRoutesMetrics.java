package space.ketterling.weatherpredict.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.weatherpredict.metrics.ExternalApiMetrics;

/**
 * Rolling outcome counts for the archive and for year resolution.
 */
final class ApiRoutesMetrics {
    private ApiRoutesMetrics() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/metrics/external", ctx -> {
            ObjectNode out = om.createObjectNode();
            out.put("window_minutes", ExternalApiMetrics.windowMinutes());
            ArrayNode services = out.putArray("services");

            ExternalApiMetrics.snapshot().forEach((name, snap) -> {
                ObjectNode row = services.addObject();
                row.put("service", name);
                row.put("calls_last_hour", snap.calls());
                row.put("failures_last_hour", snap.failures());
                row.put("failure_pct", Math.round(snap.failurePct() * 10.0) / 10.0);
                row.put("status", snap.status());
            });

            ctx.json(out);
        });
    }
}
