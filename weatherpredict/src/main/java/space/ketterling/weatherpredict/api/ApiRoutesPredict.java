package space.ketterling.weatherpredict.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.weatherpredict.fetch.FetchRequests;
import space.ketterling.weatherpredict.fetch.YearResult;
import space.ketterling.weatherpredict.model.InvalidInputException;
import space.ketterling.weatherpredict.predict.Analysis;
import space.ketterling.weatherpredict.predict.PointPrediction;
import space.ketterling.weatherpredict.predict.PredictionResult;
import space.ketterling.weatherpredict.predict.VariableStats;

import java.util.Locale;
import java.util.Map;

/**
 * {@code POST /api/weather/predict}: body {@code {latitude, longitude, targetDate}}.
 */
final class ApiRoutesPredict {
    private ApiRoutesPredict() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.post("/api/weather/predict", ctx -> {
            JsonNode body = readBody(om, ctx.body());
            double lat = requireNumber(body, "latitude");
            double lon = requireNumber(body, "longitude");
            JsonNode date = body.get("targetDate");
            String targetDate = (date == null || !date.isTextual()) ? null : date.asText();

            PredictionResult result = api.predictions().predictForPoint(lat, lon, targetDate, api.provider());
            ctx.json(toJson(om, result));
        });
    }

    static ObjectNode toJson(ObjectMapper om, PredictionResult r) {
        ObjectNode out = om.createObjectNode();
        out.put("targetDate", r.targetDate().toString());

        ObjectNode location = out.putObject("location");
        location.put("latitude", r.latitude());
        location.put("longitude", r.longitude());
        location.put("name", String.format(Locale.ROOT, "Lat: %.2f, Lon: %.2f", r.latitude(), r.longitude()));

        PointPrediction p = r.prediction();
        ObjectNode pred = out.putObject("prediction");
        pred.put("temperatureC", p.temperatureC());
        pred.put("humidity", p.humidity());
        pred.put("windSpeed", p.windSpeed());
        pred.put("windDirection", p.windDirection());
        pred.put("windCompass", p.windCompass());
        pred.put("precipitation", p.precipitation());
        pred.put("heatIndex", p.heatIndex());
        pred.put("conditions", p.conditions());
        pred.put("weatherType", p.weatherType().wireName());
        pred.put("cloudCover", p.cloudCover());
        pred.put("uvIndex", p.uvIndex());
        pred.put("dewPoint", p.dewPoint());
        pred.put("pressure", p.pressure());
        pred.put("feelsLike", p.feelsLike());
        pred.put("rainProbability", p.rainProbability());
        pred.put("snowProbability", p.snowProbability());

        out.put("confidence", r.confidence());

        int month = r.targetDate().getMonthValue();
        int day = r.targetDate().getDayOfMonth();
        ArrayNode rows = out.putArray("historicalData");
        for (YearResult yr : r.sample().results()) {
            ObjectNode row = rows.addObject();
            row.put("date", FetchRequests.dateFor(yr.year(), month, day).toString());
            row.setAll((ObjectNode) om.valueToTree(yr.record()));
            row.put("source", yr.origin().name().toLowerCase(Locale.ROOT));
            if (yr.fallbackReason() != null)
                row.put("fallbackReason", yr.fallbackReason());
        }

        ObjectNode stats = out.putObject("statistics");
        for (Map.Entry<String, VariableStats> e : r.statistics().entrySet()) {
            VariableStats s = e.getValue();
            ObjectNode n = stats.putObject(e.getKey());
            n.put("mean", s.mean());
            n.put("std", s.std());
            n.put("min", s.min());
            n.put("max", s.max());
            if (s.total() != null)
                n.put("total", s.total());
        }

        Analysis a = r.analysis();
        ObjectNode analysis = out.putObject("analysis");
        analysis.put("yearsAnalyzed", a.yearsAnalyzed());
        analysis.put("dataPoints", a.dataPoints());
        ArrayNode degraded = analysis.putArray("degradedYears");
        a.degradedYears().forEach(degraded::add);
        analysis.put("trendSlopePerYear", a.trendSlopePerYear());
        analysis.put("trends", a.trends());
        analysis.put("notes", a.notes());
        return out;
    }

    private static JsonNode readBody(ObjectMapper om, String raw) {
        if (raw == null || raw.isBlank())
            throw new InvalidInputException("request body must be a JSON object");
        JsonNode body;
        try {
            body = om.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new InvalidInputException("request body is not valid JSON", e);
        }
        if (body == null || !body.isObject())
            throw new InvalidInputException("request body must be a JSON object");
        return body;
    }

    private static double requireNumber(JsonNode body, String field) {
        JsonNode n = body.get(field);
        if (n == null || !n.isNumber())
            throw new InvalidInputException(field + " is required and must be a number");
        return n.asDouble();
    }
}
