package space.ketterling.airsense.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import space.ketterling.airsense.service.ForecastService;

import java.util.List;
import java.util.Map;

/**
 * Routes that serve forecasts, alerts, source attribution and multi-city batches.
 */
final class ApiRoutesForecast {
    static final double DEFAULT_ALERT_THRESHOLD = 200.0;
    static final int MAX_BATCH_CITIES = 25;

    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesForecast() {
    }

    /**
     * Registers forecast-related HTTP endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();
        ForecastService forecasts = api.forecasts();
        int defaultHours = api.cfg().forecastHorizonHours();

        app.get("/api/v1/cities", ctx -> ctx.json(api.cfg().cities()));

        app.get("/api/v1/predictions/{city}", ctx -> {
            int hours = ApiServer.intParam(ctx, "hours", defaultHours);
            ctx.json(forecasts.getForecast(ctx.pathParam("city"), hours));
        });

        app.get("/api/v1/alerts/{city}", ctx -> {
            double threshold = ApiServer.doubleParam(ctx, "threshold", DEFAULT_ALERT_THRESHOLD);
            ctx.json(forecasts.getAlerts(ctx.pathParam("city"), threshold));
        });

        app.get("/api/v1/sources/{city}", ctx -> ctx.json(Map.of(
                "city", ctx.pathParam("city").trim(),
                "sources", api.sources().attribute(ctx.pathParam("city")))));

        app.post("/api/v1/predictions/batch", ctx -> {
            BatchRequest req;
            try {
                req = om.readValue(ctx.body(), BatchRequest.class);
            } catch (Exception e) {
                throw new IllegalArgumentException("body must be {\"cities\": [...], \"hours\": n}");
            }
            if (req == null || req.cities() == null || req.cities().isEmpty())
                throw new IllegalArgumentException("cities is required");
            if (req.cities().size() > MAX_BATCH_CITIES)
                throw new IllegalArgumentException("at most " + MAX_BATCH_CITIES + " cities per batch");

            int hours = req.hours() == null ? defaultHours : req.hours();
            ctx.json(forecasts.batchForecast(req.cities(), hours));
        });
    }

    /**
     * Body of a batch request.
     */
    record BatchRequest(List<String> cities, Integer hours) {
    }
}
