package space.ketterling.airsense.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.airsense.metrics.OutcomeMetrics;

/**
 * Route that reports cache, admission and estimator/upstream health counters.
 */
final class ApiRoutesMetrics {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesMetrics() {
    }

    /**
     * Registers the stats endpoint.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        app.get("/api/v1/stats", ctx -> {
            ObjectNode out = om.createObjectNode();

            ObjectNode cache = out.putObject("cache");
            cache.put("entries", api.cache().size());
            cache.put("hits", api.forecasts().cacheHits());
            cache.put("misses", api.forecasts().cacheMisses());
            cache.put("default_ttl_seconds", api.cache().defaultTtl().toSeconds());

            ObjectNode limiter = out.putObject("rate_limiter");
            limiter.put("tracked_clients", api.rateLimiter().trackedClients());
            limiter.put("rpm_limit", api.rateLimiter().rpmLimit());
            limiter.put("rph_limit", api.rateLimiter().rphLimit());

            ObjectNode model = out.putObject("model");
            model.put("version", api.forecasts().model().version());
            model.put("accuracy", api.forecasts().model().accuracy());

            out.put("window_minutes", OutcomeMetrics.windowMinutes());
            ArrayNode sources = out.putArray("sources");
            for (var e : api.metrics().snapshot().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = om.createObjectNode();
                row.put("source", e.getKey());
                row.put("calls_last_hour", snap.callsLastHour());
                row.put("failures_last_hour", snap.failuresLastHour());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
                sources.add(row);
            }

            ctx.json(out);
        });
    }
}
