package space.ketterling.airsense.api;

import io.javalin.Javalin;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service index and liveness endpoints. Neither is subject to admission control.
 */
final class ApiRoutesRoot {
    static final List<String> ENDPOINTS = List.of(
            "GET /health",
            "GET /api/v1/cities",
            "GET /api/v1/predictions/{city}?hours=48",
            "GET /api/v1/alerts/{city}?threshold=200",
            "GET /api/v1/sources/{city}",
            "POST /api/v1/predictions/batch",
            "GET /api/v1/stats");

    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();

        app.get("/", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("service", "airsense");
            out.put("model", api.forecasts().model().version());
            out.put("endpoints", ENDPOINTS);
            ctx.json(out);
        });

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("time", OffsetDateTime.now().toString());
            out.put("model", api.forecasts().model().version());

            String db = checkDatabase(api.ds());
            out.put("db", db);
            boolean healthy = !db.startsWith("fail");
            out.put("status", healthy ? "ok" : "degraded");
            if (!healthy)
                ctx.status(503);
            ctx.json(out);
        });
    }

    /**
     * {@code disabled} without a database, else the outcome of a trivial query.
     */
    private static String checkDatabase(DataSource ds) {
        if (ds == null)
            return "disabled";
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT 1");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? "ok" : "unknown";
        } catch (Exception e) {
            return "fail: " + e.getMessage();
        }
    }
}
