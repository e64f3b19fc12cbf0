/*
* Copyright 2025 Taylor Ketterling
* API Server for AirSense, an air-quality forecast serving application.
* utilizes Javalin for the HTTP server; every /api request passes per-client
* admission control before reaching the forecast service.
* uses Jackson for JSON processing.
*/

package space.ketterling.airsense.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.airsense.cache.ResultCache;
import space.ketterling.airsense.config.AppConfig;
import space.ketterling.airsense.metrics.OutcomeMetrics;
import space.ketterling.airsense.ml.SourceAttributor;
import space.ketterling.airsense.ratelimit.AdmissionDecision;
import space.ketterling.airsense.ratelimit.RateLimitExceededException;
import space.ketterling.airsense.ratelimit.RateLimiter;
import space.ketterling.airsense.service.ForecastService;
import space.ketterling.airsense.service.ServiceUnavailableException;

import javax.sql.DataSource;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicLong;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String PROCESS_TIME_HEADER = "X-Process-Time";

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final ForecastService forecasts;
    private final SourceAttributor sources;
    private final RateLimiter rateLimiter;
    private final ResultCache<?, ?> cache;
    private final OutcomeMetrics metrics;
    private final DataSource ds; // nullable
    private final AtomicLong requestSeq = new AtomicLong();
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, ForecastService forecasts, SourceAttributor sources,
            RateLimiter rateLimiter, ResultCache<?, ?> cache, OutcomeMetrics metrics, DataSource ds) {
        this.cfg = cfg;
        this.om = om;
        this.forecasts = forecasts;
        this.sources = sources;
        this.rateLimiter = rateLimiter;
        this.cache = cache;
        this.metrics = metrics;
        this.ds = ds;
    }

    /**
     * Starts on the configured port.
     */
    public void start() {
        start(cfg.apiPort());
    }

    /**
     * Starts on {@code port}; 0 picks a free port (see {@link #port()}).
     */
    public void start(int port) {
        log.info("Starting API server on port {}", port);
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.jsonMapper(new JavalinJackson(om, false));
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> {
                r.anyHost();
                r.exposeHeader(REQUEST_ID_HEADER);
                r.exposeHeader(PROCESS_TIME_HEADER);
            }));
        });

        // Request id + start time; both are echoed back as response headers
        app.before(ctx -> {
            String requestId = (System.currentTimeMillis() / 1000L) + "-" + requestSeq.incrementAndGet();
            ctx.attribute("startNanos", System.nanoTime());
            ctx.attribute("requestId", requestId);
            ctx.header(REQUEST_ID_HEADER, requestId);
            MDC.put("request", requestId);
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        // Admission control for every API call
        app.before("/api/*", ctx -> {
            if (ctx.method() == HandlerType.OPTIONS)
                return;
            String client = ClientIds.resolve(ctx.header("X-Forwarded-For"), ctx.ip());
            MDC.put("client", client);
            AdmissionDecision decision = rateLimiter.checkAndRecord(client);
            if (!decision.allowed())
                throw new RateLimitExceededException(decision);
        });

        // After-handler: processing time header, response log
        app.after(ctx -> {
            Long t0 = ctx.attribute("startNanos");
            double secs = (t0 == null) ? 0.0 : (System.nanoTime() - t0) / 1_000_000_000.0;
            ctx.header(PROCESS_TIME_HEADER, String.format(Locale.ROOT, "%.4f", secs));
            log.info("Handled {} {} -> {} ({} s, id {})", ctx.method(), ctx.path(), ctx.status(),
                    String.format(Locale.ROOT, "%.3f", secs), ctx.attribute("requestId"));
            MDC.remove("client");
            MDC.remove("request");
        });

        app.exception(RateLimitExceededException.class, (e, ctx) -> {
            AdmissionDecision d = e.decision();
            ctx.header("Retry-After", String.valueOf(d.retryAfterSeconds()));
            ctx.status(429).json(om.createObjectNode()
                    .put("detail", d.reason())
                    .put("window", d.window().label())
                    .put("retry_after_seconds", d.retryAfterSeconds()));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> ctx.status(400).json(om.createObjectNode()
                .put("error", "bad_request")
                .put("message", e.getMessage())));

        app.exception(ServiceUnavailableException.class, (e, ctx) -> {
            log.warn("Service unavailable on {} {}: {}", ctx.method(), ctx.path(), e.getMessage());
            ctx.status(503).json(om.createObjectNode()
                    .put("error", "service_unavailable")
                    .put("message", e.getMessage()));
        });

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", "An error occurred"));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesForecast.register(this);
        ApiRoutesMetrics.register(this);

        app.start(port);
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /**
     * Port the server is bound to.
     */
    public int port() {
        return app.port();
    }

    // --------------------------------------------------------------------
    // Accessors for route registrars
    // --------------------------------------------------------------------
    Javalin app() {
        return app;
    }

    AppConfig cfg() {
        return cfg;
    }

    ObjectMapper om() {
        return om;
    }

    ForecastService forecasts() {
        return forecasts;
    }

    SourceAttributor sources() {
        return sources;
    }

    RateLimiter rateLimiter() {
        return rateLimiter;
    }

    ResultCache<?, ?> cache() {
        return cache;
    }

    OutcomeMetrics metrics() {
        return metrics;
    }

    DataSource ds() {
        return ds;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------
    /**
     * Parses an optional integer query parameter; absent means {@code def}.
     */
    static int intParam(Context ctx, String name, int def) {
        String s = ctx.queryParam(name);
        if (s == null || s.isBlank())
            return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer");
        }
    }

    /**
     * Parses an optional decimal query parameter; absent means {@code def}.
     */
    static double doubleParam(Context ctx, String name, double def) {
        String s = ctx.queryParam(name);
        if (s == null || s.isBlank())
            return def;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number");
        }
    }
}
