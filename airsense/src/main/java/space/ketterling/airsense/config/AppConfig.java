package space.ketterling.airsense.config;

import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, admission control, the result
 * cache, the forecasting model, data sources and the optional database.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,

        // Admission control
        int rpmLimit,
        int rphLimit,
        Duration rateLimitPrune,

        // Cache
        Duration cacheDefaultTtl,
        Duration cacheSweep,

        // Forecasting
        int sequenceLength,
        int forecastHorizonHours,
        String mlArtifactPath,
        int historyDays,
        int batchParallelism,
        List<String> cities,

        // Data sources
        long syntheticSeed,
        String openWeatherApiKey,

        // DB (optional)
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,

        // Time
        ZoneId clockZoneId) {

    public static final int MAX_HORIZON_HOURS = 72;

    static final List<String> DEFAULT_CITIES = List.of(
            "Delhi", "Mumbai", "Bangalore", "Kolkata", "Chennai",
            "Hyderabad", "Pune", "Ahmedabad", "Jaipur", "Lucknow");

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            throw new IllegalStateException("Failed reading application.properties", e);
        }
        return from(p, System.getenv());
    }

    /**
     * Builds a config from explicit sources; {@code env} wins over system properties,
     * which win over {@code p}.
     */
    public static AppConfig from(Properties p, Map<String, String> env) {
        int port = Integer.parseInt(envOr(env, p, "API_PORT", "api.port", "8000"));

        int rpm = Integer.parseInt(envOr(env, p, "RATE_LIMIT_RPM", "rateLimit.rpm", "60"));
        int rph = Integer.parseInt(envOr(env, p, "RATE_LIMIT_RPH", "rateLimit.rph", "1000"));
        Duration prune = Duration.parse(envOr(env, p, "SCHED_RATE_LIMIT_PRUNE", "schedule.rateLimitPrune", "PT60S"));

        long ttlSeconds = Long.parseLong(envOr(env, p, "CACHE_DEFAULT_TTL_SECONDS", "cache.defaultTtlSeconds", "3600"));
        Duration sweep = Duration.parse(envOr(env, p, "SCHED_CACHE_SWEEP", "schedule.cacheSweep", "PT60S"));

        int seqLen = Integer.parseInt(envOr(env, p, "ML_SEQUENCE_LENGTH", "ml.sequenceLength", "24"));
        int horizon = Integer.parseInt(envOr(env, p, "FORECAST_HORIZON_HOURS", "forecast.horizonHours", "48"));
        String artifactPath = envOr(env, p, "ML_ARTIFACT_PATH", "ml.artifactPath", "");
        int historyDays = Integer.parseInt(envOr(env, p, "HISTORY_DAYS", "history.days", "30"));
        int parallelism = Integer.parseInt(envOr(env, p, "BATCH_PARALLELISM", "batch.parallelism", "4"));
        List<String> cities = parseCities(envOr(env, p, "CITIES", "cities", ""));

        long seed = Long.parseLong(envOr(env, p, "SYNTHETIC_SEED", "synthetic.seed", "42"));
        String owKey = envOr(env, p, "OPENWEATHER_API_KEY", "openweather.apiKey", "");

        String dbUrl = envOr(env, p, "DB_JDBC_URL", "db.jdbcUrl", "");
        String dbUser = envOr(env, p, "DB_USERNAME", "db.username", "");
        String dbPass = envOr(env, p, "DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        int dbPoolMax = Integer.parseInt(envOr(env, p, "DB_POOL_MAX", "db.poolMax", "8"));

        ZoneId zoneId = ZoneId.of(envOr(env, p, "CLOCK_ZONE", "clock.zone", "Asia/Kolkata"));

        requireAtLeast(rpm, 1, "rateLimit.rpm");
        requireAtLeast(rph, 1, "rateLimit.rph");
        requireAtLeast(ttlSeconds, 1, "cache.defaultTtlSeconds");
        requireAtLeast(seqLen, 1, "ml.sequenceLength");
        requireAtLeast(historyDays, 1, "history.days");
        requireAtLeast(parallelism, 1, "batch.parallelism");
        if (horizon < 1 || horizon > MAX_HORIZON_HOURS)
            throw new IllegalStateException("forecast.horizonHours must be within 1.." + MAX_HORIZON_HOURS
                    + ", was " + horizon);

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                port,

                rpm,
                rph,
                prune,

                Duration.ofSeconds(ttlSeconds),
                sweep,

                seqLen,
                horizon,
                artifactPath,
                historyDays,
                parallelism,
                cities,

                seed,
                owKey,

                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax,

                zoneId);
    }

    /** True when a JDBC URL is configured. */
    public boolean databaseEnabled() {
        return dbJdbcUrl != null && !dbJdbcUrl.isBlank();
    }

    /** True when an OpenWeather key is configured. */
    public boolean openWeatherEnabled() {
        return openWeatherApiKey != null && !openWeatherApiKey.isBlank();
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Map<String, String> env, Properties p, String envKey, String propKey, String def) {
        String v = env.get(envKey);
        if (v != null && !v.isBlank())
            return v.trim();
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys.trim();
        return p.getProperty(propKey, def).trim();
    }

    private static void requireAtLeast(long v, long min, String name) {
        if (v < min) {
            throw new IllegalStateException(name + " must be >= " + min + ", was " + v);
        }
    }

    /**
     * Parses cities in the format "Delhi|Mumbai|Pune"; blank means the default list.
     */
    private static List<String> parseCities(String s) {
        if (s == null || s.isBlank())
            return DEFAULT_CITIES;
        List<String> out = new ArrayList<>();
        for (String part : s.split("\\|")) {
            String city = part.trim();
            if (!city.isEmpty() && !out.contains(city))
                out.add(city);
        }
        return out.isEmpty() ? DEFAULT_CITIES : List.copyOf(out);
    }
}
