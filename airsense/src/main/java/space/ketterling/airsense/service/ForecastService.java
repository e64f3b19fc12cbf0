package space.ketterling.airsense.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.airsense.cache.ForecastCacheKey;
import space.ketterling.airsense.cache.ResultCache;
import space.ketterling.airsense.config.AppConfig;
import space.ketterling.airsense.metrics.OutcomeMetrics;
import space.ketterling.airsense.ml.EnsembleForecaster;
import space.ketterling.airsense.ml.ModelInfo;
import space.ketterling.airsense.model.AlertSeverity;
import space.ketterling.airsense.model.AqiObservation;
import space.ketterling.airsense.model.BatchForecast;
import space.ketterling.airsense.model.FeatureWindow;
import space.ketterling.airsense.model.ForecastAlert;
import space.ketterling.airsense.model.ForecastPoint;
import space.ketterling.airsense.model.ForecastResult;
import space.ketterling.airsense.model.WeatherReading;
import space.ketterling.airsense.source.HistoryProvider;
import space.ketterling.airsense.source.WeatherProvider;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Serves forecasts from the result cache, computing and caching them on a miss.
 *
 * <p>
 * Concurrent misses for the same (city, hours) share one computation. Upstream data
 * failures degrade the forecast to default features instead of failing it; anything
 * else that goes wrong, {@link Error}s included, surfaces as
 * {@link ServiceUnavailableException}. Only {@link VirtualMachineError}s are rethrown as
 * they are. Fresh forecasts are recorded after callers have been answered.
 * </p>
 */
public class ForecastService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ForecastService.class);

    static final String HISTORY_SOURCE = "upstream:history";
    static final String WEATHER_SOURCE = "upstream:weather";

    private final AppConfig cfg;
    private final ResultCache<String, ForecastResult> cache;
    private final EnsembleForecaster forecaster;
    private final ModelInfo model;
    private final HistoryProvider history;
    private final WeatherProvider weather;
    private final PredictionRecorder recorder; // nullable
    private final OutcomeMetrics metrics;
    private final Clock clock;

    private final Map<String, CompletableFuture<ForecastResult>> inFlight = new ConcurrentHashMap<>();
    private final ExecutorService batchExec;
    private final ExecutorService recorderExec; // null without a recorder
    private final AtomicLong cacheHits = new AtomicLong();
    private final AtomicLong cacheMisses = new AtomicLong();

    public ForecastService(AppConfig cfg, ResultCache<String, ForecastResult> cache, EnsembleForecaster forecaster,
            ModelInfo model, HistoryProvider history, WeatherProvider weather, PredictionRecorder recorder,
            OutcomeMetrics metrics, Clock clock) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.forecaster = Objects.requireNonNull(forecaster, "forecaster");
        this.model = Objects.requireNonNull(model, "model");
        this.history = Objects.requireNonNull(history, "history");
        this.weather = Objects.requireNonNull(weather, "weather");
        this.recorder = recorder;
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");

        this.recorderExec = recorder == null ? null : Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "prediction-recorder");
            t.setDaemon(true);
            return t;
        });

        AtomicInteger n = new AtomicInteger();
        this.batchExec = Executors.newFixedThreadPool(cfg.batchParallelism(), r -> {
            Thread t = new Thread(r, "forecast-batch-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Returns the forecast for {@code city} over {@code hours} hours (1..72).
     *
     * @throws IllegalArgumentException    blank city or hours out of range
     * @throws ServiceUnavailableException the forecast could not be produced
     */
    public ForecastResult getForecast(String city, int hours) {
        String c = requireCity(city);
        requireHours(hours);
        String key = ForecastCacheKey.of(c, hours).asString();

        Optional<ForecastResult> cached = cache.get(key);
        if (cached.isPresent()) {
            cacheHits.incrementAndGet();
            return cached.get();
        }

        CompletableFuture<ForecastResult> mine = new CompletableFuture<>();
        CompletableFuture<ForecastResult> running = inFlight.putIfAbsent(key, mine);
        if (running != null) {
            log.debug("Joining in-flight forecast for {}", key);
            return await(running, c);
        }

        try {
            // another caller may have finished between the lookup and the claim
            ForecastResult result = cache.get(key).orElse(null);
            boolean fresh = result == null;
            if (fresh) {
                cacheMisses.incrementAndGet();
                result = compute(c, hours);
                cache.set(key, result);
            } else {
                cacheHits.incrementAndGet();
            }
            mine.complete(result);
            if (fresh)
                recordAsync(result);
            return result;
        } catch (Throwable t) {
            mine.completeExceptionally(t);
            if (t instanceof VirtualMachineError)
                throw (VirtualMachineError) t;
            throw unavailable(c, t);
        } finally {
            inFlight.remove(key, mine);
        }
    }

    /**
     * Returns the hours of the default-horizon forecast whose predicted AQI exceeds
     * {@code threshold}, in forecast order.
     */
    public List<ForecastAlert> getAlerts(String city, double threshold) {
        if (!Double.isFinite(threshold))
            throw new IllegalArgumentException("threshold must be a finite number");

        ForecastResult result = getForecast(city, cfg.forecastHorizonHours());
        List<ForecastAlert> alerts = new ArrayList<>();
        for (ForecastPoint p : result.predictions()) {
            if (p.predictedAQI() > threshold) {
                alerts.add(new ForecastAlert(
                        p.timestamp(),
                        p.hourOffset(),
                        p.predictedAQI(),
                        AlertSeverity.fromAqi(p.predictedAQI()),
                        recommendation(p.predictedAQI())));
            }
        }
        return alerts;
    }

    /**
     * Forecasts every distinct city concurrently. One city's failure never affects another's.
     */
    public BatchForecast batchForecast(List<String> cities, int hours) {
        requireHours(hours);
        Set<String> distinct = new LinkedHashSet<>();
        if (cities != null) {
            for (String city : cities) {
                if (city != null && !city.isBlank())
                    distinct.add(city.trim());
            }
        }

        Map<String, CompletableFuture<ForecastResult>> tasks = new LinkedHashMap<>();
        for (String city : distinct) {
            tasks.put(city, CompletableFuture.supplyAsync(() -> getForecast(city, hours), batchExec));
        }

        Map<String, ForecastResult> results = new LinkedHashMap<>();
        Map<String, String> failures = new LinkedHashMap<>();
        for (var e : tasks.entrySet()) {
            try {
                results.put(e.getKey(), e.getValue().join());
            } catch (CompletionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                log.warn("Batch forecast failed for {}: {}", e.getKey(), cause.getMessage());
                failures.put(e.getKey(), cause.getMessage() == null ? cause.getClass().getSimpleName()
                        : cause.getMessage());
            }
        }
        return new BatchForecast(results, failures);
    }

    /**
     * Health-recommendation text for an AQI value.
     */
    public static String recommendation(double aqi) {
        if (aqi > 300)
            return "Stay indoors. Avoid all outdoor activities. Use air purifiers.";
        if (aqi > 200)
            return "Limit outdoor exposure. Wear N95 masks if you must go out.";
        if (aqi > 150)
            return "Sensitive groups should reduce outdoor activities.";
        return "Moderate air quality. Take usual precautions.";
    }

    public long cacheHits() {
        return cacheHits.get();
    }

    public long cacheMisses() {
        return cacheMisses.get();
    }

    public ModelInfo model() {
        return model;
    }

    @Override
    public void close() {
        shutdown(batchExec, "batch");
        if (recorderExec != null)
            shutdown(recorderExec, "recorder");
    }

    private static void shutdown(ExecutorService es, String name) {
        es.shutdown();
        try {
            if (!es.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("{} executor did not terminate cleanly", name);
                es.shutdownNow();
            }
        } catch (InterruptedException e) {
            es.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private ForecastResult compute(String city, int hours) {
        MDC.put("city", city);
        try {
            long t0 = System.nanoTime();
            List<AqiObservation> observations = fetchQuietly(HISTORY_SOURCE, city,
                    () -> history.fetchHistory(city, cfg.historyDays()));
            List<WeatherReading> forecastWeather = fetchQuietly(WEATHER_SOURCE, city,
                    () -> weather.fetchForecast(city, hours));

            FeatureWindow window = FeatureWindow.fromObservations(observations, cfg.sequenceLength());
            List<ForecastPoint> points = forecaster.predict(window, forecastWeather, hours);

            ForecastResult result = new ForecastResult(city, points, model.accuracy(), model.confidenceInterval(),
                    clock.instant(), model.version());
            log.info("Computed {}h forecast for {} ({} history rows, {} weather rows, {} ms)", hours, city,
                    observations.size(), forecastWeather.size(), (System.nanoTime() - t0) / 1_000_000L);
            return result;
        } finally {
            MDC.remove("city");
        }
    }

    /**
     * Calls an upstream source; on failure logs, counts, and returns an empty list.
     */
    private <T> List<T> fetchQuietly(String source, String city, UpstreamCall<T> call) {
        try {
            List<T> out = call.fetch();
            metrics.record(source, true);
            return out == null ? List.of() : out;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.record(source, false);
            log.warn("{} interrupted for {}; forecasting from defaults", source, city);
            return List.of();
        } catch (Exception e) {
            metrics.record(source, false);
            log.warn("{} unavailable for {}; forecasting from defaults: {}", source, city, e.getMessage());
            return List.of();
        }
    }

    /**
     * Hands a fresh forecast to the recorder on its own thread; failures are logged only.
     */
    private void recordAsync(ForecastResult result) {
        if (recorderExec == null)
            return;
        try {
            recorderExec.execute(() -> {
                try {
                    recorder.record(result);
                } catch (Exception e) {
                    log.warn("Failed to record forecast for {}: {}", result.city(), e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Recorder is shut down; forecast for {} not recorded", result.city());
        }
    }

    private ForecastResult await(CompletableFuture<ForecastResult> running, String city) {
        try {
            return running.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ServiceUnavailableException("Interrupted waiting for forecast of " + city, e);
        } catch (ExecutionException e) {
            throw unavailable(city, e.getCause());
        }
    }

    private static RuntimeException unavailable(String city, Throwable cause) {
        if (cause instanceof IllegalArgumentException iae)
            return iae;
        if (cause instanceof ServiceUnavailableException sue)
            return sue;
        log.error("Forecast for {} failed", city, cause);
        return new ServiceUnavailableException("Forecast for " + city + " is unavailable", cause);
    }

    private static String requireCity(String city) {
        if (city == null || city.isBlank())
            throw new IllegalArgumentException("city is required");
        return city.trim();
    }

    private static void requireHours(int hours) {
        if (hours < 1 || hours > AppConfig.MAX_HORIZON_HOURS)
            throw new IllegalArgumentException("hours must be within 1.." + AppConfig.MAX_HORIZON_HOURS
                    + ", was " + hours);
    }

    @FunctionalInterface
    interface UpstreamCall<T> {
        List<T> fetch() throws Exception;
    }
}
