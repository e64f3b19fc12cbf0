/*
* Copyright 2025 Taylor Ketterling
* Main application entry point for AirSense, an air-quality forecast serving application.
*
* Initializes configuration, the model artifact, the result cache, admission control,
* history and weather sources (synthetic, or database/OpenWeather when configured),
* the maintenance scheduler, and starts the API server.
* program also handles a graceful shutdown.
*/

package space.ketterling.airsense;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.airsense.api.ApiServer;
import space.ketterling.airsense.cache.ResultCache;
import space.ketterling.airsense.config.AppConfig;
import space.ketterling.airsense.config.ObjectMappers;
import space.ketterling.airsense.db.AqiReadingRepo;
import space.ketterling.airsense.db.Database;
import space.ketterling.airsense.db.PredictionRepo;
import space.ketterling.airsense.maintenance.MaintenanceScheduler;
import space.ketterling.airsense.metrics.OutcomeMetrics;
import space.ketterling.airsense.ml.EnsembleForecaster;
import space.ketterling.airsense.ml.ModelArtifact;
import space.ketterling.airsense.ml.ModelArtifactLoader;
import space.ketterling.airsense.ml.SourceAttributor;
import space.ketterling.airsense.model.ForecastResult;
import space.ketterling.airsense.ratelimit.RateLimiter;
import space.ketterling.airsense.service.ForecastService;
import space.ketterling.airsense.service.PredictionRecorder;
import space.ketterling.airsense.source.HistoryProvider;
import space.ketterling.airsense.source.SyntheticHistoryProvider;
import space.ketterling.airsense.source.SyntheticWeatherProvider;
import space.ketterling.airsense.source.WeatherProvider;
import space.ketterling.airsense.weather.OpenWeatherClient;

import java.time.Clock;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();

        ObjectMapper om = ObjectMappers.create();
        Clock clock = Clock.systemUTC();
        OutcomeMetrics metrics = new OutcomeMetrics(clock);

        // Model
        ModelArtifact artifact = ModelArtifactLoader.load(cfg.mlArtifactPath(), om);
        if (artifact.sequenceLength() != cfg.sequenceLength()) {
            log.warn("ml.sequenceLength={} does not match the model's {}; the sequence model will fall back",
                    cfg.sequenceLength(), artifact.sequenceLength());
        }
        EnsembleForecaster forecaster = EnsembleForecaster.fromArtifact(artifact, metrics, clock);

        // Data sources
        final HikariDataSource ds = cfg.databaseEnabled() ? Database.createDataSource(cfg) : null;
        HistoryProvider history;
        PredictionRecorder recorder;
        if (ds != null) {
            history = new AqiReadingRepo(ds, clock);
            recorder = new PredictionRepo(ds);
        } else {
            log.info("No database configured; using synthetic history");
            history = new SyntheticHistoryProvider(cfg.syntheticSeed(), clock, cfg.clockZoneId());
            recorder = null;
        }

        WeatherProvider weather;
        if (cfg.openWeatherEnabled()) {
            weather = new OpenWeatherClient(cfg.openWeatherApiKey(), om, metrics, clock);
        } else {
            log.info("OpenWeather disabled by config; using synthetic weather");
            weather = new SyntheticWeatherProvider(cfg.syntheticSeed(), clock);
        }

        // Serving state
        ResultCache<String, ForecastResult> cache = new ResultCache<>(cfg.cacheDefaultTtl(), clock);
        RateLimiter rateLimiter = new RateLimiter(cfg.rpmLimit(), cfg.rphLimit(), clock);
        ForecastService forecasts = new ForecastService(cfg, cache, forecaster, artifact.info(), history, weather,
                recorder, metrics, clock);

        // Scheduler
        MaintenanceScheduler scheduler = new MaintenanceScheduler(cache, cfg.cacheSweep(), rateLimiter,
                cfg.rateLimitPrune());
        scheduler.start();

        ApiServer api = new ApiServer(cfg, om, forecasts,
                new SourceAttributor(cfg.syntheticSeed(), clock), rateLimiter, cache, metrics, ds);
        api.start();
        log.info("API server started on port {} (model {})", api.port(), artifact.modelVersion());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                scheduler.stop();
                forecasts.close();
                if (ds != null)
                    ds.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }
}
