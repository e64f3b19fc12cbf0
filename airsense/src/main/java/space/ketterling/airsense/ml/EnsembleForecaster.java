package space.ketterling.airsense.ml;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.airsense.metrics.OutcomeMetrics;
import space.ketterling.airsense.model.FeatureVector;
import space.ketterling.airsense.model.FeatureWindow;
import space.ketterling.airsense.model.ForecastPoint;
import space.ketterling.airsense.model.RiskLevel;
import space.ketterling.airsense.model.WeatherReading;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Produces an hour-by-hour AQI forecast by blending a window model with two
 * latest-hour estimators, feeding each hour's prediction back into the window.
 *
 * <p>
 * Deterministic for identical inputs apart from the timestamps, which come from the
 * injected clock. Estimator failures never escape: they are replaced by
 * {@link EstimatorResult#FALLBACK_VALUE} and counted in {@link OutcomeMetrics}.
 * </p>
 */
public class EnsembleForecaster {
    private static final Logger log = LoggerFactory.getLogger(EnsembleForecaster.class);

    static final double SEQUENCE_WEIGHT = 0.5;
    static final double ESTIMATOR_A_WEIGHT = 0.3;
    static final double ESTIMATOR_B_WEIGHT = 0.2;

    static final double BASE_CONFIDENCE = 94.0;
    static final double CONFIDENCE_DECAY_PER_HOUR = 0.4;
    static final double MIN_CONFIDENCE = 70.0;
    static final double MAX_CONFIDENCE = 95.0;
    static final double BOUND_SPREAD_FACTOR = 0.2;

    private final WindowEstimator sequenceModel;
    private final PointEstimator estimatorA;
    private final PointEstimator estimatorB;
    private final OutcomeMetrics metrics;
    private final Clock clock;

    public EnsembleForecaster(WindowEstimator sequenceModel, PointEstimator estimatorA, PointEstimator estimatorB,
            OutcomeMetrics metrics, Clock clock) {
        this.sequenceModel = Objects.requireNonNull(sequenceModel, "sequenceModel");
        this.estimatorA = Objects.requireNonNull(estimatorA, "estimatorA");
        this.estimatorB = Objects.requireNonNull(estimatorB, "estimatorB");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Builds the standard ensemble (sequence trend, linear, boosted stumps) from an artifact.
     */
    public static EnsembleForecaster fromArtifact(ModelArtifact artifact, OutcomeMetrics metrics, Clock clock) {
        return new EnsembleForecaster(
                new SequenceTrendModel(artifact.sequence(), artifact.sequenceLength()),
                new LinearFeatureModel(artifact.linear()),
                new BoostedStumpModel(artifact.boosted()),
                metrics,
                clock);
    }

    /**
     * Forecasts {@code hours} points, offsets 0..hours-1.
     *
     * @param window          most recent observations, oldest first
     * @param weatherForecast per-hour weather; hours past its end reuse the last reading
     */
    public List<ForecastPoint> predict(FeatureWindow window, List<WeatherReading> weatherForecast, int hours) {
        Objects.requireNonNull(window, "window");
        if (hours < 0)
            throw new IllegalArgumentException("hours must be >= 0, was " + hours);

        List<WeatherReading> weather = weatherForecast == null ? List.of() : weatherForecast;
        Instant start = clock.instant();
        List<ForecastPoint> out = new ArrayList<>(hours);
        FeatureWindow current = window;

        for (int i = 0; i < hours; i++) {
            FeatureWindow w = current;
            FeatureVector latest = w.latest();
            EstimatorResult seq = observe(EstimatorResult.evaluate(sequenceModel.name(), () -> sequenceModel.predict(w)));
            EstimatorResult a = observe(EstimatorResult.evaluate(estimatorA.name(), () -> estimatorA.predict(latest)));
            EstimatorResult b = observe(EstimatorResult.evaluate(estimatorB.name(), () -> estimatorB.predict(latest)));

            double ensemble = SEQUENCE_WEIGHT * seq.value() + ESTIMATOR_A_WEIGHT * a.value()
                    + ESTIMATOR_B_WEIGHT * b.value();
            double confidence = confidenceAt(i);
            double spread = (1 - confidence / 100.0) * BOUND_SPREAD_FACTOR;

            out.add(new ForecastPoint(
                    i,
                    start.plus(Duration.ofHours(i)),
                    round1(Math.max(0.0, ensemble)),
                    round1(confidence),
                    round1(Math.max(0.0, ensemble * (1 - spread))),
                    round1(Math.max(0.0, ensemble * (1 + spread))),
                    RiskLevel.fromAqi(ensemble)));

            current = w.advance(FeatureVector.synthesize(ensemble, weatherFor(weather, i)));
        }
        return out;
    }

    /**
     * Confidence for an hour offset: linear decay from 94, clamped to [70, 95].
     */
    public static double confidenceAt(int hourOffset) {
        double c = BASE_CONFIDENCE - CONFIDENCE_DECAY_PER_HOUR * hourOffset;
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, c));
    }

    static WeatherReading weatherFor(List<WeatherReading> weather, int hour) {
        if (weather.isEmpty())
            return WeatherReading.DEFAULTS;
        return hour < weather.size() ? weather.get(hour) : weather.get(weather.size() - 1);
    }

    private EstimatorResult observe(EstimatorResult r) {
        metrics.record("estimator:" + r.estimator(), !r.fallbackUsed());
        if (r.fallbackUsed()) {
            log.debug("Estimator {} failed, using fallback {}: {}", r.estimator(), r.value(), r.failure());
        }
        return r;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
