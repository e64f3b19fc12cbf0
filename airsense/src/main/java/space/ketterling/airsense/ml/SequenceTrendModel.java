package space.ketterling.airsense.ml;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import space.ketterling.airsense.model.FeatureVector;
import space.ketterling.airsense.model.FeatureWindow;

/**
 * Window model: exponentially smoothed AQI level plus the least-squares trend over the
 * window, scaled by how the latest weather departs from the baseline.
 */
public final class SequenceTrendModel implements WindowEstimator {
    private final ModelArtifact.SequenceParams params;
    private final int sequenceLength;

    public SequenceTrendModel(ModelArtifact.SequenceParams params, int sequenceLength) {
        this.params = params;
        this.sequenceLength = sequenceLength;
    }

    @Override
    public String name() {
        return "sequence-trend";
    }

    @Override
    public double predict(FeatureWindow window) {
        if (window.length() != sequenceLength) {
            throw new IllegalStateException("model expects a window of " + sequenceLength
                    + " hours, got " + window.length());
        }

        double[] aqi = window.column(FeatureVector.AQI);
        double alpha = params.smoothing();
        double level = aqi[0];
        SimpleRegression regression = new SimpleRegression();
        for (int i = 0; i < aqi.length; i++) {
            if (i > 0)
                level = alpha * aqi[i] + (1 - alpha) * level;
            regression.addData(i, aqi[i]);
        }

        double slope = regression.getSlope();
        if (Double.isNaN(slope))
            slope = 0.0;

        FeatureVector last = window.latest();
        double adjustment = params.temperatureSensitivity() * (last.temperature() - FeatureVector.DEFAULTS.temperature())
                + params.humiditySensitivity() * (last.humidity() - FeatureVector.DEFAULTS.humidity())
                + params.windSensitivity() * (last.windSpeed() - FeatureVector.DEFAULTS.windSpeed());
        double cap = params.maxWeatherAdjustment();
        adjustment = Math.max(-cap, Math.min(cap, adjustment));

        return Math.max(0.0, (level + params.trendWeight() * slope) * (1.0 + adjustment));
    }
}
