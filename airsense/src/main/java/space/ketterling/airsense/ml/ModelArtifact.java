package space.ketterling.airsense.ml;

import space.ketterling.airsense.model.ConfidenceInterval;

import java.util.List;

/**
 * Trained ensemble parameters, as stored in the model artifact JSON.
 */
public record ModelArtifact(
        String modelVersion,
        double accuracy,
        ConfidenceInterval confidenceInterval,
        int sequenceLength,
        SequenceParams sequence,
        LinearParams linear,
        BoostedParams boosted) {

    public ModelInfo info() {
        return new ModelInfo(modelVersion, accuracy, confidenceInterval);
    }

    /**
     * Smoothing, trend and weather sensitivities for the window model.
     */
    public record SequenceParams(
            double smoothing,
            double trendWeight,
            double temperatureSensitivity,
            double humiditySensitivity,
            double windSensitivity,
            double maxWeatherAdjustment) {
    }

    /**
     * Intercept plus one coefficient per feature.
     */
    public record LinearParams(double intercept, List<Double> coefficients) {
    }

    public record BoostedParams(double base, double learningRate, List<Stump> stumps) {
    }

    /**
     * One split: {@code left} when the feature is at or below {@code threshold}, otherwise {@code right}.
     */
    public record Stump(int feature, double threshold, double left, double right) {
    }
}
