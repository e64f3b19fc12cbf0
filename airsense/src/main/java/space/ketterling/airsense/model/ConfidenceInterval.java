package space.ketterling.airsense.model;

/**
 * Model-level confidence interval reported alongside a forecast.
 */
public record ConfidenceInterval(double lower, double upper) {
}
