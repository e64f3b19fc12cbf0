package space.ketterling.airsense.model;

import java.time.Instant;

/**
 * Forecast for a single hour ahead of generation time.
 */
public record ForecastPoint(
        int hourOffset,
        Instant timestamp,
        double predictedAQI,
        double confidencePercent,
        double lowerBound,
        double upperBound,
        RiskLevel riskLevel) {
}
