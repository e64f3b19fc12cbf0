package space.ketterling.airsense.model;

import java.time.Instant;

/**
 * A forecast hour whose predicted AQI crossed the caller's threshold.
 */
public record ForecastAlert(
        Instant timestamp,
        int hourOffset,
        double predictedAQI,
        AlertSeverity severity,
        String recommendation) {
}
