package space.ketterling.airsense.model;

import java.time.Instant;
import java.util.List;

/**
 * A complete forecast for one city. Immutable; the same instance is handed out on
 * every cache hit.
 */
public record ForecastResult(
        String city,
        List<ForecastPoint> predictions,
        double modelAccuracy,
        ConfidenceInterval confidenceInterval,
        Instant generatedAt,
        String modelVersion) {

    public ForecastResult {
        predictions = List.copyOf(predictions);
    }
}
