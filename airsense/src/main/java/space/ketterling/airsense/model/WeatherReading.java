package space.ketterling.airsense.model;

import java.time.Instant;

/**
 * One hour of forecast weather. Readings are nullable; missing values fall back to
 * the feature defaults when a vector is synthesized.
 */
public record WeatherReading(
        int hour,
        Instant timestamp,
        Double temperature,
        Double humidity,
        Double windSpeed,
        Double precipitationProb) {

    public static final WeatherReading DEFAULTS = new WeatherReading(0, null, 25.0, 60.0, 10.0, null);
}
