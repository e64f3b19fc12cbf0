package space.ketterling.airsense.model;

import java.time.Instant;

/**
 * A historic air-quality observation as returned by a history source.
 * Any reading may be null when the source does not report it.
 */
public record AqiObservation(
        String city,
        Instant timestamp,
        Double aqi,
        Double pm25,
        Double pm10,
        Double no2,
        Double so2,
        Double co,
        Double o3,
        Double temperature,
        Double humidity,
        Double windSpeed) {
}
