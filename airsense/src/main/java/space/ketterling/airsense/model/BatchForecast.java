package space.ketterling.airsense.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a multi-city request: each city lands in exactly one of the two maps,
 * in request order.
 */
public record BatchForecast(Map<String, ForecastResult> results, Map<String, String> failures) {

    public BatchForecast {
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }
}
