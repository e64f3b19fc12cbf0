package space.ketterling.airsense.model;

/**
 * Estimated contribution of one pollution source to a city's AQI.
 *
 * @param source     source category, e.g. "Vehicular"
 * @param percentage share of the total in percent, one decimal
 * @param trend      "increasing", "stable" or "decreasing"
 * @param confidence confidence of the estimate in percent, one decimal
 */
public record SourceShare(String source, double percentage, String trend, double confidence) {
}
