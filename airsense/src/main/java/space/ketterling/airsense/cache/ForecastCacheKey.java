package space.ketterling.airsense.cache;

/**
 * Cache key for a forecast request: the ordered pair (city, hours).
 */
public record ForecastCacheKey(String city, int hours) {

    public static ForecastCacheKey of(String city, int hours) {
        return new ForecastCacheKey(city == null ? "" : city.trim(), hours);
    }

    /**
     * Stable string form, e.g. {@code forecast:Delhi:48}.
     */
    public String asString() {
        return "forecast:" + city + ":" + hours;
    }
}
