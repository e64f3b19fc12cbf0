package space.ketterling.airsense.source;

import space.ketterling.airsense.model.WeatherReading;

import java.util.List;

/**
 * Source of hourly weather forecasts.
 */
public interface WeatherProvider {
    /**
     * Returns {@code hours} hourly readings starting at the current hour.
     */
    List<WeatherReading> fetchForecast(String city, int hours) throws Exception;
}
