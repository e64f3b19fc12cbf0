package space.ketterling.airsense.source;

import space.ketterling.airsense.model.WeatherReading;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Generates a diurnal hourly weather forecast: temperature and humidity follow a
 * 24-hour cycle, wind a 48-hour one, each with small seeded jitter.
 */
public final class SyntheticWeatherProvider implements WeatherProvider {
    private final long seed;
    private final Clock clock;

    public SyntheticWeatherProvider(long seed, Clock clock) {
        this.seed = seed;
        this.clock = clock;
    }

    @Override
    public List<WeatherReading> fetchForecast(String city, int hours) {
        Instant start = clock.instant().truncatedTo(ChronoUnit.HOURS);
        Random rnd = new Random(Objects.hash(seed, city, start.getEpochSecond()));

        List<WeatherReading> out = new ArrayList<>(Math.max(0, hours));
        for (int i = 0; i < hours; i++) {
            double temp = 20 + 10 * Math.sin(i * Math.PI / 12) + (rnd.nextInt(4) - 2);
            double humidity = 50 + 20 * Math.cos(i * Math.PI / 12) + (rnd.nextInt(10) - 5);
            double wind = 10 + 5 * Math.sin(i * Math.PI / 24) + (rnd.nextInt(4) - 2);
            double precip = Math.max(0, Math.min(100, 30 + rnd.nextInt(40) - 20));
            out.add(new WeatherReading(i, start.plus(Duration.ofHours(i)), temp, humidity, wind, precip));
        }
        return out;
    }
}
