package space.ketterling.airsense.source;

import space.ketterling.airsense.model.AqiObservation;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Generates plausible daily AQI history for a city when no measurement store is
 * configured. Jitter is seeded per (seed, city, day); the level follows the city's base
 * AQI scaled by the current local hour's traffic factor and the season.
 */
public final class SyntheticHistoryProvider implements HistoryProvider {
    private final long seed;
    private final Clock clock;
    private final ZoneId zone;

    public SyntheticHistoryProvider(long seed, Clock clock, ZoneId zone) {
        this.seed = seed;
        this.clock = clock;
        this.zone = zone;
    }

    @Override
    public List<AqiObservation> fetchHistory(String city, int days) {
        if (days < 1)
            return List.of();

        Instant today = clock.instant().truncatedTo(ChronoUnit.DAYS);
        Random rnd = new Random(Objects.hash(seed, city, today.getEpochSecond()));
        ZonedDateTime local = clock.instant().atZone(zone);
        double base = CityProfiles.baseAqi(city)
                * CityProfiles.timeFactor(local)
                * CityProfiles.seasonalFactor(local);

        List<AqiObservation> out = new ArrayList<>(days);
        for (int i = days - 1; i >= 0; i--) {
            Instant at = today.minus(Duration.ofDays(i));
            double dailyVariation = rnd.nextInt(60) - 30;
            double trend = -0.5 * i;
            double seasonal = 20 * Math.sin(i * 0.2);
            double aqi = clamp(Math.round(base + dailyVariation + trend + seasonal), 50, 400);

            out.add(new AqiObservation(city, at, aqi,
                    (double) Math.round(aqi * 0.6),
                    (double) Math.round(aqi * 0.8),
                    (double) Math.round(aqi * 0.15),
                    null, null, null, null, null, null));
        }
        return out;
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
