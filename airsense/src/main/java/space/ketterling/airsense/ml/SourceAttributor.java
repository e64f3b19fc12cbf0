package space.ketterling.airsense.ml;

import space.ketterling.airsense.model.SourceShare;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Splits a city's pollution into source categories.
 * <p>
 * Each city has a base profile of shares. The shares are jittered by a few points,
 * renormalized to 100 and returned largest first. Jitter, trend and confidence are
 * seeded per (seed, city, day) so repeated calls on the same day agree.
 * </p>
 */
public final class SourceAttributor {
    private static final String[] SOURCES = { "Vehicular", "Industrial", "Construction", "Biomass", "Other" };
    private static final String[] TRENDS = { "increasing", "stable", "decreasing" };

    private static final Map<String, double[]> PROFILES = Map.of(
            "delhi", new double[] { 38, 25, 20, 12, 5 },
            "mumbai", new double[] { 42, 22, 18, 8, 10 },
            "bangalore", new double[] { 45, 18, 22, 7, 8 });
    private static final double[] DEFAULT_PROFILE = { 35, 28, 18, 12, 7 };

    private final long seed;
    private final Clock clock;

    public SourceAttributor(long seed, Clock clock) {
        this.seed = seed;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Returns one share per source category, sorted by percentage descending.
     *
     * @throws IllegalArgumentException blank city
     */
    public List<SourceShare> attribute(String city) {
        if (city == null || city.isBlank())
            throw new IllegalArgumentException("city is required");
        String c = city.trim();

        long day = clock.instant().truncatedTo(ChronoUnit.DAYS).getEpochSecond();
        Random rnd = new Random(Objects.hash(seed, c, day));
        double[] base = PROFILES.getOrDefault(c.toLowerCase(Locale.ROOT), DEFAULT_PROFILE);

        Map<String, double[]> varied = new LinkedHashMap<>(); // source -> {pct, trend idx, confidence}
        double total = 0;
        for (int i = 0; i < SOURCES.length; i++) {
            double pct = Math.max(0, base[i] + rnd.nextInt(6) - 3);
            int trend = rnd.nextInt(TRENDS.length);
            double confidence = round1(75 + rnd.nextDouble() * 20);
            varied.put(SOURCES[i], new double[] { pct, trend, confidence });
            total += pct;
        }

        List<SourceShare> out = new ArrayList<>(SOURCES.length);
        for (var e : varied.entrySet()) {
            double[] v = e.getValue();
            double share = total > 0 ? round1(v[0] / total * 100) : round1(100.0 / SOURCES.length);
            out.add(new SourceShare(e.getKey(), share, TRENDS[(int) v[1]], v[2]));
        }
        out.sort(Comparator.comparingDouble(SourceShare::percentage).reversed());
        return out;
    }

    private static double round1(double v) {
        return Math.round(v * 10.0) / 10.0;
    }
}
