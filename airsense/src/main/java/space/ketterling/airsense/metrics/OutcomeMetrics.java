package space.ketterling.airsense.metrics;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts successes and fallbacks for every forecast input: each ensemble estimator
 * and each upstream data source.
 *
 * <p>
 * Counts live in one slot per minute over a rolling hour; a slot is reused once the
 * minute it holds has left the window.
 * </p>
 */
public final class OutcomeMetrics {
    private static final int WINDOW_MINUTES = 60;

    private final Map<String, OutcomeWindow> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public OutcomeMetrics(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Records one outcome for a named source. Blank names are ignored.
     */
    public void record(String source, boolean success) {
        if (source == null || source.isBlank())
            return;
        windows.computeIfAbsent(source, k -> new OutcomeWindow()).add(epochMinute(), success);
    }

    /**
     * Last-hour totals per source, sorted by name.
     */
    public Map<String, SourceSnapshot> snapshot() {
        long now = epochMinute();
        Map<String, SourceSnapshot> out = new TreeMap<>();
        windows.forEach((source, w) -> out.put(source, w.summarize(now)));
        return out;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    private long epochMinute() {
        return clock.millis() / 60_000L;
    }

    /**
     * Maps a failure rate to {@code no-data}, {@code ok}, {@code degraded} (10%+) or {@code down} (50%+).
     */
    static String classify(long calls, double failurePct) {
        if (calls == 0)
            return "no-data";
        if (failurePct >= 50.0)
            return "down";
        return failurePct >= 10.0 ? "degraded" : "ok";
    }

    /**
     * Last-hour summary for one source.
     */
    public record SourceSnapshot(long callsLastHour, long failuresLastHour, double failurePct, String status) {
    }

    private static final class MinuteSlot {
        long minute = Long.MIN_VALUE;
        long calls;
        long failures;
    }

    private static final class OutcomeWindow {
        private final MinuteSlot[] slots = new MinuteSlot[WINDOW_MINUTES];

        OutcomeWindow() {
            for (int i = 0; i < slots.length; i++) {
                slots[i] = new MinuteSlot();
            }
        }

        synchronized void add(long minute, boolean success) {
            MinuteSlot slot = slots[(int) Math.floorMod(minute, (long) WINDOW_MINUTES)];
            if (slot.minute != minute) {
                slot.minute = minute;
                slot.calls = 0;
                slot.failures = 0;
            }
            slot.calls++;
            if (!success)
                slot.failures++;
        }

        synchronized SourceSnapshot summarize(long now) {
            long calls = 0;
            long failures = 0;
            for (MinuteSlot slot : slots) {
                if (slot.minute == Long.MIN_VALUE || now - slot.minute >= WINDOW_MINUTES)
                    continue;
                calls += slot.calls;
                failures += slot.failures;
            }
            double pct = calls == 0 ? 0.0 : failures * 100.0 / calls;
            return new SourceSnapshot(calls, failures, pct, classify(calls, pct));
        }
    }
}
