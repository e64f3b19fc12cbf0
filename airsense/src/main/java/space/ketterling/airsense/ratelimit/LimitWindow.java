package space.ketterling.airsense.ratelimit;

import java.time.Duration;

/**
 * The two admission windows. Each keeps twice its length in memory between prunes.
 */
public enum LimitWindow {
    MINUTE("minute", Duration.ofMinutes(1)),
    HOUR("hour", Duration.ofHours(1));

    private final String label;
    private final Duration length;

    LimitWindow(String label, Duration length) {
        this.label = label;
        this.length = length;
    }

    public String label() {
        return label;
    }

    public Duration length() {
        return length;
    }

    /** How long timestamps are retained for this window by the pruning sweep. */
    public Duration retention() {
        return length.multipliedBy(2);
    }
}
