package space.ketterling.airsense.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client admission control over a trailing minute and a trailing hour.
 *
 * <p>
 * Each client's state is only touched inside {@link ConcurrentHashMap#compute}, so a
 * check-and-record is atomic per client while different clients never contend.
 * Decisions always filter to the exact window boundary; {@link #prune()} only bounds
 * memory.
 * </p>
 */
public final class RateLimiter {
    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final int rpmLimit;
    private final int rphLimit;
    private final Clock clock;
    private final Map<String, ClientWindowState> clients = new ConcurrentHashMap<>();

    public RateLimiter(int rpmLimit, int rphLimit, Clock clock) {
        if (rpmLimit < 1 || rphLimit < 1)
            throw new IllegalArgumentException("rate limits must be >= 1 (rpm=" + rpmLimit + ", rph=" + rphLimit + ")");
        this.rpmLimit = rpmLimit;
        this.rphLimit = rphLimit;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Admits or denies one request. Only admitted requests are recorded.
     */
    public AdmissionDecision checkAndRecord(String clientId) {
        String id = clientId == null ? "unknown" : clientId;
        Instant now = clock.instant();
        AdmissionDecision[] out = new AdmissionDecision[1];

        clients.compute(id, (k, state) -> {
            ClientWindowState s = state == null ? new ClientWindowState() : state;
            out[0] = s.admit(now);
            return s.isEmpty() ? null : s;
        });

        if (!out[0].allowed()) {
            log.info("Rate limit hit for client {} ({} window, retry in {}s)",
                    id, out[0].window().label(), out[0].retryAfterSeconds());
        }
        return out[0];
    }

    /**
     * Drops timestamps past each window's retention and forgets idle clients.
     * Returns the number of clients removed.
     */
    public int prune() {
        Instant now = clock.instant();
        int[] removed = new int[1];
        for (String id : clients.keySet()) {
            clients.computeIfPresent(id, (k, s) -> {
                s.trim(now);
                if (!s.isEmpty())
                    return s;
                removed[0]++;
                return null;
            });
        }
        if (removed[0] > 0)
            log.debug("Pruned {} idle rate-limit clients ({} tracked)", removed[0], clients.size());
        return removed[0];
    }

    /** Number of clients with retained timestamps. */
    public int trackedClients() {
        return clients.size();
    }

    public int rpmLimit() {
        return rpmLimit;
    }

    public int rphLimit() {
        return rphLimit;
    }

    /**
     * Timestamps of admitted requests for one client, oldest first.
     */
    private final class ClientWindowState {
        private final Deque<Instant> minute = new ArrayDeque<>();
        private final Deque<Instant> hour = new ArrayDeque<>();

        AdmissionDecision admit(Instant now) {
            int inMinute = countSince(minute, now.minus(LimitWindow.MINUTE.length()));
            if (inMinute >= rpmLimit)
                return AdmissionDecision.deny(LimitWindow.MINUTE, rpmLimit, retryAfter(minute, LimitWindow.MINUTE, now));

            int inHour = countSince(hour, now.minus(LimitWindow.HOUR.length()));
            if (inHour >= rphLimit)
                return AdmissionDecision.deny(LimitWindow.HOUR, rphLimit, retryAfter(hour, LimitWindow.HOUR, now));

            minute.addLast(now);
            hour.addLast(now);
            return AdmissionDecision.allow();
        }

        void trim(Instant now) {
            dropUpTo(minute, now.minus(LimitWindow.MINUTE.retention()));
            dropUpTo(hour, now.minus(LimitWindow.HOUR.retention()));
        }

        boolean isEmpty() {
            return minute.isEmpty() && hour.isEmpty();
        }

        private int countSince(Deque<Instant> stamps, Instant cutoff) {
            int n = 0;
            for (var it = stamps.descendingIterator(); it.hasNext();) {
                if (!it.next().isAfter(cutoff))
                    break;
                n++;
            }
            return n;
        }

        /**
         * Time until the oldest timestamp still inside the window falls out of it.
         */
        private Duration retryAfter(Deque<Instant> stamps, LimitWindow window, Instant now) {
            Instant cutoff = now.minus(window.length());
            for (Instant ts : stamps) {
                if (ts.isAfter(cutoff))
                    return Duration.between(now, ts.plus(window.length()));
            }
            return Duration.ZERO;
        }

        private void dropUpTo(Deque<Instant> stamps, Instant cutoff) {
            while (!stamps.isEmpty() && !stamps.peekFirst().isAfter(cutoff)) {
                stamps.removeFirst();
            }
        }
    }
}
