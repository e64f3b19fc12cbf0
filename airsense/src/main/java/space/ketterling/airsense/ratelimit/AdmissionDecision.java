package space.ketterling.airsense.ratelimit;

import java.time.Duration;

/**
 * Result of an admission check. Denials carry the window that was exhausted and how
 * long the client should wait before retrying.
 */
public record AdmissionDecision(boolean allowed, LimitWindow window, String reason, Duration retryAfter) {

    private static final AdmissionDecision ALLOWED = new AdmissionDecision(true, null, null, Duration.ZERO);

    public static AdmissionDecision allow() {
        return ALLOWED;
    }

    public static AdmissionDecision deny(LimitWindow window, int limit, Duration retryAfter) {
        String reason = "Rate limit exceeded: " + limit + " requests per " + window.label();
        return new AdmissionDecision(false, window, reason, retryAfter);
    }

    /**
     * Retry hint in whole seconds, rounded up, never below one.
     */
    public long retryAfterSeconds() {
        if (allowed)
            return 0L;
        long secs = retryAfter.getSeconds() + (retryAfter.getNano() > 0 ? 1 : 0);
        return Math.max(1L, secs);
    }
}
