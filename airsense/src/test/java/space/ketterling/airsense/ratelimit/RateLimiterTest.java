package space.ketterling.airsense.ratelimit;

import org.junit.jupiter.api.Test;
import space.ketterling.airsense.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {
    private static final Instant T0 = Instant.parse("2025-01-15T06:00:00Z");

    private final MutableClock clock = new MutableClock(T0);

    @Test
    void deniesOnceMinuteLimitIsReached() {
        RateLimiter limiter = new RateLimiter(3, 100, clock);

        for (int i = 0; i < 3; i++) {
            assertThat(limiter.checkAndRecord("1.2.3.4").allowed()).isTrue();
        }
        AdmissionDecision denied = limiter.checkAndRecord("1.2.3.4");

        assertThat(denied.allowed()).isFalse();
        assertThat(denied.window()).isEqualTo(LimitWindow.MINUTE);
        assertThat(denied.reason()).isEqualTo("Rate limit exceeded: 3 requests per minute");
        assertThat(denied.retryAfterSeconds()).isEqualTo(60);
    }

    @Test
    void minuteReasonWinsWhenBothWindowsAreFull() {
        RateLimiter limiter = new RateLimiter(3, 3, clock);

        for (int i = 0; i < 3; i++) {
            assertThat(limiter.checkAndRecord("5.6.7.8").allowed()).isTrue();
        }
        AdmissionDecision denied = limiter.checkAndRecord("5.6.7.8");

        assertThat(denied.allowed()).isFalse();
        assertThat(denied.window()).isEqualTo(LimitWindow.MINUTE);
        assertThat(denied.reason()).isEqualTo("Rate limit exceeded: 3 requests per minute");
        assertThat(denied.retryAfterSeconds()).isEqualTo(60);
    }

    @Test
    void admitsAgainOnceOldestRequestLeavesTheMinute() {
        RateLimiter limiter = new RateLimiter(2, 100, clock);
        limiter.checkAndRecord("c");
        clock.advance(Duration.ofSeconds(20));
        limiter.checkAndRecord("c");

        clock.advance(Duration.ofSeconds(30));
        AdmissionDecision denied = limiter.checkAndRecord("c");
        assertThat(denied.allowed()).isFalse();
        assertThat(denied.retryAfterSeconds()).isEqualTo(10);

        // exactly one minute after the first request it no longer counts
        clock.setInstant(T0.plusSeconds(60));
        assertThat(limiter.checkAndRecord("c").allowed()).isTrue();
    }

    @Test
    void deniesOnceHourLimitIsReached() {
        RateLimiter limiter = new RateLimiter(3, 5, clock);
        for (int i = 0; i < 3; i++) {
            assertThat(limiter.checkAndRecord("c").allowed()).isTrue();
        }
        clock.advance(Duration.ofSeconds(61));
        for (int i = 0; i < 2; i++) {
            assertThat(limiter.checkAndRecord("c").allowed()).isTrue();
        }

        AdmissionDecision denied = limiter.checkAndRecord("c");
        assertThat(denied.allowed()).isFalse();
        assertThat(denied.window()).isEqualTo(LimitWindow.HOUR);
        assertThat(denied.reason()).isEqualTo("Rate limit exceeded: 5 requests per hour");
        assertThat(denied.retryAfterSeconds()).isEqualTo(3600 - 61);
    }

    @Test
    void deniedRequestsAreNotRecorded() {
        RateLimiter limiter = new RateLimiter(1, 100, clock);
        assertThat(limiter.checkAndRecord("c").allowed()).isTrue();

        clock.advance(Duration.ofSeconds(30));
        assertThat(limiter.checkAndRecord("c").allowed()).isFalse();

        clock.advance(Duration.ofSeconds(30));
        assertThat(limiter.checkAndRecord("c").allowed()).isTrue();
    }

    @Test
    void clientsAreIndependent() {
        RateLimiter limiter = new RateLimiter(1, 100, clock);
        assertThat(limiter.checkAndRecord("a").allowed()).isTrue();
        assertThat(limiter.checkAndRecord("a").allowed()).isFalse();
        assertThat(limiter.checkAndRecord("b").allowed()).isTrue();
        assertThat(limiter.trackedClients()).isEqualTo(2);
    }

    @Test
    void pruneForgetsIdleClientsButKeepsActiveOnes() {
        RateLimiter limiter = new RateLimiter(10, 100, clock);
        limiter.checkAndRecord("idle");
        clock.advance(Duration.ofMinutes(90));
        limiter.checkAndRecord("active");

        assertThat(limiter.prune()).isZero();

        clock.advance(Duration.ofMinutes(31));
        assertThat(limiter.prune()).isEqualTo(1);
        assertThat(limiter.trackedClients()).isEqualTo(1);
    }

    @Test
    void concurrentRequestsNeverExceedTheLimit() throws Exception {
        RateLimiter limiter = new RateLimiter(50, 1000, clock);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    int allowed = 0;
                    for (int i = 0; i < 20; i++) {
                        if (limiter.checkAndRecord("shared").allowed())
                            allowed++;
                    }
                    return allowed;
                }));
            }
            start.countDown();

            int total = 0;
            for (Future<Integer> f : futures) {
                total += f.get(10, TimeUnit.SECONDS);
            }
            assertThat(total).isEqualTo(50);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectsNonPositiveLimits() {
        assertThatThrownBy(() -> new RateLimiter(0, 10, clock)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RateLimiter(10, 0, clock)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void retryAfterRoundsUpToWholeSeconds() {
        assertThat(AdmissionDecision.deny(LimitWindow.MINUTE, 1, Duration.ofMillis(1500)).retryAfterSeconds())
                .isEqualTo(2);
        assertThat(AdmissionDecision.deny(LimitWindow.MINUTE, 1, Duration.ZERO).retryAfterSeconds()).isEqualTo(1);
        assertThat(AdmissionDecision.allow().retryAfterSeconds()).isZero();
    }
}
