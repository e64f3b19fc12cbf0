package space.ketterling.airsense.metrics;

import org.junit.jupiter.api.Test;
import space.ketterling.airsense.support.MutableClock;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class OutcomeMetricsTest {
    private final MutableClock clock = new MutableClock(Instant.parse("2025-01-15T06:00:00Z"));
    private final OutcomeMetrics metrics = new OutcomeMetrics(clock);

    @Test
    void emptyUntilSomethingIsRecorded() {
        assertThat(metrics.snapshot()).isEmpty();
    }

    @Test
    void statusFollowsFailureRate() {
        for (int i = 0; i < 9; i++) {
            metrics.record("estimator:linear", true);
        }
        metrics.record("estimator:linear", false);
        for (int i = 0; i < 4; i++) {
            metrics.record("upstream:weather", false);
        }
        metrics.record("upstream:history", true);

        var snap = metrics.snapshot();
        assertThat(snap.keySet()).containsExactly("estimator:linear", "upstream:history", "upstream:weather");
        assertThat(snap.get("estimator:linear").callsLastHour()).isEqualTo(10);
        assertThat(snap.get("estimator:linear").failurePct()).isEqualTo(10.0);
        assertThat(snap.get("estimator:linear").status()).isEqualTo("degraded");
        assertThat(snap.get("upstream:weather").status()).isEqualTo("down");
        assertThat(snap.get("upstream:history").status()).isEqualTo("ok");
    }

    @Test
    void outcomesAgeOutAfterAnHour() {
        metrics.record("upstream:weather", false);
        clock.advance(Duration.ofMinutes(30));
        metrics.record("upstream:weather", true);

        clock.advance(Duration.ofMinutes(30));
        var snap = metrics.snapshot().get("upstream:weather");
        assertThat(snap.callsLastHour()).isEqualTo(1);
        assertThat(snap.failuresLastHour()).isZero();

        clock.advance(Duration.ofMinutes(30));
        assertThat(metrics.snapshot().get("upstream:weather").status()).isEqualTo("no-data");
    }

    @Test
    void reusedBucketStartsFromZero() {
        metrics.record("upstream:weather", false);
        clock.advance(Duration.ofMinutes(OutcomeMetrics.windowMinutes()));
        metrics.record("upstream:weather", true);

        var snap = metrics.snapshot().get("upstream:weather");
        assertThat(snap.callsLastHour()).isEqualTo(1);
        assertThat(snap.failuresLastHour()).isZero();
    }
}
