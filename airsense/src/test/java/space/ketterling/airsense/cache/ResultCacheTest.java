package space.ketterling.airsense.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.airsense.support.MutableClock;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultCacheTest {
    private static final Instant T0 = Instant.parse("2025-01-15T06:00:00Z");

    private MutableClock clock;
    private ResultCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        cache = new ResultCache<>(Duration.ofSeconds(3600), clock);
    }

    @Test
    void returnsStoredValueUntilTtlElapses() {
        cache.set("forecast:Delhi:48", "v1");

        clock.advance(Duration.ofSeconds(3599));
        assertThat(cache.get("forecast:Delhi:48")).contains("v1");

        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("forecast:Delhi:48")).isEmpty();
        assertThat(cache.size()).isZero();
    }

    @Test
    void missingKeyIsEmpty() {
        assertThat(cache.get("nope")).isEmpty();
    }

    @Test
    void perEntryTtlOverridesDefault() {
        cache.set("short", "a", Duration.ofSeconds(10));
        cache.set("long", "b");

        clock.advance(Duration.ofSeconds(11));

        assertThat(cache.get("short")).isEmpty();
        assertThat(cache.get("long")).contains("b");
    }

    @Test
    void overwriteReplacesValueAndExpiry() {
        cache.set("k", "old", Duration.ofSeconds(10));
        clock.advance(Duration.ofSeconds(5));
        cache.set("k", "new", Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(8));
        assertThat(cache.get("k")).contains("new");
    }

    @Test
    void evictExpiredDropsOnlyExpiredEntries() {
        cache.set("a", "1", Duration.ofSeconds(10));
        cache.set("b", "2", Duration.ofSeconds(10));
        cache.set("c", "3", Duration.ofSeconds(100));

        clock.advance(Duration.ofSeconds(10));

        assertThat(cache.evictExpired()).isEqualTo(2);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("c")).contains("3");
        assertThat(cache.evictExpired()).isZero();
    }

    @Test
    void expiredEntryIsNeverReturnedEvenWithoutSweep() {
        cache.set("k", "v", Duration.ofSeconds(1));
        clock.advance(Duration.ofMinutes(5));

        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.get("k")).isEmpty();
    }

    @Test
    void deleteAndClear() {
        cache.set("a", "1");
        cache.set("b", "2");

        cache.delete("a");
        assertThat(cache.get("a")).isEmpty();
        assertThat(cache.get("b")).contains("2");

        cache.clear();
        assertThat(cache.size()).isZero();
    }

    @Test
    void rejectsNonPositiveDefaultTtl() {
        assertThatThrownBy(() -> new ResultCache<String, String>(Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cacheKeyTrimsCity() {
        assertThat(ForecastCacheKey.of("  Delhi ", 24).asString()).isEqualTo("forecast:Delhi:24");
        assertThat(ForecastCacheKey.of("Delhi", 24)).isNotEqualTo(ForecastCacheKey.of("Delhi", 48));
    }
}
