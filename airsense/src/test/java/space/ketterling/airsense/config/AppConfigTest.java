package space.ketterling.airsense.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppConfigTest {

    @Test
    void defaultsApplyWhenNothingIsSet() {
        AppConfig cfg = AppConfig.from(new Properties(), Map.of());

        assertThat(cfg.apiPort()).isEqualTo(8000);
        assertThat(cfg.rpmLimit()).isEqualTo(60);
        assertThat(cfg.rphLimit()).isEqualTo(1000);
        assertThat(cfg.cacheDefaultTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(cfg.sequenceLength()).isEqualTo(24);
        assertThat(cfg.forecastHorizonHours()).isEqualTo(48);
        assertThat(cfg.cities()).hasSize(10).startsWith("Delhi", "Mumbai");
        assertThat(cfg.clockZoneId()).isEqualTo(ZoneId.of("Asia/Kolkata"));
        assertThat(cfg.databaseEnabled()).isFalse();
        assertThat(cfg.openWeatherEnabled()).isFalse();
    }

    @Test
    void environmentWinsOverPropertiesFile() {
        Properties p = new Properties();
        p.setProperty("rateLimit.rpm", "5");
        p.setProperty("rateLimit.rph", "50");

        AppConfig cfg = AppConfig.from(p, Map.of("RATE_LIMIT_RPM", "7"));

        assertThat(cfg.rpmLimit()).isEqualTo(7);
        assertThat(cfg.rphLimit()).isEqualTo(50);
    }

    @Test
    void bundledPropertiesMatchDefaults() {
        AppConfig cfg = AppConfig.load();

        assertThat(cfg.cacheSweep()).isEqualTo(Duration.ofSeconds(60));
        assertThat(cfg.rateLimitPrune()).isEqualTo(Duration.ofSeconds(60));
        assertThat(cfg.historyDays()).isEqualTo(30);
    }

    @Test
    void citiesAreTrimmedAndDeduplicated() {
        AppConfig cfg = AppConfig.from(new Properties(), Map.of("CITIES", "Delhi| Pune |Delhi||"));

        assertThat(cfg.cities()).containsExactly("Delhi", "Pune");
    }

    @Test
    void optionalIntegrationsTurnOnWhenConfigured() {
        AppConfig cfg = AppConfig.from(new Properties(), Map.of(
                "DB_JDBC_URL", "jdbc:postgresql://localhost:5432/airsense",
                "OPENWEATHER_API_KEY", "k"));

        assertThat(cfg.databaseEnabled()).isTrue();
        assertThat(cfg.openWeatherEnabled()).isTrue();
    }

    @Test
    void invalidValuesAreRejected() {
        assertThatThrownBy(() -> AppConfig.from(new Properties(), Map.of("FORECAST_HORIZON_HOURS", "73")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("forecast.horizonHours");
        assertThatThrownBy(() -> AppConfig.from(new Properties(), Map.of("RATE_LIMIT_RPM", "0")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> AppConfig.from(new Properties(), Map.of("ML_SEQUENCE_LENGTH", "0")))
                .isInstanceOf(IllegalStateException.class);
    }
}
