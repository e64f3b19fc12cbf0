package space.ketterling.airsense.support;

import space.ketterling.airsense.config.AppConfig;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

/**
 * Builds configs from defaults plus env-style overrides.
 */
public final class TestConfigs {
    private TestConfigs() {
    }

    public static AppConfig defaults() {
        return with(Map.of());
    }

    public static AppConfig with(Map<String, String> env) {
        Map<String, String> merged = new HashMap<>();
        merged.put("CITIES", "Delhi|Mumbai|Pune");
        merged.putAll(env);
        return AppConfig.from(new Properties(), merged);
    }
}
