package space.ketterling.airsense.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AlertSeverity {
    MODERATE("Moderate"),
    HIGH("High");

    private final String label;

    AlertSeverity(String label) {
        this.label = label;
    }

    /** High above AQI 300, otherwise Moderate. */
    public static AlertSeverity fromAqi(double aqi) {
        return aqi > 300 ? HIGH : MODERATE;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
