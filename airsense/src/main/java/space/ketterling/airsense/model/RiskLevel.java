package space.ketterling.airsense.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * AQI risk bands. Each upper bound is inclusive.
 */
public enum RiskLevel {
    GOOD("Good", 50),
    MODERATE("Moderate", 100),
    POOR("Poor", 200),
    VERY_POOR("Very Poor", 300),
    SEVERE("Severe", Double.POSITIVE_INFINITY);

    private final String label;
    private final double upperBound;

    RiskLevel(String label, double upperBound) {
        this.label = label;
        this.upperBound = upperBound;
    }

    /**
     * Maps an AQI value to its band.
     */
    public static RiskLevel fromAqi(double aqi) {
        for (RiskLevel level : values()) {
            if (aqi <= level.upperBound)
                return level;
        }
        return SEVERE;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
