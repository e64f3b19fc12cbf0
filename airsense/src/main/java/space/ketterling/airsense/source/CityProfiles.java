package space.ketterling.airsense.source;

import java.time.ZonedDateTime;
import java.util.Map;

/**
 * Typical pollution levels and traffic/seasonal patterns for the monitored cities.
 */
final class CityProfiles {
    static final double DEFAULT_BASE_AQI = 150;

    private static final Map<String, Integer> BASE_AQI = Map.of(
            "Delhi", 250, "Mumbai", 180, "Bangalore", 140,
            "Kolkata", 190, "Chennai", 130, "Hyderabad", 150,
            "Pune", 145, "Ahmedabad", 165, "Jaipur", 200, "Lucknow", 220);

    private CityProfiles() {
    }

    /**
     * Historic average AQI for a city.
     */
    static double baseAqi(String city) {
        Integer v = BASE_AQI.get(city);
        return v == null ? DEFAULT_BASE_AQI : v;
    }

    /**
     * Traffic factor by local hour: morning/evening peaks, moderate daytime, low at night.
     */
    static double timeFactor(ZonedDateTime t) {
        int hour = t.getHour();
        if ((hour >= 7 && hour <= 10) || (hour >= 18 && hour <= 21))
            return 1.3;
        if (hour >= 11 && hour <= 17)
            return 1.1;
        return 0.8;
    }

    /**
     * Seasonal factor by month: winter inversion high, monsoon washout low.
     */
    static double seasonalFactor(ZonedDateTime t) {
        switch (t.getMonthValue()) {
            case 11:
            case 12:
            case 1:
                return 1.5;
            case 2:
            case 3:
                return 1.2;
            case 6:
            case 7:
            case 8:
                return 0.7;
            default:
                return 1.0;
        }
    }
}
