package space.ketterling.airsense.model;

/**
 * One hour of pollutant and weather readings, in the fixed order the models expect.
 *
 * <p>
 * Index order: AQI, PM2.5, PM10, NO2, SO2, CO, O3, temperature (C), relative
 * humidity (%), wind speed.
 * </p>
 */
public record FeatureVector(
        double aqi,
        double pm25,
        double pm10,
        double no2,
        double so2,
        double co,
        double o3,
        double temperature,
        double humidity,
        double windSpeed) {

    public static final int FEATURE_COUNT = 10;

    public static final int AQI = 0;
    public static final int TEMPERATURE = 7;
    public static final int HUMIDITY = 8;
    public static final int WIND_SPEED = 9;

    /** Values used when an observation is missing a reading, or there is no observation at all. */
    public static final FeatureVector DEFAULTS = new FeatureVector(150, 90, 140, 40, 10, 1.5, 30, 25, 60, 10);

    // Pollutant levels estimated from a predicted AQI
    private static final double PM25_RATIO = 0.6;
    private static final double PM10_RATIO = 0.8;
    private static final double NO2_RATIO = 0.15;
    private static final double SO2_RATIO = 0.08;
    private static final double CO_RATIO = 0.01;
    private static final double O3_RATIO = 0.12;

    /**
     * Builds a vector from an observation, substituting {@link #DEFAULTS} for missing readings.
     */
    public static FeatureVector fromObservation(AqiObservation o) {
        return new FeatureVector(
                or(o.aqi(), DEFAULTS.aqi),
                or(o.pm25(), DEFAULTS.pm25),
                or(o.pm10(), DEFAULTS.pm10),
                or(o.no2(), DEFAULTS.no2),
                or(o.so2(), DEFAULTS.so2),
                or(o.co(), DEFAULTS.co),
                or(o.o3(), DEFAULTS.o3),
                or(o.temperature(), DEFAULTS.temperature),
                or(o.humidity(), DEFAULTS.humidity),
                or(o.windSpeed(), DEFAULTS.windSpeed));
    }

    /**
     * Synthesizes the next hour's vector from a predicted AQI and that hour's weather.
     */
    public static FeatureVector synthesize(double predictedAqi, WeatherReading weather) {
        WeatherReading w = weather == null ? WeatherReading.DEFAULTS : weather;
        return new FeatureVector(
                predictedAqi,
                predictedAqi * PM25_RATIO,
                predictedAqi * PM10_RATIO,
                predictedAqi * NO2_RATIO,
                predictedAqi * SO2_RATIO,
                predictedAqi * CO_RATIO,
                predictedAqi * O3_RATIO,
                or(w.temperature(), DEFAULTS.temperature),
                or(w.humidity(), DEFAULTS.humidity),
                or(w.windSpeed(), DEFAULTS.windSpeed));
    }

    /**
     * Returns the reading at a feature index.
     */
    public double get(int index) {
        switch (index) {
            case 0:
                return aqi;
            case 1:
                return pm25;
            case 2:
                return pm10;
            case 3:
                return no2;
            case 4:
                return so2;
            case 5:
                return co;
            case 6:
                return o3;
            case 7:
                return temperature;
            case 8:
                return humidity;
            case 9:
                return windSpeed;
            default:
                throw new IndexOutOfBoundsException("feature index " + index + " out of range 0.."
                        + (FEATURE_COUNT - 1));
        }
    }

    /**
     * Copies the readings into a fresh array.
     */
    public double[] toArray() {
        return new double[] { aqi, pm25, pm10, no2, so2, co, o3, temperature, humidity, windSpeed };
    }

    private static double or(Double v, double def) {
        return (v == null || v.isNaN()) ? def : v;
    }
}
