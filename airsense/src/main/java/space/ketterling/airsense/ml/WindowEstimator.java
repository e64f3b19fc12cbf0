package space.ketterling.airsense.ml;

import space.ketterling.airsense.model.FeatureWindow;

/**
 * A predictor that reads the whole feature window.
 */
public interface WindowEstimator {
    String name();

    /**
     * Predicts the next hour's AQI. May throw when the window does not fit the model.
     */
    double predict(FeatureWindow window);
}
