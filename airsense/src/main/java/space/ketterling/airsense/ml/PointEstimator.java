package space.ketterling.airsense.ml;

import space.ketterling.airsense.model.FeatureVector;

/**
 * A predictor that reads only the most recent feature vector.
 */
public interface PointEstimator {
    String name();

    double predict(FeatureVector latest);
}
