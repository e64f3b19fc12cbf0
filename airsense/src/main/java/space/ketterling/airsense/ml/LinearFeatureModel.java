package space.ketterling.airsense.ml;

import space.ketterling.airsense.model.FeatureVector;

import java.util.List;

/**
 * Linear regression over the ten features of the latest hour.
 */
public final class LinearFeatureModel implements PointEstimator {
    private final double intercept;
    private final double[] coefficients;

    public LinearFeatureModel(ModelArtifact.LinearParams params) {
        this.intercept = params.intercept();
        List<Double> c = params.coefficients() == null ? List.of() : params.coefficients();
        this.coefficients = new double[c.size()];
        for (int i = 0; i < coefficients.length; i++) {
            coefficients[i] = c.get(i);
        }
    }

    @Override
    public String name() {
        return "linear";
    }

    @Override
    public double predict(FeatureVector latest) {
        if (coefficients.length != FeatureVector.FEATURE_COUNT) {
            throw new IllegalStateException("linear model has " + coefficients.length
                    + " coefficients, expected " + FeatureVector.FEATURE_COUNT);
        }
        double sum = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            sum += coefficients[i] * latest.get(i);
        }
        return sum;
    }
}
