package space.ketterling.airsense.ml;

import space.ketterling.airsense.model.FeatureVector;

import java.util.List;

/**
 * Gradient-boosted decision stumps: base value plus the shrunken sum of each stump's leaf.
 */
public final class BoostedStumpModel implements PointEstimator {
    private final double base;
    private final double learningRate;
    private final List<ModelArtifact.Stump> stumps;

    public BoostedStumpModel(ModelArtifact.BoostedParams params) {
        this.base = params.base();
        this.learningRate = params.learningRate();
        this.stumps = params.stumps() == null ? List.of() : List.copyOf(params.stumps());
    }

    @Override
    public String name() {
        return "boosted-stumps";
    }

    @Override
    public double predict(FeatureVector latest) {
        double sum = 0.0;
        for (ModelArtifact.Stump s : stumps) {
            // an out-of-range feature index throws here and the ensemble falls back
            double x = latest.get(s.feature());
            sum += x <= s.threshold() ? s.left() : s.right();
        }
        return base + learningRate * sum;
    }
}
