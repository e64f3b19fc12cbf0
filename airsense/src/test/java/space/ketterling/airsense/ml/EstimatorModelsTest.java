package space.ketterling.airsense.ml;

import org.junit.jupiter.api.Test;
import space.ketterling.airsense.model.FeatureVector;
import space.ketterling.airsense.model.FeatureWindow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class EstimatorModelsTest {
    private static final ModelArtifact.SequenceParams NO_WEATHER =
            new ModelArtifact.SequenceParams(0.35, 1.0, 0.0, 0.0, 0.0, 0.5);

    private static FeatureWindow aqiWindow(double... aqi) {
        List<FeatureVector> out = new ArrayList<>();
        for (double v : aqi) {
            out.add(new FeatureVector(v, 0, 0, 0, 0, 0, 0, 25, 60, 10));
        }
        return FeatureWindow.of(out);
    }

    @Test
    void sequenceModelReturnsLevelOfFlatHistory() {
        SequenceTrendModel m = new SequenceTrendModel(NO_WEATHER, 4);

        assertThat(m.predict(aqiWindow(120, 120, 120, 120))).isCloseTo(120.0, within(1e-9));
    }

    @Test
    void sequenceModelFollowsRisingTrend() {
        SequenceTrendModel m = new SequenceTrendModel(NO_WEATHER, 4);

        assertThat(m.predict(aqiWindow(100, 110, 120, 130))).isGreaterThan(120.0);
        assertThat(m.predict(aqiWindow(130, 120, 110, 100))).isLessThan(110.0);
    }

    @Test
    void sequenceModelRejectsWrongWindowLength() {
        SequenceTrendModel m = new SequenceTrendModel(NO_WEATHER, 24);

        assertThatThrownBy(() -> m.predict(aqiWindow(100, 100)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("24");
    }

    @Test
    void weatherAdjustmentIsCapped() {
        ModelArtifact.SequenceParams windy = new ModelArtifact.SequenceParams(0.35, 1.0, 0.0, 0.0, -1.0, 0.5);
        SequenceTrendModel m = new SequenceTrendModel(windy, 2);
        FeatureVector calm = new FeatureVector(100, 0, 0, 0, 0, 0, 0, 25, 60, 10);
        FeatureVector gale = new FeatureVector(100, 0, 0, 0, 0, 0, 0, 25, 60, 90);

        assertThat(m.predict(FeatureWindow.of(List.of(calm, gale)))).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void linearModelIsInterceptPlusWeightedFeatures() {
        List<Double> coefficients = new ArrayList<>(Collections.nCopies(10, 0.0));
        coefficients.set(FeatureVector.AQI, 0.5);
        coefficients.set(FeatureVector.WIND_SPEED, -1.0);
        LinearFeatureModel m = new LinearFeatureModel(new ModelArtifact.LinearParams(10.0, coefficients));

        assertThat(m.predict(FeatureVector.DEFAULTS)).isCloseTo(10.0 + 75.0 - 10.0, within(1e-9));
    }

    @Test
    void linearModelWithWrongCoefficientCountThrows() {
        LinearFeatureModel m = new LinearFeatureModel(new ModelArtifact.LinearParams(0.0, List.of(1.0, 2.0)));

        assertThatThrownBy(() -> m.predict(FeatureVector.DEFAULTS)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void boostedStumpsSumShrunkenLeaves() {
        BoostedStumpModel m = new BoostedStumpModel(new ModelArtifact.BoostedParams(100.0, 0.1, List.of(
                new ModelArtifact.Stump(FeatureVector.AQI, 120, -50, 200),
                new ModelArtifact.Stump(FeatureVector.HUMIDITY, 70, 20, -20))));

        // aqi 150 > 120 -> 200, humidity 60 <= 70 -> 20
        assertThat(m.predict(FeatureVector.DEFAULTS)).isCloseTo(122.0, within(1e-9));
    }

    @Test
    void boostedStumpWithUnknownFeatureThrows() {
        BoostedStumpModel m = new BoostedStumpModel(new ModelArtifact.BoostedParams(100.0, 0.1, List.of(
                new ModelArtifact.Stump(42, 1, 0, 0))));

        assertThatThrownBy(() -> m.predict(FeatureVector.DEFAULTS)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void estimatorErrorsFallBack() {
        EstimatorResult r = EstimatorResult.evaluate("rf", () -> {
            throw new AssertionError("bad split");
        });

        assertThat(r.fallbackUsed()).isTrue();
        assertThat(r.value()).isEqualTo(EstimatorResult.FALLBACK_VALUE);
        assertThat(r.failure()).isEqualTo("AssertionError: bad split");
    }

    @Test
    void nonFiniteOutputFallsBack() {
        EstimatorResult r = EstimatorResult.evaluate("gb", () -> Double.NaN);

        assertThat(r.fallbackUsed()).isTrue();
        assertThat(r.failure()).startsWith("non-finite output");
    }

    @Test
    void virtualMachineErrorsAreNotMasked() {
        assertThatThrownBy(() -> EstimatorResult.evaluate("lstm", () -> {
            throw new OutOfMemoryError("heap");
        })).isInstanceOf(OutOfMemoryError.class);
    }
}
