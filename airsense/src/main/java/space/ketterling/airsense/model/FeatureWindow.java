package space.ketterling.airsense.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Fixed-length rolling history of feature vectors, oldest first.
 *
 * <p>
 * Instances are immutable. {@link #advance(FeatureVector)} returns a new window with the
 * oldest vector dropped and the given vector appended, so the length never changes.
 * </p>
 */
public final class FeatureWindow {
    private final List<FeatureVector> vectors;

    private FeatureWindow(List<FeatureVector> vectors) {
        this.vectors = Collections.unmodifiableList(vectors);
    }

    /**
     * Creates a window from exactly {@code length} vectors.
     */
    public static FeatureWindow of(List<FeatureVector> vectors) {
        if (vectors == null || vectors.isEmpty())
            throw new IllegalArgumentException("a feature window needs at least one vector");
        return new FeatureWindow(new ArrayList<>(vectors));
    }

    /**
     * Builds a window from observations (oldest first), keeping the most recent
     * {@code length} and padding the front with the earliest kept one when short.
     * With no observations every slot holds {@link FeatureVector#DEFAULTS}.
     */
    public static FeatureWindow fromObservations(List<AqiObservation> observations, int length) {
        if (length < 1)
            throw new IllegalArgumentException("window length must be >= 1, was " + length);

        List<FeatureVector> out = new ArrayList<>(length);
        if (observations != null) {
            int from = Math.max(0, observations.size() - length);
            for (AqiObservation o : observations.subList(from, observations.size())) {
                out.add(FeatureVector.fromObservation(o));
            }
        }

        FeatureVector pad = out.isEmpty() ? FeatureVector.DEFAULTS : out.get(0);
        while (out.size() < length) {
            out.add(0, pad);
        }
        return new FeatureWindow(out);
    }

    /**
     * Returns a new window: oldest vector dropped, {@code next} appended.
     */
    public FeatureWindow advance(FeatureVector next) {
        List<FeatureVector> out = new ArrayList<>(vectors.size());
        out.addAll(vectors.subList(1, vectors.size()));
        out.add(next);
        return new FeatureWindow(out);
    }

    public int length() {
        return vectors.size();
    }

    public FeatureVector get(int index) {
        return vectors.get(index);
    }

    /** Most recent vector. */
    public FeatureVector latest() {
        return vectors.get(vectors.size() - 1);
    }

    public List<FeatureVector> vectors() {
        return vectors;
    }

    /**
     * Values of one feature across the window, oldest first.
     */
    public double[] column(int featureIndex) {
        double[] out = new double[vectors.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = vectors.get(i).get(featureIndex);
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureWindow other))
            return false;
        return vectors.equals(other.vectors);
    }

    @Override
    public int hashCode() {
        return vectors.hashCode();
    }

    @Override
    public String toString() {
        return "FeatureWindow[length=" + vectors.size() + ", latest=" + latest() + "]";
    }
}
