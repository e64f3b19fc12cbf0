package space.ketterling.airsense.ml;

import java.util.function.DoubleSupplier;

/**
 * Value produced by one estimator, or the fallback value with the reason it was used.
 */
public record EstimatorResult(String estimator, double value, boolean fallbackUsed, String failure) {

    public static final double FALLBACK_VALUE = 150.0;

    /**
     * Runs an estimator call. Exceptions, errors and non-finite outputs become
     * {@link #FALLBACK_VALUE} with {@code fallbackUsed} set. A
     * {@link VirtualMachineError} is rethrown.
     */
    public static EstimatorResult evaluate(String estimator, DoubleSupplier call) {
        try {
            double v = call.getAsDouble();
            if (!Double.isFinite(v))
                return fallback(estimator, "non-finite output " + v);
            return new EstimatorResult(estimator, v, false, null);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (RuntimeException | Error e) {
            return fallback(estimator, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    public static EstimatorResult fallback(String estimator, String failure) {
        return new EstimatorResult(estimator, FALLBACK_VALUE, true, failure);
    }
}
