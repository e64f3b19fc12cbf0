package space.ketterling.airsense.ml;

import space.ketterling.airsense.model.ConfidenceInterval;

/**
 * Metadata reported with every forecast produced by a model.
 */
public record ModelInfo(String version, double accuracy, ConfidenceInterval confidenceInterval) {
}
