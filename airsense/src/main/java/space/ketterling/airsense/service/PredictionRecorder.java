package space.ketterling.airsense.service;

import space.ketterling.airsense.model.ForecastResult;

/**
 * Receives each freshly computed forecast (never cache hits).
 */
@FunctionalInterface
public interface PredictionRecorder {
    void record(ForecastResult result) throws Exception;
}
