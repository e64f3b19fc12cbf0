package space.ketterling.airsense.source;

import space.ketterling.airsense.model.AqiObservation;

import java.util.List;

/**
 * Source of historic air-quality observations.
 */
public interface HistoryProvider {
    /**
     * Returns observations for the last {@code days} days, oldest first.
     */
    List<AqiObservation> fetchHistory(String city, int days) throws Exception;
}
