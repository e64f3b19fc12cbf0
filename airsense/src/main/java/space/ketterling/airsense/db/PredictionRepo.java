package space.ketterling.airsense.db;

import space.ketterling.airsense.model.ForecastPoint;
import space.ketterling.airsense.model.ForecastResult;
import space.ketterling.airsense.service.PredictionRecorder;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;

/**
 * Database access for computed forecast points, kept for later comparison against
 * measured AQI.
 */
public class PredictionRepo implements PredictionRecorder {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(PredictionRepo.class);

    private final DataSource ds;

    /**
     * Creates a repo backed by the provided datasource.
     */
    public PredictionRepo(DataSource ds) {
        this.ds = ds;
    }

    /**
     * Inserts one row per forecast hour in a single batch.
     */
    @Override
    public void record(ForecastResult result) throws SQLException {
        String sql = "INSERT INTO predictions (city, prediction_time, predicted_aqi, confidence, model_version) "
                + "VALUES (?, ?, ?, ?, ?)";

        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            for (ForecastPoint p : result.predictions()) {
                ps.setString(1, result.city());
                ps.setTimestamp(2, Timestamp.from(p.timestamp()));
                ps.setDouble(3, p.predictedAQI());
                ps.setDouble(4, p.confidencePercent());
                ps.setString(5, result.modelVersion());
                ps.addBatch();
            }
            ps.executeBatch();
        }
        log.debug("record: city={} points={}", result.city(), result.predictions().size());
    }
}
