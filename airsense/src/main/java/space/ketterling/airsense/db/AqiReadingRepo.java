package space.ketterling.airsense.db;

import space.ketterling.airsense.model.AqiObservation;
import space.ketterling.airsense.source.HistoryProvider;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads measured AQI history from the {@code aqi_readings} table.
 */
public class AqiReadingRepo implements HistoryProvider {
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(AqiReadingRepo.class);

    private final DataSource ds;
    private final Clock clock;

    /**
     * Creates a repo backed by the provided datasource.
     */
    public AqiReadingRepo(DataSource ds, Clock clock) {
        this.ds = ds;
        this.clock = clock;
    }

    /**
     * Returns readings from the last {@code days} days, oldest first.
     */
    @Override
    public List<AqiObservation> fetchHistory(String city, int days) throws SQLException {
        String sql = """
                    SELECT city, timestamp, aqi, pm25, pm10, no2, so2, co, o3
                    FROM aqi_readings
                    WHERE city = ? AND timestamp >= ?
                    ORDER BY timestamp ASC
                """;

        List<AqiObservation> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, city);
            ps.setTimestamp(2, Timestamp.from(clock.instant().minus(Duration.ofDays(days))));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new AqiObservation(
                            rs.getString("city"),
                            rs.getTimestamp("timestamp").toInstant(),
                            getDouble(rs, "aqi"),
                            getDouble(rs, "pm25"),
                            getDouble(rs, "pm10"),
                            getDouble(rs, "no2"),
                            getDouble(rs, "so2"),
                            getDouble(rs, "co"),
                            getDouble(rs, "o3"),
                            null, null, null));
                }
            }
        }
        log.debug("fetchHistory: city={} days={} rows={}", city, days, out.size());
        return out;
    }

    /**
     * Reads a nullable double column.
     */
    private static Double getDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }
}
