package space.ketterling.airsense.db;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import space.ketterling.airsense.model.AqiObservation;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AqiReadingRepoTest {
    private static final Instant NOW = Instant.parse("2025-01-15T06:00:00Z");

    @Mock
    private DataSource ds;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet rs;

    private AqiReadingRepo repo;

    @BeforeEach
    void setUp() throws Exception {
        when(ds.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        when(statement.executeQuery()).thenReturn(rs);
        repo = new AqiReadingRepo(ds, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void mapsRowsAndNullColumns() throws Exception {
        when(rs.next()).thenReturn(true, false);
        when(rs.getString("city")).thenReturn("Delhi");
        when(rs.getTimestamp("timestamp")).thenReturn(Timestamp.from(NOW));
        when(rs.getDouble("aqi")).thenReturn(212.0);
        when(rs.getDouble("pm25")).thenReturn(130.0);
        when(rs.getDouble("pm10")).thenReturn(170.0);
        when(rs.getDouble("no2")).thenReturn(31.0);
        // so2, co and o3 are SQL NULL
        when(rs.wasNull()).thenReturn(false, false, false, false, true, true, true);

        List<AqiObservation> rows = repo.fetchHistory("Delhi", 30);

        assertThat(rows).hasSize(1);
        AqiObservation o = rows.get(0);
        assertThat(o.city()).isEqualTo("Delhi");
        assertThat(o.timestamp()).isEqualTo(NOW);
        assertThat(o.aqi()).isEqualTo(212.0);
        assertThat(o.no2()).isEqualTo(31.0);
        assertThat(o.so2()).isNull();
        assertThat(o.o3()).isNull();
        assertThat(o.temperature()).isNull();

        verify(statement).setString(1, "Delhi");
        verify(statement).setTimestamp(2, Timestamp.from(Instant.parse("2024-12-16T06:00:00Z")));
    }

    @Test
    void emptyResultIsEmptyList() throws Exception {
        when(rs.next()).thenReturn(false);

        assertThat(repo.fetchHistory("Pune", 7)).isEmpty();
        verify(connection).close();
    }
}
