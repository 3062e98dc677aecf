package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.data.Gap;
import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.error.PersistenceException;
import in.candlevault.domain.repository.GapRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * PostgreSQL implementation of GapRepository.
 */
public final class PostgresGapRepository implements GapRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresGapRepository.class);

    private static final String COLUMNS = """
        id, symbol, interval_code, gap_start, gap_end, status, attempt_count,
        detected_at, last_attempt_at, last_error
        """;

    private final DataSource dataSource;

    public PostgresGapRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Gap> listGaps(String symbol, Interval interval, GapStatus status) {
        String sql = "SELECT " + COLUMNS + " FROM data_gaps WHERE symbol = ? AND interval_code = ?"
            + (status != null ? " AND status = ?" : "")
            + " ORDER BY gap_start ASC, id ASC";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, interval.getCode());
            if (status != null) {
                ps.setString(3, status.name());
            }
            return readAll(ps);

        } catch (SQLException e) {
            log.error("Failed to list gaps: {}", e.getMessage());
            throw new PersistenceException("Failed to list gaps", e);
        }
    }

    @Override
    public List<Gap> findByStatus(GapStatus status) {
        String sql = "SELECT " + COLUMNS + " FROM data_gaps WHERE status = ? ORDER BY gap_start ASC, id ASC";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            return readAll(ps);

        } catch (SQLException e) {
            log.error("Failed to find gaps by status: {}", e.getMessage());
            throw new PersistenceException("Failed to find gaps by status", e);
        }
    }

    @Override
    public Optional<Gap> findById(String id) {
        String sql = "SELECT " + COLUMNS + " FROM data_gaps WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, id);
            List<Gap> found = readAll(ps);
            return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));

        } catch (SQLException e) {
            log.error("Failed to find gap {}: {}", id, e.getMessage());
            throw new PersistenceException("Failed to find gap", e);
        }
    }

    @Override
    public void saveGap(Gap gap) {
        String sql = """
            INSERT INTO data_gaps (id, symbol, interval_code, gap_start, gap_end, status, attempt_count,
                                   detected_at, last_attempt_at, last_error)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (id)
            DO UPDATE SET
                gap_start = EXCLUDED.gap_start,
                gap_end = EXCLUDED.gap_end,
                status = EXCLUDED.status,
                attempt_count = EXCLUDED.attempt_count,
                last_attempt_at = EXCLUDED.last_attempt_at,
                last_error = EXCLUDED.last_error,
                updated_at = NOW()
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, gap.id());
            ps.setString(2, gap.symbol());
            ps.setString(3, gap.interval().getCode());
            ps.setTimestamp(4, Timestamp.from(gap.start()));
            ps.setTimestamp(5, Timestamp.from(gap.end()));
            ps.setString(6, gap.status().name());
            ps.setInt(7, gap.attemptCount());
            ps.setTimestamp(8, Timestamp.from(gap.detectedAt()));
            setNullableTimestamp(ps, 9, gap.lastAttemptAt());
            ps.setString(10, gap.lastError());
            ps.executeUpdate();

        } catch (SQLException e) {
            log.error("Failed to save gap {}: {}", gap.id(), e.getMessage());
            throw new PersistenceException("Failed to save gap", e);
        }
    }

    private List<Gap> readAll(PreparedStatement ps) throws SQLException {
        List<Gap> result = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Timestamp lastAttempt = rs.getTimestamp("last_attempt_at");
                result.add(new Gap(
                    rs.getString("id"),
                    rs.getString("symbol"),
                    Interval.fromCode(rs.getString("interval_code")),
                    rs.getTimestamp("gap_start").toInstant(),
                    rs.getTimestamp("gap_end").toInstant(),
                    GapStatus.valueOf(rs.getString("status")),
                    rs.getInt("attempt_count"),
                    rs.getTimestamp("detected_at").toInstant(),
                    lastAttempt != null ? lastAttempt.toInstant() : null,
                    rs.getString("last_error")
                ));
            }
        }
        return result;
    }

    private void setNullableTimestamp(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            ps.setTimestamp(index, Timestamp.from(value));
        }
    }
}
