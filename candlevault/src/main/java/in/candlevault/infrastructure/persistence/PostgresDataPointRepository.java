package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.error.PersistenceException;
import in.candlevault.domain.repository.DataPointRepository;
import in.candlevault.domain.repository.UpsertMerge;
import in.candlevault.domain.repository.UpsertResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * PostgreSQL implementation of DataPointRepository.
 *
 * Upsert runs in one transaction per batch: {@code INSERT ... ON CONFLICT DO NOTHING};
 * on conflict the stored row is locked, merged through {@link UpsertMerge} and
 * updated only when the merge says so.
 */
public final class PostgresDataPointRepository implements DataPointRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresDataPointRepository.class);

    private static final String INSERT_SQL = """
        INSERT INTO market_data (symbol, interval_code, ts, open, high, low, close, volume,
                                 source_id, confirmed_by, quality_score, is_validated)
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (symbol, interval_code, ts) DO NOTHING
        """;

    private static final String SELECT_FOR_UPDATE_SQL = """
        SELECT symbol, interval_code, ts, open, high, low, close, volume,
               source_id, confirmed_by, quality_score, is_validated
        FROM market_data
        WHERE symbol = ? AND interval_code = ? AND ts = ?
        FOR UPDATE
        """;

    private static final String UPDATE_SQL = """
        UPDATE market_data
        SET open = ?, high = ?, low = ?, close = ?, volume = ?,
            source_id = ?, confirmed_by = ?, quality_score = ?, is_validated = ?,
            updated_at = NOW()
        WHERE symbol = ? AND interval_code = ? AND ts = ?
          AND quality_score <= ?
        """;

    private final DataSource dataSource;

    public PostgresDataPointRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public UpsertResult upsert(DataPoint point) {
        return upsertAll(List.of(point)).get(0);
    }

    @Override
    public List<UpsertResult> upsertAll(List<DataPoint> points) {
        List<UpsertResult> results = new ArrayList<>(points.size());
        if (points.isEmpty()) {
            return results;
        }

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement insert = conn.prepareStatement(INSERT_SQL);
                 PreparedStatement select = conn.prepareStatement(SELECT_FOR_UPDATE_SQL);
                 PreparedStatement update = conn.prepareStatement(UPDATE_SQL)) {

                for (DataPoint point : points) {
                    bindInsert(insert, point);
                    if (insert.executeUpdate() == 1) {
                        results.add(UpsertResult.STORED);
                        continue;
                    }
                    DataPoint existing = lock(select, point);
                    UpsertMerge.Decision decision = UpsertMerge.merge(existing, point);
                    if (decision.result() == UpsertResult.STORED) {
                        bindUpdate(update, decision.point());
                        update.executeUpdate();
                    }
                    results.add(decision.result());
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }

            log.debug("Upserted {} market data points", points.size());
            return results;

        } catch (SQLException e) {
            log.error("Failed to upsert {} points: {}", points.size(), e.getMessage());
            throw new PersistenceException("Failed to upsert market data", e);
        }
    }

    @Override
    public List<DataPoint> queryRange(String symbol, Interval interval, Instant start, Instant end) {
        String sql = """
            SELECT symbol, interval_code, ts, open, high, low, close, volume,
                   source_id, confirmed_by, quality_score, is_validated
            FROM market_data
            WHERE symbol = ? AND interval_code = ? AND ts >= ? AND ts < ?
            ORDER BY ts ASC
            """;

        List<DataPoint> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, interval.getCode());
            ps.setTimestamp(3, Timestamp.from(start));
            ps.setTimestamp(4, Timestamp.from(end));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query market data: {}", e.getMessage());
            throw new PersistenceException("Failed to query market data", e);
        }
        return result;
    }

    @Override
    public List<Instant> findTimestamps(String symbol, Interval interval, Instant start, Instant end) {
        String sql = """
            SELECT ts FROM market_data
            WHERE symbol = ? AND interval_code = ? AND ts >= ? AND ts < ?
            ORDER BY ts ASC
            """;

        List<Instant> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, interval.getCode());
            ps.setTimestamp(3, Timestamp.from(start));
            ps.setTimestamp(4, Timestamp.from(end));

            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(rs.getTimestamp("ts").toInstant());
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query timestamps: {}", e.getMessage());
            throw new PersistenceException("Failed to query timestamps", e);
        }
        return result;
    }

    @Override
    public long countRange(String symbol, Interval interval, Instant start, Instant end) {
        String sql = """
            SELECT COUNT(*) FROM market_data
            WHERE symbol = ? AND interval_code = ? AND ts >= ? AND ts < ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, interval.getCode());
            ps.setTimestamp(3, Timestamp.from(start));
            ps.setTimestamp(4, Timestamp.from(end));

            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0;
            }
        } catch (SQLException e) {
            log.error("Failed to count market data: {}", e.getMessage());
            throw new PersistenceException("Failed to count market data", e);
        }
    }

    @Override
    public Optional<Instant> findLatestTimestamp(String symbol, Interval interval) {
        String sql = "SELECT MAX(ts) FROM market_data WHERE symbol = ? AND interval_code = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, symbol);
            ps.setString(2, interval.getCode());

            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next() && rs.getTimestamp(1) != null) {
                    return Optional.of(rs.getTimestamp(1).toInstant());
                }
                return Optional.empty();
            }
        } catch (SQLException e) {
            log.error("Failed to find latest timestamp: {}", e.getMessage());
            throw new PersistenceException("Failed to find latest timestamp", e);
        }
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        String sql = "DELETE FROM market_data WHERE ts < ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setTimestamp(1, Timestamp.from(cutoff));
            int deleted = ps.executeUpdate();
            log.info("Pruned {} market data points older than {}", deleted, cutoff);
            return deleted;

        } catch (SQLException e) {
            log.error("Failed to prune market data: {}", e.getMessage());
            throw new PersistenceException("Failed to prune market data", e);
        }
    }

    private DataPoint lock(PreparedStatement select, DataPoint point) throws SQLException {
        select.setString(1, point.symbol());
        select.setString(2, point.interval().getCode());
        select.setTimestamp(3, Timestamp.from(point.timestamp()));
        try (ResultSet rs = select.executeQuery()) {
            return rs.next() ? mapRow(rs) : null;
        }
    }

    private void bindInsert(PreparedStatement ps, DataPoint p) throws SQLException {
        ps.setString(1, p.symbol());
        ps.setString(2, p.interval().getCode());
        ps.setTimestamp(3, Timestamp.from(p.timestamp()));
        ps.setBigDecimal(4, p.open());
        ps.setBigDecimal(5, p.high());
        ps.setBigDecimal(6, p.low());
        ps.setBigDecimal(7, p.close());
        ps.setBigDecimal(8, p.volume());
        ps.setString(9, p.sourceId());
        ps.setString(10, String.join(",", p.confirmedBy()));
        ps.setDouble(11, p.qualityScore());
        ps.setBoolean(12, p.validated());
    }

    private void bindUpdate(PreparedStatement ps, DataPoint p) throws SQLException {
        ps.setBigDecimal(1, p.open());
        ps.setBigDecimal(2, p.high());
        ps.setBigDecimal(3, p.low());
        ps.setBigDecimal(4, p.close());
        ps.setBigDecimal(5, p.volume());
        ps.setString(6, p.sourceId());
        ps.setString(7, String.join(",", p.confirmedBy()));
        ps.setDouble(8, p.qualityScore());
        ps.setBoolean(9, p.validated());
        ps.setString(10, p.symbol());
        ps.setString(11, p.interval().getCode());
        ps.setTimestamp(12, Timestamp.from(p.timestamp()));
        ps.setDouble(13, p.qualityScore());
    }

    private DataPoint mapRow(ResultSet rs) throws SQLException {
        String confirmed = rs.getString("confirmed_by");
        Set<String> confirmedBy = new TreeSet<>();
        if (confirmed != null && !confirmed.isEmpty()) {
            confirmedBy.addAll(Arrays.asList(confirmed.split(",")));
        }
        return new DataPoint(
            rs.getString("symbol"),
            Interval.fromCode(rs.getString("interval_code")),
            rs.getTimestamp("ts").toInstant(),
            rs.getBigDecimal("open"),
            rs.getBigDecimal("high"),
            rs.getBigDecimal("low"),
            rs.getBigDecimal("close"),
            rs.getBigDecimal("volume"),
            rs.getString("source_id"),
            confirmedBy,
            rs.getDouble("quality_score"),
            rs.getBoolean("is_validated")
        );
    }
}
