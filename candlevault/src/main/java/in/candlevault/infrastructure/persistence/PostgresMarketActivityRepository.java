package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.data.Interval;
import in.candlevault.domain.error.PersistenceException;
import in.candlevault.domain.market.LiquidationBucket;
import in.candlevault.domain.market.OrderBookCandle;
import in.candlevault.domain.repository.MarketActivityRepository;
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
import java.util.List;

/**
 * PostgreSQL implementation of MarketActivityRepository.
 *
 * Same write path as the market data store: insert, and on key conflict lock
 * the stored row, merge in memory and write the merged aggregate back.
 */
public final class PostgresMarketActivityRepository implements MarketActivityRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresMarketActivityRepository.class);

    // ════════════════════════════════════════════════════════════════════════
    // LIQUIDATIONS
    // ════════════════════════════════════════════════════════════════════════

    private static final String LIQ_COLUMNS = """
        symbol, interval_code, bucket_start, long_count, short_count,
        long_quantity, short_quantity, long_notional, short_notional""";

    private static final String LIQ_INSERT_SQL = "INSERT INTO liquidation_buckets (" + LIQ_COLUMNS + """
        )
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (symbol, interval_code, bucket_start) DO NOTHING
        """;

    private static final String LIQ_LOCK_SQL = "SELECT " + LIQ_COLUMNS + """

        FROM liquidation_buckets
        WHERE symbol = ? AND interval_code = ? AND bucket_start = ?
        FOR UPDATE
        """;

    private static final String LIQ_UPDATE_SQL = """
        UPDATE liquidation_buckets
        SET long_count = ?, short_count = ?, long_quantity = ?, short_quantity = ?,
            long_notional = ?, short_notional = ?, updated_at = NOW()
        WHERE symbol = ? AND interval_code = ? AND bucket_start = ?
        """;

    // ════════════════════════════════════════════════════════════════════════
    // ORDER BOOK
    // ════════════════════════════════════════════════════════════════════════

    private static final String OB_COLUMNS = """
        symbol, interval_code, bucket_start, mid_open, mid_high, mid_low, mid_close,
        spread_sum, spread_max, bid_depth_sum, ask_depth_sum, snapshot_count,
        first_snapshot_at, last_snapshot_at""";

    private static final String OB_INSERT_SQL = "INSERT INTO orderbook_candles (" + OB_COLUMNS + """
        )
        VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (symbol, interval_code, bucket_start) DO NOTHING
        """;

    private static final String OB_LOCK_SQL = "SELECT " + OB_COLUMNS + """

        FROM orderbook_candles
        WHERE symbol = ? AND interval_code = ? AND bucket_start = ?
        FOR UPDATE
        """;

    private static final String OB_UPDATE_SQL = """
        UPDATE orderbook_candles
        SET mid_open = ?, mid_high = ?, mid_low = ?, mid_close = ?,
            spread_sum = ?, spread_max = ?, bid_depth_sum = ?, ask_depth_sum = ?,
            snapshot_count = ?, first_snapshot_at = ?, last_snapshot_at = ?, updated_at = NOW()
        WHERE symbol = ? AND interval_code = ? AND bucket_start = ?
        """;

    private final DataSource dataSource;

    public PostgresMarketActivityRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void mergeLiquidations(LiquidationBucket bucket) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement insert = conn.prepareStatement(LIQ_INSERT_SQL);
                 PreparedStatement lock = conn.prepareStatement(LIQ_LOCK_SQL);
                 PreparedStatement update = conn.prepareStatement(LIQ_UPDATE_SQL)) {

                bindLiquidationInsert(insert, bucket);
                if (insert.executeUpdate() == 0) {
                    bindKey(lock, 1, bucket.symbol(), bucket.interval(), bucket.bucketStart());
                    LiquidationBucket merged;
                    try (ResultSet rs = lock.executeQuery()) {
                        if (!rs.next()) {
                            throw new SQLException("Liquidation bucket vanished during merge: "
                                + bucket.symbol() + "@" + bucket.bucketStart());
                        }
                        merged = mapLiquidation(rs).merge(bucket);
                    }
                    update.setInt(1, merged.longCount());
                    update.setInt(2, merged.shortCount());
                    update.setBigDecimal(3, merged.longQuantity());
                    update.setBigDecimal(4, merged.shortQuantity());
                    update.setBigDecimal(5, merged.longNotional());
                    update.setBigDecimal(6, merged.shortNotional());
                    bindKey(update, 7, merged.symbol(), merged.interval(), merged.bucketStart());
                    update.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to merge liquidation bucket {}@{}: {}", bucket.symbol(), bucket.bucketStart(), e.getMessage());
            throw new PersistenceException("Failed to merge liquidation bucket", e);
        }
    }

    @Override
    public List<LiquidationBucket> queryLiquidations(String symbol, Interval interval, Instant start, Instant end) {
        String sql = "SELECT " + LIQ_COLUMNS + """

            FROM liquidation_buckets
            WHERE symbol = ? AND interval_code = ? AND bucket_start >= ? AND bucket_start < ?
            ORDER BY bucket_start ASC
            """;

        List<LiquidationBucket> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            bindRange(ps, symbol, interval, start, end);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapLiquidation(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query liquidation buckets: {}", e.getMessage());
            throw new PersistenceException("Failed to query liquidation buckets", e);
        }
        return result;
    }

    @Override
    public void mergeOrderBookCandle(OrderBookCandle candle) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try (PreparedStatement insert = conn.prepareStatement(OB_INSERT_SQL);
                 PreparedStatement lock = conn.prepareStatement(OB_LOCK_SQL);
                 PreparedStatement update = conn.prepareStatement(OB_UPDATE_SQL)) {

                bindKey(insert, 1, candle.symbol(), candle.interval(), candle.bucketStart());
                bindCandleValues(insert, 4, candle);
                if (insert.executeUpdate() == 0) {
                    bindKey(lock, 1, candle.symbol(), candle.interval(), candle.bucketStart());
                    OrderBookCandle merged;
                    try (ResultSet rs = lock.executeQuery()) {
                        if (!rs.next()) {
                            throw new SQLException("Order book candle vanished during merge: "
                                + candle.symbol() + "@" + candle.bucketStart());
                        }
                        merged = mapCandle(rs).merge(candle);
                    }
                    bindCandleValues(update, 1, merged);
                    bindKey(update, 12, merged.symbol(), merged.interval(), merged.bucketStart());
                    update.executeUpdate();
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to merge order book candle {}@{}: {}", candle.symbol(), candle.bucketStart(), e.getMessage());
            throw new PersistenceException("Failed to merge order book candle", e);
        }
    }

    @Override
    public List<OrderBookCandle> queryOrderBookCandles(String symbol, Interval interval, Instant start, Instant end) {
        String sql = "SELECT " + OB_COLUMNS + """

            FROM orderbook_candles
            WHERE symbol = ? AND interval_code = ? AND bucket_start >= ? AND bucket_start < ?
            ORDER BY bucket_start ASC
            """;

        List<OrderBookCandle> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            bindRange(ps, symbol, interval, start, end);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapCandle(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Failed to query order book candles: {}", e.getMessage());
            throw new PersistenceException("Failed to query order book candles", e);
        }
        return result;
    }

    private void bindLiquidationInsert(PreparedStatement ps, LiquidationBucket b) throws SQLException {
        bindKey(ps, 1, b.symbol(), b.interval(), b.bucketStart());
        ps.setInt(4, b.longCount());
        ps.setInt(5, b.shortCount());
        ps.setBigDecimal(6, b.longQuantity());
        ps.setBigDecimal(7, b.shortQuantity());
        ps.setBigDecimal(8, b.longNotional());
        ps.setBigDecimal(9, b.shortNotional());
    }

    private void bindCandleValues(PreparedStatement ps, int from, OrderBookCandle c) throws SQLException {
        ps.setBigDecimal(from, c.midOpen());
        ps.setBigDecimal(from + 1, c.midHigh());
        ps.setBigDecimal(from + 2, c.midLow());
        ps.setBigDecimal(from + 3, c.midClose());
        ps.setBigDecimal(from + 4, c.spreadSum());
        ps.setBigDecimal(from + 5, c.spreadMax());
        ps.setBigDecimal(from + 6, c.bidDepthSum());
        ps.setBigDecimal(from + 7, c.askDepthSum());
        ps.setInt(from + 8, c.snapshotCount());
        ps.setTimestamp(from + 9, Timestamp.from(c.firstSnapshotAt()));
        ps.setTimestamp(from + 10, Timestamp.from(c.lastSnapshotAt()));
    }

    private void bindKey(PreparedStatement ps, int from, String symbol, Interval interval, Instant start)
            throws SQLException {
        ps.setString(from, symbol);
        ps.setString(from + 1, interval.getCode());
        ps.setTimestamp(from + 2, Timestamp.from(start));
    }

    private void bindRange(PreparedStatement ps, String symbol, Interval interval, Instant start, Instant end)
            throws SQLException {
        ps.setString(1, symbol);
        ps.setString(2, interval.getCode());
        ps.setTimestamp(3, Timestamp.from(start));
        ps.setTimestamp(4, Timestamp.from(end));
    }

    private LiquidationBucket mapLiquidation(ResultSet rs) throws SQLException {
        return new LiquidationBucket(
            rs.getString("symbol"),
            Interval.fromCode(rs.getString("interval_code")),
            rs.getTimestamp("bucket_start").toInstant(),
            rs.getInt("long_count"),
            rs.getInt("short_count"),
            rs.getBigDecimal("long_quantity"),
            rs.getBigDecimal("short_quantity"),
            rs.getBigDecimal("long_notional"),
            rs.getBigDecimal("short_notional"));
    }

    private OrderBookCandle mapCandle(ResultSet rs) throws SQLException {
        return new OrderBookCandle(
            rs.getString("symbol"),
            Interval.fromCode(rs.getString("interval_code")),
            rs.getTimestamp("bucket_start").toInstant(),
            rs.getBigDecimal("mid_open"),
            rs.getBigDecimal("mid_high"),
            rs.getBigDecimal("mid_low"),
            rs.getBigDecimal("mid_close"),
            rs.getBigDecimal("spread_sum"),
            rs.getBigDecimal("spread_max"),
            rs.getBigDecimal("bid_depth_sum"),
            rs.getBigDecimal("ask_depth_sum"),
            rs.getInt("snapshot_count"),
            rs.getTimestamp("first_snapshot_at").toInstant(),
            rs.getTimestamp("last_snapshot_at").toInstant());
    }
}
