package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.error.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the market_data, data_gaps, liquidation_buckets and orderbook_candles
 * tables on startup when missing.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Checking ingestion schema");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "market_data")) {
                log.info("[MIGRATION] Creating market_data table...");
                execute(conn, """
                    CREATE TABLE market_data (
                        symbol          VARCHAR(32)      NOT NULL,
                        interval_code   VARCHAR(8)       NOT NULL,
                        ts              TIMESTAMPTZ      NOT NULL,
                        open            NUMERIC          NOT NULL CHECK (open >= 0),
                        high            NUMERIC          NOT NULL CHECK (high >= 0),
                        low             NUMERIC          NOT NULL CHECK (low >= 0),
                        close           NUMERIC          NOT NULL CHECK (close >= 0),
                        volume          NUMERIC          NOT NULL CHECK (volume >= 0),
                        source_id       VARCHAR(32)      NOT NULL,
                        confirmed_by    TEXT             NOT NULL,
                        quality_score   DOUBLE PRECISION NOT NULL CHECK (quality_score BETWEEN 0 AND 1),
                        is_validated    BOOLEAN          NOT NULL DEFAULT TRUE,
                        created_at      TIMESTAMPTZ      NOT NULL DEFAULT NOW(),
                        updated_at      TIMESTAMPTZ      NOT NULL DEFAULT NOW(),
                        PRIMARY KEY (symbol, interval_code, ts),
                        CHECK (high >= low)
                    )
                    """);
                log.info("[MIGRATION] ✓ market_data table created");
            }

            if (!tableExists(conn, "data_gaps")) {
                log.info("[MIGRATION] Creating data_gaps table...");
                execute(conn, """
                    CREATE TABLE data_gaps (
                        id              VARCHAR(36)  PRIMARY KEY,
                        symbol          VARCHAR(32)  NOT NULL,
                        interval_code   VARCHAR(8)   NOT NULL,
                        gap_start       TIMESTAMPTZ  NOT NULL,
                        gap_end         TIMESTAMPTZ  NOT NULL,
                        status          VARCHAR(16)  NOT NULL,
                        attempt_count   INT          NOT NULL DEFAULT 0,
                        detected_at     TIMESTAMPTZ  NOT NULL,
                        last_attempt_at TIMESTAMPTZ,
                        last_error      TEXT,
                        updated_at      TIMESTAMPTZ  NOT NULL DEFAULT NOW(),
                        CHECK (gap_end > gap_start)
                    )
                    """);
                execute(conn, "CREATE INDEX idx_data_gaps_series ON data_gaps (symbol, interval_code, status)");
                execute(conn, "CREATE INDEX idx_data_gaps_status ON data_gaps (status, gap_start)");
                log.info("[MIGRATION] ✓ data_gaps table created");
            }

            if (!tableExists(conn, "liquidation_buckets")) {
                log.info("[MIGRATION] Creating liquidation_buckets table...");
                execute(conn, """
                    CREATE TABLE liquidation_buckets (
                        symbol          VARCHAR(32)  NOT NULL,
                        interval_code   VARCHAR(8)   NOT NULL,
                        bucket_start    TIMESTAMPTZ  NOT NULL,
                        long_count      INT          NOT NULL CHECK (long_count >= 0),
                        short_count     INT          NOT NULL CHECK (short_count >= 0),
                        long_quantity   NUMERIC      NOT NULL,
                        short_quantity  NUMERIC      NOT NULL,
                        long_notional   NUMERIC      NOT NULL,
                        short_notional  NUMERIC      NOT NULL,
                        updated_at      TIMESTAMPTZ  NOT NULL DEFAULT NOW(),
                        PRIMARY KEY (symbol, interval_code, bucket_start)
                    )
                    """);
                log.info("[MIGRATION] ✓ liquidation_buckets table created");
            }

            if (!tableExists(conn, "orderbook_candles")) {
                log.info("[MIGRATION] Creating orderbook_candles table...");
                execute(conn, """
                    CREATE TABLE orderbook_candles (
                        symbol            VARCHAR(32)  NOT NULL,
                        interval_code     VARCHAR(8)   NOT NULL,
                        bucket_start      TIMESTAMPTZ  NOT NULL,
                        mid_open          NUMERIC      NOT NULL,
                        mid_high          NUMERIC      NOT NULL,
                        mid_low           NUMERIC      NOT NULL,
                        mid_close         NUMERIC      NOT NULL,
                        spread_sum        NUMERIC      NOT NULL,
                        spread_max        NUMERIC      NOT NULL,
                        bid_depth_sum     NUMERIC      NOT NULL,
                        ask_depth_sum     NUMERIC      NOT NULL,
                        snapshot_count    INT          NOT NULL CHECK (snapshot_count > 0),
                        first_snapshot_at TIMESTAMPTZ  NOT NULL,
                        last_snapshot_at  TIMESTAMPTZ  NOT NULL,
                        updated_at        TIMESTAMPTZ  NOT NULL DEFAULT NOW(),
                        PRIMARY KEY (symbol, interval_code, bucket_start),
                        CHECK (mid_high >= mid_low)
                    )
                    """);
                log.info("[MIGRATION] ✓ orderbook_candles table created");
            }

            log.info("[MIGRATION] Schema ready");

        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new PersistenceException("Schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
