package in.candlevault.infrastructure.metrics;

import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.TaskPriority;
import in.candlevault.domain.health.CircuitState;
import in.candlevault.domain.market.LiquidationSide;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static in.candlevault.testutil.TestData.BTC_1H;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for PrometheusIngestionMetrics.
 *
 * Tests:
 * - Counters accumulate per label set
 * - Gauges hold the last value
 * - Latency histogram observations
 * - Liquidation and order book activity
 */
class PrometheusIngestionMetricsTest {

    private CollectorRegistry registry;
    private PrometheusIngestionMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new CollectorRegistry();
        metrics = new PrometheusIngestionMetrics(registry);
    }

    private Double sample(String name, String[] labels, String[] values) {
        return registry.getSampleValue(name, labels, values);
    }

    @Test
    void testSourceRequestsCountedByOutcome() {
        metrics.recordSourceRequest("binance", "success", Duration.ofMillis(120));
        metrics.recordSourceRequest("binance", "success", Duration.ofMillis(80));
        metrics.recordSourceRequest("binance", "TIMEOUT", Duration.ofSeconds(10));

        assertEquals(2.0, sample("source_requests_total", new String[]{"source", "outcome"},
            new String[]{"binance", "success"}));
        assertEquals(1.0, sample("source_requests_total", new String[]{"source", "outcome"},
            new String[]{"binance", "TIMEOUT"}));
        assertEquals(3.0, sample("source_request_latency_seconds_count", new String[]{"source"},
            new String[]{"binance"}));
    }

    @Test
    void testPointsStoredPerSeries() {
        metrics.recordPointsStored(BTC_1H, "bybit", 24);
        metrics.recordPointsStored(BTC_1H, "bybit", 6);

        assertEquals(30.0, sample("points_stored_total", new String[]{"symbol", "interval", "source"},
            new String[]{"BTCUSDT", "1h", "bybit"}));
    }

    @Test
    void testGaugesKeepLatestValue() {
        metrics.recordBreakerState("binance", CircuitState.OPEN);
        metrics.recordQueueDepth(TaskPriority.BACKFILL, 7);
        metrics.recordQueueDepth(TaskPriority.BACKFILL, 2);
        metrics.recordGapCount(BTC_1H, GapStatus.FAILED, 1);

        assertEquals((double) CircuitState.OPEN.ordinal(), sample("circuit_state", new String[]{"source"},
            new String[]{"binance"}));
        assertEquals(2.0, sample("scheduler_queue_depth", new String[]{"priority"}, new String[]{"BACKFILL"}));
        assertEquals(1.0, sample("gaps", new String[]{"symbol", "interval", "status"},
            new String[]{"BTCUSDT", "1h", "FAILED"}));
    }

    @Test
    void testTaskOutcomesAndRejections() {
        metrics.recordTaskOutcome(TaskPriority.LIVE, "retry_scheduled");
        metrics.recordRateLimitRejected("binance", TaskPriority.BACKFILL);
        metrics.recordValidationRejected(BTC_1H, "bybit");

        assertEquals(1.0, sample("fetch_tasks_total", new String[]{"priority", "outcome"},
            new String[]{"LIVE", "retry_scheduled"}));
        assertEquals(1.0, sample("rate_limit_rejections_total", new String[]{"source", "priority"},
            new String[]{"binance", "BACKFILL"}));
        assertEquals(1.0, sample("validation_rejections_total", new String[]{"symbol", "interval", "source"},
            new String[]{"BTCUSDT", "1h", "bybit"}));
    }

    @Test
    void testMarketActivityMetrics() {
        metrics.recordLiquidationEvent("BTCUSDT", LiquidationSide.LONG);
        metrics.recordLiquidationEvent("BTCUSDT", LiquidationSide.LONG);
        metrics.recordOrderBookSnapshot("BTCUSDT", "invalid");
        metrics.recordMarketBucketsStored("orderbook", 3);
        metrics.recordStreamConnected("binance-liquidations", true);
        metrics.recordStreamConnected("binance-liquidations", false);

        assertEquals(2.0, sample("liquidation_events_total", new String[]{"symbol", "side"},
            new String[]{"BTCUSDT", "LONG"}));
        assertEquals(1.0, sample("orderbook_snapshots_total", new String[]{"symbol", "outcome"},
            new String[]{"BTCUSDT", "invalid"}));
        assertEquals(3.0, sample("market_buckets_stored_total", new String[]{"kind"}, new String[]{"orderbook"}));
        assertEquals(0.0, sample("market_stream_connected", new String[]{"stream"},
            new String[]{"binance-liquidations"}));
    }
}
