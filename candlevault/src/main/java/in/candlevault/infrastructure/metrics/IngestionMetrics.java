package in.candlevault.infrastructure.metrics;

import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TaskPriority;
import in.candlevault.domain.health.CircuitState;
import in.candlevault.domain.health.SourceState;
import in.candlevault.domain.market.LiquidationSide;

import java.time.Duration;

/**
 * Ingestion metrics interface for monitoring and alerting.
 *
 * Key metrics:
 * - Source request outcomes and latency
 * - Rate limiter waits and rejections
 * - Breaker and health state per source
 * - Stored, confirmed and rejected points per series
 * - Task outcomes and queue depth
 * - Gap counts by status
 * - Liquidation events, order book snapshots and their stored aggregates
 */
public interface IngestionMetrics {

    /** Discards everything. */
    IngestionMetrics NOOP = new IngestionMetrics() {
        @Override public void recordSourceRequest(String sourceId, String outcome, Duration latency) {}
        @Override public void recordRateLimitWait(String sourceId, TaskPriority priority, Duration waited) {}
        @Override public void recordRateLimitRejected(String sourceId, TaskPriority priority) {}
        @Override public void recordBreakerState(String sourceId, CircuitState state) {}
        @Override public void recordHealthState(String sourceId, SourceState state) {}
        @Override public void recordPointsStored(SeriesKey series, String sourceId, int count) {}
        @Override public void recordConfirmations(SeriesKey series, String sourceId, int count) {}
        @Override public void recordValidationRejected(SeriesKey series, String sourceId) {}
        @Override public void recordDisputedSkipped(SeriesKey series, String sourceId, int count) {}
        @Override public void recordTaskOutcome(TaskPriority priority, String outcome) {}
        @Override public void recordQueueDepth(TaskPriority priority, int depth) {}
        @Override public void recordGapCount(SeriesKey series, GapStatus status, int count) {}
        @Override public void recordLiquidationEvent(String symbol, LiquidationSide side) {}
        @Override public void recordOrderBookSnapshot(String symbol, String outcome) {}
        @Override public void recordMarketBucketsStored(String kind, int count) {}
        @Override public void recordStreamConnected(String stream, boolean connected) {}
    };

    /**
     * @param outcome "success" or a failure kind name
     */
    void recordSourceRequest(String sourceId, String outcome, Duration latency);

    void recordRateLimitWait(String sourceId, TaskPriority priority, Duration waited);

    void recordRateLimitRejected(String sourceId, TaskPriority priority);

    void recordBreakerState(String sourceId, CircuitState state);

    void recordHealthState(String sourceId, SourceState state);

    void recordPointsStored(SeriesKey series, String sourceId, int count);

    void recordConfirmations(SeriesKey series, String sourceId, int count);

    void recordValidationRejected(SeriesKey series, String sourceId);

    void recordDisputedSkipped(SeriesKey series, String sourceId, int count);

    /**
     * @param outcome "success", "retry_scheduled", "abandoned" or "cancelled"
     */
    void recordTaskOutcome(TaskPriority priority, String outcome);

    void recordQueueDepth(TaskPriority priority, int depth);

    void recordGapCount(SeriesKey series, GapStatus status, int count);

    void recordLiquidationEvent(String symbol, LiquidationSide side);

    /**
     * @param outcome "accepted", "invalid" or a failure kind name
     */
    void recordOrderBookSnapshot(String symbol, String outcome);

    /**
     * @param kind "liquidation" or "orderbook"
     */
    void recordMarketBucketsStored(String kind, int count);

    void recordStreamConnected(String stream, boolean connected);
}
