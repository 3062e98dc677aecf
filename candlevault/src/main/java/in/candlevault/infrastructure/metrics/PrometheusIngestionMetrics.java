package in.candlevault.infrastructure.metrics;

import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TaskPriority;
import in.candlevault.domain.health.CircuitState;
import in.candlevault.domain.health.SourceState;
import in.candlevault.domain.market.LiquidationSide;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of IngestionMetrics.
 *
 * Key Metrics:
 * - source_requests_total{source, outcome}
 * - source_request_latency_seconds{source}
 * - rate_limit_wait_seconds{source, priority} / rate_limit_rejections_total{source, priority}
 * - circuit_state{source} (0=closed, 1=half-open, 2=open)
 * - source_health_state{source} (0=healthy, 1=degraded, 2=suspended)
 * - points_stored_total{symbol, interval, source}
 * - points_confirmed_total{symbol, interval, source}
 * - validation_rejections_total{symbol, interval, source}
 * - disputed_points_skipped_total{symbol, interval, source}
 * - fetch_tasks_total{priority, outcome}
 * - scheduler_queue_depth{priority}
 * - gaps{symbol, interval, status}
 * - liquidation_events_total{symbol, side}
 * - orderbook_snapshots_total{symbol, outcome}
 * - market_buckets_stored_total{kind}
 * - market_stream_connected{stream}
 *
 * Usage:
 * <pre>
 * PrometheusIngestionMetrics metrics = new PrometheusIngestionMetrics(registry);
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusIngestionMetrics implements IngestionMetrics {

    private final CollectorRegistry registry;

    // Source metrics
    private final Counter sourceRequests;
    private final Histogram sourceLatency;

    // Rate limit metrics
    private final Histogram rateLimitWait;
    private final Counter rateLimitRejections;

    // State metrics
    private final Gauge circuitState;
    private final Gauge healthState;

    // Data metrics
    private final Counter pointsStored;
    private final Counter pointsConfirmed;
    private final Counter validationRejections;
    private final Counter disputedSkipped;

    // Scheduler metrics
    private final Counter taskOutcomes;
    private final Gauge queueDepth;

    // Gap metrics
    private final Gauge gaps;

    // Market activity metrics
    private final Counter liquidationEvents;
    private final Counter orderBookSnapshots;
    private final Counter marketBucketsStored;
    private final Gauge streamConnected;

    public PrometheusIngestionMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusIngestionMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.sourceRequests = Counter.build()
            .name("source_requests_total")
            .help("Total number of source fetch requests by outcome")
            .labelNames("source", "outcome")
            .register(registry);

        this.sourceLatency = Histogram.build()
            .name("source_request_latency_seconds")
            .help("Source fetch latency in seconds")
            .labelNames("source")
            .buckets(0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0, 30.0)
            .register(registry);

        this.rateLimitWait = Histogram.build()
            .name("rate_limit_wait_seconds")
            .help("Time spent waiting for a rate limit token")
            .labelNames("source", "priority")
            .buckets(0.0, 0.1, 1.0, 5.0, 15.0, 30.0, 60.0)
            .register(registry);

        this.rateLimitRejections = Counter.build()
            .name("rate_limit_rejections_total")
            .help("Token requests that exceeded the maximum wait")
            .labelNames("source", "priority")
            .register(registry);

        this.circuitState = Gauge.build()
            .name("circuit_state")
            .help("Circuit breaker state (0=closed, 1=half-open, 2=open)")
            .labelNames("source")
            .register(registry);

        this.healthState = Gauge.build()
            .name("source_health_state")
            .help("Source health state (0=healthy, 1=degraded, 2=suspended)")
            .labelNames("source")
            .register(registry);

        this.pointsStored = Counter.build()
            .name("points_stored_total")
            .help("Data points inserted or upgraded")
            .labelNames("symbol", "interval", "source")
            .register(registry);

        this.pointsConfirmed = Counter.build()
            .name("points_confirmed_total")
            .help("Stored points confirmed by another source")
            .labelNames("symbol", "interval", "source")
            .register(registry);

        this.validationRejections = Counter.build()
            .name("validation_rejections_total")
            .help("Batches rejected by the validator")
            .labelNames("symbol", "interval", "source")
            .register(registry);

        this.disputedSkipped = Counter.build()
            .name("disputed_points_skipped_total")
            .help("Points skipped during reconciliation because sources disagree")
            .labelNames("symbol", "interval", "source")
            .register(registry);

        this.taskOutcomes = Counter.build()
            .name("fetch_tasks_total")
            .help("Fetch task attempts by outcome")
            .labelNames("priority", "outcome")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("scheduler_queue_depth")
            .help("Tasks waiting in the scheduler queue")
            .labelNames("priority")
            .register(registry);

        this.gaps = Gauge.build()
            .name("gaps")
            .help("Known gaps by status")
            .labelNames("symbol", "interval", "status")
            .register(registry);

        this.liquidationEvents = Counter.build()
            .name("liquidation_events_total")
            .help("Forced liquidations received from the stream")
            .labelNames("symbol", "side")
            .register(registry);

        this.orderBookSnapshots = Counter.build()
            .name("orderbook_snapshots_total")
            .help("Order book snapshot polls by outcome")
            .labelNames("symbol", "outcome")
            .register(registry);

        this.marketBucketsStored = Counter.build()
            .name("market_buckets_stored_total")
            .help("Liquidation buckets and order book candles written")
            .labelNames("kind")
            .register(registry);

        this.streamConnected = Gauge.build()
            .name("market_stream_connected")
            .help("Market stream connection (1=connected, 0=disconnected)")
            .labelNames("stream")
            .register(registry);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordSourceRequest(String sourceId, String outcome, Duration latency) {
        sourceRequests.labels(sourceId, outcome).inc();
        sourceLatency.labels(sourceId).observe(latency.toMillis() / 1000.0);
    }

    @Override
    public void recordRateLimitWait(String sourceId, TaskPriority priority, Duration waited) {
        rateLimitWait.labels(sourceId, priority.name()).observe(waited.toMillis() / 1000.0);
    }

    @Override
    public void recordRateLimitRejected(String sourceId, TaskPriority priority) {
        rateLimitRejections.labels(sourceId, priority.name()).inc();
    }

    @Override
    public void recordBreakerState(String sourceId, CircuitState state) {
        circuitState.labels(sourceId).set(state.ordinal());
    }

    @Override
    public void recordHealthState(String sourceId, SourceState state) {
        healthState.labels(sourceId).set(state.ordinal());
    }

    @Override
    public void recordPointsStored(SeriesKey series, String sourceId, int count) {
        pointsStored.labels(series.symbol(), series.interval().getCode(), sourceId).inc(count);
    }

    @Override
    public void recordConfirmations(SeriesKey series, String sourceId, int count) {
        pointsConfirmed.labels(series.symbol(), series.interval().getCode(), sourceId).inc(count);
    }

    @Override
    public void recordValidationRejected(SeriesKey series, String sourceId) {
        validationRejections.labels(series.symbol(), series.interval().getCode(), sourceId).inc();
    }

    @Override
    public void recordDisputedSkipped(SeriesKey series, String sourceId, int count) {
        disputedSkipped.labels(series.symbol(), series.interval().getCode(), sourceId).inc(count);
    }

    @Override
    public void recordTaskOutcome(TaskPriority priority, String outcome) {
        taskOutcomes.labels(priority.name(), outcome).inc();
    }

    @Override
    public void recordQueueDepth(TaskPriority priority, int depth) {
        queueDepth.labels(priority.name()).set(depth);
    }

    @Override
    public void recordGapCount(SeriesKey series, GapStatus status, int count) {
        gaps.labels(series.symbol(), series.interval().getCode(), status.name()).set(count);
    }

    @Override
    public void recordLiquidationEvent(String symbol, LiquidationSide side) {
        liquidationEvents.labels(symbol, side.name()).inc();
    }

    @Override
    public void recordOrderBookSnapshot(String symbol, String outcome) {
        orderBookSnapshots.labels(symbol, outcome).inc();
    }

    @Override
    public void recordMarketBucketsStored(String kind, int count) {
        marketBucketsStored.labels(kind).inc(count);
    }

    @Override
    public void recordStreamConnected(String stream, boolean connected) {
        streamConnected.labels(stream).set(connected ? 1 : 0);
    }
}
