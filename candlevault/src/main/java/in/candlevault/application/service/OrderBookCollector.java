package in.candlevault.application.service;

import in.candlevault.domain.data.TaskPriority;
import in.candlevault.domain.error.CircuitOpenException;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.PersistenceException;
import in.candlevault.domain.error.SourceException;
import in.candlevault.domain.market.OrderBookCandle;
import in.candlevault.domain.market.OrderBookSnapshot;
import in.candlevault.domain.repository.MarketActivityRepository;
import in.candlevault.infrastructure.market.BinanceOrderBookClient;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.service.market.TimeBucketAggregator;
import in.candlevault.service.resilience.CircuitBreakerRegistry;
import in.candlevault.service.resilience.HealthTracker;
import in.candlevault.service.resilience.SlidingWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls order book snapshots and aggregates them into per-interval candles
 * of mid price, spread and depth.
 *
 * Every poll goes through the same rate limiter, circuit breaker and health
 * tracker as the kline sources. Snapshots with a crossed or empty book are
 * counted and dropped. A missed poll is not recovered; the candle of that
 * interval simply holds fewer snapshots.
 */
public class OrderBookCollector {
    private static final Logger log = LoggerFactory.getLogger(OrderBookCollector.class);

    private final List<String> symbols;
    private final int depth;
    private final Duration pollPeriod;
    private final Duration flushPeriod;
    private final BinanceOrderBookClient client;
    private final SlidingWindowRateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final HealthTracker health;
    private final TimeBucketAggregator<OrderBookSnapshot, OrderBookCandle> aggregator;
    private final MarketActivityRepository repository;
    private final IngestionMetrics metrics;
    private final Clock clock;

    private final ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "orderbook-collector");
        t.setDaemon(true);
        return t;
    });

    public OrderBookCollector(List<String> symbols, int depth, Duration pollPeriod, Duration flushPeriod,
                              BinanceOrderBookClient client, SlidingWindowRateLimiter rateLimiter,
                              CircuitBreakerRegistry breakers, HealthTracker health,
                              TimeBucketAggregator<OrderBookSnapshot, OrderBookCandle> aggregator,
                              MarketActivityRepository repository, IngestionMetrics metrics, Clock clock) {
        this.symbols = List.copyOf(symbols);
        this.depth = depth;
        this.pollPeriod = pollPeriod;
        this.flushPeriod = flushPeriod;
        this.client = client;
        this.rateLimiter = rateLimiter;
        this.breakers = breakers;
        this.health = health;
        this.aggregator = aggregator;
        this.repository = repository;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void start() {
        loop.scheduleWithFixedDelay(this::pollSafely, 0, pollPeriod.toMillis(), TimeUnit.MILLISECONDS);
        loop.scheduleWithFixedDelay(this::flushSafely,
            flushPeriod.toMillis(), flushPeriod.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[OrderBook] Polling {} symbol(s) every {}s at depth {}, {} candles",
            symbols.size(), pollPeriod.toSeconds(), depth, aggregator.getInterval().getCode());
    }

    public void stop() {
        loop.shutdownNow();
        try {
            loop.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int stored = store(aggregator.drainAll());
        log.info("[OrderBook] Stopped, {} partial candle(s) stored", stored);
    }

    /**
     * Take one snapshot of every symbol.
     *
     * @return snapshots accepted into the aggregator
     */
    public int pollOnce() {
        int accepted = 0;
        for (String symbol : symbols) {
            if (poll(symbol)) {
                accepted++;
            }
        }
        return accepted;
    }

    /**
     * Store every closed candle.
     *
     * @return candles stored
     */
    public int flush() {
        return store(aggregator.drainClosed(clock.instant()));
    }

    private boolean poll(String symbol) {
        String sourceId = client.getSourceId();
        if (!health.state(sourceId).isSelectable()) {
            log.debug("[OrderBook] {} suspended, skipping {}", sourceId, symbol);
            return false;
        }
        try {
            rateLimiter.acquire(sourceId, TaskPriority.LIVE);
        } catch (SourceException e) {
            log.debug("[OrderBook] {} skipped: {}", symbol, e.getMessage());
            metrics.recordOrderBookSnapshot(symbol, e.getKind().name());
            return false;
        }

        long started = System.nanoTime();
        OrderBookSnapshot snapshot;
        try {
            snapshot = breakers.get(sourceId).call(() -> client.fetchSnapshot(symbol, depth));
        } catch (CircuitOpenException e) {
            metrics.recordOrderBookSnapshot(symbol, FailureKind.CIRCUIT_OPEN.name());
            return false;
        } catch (SourceException e) {
            Duration latency = Duration.ofNanos(System.nanoTime() - started);
            health.recordFailure(sourceId, e.getKind(), latency);
            metrics.recordSourceRequest(sourceId, e.getKind().name(), latency);
            metrics.recordOrderBookSnapshot(symbol, e.getKind().name());
            log.warn("[OrderBook] Snapshot of {} failed: {}", symbol, e.getMessage());
            return false;
        }
        Duration latency = Duration.ofNanos(System.nanoTime() - started);
        health.recordSuccess(sourceId, latency);
        metrics.recordSourceRequest(sourceId, "success", latency);

        List<String> problems = snapshot.violations();
        if (!problems.isEmpty()) {
            metrics.recordOrderBookSnapshot(symbol, "invalid");
            log.warn("[OrderBook] Dropping {} snapshot at {}: {}", symbol, snapshot.timestamp(), problems);
            return false;
        }
        aggregator.accept(snapshot);
        metrics.recordOrderBookSnapshot(symbol, "accepted");
        return true;
    }

    private void pollSafely() {
        try {
            pollOnce();
        } catch (RuntimeException e) {
            log.error("[OrderBook] Poll cycle failed: {}", e.getMessage(), e);
        }
    }

    private void flushSafely() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.error("[OrderBook] Flush failed: {}", e.getMessage(), e);
        }
    }

    private int store(List<OrderBookCandle> candles) {
        int stored = 0;
        try {
            for (OrderBookCandle candle : candles) {
                repository.mergeOrderBookCandle(candle);
                stored++;
            }
        } catch (PersistenceException e) {
            List<OrderBookCandle> unsaved = candles.subList(stored, candles.size());
            aggregator.restore(unsaved);
            log.warn("[OrderBook] {} candle(s) kept for the next flush: {}", unsaved.size(), e.getMessage());
        }
        if (stored > 0) {
            metrics.recordMarketBucketsStored("orderbook", stored);
            log.info("[OrderBook] ✓ Stored {} candle(s)", stored);
        }
        return stored;
    }
}
