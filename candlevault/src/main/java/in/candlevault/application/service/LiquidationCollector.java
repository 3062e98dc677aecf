package in.candlevault.application.service;

import in.candlevault.domain.error.PersistenceException;
import in.candlevault.domain.market.LiquidationBucket;
import in.candlevault.domain.market.LiquidationEvent;
import in.candlevault.domain.repository.MarketActivityRepository;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.service.market.TimeBucketAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sums streamed liquidations into per-interval buckets and stores each bucket
 * once its interval has closed.
 *
 * Buckets that fail to store stay in memory and are retried on the next
 * flush. On {@link #stop()} open buckets are stored as partial aggregates; the
 * store merges them with whatever arrives for the same bucket after a restart.
 */
public class LiquidationCollector {
    private static final Logger log = LoggerFactory.getLogger(LiquidationCollector.class);

    private final TimeBucketAggregator<LiquidationEvent, LiquidationBucket> aggregator;
    private final MarketActivityRepository repository;
    private final Duration flushPeriod;
    private final IngestionMetrics metrics;
    private final Clock clock;

    private final ScheduledExecutorService flusher = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "liquidation-flush");
        t.setDaemon(true);
        return t;
    });

    public LiquidationCollector(TimeBucketAggregator<LiquidationEvent, LiquidationBucket> aggregator,
                                MarketActivityRepository repository, Duration flushPeriod,
                                IngestionMetrics metrics, Clock clock) {
        this.aggregator = aggregator;
        this.repository = repository;
        this.flushPeriod = flushPeriod;
        this.metrics = metrics;
        this.clock = clock;
    }

    public void onEvent(LiquidationEvent event) {
        aggregator.accept(event);
        log.debug("[Liquidations] {} {} {} @ {}", event.symbol(), event.side(), event.quantity(), event.price());
    }

    public void start() {
        flusher.scheduleWithFixedDelay(this::flushSafely,
            flushPeriod.toMillis(), flushPeriod.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[Liquidations] Collecting into {} buckets, flush every {}s",
            aggregator.getInterval().getCode(), flushPeriod.toSeconds());
    }

    public void stop() {
        flusher.shutdownNow();
        int stored = store(aggregator.drainAll());
        log.info("[Liquidations] Stopped, {} partial bucket(s) stored", stored);
    }

    /**
     * Store every closed bucket.
     *
     * @return buckets stored
     */
    public int flush() {
        return store(aggregator.drainClosed(clock.instant()));
    }

    private void flushSafely() {
        try {
            flush();
        } catch (RuntimeException e) {
            log.error("[Liquidations] Flush failed: {}", e.getMessage(), e);
        }
    }

    private int store(List<LiquidationBucket> buckets) {
        int stored = 0;
        try {
            for (LiquidationBucket bucket : buckets) {
                repository.mergeLiquidations(bucket);
                stored++;
            }
        } catch (PersistenceException e) {
            List<LiquidationBucket> unsaved = buckets.subList(stored, buckets.size());
            aggregator.restore(unsaved);
            log.warn("[Liquidations] {} bucket(s) kept for the next flush: {}", unsaved.size(), e.getMessage());
        }
        if (stored > 0) {
            metrics.recordMarketBucketsStored("liquidation", stored);
            log.info("[Liquidations] ✓ Stored {} bucket(s)", stored);
        }
        return stored;
    }
}
