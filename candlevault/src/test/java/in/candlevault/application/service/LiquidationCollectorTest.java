package in.candlevault.application.service;

import in.candlevault.domain.data.Interval;
import in.candlevault.domain.error.PersistenceException;
import in.candlevault.domain.market.LiquidationBucket;
import in.candlevault.domain.market.LiquidationEvent;
import in.candlevault.domain.market.LiquidationSide;
import in.candlevault.domain.repository.MarketActivityRepository;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.infrastructure.persistence.InMemoryMarketActivityRepository;
import in.candlevault.service.market.TimeBucketAggregator;
import in.candlevault.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static in.candlevault.testutil.TestData.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for LiquidationCollector.
 *
 * Tests:
 * - Buckets stored once their hour has closed
 * - Failed stores kept and retried without losing later events
 * - Stop stores the open bucket as a partial aggregate
 */
class LiquidationCollectorTest {

    private MutableClock clock;
    private InMemoryMarketActivityRepository repository;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        repository = new InMemoryMarketActivityRepository();
    }

    private LiquidationCollector collector(MarketActivityRepository repo) {
        return new LiquidationCollector(TimeBucketAggregator.liquidations(Interval.HOUR_1), repo,
            Duration.ofMinutes(1), IngestionMetrics.NOOP, clock);
    }

    private static LiquidationEvent event(LiquidationSide side, String qty, Instant at) {
        return new LiquidationEvent("BTCUSDT", side, new BigDecimal("42000"), new BigDecimal(qty), at);
    }

    private List<LiquidationBucket> stored() {
        return repository.queryLiquidations("BTCUSDT", Interval.HOUR_1, T0, T0.plusSeconds(24 * 3600));
    }

    @Test
    void testBucketStoredOnceHourCloses() {
        LiquidationCollector collector = collector(repository);
        collector.onEvent(event(LiquidationSide.LONG, "0.5", T0.plusSeconds(100)));
        collector.onEvent(event(LiquidationSide.SHORT, "1.5", T0.plusSeconds(200)));
        collector.onEvent(event(LiquidationSide.LONG, "1", T0.plusSeconds(3700)));

        clock.set(T0.plusSeconds(3650));
        assertEquals(1, collector.flush());

        List<LiquidationBucket> buckets = stored();
        assertEquals(1, buckets.size());
        assertEquals(1, buckets.get(0).longCount());
        assertEquals(1, buckets.get(0).shortCount());
        assertEquals(0, new BigDecimal("84000").compareTo(buckets.get(0).totalNotional()));
    }

    @Test
    void testFailedStoreRetriedWithLaterEvents() {
        MarketActivityRepository flaky = mock(MarketActivityRepository.class);
        doThrow(new PersistenceException("connection refused", null))
            .doNothing()
            .when(flaky).mergeLiquidations(any());
        LiquidationCollector collector = collector(flaky);
        collector.onEvent(event(LiquidationSide.LONG, "1", T0.plusSeconds(100)));
        clock.set(T0.plusSeconds(3600));

        assertEquals(0, collector.flush());
        // Late event for the same hour, e.g. delivered after a reconnect
        collector.onEvent(event(LiquidationSide.LONG, "2", T0.plusSeconds(3500)));
        assertEquals(1, collector.flush());

        verify(flaky).mergeLiquidations(argThat(b -> b.longCount() == 2));
    }

    @Test
    void testStopStoresPartialBucket() {
        LiquidationCollector collector = collector(repository);
        collector.onEvent(event(LiquidationSide.SHORT, "3", T0.plusSeconds(100)));

        collector.stop();

        assertEquals(1, stored().size());
        assertEquals(1, stored().get(0).shortCount());
    }
}
