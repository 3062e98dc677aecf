package in.candlevault.application.service;

import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.RawPoint;
import in.candlevault.domain.data.TimeRange;
import in.candlevault.domain.error.ValidationException;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.infrastructure.persistence.InMemoryDataPointRepository;
import in.candlevault.infrastructure.source.SourceAdapter;
import in.candlevault.service.resilience.CircuitBreakerRegistry;
import in.candlevault.service.resilience.HealthTracker;
import in.candlevault.service.resilience.SlidingWindowRateLimiter;
import in.candlevault.service.source.SourceSelector;
import in.candlevault.service.validation.DataValidator;
import in.candlevault.testutil.FakeSourceAdapter;
import in.candlevault.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static in.candlevault.testutil.TestData.BTC_1H;
import static in.candlevault.testutil.TestData.T0;
import static in.candlevault.testutil.TestData.hourly;
import static in.candlevault.testutil.TestData.raw;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FetchTaskHandler.
 *
 * Tests:
 * - Fetch, validate and store a live window
 * - Re-fetching identical data stores nothing
 * - Cross-source reconciliation raises quality
 * - Rejected batches leave the store untouched
 * - Points outside the task range are dropped
 */
class FetchTaskHandlerTest {

    private final TimeRange day = new TimeRange(T0, T0.plus(Duration.ofHours(24)));

    private InMemoryDataPointRepository points;
    private SlidingWindowRateLimiter rateLimiter;
    private CircuitBreakerRegistry breakers;
    private HealthTracker health;
    private DataValidator validator;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(T0.plus(Duration.ofDays(2)));
        points = new InMemoryDataPointRepository();
        rateLimiter = new SlidingWindowRateLimiter(Duration.ofSeconds(60), Duration.ZERO, IngestionMetrics.NOOP);
        breakers = new CircuitBreakerRegistry(5, Duration.ofSeconds(60), Duration.ofMinutes(10),
            clock, IngestionMetrics.NOOP);
        health = new HealthTracker(Duration.ofMinutes(15), 0.95, 3, 5, Duration.ofMinutes(2),
            clock, IngestionMetrics.NOOP);
        validator = new DataValidator(0.0001, 0.8, 0.5);
    }

    private FetchTaskHandler handler(SourceAdapter... adapters) {
        for (SourceAdapter adapter : adapters) {
            rateLimiter.register(adapter.id(), 1000);
        }
        SourceSelector selector = new SourceSelector(List.of(adapters), rateLimiter, breakers, health,
            IngestionMetrics.NOOP);
        return new FetchTaskHandler(selector, validator, points, IngestionMetrics.NOOP);
    }

    private List<DataPoint> storedDay() {
        return points.queryRange(BTC_1H.symbol(), Interval.HOUR_1, day.start(), day.end());
    }

    @Test
    void testLiveTaskStoresWindow() {
        FetchTaskHandler handler = handler(new FakeSourceAdapter("binance").serving(hourly(T0, 24, "100")));

        TaskOutcome outcome = handler.run(FetchTask.live(BTC_1H, day));

        assertEquals("binance", outcome.sourceId());
        assertEquals(24, outcome.received());
        assertEquals(24, outcome.expected());
        assertEquals(24, outcome.stored());
        assertFalse(outcome.isPartial());
        assertEquals(24, storedDay().size());
        assertEquals(0.8, storedDay().get(0).qualityScore(), 1e-9);
    }

    @Test
    void testRefetchStoresNothing() {
        FetchTaskHandler handler = handler(new FakeSourceAdapter("binance").serving(hourly(T0, 24, "100")));
        handler.run(FetchTask.live(BTC_1H, day));

        TaskOutcome second = handler.run(FetchTask.live(BTC_1H, day));

        assertEquals(0, second.stored());
        assertEquals(24, second.unchanged());
    }

    @Test
    void testShortResultIsPartial() {
        FetchTaskHandler handler = handler(new FakeSourceAdapter("binance").serving(hourly(T0, 20, "100")));

        TaskOutcome outcome = handler.run(FetchTask.live(BTC_1H, day));

        assertTrue(outcome.isPartial());
        assertEquals(20, outcome.stored());
    }

    @Test
    void testReconciliationUsesOtherSourceAndRaisesQuality() {
        FakeSourceAdapter binance = new FakeSourceAdapter("binance").serving(hourly(T0, 24, "100"));
        FakeSourceAdapter bybit = new FakeSourceAdapter("bybit").serving(hourly(T0, 24, "100"));
        FetchTaskHandler handler = handler(binance, bybit);
        handler.run(FetchTask.live(BTC_1H, day));

        TaskOutcome outcome = handler.run(FetchTask.reconciliation(BTC_1H, day));

        assertEquals("bybit", outcome.sourceId(), "The source that stored the range is excluded");
        assertEquals(24, outcome.confirmed());
        assertEquals(1, binance.calls());
        DataPoint point = storedDay().get(0);
        assertEquals("binance", point.sourceId());
        assertEquals(Set.of("binance", "bybit"), point.confirmedBy());
        assertEquals(0.9, point.qualityScore(), 1e-9);
    }

    @Test
    void testRejectedBatchLeavesStoreUntouched() {
        List<DataPoint> before = new ArrayList<>();
        for (RawPoint p : hourly(T0, 24, "100")) {
            DataPoint stored = DataPoint.fromRaw(BTC_1H, p, "binance", 0.8);
            points.upsert(stored);
            before.add(stored);
        }
        FetchTaskHandler handler = handler(new FakeSourceAdapter("bybit").serving(hourly(T0, 24, "130")));

        assertThrows(ValidationException.class, () -> handler.run(FetchTask.live(BTC_1H, day)));

        assertEquals(before, storedDay());
    }

    @Test
    void testPointsOutsideRangeDropped() {
        SourceAdapter adapter = mock(SourceAdapter.class);
        when(adapter.id()).thenReturn("mock");
        when(adapter.supports(anyString(), any())).thenReturn(true);
        List<RawPoint> withExtra = new ArrayList<>(hourly(T0, 24, "100"));
        withExtra.add(raw(day.end(), "100"));
        when(adapter.fetch(anyString(), any(), any(Instant.class), any(Instant.class))).thenReturn(withExtra);
        FetchTaskHandler handler = handler(adapter);

        TaskOutcome outcome = handler.run(FetchTask.live(BTC_1H, day));

        assertEquals(24, outcome.received());
        assertTrue(points.findTimestamps(BTC_1H.symbol(), Interval.HOUR_1, day.end(), day.end().plusSeconds(3600))
            .isEmpty(), "Point at the exclusive end was not stored");
    }
}
