package in.candlevault.application.service;

import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.Gap;
import in.candlevault.domain.data.RawPoint;
import in.candlevault.domain.data.TimeRange;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourcesExhaustedException;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.infrastructure.persistence.InMemoryDataPointRepository;
import in.candlevault.infrastructure.persistence.InMemoryGapRepository;
import in.candlevault.service.gap.GapDetector;
import in.candlevault.service.resilience.CircuitBreakerRegistry;
import in.candlevault.service.resilience.HealthTracker;
import in.candlevault.service.resilience.SlidingWindowRateLimiter;
import in.candlevault.service.source.SourceSelector;
import in.candlevault.service.validation.DataValidator;
import in.candlevault.testutil.FakeSourceAdapter;
import in.candlevault.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static in.candlevault.testutil.TestData.BTC_1H;
import static in.candlevault.testutil.TestData.T0;
import static in.candlevault.testutil.TestData.hourly;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scenario over fetch, validation, persistence and gap detection.
 *
 * Tests:
 * - A short fetch whose follow-up times out leaves exactly one gap
 */
class IngestionScenarioTest {

    @Test
    void testPartialFetchThenTimeoutLeavesOneGap() {
        MutableClock clock = new MutableClock(T0.plus(Duration.ofHours(120)).plusSeconds(60));
        InMemoryDataPointRepository points = new InMemoryDataPointRepository();
        InMemoryGapRepository gaps = new InMemoryGapRepository();

        List<RawPoint> served = new ArrayList<>(hourly(T0, 50, "100"));
        served.addAll(hourly(T0.plus(Duration.ofHours(70)), 50, "100"));
        FakeSourceAdapter binance = new FakeSourceAdapter("binance").serving(served);

        SlidingWindowRateLimiter rateLimiter =
            new SlidingWindowRateLimiter(Duration.ofSeconds(60), Duration.ZERO, IngestionMetrics.NOOP);
        rateLimiter.register("binance", 1000);
        CircuitBreakerRegistry breakers = new CircuitBreakerRegistry(5, Duration.ofSeconds(60),
            Duration.ofMinutes(10), clock, IngestionMetrics.NOOP);
        HealthTracker health = new HealthTracker(Duration.ofMinutes(15), 0.95, 3, 5, Duration.ofMinutes(2),
            clock, IngestionMetrics.NOOP);
        SourceSelector selector = new SourceSelector(List.of(binance), rateLimiter, breakers, health,
            IngestionMetrics.NOOP);
        FetchTaskHandler handler = new FetchTaskHandler(selector, new DataValidator(0.0001, 0.8, 0.5), points,
            IngestionMetrics.NOOP);
        GapDetector detector = new GapDetector(points, gaps, T0, Duration.ofDays(30), clock, IngestionMetrics.NOOP);

        TaskOutcome outcome = handler.run(FetchTask.live(BTC_1H, new TimeRange(T0, T0.plus(Duration.ofHours(120)))));
        assertEquals(100, outcome.received());
        assertTrue(outcome.isPartial());

        binance.failing(FailureKind.TIMEOUT);
        FetchTask retry = FetchTask.live(BTC_1H,
            new TimeRange(T0.plus(Duration.ofHours(50)), T0.plus(Duration.ofHours(70))));
        assertThrows(SourcesExhaustedException.class, () -> handler.run(retry));

        GapDetector.ScanResult scan = detector.scan(BTC_1H);

        assertEquals(1, scan.pending().size());
        Gap gap = scan.pending().get(0);
        assertEquals(20, gap.missingIntervals());
        assertEquals(T0.plus(Duration.ofHours(50)), gap.start());
    }
}
