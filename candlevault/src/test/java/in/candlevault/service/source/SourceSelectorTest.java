package in.candlevault.service.source;

import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.TimeRange;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourcesExhaustedException;
import in.candlevault.domain.health.CircuitState;
import in.candlevault.domain.health.SourceState;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.infrastructure.source.SourceAdapter;
import in.candlevault.service.resilience.CircuitBreakerRegistry;
import in.candlevault.service.resilience.HealthTracker;
import in.candlevault.service.resilience.SlidingWindowRateLimiter;
import in.candlevault.service.source.SourceSelector.FetchResult;
import in.candlevault.testutil.FakeSourceAdapter;
import in.candlevault.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static in.candlevault.testutil.TestData.BTC_1H;
import static in.candlevault.testutil.TestData.T0;
import static in.candlevault.testutil.TestData.hourly;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SourceSelector.
 *
 * Tests:
 * - Ranking by breaker state, health and latency
 * - Failover to the next source within one attempt
 * - Suspended and circuit-open sources are skipped
 * - Exhaustion reporting
 */
class SourceSelectorTest {

    private MutableClock clock;
    private SlidingWindowRateLimiter rateLimiter;
    private CircuitBreakerRegistry breakers;
    private HealthTracker health;
    private FakeSourceAdapter a;
    private FakeSourceAdapter b;
    private final FetchTask task = FetchTask.live(BTC_1H, new TimeRange(T0, T0.plusSeconds(24 * 3600)));

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0.plusSeconds(30 * 24 * 3600));
        rateLimiter = new SlidingWindowRateLimiter(Duration.ofSeconds(60), Duration.ZERO, IngestionMetrics.NOOP);
        breakers = new CircuitBreakerRegistry(5, Duration.ofSeconds(60), Duration.ofMinutes(10),
            clock, IngestionMetrics.NOOP);
        health = new HealthTracker(Duration.ofMinutes(15), 0.95, 3, 5, Duration.ofMinutes(2),
            clock, IngestionMetrics.NOOP);
        a = new FakeSourceAdapter("a").serving(hourly(T0, 24, "100"));
        b = new FakeSourceAdapter("b").serving(hourly(T0, 24, "100"));
        rateLimiter.register("a", 1000);
        rateLimiter.register("b", 1000);
    }

    private SourceSelector selector(SourceAdapter... adapters) {
        return new SourceSelector(List.of(adapters), rateLimiter, breakers, health, IngestionMetrics.NOOP);
    }

    @Test
    void testConfigurationOrderBreaksTies() {
        SourceSelector selector = selector(a, b);

        assertEquals(List.of(a, b), selector.rank(BTC_1H));
        assertEquals("a", selector.fetch(task).sourceId());
    }

    @Test
    void testHealthyPreferredOverDegraded() {
        SourceSelector selector = selector(a, b);
        for (int i = 0; i < 3; i++) {
            health.recordFailure("a", FailureKind.TIMEOUT, Duration.ofMillis(10));
        }
        assertEquals(SourceState.DEGRADED, health.state("a"));

        assertEquals(List.of(b, a), selector.rank(BTC_1H), "Degraded sources stay selectable, ranked last");
    }

    @Test
    void testLowerLatencyPreferred() {
        SourceSelector selector = selector(a, b);
        health.recordSuccess("a", Duration.ofMillis(400));
        health.recordSuccess("b", Duration.ofMillis(50));

        assertEquals(List.of(b, a), selector.rank(BTC_1H));
    }

    @Test
    void testFailoverWithinOneAttempt() {
        a.failing(FailureKind.UNAVAILABLE);
        SourceSelector selector = selector(a, b);

        FetchResult result = selector.fetch(task);

        assertEquals("b", result.sourceId());
        assertEquals(24, result.points().size());
        assertEquals(1, a.calls());
        assertEquals(1, health.snapshot("a").errorCount());
        assertEquals(1, health.snapshot("b").successCount());
    }

    @Test
    void testSuspendedSourceSkippedUntilCooldown() {
        a.failing(FailureKind.TIMEOUT);
        SourceSelector selector = selector(a, b);

        for (int i = 0; i < 5; i++) {
            assertThrows(SourcesExhaustedException.class, () -> selector.fetch(task, Set.of("b")));
        }
        assertEquals(5, a.calls());
        assertEquals(SourceState.SUSPENDED, health.state("a"));
        assertEquals(CircuitState.OPEN, breakers.get("a").getState());

        assertEquals("b", selector.fetch(task).sourceId());
        assertEquals(5, a.calls(), "Suspended source is not contacted");
        assertEquals(List.of(b), selector.rank(BTC_1H));

        clock.advance(Duration.ofMinutes(2));
        assertEquals(CircuitState.HALF_OPEN, breakers.get("a").getState());
        assertEquals(List.of(b, a), selector.rank(BTC_1H), "After the suspension a is selectable again, ranked last");
    }

    @Test
    void testCircuitOpenSourceNotContacted() {
        SourceSelector selector = selector(a, b);
        for (int i = 0; i < 5; i++) {
            breakers.get("a").onFailure();
        }

        assertEquals("b", selector.fetch(task).sourceId());
        assertEquals(0, a.calls());
    }

    @Test
    void testAllSourcesFailed() {
        a.failing(FailureKind.AUTH_ERROR);
        b.failing(FailureKind.RATE_LIMITED);
        SourceSelector selector = selector(a, b);

        SourcesExhaustedException e = assertThrows(SourcesExhaustedException.class, () -> selector.fetch(task));

        assertEquals(FailureKind.AUTH_ERROR, e.getAttempts().get("a"));
        assertEquals(FailureKind.RATE_LIMITED, e.getAttempts().get("b"));
        assertTrue(e.isRetryable(), "One transient failure makes the attempt retryable");
        assertFalse(e.noSourceAvailable());
    }

    @Test
    void testNoCapableSource() {
        a.unsupported();
        SourceSelector selector = selector(a);

        SourcesExhaustedException e = assertThrows(SourcesExhaustedException.class, () -> selector.fetch(task));

        assertTrue(e.noSourceAvailable());
        assertTrue(selector.capable(BTC_1H).isEmpty());
        assertFalse(selector.anyAvailable(BTC_1H));
    }

    @Test
    void testRateLimitedSourceSkipped() {
        rateLimiter.register("a", 1);
        SourceSelector selector = selector(a, b);

        assertEquals("a", selector.fetch(task).sourceId());
        assertEquals("b", selector.fetch(task).sourceId(), "Quota of a is used up, no wait allowed");
        assertEquals(1, a.calls());
    }

    @Test
    void testExcludedSourceNotUsed() {
        SourceSelector selector = selector(a, b);

        assertEquals("b", selector.fetch(task, Set.of("a")).sourceId());
        assertEquals(0, a.calls());
    }
}
