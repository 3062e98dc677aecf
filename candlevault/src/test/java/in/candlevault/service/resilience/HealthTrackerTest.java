package in.candlevault.service.resilience;

import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.health.SourceHealth;
import in.candlevault.domain.health.SourceState;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HealthTracker.
 *
 * Tests:
 * - HEALTHY / DEGRADED / SUSPENDED classification
 * - Suspension expiry and re-suspension
 * - Time decay of the success rate
 * - Performance snapshot
 */
class HealthTrackerTest {

    private static final Duration LATENCY = Duration.ofMillis(100);

    private MutableClock clock;
    private HealthTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T00:00:00Z"));
        tracker = new HealthTracker(Duration.ofMinutes(15), 0.95, 3, 5, Duration.ofMinutes(2),
            clock, IngestionMetrics.NOOP);
    }

    private void failures(String id, int n) {
        for (int i = 0; i < n; i++) {
            tracker.recordFailure(id, FailureKind.TIMEOUT, LATENCY);
        }
    }

    private void successes(String id, int n) {
        for (int i = 0; i < n; i++) {
            tracker.recordSuccess(id, LATENCY);
        }
    }

    @Test
    void testUnknownSourceStartsHealthy() {
        assertEquals(SourceState.HEALTHY, tracker.state("binance"));
        assertEquals(Duration.ZERO, tracker.averageLatency("binance"));
    }

    @Test
    void testConsecutiveFailuresDegradeThenSuspend() {
        successes("binance", 100);

        failures("binance", 2);
        assertEquals(SourceState.HEALTHY, tracker.state("binance"), "Two failures in a healthy history");

        failures("binance", 1);
        assertEquals(SourceState.DEGRADED, tracker.state("binance"), "Three consecutive failures degrade");

        failures("binance", 2);
        assertEquals(SourceState.SUSPENDED, tracker.state("binance"), "Five consecutive failures suspend");
        assertFalse(tracker.state("binance").isSelectable());
    }

    @Test
    void testLowSuccessRateDegrades() {
        for (int i = 0; i < 10; i++) {
            successes("bybit", 8);
            failures("bybit", 1);
            successes("bybit", 1);
        }

        assertEquals(SourceState.DEGRADED, tracker.state("bybit"), "90% success is below the 95% threshold");
        assertTrue(tracker.state("bybit").isSelectable());
    }

    @Test
    void testSuspensionExpiresToDegradedAndResuspendsOnFailure() {
        failures("binance", 5);
        assertEquals(SourceState.SUSPENDED, tracker.state("binance"));

        clock.advance(Duration.ofMinutes(2));
        assertEquals(SourceState.DEGRADED, tracker.state("binance"), "Suspension over, still unhealthy");

        failures("binance", 1);
        assertEquals(SourceState.SUSPENDED, tracker.state("binance"), "A failed trial request suspends again");
    }

    @Test
    void testSuccessAfterSuspensionClearsIt() {
        failures("binance", 5);
        clock.advance(Duration.ofMinutes(2));

        tracker.recordSuccess("binance", LATENCY);

        SourceHealth health = tracker.snapshot("binance");
        assertEquals(0, health.consecutiveFailures());
        assertNull(health.suspendedUntil());
        assertNotEquals(SourceState.SUSPENDED, health.state());
    }

    @Test
    void testOldFailuresDecay() {
        failures("bybit", 2);
        successes("bybit", 3);
        assertEquals(SourceState.DEGRADED, tracker.state("bybit"), "60% success rate");

        clock.advance(Duration.ofHours(3));
        successes("bybit", 5);

        assertEquals(SourceState.HEALTHY, tracker.state("bybit"),
            "After twelve half-lives the old failures no longer count");
        assertTrue(tracker.snapshot("bybit").successRate() > 0.99);
    }

    @Test
    void testSnapshotReportsCountersAndLatency() {
        tracker.recordSuccess("binance", Duration.ofMillis(100));
        tracker.recordSuccess("binance", Duration.ofMillis(300));
        tracker.recordFailure("binance", FailureKind.RATE_LIMITED, Duration.ofMillis(200));

        SourceHealth health = tracker.snapshot("binance");
        assertEquals(3, health.requestCount());
        assertEquals(2, health.successCount());
        assertEquals(1, health.errorCount());
        assertEquals(1, health.consecutiveFailures());
        assertEquals(FailureKind.RATE_LIMITED, health.lastErrorKind());
        assertEquals(Duration.ofMillis(200), health.averageLatency());
        assertEquals(2.0 / 3.0, health.successRate(), 1e-9);
    }

    @Test
    void testSnapshotAllOrderedById() {
        tracker.register("bybit");
        tracker.register("binance");

        assertEquals(List.of("binance", "bybit"), List.copyOf(tracker.snapshotAll().keySet()));
    }
}
