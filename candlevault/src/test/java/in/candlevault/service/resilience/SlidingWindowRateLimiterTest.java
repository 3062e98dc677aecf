package in.candlevault.service.resilience;

import in.candlevault.domain.data.TaskPriority;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourceException;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SlidingWindowRateLimiter.
 *
 * Tests:
 * - Quota within a rolling window
 * - Rejection after max wait
 * - Blocking until the oldest grant leaves the window
 * - LIVE priority and BACKFILL starvation guard
 */
class SlidingWindowRateLimiterTest {

    private final AtomicLong nanos = new AtomicLong(1_000_000_000L);

    private SlidingWindowRateLimiter fakeTimeLimiter(int quota) {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
            Duration.ofSeconds(60), Duration.ZERO, nanos::get, IngestionMetrics.NOOP);
        limiter.register("binance", quota);
        return limiter;
    }

    private void advance(Duration d) {
        nanos.addAndGet(d.toNanos());
    }

    @Test
    void testQuotaEnforcedWithinWindow() {
        SlidingWindowRateLimiter limiter = fakeTimeLimiter(3);

        limiter.acquire("binance", TaskPriority.LIVE);
        limiter.acquire("binance", TaskPriority.LIVE);
        limiter.acquire("binance", TaskPriority.BACKFILL);

        assertEquals(0, limiter.available("binance"));
        SourceException e = assertThrows(SourceException.class,
            () -> limiter.acquire("binance", TaskPriority.LIVE));
        assertEquals(FailureKind.RATE_LIMITED, e.getKind());
    }

    @Test
    void testWindowSlides() {
        SlidingWindowRateLimiter limiter = fakeTimeLimiter(3);

        limiter.acquire("binance", TaskPriority.LIVE);
        advance(Duration.ofSeconds(30));
        limiter.acquire("binance", TaskPriority.LIVE);
        advance(Duration.ofSeconds(10));
        limiter.acquire("binance", TaskPriority.LIVE);

        advance(Duration.ofSeconds(19));
        assertEquals(0, limiter.available("binance"), "First grant is 59s old");

        advance(Duration.ofSeconds(1));
        assertEquals(1, limiter.available("binance"), "First grant left the window");

        advance(Duration.ofSeconds(40));
        assertEquals(3, limiter.available("binance"));
    }

    @Test
    void testUnknownSourceRejected() {
        SlidingWindowRateLimiter limiter = fakeTimeLimiter(1);

        assertThrows(IllegalArgumentException.class, () -> limiter.acquire("kraken", TaskPriority.LIVE));
        assertThrows(IllegalArgumentException.class, () -> limiter.register("kraken", 0));
    }

    @Test
    void testBlocksUntilSlotFrees() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
            Duration.ofMillis(200), Duration.ofSeconds(2), IngestionMetrics.NOOP);
        limiter.register("binance", 1);

        limiter.acquire("binance", TaskPriority.LIVE);
        long started = System.nanoTime();
        limiter.acquire("binance", TaskPriority.LIVE);
        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        assertTrue(waitedMs >= 150, "Second request should wait for the window, waited " + waitedMs + "ms");
        assertTrue(waitedMs < 1500, "Second request waited too long: " + waitedMs + "ms");
    }

    @Test
    void testLiveServedBeforeBackfill() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
            Duration.ofMillis(400), Duration.ofSeconds(5), IngestionMetrics.NOOP);
        limiter.register("binance", 2);
        List<TaskPriority> order = Collections.synchronizedList(new ArrayList<>());

        limiter.acquire("binance", TaskPriority.LIVE);
        Thread.sleep(150);
        limiter.acquire("binance", TaskPriority.BACKFILL);

        Thread backfill = waiter(limiter, TaskPriority.BACKFILL, order);
        Thread.sleep(30);
        Thread live = waiter(limiter, TaskPriority.LIVE, order);

        backfill.join(5000);
        live.join(5000);

        assertEquals(List.of(TaskPriority.LIVE, TaskPriority.BACKFILL), order,
            "LIVE takes the first free slot while BACKFILL already had a grant in the window");
    }

    @Test
    void testStarvedBackfillGetsNextSlot() throws Exception {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(
            Duration.ofMillis(300), Duration.ofSeconds(5), IngestionMetrics.NOOP);
        limiter.register("binance", 1);
        List<TaskPriority> order = Collections.synchronizedList(new ArrayList<>());

        limiter.acquire("binance", TaskPriority.LIVE);

        Thread backfill = waiter(limiter, TaskPriority.BACKFILL, order);
        Thread.sleep(30);
        Thread live = waiter(limiter, TaskPriority.LIVE, order);

        backfill.join(5000);
        live.join(5000);

        assertEquals(List.of(TaskPriority.BACKFILL, TaskPriority.LIVE), order,
            "BACKFILL with no grant in the window is not starved by LIVE");
    }

    private static Thread waiter(SlidingWindowRateLimiter limiter, TaskPriority priority, List<TaskPriority> order) {
        Thread t = new Thread(() -> {
            limiter.acquire("binance", priority);
            order.add(priority);
        });
        t.start();
        return t;
    }
}
