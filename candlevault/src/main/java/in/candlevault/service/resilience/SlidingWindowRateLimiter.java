package in.candlevault.service.resilience;

import in.candlevault.domain.data.TaskPriority;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourceException;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * Sliding-window rate limiter with one bucket per source.
 *
 * A source may be granted at most {@code quota} requests in any rolling
 * window. {@link #acquire} grants immediately when a slot is free, otherwise
 * blocks until the oldest grant leaves the window, up to {@code maxWait}.
 *
 * Sharing between priorities:
 * - LIVE waiters are served first
 * - when BACKFILL waiters exist and no BACKFILL grant happened in the current
 *   window, the next free slot goes to BACKFILL
 */
public class SlidingWindowRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final long windowNanos;
    private final long maxWaitNanos;
    private final LongSupplier nanoTime;
    private final IngestionMetrics metrics;
    private final Map<String, Bucket> buckets = new ConcurrentHashMap<>();

    public SlidingWindowRateLimiter(Duration window, Duration maxWait, IngestionMetrics metrics) {
        this(window, maxWait, System::nanoTime, metrics);
    }

    SlidingWindowRateLimiter(Duration window, Duration maxWait, LongSupplier nanoTime, IngestionMetrics metrics) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        this.windowNanos = window.toNanos();
        this.maxWaitNanos = maxWait.toNanos();
        this.nanoTime = nanoTime;
        this.metrics = metrics;
    }

    public void register(String sourceId, int quota) {
        if (quota < 1) {
            throw new IllegalArgumentException("Quota must be >= 1 for " + sourceId);
        }
        buckets.put(sourceId, new Bucket(quota));
        log.info("[RateLimiter] {} quota {} per {}s", sourceId, quota, TimeUnit.NANOSECONDS.toSeconds(windowNanos));
    }

    /**
     * Take one request slot for {@code sourceId}.
     *
     * @throws SourceException with RATE_LIMITED if no slot frees up within maxWait
     */
    public void acquire(String sourceId, TaskPriority priority) {
        Bucket bucket = bucketFor(sourceId);
        long started = nanoTime.getAsLong();
        long deadline = started + maxWaitNanos;

        bucket.lock.lock();
        try {
            bucket.waiting(priority, +1);
            try {
                while (true) {
                    long now = nanoTime.getAsLong();
                    bucket.evict(now);
                    if (bucket.free() > 0 && bucket.mayTake(priority)) {
                        bucket.grant(priority, now);
                        long waited = now - started;
                        metrics.recordRateLimitWait(sourceId, priority, Duration.ofNanos(waited));
                        if (waited > 0 && log.isDebugEnabled()) {
                            log.debug("[RateLimiter] {} {} granted after {}ms", sourceId, priority,
                                TimeUnit.NANOSECONDS.toMillis(waited));
                        }
                        return;
                    }

                    long remaining = deadline - now;
                    if (remaining <= 0) {
                        metrics.recordRateLimitRejected(sourceId, priority);
                        throw new SourceException(sourceId, FailureKind.RATE_LIMITED,
                            "no request slot within " + TimeUnit.NANOSECONDS.toMillis(maxWaitNanos) + "ms");
                    }
                    long untilSlotFrees = bucket.free() > 0 ? remaining : bucket.nanosUntilExpiry(now);
                    bucket.changed.awaitNanos(Math.max(1, Math.min(remaining, untilSlotFrees)));
                }
            } finally {
                bucket.waiting(priority, -1);
                bucket.changed.signalAll();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceException(sourceId, FailureKind.RATE_LIMITED, "interrupted while waiting for a slot", e);
        } finally {
            bucket.lock.unlock();
        }
    }

    /**
     * Slots currently free for {@code sourceId}.
     */
    public int available(String sourceId) {
        Bucket bucket = bucketFor(sourceId);
        bucket.lock.lock();
        try {
            bucket.evict(nanoTime.getAsLong());
            return bucket.free();
        } finally {
            bucket.lock.unlock();
        }
    }

    private Bucket bucketFor(String sourceId) {
        Bucket bucket = buckets.get(sourceId);
        if (bucket == null) {
            throw new IllegalArgumentException("No rate limit registered for source " + sourceId);
        }
        return bucket;
    }

    private final class Bucket {
        private final int quota;
        private final Deque<Long> grants = new ArrayDeque<>();
        private final Deque<Long> backfillGrants = new ArrayDeque<>();
        private final ReentrantLock lock = new ReentrantLock();
        private final Condition changed = lock.newCondition();
        private int waitingLive;
        private int waitingBackfill;

        private Bucket(int quota) {
            this.quota = quota;
        }

        private void evict(long now) {
            while (!grants.isEmpty() && now - grants.peekFirst() >= windowNanos) {
                grants.pollFirst();
            }
            while (!backfillGrants.isEmpty() && now - backfillGrants.peekFirst() >= windowNanos) {
                backfillGrants.pollFirst();
            }
        }

        private int free() {
            return quota - grants.size();
        }

        private boolean mayTake(TaskPriority priority) {
            boolean backfillStarved = waitingBackfill > 0 && backfillGrants.isEmpty();
            if (priority == TaskPriority.LIVE) {
                return !backfillStarved;
            }
            return waitingLive == 0 || backfillGrants.isEmpty();
        }

        private void grant(TaskPriority priority, long now) {
            grants.addLast(now);
            if (priority == TaskPriority.BACKFILL) {
                backfillGrants.addLast(now);
            }
        }

        private long nanosUntilExpiry(long now) {
            Long oldest = grants.peekFirst();
            return oldest == null ? 0 : oldest + windowNanos - now;
        }

        private void waiting(TaskPriority priority, int delta) {
            if (priority == TaskPriority.LIVE) {
                waitingLive += delta;
            } else {
                waitingBackfill += delta;
            }
        }
    }
}
