package in.candlevault.application.service;

import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TaskPriority;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.service.resilience.RetryPolicy;
import in.candlevault.service.resilience.RetryPolicy.RetryDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Priority task scheduler backed by a bounded worker pool.
 *
 * Ordering rules:
 * - LIVE before BACKFILL, FIFO within a priority
 * - LIVE tasks of one series run one at a time, in submission order; a LIVE
 *   task waiting out a retry delay holds back later LIVE tasks of its series
 * - BACKFILL tasks of a series wait while any LIVE task of that series is
 *   queued, backing off or running
 *
 * Failed attempts are classified by {@link RetryPolicy}. Retries are delayed
 * re-submissions on a timer thread; no worker sleeps.
 *
 * Usage:
 * <pre>
 * TaskScheduler scheduler = new TaskScheduler(10, handler, retryPolicy, metrics);
 * scheduler.setListener(coordinator);
 * scheduler.submit(FetchTask.live(series, range));
 * ...
 * scheduler.shutdown(Duration.ofSeconds(30));
 * </pre>
 */
public class TaskScheduler {
    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /**
     * Executes one attempt of a task. Throws on failure.
     */
    @FunctionalInterface
    public interface TaskRunner {
        TaskOutcome run(FetchTask task);
    }

    private record Entry(FetchTask task, int attempt, long seq) {
        SeriesKey series() {
            return task.series();
        }

        boolean isLive() {
            return task.priority() == TaskPriority.LIVE;
        }
    }

    private static final Comparator<Entry> ORDER = Comparator
        .comparing((Entry e) -> e.task().priority())
        .thenComparingLong(Entry::seq);

    private final int poolSize;
    private final TaskRunner runner;
    private final RetryPolicy retryPolicy;
    private final IngestionMetrics metrics;
    private final ExecutorService workers;
    private final ScheduledExecutorService retryTimer;
    private volatile TaskListener listener = TaskListener.NONE;

    // Guarded by this
    private final TreeSet<Entry> queue = new TreeSet<>(ORDER);
    private final Set<SeriesKey> liveRunning = new HashSet<>();
    private final Set<SeriesKey> liveBackingOff = new HashSet<>();
    private final Map<SeriesKey, Integer> liveOutstanding = new HashMap<>();
    private int running = 0;
    private int waitingRetries = 0;
    private long nextSeq = 0;
    private boolean stopped = false;

    public TaskScheduler(int poolSize, TaskRunner runner, RetryPolicy retryPolicy, IngestionMetrics metrics) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("Pool size must be >= 1");
        }
        this.poolSize = poolSize;
        this.runner = runner;
        this.retryPolicy = retryPolicy;
        this.metrics = metrics;
        this.workers = Executors.newFixedThreadPool(poolSize, namedDaemon("fetch-worker"));
        this.retryTimer = Executors.newSingleThreadScheduledExecutor(namedDaemon("fetch-retry"));
    }

    public void setListener(TaskListener listener) {
        this.listener = listener;
    }

    /**
     * Queue a task for its first attempt.
     *
     * @throws IllegalStateException after shutdown
     */
    public synchronized void submit(FetchTask task) {
        if (stopped) {
            throw new IllegalStateException("Scheduler is shut down, rejected " + task);
        }
        Entry entry = new Entry(task, 0, nextSeq++);
        queue.add(entry);
        if (entry.isLive()) {
            liveOutstanding.merge(entry.series(), 1, Integer::sum);
        }
        log.debug("[Scheduler] Queued {}", task);
        pump();
    }

    public synchronized int queuedCount(TaskPriority priority) {
        return (int) queue.stream().filter(e -> e.task().priority() == priority).count();
    }

    public synchronized int runningCount() {
        return running;
    }

    public synchronized boolean isIdle() {
        return queue.isEmpty() && running == 0 && waitingRetries == 0;
    }

    /**
     * Block until nothing is queued, running or waiting to be retried.
     *
     * @return false on timeout
     */
    public synchronized boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!isIdle()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return false;
            }
            TimeUnit.NANOSECONDS.timedWait(this, remaining);
        }
        return true;
    }

    /**
     * Stop accepting work, drop queued tasks and wait up to {@code grace} for
     * running attempts before interrupting them.
     *
     * @return true if every running attempt finished within the grace period
     */
    public boolean shutdown(Duration grace) {
        int dropped;
        synchronized (this) {
            if (stopped) {
                return true;
            }
            stopped = true;
            dropped = queue.size() + waitingRetries;
            queue.clear();
            liveOutstanding.clear();
            // Pending retries are discarded with the timer below
            waitingRetries = 0;
            liveBackingOff.clear();
            notifyAll();
        }
        log.info("[Scheduler] Shutting down: {} queued or retrying task(s) dropped, waiting up to {}s for running tasks",
            dropped, grace.toSeconds());

        retryTimer.shutdownNow();
        workers.shutdown();
        try {
            if (workers.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            log.warn("[Scheduler] Grace period elapsed, interrupting running tasks");
            workers.shutdownNow();
            workers.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        return false;
    }

    // Caller holds the lock
    private void pump() {
        if (stopped) {
            return;
        }
        Set<SeriesKey> liveSeen = new HashSet<>();
        Iterator<Entry> it = queue.iterator();
        while (running < poolSize && it.hasNext()) {
            Entry entry = it.next();
            SeriesKey series = entry.series();
            if (entry.isLive()) {
                boolean first = liveSeen.add(series);
                if (!first || liveRunning.contains(series) || liveBackingOff.contains(series)) {
                    continue;
                }
                liveRunning.add(series);
            } else if (liveOutstanding.getOrDefault(series, 0) > 0) {
                continue;
            }
            it.remove();
            running++;
            workers.execute(() -> runEntry(entry));
        }
        publishDepth();
    }

    private void runEntry(Entry entry) {
        FetchTask task = entry.task();
        TaskListener current = listener;
        boolean retrying = false;
        Duration delay = Duration.ZERO;

        try {
            if (!current.isWanted(task)) {
                log.debug("[Scheduler] Dropping no longer wanted {}", task);
                metrics.recordTaskOutcome(task.priority(), "cancelled");
                return;
            }

            TaskOutcome outcome = runner.run(task);
            metrics.recordTaskOutcome(task.priority(), "success");
            log.debug("[Scheduler] {} done on attempt {}: {}", task, entry.attempt() + 1, outcome);
            notifySuccess(current, entry, outcome);

        } catch (RuntimeException failure) {
            RetryDecision decision = retryPolicy.decide(entry.attempt(), failure);
            retrying = decision.retry() && !isStopped();
            delay = decision.delay();
            notifyFailure(current, entry, failure, retrying);

            if (retrying) {
                metrics.recordTaskOutcome(task.priority(), "retry_scheduled");
                log.warn("[Scheduler] {} attempt {} failed ({}), retry in {}ms: {}",
                    task, entry.attempt() + 1, decision.kind(), delay.toMillis(), failure.getMessage());
            } else {
                metrics.recordTaskOutcome(task.priority(), "abandoned");
                log.error("[Scheduler] Abandoned {} after attempt {}: {} - {}",
                    task, entry.attempt() + 1, decision.reason(), failure.getMessage());
                notifyAbandoned(current, entry, failure);
            }
        } finally {
            complete(entry, retrying, delay);
        }
    }

    private void complete(Entry entry, boolean retrying, Duration delay) {
        synchronized (this) {
            running--;
            SeriesKey series = entry.series();
            if (entry.isLive()) {
                liveRunning.remove(series);
            }
            if (retrying && !stopped) {
                waitingRetries++;
                if (entry.isLive()) {
                    liveBackingOff.add(series);
                }
                try {
                    retryTimer.schedule(() -> resubmit(entry), delay.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RuntimeException e) {
                    log.warn("[Scheduler] Could not schedule retry of {}: {}", entry.task(), e.getMessage());
                    waitingRetries--;
                    liveBackingOff.remove(series);
                    releaseLive(entry);
                }
            } else {
                releaseLive(entry);
            }
            pump();
            notifyAll();
        }
    }

    private synchronized void resubmit(Entry entry) {
        if (stopped) {
            return;
        }
        waitingRetries--;
        if (entry.isLive()) {
            liveBackingOff.remove(entry.series());
        }
        queue.add(new Entry(entry.task(), entry.attempt() + 1, entry.seq()));
        pump();
        notifyAll();
    }

    private void releaseLive(Entry entry) {
        if (!entry.isLive()) {
            return;
        }
        liveOutstanding.computeIfPresent(entry.series(), (k, v) -> v > 1 ? v - 1 : null);
    }

    private synchronized boolean isStopped() {
        return stopped;
    }

    private void notifySuccess(TaskListener current, Entry entry, TaskOutcome outcome) {
        try {
            current.onSuccess(entry.task(), entry.attempt(), outcome);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Success listener threw for {}: {}", entry.task(), e.getMessage(), e);
        }
    }

    private void notifyFailure(TaskListener current, Entry entry, Throwable failure, boolean retrying) {
        try {
            current.onFailure(entry.task(), entry.attempt(), failure, retrying);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Failure listener threw for {}: {}", entry.task(), e.getMessage(), e);
        }
    }

    private void notifyAbandoned(TaskListener current, Entry entry, Throwable failure) {
        try {
            current.onAbandoned(entry.task(), entry.attempt(), failure);
        } catch (RuntimeException e) {
            log.error("[Scheduler] Abandon listener threw for {}: {}", entry.task(), e.getMessage(), e);
        }
    }

    private void publishDepth() {
        int live = 0;
        int backfill = 0;
        for (Entry e : queue) {
            if (e.isLive()) {
                live++;
            } else {
                backfill++;
            }
        }
        metrics.recordQueueDepth(TaskPriority.LIVE, live);
        metrics.recordQueueDepth(TaskPriority.BACKFILL, backfill);
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
