package in.candlevault.application.service;

import in.candlevault.application.monitoring.AlertService;
import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TaskOrigin;
import in.candlevault.domain.data.TaskPriority;
import in.candlevault.domain.data.TimeRange;
import in.candlevault.domain.error.SourcesExhaustedException;
import in.candlevault.domain.monitoring.Alert;
import in.candlevault.domain.monitoring.AlertLevel;
import in.candlevault.infrastructure.source.SourceAdapter;
import in.candlevault.service.gap.GapDetector;
import in.candlevault.service.gap.RecoveryOrchestrator;
import in.candlevault.service.source.SourceSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Top-level ingestion loop.
 *
 * Features:
 * - LIVE task per series every live period for the most recent window
 * - Gap detection and recovery scheduling every detection period
 * - Extra detection for a series after a short or abandoned live fetch
 * - HIGH alert when no capable source is usable for a series
 * - Per-series failure containment; only {@link #stop()} ends the loops
 *
 * Usage:
 * <pre>
 * IngestionCoordinator coordinator = new IngestionCoordinator(series, livePeriod, 24,
 *     detectionPeriod, scheduler, selector, detector, orchestrator, alerts, clock);
 * coordinator.start();
 * ...
 * coordinator.stop();
 * </pre>
 */
public class IngestionCoordinator implements TaskListener {
    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final List<SeriesKey> series;
    private final Duration livePeriod;
    private final int liveLookbackIntervals;
    private final Duration detectionPeriod;
    private final Duration shutdownGrace;
    private final TaskScheduler scheduler;
    private final SourceSelector selector;
    private final GapDetector detector;
    private final RecoveryOrchestrator orchestrator;
    private final AlertService alerts;
    private final Clock clock;

    private final ScheduledExecutorService loop = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ingestion-coordinator");
        t.setDaemon(true);
        return t;
    });

    private final Set<SeriesKey> unavailable = ConcurrentHashMap.newKeySet();
    private final Set<SeriesKey> detectionRequested = ConcurrentHashMap.newKeySet();

    private volatile boolean running = false;
    private ScheduledFuture<?> liveTask;
    private ScheduledFuture<?> detectionTask;

    public IngestionCoordinator(List<SeriesKey> series, Duration livePeriod, int liveLookbackIntervals,
                                Duration detectionPeriod, Duration shutdownGrace,
                                TaskScheduler scheduler, SourceSelector selector, GapDetector detector,
                                RecoveryOrchestrator orchestrator, AlertService alerts, Clock clock) {
        this.series = List.copyOf(series);
        this.livePeriod = livePeriod;
        this.liveLookbackIntervals = liveLookbackIntervals;
        this.detectionPeriod = detectionPeriod;
        this.shutdownGrace = shutdownGrace;
        this.scheduler = scheduler;
        this.selector = selector;
        this.detector = detector;
        this.orchestrator = orchestrator;
        this.alerts = alerts;
        this.clock = clock;
    }

    public synchronized void start() {
        if (running) {
            log.warn("[Coordinator] Already running");
            return;
        }
        running = true;
        scheduler.setListener(this);

        log.info("[Coordinator] Starting: {} series, live every {}min, detection every {}min",
            series.size(), livePeriod.toMinutes(), detectionPeriod.toMinutes());

        liveTask = loop.scheduleAtFixedRate(this::runLiveCycle, 0, livePeriod.toMillis(), TimeUnit.MILLISECONDS);
        detectionTask = loop.scheduleWithFixedDelay(this::runDetectionCycle,
            0, detectionPeriod.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Stop both loops, then the scheduler with its grace period.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[Coordinator] Stopping");
        running = false;

        if (liveTask != null) {
            liveTask.cancel(false);
        }
        if (detectionTask != null) {
            detectionTask.cancel(false);
        }
        loop.shutdown();
        try {
            if (!loop.awaitTermination(10, TimeUnit.SECONDS)) {
                loop.shutdownNow();
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }

        boolean clean = scheduler.shutdown(shutdownGrace);
        log.info("[Coordinator] Stopped{}", clean ? "" : " (running tasks were interrupted)");
    }

    public boolean isRunning() {
        return running;
    }

    // ════════════════════════════════════════════════════════════════════
    // Cycles
    // ════════════════════════════════════════════════════════════════════

    void runLiveCycle() {
        Instant now = clock.instant();
        for (SeriesKey s : series) {
            try {
                if (!checkAvailability(s)) {
                    continue;
                }
                scheduler.submit(FetchTask.live(s, liveWindow(s.interval(), now)));
            } catch (RuntimeException e) {
                log.error("[Coordinator] Live cycle failed for {}: {}", s, e.getMessage(), e);
            }
        }
    }

    void runDetectionCycle() {
        for (SeriesKey s : series) {
            detectSeries(s);
        }
        scheduleRecovery();
    }

    /**
     * Range of the most recent {@code liveLookbackIntervals} closed intervals.
     */
    public TimeRange liveWindow(Interval interval, Instant now) {
        Instant end = interval.align(now);
        Instant start = end.minus(interval.getDuration().multipliedBy(liveLookbackIntervals));
        return new TimeRange(start, end);
    }

    /**
     * Queue a cross-source reconciliation of an already stored range.
     */
    public FetchTask submitReconciliation(SeriesKey s, TimeRange range) {
        Interval interval = s.interval();
        Instant start = interval.align(range.start());
        Instant end = interval.isAligned(range.end()) ? range.end() : interval.align(range.end()).plus(interval.getDuration());
        FetchTask task = FetchTask.reconciliation(s, new TimeRange(start, end));
        scheduler.submit(task);
        log.info("[Coordinator] Reconciliation queued: {}", task);
        return task;
    }

    private void detectSeries(SeriesKey s) {
        try {
            detector.scan(s);
        } catch (RuntimeException e) {
            log.error("[Coordinator] Gap detection failed for {}: {}", s, e.getMessage(), e);
        }
    }

    private void scheduleRecovery() {
        try {
            int claimed = orchestrator.scheduleRecovery();
            if (claimed > 0) {
                log.info("[Coordinator] Recovery claimed {} gap(s), {} active", claimed, orchestrator.activeGapCount());
            }
        } catch (RuntimeException e) {
            log.error("[Coordinator] Recovery scheduling failed: {}", e.getMessage(), e);
        }
    }

    private void requestDetection(SeriesKey s) {
        if (!running || !detectionRequested.add(s)) {
            return;
        }
        try {
            loop.execute(() -> {
                detectionRequested.remove(s);
                detectSeries(s);
                scheduleRecovery();
            });
        } catch (RuntimeException e) {
            detectionRequested.remove(s);
            log.debug("[Coordinator] Detection for {} not scheduled: {}", s, e.getMessage());
        }
    }

    /**
     * @return true if at least one capable source is usable; raises an alert on the transition otherwise
     */
    private boolean checkAvailability(SeriesKey s) {
        List<SourceAdapter> capable = selector.capable(s);
        if (capable.isEmpty()) {
            if (unavailable.add(s)) {
                raiseSystemic(s, "no configured source supports this series");
            }
            return false;
        }
        if (selector.anyAvailable(s)) {
            if (unavailable.remove(s)) {
                log.info("[Coordinator] {} has a usable source again", s);
            }
            return true;
        }
        if (unavailable.add(s)) {
            raiseSystemic(s, "all capable sources " + capable.stream().map(SourceAdapter::id).toList()
                + " are suspended or circuit-open");
        }
        return false;
    }

    private void raiseSystemic(SeriesKey s, String reason) {
        alerts.sendAlert(Alert.builder()
            .alertType("NO_SOURCE_AVAILABLE")
            .level(AlertLevel.HIGH)
            .message("No source available for " + s + ": " + reason)
            .timestamp(clock.instant())
            .detail("series", s.toString())
            .build());
    }

    // ════════════════════════════════════════════════════════════════════
    // Task callbacks
    // ════════════════════════════════════════════════════════════════════

    @Override
    public boolean isWanted(FetchTask task) {
        if (task.origin() == TaskOrigin.GAP) {
            return orchestrator.isActive(task.gapId());
        }
        return true;
    }

    @Override
    public void onSuccess(FetchTask task, int attempt, TaskOutcome outcome) {
        if (task.origin() == TaskOrigin.GAP) {
            orchestrator.onChunkSucceeded(task);
            return;
        }
        unavailable.remove(task.series());
        if (task.priority() == TaskPriority.LIVE && outcome.isPartial()) {
            log.info("[Coordinator] {} live fetch returned {}/{} points, running gap detection",
                task.series(), outcome.received(), outcome.expected());
            requestDetection(task.series());
        }
    }

    @Override
    public void onFailure(FetchTask task, int attempt, Throwable failure, boolean willRetry) {
        if (task.origin() == TaskOrigin.GAP) {
            orchestrator.onChunkFailed(task, failure);
        }
        if (failure instanceof SourcesExhaustedException exhausted && exhausted.noSourceAvailable()) {
            checkAvailability(task.series());
        }
    }

    @Override
    public void onAbandoned(FetchTask task, int attempt, Throwable failure) {
        if (task.origin() == TaskOrigin.GAP) {
            orchestrator.onChunkAbandoned(task);
            return;
        }
        if (task.priority() == TaskPriority.LIVE) {
            requestDetection(task.series());
        }
    }
}
