package in.candlevault.service.gap;

import in.candlevault.application.monitoring.AlertService;
import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.Gap;
import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.TimeRange;
import in.candlevault.domain.data.TimeRanges;
import in.candlevault.domain.monitoring.Alert;
import in.candlevault.domain.monitoring.AlertLevel;
import in.candlevault.domain.repository.DataPointRepository;
import in.candlevault.domain.repository.GapRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Turns PENDING gaps into backfill work.
 *
 * Flow:
 * 1. Claim PENDING gaps oldest first, keeping at most {@code maxActiveGaps} active
 * 2. Mark them IN_PROGRESS and emit one BACKFILL task per chunk of at most
 *    {@code chunkIntervals} intervals
 * 3. Count every failed chunk attempt against the gap; at {@code maxAttempts}
 *    the gap is FAILED and its remaining chunks are dropped
 * 4. When every chunk has settled, re-check coverage: RESOLVED if complete,
 *    otherwise back to PENDING for the next detection pass
 *
 * FAILED gaps are only retried after {@link #requeue(String)}. IN_PROGRESS gaps
 * left behind by a previous run are returned to PENDING on the next claim pass.
 */
public class RecoveryOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(RecoveryOrchestrator.class);

    private final GapRepository gaps;
    private final DataPointRepository points;
    private final Consumer<FetchTask> submitter;
    private final int maxActiveGaps;
    private final int chunkIntervals;
    private final int maxAttempts;
    private final Clock clock;
    private final AlertService alerts;

    /** Active gap id to number of chunks not yet settled. */
    private final Map<String, Integer> outstanding = new HashMap<>();

    public RecoveryOrchestrator(GapRepository gaps, DataPointRepository points, Consumer<FetchTask> submitter,
                                int maxActiveGaps, int chunkIntervals, int maxAttempts,
                                Clock clock, AlertService alerts) {
        this.gaps = gaps;
        this.points = points;
        this.submitter = submitter;
        this.maxActiveGaps = maxActiveGaps;
        this.chunkIntervals = chunkIntervals;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
        this.alerts = alerts;
    }

    /**
     * Claim pending gaps up to the concurrency limit and submit their chunks.
     *
     * @return number of gaps claimed
     */
    public synchronized int scheduleRecovery() {
        releaseOrphans();
        int capacity = maxActiveGaps - outstanding.size();
        if (capacity <= 0) {
            return 0;
        }

        List<Gap> pending = gaps.findByStatus(GapStatus.PENDING);
        int claimed = 0;
        for (Gap gap : pending) {
            if (claimed >= capacity) {
                break;
            }
            if (outstanding.containsKey(gap.id())) {
                continue;
            }
            Gap inProgress = gap.withStatus(GapStatus.IN_PROGRESS);
            gaps.saveGap(inProgress);

            List<TimeRange> chunks = TimeRanges.chunk(gap.range(), gap.interval(), chunkIntervals);
            outstanding.put(gap.id(), chunks.size());
            log.info("[Recovery] Claimed gap {} {} {} ({} intervals, {} chunk(s), attempts so far {})",
                gap.id(), gap.series(), gap.range(), gap.missingIntervals(), chunks.size(), gap.attemptCount());

            try {
                for (TimeRange chunk : chunks) {
                    submitter.accept(FetchTask.backfill(gap.series(), chunk, gap.id()));
                }
            } catch (RuntimeException e) {
                log.error("[Recovery] Could not submit chunks for gap {}: {}", gap.id(), e.getMessage(), e);
                outstanding.remove(gap.id());
                gaps.findById(gap.id()).ifPresent(g -> gaps.saveGap(g.withStatus(GapStatus.PENDING)));
                throw e;
            }
            claimed++;
        }
        return claimed;
    }

    /**
     * Whether chunks of this gap should still run.
     */
    public synchronized boolean isActive(String gapId) {
        return outstanding.containsKey(gapId);
    }

    public synchronized int activeGapCount() {
        return outstanding.size();
    }

    public synchronized void onChunkSucceeded(FetchTask task) {
        settleChunk(task.gapId());
    }

    /**
     * A chunk attempt failed. Counts against the gap whether or not the chunk is retried.
     */
    public synchronized void onChunkFailed(FetchTask task, Throwable failure) {
        String gapId = task.gapId();
        if (!outstanding.containsKey(gapId)) {
            return;
        }
        Optional<Gap> current = gaps.findById(gapId);
        if (current.isEmpty()) {
            outstanding.remove(gapId);
            return;
        }

        Instant now = clock.instant();
        Gap updated = current.get().withFailedAttempt(now, failure.getMessage());
        if (updated.attemptCount() >= maxAttempts) {
            gaps.saveGap(updated.withStatus(GapStatus.FAILED));
            outstanding.remove(gapId);
            log.error("[Recovery] Gap {} {} {} FAILED after {} attempts: {}",
                gapId, updated.series(), updated.range(), updated.attemptCount(), failure.getMessage());
            alerts.sendAlert(Alert.builder()
                .alertType("GAP_FAILED")
                .level(AlertLevel.MEDIUM)
                .message("Gap " + updated.range() + " for " + updated.series() + " failed after "
                    + updated.attemptCount() + " attempts")
                .timestamp(now)
                .detail("gapId", gapId)
                .detail("lastError", String.valueOf(failure.getMessage()))
                .build());
            return;
        }
        gaps.saveGap(updated);
        log.warn("[Recovery] Gap {} chunk {} failed (attempt {}/{}): {}",
            gapId, task.range(), updated.attemptCount(), maxAttempts, failure.getMessage());
    }

    /**
     * A chunk will not be retried any more.
     */
    public synchronized void onChunkAbandoned(FetchTask task) {
        settleChunk(task.gapId());
    }

    /**
     * Move a FAILED gap back to PENDING with its attempt count reset.
     *
     * @return the requeued gap, or empty if the gap is unknown or not FAILED
     */
    public synchronized Optional<Gap> requeue(String gapId) {
        Optional<Gap> gap = gaps.findById(gapId);
        if (gap.isEmpty() || gap.get().status() != GapStatus.FAILED) {
            return Optional.empty();
        }
        Gap requeued = gap.get().requeued();
        gaps.saveGap(requeued);
        log.info("[Recovery] Gap {} {} {} requeued", gapId, requeued.series(), requeued.range());
        return Optional.of(requeued);
    }

    /**
     * IN_PROGRESS gaps with no chunks tracked here were claimed by an earlier
     * process; return them to PENDING.
     */
    private void releaseOrphans() {
        for (Gap gap : gaps.findByStatus(GapStatus.IN_PROGRESS)) {
            if (!outstanding.containsKey(gap.id())) {
                gaps.saveGap(gap.withStatus(GapStatus.PENDING));
                log.warn("[Recovery] Gap {} {} {} was IN_PROGRESS without active chunks, back to PENDING",
                    gap.id(), gap.series(), gap.range());
            }
        }
    }

    private void settleChunk(String gapId) {
        Integer remaining = outstanding.get(gapId);
        if (remaining == null) {
            return;
        }
        if (remaining > 1) {
            outstanding.put(gapId, remaining - 1);
            return;
        }
        outstanding.remove(gapId);

        Optional<Gap> current = gaps.findById(gapId);
        if (current.isEmpty() || current.get().status() != GapStatus.IN_PROGRESS) {
            return;
        }
        Gap gap = current.get();
        long stored = points.countRange(gap.symbol(), gap.interval(), gap.start(), gap.end());
        long expected = gap.missingIntervals();
        if (stored >= expected) {
            gaps.saveGap(gap.withStatus(GapStatus.RESOLVED));
            log.info("[Recovery] Gap {} {} {} RESOLVED", gapId, gap.series(), gap.range());
        } else {
            gaps.saveGap(gap.withStatus(GapStatus.PENDING));
            log.info("[Recovery] Gap {} {} {} partially filled ({}/{}), back to PENDING",
                gapId, gap.series(), gap.range(), stored, expected);
        }
    }
}
