package in.candlevault.service.gap;

import in.candlevault.domain.data.Gap;
import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TimeRange;
import in.candlevault.domain.data.TimeRanges;
import in.candlevault.domain.repository.DataPointRepository;
import in.candlevault.domain.repository.GapRepository;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Finds missing time ranges in stored series and keeps the gap set in sync.
 *
 * Expected timestamps run from the aligned collection start through the last
 * closed interval ({@code align(now) - interval}). Contiguous missing
 * timestamps form one half-open range.
 *
 * Scanning never touches FAILED or IN_PROGRESS gaps. PENDING gaps are
 * narrowed, split or resolved to match what is still missing, keeping their
 * attempt counts. Repeated scans with no writes in between change nothing.
 */
public class GapDetector {
    private static final Logger log = LoggerFactory.getLogger(GapDetector.class);

    /**
     * Changes made by one scan.
     */
    public record ScanResult(SeriesKey series, int created, int updated, int resolved, List<Gap> pending) {
        public boolean changed() {
            return created + updated + resolved > 0;
        }
    }

    /**
     * Coverage report for a series.
     */
    public record Completeness(SeriesKey series, Instant from, Instant to, long expected, long stored,
                               double ratio, int pendingGaps, int inProgressGaps, int failedGaps) {
    }

    private final DataPointRepository points;
    private final GapRepository gaps;
    private final Instant collectionStart;
    private final Duration maxBackfillAge;
    private final Clock clock;
    private final IngestionMetrics metrics;

    public GapDetector(DataPointRepository points, GapRepository gaps, Instant collectionStart,
                       Duration maxBackfillAge, Clock clock, IngestionMetrics metrics) {
        this.points = points;
        this.gaps = gaps;
        this.collectionStart = collectionStart;
        this.maxBackfillAge = maxBackfillAge;
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * First expected timestamp: the collection start (clamped to the maximum
     * backfill age) rounded up to the interval grid.
     */
    public Instant firstExpected(Interval interval, Instant now) {
        Instant earliest = now.minus(maxBackfillAge);
        Instant start = collectionStart.isBefore(earliest) ? earliest : collectionStart;
        Instant aligned = interval.align(start);
        return aligned.isBefore(start) ? aligned.plus(interval.getDuration()) : aligned;
    }

    /**
     * Missing ranges for the series as of {@code now}, ascending.
     */
    public List<TimeRange> findMissingRanges(SeriesKey series, Instant now) {
        Interval interval = series.interval();
        Instant start = firstExpected(interval, now);
        Instant end = interval.align(now);
        List<TimeRange> missing = new ArrayList<>();
        if (!end.isAfter(start)) {
            return missing;
        }

        Instant expected = start;
        for (Instant ts : points.findTimestamps(series.symbol(), interval, start, end)) {
            if (ts.isBefore(expected) || !interval.isAligned(ts)) {
                continue;
            }
            if (ts.isAfter(expected)) {
                missing.add(new TimeRange(expected, ts));
            }
            expected = ts.plus(interval.getDuration());
        }
        if (expected.isBefore(end)) {
            missing.add(new TimeRange(expected, end));
        }
        return missing;
    }

    public ScanResult scan(SeriesKey series) {
        Instant now = clock.instant();
        List<TimeRange> computed = findMissingRanges(series, now);
        List<Gap> stored = gaps.listGaps(series.symbol(), series.interval(), null);

        List<TimeRange> blocked = new ArrayList<>();
        List<Gap> pending = new ArrayList<>();
        for (Gap gap : stored) {
            if (gap.status() == GapStatus.FAILED || gap.status() == GapStatus.IN_PROGRESS) {
                blocked.add(gap.range());
            } else if (gap.status() == GapStatus.PENDING) {
                pending.add(gap);
            }
        }
        List<TimeRange> target = TimeRanges.subtract(computed, blocked);

        int created = 0;
        int updated = 0;
        int resolved = 0;
        List<Gap> result = new ArrayList<>();
        List<TimeRange> covered = new ArrayList<>();

        for (Gap gap : pending) {
            List<TimeRange> pieces = TimeRanges.intersect(gap.range(), target);
            if (pieces.isEmpty()) {
                gaps.saveGap(gap.withStatus(GapStatus.RESOLVED));
                resolved++;
                log.info("[GapDetector] {} gap {} {} resolved", series, gap.id(), gap.range());
                continue;
            }
            for (int i = 0; i < pieces.size(); i++) {
                TimeRange piece = pieces.get(i);
                covered.add(piece);
                Gap next = i == 0 ? gap.withRange(piece) : gap.splitOff(piece);
                if (i > 0 || !piece.equals(gap.range())) {
                    gaps.saveGap(next);
                    updated++;
                }
                result.add(next);
            }
        }

        for (TimeRange range : TimeRanges.subtract(target, covered)) {
            Gap gap = Gap.pending(series, range, now);
            gaps.saveGap(gap);
            result.add(gap);
            created++;
            log.info("[GapDetector] {} new gap {} ({} intervals)", series, range, gap.missingIntervals());
        }

        ScanResult scanResult = new ScanResult(series, created, updated, resolved, List.copyOf(result));
        if (scanResult.changed()) {
            log.info("[GapDetector] {} scan: created={}, updated={}, resolved={}, pending={}",
                series, created, updated, resolved, result.size());
        } else {
            log.debug("[GapDetector] {} scan: no changes ({} pending)", series, result.size());
        }
        publishCounts(series);
        return scanResult;
    }

    public Completeness completeness(SeriesKey series) {
        Instant now = clock.instant();
        Interval interval = series.interval();
        Instant from = firstExpected(interval, now);
        Instant to = interval.align(now);
        long expected = interval.countBetween(from, to);
        long stored = expected == 0 ? 0 : points.countRange(series.symbol(), interval, from, to);
        Map<GapStatus, Integer> counts = countByStatus(series);
        return new Completeness(series, from, to, expected, stored,
            expected == 0 ? 1.0 : (double) stored / expected,
            counts.get(GapStatus.PENDING), counts.get(GapStatus.IN_PROGRESS), counts.get(GapStatus.FAILED));
    }

    private void publishCounts(SeriesKey series) {
        countByStatus(series).forEach((status, count) -> metrics.recordGapCount(series, status, count));
    }

    private Map<GapStatus, Integer> countByStatus(SeriesKey series) {
        Map<GapStatus, Integer> counts = new EnumMap<>(GapStatus.class);
        for (GapStatus status : GapStatus.values()) {
            counts.put(status, 0);
        }
        for (Gap gap : gaps.listGaps(series.symbol(), series.interval(), null)) {
            counts.merge(gap.status(), 1, Integer::sum);
        }
        return counts;
    }
}
