package in.candlevault.domain.data;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A contiguous range of expected but missing timestamps for one series.
 *
 * Immutable; state changes produce copies through the {@code with*} methods.
 */
public record Gap(
    String id,
    String symbol,
    Interval interval,
    Instant start,
    Instant end,
    GapStatus status,
    int attemptCount,
    Instant detectedAt,
    Instant lastAttemptAt,
    String lastError
) {
    public Gap {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Gap range must be non-empty: [" + start + ", " + end + ")");
        }
    }

    public static Gap pending(SeriesKey series, TimeRange range, Instant detectedAt) {
        return new Gap(UUID.randomUUID().toString(), series.symbol(), series.interval(),
            range.start(), range.end(), GapStatus.PENDING, 0, detectedAt, null, null);
    }

    public SeriesKey series() {
        return new SeriesKey(symbol, interval);
    }

    public TimeRange range() {
        return new TimeRange(start, end);
    }

    public long missingIntervals() {
        return interval.countBetween(start, end);
    }

    public Gap withStatus(GapStatus newStatus) {
        return new Gap(id, symbol, interval, start, end, newStatus, attemptCount, detectedAt, lastAttemptAt, lastError);
    }

    public Gap withRange(TimeRange range) {
        return new Gap(id, symbol, interval, range.start(), range.end(), status, attemptCount, detectedAt, lastAttemptAt, lastError);
    }

    /**
     * Same gap data under a fresh id, used when a stored gap is split in two.
     */
    public Gap splitOff(TimeRange range) {
        return new Gap(UUID.randomUUID().toString(), symbol, interval, range.start(), range.end(),
            status, attemptCount, detectedAt, lastAttemptAt, lastError);
    }

    public Gap withFailedAttempt(Instant at, String error) {
        return new Gap(id, symbol, interval, start, end, status, attemptCount + 1, detectedAt, at, error);
    }

    public Gap requeued() {
        return new Gap(id, symbol, interval, start, end, GapStatus.PENDING, 0, detectedAt, lastAttemptAt, lastError);
    }
}
