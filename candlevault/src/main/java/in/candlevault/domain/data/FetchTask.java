package in.candlevault.domain.data;

import java.util.Objects;

/**
 * A single unit of fetch work. Ephemeral, never persisted.
 *
 * @param gapId owning gap for GAP-origin tasks, null otherwise
 */
public record FetchTask(
    SeriesKey series,
    TimeRange range,
    TaskPriority priority,
    TaskOrigin origin,
    String gapId
) {
    public FetchTask {
        Objects.requireNonNull(series, "series");
        Objects.requireNonNull(range, "range");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(origin, "origin");
        if (origin == TaskOrigin.GAP && gapId == null) {
            throw new IllegalArgumentException("GAP task requires a gap id");
        }
    }

    public static FetchTask live(SeriesKey series, TimeRange range) {
        return new FetchTask(series, range, TaskPriority.LIVE, TaskOrigin.LIVE_LOOP, null);
    }

    public static FetchTask backfill(SeriesKey series, TimeRange range, String gapId) {
        return new FetchTask(series, range, TaskPriority.BACKFILL, TaskOrigin.GAP, gapId);
    }

    public static FetchTask reconciliation(SeriesKey series, TimeRange range) {
        return new FetchTask(series, range, TaskPriority.BACKFILL, TaskOrigin.RECONCILIATION, null);
    }

    public long expectedPoints() {
        return series.interval().countBetween(range.start(), range.end());
    }

    @Override
    public String toString() {
        return priority + " " + series + " " + range + (gapId != null ? " gap=" + gapId : "");
    }
}
