package in.candlevault.domain.data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Set operations over lists of half-open ranges.
 */
public final class TimeRanges {

    /**
     * Parts of {@code ranges} not covered by any of {@code remove}. Result is sorted.
     */
    public static List<TimeRange> subtract(List<TimeRange> ranges, List<TimeRange> remove) {
        List<TimeRange> sortedRemove = sorted(remove);
        List<TimeRange> result = new ArrayList<>();
        for (TimeRange range : sorted(ranges)) {
            Instant cursor = range.start();
            for (TimeRange r : sortedRemove) {
                if (!r.end().isAfter(cursor) || !r.start().isBefore(range.end())) {
                    continue;
                }
                if (r.start().isAfter(cursor)) {
                    result.add(new TimeRange(cursor, r.start()));
                }
                if (r.end().isAfter(cursor)) {
                    cursor = r.end();
                }
                if (!cursor.isBefore(range.end())) {
                    break;
                }
            }
            if (cursor.isBefore(range.end())) {
                result.add(new TimeRange(cursor, range.end()));
            }
        }
        return result;
    }

    /**
     * Non-empty intersections of {@code range} with each of {@code ranges}, sorted.
     */
    public static List<TimeRange> intersect(TimeRange range, List<TimeRange> ranges) {
        List<TimeRange> result = new ArrayList<>();
        for (TimeRange r : sorted(ranges)) {
            Instant start = r.start().isAfter(range.start()) ? r.start() : range.start();
            Instant end = r.end().isBefore(range.end()) ? r.end() : range.end();
            if (end.isAfter(start)) {
                result.add(new TimeRange(start, end));
            }
        }
        return result;
    }

    /**
     * Split {@code range} into consecutive pieces of at most {@code maxIntervals} intervals.
     */
    public static List<TimeRange> chunk(TimeRange range, Interval interval, int maxIntervals) {
        List<TimeRange> chunks = new ArrayList<>();
        Instant cursor = range.start();
        while (cursor.isBefore(range.end())) {
            Instant next = cursor.plus(interval.getDuration().multipliedBy(maxIntervals));
            if (next.isAfter(range.end())) {
                next = range.end();
            }
            chunks.add(new TimeRange(cursor, next));
            cursor = next;
        }
        return chunks;
    }

    private static List<TimeRange> sorted(List<TimeRange> ranges) {
        List<TimeRange> copy = new ArrayList<>(ranges);
        copy.sort(Comparator.comparing(TimeRange::start));
        return copy;
    }

    private TimeRanges() {}
}
