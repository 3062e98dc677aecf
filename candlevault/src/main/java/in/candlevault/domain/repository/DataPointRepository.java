package in.candlevault.domain.repository;

import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.Interval;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Repository for validated data points.
 *
 * Points are unique per (symbol, interval, timestamp). Upserts are
 * idempotent and follow {@link UpsertMerge}.
 */
public interface DataPointRepository {

    UpsertResult upsert(DataPoint point);

    /**
     * Upsert multiple points. Implementations may batch.
     */
    default List<UpsertResult> upsertAll(List<DataPoint> points) {
        List<UpsertResult> results = new ArrayList<>(points.size());
        for (DataPoint point : points) {
            results.add(upsert(point));
        }
        return results;
    }

    /**
     * Points in [start, end), ordered by timestamp ascending.
     */
    List<DataPoint> queryRange(String symbol, Interval interval, Instant start, Instant end);

    /**
     * Stored timestamps in [start, end), ascending.
     */
    List<Instant> findTimestamps(String symbol, Interval interval, Instant start, Instant end);

    Optional<Instant> findLatestTimestamp(String symbol, Interval interval);

    default long countRange(String symbol, Interval interval, Instant start, Instant end) {
        return findTimestamps(symbol, interval, start, end).size();
    }

    /**
     * Retention pruning. Not part of the ingestion loop.
     *
     * @return number of points deleted
     */
    int deleteOlderThan(Instant cutoff);
}
