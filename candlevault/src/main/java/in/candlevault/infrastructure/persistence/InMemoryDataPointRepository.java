package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.repository.DataPointRepository;
import in.candlevault.domain.repository.UpsertMerge;
import in.candlevault.domain.repository.UpsertResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory data point store, one sorted map per series.
 */
public final class InMemoryDataPointRepository implements DataPointRepository {

    private final Map<SeriesKey, ConcurrentSkipListMap<Instant, DataPoint>> series = new ConcurrentHashMap<>();

    @Override
    public UpsertResult upsert(DataPoint point) {
        ConcurrentSkipListMap<Instant, DataPoint> map =
            series.computeIfAbsent(point.series(), k -> new ConcurrentSkipListMap<>());
        UpsertResult[] result = new UpsertResult[1];
        map.compute(point.timestamp(), (ts, existing) -> {
            UpsertMerge.Decision decision = UpsertMerge.merge(existing, point);
            result[0] = decision.result();
            return decision.point();
        });
        return result[0];
    }

    @Override
    public List<DataPoint> queryRange(String symbol, Interval interval, Instant start, Instant end) {
        return new ArrayList<>(slice(symbol, interval, start, end).values());
    }

    @Override
    public List<Instant> findTimestamps(String symbol, Interval interval, Instant start, Instant end) {
        return new ArrayList<>(slice(symbol, interval, start, end).keySet());
    }

    @Override
    public long countRange(String symbol, Interval interval, Instant start, Instant end) {
        return slice(symbol, interval, start, end).size();
    }

    @Override
    public Optional<Instant> findLatestTimestamp(String symbol, Interval interval) {
        ConcurrentSkipListMap<Instant, DataPoint> map = series.get(SeriesKey.of(symbol, interval));
        if (map == null || map.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(map.lastKey());
    }

    @Override
    public int deleteOlderThan(Instant cutoff) {
        int deleted = 0;
        for (ConcurrentSkipListMap<Instant, DataPoint> map : series.values()) {
            NavigableMap<Instant, DataPoint> head = map.headMap(cutoff, false);
            deleted += head.size();
            head.clear();
        }
        return deleted;
    }

    private NavigableMap<Instant, DataPoint> slice(String symbol, Interval interval, Instant start, Instant end) {
        ConcurrentSkipListMap<Instant, DataPoint> map = series.get(SeriesKey.of(symbol, interval));
        if (map == null || !end.isAfter(start)) {
            return new ConcurrentSkipListMap<>();
        }
        return map.subMap(start, true, end, false);
    }
}
