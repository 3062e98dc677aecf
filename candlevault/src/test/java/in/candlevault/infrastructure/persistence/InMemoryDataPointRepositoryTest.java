package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.repository.UpsertResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static in.candlevault.testutil.TestData.BTC_1H;
import static in.candlevault.testutil.TestData.T0;
import static in.candlevault.testutil.TestData.raw;
import static in.candlevault.testutil.TestData.stored;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemoryDataPointRepository.
 *
 * Tests:
 * - Upsert outcomes follow the merge rule
 * - Range queries are half-open and ordered
 * - Series are isolated
 * - Retention pruning
 */
class InMemoryDataPointRepositoryTest {

    private InMemoryDataPointRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryDataPointRepository();
    }

    private static Instant hour(int h) {
        return T0.plus(Duration.ofHours(h));
    }

    @Test
    void testUpsertIsIdempotent() {
        DataPoint point = stored(BTC_1H, raw(T0, "100"), "binance", 0.8);

        assertEquals(UpsertResult.STORED, repository.upsert(point));
        assertEquals(UpsertResult.UNCHANGED, repository.upsert(point));
        assertEquals(1, repository.countRange("BTCUSDT", Interval.HOUR_1, T0, hour(1)));
    }

    @Test
    void testConfirmationMergedIntoStoredPoint() {
        repository.upsert(stored(BTC_1H, raw(T0, "100"), "binance", 0.8));

        UpsertResult result = repository.upsert(stored(BTC_1H, raw(T0, "100"), "bybit", 0.9));

        assertEquals(UpsertResult.STORED, result);
        DataPoint merged = repository.queryRange("BTCUSDT", Interval.HOUR_1, T0, hour(1)).get(0);
        assertEquals("binance", merged.sourceId());
        assertEquals(Set.of("binance", "bybit"), merged.confirmedBy());
        assertEquals(0.9, merged.qualityScore(), 1e-9);
    }

    @Test
    void testLowerQualityDifferentValuesConflict() {
        repository.upsert(stored(BTC_1H, raw(T0, "100"), "binance", 0.9));

        assertEquals(UpsertResult.CONFLICT, repository.upsert(stored(BTC_1H, raw(T0, "105"), "bybit", 0.8)));
        assertEquals(0, repository.queryRange("BTCUSDT", Interval.HOUR_1, T0, hour(1)).get(0)
            .close().compareTo(raw(T0, "100").close()));
    }

    @Test
    void testRangeIsHalfOpenAndOrdered() {
        for (int h : new int[]{3, 0, 2, 1}) {
            repository.upsert(stored(BTC_1H, raw(hour(h), "100"), "binance", 0.8));
        }

        List<Instant> timestamps = repository.findTimestamps("BTCUSDT", Interval.HOUR_1, hour(0), hour(3));

        assertEquals(List.of(hour(0), hour(1), hour(2)), timestamps);
        assertEquals(hour(3), repository.findLatestTimestamp("BTCUSDT", Interval.HOUR_1).orElseThrow());
        assertTrue(repository.queryRange("BTCUSDT", Interval.HOUR_1, hour(3), hour(3)).isEmpty());
    }

    @Test
    void testSeriesIsolated() {
        SeriesKey eth = SeriesKey.of("ETHUSDT", Interval.HOUR_1);
        SeriesKey btcDaily = SeriesKey.of("BTCUSDT", Interval.DAY_1);
        repository.upsert(stored(BTC_1H, raw(T0, "100"), "binance", 0.8));
        repository.upsert(stored(eth, raw(T0, "5"), "binance", 0.8));
        repository.upsert(stored(btcDaily, raw(T0, "100"), "binance", 0.8));

        assertEquals(1, repository.countRange("BTCUSDT", Interval.HOUR_1, T0, hour(24)));
        assertEquals(1, repository.countRange("ETHUSDT", Interval.HOUR_1, T0, hour(24)));
        assertTrue(repository.findLatestTimestamp("SOLUSDT", Interval.HOUR_1).isEmpty());
    }

    @Test
    void testDeleteOlderThan() {
        for (int h = 0; h < 5; h++) {
            repository.upsert(stored(BTC_1H, raw(hour(h), "100"), "binance", 0.8));
        }

        int deleted = repository.deleteOlderThan(hour(3));

        assertEquals(3, deleted);
        assertEquals(List.of(hour(3), hour(4)), repository.findTimestamps("BTCUSDT", Interval.HOUR_1, T0, hour(5)));
    }
}
