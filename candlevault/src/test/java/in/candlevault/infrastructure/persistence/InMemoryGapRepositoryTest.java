package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.data.Gap;
import in.candlevault.domain.data.GapStatus;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.data.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static in.candlevault.testutil.TestData.BTC_1H;
import static in.candlevault.testutil.TestData.T0;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for InMemoryGapRepository.
 */
class InMemoryGapRepositoryTest {

    private final InMemoryGapRepository repository = new InMemoryGapRepository();

    private Gap gap(SeriesKey series, int fromHour, int toHour) {
        Gap gap = Gap.pending(series, new TimeRange(T0.plus(Duration.ofHours(fromHour)),
            T0.plus(Duration.ofHours(toHour))), T0);
        repository.saveGap(gap);
        return gap;
    }

    @Test
    void testListGapsOrderedAndFiltered() {
        Gap later = gap(BTC_1H, 10, 12);
        Gap earlier = gap(BTC_1H, 2, 4);
        gap(SeriesKey.of("ETHUSDT", Interval.HOUR_1), 0, 1);
        repository.saveGap(later.withStatus(GapStatus.FAILED));

        assertEquals(List.of(earlier.id(), later.id()),
            repository.listGaps("BTCUSDT", Interval.HOUR_1, null).stream().map(Gap::id).toList());
        assertEquals(List.of(later.id()),
            repository.listGaps("BTCUSDT", Interval.HOUR_1, GapStatus.FAILED).stream().map(Gap::id).toList());
    }

    @Test
    void testSaveReplacesById() {
        Gap gap = gap(BTC_1H, 0, 5);

        repository.saveGap(gap.withFailedAttempt(T0, "timeout"));

        assertEquals(1, repository.findById(gap.id()).orElseThrow().attemptCount());
        assertEquals(1, repository.findByStatus(GapStatus.PENDING).size());
        assertTrue(repository.findById("missing").isEmpty());
    }
}
