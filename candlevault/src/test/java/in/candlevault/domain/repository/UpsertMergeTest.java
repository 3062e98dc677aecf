package in.candlevault.domain.repository;

import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.RawPoint;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static in.candlevault.testutil.TestData.BTC_1H;
import static in.candlevault.testutil.TestData.T0;
import static in.candlevault.testutil.TestData.raw;
import static in.candlevault.testutil.TestData.stored;
import static org.junit.jupiter.api.Assertions.*;

class UpsertMergeTest {

    private final RawPoint point = raw(T0, "100");

    @Test
    void testNewPointIsStored() {
        DataPoint incoming = stored(BTC_1H, point, "binance", 0.8);

        UpsertMerge.Decision decision = UpsertMerge.merge(null, incoming);

        assertEquals(UpsertResult.STORED, decision.result());
        assertSame(incoming, decision.point());
    }

    @Test
    void testSameValuesSameSourceIsUnchanged() {
        DataPoint existing = stored(BTC_1H, point, "binance", 0.8);

        UpsertMerge.Decision decision = UpsertMerge.merge(existing, stored(BTC_1H, point, "binance", 0.8));

        assertEquals(UpsertResult.UNCHANGED, decision.result());
        assertSame(existing, decision.point());
    }

    @Test
    void testSameValuesUnionConfirmationsAndKeepHigherQuality() {
        DataPoint existing = stored(BTC_1H, point, "binance", 0.8);
        DataPoint confirmed = existing.withConfirmation("bybit", 0.9);

        UpsertMerge.Decision decision = UpsertMerge.merge(existing, confirmed);

        assertEquals(UpsertResult.STORED, decision.result());
        assertEquals(Set.of("binance", "bybit"), decision.point().confirmedBy());
        assertEquals(0.9, decision.point().qualityScore(), 1e-9);
        assertEquals("binance", decision.point().sourceId(), "Origin source is kept");
    }

    @Test
    void testQualityNeverDecreases() {
        DataPoint existing = stored(BTC_1H, point, "binance", 0.9);

        UpsertMerge.Decision decision = UpsertMerge.merge(existing, stored(BTC_1H, point, "bybit", 0.8));

        assertEquals(UpsertResult.STORED, decision.result(), "New confirmation is still recorded");
        assertEquals(0.9, decision.point().qualityScore(), 1e-9);
    }

    @Test
    void testDifferentValuesWithLowerOrEqualQualityConflict() {
        DataPoint existing = stored(BTC_1H, point, "binance", 0.8);
        DataPoint other = stored(BTC_1H, raw(T0, "105"), "bybit", 0.8);

        UpsertMerge.Decision decision = UpsertMerge.merge(existing, other);

        assertEquals(UpsertResult.CONFLICT, decision.result());
        assertSame(existing, decision.point());
    }

    @Test
    void testDifferentValuesWithHigherQualityConflict() {
        DataPoint existing = stored(BTC_1H, point, "binance", 0.8);
        DataPoint better = stored(BTC_1H, raw(T0, "105"), "bybit", 0.95);

        UpsertMerge.Decision decision = UpsertMerge.merge(existing, better);

        assertEquals(UpsertResult.CONFLICT, decision.result(), "Stored values are never rewritten");
        assertSame(existing, decision.point());
        assertEquals(0.8, decision.point().qualityScore(), 1e-9);
    }
}
