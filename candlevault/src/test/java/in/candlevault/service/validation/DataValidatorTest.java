package in.candlevault.service.validation;

import in.candlevault.domain.data.DataPoint;
import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.RawPoint;
import in.candlevault.domain.data.TimeRange;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static in.candlevault.testutil.TestData.BTC_1H;
import static in.candlevault.testutil.TestData.T0;
import static in.candlevault.testutil.TestData.hourly;
import static in.candlevault.testutil.TestData.raw;
import static in.candlevault.testutil.TestData.stored;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DataValidator.
 *
 * Tests:
 * - Structural checks reject the whole batch
 * - Cross-source confirmation within tolerance
 * - Disagreement beyond tolerance
 * - Reconciliation skips disputed points
 */
class DataValidatorTest {

    private final DataValidator validator = new DataValidator(0.0001, 0.8, 0.5);
    private final FetchTask live = FetchTask.live(BTC_1H, new TimeRange(T0, T0.plusSeconds(10 * 3600)));

    private static Map<Instant, DataPoint> index(DataPoint... points) {
        Map<Instant, DataPoint> map = new HashMap<>();
        for (DataPoint p : points) {
            map.put(p.timestamp(), p);
        }
        return map;
    }

    @Test
    void testNewPointsGetBaseQuality() {
        ValidationResult result = validator.validate(live, "binance", hourly(T0, 10, "100"), Map.of());

        assertEquals(10, result.newPoints());
        assertEquals(10, result.toStore().size());
        DataPoint first = result.toStore().get(0);
        assertEquals(0.8, first.qualityScore(), 1e-9);
        assertEquals(Set.of("binance"), first.confirmedBy());
        assertTrue(first.validated());
    }

    @Test
    void testNegativeVolumeRejectsWholeBatch() {
        List<RawPoint> batch = new ArrayList<>(hourly(T0, 3, "100"));
        RawPoint bad = batch.get(1);
        batch.set(1, new RawPoint(bad.timestamp(), bad.open(), bad.high(), bad.low(), bad.close(), new BigDecimal("-1")));

        ValidationException e = assertThrows(ValidationException.class,
            () -> validator.validate(live, "binance", batch, Map.of()));

        assertEquals(FailureKind.VALIDATION_FAILED, e.getKind());
        assertTrue(e.getViolations().get(0).contains("negative volume"));
    }

    @Test
    void testHighBelowCloseRejected() {
        RawPoint bad = RawPoint.of(T0, "100", "101", "99", "102", "5");

        assertThrows(ValidationException.class, () -> validator.validate(live, "binance", List.of(bad), Map.of()));
    }

    @Test
    void testLowAboveOpenRejected() {
        RawPoint bad = RawPoint.of(T0, "100", "101", "100.5", "100.7", "5");

        List<String> violations = validator.checkStructure(Interval.HOUR_1, List.of(bad));

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("low"));
    }

    @Test
    void testOutOfOrderAndMisalignedRejected() {
        List<String> violations = validator.checkStructure(Interval.HOUR_1, List.of(
            raw(T0.plusSeconds(3600), "100"),
            raw(T0, "100"),
            raw(T0.plusSeconds(7200 + 60), "100")));

        assertEquals(2, violations.size(), "One order violation and one grid violation: " + violations);
    }

    @Test
    void testCrossSourceConfirmationWithinTolerance() {
        DataPoint existing = stored(BTC_1H, raw(T0, "40000"), "binance", 0.8);
        // close differs by 0.005%
        RawPoint other = RawPoint.of(T0, "40000", "40002", "39999", "40002", "999");

        ValidationResult result = validator.validate(live, "bybit", List.of(other), index(existing));

        assertEquals(1, result.confirmations());
        assertEquals(0, result.newPoints());
        DataPoint confirmed = result.toStore().get(0);
        assertEquals(new BigDecimal("40000"), confirmed.close(), "Stored values are kept");
        assertEquals("binance", confirmed.sourceId());
        assertEquals(Set.of("binance", "bybit"), confirmed.confirmedBy());
        assertEquals(0.9, confirmed.qualityScore(), 1e-9, "0.8 + 0.2 * 0.5");
    }

    @Test
    void testRepeatedConfirmationIsUnchanged() {
        DataPoint existing = stored(BTC_1H, raw(T0, "100"), "binance", 0.8).withConfirmation("bybit", 0.9);

        ValidationResult result = validator.validate(live, "bybit", List.of(raw(T0, "100")), index(existing));

        assertEquals(1, result.unchanged());
        assertTrue(result.toStore().isEmpty());
    }

    @Test
    void testCrossSourceDisagreementRejected() {
        DataPoint existing = stored(BTC_1H, raw(T0, "100"), "binance", 0.8);

        ValidationException e = assertThrows(ValidationException.class,
            () -> validator.validate(live, "bybit", List.of(raw(T0, "100.5")), index(existing)));

        assertTrue(e.getViolations().get(0).contains("disagrees"));
    }

    @Test
    void testSameSourceVolumeChangeRejected() {
        DataPoint existing = stored(BTC_1H, raw(T0, "100"), "binance", 0.8);
        RawPoint changed = RawPoint.of(T0, "100", "101", "99", "100", "50");

        assertThrows(ValidationException.class,
            () -> validator.validate(live, "binance", List.of(changed), index(existing)));
    }

    @Test
    void testSameSourceIdenticalIsUnchanged() {
        DataPoint existing = stored(BTC_1H, raw(T0, "100"), "binance", 0.8);

        ValidationResult result = validator.validate(live, "binance", List.of(raw(T0, "100")), index(existing));

        assertEquals(1, result.unchanged());
        assertTrue(result.toStore().isEmpty());
    }

    @Test
    void testReconciliationSkipsDisputedPoints() {
        FetchTask reconcile = FetchTask.reconciliation(BTC_1H, new TimeRange(T0, T0.plusSeconds(2 * 3600)));
        DataPoint first = stored(BTC_1H, raw(T0, "100"), "binance", 0.8);
        DataPoint second = stored(BTC_1H, raw(T0.plusSeconds(3600), "100"), "binance", 0.8);

        ValidationResult result = validator.validate(reconcile, "bybit",
            List.of(raw(T0, "100"), raw(T0.plusSeconds(3600), "120")), index(first, second));

        assertEquals(1, result.confirmations());
        assertEquals(1, result.disputed());
        assertEquals(1, result.toStore().size());
        assertEquals(T0, result.toStore().get(0).timestamp());
    }

    @Test
    void testBoostNeverLowersQuality() {
        assertEquals(0.9, validator.boosted(0.8), 1e-9);
        assertEquals(0.95, validator.boosted(0.9), 1e-9);
        assertEquals(1.0, validator.boosted(1.0), 1e-9);
    }
}
