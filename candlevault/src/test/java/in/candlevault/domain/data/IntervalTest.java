package in.candlevault.domain.data;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class IntervalTest {

    @Test
    void testAlignFloorsToGrid() {
        Instant ts = Instant.parse("2024-03-05T13:47:12Z");

        assertEquals(Instant.parse("2024-03-05T13:00:00Z"), Interval.HOUR_1.align(ts));
        assertEquals(Instant.parse("2024-03-05T12:00:00Z"), Interval.HOUR_4.align(ts));
        assertEquals(Instant.parse("2024-03-05T13:45:00Z"), Interval.MINUTE_15.align(ts));
        assertEquals(Instant.parse("2024-03-05T00:00:00Z"), Interval.DAY_1.align(ts));
    }

    @Test
    void testIsAligned() {
        assertTrue(Interval.HOUR_1.isAligned(Instant.parse("2024-03-05T13:00:00Z")));
        assertFalse(Interval.HOUR_1.isAligned(Instant.parse("2024-03-05T13:00:01Z")));
        assertFalse(Interval.HOUR_1.isAligned(Instant.parse("2024-03-05T13:00:00.000000500Z")),
            "Sub-millisecond offsets are off-grid");
    }

    @Test
    void testLastClosed() {
        Instant now = Instant.parse("2024-03-05T13:20:00Z");
        assertEquals(Instant.parse("2024-03-05T12:00:00Z"), Interval.HOUR_1.lastClosed(now),
            "The 13:00 interval is still open at 13:20");
    }

    @Test
    void testCountBetween() {
        Instant start = Instant.parse("2024-01-01T00:00:00Z");

        assertEquals(24, Interval.HOUR_1.countBetween(start, start.plusSeconds(24 * 3600)));
        assertEquals(0, Interval.HOUR_1.countBetween(start, start));
        assertEquals(1, Interval.HOUR_1.countBetween(start, start.plusSeconds(60)),
            "A partial interval still contains one aligned timestamp");
    }

    @Test
    void testFromCodeAcceptsCodeAndName() {
        assertEquals(Interval.HOUR_1, Interval.fromCode("1h"));
        assertEquals(Interval.MINUTE_5, Interval.fromCode("MINUTE_5"));
        assertEquals(Interval.DAY_1, Interval.fromCode("1D"));
        assertThrows(IllegalArgumentException.class, () -> Interval.fromCode("2h"));
    }
}
