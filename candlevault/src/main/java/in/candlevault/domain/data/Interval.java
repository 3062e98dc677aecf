package in.candlevault.domain.data;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed sampling granularities supported by the ingestion engine.
 *
 * Every stored timestamp is aligned to the interval grid, counted in whole
 * intervals from the Unix epoch (UTC).
 */
public enum Interval {
    MINUTE_1("1m", Duration.ofMinutes(1)),
    MINUTE_5("5m", Duration.ofMinutes(5)),
    MINUTE_15("15m", Duration.ofMinutes(15)),
    MINUTE_30("30m", Duration.ofMinutes(30)),
    HOUR_1("1h", Duration.ofHours(1)),
    HOUR_4("4h", Duration.ofHours(4)),
    DAY_1("1d", Duration.ofDays(1));

    private final String code;
    private final Duration duration;

    Interval(String code, Duration duration) {
        this.code = code;
        this.duration = duration;
    }

    public String getCode() {
        return code;
    }

    public Duration getDuration() {
        return duration;
    }

    public long getMillis() {
        return duration.toMillis();
    }

    /**
     * Floor a timestamp to the start of the interval containing it.
     */
    public Instant align(Instant instant) {
        long millis = getMillis();
        long epochMillis = instant.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(epochMillis, millis) * millis);
    }

    public boolean isAligned(Instant instant) {
        return instant.getNano() % 1_000_000 == 0
            && Math.floorMod(instant.toEpochMilli(), getMillis()) == 0;
    }

    /**
     * Timestamp of the most recent interval that has fully closed at {@code now}.
     */
    public Instant lastClosed(Instant now) {
        return align(now).minus(duration);
    }

    /**
     * Number of aligned timestamps in the half-open range [start, end).
     */
    public long countBetween(Instant start, Instant end) {
        if (!end.isAfter(start)) {
            return 0;
        }
        return (end.toEpochMilli() - start.toEpochMilli() + getMillis() - 1) / getMillis();
    }

    public static Interval fromCode(String code) {
        for (Interval interval : values()) {
            if (interval.code.equalsIgnoreCase(code) || interval.name().equalsIgnoreCase(code)) {
                return interval;
            }
        }
        throw new IllegalArgumentException("Unknown interval: " + code);
    }
}
