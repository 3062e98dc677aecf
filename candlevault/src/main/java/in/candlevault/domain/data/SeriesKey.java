package in.candlevault.domain.data;

import java.util.Objects;

/**
 * A (symbol, interval) pair: the unit of ordering and gap detection.
 */
public record SeriesKey(String symbol, Interval interval) {

    public SeriesKey {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(interval, "interval");
        if (symbol.isBlank()) {
            throw new IllegalArgumentException("symbol must not be blank");
        }
    }

    public static SeriesKey of(String symbol, Interval interval) {
        return new SeriesKey(symbol, interval);
    }

    @Override
    public String toString() {
        return symbol + "/" + interval.getCode();
    }
}
