package in.candlevault.domain.data;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Validated OHLCV observation, unique per (symbol, interval, timestamp).
 *
 * Once stored only {@code validated}, {@code qualityScore} and
 * {@code confirmedBy} may change, and only upward.
 */
public record DataPoint(
    String symbol,
    Interval interval,
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    String sourceId,
    Set<String> confirmedBy,
    double qualityScore,
    boolean validated
) {
    public DataPoint {
        confirmedBy = confirmedBy == null
            ? Collections.emptySet()
            : Collections.unmodifiableSet(new TreeSet<>(confirmedBy));
    }

    public static DataPoint fromRaw(SeriesKey series, RawPoint raw, String sourceId, double qualityScore) {
        return new DataPoint(series.symbol(), series.interval(), raw.timestamp(),
            raw.open(), raw.high(), raw.low(), raw.close(), raw.volume(),
            sourceId, Set.of(sourceId), qualityScore, true);
    }

    public SeriesKey series() {
        return new SeriesKey(symbol, interval);
    }

    /**
     * Copy carrying an additional confirming source and a new quality score.
     */
    public DataPoint withConfirmation(String confirmingSource, double newQuality) {
        Set<String> sources = new TreeSet<>(confirmedBy);
        sources.add(confirmingSource);
        return new DataPoint(symbol, interval, timestamp, open, high, low, close, volume,
            sourceId, sources, Math.max(qualityScore, newQuality), true);
    }
}
