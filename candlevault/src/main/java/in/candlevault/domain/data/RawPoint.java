package in.candlevault.domain.data;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Unvalidated OHLCV row as returned by a source adapter.
 */
public record RawPoint(
    Instant timestamp,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume
) {
    public static RawPoint of(Instant timestamp, String open, String high, String low, String close, String volume) {
        return new RawPoint(timestamp,
            new BigDecimal(open), new BigDecimal(high), new BigDecimal(low),
            new BigDecimal(close), new BigDecimal(volume));
    }
}
