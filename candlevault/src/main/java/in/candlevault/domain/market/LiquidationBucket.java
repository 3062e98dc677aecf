package in.candlevault.domain.market;

import in.candlevault.domain.data.Interval;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Liquidations of one symbol summed over one aligned interval, split by side.
 * Keyed by (symbol, interval, bucketStart).
 */
public record LiquidationBucket(
    String symbol,
    Interval interval,
    Instant bucketStart,
    int longCount,
    int shortCount,
    BigDecimal longQuantity,
    BigDecimal shortQuantity,
    BigDecimal longNotional,
    BigDecimal shortNotional
) {
    public LiquidationBucket {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(interval, "interval");
        if (!interval.isAligned(bucketStart)) {
            throw new IllegalArgumentException("Bucket start " + bucketStart + " is not aligned to " + interval.getCode());
        }
    }

    public static LiquidationBucket empty(String symbol, Interval interval, Instant bucketStart) {
        return new LiquidationBucket(symbol, interval, bucketStart, 0, 0,
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public static LiquidationBucket of(LiquidationEvent event, Interval interval) {
        return empty(event.symbol(), interval, interval.align(event.tradeTime())).plus(event);
    }

    public LiquidationBucket plus(LiquidationEvent event) {
        if (!event.symbol().equals(symbol) || !interval.align(event.tradeTime()).equals(bucketStart)) {
            throw new IllegalArgumentException("Event " + event + " does not belong to bucket " + symbol + "@" + bucketStart);
        }
        if (event.side() == LiquidationSide.LONG) {
            return new LiquidationBucket(symbol, interval, bucketStart, longCount + 1, shortCount,
                longQuantity.add(event.quantity()), shortQuantity,
                longNotional.add(event.notional()), shortNotional);
        }
        return new LiquidationBucket(symbol, interval, bucketStart, longCount, shortCount + 1,
            longQuantity, shortQuantity.add(event.quantity()),
            longNotional, shortNotional.add(event.notional()));
    }

    /**
     * Sum of two partial buckets of the same key, e.g. before and after a restart.
     */
    public LiquidationBucket merge(LiquidationBucket other) {
        if (!sameKey(other)) {
            throw new IllegalArgumentException("Cannot merge buckets of different keys");
        }
        return new LiquidationBucket(symbol, interval, bucketStart,
            longCount + other.longCount, shortCount + other.shortCount,
            longQuantity.add(other.longQuantity), shortQuantity.add(other.shortQuantity),
            longNotional.add(other.longNotional), shortNotional.add(other.shortNotional));
    }

    public boolean sameKey(LiquidationBucket other) {
        return symbol.equals(other.symbol) && interval == other.interval && bucketStart.equals(other.bucketStart);
    }

    public int totalCount() {
        return longCount + shortCount;
    }

    public BigDecimal totalNotional() {
        return longNotional.add(shortNotional);
    }
}
