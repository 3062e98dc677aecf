package in.candlevault.domain.market;

import in.candlevault.domain.data.Interval;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.Objects;

/**
 * Order book snapshots of one symbol aggregated over one aligned interval.
 *
 * Mid price forms the OHLC; spread and depth are kept as sums so that two
 * partial candles of the same bucket merge exactly. Keyed by
 * (symbol, interval, bucketStart).
 */
public record OrderBookCandle(
    String symbol,
    Interval interval,
    Instant bucketStart,
    BigDecimal midOpen,
    BigDecimal midHigh,
    BigDecimal midLow,
    BigDecimal midClose,
    BigDecimal spreadSum,
    BigDecimal spreadMax,
    BigDecimal bidDepthSum,
    BigDecimal askDepthSum,
    int snapshotCount,
    Instant firstSnapshotAt,
    Instant lastSnapshotAt
) {
    public OrderBookCandle {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(interval, "interval");
        if (!interval.isAligned(bucketStart)) {
            throw new IllegalArgumentException("Bucket start " + bucketStart + " is not aligned to " + interval.getCode());
        }
        if (snapshotCount < 1) {
            throw new IllegalArgumentException("A candle needs at least one snapshot");
        }
    }

    public static OrderBookCandle of(OrderBookSnapshot snapshot, Interval interval) {
        BigDecimal mid = snapshot.mid();
        return new OrderBookCandle(snapshot.symbol(), interval, interval.align(snapshot.timestamp()),
            mid, mid, mid, mid,
            snapshot.spread(), snapshot.spread(), snapshot.bidDepth(), snapshot.askDepth(),
            1, snapshot.timestamp(), snapshot.timestamp());
    }

    public OrderBookCandle plus(OrderBookSnapshot snapshot) {
        if (!snapshot.symbol().equals(symbol) || !interval.align(snapshot.timestamp()).equals(bucketStart)) {
            throw new IllegalArgumentException("Snapshot at " + snapshot.timestamp() + " does not belong to "
                + symbol + "@" + bucketStart);
        }
        return merge(of(snapshot, interval));
    }

    /**
     * Combine two partial candles of the same key; open and close follow snapshot time.
     */
    public OrderBookCandle merge(OrderBookCandle other) {
        if (!symbol.equals(other.symbol) || interval != other.interval || !bucketStart.equals(other.bucketStart)) {
            throw new IllegalArgumentException("Cannot merge candles of different keys");
        }
        OrderBookCandle first = other.firstSnapshotAt.isBefore(firstSnapshotAt) ? other : this;
        OrderBookCandle last = other.lastSnapshotAt.isAfter(lastSnapshotAt) ? other : this;
        return new OrderBookCandle(symbol, interval, bucketStart,
            first.midOpen, midHigh.max(other.midHigh), midLow.min(other.midLow), last.midClose,
            spreadSum.add(other.spreadSum), spreadMax.max(other.spreadMax),
            bidDepthSum.add(other.bidDepthSum), askDepthSum.add(other.askDepthSum),
            snapshotCount + other.snapshotCount, first.firstSnapshotAt, last.lastSnapshotAt);
    }

    public BigDecimal spreadMean() {
        return mean(spreadSum);
    }

    public BigDecimal bidDepthMean() {
        return mean(bidDepthSum);
    }

    public BigDecimal askDepthMean() {
        return mean(askDepthSum);
    }

    private BigDecimal mean(BigDecimal sum) {
        return sum.divide(BigDecimal.valueOf(snapshotCount), MathContext.DECIMAL64);
    }
}
