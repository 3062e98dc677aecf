package in.candlevault.service.market;

import in.candlevault.domain.data.Interval;
import in.candlevault.domain.market.LiquidationBucket;
import in.candlevault.domain.market.LiquidationEvent;
import in.candlevault.domain.market.OrderBookCandle;
import in.candlevault.domain.market.OrderBookSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;

/**
 * Folds timestamped observations into per-symbol aligned buckets.
 *
 * A bucket is closed once its interval has fully elapsed. Closed buckets are
 * handed out by {@link #drainClosed(Instant)} and removed; a caller that fails
 * to persist them hands them back through {@link #restore(List)}, where they
 * merge with anything collected for the same key in the meantime.
 *
 * Thread-safe.
 *
 * @param <E> observation type
 * @param <B> bucket type
 */
public final class TimeBucketAggregator<E, B> {

    private record Key(String symbol, Instant start) {
    }

    private final Interval interval;
    private final Function<E, String> symbolOf;
    private final Function<E, Instant> timeOf;
    private final Function<B, String> bucketSymbol;
    private final Function<B, Instant> bucketStart;
    private final BiFunction<E, Interval, B> open;
    private final BiFunction<B, E, B> add;
    private final BinaryOperator<B> merge;

    private final Map<Key, B> buckets = new TreeMap<>(
        (a, b) -> {
            int byStart = a.start().compareTo(b.start());
            return byStart != 0 ? byStart : a.symbol().compareTo(b.symbol());
        });

    private TimeBucketAggregator(Builder<E, B> b) {
        this.interval = Objects.requireNonNull(b.interval, "interval");
        this.symbolOf = Objects.requireNonNull(b.symbolOf, "symbolOf");
        this.timeOf = Objects.requireNonNull(b.timeOf, "timeOf");
        this.bucketSymbol = Objects.requireNonNull(b.bucketSymbol, "bucketSymbol");
        this.bucketStart = Objects.requireNonNull(b.bucketStart, "bucketStart");
        this.open = Objects.requireNonNull(b.open, "open");
        this.add = Objects.requireNonNull(b.add, "add");
        this.merge = Objects.requireNonNull(b.merge, "merge");
    }

    public Interval getInterval() {
        return interval;
    }

    public synchronized void accept(E observation) {
        Key key = new Key(symbolOf.apply(observation), interval.align(timeOf.apply(observation)));
        B current = buckets.get(key);
        buckets.put(key, current == null ? open.apply(observation, interval) : add.apply(current, observation));
    }

    /**
     * Remove and return every bucket whose interval ended at or before {@code now}, oldest first.
     */
    public synchronized List<B> drainClosed(Instant now) {
        List<B> closed = new ArrayList<>();
        Iterator<Map.Entry<Key, B>> it = buckets.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Key, B> entry = it.next();
            if (entry.getKey().start().plus(interval.getDuration()).isAfter(now)) {
                break;
            }
            closed.add(entry.getValue());
            it.remove();
        }
        return closed;
    }

    /**
     * Remove and return every bucket, open ones included. Used on shutdown.
     */
    public synchronized List<B> drainAll() {
        List<B> all = new ArrayList<>(buckets.values());
        buckets.clear();
        return all;
    }

    public synchronized void restore(List<B> unsaved) {
        for (B bucket : unsaved) {
            buckets.merge(new Key(bucketSymbol.apply(bucket), bucketStart.apply(bucket)), bucket, merge);
        }
    }

    public synchronized int size() {
        return buckets.size();
    }

    public static <E, B> Builder<E, B> builder() {
        return new Builder<>();
    }

    public static class Builder<E, B> {
        private Interval interval;
        private Function<E, String> symbolOf;
        private Function<E, Instant> timeOf;
        private Function<B, String> bucketSymbol;
        private Function<B, Instant> bucketStart;
        private BiFunction<E, Interval, B> open;
        private BiFunction<B, E, B> add;
        private BinaryOperator<B> merge;

        public Builder<E, B> interval(Interval interval) { this.interval = interval; return this; }
        public Builder<E, B> symbolOf(Function<E, String> f) { this.symbolOf = f; return this; }
        public Builder<E, B> timeOf(Function<E, Instant> f) { this.timeOf = f; return this; }
        public Builder<E, B> bucketSymbol(Function<B, String> f) { this.bucketSymbol = f; return this; }
        public Builder<E, B> bucketStart(Function<B, Instant> f) { this.bucketStart = f; return this; }
        public Builder<E, B> open(BiFunction<E, Interval, B> f) { this.open = f; return this; }
        public Builder<E, B> add(BiFunction<B, E, B> f) { this.add = f; return this; }
        public Builder<E, B> merge(BinaryOperator<B> f) { this.merge = f; return this; }

        public TimeBucketAggregator<E, B> build() {
            return new TimeBucketAggregator<>(this);
        }
    }

    public static TimeBucketAggregator<LiquidationEvent, LiquidationBucket> liquidations(Interval interval) {
        return TimeBucketAggregator.<LiquidationEvent, LiquidationBucket>builder()
            .interval(interval)
            .symbolOf(LiquidationEvent::symbol)
            .timeOf(LiquidationEvent::tradeTime)
            .bucketSymbol(LiquidationBucket::symbol)
            .bucketStart(LiquidationBucket::bucketStart)
            .open(LiquidationBucket::of)
            .add(LiquidationBucket::plus)
            .merge(LiquidationBucket::merge)
            .build();
    }

    public static TimeBucketAggregator<OrderBookSnapshot, OrderBookCandle> orderBook(Interval interval) {
        return TimeBucketAggregator.<OrderBookSnapshot, OrderBookCandle>builder()
            .interval(interval)
            .symbolOf(OrderBookSnapshot::symbol)
            .timeOf(OrderBookSnapshot::timestamp)
            .bucketSymbol(OrderBookCandle::symbol)
            .bucketStart(OrderBookCandle::bucketStart)
            .open(OrderBookCandle::of)
            .add(OrderBookCandle::plus)
            .merge(OrderBookCandle::merge)
            .build();
    }
}
