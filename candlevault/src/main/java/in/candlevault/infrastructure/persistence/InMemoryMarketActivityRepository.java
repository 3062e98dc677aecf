package in.candlevault.infrastructure.persistence;

import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.market.LiquidationBucket;
import in.candlevault.domain.market.OrderBookCandle;
import in.candlevault.domain.repository.MarketActivityRepository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory liquidation and order book store, one sorted map per series.
 */
public final class InMemoryMarketActivityRepository implements MarketActivityRepository {

    private final Map<SeriesKey, ConcurrentSkipListMap<Instant, LiquidationBucket>> liquidations =
        new ConcurrentHashMap<>();
    private final Map<SeriesKey, ConcurrentSkipListMap<Instant, OrderBookCandle>> orderBook =
        new ConcurrentHashMap<>();

    @Override
    public void mergeLiquidations(LiquidationBucket bucket) {
        liquidations.computeIfAbsent(SeriesKey.of(bucket.symbol(), bucket.interval()), k -> new ConcurrentSkipListMap<>())
            .merge(bucket.bucketStart(), bucket, LiquidationBucket::merge);
    }

    @Override
    public List<LiquidationBucket> queryLiquidations(String symbol, Interval interval, Instant start, Instant end) {
        return slice(liquidations.get(SeriesKey.of(symbol, interval)), start, end);
    }

    @Override
    public void mergeOrderBookCandle(OrderBookCandle candle) {
        orderBook.computeIfAbsent(SeriesKey.of(candle.symbol(), candle.interval()), k -> new ConcurrentSkipListMap<>())
            .merge(candle.bucketStart(), candle, OrderBookCandle::merge);
    }

    @Override
    public List<OrderBookCandle> queryOrderBookCandles(String symbol, Interval interval, Instant start, Instant end) {
        return slice(orderBook.get(SeriesKey.of(symbol, interval)), start, end);
    }

    private static <T> List<T> slice(ConcurrentSkipListMap<Instant, T> map, Instant start, Instant end) {
        if (map == null || !end.isAfter(start)) {
            return new ArrayList<>();
        }
        return new ArrayList<>(map.subMap(start, true, end, false).values());
    }
}
