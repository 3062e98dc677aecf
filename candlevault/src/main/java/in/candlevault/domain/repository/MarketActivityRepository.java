package in.candlevault.domain.repository;

import in.candlevault.domain.data.Interval;
import in.candlevault.domain.market.LiquidationBucket;
import in.candlevault.domain.market.OrderBookCandle;

import java.time.Instant;
import java.util.List;

/**
 * Repository for aggregated liquidation and order book activity.
 *
 * Both kinds are unique per (symbol, interval, bucketStart). Saving a bucket
 * whose key already exists merges the two partial aggregates
 * ({@link LiquidationBucket#merge}, {@link OrderBookCandle#merge}).
 */
public interface MarketActivityRepository {

    void mergeLiquidations(LiquidationBucket bucket);

    /**
     * Buckets with start in [start, end), ascending.
     */
    List<LiquidationBucket> queryLiquidations(String symbol, Interval interval, Instant start, Instant end);

    void mergeOrderBookCandle(OrderBookCandle candle);

    /**
     * Candles with start in [start, end), ascending.
     */
    List<OrderBookCandle> queryOrderBookCandles(String symbol, Interval interval, Instant start, Instant end);
}
