package in.candlevault.config;

import in.candlevault.domain.data.Interval;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings for liquidation and order book collection.
 *
 * An empty symbol list disables the matching collector.
 *
 * @param liquidationStreamUrl   websocket base, e.g. {@code wss://fstream.binance.com}
 * @param orderBookDepth         levels per side requested from the depth endpoint
 * @param orderBookRequestsPerWindow quota for the depth endpoint within the rate limit window
 * @param flushPeriod            how often closed buckets are written to the store
 */
public record MarketActivityConfig(
    List<String> liquidationSymbols,
    Interval liquidationInterval,
    String liquidationStreamUrl,
    List<String> orderBookSymbols,
    Interval orderBookInterval,
    String orderBookBaseUrl,
    int orderBookDepth,
    Duration orderBookPollPeriod,
    int orderBookRequestsPerWindow,
    Duration flushPeriod
) {
    public static final String ORDER_BOOK_SOURCE_ID = "binance-futures";
    public static final List<Integer> SUPPORTED_DEPTHS = List.of(5, 10, 20, 50, 100, 500, 1000);

    public MarketActivityConfig {
        liquidationSymbols = List.copyOf(liquidationSymbols);
        orderBookSymbols = List.copyOf(orderBookSymbols);
        Objects.requireNonNull(liquidationInterval, "liquidationInterval");
        Objects.requireNonNull(orderBookInterval, "orderBookInterval");
        Objects.requireNonNull(orderBookPollPeriod, "orderBookPollPeriod");
        Objects.requireNonNull(flushPeriod, "flushPeriod");
    }

    public static MarketActivityConfig disabled() {
        return new MarketActivityConfig(List.of(), Interval.HOUR_1, "wss://fstream.binance.com",
            List.of(), Interval.MINUTE_5, "https://fapi.binance.com", 20,
            Duration.ofSeconds(10), 600, Duration.ofMinutes(1));
    }

    public boolean liquidationsEnabled() {
        return !liquidationSymbols.isEmpty();
    }

    public boolean orderBookEnabled() {
        return !orderBookSymbols.isEmpty();
    }
}
