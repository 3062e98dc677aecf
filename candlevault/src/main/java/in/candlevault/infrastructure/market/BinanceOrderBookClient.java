package in.candlevault.infrastructure.market;

import com.fasterxml.jackson.databind.JsonNode;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourceException;
import in.candlevault.domain.market.OrderBookSnapshot;
import in.candlevault.infrastructure.source.ProviderHttpClient;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binance USDⓈ-M futures order book ({@code GET /fapi/v1/depth}).
 *
 * Body: {@code {"lastUpdateId":1,"E":1700000000123,"T":1700000000120,
 * "bids":[["9900.10","1.5"],...],"asks":[["9900.20","0.7"],...]}}, best level first.
 */
public class BinanceOrderBookClient {

    private final String sourceId;
    private final String baseUrl;
    private final ProviderHttpClient http;
    private final Clock clock;

    public BinanceOrderBookClient(String sourceId, String baseUrl, ProviderHttpClient http, Clock clock) {
        this.sourceId = sourceId;
        this.baseUrl = baseUrl;
        this.http = http;
        this.clock = clock;
    }

    public String getSourceId() {
        return sourceId;
    }

    /**
     * @throws SourceException on transport failure or an unusable body
     */
    public OrderBookSnapshot fetchSnapshot(String symbol, int depth) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("symbol", symbol);
        query.put("limit", Integer.toString(depth));

        JsonNode body = http.getJson(sourceId, baseUrl, "/fapi/v1/depth", query, Map.of());
        JsonNode bids = body.path("bids");
        JsonNode asks = body.path("asks");
        if (!bids.isArray() || !asks.isArray() || bids.isEmpty() || asks.isEmpty()) {
            throw new SourceException(sourceId, FailureKind.MALFORMED_RESPONSE,
                "order book for " + symbol + " has an empty or missing side");
        }

        Instant timestamp = body.hasNonNull("T") ? Instant.ofEpochMilli(body.get("T").asLong()) : clock.instant();
        try {
            return new OrderBookSnapshot(
                symbol,
                timestamp,
                new BigDecimal(bids.get(0).get(0).asText()),
                new BigDecimal(asks.get(0).get(0).asText()),
                sumQuantity(bids),
                sumQuantity(asks),
                Math.min(bids.size(), asks.size()));
        } catch (NumberFormatException | NullPointerException e) {
            throw new SourceException(sourceId, FailureKind.MALFORMED_RESPONSE,
                "bad order book level for " + symbol, e);
        }
    }

    private static BigDecimal sumQuantity(JsonNode levels) {
        BigDecimal total = BigDecimal.ZERO;
        for (JsonNode level : levels) {
            total = total.add(new BigDecimal(level.get(1).asText()));
        }
        return total;
    }
}
