package in.candlevault.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.market.LiquidationBucket;
import in.candlevault.domain.market.OrderBookCandle;
import in.candlevault.domain.repository.MarketActivityRepository;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Read endpoints for stored liquidation buckets and order book candles.
 *
 * - GET /api/liquidations?symbol=&interval=&from=&to=
 * - GET /api/orderbook?symbol=&interval=&from=&to=
 */
public final class MarketDataHandler {
    private static final Logger log = LoggerFactory.getLogger(MarketDataHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final MarketActivityRepository repository;

    public MarketDataHandler(MarketActivityRepository repository) {
        this.repository = repository;
    }

    public void liquidations(HttpServerExchange exchange) {
        try {
            Query q = query(exchange);
            List<Map<String, Object>> rows = new ArrayList<>();
            for (LiquidationBucket b : repository.queryLiquidations(q.symbol, q.interval, q.from, q.to)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("bucketStart", b.bucketStart());
                row.put("longCount", b.longCount());
                row.put("shortCount", b.shortCount());
                row.put("longQuantity", b.longQuantity());
                row.put("shortQuantity", b.shortQuantity());
                row.put("longNotional", b.longNotional());
                row.put("shortNotional", b.shortNotional());
                row.put("totalNotional", b.totalNotional());
                rows.add(row);
            }
            sendJson(exchange, q, "buckets", rows);
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Failed to query liquidations: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to query liquidations: " + e.getMessage());
        }
    }

    public void orderBook(HttpServerExchange exchange) {
        try {
            Query q = query(exchange);
            List<Map<String, Object>> rows = new ArrayList<>();
            for (OrderBookCandle c : repository.queryOrderBookCandles(q.symbol, q.interval, q.from, q.to)) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("bucketStart", c.bucketStart());
                row.put("open", c.midOpen());
                row.put("high", c.midHigh());
                row.put("low", c.midLow());
                row.put("close", c.midClose());
                row.put("spreadMean", c.spreadMean());
                row.put("spreadMax", c.spreadMax());
                row.put("bidDepthMean", c.bidDepthMean());
                row.put("askDepthMean", c.askDepthMean());
                row.put("snapshots", c.snapshotCount());
                rows.add(row);
            }
            sendJson(exchange, q, "candles", rows);
        } catch (IllegalArgumentException e) {
            sendError(exchange, StatusCodes.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Failed to query order book candles: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to query order book candles: " + e.getMessage());
        }
    }

    private record Query(String symbol, Interval interval, Instant from, Instant to) {
    }

    private static Query query(HttpServerExchange exchange) {
        String symbol = param(exchange, "symbol");
        String interval = param(exchange, "interval");
        if (symbol == null || interval == null) {
            throw new IllegalArgumentException("symbol and interval are required");
        }
        Instant from = instant(exchange, "from");
        Instant to = instant(exchange, "to");
        if (!to.isAfter(from)) {
            throw new IllegalArgumentException("to must be after from");
        }
        return new Query(symbol.toUpperCase(Locale.ROOT), Interval.fromCode(interval), from, to);
    }

    private static Instant instant(HttpServerExchange exchange, String name) {
        String value = param(exchange, name);
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid " + name + ": " + value, e);
        }
    }

    private static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    private void sendJson(HttpServerExchange exchange, Query q, String field, Object rows) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("symbol", q.symbol);
        body.put("interval", q.interval.getCode());
        body.put(field, rows);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(MAPPER.writeValueAsString(body), StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
