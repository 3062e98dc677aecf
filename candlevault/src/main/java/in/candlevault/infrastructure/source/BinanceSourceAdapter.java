package in.candlevault.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import in.candlevault.config.SourceConfig;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.RawPoint;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Binance spot klines ({@code GET /api/v3/klines}).
 *
 * Rows are {@code [openTime, open, high, low, close, volume, closeTime, ...]}
 * with prices as strings. At most 1000 rows per page; pages are followed
 * forward until the range is covered or {@code maxPagesPerCall} is reached.
 */
public class BinanceSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(BinanceSourceAdapter.class);

    public static final String ID = "binance";
    static final int PAGE_LIMIT = 1000;
    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9]{5,20}");

    private final SourceConfig config;
    private final ProviderHttpClient http;

    public BinanceSourceAdapter(SourceConfig config, ProviderHttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public String id() {
        return config.id();
    }

    @Override
    public boolean supports(String symbol, Interval interval) {
        return SYMBOL.matcher(symbol).matches();
    }

    @Override
    public List<RawPoint> fetch(String symbol, Interval interval, Instant start, Instant end) {
        List<RawPoint> points = new ArrayList<>();
        long cursor = start.toEpochMilli();
        long endMillis = end.toEpochMilli();
        int pages = 0;

        while (cursor < endMillis && pages < config.maxPagesPerCall()) {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("symbol", symbol);
            query.put("interval", interval.getCode());
            query.put("startTime", Long.toString(cursor));
            query.put("endTime", Long.toString(endMillis - 1));
            query.put("limit", Integer.toString(PAGE_LIMIT));

            JsonNode body = http.getJson(id(), config.baseUrl(), "/api/v3/klines", query, headers());
            pages++;
            if (!body.isArray()) {
                throw new SourceException(id(), FailureKind.MALFORMED_RESPONSE, "expected array, got " + body.getNodeType());
            }

            long lastOpen = -1;
            for (JsonNode row : body) {
                RawPoint point = parseRow(row);
                long openTime = point.timestamp().toEpochMilli();
                if (openTime <= lastOpen) {
                    throw new SourceException(id(), FailureKind.MALFORMED_RESPONSE, "rows out of order at " + point.timestamp());
                }
                lastOpen = openTime;
                if (openTime >= cursor && openTime < endMillis) {
                    points.add(point);
                }
            }

            if (body.size() < PAGE_LIMIT || lastOpen < 0) {
                break;
            }
            cursor = lastOpen + interval.getMillis();
        }

        if (cursor < endMillis && pages >= config.maxPagesPerCall()) {
            log.debug("[{}] Page budget {} reached for {} {}, returning {} points",
                id(), config.maxPagesPerCall(), symbol, interval.getCode(), points.size());
        }
        log.debug("[{}] Fetched {} {} points for {} in {} page(s)", id(), points.size(), interval.getCode(), symbol, pages);
        return points;
    }

    private RawPoint parseRow(JsonNode row) {
        if (!row.isArray() || row.size() < 6) {
            throw new SourceException(id(), FailureKind.MALFORMED_RESPONSE, "unexpected kline row: " + row);
        }
        try {
            return new RawPoint(
                Instant.ofEpochMilli(row.get(0).asLong()),
                new BigDecimal(row.get(1).asText()),
                new BigDecimal(row.get(2).asText()),
                new BigDecimal(row.get(3).asText()),
                new BigDecimal(row.get(4).asText()),
                new BigDecimal(row.get(5).asText())
            );
        } catch (NumberFormatException e) {
            throw new SourceException(id(), FailureKind.MALFORMED_RESPONSE, "bad number in row: " + row, e);
        }
    }

    private Map<String, String> headers() {
        return config.hasApiKey() ? Map.of("X-MBX-APIKEY", config.apiKey()) : Map.of();
    }
}
