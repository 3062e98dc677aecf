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
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Bybit v5 spot klines ({@code GET /v5/market/kline}).
 *
 * Response: {@code {"retCode":0,"result":{"list":[[startTime,o,h,l,c,volume,turnover],...]}}}
 * with rows newest first. Pages walk backward from the range end; the result
 * is re-sorted ascending.
 */
public class BybitSourceAdapter implements SourceAdapter {
    private static final Logger log = LoggerFactory.getLogger(BybitSourceAdapter.class);

    public static final String ID = "bybit";
    static final int PAGE_LIMIT = 1000;
    private static final Pattern SYMBOL = Pattern.compile("[A-Z0-9]{5,20}");

    private static final Map<Interval, String> INTERVALS = new EnumMap<>(Interval.class);

    static {
        INTERVALS.put(Interval.MINUTE_1, "1");
        INTERVALS.put(Interval.MINUTE_5, "5");
        INTERVALS.put(Interval.MINUTE_15, "15");
        INTERVALS.put(Interval.MINUTE_30, "30");
        INTERVALS.put(Interval.HOUR_1, "60");
        INTERVALS.put(Interval.HOUR_4, "240");
        INTERVALS.put(Interval.DAY_1, "D");
    }

    private final SourceConfig config;
    private final ProviderHttpClient http;

    public BybitSourceAdapter(SourceConfig config, ProviderHttpClient http) {
        this.config = config;
        this.http = http;
    }

    @Override
    public String id() {
        return config.id();
    }

    @Override
    public boolean supports(String symbol, Interval interval) {
        return INTERVALS.containsKey(interval) && SYMBOL.matcher(symbol).matches();
    }

    @Override
    public List<RawPoint> fetch(String symbol, Interval interval, Instant start, Instant end) {
        String code = INTERVALS.get(interval);
        if (code == null) {
            throw new SourceException(id(), FailureKind.MALFORMED_RESPONSE, "unsupported interval " + interval);
        }

        long startMillis = start.toEpochMilli();
        long cursorEnd = end.toEpochMilli() - 1;
        List<RawPoint> points = new ArrayList<>();
        int pages = 0;

        while (cursorEnd >= startMillis && pages < config.maxPagesPerCall()) {
            Map<String, String> query = new LinkedHashMap<>();
            query.put("category", "spot");
            query.put("symbol", symbol);
            query.put("interval", code);
            query.put("start", Long.toString(startMillis));
            query.put("end", Long.toString(cursorEnd));
            query.put("limit", Integer.toString(PAGE_LIMIT));

            JsonNode body = http.getJson(id(), config.baseUrl(), "/v5/market/kline", query, Map.of());
            pages++;
            checkRetCode(body);

            JsonNode list = body.path("result").path("list");
            if (!list.isArray()) {
                throw new SourceException(id(), FailureKind.MALFORMED_RESPONSE, "missing result.list");
            }

            long oldest = Long.MAX_VALUE;
            for (JsonNode row : list) {
                RawPoint point = parseRow(row);
                long openTime = point.timestamp().toEpochMilli();
                oldest = Math.min(oldest, openTime);
                if (openTime >= startMillis && openTime <= cursorEnd) {
                    points.add(point);
                }
            }

            if (list.size() < PAGE_LIMIT || oldest == Long.MAX_VALUE) {
                break;
            }
            cursorEnd = oldest - 1;
        }

        points.sort(Comparator.comparing(RawPoint::timestamp));
        log.debug("[{}] Fetched {} {} points for {} in {} page(s)", id(), points.size(), interval.getCode(), symbol, pages);
        return points;
    }

    private void checkRetCode(JsonNode body) {
        JsonNode retCode = body.get("retCode");
        if (retCode == null || !retCode.isNumber()) {
            throw new SourceException(id(), FailureKind.MALFORMED_RESPONSE, "missing retCode");
        }
        int rc = retCode.asInt();
        if (rc == 0) {
            return;
        }
        String message = body.path("retMsg").asText("");
        FailureKind kind = switch (rc) {
            case 10006, 10018 -> FailureKind.RATE_LIMITED;
            case 10003, 10004, 10005, 33004 -> FailureKind.AUTH_ERROR;
            case 10016 -> FailureKind.UNAVAILABLE;
            default -> FailureKind.MALFORMED_RESPONSE;
        };
        throw new SourceException(id(), kind, "retCode " + rc + ": " + message);
    }

    private RawPoint parseRow(JsonNode row) {
        if (!row.isArray() || row.size() < 6) {
            throw new SourceException(id(), FailureKind.MALFORMED_RESPONSE, "unexpected kline row: " + row);
        }
        try {
            return new RawPoint(
                Instant.ofEpochMilli(Long.parseLong(row.get(0).asText())),
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
}
