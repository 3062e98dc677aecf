package in.candlevault.infrastructure.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.candlevault.config.SourceConfig;
import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.RawPoint;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourceException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static in.candlevault.testutil.TestData.T0;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for BybitSourceAdapter.
 *
 * Tests:
 * - Newest-first rows returned ascending
 * - Interval code mapping
 * - retCode classification
 * - Missing result list
 */
@ExtendWith(MockitoExtension.class)
class BybitSourceAdapterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private ProviderHttpClient http;
    private BybitSourceAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new BybitSourceAdapter(new SourceConfig("bybit", true, "https://api.bybit.com", null, 600,
            Duration.ofSeconds(10), 5), http);
    }

    private void respond(String json) throws Exception {
        JsonNode body = MAPPER.readTree(json);
        when(http.getJson(eq("bybit"), anyString(), eq("/v5/market/kline"), anyMap(), anyMap())).thenReturn(body);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testRowsSortedAscending() throws Exception {
        respond("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{\"category\":\"spot\",\"list\":["
            + "[\"1704070800000\",\"101\",\"102\",\"100\",\"101.5\",\"3.2\",\"324.8\"],"
            + "[\"1704067200000\",\"100\",\"101\",\"99\",\"100.5\",\"2.1\",\"211.0\"]]}}");

        List<RawPoint> points = adapter.fetch("BTCUSDT", Interval.HOUR_1, T0, T0.plusSeconds(7200));

        assertEquals(2, points.size());
        assertEquals(T0, points.get(0).timestamp());
        assertEquals(T0.plusSeconds(3600), points.get(1).timestamp());
        assertEquals(new BigDecimal("100.5"), points.get(0).close());
        assertEquals(new BigDecimal("3.2"), points.get(1).volume());

        ArgumentCaptor<Map<String, String>> query = ArgumentCaptor.forClass(Map.class);
        verify(http).getJson(eq("bybit"), anyString(), eq("/v5/market/kline"), query.capture(), anyMap());
        assertEquals("60", query.getValue().get("interval"));
        assertEquals("spot", query.getValue().get("category"));
        assertEquals(Long.toString(T0.toEpochMilli() + 7_200_000L - 1), query.getValue().get("end"));
    }

    @Test
    void testRateLimitRetCode() throws Exception {
        respond("{\"retCode\":10006,\"retMsg\":\"Too many visits!\",\"result\":{}}");

        SourceException e = assertThrows(SourceException.class,
            () -> adapter.fetch("BTCUSDT", Interval.HOUR_1, T0, T0.plusSeconds(3600)));

        assertEquals(FailureKind.RATE_LIMITED, e.getKind());
        assertEquals("bybit", e.getSourceId());
    }

    @Test
    void testAuthRetCode() throws Exception {
        respond("{\"retCode\":10003,\"retMsg\":\"API key is invalid.\",\"result\":{}}");

        SourceException e = assertThrows(SourceException.class,
            () -> adapter.fetch("BTCUSDT", Interval.HOUR_1, T0, T0.plusSeconds(3600)));

        assertEquals(FailureKind.AUTH_ERROR, e.getKind());
    }

    @Test
    void testMissingListIsMalformed() throws Exception {
        respond("{\"retCode\":0,\"retMsg\":\"OK\",\"result\":{}}");

        SourceException e = assertThrows(SourceException.class,
            () -> adapter.fetch("BTCUSDT", Interval.HOUR_1, T0, T0.plusSeconds(3600)));

        assertEquals(FailureKind.MALFORMED_RESPONSE, e.getKind());
    }

    @Test
    void testMissingRetCodeIsMalformed() throws Exception {
        respond("[]");

        SourceException e = assertThrows(SourceException.class,
            () -> adapter.fetch("BTCUSDT", Interval.HOUR_1, T0, T0.plusSeconds(3600)));

        assertEquals(FailureKind.MALFORMED_RESPONSE, e.getKind());
    }

    @Test
    void testSupportsEveryInterval() {
        for (Interval interval : Interval.values()) {
            assertTrue(adapter.supports("ETHUSDT", interval), "Should support " + interval);
        }
        assertFalse(adapter.supports("eth", Interval.HOUR_1));
    }
}
