package in.candlevault.infrastructure.source;

import in.candlevault.config.SourceConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SourceAdapterFactory.
 */
class SourceAdapterFactoryTest {

    private static SourceConfig config(String id) {
        return new SourceConfig(id, true, "https://example.test", null, 100, Duration.ofSeconds(5), 3);
    }

    @Test
    void testCreatesAdaptersInOrder() {
        List<SourceAdapter> adapters = SourceAdapterFactory.createAll(List.of(config("bybit"), config("binance")));

        assertEquals(2, adapters.size());
        assertInstanceOf(BybitSourceAdapter.class, adapters.get(0));
        assertInstanceOf(BinanceSourceAdapter.class, adapters.get(1));
        assertEquals("bybit", adapters.get(0).id());
    }

    @Test
    void testUnknownSourceRejected() {
        assertFalse(SourceAdapterFactory.isSupported("coingecko"));
        assertThrows(IllegalArgumentException.class, () -> SourceAdapterFactory.create(config("coingecko")));
    }
}
