package in.candlevault.infrastructure.market;

import in.candlevault.domain.market.LiquidationEvent;
import in.candlevault.domain.market.LiquidationSide;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BinanceLiquidationStream message handling.
 *
 * Tests:
 * - Combined and raw force-order messages
 * - Average and filled values preferred over order values
 * - Non force-order messages ignored
 * - Malformed force orders rejected
 * - Combined stream URL
 */
class BinanceLiquidationStreamTest {

    @Test
    void testParsesCombinedForceOrder() {
        String msg = """
            {"stream":"btcusdt@forceOrder","data":{"e":"forceOrder","E":1704067200123,
              "o":{"s":"BTCUSDT","S":"SELL","o":"LIMIT","q":"0.014","p":"42000.10","ap":"42010.50",
                   "X":"FILLED","l":"0.014","z":"0.014","T":1704067200120}}}
            """;

        LiquidationEvent event = BinanceLiquidationStream.parseMessage(msg).orElseThrow();

        assertEquals("BTCUSDT", event.symbol());
        assertEquals(LiquidationSide.LONG, event.side());
        assertEquals(new BigDecimal("42010.50"), event.price());
        assertEquals(new BigDecimal("0.014"), event.quantity());
        assertEquals(Instant.ofEpochMilli(1704067200120L), event.tradeTime());
    }

    @Test
    void testParsesRawForceOrderWithLimitPriceFallback() {
        String msg = """
            {"e":"forceOrder","E":1704067200500,"o":{"s":"ETHUSDT","S":"BUY","q":"2.5","p":"2300","ap":"0"}}
            """;

        LiquidationEvent event = BinanceLiquidationStream.parseMessage(msg).orElseThrow();

        assertEquals(LiquidationSide.SHORT, event.side());
        assertEquals(new BigDecimal("2300"), event.price());
        assertEquals(new BigDecimal("2.5"), event.quantity());
        assertEquals(Instant.ofEpochMilli(1704067200500L), event.tradeTime());
    }

    @Test
    void testOtherEventsIgnored() {
        Optional<LiquidationEvent> event = BinanceLiquidationStream.parseMessage("{\"result\":null,\"id\":1}");

        assertTrue(event.isEmpty());
    }

    @Test
    void testMalformedForceOrderRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> BinanceLiquidationStream.parseMessage("{\"e\":\"forceOrder\",\"o\":{\"s\":\"BTCUSDT\",\"S\":\"SELL\",\"q\":\"x\",\"p\":\"1\"}}"));
        assertThrows(IllegalArgumentException.class,
            () -> BinanceLiquidationStream.parseMessage("{\"e\":\"forceOrder\"}"));
        assertThrows(IllegalArgumentException.class,
            () -> BinanceLiquidationStream.parseMessage("not json"));
    }

    @Test
    void testCombinedStreamUrl() {
        assertEquals("wss://fstream.binance.com/stream?streams=btcusdt@forceOrder/ethusdt@forceOrder",
            BinanceLiquidationStream.combinedStreamUrl("wss://fstream.binance.com/", List.of("BTCUSDT", "ETHUSDT")));
    }
}
