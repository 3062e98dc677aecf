package in.candlevault.util;

import in.candlevault.domain.error.ConfigurationException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Env.
 *
 * Tests:
 * - Duration formats
 * - System property fallback and defaults
 * - Unparsable values rejected
 */
class EnvTest {

    private static final String KEY = "CANDLEVAULT_ENV_TEST_VALUE";

    @AfterEach
    void tearDown() {
        System.clearProperty(KEY);
    }

    @Test
    void testParseDurationFormats() {
        assertEquals(Duration.ofMillis(500), Env.parseDuration("500ms"));
        assertEquals(Duration.ofSeconds(30), Env.parseDuration("30s"));
        assertEquals(Duration.ofMinutes(15), Env.parseDuration("15m"));
        assertEquals(Duration.ofHours(1), Env.parseDuration("1h"));
        assertEquals(Duration.ofDays(730), Env.parseDuration("730d"));
        assertEquals(Duration.ofMinutes(15), Env.parseDuration("PT15M"));
    }

    @Test
    void testParseDurationInvalid() {
        assertNull(Env.parseDuration("15x"));
        assertNull(Env.parseDuration("abc"));
        assertNull(Env.parseDuration(""));
    }

    @Test
    void testDefaultsWhenUnset() {
        assertEquals("fallback", Env.get(KEY, "fallback"));
        assertEquals(7, Env.getInt(KEY, 7));
        assertEquals(Duration.ofSeconds(3), Env.getDuration(KEY, Duration.ofSeconds(3)));
        assertEquals(List.of("a"), Env.getList(KEY, List.of("a")));
    }

    @Test
    void testReadsSystemProperty() {
        System.setProperty(KEY, " binance, ,bybit ");

        assertEquals(List.of("binance", "bybit"), Env.getList(KEY, List.of()));
    }

    @Test
    void testInvalidIntegerRejected() {
        System.setProperty(KEY, "ten");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> Env.getInt(KEY, 1));
        assertTrue(e.getProblems().get(0).contains(KEY));
    }

    @Test
    void testInvalidDurationRejected() {
        System.setProperty(KEY, "soon");

        assertThrows(ConfigurationException.class, () -> Env.getDuration(KEY, Duration.ZERO));
    }

    @Test
    void testBoolean() {
        System.setProperty(KEY, "1");
        assertTrue(Env.getBool(KEY, false));
        System.setProperty(KEY, "no");
        assertFalse(Env.getBool(KEY, true));
    }
}
