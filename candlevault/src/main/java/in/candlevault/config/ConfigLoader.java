package in.candlevault.config;

import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.error.ConfigurationException;
import in.candlevault.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds {@link IngestionConfig} from environment variables / system properties.
 *
 * Series: {@code SYMBOLS} x {@code INTERVALS}. Sources: {@code SOURCES} lists
 * adapter ids; each id reads {@code <ID>_ENABLED}, {@code <ID>_BASE_URL},
 * {@code <ID>_API_KEY}, {@code <ID>_REQUESTS_PER_MINUTE}, {@code <ID>_TIMEOUT}
 * and {@code <ID>_MAX_PAGES}. Liquidation and order book collection read the
 * {@code LIQUIDATION_*}, {@code ORDERBOOK_*} and {@code MARKET_FLUSH_PERIOD} keys
 * and stay off while their symbol lists are empty.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final List<String> DEFAULT_SYMBOLS = List.of("BTCUSDT", "ETHUSDT", "SOLUSDT", "ADAUSDT");

    private record SourceDefaults(String baseUrl, int requestsPerMinute) {
    }

    private static final Map<String, SourceDefaults> SOURCE_DEFAULTS = Map.of(
        "binance", new SourceDefaults("https://api.binance.com", 1200),
        "bybit", new SourceDefaults("https://api.bybit.com", 600)
    );

    public static IngestionConfig load() {
        IngestionConfig.Builder builder = IngestionConfig.builder()
            .series(loadSeries())
            .sources(loadSources())
            .collectionStart(parseInstant("COLLECTION_START", Env.get("COLLECTION_START", "2024-01-01")))
            .maxBackfillAge(Env.getDuration("MAX_BACKFILL_AGE", Duration.ofDays(730)))
            .livePeriod(Env.getDuration("LIVE_PERIOD", Duration.ofHours(1)))
            .liveLookbackIntervals(Env.getInt("LIVE_LOOKBACK_INTERVALS", 24))
            .detectionPeriod(Env.getDuration("DETECTION_PERIOD", Duration.ofMinutes(15)))
            .workerPoolSize(Env.getInt("WORKER_POOL_SIZE", 10))
            .shutdownGrace(Env.getDuration("SHUTDOWN_GRACE", Duration.ofSeconds(30)))
            .retryBaseDelay(Env.getDuration("RETRY_BASE_DELAY", Duration.ofSeconds(1)))
            .retryMaxDelay(Env.getDuration("RETRY_MAX_DELAY", Duration.ofMinutes(5)))
            .retryMaxAttempts(Env.getInt("RETRY_MAX_ATTEMPTS", 5))
            .retryJitter(Env.getDouble("RETRY_JITTER", 0.1))
            .breakerFailureThreshold(Env.getInt("BREAKER_FAILURE_THRESHOLD", 5))
            .breakerCooldown(Env.getDuration("BREAKER_COOLDOWN", Duration.ofSeconds(60)))
            .breakerMaxCooldown(Env.getDuration("BREAKER_MAX_COOLDOWN", Duration.ofMinutes(10)))
            .healthHalfLife(Env.getDuration("HEALTH_HALF_LIFE", Duration.ofMinutes(15)))
            .healthyThreshold(Env.getDouble("HEALTHY_THRESHOLD", 0.95))
            .degradedAfterFailures(Env.getInt("DEGRADED_AFTER_FAILURES", 3))
            .suspendAfterFailures(Env.getInt("SUSPEND_AFTER_FAILURES", 5))
            .suspensionCooldown(Env.getDuration("SUSPENSION_COOLDOWN", Duration.ofMinutes(2)))
            .rateLimitWindow(Env.getDuration("RATE_LIMIT_WINDOW", Duration.ofSeconds(60)))
            .rateLimitMaxWait(Env.getDuration("RATE_LIMIT_MAX_WAIT", Duration.ofSeconds(30)))
            .gapMaxAttempts(Env.getInt("GAP_MAX_ATTEMPTS", 5))
            .backfillChunkIntervals(Env.getInt("BACKFILL_CHUNK_INTERVALS", 500))
            .maxActiveGaps(Env.getInt("MAX_ACTIVE_GAPS", 3))
            .validationTolerance(Env.getDouble("VALIDATION_TOLERANCE", 0.0001))
            .baseQuality(Env.getDouble("BASE_QUALITY", 0.8))
            .confirmationBoost(Env.getDouble("CONFIRMATION_BOOST", 0.5))
            .marketActivity(loadMarketActivity());

        IngestionConfig config = builder.build();
        log.info("[Config] {} series, sources={}, collectionStart={}",
            config.getSeries().size(), config.getEnabledSources().stream().map(SourceConfig::id).toList(),
            config.getCollectionStart());
        return config;
    }

    static List<SeriesKey> loadSeries() {
        List<String> symbols = Env.getList("SYMBOLS", DEFAULT_SYMBOLS);
        List<String> intervalCodes = Env.getList("INTERVALS", List.of("1h"));
        List<SeriesKey> series = new ArrayList<>();
        for (String code : intervalCodes) {
            Interval interval;
            try {
                interval = Interval.fromCode(code);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(List.of("INTERVALS contains unknown interval '" + code + "'"));
            }
            for (String symbol : symbols) {
                series.add(SeriesKey.of(symbol.toUpperCase(Locale.ROOT), interval));
            }
        }
        return series;
    }

    static List<SourceConfig> loadSources() {
        List<SourceConfig> sources = new ArrayList<>();
        for (String id : Env.getList("SOURCES", List.of("binance", "bybit"))) {
            String normalized = id.toLowerCase(Locale.ROOT);
            String prefix = normalized.toUpperCase(Locale.ROOT);
            SourceDefaults defaults = SOURCE_DEFAULTS.getOrDefault(normalized, new SourceDefaults(null, 60));
            sources.add(new SourceConfig(
                normalized,
                Env.getBool(prefix + "_ENABLED", true),
                Env.get(prefix + "_BASE_URL", defaults.baseUrl()),
                Env.get(prefix + "_API_KEY", null),
                Env.getInt(prefix + "_REQUESTS_PER_MINUTE", defaults.requestsPerMinute()),
                Env.getDuration(prefix + "_TIMEOUT", Duration.ofSeconds(10)),
                Env.getInt(prefix + "_MAX_PAGES", 5)
            ));
        }
        return sources;
    }

    static MarketActivityConfig loadMarketActivity() {
        MarketActivityConfig defaults = MarketActivityConfig.disabled();
        return new MarketActivityConfig(
            upper(Env.getList("LIQUIDATION_SYMBOLS", List.of())),
            parseInterval("LIQUIDATION_INTERVAL", Env.get("LIQUIDATION_INTERVAL", defaults.liquidationInterval().getCode())),
            Env.get("LIQUIDATION_STREAM_URL", defaults.liquidationStreamUrl()),
            upper(Env.getList("ORDERBOOK_SYMBOLS", List.of())),
            parseInterval("ORDERBOOK_INTERVAL", Env.get("ORDERBOOK_INTERVAL", defaults.orderBookInterval().getCode())),
            Env.get("ORDERBOOK_BASE_URL", defaults.orderBookBaseUrl()),
            Env.getInt("ORDERBOOK_DEPTH", defaults.orderBookDepth()),
            Env.getDuration("ORDERBOOK_POLL_PERIOD", defaults.orderBookPollPeriod()),
            Env.getInt("ORDERBOOK_REQUESTS_PER_MINUTE", defaults.orderBookRequestsPerWindow()),
            Env.getDuration("MARKET_FLUSH_PERIOD", defaults.flushPeriod())
        );
    }

    private static List<String> upper(List<String> symbols) {
        return symbols.stream().map(s -> s.toUpperCase(Locale.ROOT)).toList();
    }

    private static Interval parseInterval(String key, String code) {
        try {
            return Interval.fromCode(code);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(List.of(key + " contains unknown interval '" + code + "'"));
        }
    }

    /**
     * Accepts a date ({@code 2024-01-01}, midnight UTC) or an ISO instant.
     */
    static Instant parseInstant(String key, String value) {
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException(List.of(key + "='" + value + "' is not a date or ISO instant"));
        }
    }

    private ConfigLoader() {}
}
