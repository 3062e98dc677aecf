package in.candlevault.bootstrap;

import in.candlevault.config.IngestionConfig;
import in.candlevault.config.MarketActivityConfig;
import in.candlevault.config.SourceConfig;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Runs before any component is created. Collects every problem and throws a
 * single {@link ConfigurationException}; the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    /**
     * @param supportedSources adapter ids this build knows how to create
     * @throws ConfigurationException if configuration is invalid
     */
    public static void validate(IngestionConfig config, Set<String> supportedSources, Instant now) {
        log.info("════════════════════════════════════════════════════════");
        log.info("Running startup config validation...");
        log.info("════════════════════════════════════════════════════════");

        List<String> problems = new ArrayList<>();

        // Series
        if (config.getSeries().isEmpty()) {
            problems.add("At least one series (SYMBOLS x INTERVALS) is required");
        }
        Set<SeriesKey> seen = new HashSet<>();
        for (SeriesKey series : config.getSeries()) {
            if (!seen.add(series)) {
                problems.add("Duplicate series " + series);
            }
        }
        if (!config.getCollectionStart().isBefore(now)) {
            problems.add("COLLECTION_START " + config.getCollectionStart() + " is not in the past");
        }

        // Sources
        List<SourceConfig> enabled = config.getEnabledSources();
        if (enabled.isEmpty()) {
            problems.add("At least one source must be enabled");
        }
        Set<String> ids = new HashSet<>();
        for (SourceConfig source : config.getSources()) {
            if (!ids.add(source.id())) {
                problems.add("Duplicate source id " + source.id());
            }
            if (!source.enabled()) {
                continue;
            }
            if (!supportedSources.contains(source.id())) {
                problems.add("Unknown source '" + source.id() + "' (supported: " + supportedSources + ")");
            }
            if (source.baseUrl() == null || source.baseUrl().isBlank()) {
                problems.add("Source " + source.id() + " has no base URL");
            }
            if (source.requestsPerWindow() < 1) {
                problems.add("Source " + source.id() + " quota must be >= 1");
            }
            if (source.maxPagesPerCall() < 1) {
                problems.add("Source " + source.id() + " max pages must be >= 1");
            }
            requirePositive(problems, "Source " + source.id() + " timeout", source.requestTimeout());
        }

        // Scheduling
        requirePositive(problems, "LIVE_PERIOD", config.getLivePeriod());
        requirePositive(problems, "DETECTION_PERIOD", config.getDetectionPeriod());
        requirePositive(problems, "MAX_BACKFILL_AGE", config.getMaxBackfillAge());
        requireAtLeast(problems, "LIVE_LOOKBACK_INTERVALS", config.getLiveLookbackIntervals(), 1);
        requireAtLeast(problems, "WORKER_POOL_SIZE", config.getWorkerPoolSize(), 1);
        if (config.getShutdownGrace().isNegative()) {
            problems.add("SHUTDOWN_GRACE must not be negative");
        }

        // Retry / breaker / health
        requirePositive(problems, "RETRY_BASE_DELAY", config.getRetryBaseDelay());
        if (config.getRetryMaxDelay().compareTo(config.getRetryBaseDelay()) < 0) {
            problems.add("RETRY_MAX_DELAY must be >= RETRY_BASE_DELAY");
        }
        requireAtLeast(problems, "RETRY_MAX_ATTEMPTS", config.getRetryMaxAttempts(), 1);
        if (config.getRetryJitter() < 0 || config.getRetryJitter() >= 1) {
            problems.add("RETRY_JITTER must be in [0, 1)");
        }
        requireAtLeast(problems, "BREAKER_FAILURE_THRESHOLD", config.getBreakerFailureThreshold(), 1);
        requirePositive(problems, "BREAKER_COOLDOWN", config.getBreakerCooldown());
        if (config.getBreakerMaxCooldown().compareTo(config.getBreakerCooldown()) < 0) {
            problems.add("BREAKER_MAX_COOLDOWN must be >= BREAKER_COOLDOWN");
        }
        requirePositive(problems, "HEALTH_HALF_LIFE", config.getHealthHalfLife());
        requireFraction(problems, "HEALTHY_THRESHOLD", config.getHealthyThreshold());
        requireAtLeast(problems, "DEGRADED_AFTER_FAILURES", config.getDegradedAfterFailures(), 1);
        if (config.getSuspendAfterFailures() < config.getDegradedAfterFailures()) {
            problems.add("SUSPEND_AFTER_FAILURES must be >= DEGRADED_AFTER_FAILURES");
        }
        requirePositive(problems, "SUSPENSION_COOLDOWN", config.getSuspensionCooldown());
        requirePositive(problems, "RATE_LIMIT_WINDOW", config.getRateLimitWindow());
        if (config.getRateLimitMaxWait().isNegative()) {
            problems.add("RATE_LIMIT_MAX_WAIT must not be negative");
        }

        // Gaps / validation
        requireAtLeast(problems, "GAP_MAX_ATTEMPTS", config.getGapMaxAttempts(), 1);
        requireAtLeast(problems, "BACKFILL_CHUNK_INTERVALS", config.getBackfillChunkIntervals(), 1);
        requireAtLeast(problems, "MAX_ACTIVE_GAPS", config.getMaxActiveGaps(), 1);
        if (config.getValidationTolerance() < 0) {
            problems.add("VALIDATION_TOLERANCE must not be negative");
        }
        requireFraction(problems, "BASE_QUALITY", config.getBaseQuality());
        requireFraction(problems, "CONFIRMATION_BOOST", config.getConfirmationBoost());

        // Liquidations / order book
        MarketActivityConfig market = config.getMarketActivity();
        if (market.liquidationsEnabled()) {
            String url = market.liquidationStreamUrl();
            if (url == null || !(url.startsWith("ws://") || url.startsWith("wss://"))) {
                problems.add("LIQUIDATION_STREAM_URL must start with ws:// or wss:// (was " + url + ")");
            }
        }
        if (market.orderBookEnabled()) {
            if (market.orderBookBaseUrl() == null || market.orderBookBaseUrl().isBlank()) {
                problems.add("ORDERBOOK_BASE_URL is required when ORDERBOOK_SYMBOLS is set");
            }
            if (!MarketActivityConfig.SUPPORTED_DEPTHS.contains(market.orderBookDepth())) {
                problems.add("ORDERBOOK_DEPTH must be one of " + MarketActivityConfig.SUPPORTED_DEPTHS
                    + " (was " + market.orderBookDepth() + ")");
            }
            requirePositive(problems, "ORDERBOOK_POLL_PERIOD", market.orderBookPollPeriod());
            requireAtLeast(problems, "ORDERBOOK_REQUESTS_PER_MINUTE", market.orderBookRequestsPerWindow(), 1);
        }
        requirePositive(problems, "MARKET_FLUSH_PERIOD", market.flushPeriod());

        if (!problems.isEmpty()) {
            throw new ConfigurationException(problems);
        }

        log.info("✅ Startup config validation passed");
        log.info("════════════════════════════════════════════════════════");
    }

    private static void requirePositive(List<String> problems, String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            problems.add(name + " must be positive");
        }
    }

    private static void requireAtLeast(List<String> problems, String name, int value, int min) {
        if (value < min) {
            problems.add(name + " must be >= " + min + " (was " + value + ")");
        }
    }

    private static void requireFraction(List<String> problems, String name, double value) {
        if (value <= 0 || value > 1) {
            problems.add(name + " must be in (0, 1] (was " + value + ")");
        }
    }

    private StartupConfigValidator() {}
}
