package in.candlevault.config;

import in.candlevault.domain.data.SeriesKey;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of the ingestion engine, built once at startup.
 *
 * Usage:
 * <pre>
 * IngestionConfig config = IngestionConfig.builder()
 *     .series(List.of(SeriesKey.of("BTCUSDT", Interval.HOUR_1)))
 *     .collectionStart(Instant.parse("2024-01-01T00:00:00Z"))
 *     .source(binanceConfig)
 *     .build();
 * </pre>
 *
 * Core components receive this object (or values from it) through their
 * constructors and never read the environment themselves.
 */
public final class IngestionConfig {

    private final List<SeriesKey> series;
    private final List<SourceConfig> sources;
    private final Instant collectionStart;
    private final Duration maxBackfillAge;

    // Scheduling
    private final Duration livePeriod;
    private final int liveLookbackIntervals;
    private final Duration detectionPeriod;
    private final int workerPoolSize;
    private final Duration shutdownGrace;

    // Retry
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final int retryMaxAttempts;
    private final double retryJitter;

    // Circuit breaker
    private final int breakerFailureThreshold;
    private final Duration breakerCooldown;
    private final Duration breakerMaxCooldown;

    // Health
    private final Duration healthHalfLife;
    private final double healthyThreshold;
    private final int degradedAfterFailures;
    private final int suspendAfterFailures;
    private final Duration suspensionCooldown;

    // Rate limiting
    private final Duration rateLimitWindow;
    private final Duration rateLimitMaxWait;

    // Gaps
    private final int gapMaxAttempts;
    private final int backfillChunkIntervals;
    private final int maxActiveGaps;

    // Validation
    private final double validationTolerance;
    private final double baseQuality;
    private final double confirmationBoost;

    // Liquidations and order book
    private final MarketActivityConfig marketActivity;

    private IngestionConfig(Builder b) {
        this.series = List.copyOf(b.series);
        this.sources = List.copyOf(b.sources);
        this.collectionStart = b.collectionStart;
        this.maxBackfillAge = b.maxBackfillAge;
        this.livePeriod = b.livePeriod;
        this.liveLookbackIntervals = b.liveLookbackIntervals;
        this.detectionPeriod = b.detectionPeriod;
        this.workerPoolSize = b.workerPoolSize;
        this.shutdownGrace = b.shutdownGrace;
        this.retryBaseDelay = b.retryBaseDelay;
        this.retryMaxDelay = b.retryMaxDelay;
        this.retryMaxAttempts = b.retryMaxAttempts;
        this.retryJitter = b.retryJitter;
        this.breakerFailureThreshold = b.breakerFailureThreshold;
        this.breakerCooldown = b.breakerCooldown;
        this.breakerMaxCooldown = b.breakerMaxCooldown;
        this.healthHalfLife = b.healthHalfLife;
        this.healthyThreshold = b.healthyThreshold;
        this.degradedAfterFailures = b.degradedAfterFailures;
        this.suspendAfterFailures = b.suspendAfterFailures;
        this.suspensionCooldown = b.suspensionCooldown;
        this.rateLimitWindow = b.rateLimitWindow;
        this.rateLimitMaxWait = b.rateLimitMaxWait;
        this.gapMaxAttempts = b.gapMaxAttempts;
        this.backfillChunkIntervals = b.backfillChunkIntervals;
        this.maxActiveGaps = b.maxActiveGaps;
        this.validationTolerance = b.validationTolerance;
        this.baseQuality = b.baseQuality;
        this.confirmationBoost = b.confirmationBoost;
        this.marketActivity = b.marketActivity;
    }

    public List<SeriesKey> getSeries() { return series; }
    public List<SourceConfig> getSources() { return sources; }
    public Instant getCollectionStart() { return collectionStart; }
    public Duration getMaxBackfillAge() { return maxBackfillAge; }
    public Duration getLivePeriod() { return livePeriod; }
    public int getLiveLookbackIntervals() { return liveLookbackIntervals; }
    public Duration getDetectionPeriod() { return detectionPeriod; }
    public int getWorkerPoolSize() { return workerPoolSize; }
    public Duration getShutdownGrace() { return shutdownGrace; }
    public Duration getRetryBaseDelay() { return retryBaseDelay; }
    public Duration getRetryMaxDelay() { return retryMaxDelay; }
    public int getRetryMaxAttempts() { return retryMaxAttempts; }
    public double getRetryJitter() { return retryJitter; }
    public int getBreakerFailureThreshold() { return breakerFailureThreshold; }
    public Duration getBreakerCooldown() { return breakerCooldown; }
    public Duration getBreakerMaxCooldown() { return breakerMaxCooldown; }
    public Duration getHealthHalfLife() { return healthHalfLife; }
    public double getHealthyThreshold() { return healthyThreshold; }
    public int getDegradedAfterFailures() { return degradedAfterFailures; }
    public int getSuspendAfterFailures() { return suspendAfterFailures; }
    public Duration getSuspensionCooldown() { return suspensionCooldown; }
    public Duration getRateLimitWindow() { return rateLimitWindow; }
    public Duration getRateLimitMaxWait() { return rateLimitMaxWait; }
    public int getGapMaxAttempts() { return gapMaxAttempts; }
    public int getBackfillChunkIntervals() { return backfillChunkIntervals; }
    public int getMaxActiveGaps() { return maxActiveGaps; }
    public double getValidationTolerance() { return validationTolerance; }
    public double getBaseQuality() { return baseQuality; }
    public double getConfirmationBoost() { return confirmationBoost; }
    public MarketActivityConfig getMarketActivity() { return marketActivity; }

    /**
     * Collection start clamped so that no gap older than {@code maxBackfillAge} is ever created.
     */
    public Instant effectiveCollectionStart(Instant now) {
        Instant earliest = now.minus(maxBackfillAge);
        return collectionStart.isBefore(earliest) ? earliest : collectionStart;
    }

    public List<SourceConfig> getEnabledSources() {
        return sources.stream().filter(SourceConfig::enabled).toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private List<SeriesKey> series = new ArrayList<>();
        private final List<SourceConfig> sources = new ArrayList<>();
        private Instant collectionStart;
        private Duration maxBackfillAge = Duration.ofDays(730);
        private Duration livePeriod = Duration.ofHours(1);
        private int liveLookbackIntervals = 24;
        private Duration detectionPeriod = Duration.ofMinutes(15);
        private int workerPoolSize = 10;
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private Duration retryBaseDelay = Duration.ofSeconds(1);
        private Duration retryMaxDelay = Duration.ofMinutes(5);
        private int retryMaxAttempts = 5;
        private double retryJitter = 0.1;
        private int breakerFailureThreshold = 5;
        private Duration breakerCooldown = Duration.ofSeconds(60);
        private Duration breakerMaxCooldown = Duration.ofMinutes(10);
        private Duration healthHalfLife = Duration.ofMinutes(15);
        private double healthyThreshold = 0.95;
        private int degradedAfterFailures = 3;
        private int suspendAfterFailures = 5;
        private Duration suspensionCooldown = Duration.ofMinutes(2);
        private Duration rateLimitWindow = Duration.ofSeconds(60);
        private Duration rateLimitMaxWait = Duration.ofSeconds(30);
        private int gapMaxAttempts = 5;
        private int backfillChunkIntervals = 500;
        private int maxActiveGaps = 3;
        private double validationTolerance = 0.0001;
        private double baseQuality = 0.8;
        private double confirmationBoost = 0.5;
        private MarketActivityConfig marketActivity = MarketActivityConfig.disabled();

        public Builder series(List<SeriesKey> series) { this.series = new ArrayList<>(series); return this; }
        public Builder source(SourceConfig source) { this.sources.add(source); return this; }
        public Builder sources(List<SourceConfig> sources) { this.sources.addAll(sources); return this; }
        public Builder collectionStart(Instant collectionStart) { this.collectionStart = collectionStart; return this; }
        public Builder maxBackfillAge(Duration maxBackfillAge) { this.maxBackfillAge = maxBackfillAge; return this; }
        public Builder livePeriod(Duration livePeriod) { this.livePeriod = livePeriod; return this; }
        public Builder liveLookbackIntervals(int n) { this.liveLookbackIntervals = n; return this; }
        public Builder detectionPeriod(Duration detectionPeriod) { this.detectionPeriod = detectionPeriod; return this; }
        public Builder workerPoolSize(int workerPoolSize) { this.workerPoolSize = workerPoolSize; return this; }
        public Builder shutdownGrace(Duration shutdownGrace) { this.shutdownGrace = shutdownGrace; return this; }
        public Builder retryBaseDelay(Duration d) { this.retryBaseDelay = d; return this; }
        public Builder retryMaxDelay(Duration d) { this.retryMaxDelay = d; return this; }
        public Builder retryMaxAttempts(int n) { this.retryMaxAttempts = n; return this; }
        public Builder retryJitter(double jitter) { this.retryJitter = jitter; return this; }
        public Builder breakerFailureThreshold(int n) { this.breakerFailureThreshold = n; return this; }
        public Builder breakerCooldown(Duration d) { this.breakerCooldown = d; return this; }
        public Builder breakerMaxCooldown(Duration d) { this.breakerMaxCooldown = d; return this; }
        public Builder healthHalfLife(Duration d) { this.healthHalfLife = d; return this; }
        public Builder healthyThreshold(double threshold) { this.healthyThreshold = threshold; return this; }
        public Builder degradedAfterFailures(int n) { this.degradedAfterFailures = n; return this; }
        public Builder suspendAfterFailures(int n) { this.suspendAfterFailures = n; return this; }
        public Builder suspensionCooldown(Duration d) { this.suspensionCooldown = d; return this; }
        public Builder rateLimitWindow(Duration d) { this.rateLimitWindow = d; return this; }
        public Builder rateLimitMaxWait(Duration d) { this.rateLimitMaxWait = d; return this; }
        public Builder gapMaxAttempts(int n) { this.gapMaxAttempts = n; return this; }
        public Builder backfillChunkIntervals(int n) { this.backfillChunkIntervals = n; return this; }
        public Builder maxActiveGaps(int n) { this.maxActiveGaps = n; return this; }
        public Builder validationTolerance(double tolerance) { this.validationTolerance = tolerance; return this; }
        public Builder baseQuality(double quality) { this.baseQuality = quality; return this; }
        public Builder confirmationBoost(double boost) { this.confirmationBoost = boost; return this; }
        public Builder marketActivity(MarketActivityConfig m) { this.marketActivity = m; return this; }

        /**
         * Build the configuration. Range checks are done by
         * {@code StartupConfigValidator}; this only rejects missing values.
         */
        public IngestionConfig build() {
            Objects.requireNonNull(collectionStart, "collectionStart");
            Objects.requireNonNull(maxBackfillAge, "maxBackfillAge");
            Objects.requireNonNull(livePeriod, "livePeriod");
            Objects.requireNonNull(detectionPeriod, "detectionPeriod");
            Objects.requireNonNull(shutdownGrace, "shutdownGrace");
            Objects.requireNonNull(retryBaseDelay, "retryBaseDelay");
            Objects.requireNonNull(retryMaxDelay, "retryMaxDelay");
            Objects.requireNonNull(breakerCooldown, "breakerCooldown");
            Objects.requireNonNull(breakerMaxCooldown, "breakerMaxCooldown");
            Objects.requireNonNull(healthHalfLife, "healthHalfLife");
            Objects.requireNonNull(suspensionCooldown, "suspensionCooldown");
            Objects.requireNonNull(rateLimitWindow, "rateLimitWindow");
            Objects.requireNonNull(rateLimitMaxWait, "rateLimitMaxWait");
            Objects.requireNonNull(marketActivity, "marketActivity");
            return new IngestionConfig(this);
        }
    }
}
