package in.candlevault.service.resilience;

import in.candlevault.config.IngestionConfig;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.health.SourceHealth;
import in.candlevault.domain.health.SourceState;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-source health tracking with time-decayed statistics.
 *
 * Features:
 * - Raw request, success and error counters
 * - Success rate and average latency decayed with a configurable half-life
 * - Consecutive failure tracking with timed suspension
 *
 * Classification:
 * - HEALTHY: decayed success rate >= threshold and consecutive failures < degradedAfterFailures
 * - SUSPENDED: consecutive failures >= suspendAfterFailures, until the suspension cooldown elapses
 * - DEGRADED: everything else, including a source whose suspension just expired
 *
 * A failure after an expired suspension suspends the source again; a success
 * clears it. Each source record has its own lock.
 */
public class HealthTracker {
    private static final Logger log = LoggerFactory.getLogger(HealthTracker.class);

    private final Duration halfLife;
    private final double healthyThreshold;
    private final int degradedAfterFailures;
    private final int suspendAfterFailures;
    private final Duration suspensionCooldown;
    private final Clock clock;
    private final IngestionMetrics metrics;

    private final Map<String, SourceRecord> records = new ConcurrentHashMap<>();

    public HealthTracker(Duration halfLife, double healthyThreshold, int degradedAfterFailures,
                         int suspendAfterFailures, Duration suspensionCooldown,
                         Clock clock, IngestionMetrics metrics) {
        this.halfLife = halfLife;
        this.healthyThreshold = healthyThreshold;
        this.degradedAfterFailures = degradedAfterFailures;
        this.suspendAfterFailures = suspendAfterFailures;
        this.suspensionCooldown = suspensionCooldown;
        this.clock = clock;
        this.metrics = metrics;
    }

    public static HealthTracker fromConfig(IngestionConfig config, Clock clock, IngestionMetrics metrics) {
        return new HealthTracker(config.getHealthHalfLife(), config.getHealthyThreshold(),
            config.getDegradedAfterFailures(), config.getSuspendAfterFailures(),
            config.getSuspensionCooldown(), clock, metrics);
    }

    public void recordSuccess(String sourceId, Duration latency) {
        SourceRecord record = recordFor(sourceId);
        synchronized (record) {
            Instant now = clock.instant();
            SourceState before = record.state(now);
            record.decay(now);
            record.requestCount++;
            record.successCount++;
            record.successWeight += 1.0;
            record.totalWeight += 1.0;
            record.addLatency(latency);
            record.consecutiveFailures = 0;
            record.suspendedUntil = null;
            record.lastSuccessAt = now;
            afterUpdate(record, before, now);
        }
    }

    public void recordFailure(String sourceId, FailureKind kind, Duration latency) {
        SourceRecord record = recordFor(sourceId);
        synchronized (record) {
            Instant now = clock.instant();
            SourceState before = record.state(now);
            record.decay(now);
            record.requestCount++;
            record.errorCount++;
            record.totalWeight += 1.0;
            record.addLatency(latency);
            record.consecutiveFailures++;
            record.lastErrorAt = now;
            record.lastErrorKind = kind;

            boolean suspended = record.suspendedUntil != null && now.isBefore(record.suspendedUntil);
            if (record.consecutiveFailures >= suspendAfterFailures && !suspended) {
                record.suspendedUntil = now.plus(suspensionCooldown);
                log.warn("[HealthTracker] {} SUSPENDED until {} after {} consecutive failures (last: {})",
                    sourceId, record.suspendedUntil, record.consecutiveFailures, kind);
            }
            afterUpdate(record, before, now);
        }
    }

    public SourceState state(String sourceId) {
        SourceRecord record = recordFor(sourceId);
        synchronized (record) {
            SourceState state = record.state(clock.instant());
            if (state != record.lastReportedState) {
                log.info("[HealthTracker] {} {} -> {}", sourceId, record.lastReportedState, state);
                record.lastReportedState = state;
                metrics.recordHealthState(sourceId, state);
            }
            return state;
        }
    }

    /**
     * Decayed average latency; zero for a source with no recorded requests.
     */
    public Duration averageLatency(String sourceId) {
        SourceRecord record = recordFor(sourceId);
        synchronized (record) {
            record.decay(clock.instant());
            return record.averageLatency();
        }
    }

    public SourceHealth snapshot(String sourceId) {
        SourceRecord record = recordFor(sourceId);
        synchronized (record) {
            Instant now = clock.instant();
            record.decay(now);
            return new SourceHealth(
                sourceId,
                record.state(now),
                record.requestCount,
                record.successCount,
                record.errorCount,
                record.consecutiveFailures,
                record.successRate(),
                record.averageLatency(),
                record.lastSuccessAt,
                record.lastErrorAt,
                record.lastErrorKind,
                record.suspendedUntil != null && now.isBefore(record.suspendedUntil) ? record.suspendedUntil : null
            );
        }
    }

    /**
     * Performance report for every known source, ordered by id.
     */
    public Map<String, SourceHealth> snapshotAll() {
        Map<String, SourceHealth> all = new LinkedHashMap<>();
        records.keySet().stream().sorted().forEach(id -> all.put(id, snapshot(id)));
        return all;
    }

    public void register(String sourceId) {
        recordFor(sourceId);
    }

    private SourceRecord recordFor(String sourceId) {
        return records.computeIfAbsent(sourceId, id -> {
            metrics.recordHealthState(id, SourceState.HEALTHY);
            return new SourceRecord(id);
        });
    }

    private void afterUpdate(SourceRecord record, SourceState before, Instant now) {
        SourceState after = record.state(now);
        if (after != before) {
            log.info("[HealthTracker] {} {} -> {} (successRate={}, consecutiveFailures={})",
                record.sourceId, before, after, String.format("%.3f", record.successRate()),
                record.consecutiveFailures);
        }
        if (after != record.lastReportedState) {
            record.lastReportedState = after;
            metrics.recordHealthState(record.sourceId, after);
        }
    }

    /**
     * Mutable per-source state. Guarded by its own monitor.
     */
    private final class SourceRecord {
        private final String sourceId;

        private long requestCount;
        private long successCount;
        private long errorCount;
        private int consecutiveFailures;

        private double successWeight;
        private double totalWeight;
        private double latencyMillisWeighted;
        private double latencyWeight;
        private Instant decayedAt;

        private Instant lastSuccessAt;
        private Instant lastErrorAt;
        private FailureKind lastErrorKind;
        private Instant suspendedUntil;
        private SourceState lastReportedState = SourceState.HEALTHY;

        private SourceRecord(String sourceId) {
            this.sourceId = sourceId;
        }

        private void decay(Instant now) {
            if (decayedAt != null && now.isAfter(decayedAt)) {
                double elapsed = Duration.between(decayedAt, now).toMillis();
                double factor = Math.pow(0.5, elapsed / halfLife.toMillis());
                successWeight *= factor;
                totalWeight *= factor;
                latencyMillisWeighted *= factor;
                latencyWeight *= factor;
            }
            if (decayedAt == null || now.isAfter(decayedAt)) {
                decayedAt = now;
            }
        }

        private void addLatency(Duration latency) {
            latencyMillisWeighted += latency.toMillis();
            latencyWeight += 1.0;
        }

        private double successRate() {
            return totalWeight <= 1e-9 ? 1.0 : successWeight / totalWeight;
        }

        private Duration averageLatency() {
            return latencyWeight <= 1e-9 ? Duration.ZERO
                : Duration.ofMillis(Math.round(latencyMillisWeighted / latencyWeight));
        }

        private SourceState state(Instant now) {
            if (suspendedUntil != null && now.isBefore(suspendedUntil)) {
                return SourceState.SUSPENDED;
            }
            if (successRate() >= healthyThreshold && consecutiveFailures < degradedAfterFailures) {
                return SourceState.HEALTHY;
            }
            return SourceState.DEGRADED;
        }
    }
}
