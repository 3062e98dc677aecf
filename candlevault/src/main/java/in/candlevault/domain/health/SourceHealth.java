package in.candlevault.domain.health;

import in.candlevault.domain.error.FailureKind;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time snapshot of an adapter's health record.
 */
public record SourceHealth(
    String sourceId,
    SourceState state,
    long requestCount,
    long successCount,
    long errorCount,
    int consecutiveFailures,
    double successRate,
    Duration averageLatency,
    Instant lastSuccessAt,
    Instant lastErrorAt,
    FailureKind lastErrorKind,
    Instant suspendedUntil
) {
}
