package in.candlevault.infrastructure.source;

import in.candlevault.domain.data.Interval;
import in.candlevault.domain.data.RawPoint;

import java.time.Instant;
import java.util.List;

/**
 * Uniform contract every market-data provider is accessed through.
 *
 * Implementations translate provider wire formats into {@link RawPoint}s and
 * provider failures into {@link in.candlevault.domain.error.SourceException}
 * with a {@link in.candlevault.domain.error.FailureKind}. They hold no health,
 * breaker or rate-limit state.
 */
public interface SourceAdapter {

    /**
     * Stable adapter id, used as the key for health, breaker and quota state.
     */
    String id();

    /**
     * Whether this adapter can serve the series at all.
     */
    boolean supports(String symbol, Interval interval);

    /**
     * Fetch points in [start, end).
     *
     * @return points sorted by timestamp ascending, possibly fewer than the range holds
     * @throws in.candlevault.domain.error.SourceException on failure
     */
    List<RawPoint> fetch(String symbol, Interval interval, Instant start, Instant end);
}
