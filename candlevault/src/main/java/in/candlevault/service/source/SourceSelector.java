package in.candlevault.service.source;

import in.candlevault.domain.data.FetchTask;
import in.candlevault.domain.data.RawPoint;
import in.candlevault.domain.data.SeriesKey;
import in.candlevault.domain.error.CircuitOpenException;
import in.candlevault.domain.error.FailureKind;
import in.candlevault.domain.error.SourceException;
import in.candlevault.domain.error.SourcesExhaustedException;
import in.candlevault.domain.health.CircuitState;
import in.candlevault.domain.health.SourceState;
import in.candlevault.infrastructure.metrics.IngestionMetrics;
import in.candlevault.infrastructure.source.SourceAdapter;
import in.candlevault.service.resilience.CircuitBreakerRegistry;
import in.candlevault.service.resilience.HealthTracker;
import in.candlevault.service.resilience.SlidingWindowRateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Picks the source for each fetch attempt and runs it through the
 * rate limiter, circuit breaker and health tracker.
 *
 * Ranking (adapters that cannot serve the series are never considered):
 * 1. breaker CLOSED before HALF_OPEN; OPEN excluded
 * 2. HEALTHY before DEGRADED; SUSPENDED excluded
 * 3. lower decayed average latency first
 * 4. configuration order
 *
 * Candidates are tried in order until one returns. When none does, the
 * attempt fails with {@link SourcesExhaustedException}.
 */
public class SourceSelector {
    private static final Logger log = LoggerFactory.getLogger(SourceSelector.class);

    /**
     * Successful fetch from one source.
     */
    public record FetchResult(String sourceId, List<RawPoint> points, Duration latency) {
    }

    private record Candidate(SourceAdapter adapter, int order, CircuitState circuit, SourceState health, Duration latency) {
    }

    private static final Comparator<Candidate> RANKING = Comparator
        .comparing((Candidate c) -> c.circuit() == CircuitState.CLOSED ? 0 : 1)
        .thenComparing(c -> c.health() == SourceState.HEALTHY ? 0 : 1)
        .thenComparing(Candidate::latency)
        .thenComparingInt(Candidate::order);

    private final List<SourceAdapter> adapters;
    private final SlidingWindowRateLimiter rateLimiter;
    private final CircuitBreakerRegistry breakers;
    private final HealthTracker health;
    private final IngestionMetrics metrics;

    /**
     * @param adapters in configuration order
     */
    public SourceSelector(List<SourceAdapter> adapters, SlidingWindowRateLimiter rateLimiter,
                          CircuitBreakerRegistry breakers, HealthTracker health, IngestionMetrics metrics) {
        this.adapters = List.copyOf(adapters);
        this.rateLimiter = rateLimiter;
        this.breakers = breakers;
        this.health = health;
        this.metrics = metrics;
        for (SourceAdapter adapter : this.adapters) {
            health.register(adapter.id());
            breakers.get(adapter.id());
        }
    }

    public List<SourceAdapter> capable(SeriesKey series) {
        return adapters.stream()
            .filter(a -> a.supports(series.symbol(), series.interval()))
            .toList();
    }

    /**
     * Selectable adapters for the series, best first.
     */
    public List<SourceAdapter> rank(SeriesKey series) {
        return rank(series, Set.of());
    }

    public List<SourceAdapter> rank(SeriesKey series, Set<String> excluded) {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < adapters.size(); i++) {
            SourceAdapter adapter = adapters.get(i);
            if (excluded.contains(adapter.id()) || !adapter.supports(series.symbol(), series.interval())) {
                continue;
            }
            CircuitState circuit = breakers.get(adapter.id()).getState();
            SourceState state = health.state(adapter.id());
            if (circuit == CircuitState.OPEN || !state.isSelectable()) {
                continue;
            }
            candidates.add(new Candidate(adapter, i, circuit, state, health.averageLatency(adapter.id())));
        }
        candidates.sort(RANKING);
        return candidates.stream().map(Candidate::adapter).toList();
    }

    /**
     * Whether at least one capable adapter is currently selectable.
     */
    public boolean anyAvailable(SeriesKey series) {
        return !rank(series).isEmpty();
    }

    public FetchResult fetch(FetchTask task) {
        return fetch(task, Set.of());
    }

    /**
     * Fetch the task's range from the best available source.
     *
     * @param excluded source ids not to use for this attempt
     * @throws SourcesExhaustedException if no candidate returned data
     */
    public FetchResult fetch(FetchTask task, Set<String> excluded) {
        SeriesKey series = task.series();
        List<SourceAdapter> ranked = rank(series, excluded);
        Map<String, FailureKind> attempts = new LinkedHashMap<>();

        for (SourceAdapter adapter : ranked) {
            String sourceId = adapter.id();

            try {
                rateLimiter.acquire(sourceId, task.priority());
            } catch (SourceException e) {
                log.debug("[Selector] {} skipped for {}: {}", sourceId, task, e.getMessage());
                attempts.put(sourceId, e.getKind());
                continue;
            }

            long started = System.nanoTime();
            try {
                List<RawPoint> points = breakers.get(sourceId).call(() -> adapter.fetch(
                    series.symbol(), series.interval(), task.range().start(), task.range().end()));
                Duration latency = Duration.ofNanos(System.nanoTime() - started);
                health.recordSuccess(sourceId, latency);
                metrics.recordSourceRequest(sourceId, "success", latency);
                log.debug("[Selector] {} served {} ({} points, {}ms)", sourceId, task, points.size(), latency.toMillis());
                return new FetchResult(sourceId, points, latency);

            } catch (CircuitOpenException e) {
                attempts.put(sourceId, FailureKind.CIRCUIT_OPEN);

            } catch (SourceException e) {
                Duration latency = Duration.ofNanos(System.nanoTime() - started);
                health.recordFailure(sourceId, e.getKind(), latency);
                metrics.recordSourceRequest(sourceId, e.getKind().name(), latency);
                attempts.put(sourceId, e.getKind());
                log.warn("[Selector] {} failed for {}: {}", sourceId, task, e.getMessage());

            } catch (RuntimeException e) {
                Duration latency = Duration.ofNanos(System.nanoTime() - started);
                health.recordFailure(sourceId, FailureKind.MALFORMED_RESPONSE, latency);
                metrics.recordSourceRequest(sourceId, FailureKind.MALFORMED_RESPONSE.name(), latency);
                attempts.put(sourceId, FailureKind.MALFORMED_RESPONSE);
                log.error("[Selector] {} raised unexpected error for {}: {}", sourceId, task, e.getMessage(), e);
            }
        }

        if (ranked.isEmpty()) {
            throw new SourcesExhaustedException("No available source for " + series, attempts);
        }
        throw new SourcesExhaustedException("All sources failed for " + task, attempts);
    }
}
