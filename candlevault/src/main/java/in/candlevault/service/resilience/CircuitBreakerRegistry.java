package in.candlevault.service.resilience;

import in.candlevault.config.IngestionConfig;
import in.candlevault.domain.health.CircuitState;
import in.candlevault.infrastructure.metrics.IngestionMetrics;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link CircuitBreaker} per source.
 */
public class CircuitBreakerRegistry {

    private final int failureThreshold;
    private final Duration cooldown;
    private final Duration maxCooldown;
    private final Clock clock;
    private final IngestionMetrics metrics;
    private final Map<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(int failureThreshold, Duration cooldown, Duration maxCooldown,
                                  Clock clock, IngestionMetrics metrics) {
        this.failureThreshold = failureThreshold;
        this.cooldown = cooldown;
        this.maxCooldown = maxCooldown;
        this.clock = clock;
        this.metrics = metrics;
    }

    public static CircuitBreakerRegistry fromConfig(IngestionConfig config, Clock clock, IngestionMetrics metrics) {
        return new CircuitBreakerRegistry(config.getBreakerFailureThreshold(), config.getBreakerCooldown(),
            config.getBreakerMaxCooldown(), clock, metrics);
    }

    public CircuitBreaker get(String sourceId) {
        return breakers.computeIfAbsent(sourceId, id -> {
            metrics.recordBreakerState(id, CircuitState.CLOSED);
            return new CircuitBreaker(id, failureThreshold, cooldown, maxCooldown, clock, metrics::recordBreakerState);
        });
    }

    /**
     * @return false if no breaker exists for the source
     */
    public boolean reset(String sourceId) {
        CircuitBreaker breaker = breakers.get(sourceId);
        if (breaker == null) {
            return false;
        }
        breaker.reset();
        return true;
    }

    public Map<String, CircuitState> snapshot() {
        Map<String, CircuitState> states = new LinkedHashMap<>();
        breakers.keySet().stream().sorted().forEach(id -> states.put(id, breakers.get(id).getState()));
        return states;
    }
}
