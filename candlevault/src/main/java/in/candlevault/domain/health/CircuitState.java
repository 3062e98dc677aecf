package in.candlevault.domain.health;

/**
 * Circuit breaker states.
 */
public enum CircuitState {
    CLOSED,
    HALF_OPEN,
    OPEN
}
