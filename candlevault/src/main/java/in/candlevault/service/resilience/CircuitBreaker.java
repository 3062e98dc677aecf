package in.candlevault.service.resilience;

import in.candlevault.domain.error.CircuitOpenException;
import in.candlevault.domain.health.CircuitState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Per-source circuit breaker.
 *
 * <pre>
 * CLOSED --(failureThreshold consecutive failures)--> OPEN
 * OPEN --(cooldown elapsed)--> HALF_OPEN
 * HALF_OPEN --(trial success)--> CLOSED
 * HALF_OPEN --(trial failure)--> OPEN, cooldown doubled up to maxCooldown
 * </pre>
 *
 * OPEN rejects calls without contacting the source. HALF_OPEN admits one
 * trial call at a time. The OPEN to HALF_OPEN move happens lazily when the
 * state is read.
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final String sourceId;
    private final int failureThreshold;
    private final Duration initialCooldown;
    private final Duration maxCooldown;
    private final Clock clock;
    private final BiConsumer<String, CircuitState> stateListener;

    private CircuitState state = CircuitState.CLOSED;
    private int consecutiveFailures = 0;
    private Duration currentCooldown;
    private Instant openUntil;
    private boolean trialInFlight = false;

    public CircuitBreaker(String sourceId, int failureThreshold, Duration cooldown, Duration maxCooldown,
                          Clock clock, BiConsumer<String, CircuitState> stateListener) {
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be >= 1");
        }
        if (maxCooldown.compareTo(cooldown) < 0) {
            throw new IllegalArgumentException("Max cooldown must be >= cooldown");
        }
        this.sourceId = sourceId;
        this.failureThreshold = failureThreshold;
        this.initialCooldown = cooldown;
        this.maxCooldown = maxCooldown;
        this.clock = clock;
        this.stateListener = stateListener;
        this.currentCooldown = cooldown;
    }

    /**
     * Run {@code action} through the breaker.
     *
     * @throws CircuitOpenException if the circuit rejects the call
     */
    public <T> T call(Supplier<T> action) {
        acquirePermission();
        T result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    public synchronized void acquirePermission() {
        CircuitState current = currentState();
        if (current == CircuitState.OPEN) {
            throw new CircuitOpenException(sourceId, openUntil);
        }
        if (current == CircuitState.HALF_OPEN) {
            if (trialInFlight) {
                throw new CircuitOpenException(sourceId, clock.instant());
            }
            trialInFlight = true;
        }
    }

    public synchronized void onSuccess() {
        consecutiveFailures = 0;
        trialInFlight = false;
        currentCooldown = initialCooldown;
        if (state != CircuitState.CLOSED) {
            log.info("[CircuitBreaker] {} closed after successful trial", sourceId);
            transition(CircuitState.CLOSED);
        }
    }

    public synchronized void onFailure() {
        CircuitState current = currentState();
        trialInFlight = false;
        if (current == CircuitState.HALF_OPEN) {
            long doubled = Math.min(currentCooldown.toMillis() * 2, maxCooldown.toMillis());
            currentCooldown = Duration.ofMillis(doubled);
            open("trial call failed");
            return;
        }
        consecutiveFailures++;
        if (current == CircuitState.CLOSED && consecutiveFailures >= failureThreshold) {
            open(consecutiveFailures + " consecutive failures");
        }
    }

    public synchronized CircuitState getState() {
        return currentState();
    }

    public synchronized int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public synchronized Duration getCurrentCooldown() {
        return currentCooldown;
    }

    /**
     * End of the current open period, or null when not open.
     */
    public synchronized Instant getOpenUntil() {
        return currentState() == CircuitState.OPEN ? openUntil : null;
    }

    /**
     * Manual reset to CLOSED with the initial cooldown.
     */
    public synchronized void reset() {
        log.info("[CircuitBreaker] {} manually reset", sourceId);
        consecutiveFailures = 0;
        trialInFlight = false;
        currentCooldown = initialCooldown;
        openUntil = null;
        transition(CircuitState.CLOSED);
    }

    public String getSourceId() {
        return sourceId;
    }

    private CircuitState currentState() {
        if (state == CircuitState.OPEN && !clock.instant().isBefore(openUntil)) {
            log.info("[CircuitBreaker] {} cooldown elapsed, half-open", sourceId);
            transition(CircuitState.HALF_OPEN);
        }
        return state;
    }

    private void open(String reason) {
        openUntil = clock.instant().plus(currentCooldown);
        log.warn("[CircuitBreaker] {} OPEN for {}s: {}", sourceId, currentCooldown.toSeconds(), reason);
        transition(CircuitState.OPEN);
    }

    private void transition(CircuitState next) {
        if (state == next) {
            return;
        }
        state = next;
        if (stateListener != null) {
            stateListener.accept(sourceId, next);
        }
    }
}
