package in.candlevault.domain.error;

import java.time.Instant;

/**
 * Raised without contacting the source while its circuit is open.
 */
public class CircuitOpenException extends SourceException {
    private final Instant retryAfter;

    public CircuitOpenException(String sourceId, Instant retryAfter) {
        super(sourceId, FailureKind.CIRCUIT_OPEN, "circuit open until " + retryAfter);
        this.retryAfter = retryAfter;
    }

    public Instant getRetryAfter() {
        return retryAfter;
    }
}
