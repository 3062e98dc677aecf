package in.candlevault.domain.error;

/**
 * Classification of every failure that can end a fetch attempt.
 */
public enum FailureKind {
    TIMEOUT(true),
    RATE_LIMITED(true),
    AUTH_ERROR(false),
    MALFORMED_RESPONSE(false),
    UNAVAILABLE(true),
    CIRCUIT_OPEN(true),
    VALIDATION_FAILED(false);

    private final boolean transientFailure;

    FailureKind(boolean transientFailure) {
        this.transientFailure = transientFailure;
    }

    /**
     * Whether retrying the same request later may succeed.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
