package in.candlevault.domain.error;

/**
 * Base exception for failures of a fetch attempt, classified by {@link FailureKind}.
 */
public class IngestionException extends RuntimeException {
    private final FailureKind kind;

    public IngestionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public IngestionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
