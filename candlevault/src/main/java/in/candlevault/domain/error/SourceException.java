package in.candlevault.domain.error;

/**
 * Failure reported by a source adapter.
 */
public class SourceException extends IngestionException {
    private final String sourceId;

    public SourceException(String sourceId, FailureKind kind, String message) {
        super(kind, String.format("[%s] %s: %s", sourceId, kind, message));
        this.sourceId = sourceId;
    }

    public SourceException(String sourceId, FailureKind kind, String message, Throwable cause) {
        super(kind, String.format("[%s] %s: %s", sourceId, kind, message), cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
