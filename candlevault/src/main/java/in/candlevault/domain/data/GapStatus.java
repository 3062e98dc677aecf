package in.candlevault.domain.data;

/**
 * Lifecycle of a detected gap.
 */
public enum GapStatus {
    PENDING,
    IN_PROGRESS,
    RESOLVED,
    FAILED;

    public boolean isOpen() {
        return this == PENDING || this == IN_PROGRESS;
    }
}
