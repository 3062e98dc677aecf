package in.candlevault.domain.health;

/**
 * Availability classification of a source adapter.
 */
public enum SourceState {
    /** Success rate at or above threshold and few consecutive failures. */
    HEALTHY,
    /** Usable but ranked behind healthy sources. */
    DEGRADED,
    /** Excluded from selection until the suspension cooldown expires. */
    SUSPENDED;

    public boolean isSelectable() {
        return this != SUSPENDED;
    }
}
