package in.candlevault.domain.data;

/**
 * What produced a fetch task.
 */
public enum TaskOrigin {
    /** Periodic fetch of the most recent window. */
    LIVE_LOOP,
    /** Chunk of a gap being backfilled. */
    GAP,
    /** Cross-source re-fetch of data already stored. */
    RECONCILIATION
}
