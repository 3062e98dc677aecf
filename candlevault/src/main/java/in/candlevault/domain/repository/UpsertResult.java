package in.candlevault.domain.repository;

/**
 * Outcome of storing a single data point.
 */
public enum UpsertResult {
    /** New point inserted, or existing point confirmed or upgraded in quality. */
    STORED,
    /** Identical point already stored with at least the same quality and confirmations. */
    UNCHANGED,
    /** A stored point with different values was kept unchanged. */
    CONFLICT
}
