package in.candlevault.domain.data;

/**
 * Scheduling priority of a fetch task. Lower ordinal runs first.
 */
public enum TaskPriority {
    LIVE,
    BACKFILL
}
