package in.candlevault.domain.monitoring;

/**
 * Alert severity levels for ingestion monitoring.
 */
public enum AlertLevel {
    /**
     * CRITICAL - Collection stopped for every series.
     */
    CRITICAL,

    /**
     * HIGH - A series has no usable source.
     * Examples: all adapters suspended or circuit-open
     */
    HIGH,

    /**
     * MEDIUM - Data loss needs manual attention.
     * Examples: gap exhausted its attempts
     */
    MEDIUM,

    /**
     * INFO - General information
     */
    INFO
}
