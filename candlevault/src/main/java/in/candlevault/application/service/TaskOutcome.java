package in.candlevault.application.service;

/**
 * Result of a successful fetch task attempt.
 *
 * @param received  points returned by the source inside the task range
 * @param expected  aligned timestamps in the task range
 * @param stored    points inserted or upgraded
 */
public record TaskOutcome(
    String sourceId,
    int received,
    long expected,
    int stored,
    int confirmed,
    int unchanged,
    int disputed
) {
    public boolean isPartial() {
        return received < expected;
    }
}
