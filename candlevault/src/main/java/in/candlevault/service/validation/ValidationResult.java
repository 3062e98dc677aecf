package in.candlevault.service.validation;

import in.candlevault.domain.data.DataPoint;

import java.util.List;

/**
 * Outcome of validating an accepted batch.
 *
 * @param toStore     new points and confirmed (quality-raised) copies of stored points
 * @param newPoints   points with no stored counterpart
 * @param confirmations stored points confirmed by a different source
 * @param unchanged   points already stored with matching values
 * @param disputed    points skipped because sources disagree (reconciliation only)
 */
public record ValidationResult(
    List<DataPoint> toStore,
    int newPoints,
    int confirmations,
    int unchanged,
    int disputed
) {
    public ValidationResult {
        toStore = List.copyOf(toStore);
    }
}
