package in.candlevault.domain.error;

import java.util.List;

/**
 * A batch was rejected by the validator. Nothing from it was persisted.
 */
public class ValidationException extends IngestionException {
    private final List<String> violations;

    public ValidationException(String sourceId, List<String> violations) {
        super(FailureKind.VALIDATION_FAILED,
            String.format("Batch from %s rejected: %s", sourceId, summarize(violations)));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }

    private static String summarize(List<String> violations) {
        if (violations.size() <= 3) {
            return String.join("; ", violations);
        }
        return String.join("; ", violations.subList(0, 3)) + " (+" + (violations.size() - 3) + " more)";
    }
}
