package in.candlevault.domain.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every candidate source was tried (or none was available) for a task attempt.
 */
public class SourcesExhaustedException extends IngestionException {
    private final Map<String, FailureKind> attempts;

    public SourcesExhaustedException(String message, Map<String, FailureKind> attempts) {
        super(dominantKind(attempts), message + " " + attempts);
        this.attempts = Collections.unmodifiableMap(new LinkedHashMap<>(attempts));
    }

    /**
     * Failure kind per attempted source id, in attempt order.
     */
    public Map<String, FailureKind> getAttempts() {
        return attempts;
    }

    public boolean noSourceAvailable() {
        return attempts.isEmpty();
    }

    /**
     * Retryable when nothing was available or any source failed transiently.
     */
    public boolean isRetryable() {
        return attempts.isEmpty() || attempts.values().stream().anyMatch(FailureKind::isTransient);
    }

    private static FailureKind dominantKind(Map<String, FailureKind> attempts) {
        if (attempts.isEmpty()) {
            return FailureKind.UNAVAILABLE;
        }
        return attempts.values().stream()
            .filter(FailureKind::isTransient)
            .findFirst()
            .orElse(attempts.values().iterator().next());
    }
}
