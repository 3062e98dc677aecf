package in.candlevault.domain.error;

/**
 * Unchecked wrapper for storage failures.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
