package structdb.engine.error;

/**
 * Timed out waiting for a per-structure lock.
 */
public class ConcurrencyException extends StructureStoreException {
    public ConcurrencyException(String message) {
        super(message);
    }

    public ConcurrencyException(String message, Throwable cause) {
        super(message, cause);
    }
}
