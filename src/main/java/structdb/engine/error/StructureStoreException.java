package structdb.engine.error;

/**
 * Base type of every failure raised by the structure store. All failures are
 * unchecked and local to the operation that raised them.
 */
public class StructureStoreException extends RuntimeException {
    public StructureStoreException(String message) {
        super(message);
    }

    public StructureStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
