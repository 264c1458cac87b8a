package structdb.engine.error;

/**
 * I/O failure in the heap files or the catalog file.
 */
public class StorageException extends StructureStoreException {
    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
