package structdb.engine.error;

/**
 * The operation collides with the current state: a structure that already
 * exists, or a schema update based on a version that is no longer current.
 */
public class ConflictException extends StructureStoreException {
    public ConflictException(String message) {
        super(message);
    }
}
