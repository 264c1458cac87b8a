package structdb.engine.error;

/**
 * Malformed or unsupported schema document.
 */
public class SchemaException extends StructureStoreException {
    private final String path; // location inside the schema document, "" for the root

    public SchemaException(String path, String message) {
        super(path == null || path.isEmpty() ? message : path + ": " + message);
        this.path = path == null ? "" : path;
    }

    public SchemaException(String path, String message, Throwable cause) {
        super(path == null || path.isEmpty() ? message : path + ": " + message, cause);
        this.path = path == null ? "" : path;
    }

    public String path() { return path; }
}
