package structdb.engine.error;

/**
 * A schema used a type token the engine does not know.
 */
public class UnsupportedTypeException extends SchemaException {
    private final String token;

    public UnsupportedTypeException(String path, String token) {
        super(path, "unsupported type '" + token + "'");
        this.token = token;
    }

    public String token() { return token; }
}
