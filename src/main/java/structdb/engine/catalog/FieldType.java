package structdb.engine.catalog;

import java.util.Locale;

import structdb.engine.error.UnsupportedTypeException;

/**
 * Type tokens accepted in schema documents.
 */
public enum FieldType {
    STRING("string"),
    NUMBER("number"),
    INTEGER("integer"),
    BOOLEAN("boolean"),
    ARRAY("array"),
    OBJECT("object");

    private final String token;

    FieldType(String token) {
        this.token = token;
    }

    public String token() { return token; }

    public boolean isScalar() { return this != ARRAY && this != OBJECT; }

    public static FieldType fromToken(String path, String token) {
        if (token != null) {
            String t = token.toLowerCase(Locale.ROOT);
            for (FieldType ft : values()) {
                if (ft.token.equals(t)) return ft;
            }
        }
        throw new UnsupportedTypeException(path, token);
    }
}
