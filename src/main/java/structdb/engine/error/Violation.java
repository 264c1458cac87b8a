package structdb.engine.error;

/**
 * One field-level validation failure.
 *
 * @param field   dotted path of the offending value, array items as {@code name[i]}
 * @param rule    the schema keyword that failed (required, type, maxLength, ...)
 * @param message human readable detail
 */
public record Violation(String field, String rule, String message) {
    @Override
    public String toString() {
        return field + " [" + rule + "]: " + message;
    }
}
