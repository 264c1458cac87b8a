package structdb.engine.error;

/**
 * Filter or sort on a field that has no projection column.
 */
public class UnfilterableFieldException extends StructureStoreException {
    private final String field;

    public UnfilterableFieldException(String structureName, String field) {
        super("Field '" + field + "' of structure " + structureName + " has no projection column and cannot be filtered or sorted on");
        this.field = field;
    }

    public String field() { return field; }
}
