package structdb.engine.error;

/**
 * Unknown structure or record.
 */
public class NotFoundException extends StructureStoreException {
    private final String structureName;
    private final Long recordId; // null when the structure itself is missing

    private NotFoundException(String message, String structureName, Long recordId) {
        super(message);
        this.structureName = structureName;
        this.recordId = recordId;
    }

    public static NotFoundException structure(String name) {
        return new NotFoundException("Structure not found: " + name, name, null);
    }

    public static NotFoundException record(String name, long id) {
        return new NotFoundException("Record " + id + " not found in structure " + name, name, id);
    }

    public String structureName() { return structureName; }
    public Long recordId() { return recordId; }
}
