package structdb.engine.error;

import java.util.List;

/**
 * A schema update asked for a column type change that is not a declared
 * widening conversion. Nothing was applied.
 */
public class IncompatibleMigrationException extends StructureStoreException {
    private final String structureName;
    private final List<String> changes;

    public IncompatibleMigrationException(String structureName, List<String> changes) {
        super("Incompatible column changes for structure " + structureName + ": " + String.join("; ", changes));
        this.structureName = structureName;
        this.changes = List.copyOf(changes);
    }

    public String structureName() { return structureName; }
    public List<String> changes() { return changes; }
}
