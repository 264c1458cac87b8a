package structdb.engine.migration;

import java.util.List;

import structdb.engine.catalog.TableSchema;

/**
 * Column changes needed to bring a table in line with a structure definition,
 * and the layout that results. Computed without side effects.
 *
 * @param creation   true when the table does not exist yet
 * @param added      new projection columns, appended to the layout
 * @param widened    columns whose type widens, as "column: FROM -> TO"
 * @param deprecated columns whose field left the schema or stopped being scalar
 * @param restored   deprecated columns whose field came back
 * @param target     the layout after the change
 */
public record MigrationPlan(String structureName,
                            boolean creation,
                            List<String> added,
                            List<String> widened,
                            List<String> deprecated,
                            List<String> restored,
                            TableSchema target) {
    public MigrationPlan {
        added = List.copyOf(added);
        widened = List.copyOf(widened);
        deprecated = List.copyOf(deprecated);
        restored = List.copyOf(restored);
    }

    /** True when the table already exists and its layout does not change. */
    public boolean isEmpty() {
        return !creation && added.isEmpty() && widened.isEmpty() && deprecated.isEmpty() && restored.isEmpty();
    }
}
