package structdb.engine.exec;

import java.util.Locale;

/**
 * Case-insensitive substring match on a text column. Null values never match.
 */
public class ContainsPredicate implements Predicate {
    private final int columnIndex;
    private final String needle;

    public ContainsPredicate(int columnIndex, String needle) {
        this.columnIndex = columnIndex;
        this.needle = needle.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean test(Row row) {
        Object v = row.value(columnIndex);
        return v instanceof String s && s.toLowerCase(Locale.ROOT).contains(needle);
    }

    @Override
    public String toString() { return "col[" + columnIndex + "] CONTAINS '" + needle + "'"; }
}
