package structdb.engine.exec;

/**
 * Equality on one column. A null expected value means IS NULL; negated
 * turns it into IS NOT NULL / not-equal. Used for BOOLEAN columns and null tests.
 */
public class EqualityPredicate implements Predicate {
    private final int columnIndex;
    private final Object expected;
    private final boolean negated;

    public EqualityPredicate(int columnIndex, Object expected) {
        this(columnIndex, expected, false);
    }

    public EqualityPredicate(int columnIndex, Object expected, boolean negated) {
        this.columnIndex = columnIndex;
        this.expected = expected;
        this.negated = negated;
    }

    @Override
    public boolean test(Row row) {
        Object v = row.value(columnIndex);
        if (expected == null) {
            return negated ? v != null : v == null;
        }
        if (v == null) return false;
        return negated != expected.equals(v);
    }

    // For debugging
    @Override
    public String toString() { return "col[" + columnIndex + "] " + (negated ? "!= " : "= ") + expected; }
}
