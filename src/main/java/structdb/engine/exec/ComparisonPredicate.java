package structdb.engine.exec;

import java.util.List;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;

/**
 * Ordered comparison of one column against a literal of the column's Java type
 * (Long, Double, String or Instant). A null column value never matches.
 */
public class ComparisonPredicate implements Predicate {
    public enum Op { EQ, NE, LT, LTE, GT, GTE }

    private final int columnIndex;
    private final Op op;
    private final Comparable<Object> value;

    @SuppressWarnings("unchecked")
    public ComparisonPredicate(int columnIndex, Op op, Comparable<?> value) {
        if (value == null) throw new IllegalArgumentException("Comparison literal must not be null");
        this.columnIndex = columnIndex;
        this.op = op;
        this.value = (Comparable<Object>) value;
    }

    public static ComparisonPredicate forColumnName(List<ColumnSchema> schema, String columnName, Op op, Comparable<?> value) {
        for (int i = 0; i < schema.size(); i++) {
            ColumnSchema c = schema.get(i);
            if (c.name().equals(columnName)) {
                if (c.type() == DataType.BOOLEAN || c.type() == DataType.JSON) {
                    throw new IllegalArgumentException("ComparisonPredicate does not support " + c.type() + " columns: " + columnName);
                }
                return new ComparisonPredicate(i, op, value);
            }
        }
        throw new IllegalArgumentException("Column not found: " + columnName);
    }

    @Override
    public boolean test(Row row) {
        Object v = row.value(columnIndex);
        if (v == null) return false;
        // literal.compareTo(v) is the negated order of v against the literal
        int cmp = -value.compareTo(v);
        return switch (op) {
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case LT -> cmp < 0;
            case LTE -> cmp <= 0;
            case GT -> cmp > 0;
            case GTE -> cmp >= 0;
        };
    }

    @Override
    public String toString() { return "col[" + columnIndex + "] " + op + " " + value; }
}
