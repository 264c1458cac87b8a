package structdb.engine.query;

import java.util.Objects;

/**
 * Single-field list filter: field, operator and literal.
 * The literal is coerced to the column type when the filter is compiled.
 */
public class FilterCondition {
    public enum Op { EQ, NE, LT, LTE, GT, GTE, CONTAINS }

    private final String field;
    private final Op op;
    private final Object value; // null only with EQ / NE

    public FilterCondition(String field, Op op, Object value) {
        this.field = Objects.requireNonNull(field, "field");
        this.op = Objects.requireNonNull(op, "op");
        this.value = value;
    }

    public static FilterCondition of(String field, Op op, Object value) {
        return new FilterCondition(field, op, value);
    }

    public String field() { return field; }
    public Op op() { return op; }
    public Object value() { return value; }

    @Override
    public String toString() { return field + " " + op + " " + value; }
}
