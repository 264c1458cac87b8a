package structdb.engine.query;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.gson.JsonNull;
import com.google.gson.JsonPrimitive;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;
import structdb.engine.catalog.FieldSpec;
import structdb.engine.catalog.SchemaParser;
import structdb.engine.catalog.StructureDefinition;
import structdb.engine.catalog.TableSchema;
import structdb.engine.catalog.TypeMapper;
import structdb.engine.error.UnfilterableFieldException;
import structdb.engine.exec.ComparisonPredicate;
import structdb.engine.exec.CompoundPredicate;
import structdb.engine.exec.ContainsPredicate;
import structdb.engine.exec.EqualityPredicate;
import structdb.engine.exec.Predicate;
import structdb.engine.exec.Row;

/**
 * Compiles list filters and sort keys into physical predicates and row
 * comparators over a table layout.
 *
 * Filterable fields are the reserved {@code id}, {@code parent_id},
 * {@code created_at} and {@code updated_at} plus every scalar root field of
 * the current schema whose projection column is active.
 */
public class PredicateCompiler {
    private final TypeMapper typeMapper;

    public PredicateCompiler(TypeMapper typeMapper) {
        this.typeMapper = typeMapper;
    }

    /** Conjunction of all filters; an empty list matches every row. */
    public Predicate compile(StructureDefinition def, TableSchema layout, List<FilterCondition> filters) {
        List<Predicate> atomic = new ArrayList<>(filters.size());
        for (FilterCondition cond : filters) {
            atomic.add(compileSingle(def, layout, cond));
        }
        return CompoundPredicate.allOf(atomic);
    }

    /**
     * Row order for a listing: the sort column with nulls first (ascending) or
     * last (descending), ties broken by id ascending. A null field sorts by id.
     */
    public Comparator<Row> comparator(StructureDefinition def, TableSchema layout, String sortField, SortOrder order) {
        int idCol = layout.indexOf(TableSchema.ID);
        Comparator<Row> byId = Comparator.comparing(r -> (Long) r.value(idCol));
        if (sortField == null) {
            return order == SortOrder.DESC ? byId.reversed() : byId;
        }
        int col = resolveColumn(def, layout, sortField);
        Comparator<Row> byColumn = Comparator.comparing(r -> comparable(r.value(col)),
                Comparator.nullsFirst(Comparator.<Comparable<Object>>naturalOrder()));
        if (order == SortOrder.DESC) byColumn = byColumn.reversed();
        return byColumn.thenComparing(byId);
    }

    /** Index of the layout column backing a filterable field. */
    public int resolveColumn(StructureDefinition def, TableSchema layout, String field) {
        String column;
        if (TableSchema.ID.equals(field) || TableSchema.PARENT_ID.equals(field)
                || TableSchema.CREATED_AT.equals(field) || TableSchema.UPDATED_AT.equals(field)) {
            column = field;
        } else {
            FieldSpec spec = def.root().property(field);
            if (spec == null || !spec.isScalar()) {
                throw new UnfilterableFieldException(def.name(), field);
            }
            column = typeMapper.columnName(field);
        }
        int idx = layout.indexOf(column);
        if (idx < 0 || layout.columns().get(idx).deprecated()) {
            throw new UnfilterableFieldException(def.name(), field);
        }
        return idx;
    }

    private Predicate compileSingle(StructureDefinition def, TableSchema layout, FilterCondition cond) {
        int colIndex = resolveColumn(def, layout, cond.field());
        ColumnSchema col = layout.columns().get(colIndex);
        FilterCondition.Op op = cond.op();
        Object lit = unwrap(cond.value());

        if (lit == null) {
            return switch (op) {
                case EQ -> new EqualityPredicate(colIndex, null);
                case NE -> new EqualityPredicate(colIndex, null, true);
                default -> throw new IllegalArgumentException("Operator " + op + " needs a non-null value for field '" + cond.field() + "'");
            };
        }
        if (op == FilterCondition.Op.CONTAINS) {
            if (!col.type().isText()) {
                throw new IllegalArgumentException("CONTAINS applies to text fields only: '" + cond.field() + "'");
            }
            if (!(lit instanceof String s)) {
                throw literalError(cond, col);
            }
            return new ContainsPredicate(colIndex, s);
        }

        Object value = coerce(lit, col, cond);
        if (col.type() == DataType.BOOLEAN) {
            return switch (op) {
                case EQ -> new EqualityPredicate(colIndex, value);
                case NE -> new EqualityPredicate(colIndex, value, true);
                default -> throw new IllegalArgumentException("Only EQ and NE apply to boolean field '" + cond.field() + "'");
            };
        }
        return new ComparisonPredicate(colIndex, mapOp(op), (Comparable<?>) value);
    }

    // Literal to the Java type the column stores
    private Object coerce(Object lit, ColumnSchema col, FilterCondition cond) {
        return switch (col.type()) {
            case BIGINT -> {
                BigDecimal n = number(lit, cond, col);
                if (!SchemaParser.isIntegral(n)) throw literalError(cond, col);
                try {
                    yield n.longValueExact();
                } catch (ArithmeticException e) {
                    throw new IllegalArgumentException("Value out of range for field '" + cond.field() + "': " + lit, e);
                }
            }
            case DOUBLE -> number(lit, cond, col).doubleValue();
            case BOOLEAN -> {
                if (lit instanceof Boolean b) yield b;
                if (lit instanceof String s && (s.equalsIgnoreCase("true") || s.equalsIgnoreCase("false"))) {
                    yield Boolean.parseBoolean(s);
                }
                throw literalError(cond, col);
            }
            case VARCHAR, TEXT -> {
                if (lit instanceof String s) yield s;
                throw literalError(cond, col);
            }
            case TIMESTAMP -> {
                if (lit instanceof Instant t) yield t;
                if (lit instanceof String s) {
                    try {
                        yield Instant.parse(s);
                    } catch (DateTimeParseException e) {
                        throw new IllegalArgumentException("Not an ISO-8601 instant for field '" + cond.field() + "': " + s, e);
                    }
                }
                throw literalError(cond, col);
            }
            case JSON -> throw new IllegalStateException("JSON columns are never projected: " + col.name());
        };
    }

    private BigDecimal number(Object lit, FilterCondition cond, ColumnSchema col) {
        try {
            if (lit instanceof BigDecimal d) return d;
            if (lit instanceof Long || lit instanceof Integer || lit instanceof Short || lit instanceof Byte) {
                return BigDecimal.valueOf(((Number) lit).longValue());
            }
            if (lit instanceof Number n) return new BigDecimal(n.toString());
            if (lit instanceof String s) return new BigDecimal(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Not a number for field '" + cond.field() + "': " + lit, e);
        }
        throw literalError(cond, col);
    }

    private static Object unwrap(Object lit) {
        if (lit instanceof JsonPrimitive p) {
            if (p.isBoolean()) return p.getAsBoolean();
            if (p.isNumber()) return p.getAsBigDecimal();
            return p.getAsString();
        }
        if (lit instanceof JsonNull) return null;
        return lit;
    }

    @SuppressWarnings("unchecked")
    private static Comparable<Object> comparable(Object v) {
        return (Comparable<Object>) v;
    }

    private static IllegalArgumentException literalError(FilterCondition cond, ColumnSchema col) {
        Object v = cond.value();
        return new IllegalArgumentException("Expected " + col.physicalType() + " value for field '" + cond.field()
                + "' but got " + (v == null ? "null" : v.getClass().getSimpleName() + " " + v));
    }

    private ComparisonPredicate.Op mapOp(FilterCondition.Op op) {
        return switch (op) {
            case EQ -> ComparisonPredicate.Op.EQ;
            case NE -> ComparisonPredicate.Op.NE;
            case LT -> ComparisonPredicate.Op.LT;
            case LTE -> ComparisonPredicate.Op.LTE;
            case GT -> ComparisonPredicate.Op.GT;
            case GTE -> ComparisonPredicate.Op.GTE;
            case CONTAINS -> throw new IllegalStateException("CONTAINS is not a comparison");
        };
    }
}
