package structdb.engine.catalog;

// Immutable data carrier for a table column.
// length: only matters for VARCHAR else 0.
// deprecated: the field left the schema; the column stays until vacuum.
public record ColumnSchema(String name, DataType type, int length, boolean deprecated) {
    public static ColumnSchema of(String name, PhysicalType pt) {
        return new ColumnSchema(name, pt.type(), pt.length(), false);
    }

    public PhysicalType physicalType() { return new PhysicalType(type, length); }

    public ColumnSchema withType(PhysicalType pt) { return new ColumnSchema(name, pt.type(), pt.length(), deprecated); }

    public ColumnSchema withDeprecated(boolean flag) { return new ColumnSchema(name, type, length, flag); }
}
