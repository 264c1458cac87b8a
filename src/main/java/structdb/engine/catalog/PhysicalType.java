package structdb.engine.catalog;

// Column type plus length; length only matters for VARCHAR, else 0.
public record PhysicalType(DataType type, int length) {
    public static PhysicalType of(DataType type) { return new PhysicalType(type, 0); }

    @Override
    public String toString() {
        return type == DataType.VARCHAR ? "VARCHAR(" + length + ")" : type.name();
    }
}
