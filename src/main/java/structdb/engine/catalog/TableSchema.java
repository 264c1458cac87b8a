package structdb.engine.catalog;

import java.util.List;

// Immutable data carrier for a structure table layout.
// Column order is the on-disk value order; new columns are only ever appended.
public record TableSchema(String name, List<ColumnSchema> columns, String filePath) {
    public static final String ID = "id";
    public static final String PARENT_ID = "parent_id";
    public static final String DOCUMENT = "document";
    public static final String CREATED_AT = "created_at";
    public static final String UPDATED_AT = "updated_at";

    public TableSchema {
        columns = List.copyOf(columns);
    }

    public static boolean isReserved(String column) {
        return ID.equals(column) || PARENT_ID.equals(column) || DOCUMENT.equals(column)
                || CREATED_AT.equals(column) || UPDATED_AT.equals(column);
    }

    /** Position of a column by name, -1 if absent. */
    public int indexOf(String column) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).name().equals(column)) return i;
        }
        return -1;
    }

    public ColumnSchema column(String column) {
        int idx = indexOf(column);
        return idx < 0 ? null : columns.get(idx);
    }

    public List<ColumnSchema> deprecatedColumns() {
        return columns.stream().filter(ColumnSchema::deprecated).toList();
    }

    public TableSchema withColumns(List<ColumnSchema> newColumns) {
        return new TableSchema(name, newColumns, filePath);
    }

    public TableSchema withFile(List<ColumnSchema> newColumns, String newFilePath) {
        return new TableSchema(name, newColumns, newFilePath);
    }
}
