package structdb.engine.exec;

import java.util.List;

import structdb.engine.catalog.ColumnSchema;

/**
 * Minimal physical operator interface
 */
public interface Operator {
    void open();
    Row next(); // returns next row or null when exhausted
    void close();

    /**
     * Column layout of produced rows, or null when the operator does not know it.
     */
    default List<ColumnSchema> schema() { return null; }
}
