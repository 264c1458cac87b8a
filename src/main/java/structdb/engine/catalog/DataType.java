package structdb.engine.catalog;

/**
 * Physical column types of a structure table.
 * JSON marks array and object fields; such fields live only inside the document column.
 */
public enum DataType {
    BIGINT,
    DOUBLE,
    BOOLEAN,
    VARCHAR,
    TEXT,
    TIMESTAMP,
    JSON;

    public boolean isProjectable() { return this != JSON; }

    public boolean isText() { return this == VARCHAR || this == TEXT; }
}
