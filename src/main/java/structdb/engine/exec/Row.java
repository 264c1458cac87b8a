package structdb.engine.exec;

import java.util.List;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.storage.HeapRecord;
import structdb.engine.storage.RID;

/**
 * Row is an execution pipeline unit (values + RID + column layout).
 * HeapRecord is the storage-level encoding; Row adds identity and schema.
 */
public class Row {
    private final HeapRecord record;
    private final RID rid;
    private final List<ColumnSchema> schema;

    public static Row of(HeapRecord record, RID rid, List<ColumnSchema> schema) { return new Row(record, rid, schema); }

    public Row(HeapRecord record, RID rid, List<ColumnSchema> schema) {
        this.record = record;
        this.rid = rid;
        this.schema = schema;
    }

    public HeapRecord record() { return record; }
    public RID rid() { return rid; }
    public List<Object> values() { return record.getValues(); }
    public Object value(int columnIndex) { return record.get(columnIndex); }
    public List<ColumnSchema> schema() { return schema; }

    @Override
    public String toString() {
        return "Row" + values() + " rid=" + rid;
    }
}
