package structdb.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;

public class HeapRecordTest {

    @Test
    void encodesEveryColumnTypeAndNulls() {
        List<ColumnSchema> cols = List.of(
            new ColumnSchema("id", DataType.BIGINT, 0, false),
            new ColumnSchema("price", DataType.DOUBLE, 0, false),
            new ColumnSchema("active", DataType.BOOLEAN, 0, false),
            new ColumnSchema("name", DataType.VARCHAR, 20, false),
            new ColumnSchema("at", DataType.TIMESTAMP, 0, false),
            new ColumnSchema("note", DataType.TEXT, 0, false)
        );
        Instant at = Instant.parse("2024-05-01T10:15:30.123Z");
        HeapRecord rec = new HeapRecord(Arrays.asList(7L, 2.5, false, "Zoë ☕", at, null));
        HeapRecord back = HeapRecord.fromBytes(rec.toBytes(), cols);
        assertEquals(rec.getValues(), back.getValues());
    }

    @Test
    void appendedColumnsReadAsNull() {
        List<ColumnSchema> before = List.of(new ColumnSchema("id", DataType.BIGINT, 0, false));
        List<ColumnSchema> after = List.of(
            new ColumnSchema("id", DataType.BIGINT, 0, false),
            new ColumnSchema("f_extra", DataType.TEXT, 0, false)
        );
        byte[] old = new HeapRecord(List.of(3L)).toBytes();
        assertEquals(1, HeapRecord.fromBytes(old, before).getValues().size());
        HeapRecord widened = HeapRecord.fromBytes(old, after);
        assertEquals(3L, widened.get(0));
        assertNull(widened.get(1));
    }

    @Test
    void longValuesAreCoercedAfterWideningToDouble() {
        byte[] old = new HeapRecord(List.of(5L)).toBytes();
        HeapRecord back = HeapRecord.fromBytes(old, List.of(new ColumnSchema("f_qty", DataType.DOUBLE, 0, false)));
        assertEquals(5.0, back.get(0));
    }

    @Test
    void rejectsUnsupportedValueTypes() {
        HeapRecord rec = new HeapRecord(List.of(new Object()));
        assertThrows(IllegalArgumentException.class, rec::toBytes);
    }
}
