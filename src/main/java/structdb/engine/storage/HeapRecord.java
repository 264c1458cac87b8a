package structdb.engine.storage;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;

/**
 * One row's column values and their on-page encoding.
 *
 * Layout: short valueCount, then per value a one byte tag followed by the payload.
 *   0 null | 1 long (8) | 2 double (8) | 3 boolean (1) | 4 string (int length + UTF-8) | 5 timestamp (long epoch millis)
 *
 * The count lets rows written before a column was appended decode the new column as null,
 * and the tags let rows written before a widening (BIGINT -> DOUBLE) be coerced on read.
 */
public class HeapRecord {
    private static final byte TAG_NULL = 0;
    private static final byte TAG_LONG = 1;
    private static final byte TAG_DOUBLE = 2;
    private static final byte TAG_BOOLEAN = 3;
    private static final byte TAG_STRING = 4;
    private static final byte TAG_TIMESTAMP = 5;

    private static final int COUNT_BYTES = 2;
    private static final int TAG_BYTES = 1;
    private static final int LONG_BYTES = 8;
    private static final int BOOLEAN_BYTES = 1;
    private static final int STRING_PREFIX_BYTES = 4;

    private final List<Object> values;

    public HeapRecord(List<Object> values) {
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public List<Object> getValues() {
        return values;
    }

    public Object get(int index) {
        return values.get(index);
    }

    // Serialize to byte[]; values must already match the column types (see StorageManager.validateRecord)
    public byte[] toBytes() {
        byte[][] strings = new byte[values.size()][];
        int size = COUNT_BYTES;
        for (int i = 0; i < values.size(); i++) {
            Object v = values.get(i);
            size += TAG_BYTES;
            if (v instanceof Long || v instanceof Double || v instanceof Instant) {
                size += LONG_BYTES;
            } else if (v instanceof Boolean) {
                size += BOOLEAN_BYTES;
            } else if (v instanceof String s) {
                strings[i] = s.getBytes(StandardCharsets.UTF_8);
                size += STRING_PREFIX_BYTES + strings[i].length;
            } else if (v != null) {
                throw new IllegalArgumentException("Unsupported value type: " + v.getClass().getSimpleName());
            }
        }

        ByteBuffer buffer = ByteBuffer.allocate(size);
        buffer.putShort((short) values.size());
        for (int i = 0; i < values.size(); i++) {
            Object v = values.get(i);
            if (v == null) {
                buffer.put(TAG_NULL);
            } else if (v instanceof Long l) {
                buffer.put(TAG_LONG).putLong(l);
            } else if (v instanceof Double d) {
                buffer.put(TAG_DOUBLE).putDouble(d);
            } else if (v instanceof Boolean b) {
                buffer.put(TAG_BOOLEAN).put((byte) (b ? 1 : 0));
            } else if (v instanceof Instant t) {
                buffer.put(TAG_TIMESTAMP).putLong(t.toEpochMilli());
            } else {
                buffer.put(TAG_STRING).putInt(strings[i].length).put(strings[i]);
            }
        }
        return buffer.array();
    }

    // Deserialize against the current layout; columns past the stored count read as null
    public static HeapRecord fromBytes(byte[] data, List<ColumnSchema> columns) {
        ByteBuffer buffer = ByteBuffer.wrap(data);
        int stored = buffer.getShort() & 0xFFFF;
        List<Object> values = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            if (i >= stored) {
                values.add(null);
                continue;
            }
            values.add(coerce(readValue(buffer), columns.get(i)));
        }
        return new HeapRecord(values);
    }

    private static Object readValue(ByteBuffer buffer) {
        byte tag = buffer.get();
        return switch (tag) {
            case TAG_NULL -> null;
            case TAG_LONG -> buffer.getLong();
            case TAG_DOUBLE -> buffer.getDouble();
            case TAG_BOOLEAN -> buffer.get() == 1;
            case TAG_STRING -> {
                int len = buffer.getInt();
                byte[] strBytes = new byte[len];
                buffer.get(strBytes);
                yield new String(strBytes, StandardCharsets.UTF_8);
            }
            case TAG_TIMESTAMP -> Instant.ofEpochMilli(buffer.getLong());
            default -> throw new IllegalStateException("Corrupt row: unknown value tag " + tag);
        };
    }

    private static Object coerce(Object v, ColumnSchema col) {
        if (v instanceof Long l && col.type() == DataType.DOUBLE) {
            return l.doubleValue();
        }
        return v;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
