package structdb.engine.record;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.FieldSpec;
import structdb.engine.catalog.StructureDefinition;
import structdb.engine.catalog.TableSchema;
import structdb.engine.catalog.TypeMapper;
import structdb.engine.error.StorageException;
import structdb.engine.storage.HeapRecord;

/**
 * Converts between stored records and heap rows. The document column holds
 * the whole document as JSON text; projection columns copy the scalar root
 * fields so they can be filtered and sorted without parsing the document.
 */
public class RowMapper {
    private final TypeMapper typeMapper;
    private final Gson gson;

    public RowMapper(TypeMapper typeMapper, Gson gson) {
        this.typeMapper = typeMapper;
        this.gson = gson;
    }

    public HeapRecord toRow(StructureDefinition def, TableSchema layout, long id, Long parentId,
                            JsonObject document, Instant createdAt, Instant updatedAt) {
        Map<String, String> fieldByColumn = new HashMap<>();
        for (Map.Entry<String, FieldSpec> e : def.root().properties().entrySet()) {
            if (e.getValue().isScalar()) fieldByColumn.put(typeMapper.columnName(e.getKey()), e.getKey());
        }
        List<Object> values = new ArrayList<>(layout.columns().size());
        for (ColumnSchema col : layout.columns()) {
            Object v = switch (col.name()) {
                case TableSchema.ID -> id;
                case TableSchema.PARENT_ID -> parentId;
                case TableSchema.DOCUMENT -> gson.toJson(document);
                case TableSchema.CREATED_AT -> createdAt;
                case TableSchema.UPDATED_AT -> updatedAt;
                default -> {
                    String field = fieldByColumn.get(col.name());
                    yield col.deprecated() || field == null ? null : project(col, document.get(field));
                }
            };
            values.add(v);
        }
        return new HeapRecord(values);
    }

    public StoredRecord fromRow(TableSchema layout, HeapRecord row) {
        String text = (String) row.get(layout.indexOf(TableSchema.DOCUMENT));
        JsonObject document;
        try {
            document = gson.fromJson(text, JsonObject.class);
        } catch (JsonParseException e) {
            throw new StorageException("Corrupt document column in table " + layout.name(), e);
        }
        return new StoredRecord(
                (Long) row.get(layout.indexOf(TableSchema.ID)),
                (Long) row.get(layout.indexOf(TableSchema.PARENT_ID)),
                document,
                (Instant) row.get(layout.indexOf(TableSchema.CREATED_AT)),
                (Instant) row.get(layout.indexOf(TableSchema.UPDATED_AT)));
    }

    // Document value to the column's Java type; absent values project as null
    private Object project(ColumnSchema col, JsonElement value) {
        if (value == null || value.isJsonNull() || !value.isJsonPrimitive()) return null;
        return switch (col.type()) {
            case BIGINT -> value.getAsLong();
            case DOUBLE -> value.getAsDouble();
            case BOOLEAN -> value.getAsBoolean();
            case VARCHAR, TEXT -> value.getAsString();
            case TIMESTAMP, JSON -> null;
        };
    }
}
