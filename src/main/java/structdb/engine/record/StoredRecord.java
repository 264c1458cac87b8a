package structdb.engine.record;

import java.time.Instant;

import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import structdb.engine.catalog.TableSchema;

/**
 * One stored instance of a structure.
 *
 * @param parentId parent record in the same structure, null for roots
 * @param document the validated document, without id and parent_id
 */
public record StoredRecord(long id, Long parentId, JsonObject document, Instant createdAt, Instant updatedAt) {

    @Override
    public JsonObject document() { return document.deepCopy(); }

    /** The document with id and parent_id added, as handed to clients and subscribers. */
    public JsonObject toJson() {
        JsonObject out = new JsonObject();
        out.addProperty(TableSchema.ID, id);
        out.add(TableSchema.PARENT_ID, parentId == null ? JsonNull.INSTANCE : new JsonPrimitive(parentId));
        document.entrySet().forEach(e -> out.add(e.getKey(), e.getValue().deepCopy()));
        return out;
    }
}
