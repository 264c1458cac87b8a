package structdb.engine.catalog;

import java.time.Instant;

import com.google.gson.JsonObject;

/**
 * A registered structure: its schema document as submitted, the parsed field
 * tree, the effective nesting limit and the version counter.
 */
public record StructureDefinition(String name,
                                  JsonObject schema,
                                  FieldSpec root,
                                  int maxDepth,
                                  int version,
                                  Instant createdAt,
                                  Instant updatedAt) {

    // JsonObject is mutable; hand out copies so callers can not edit a registered schema
    @Override
    public JsonObject schema() { return schema.deepCopy(); }

    public StructureDefinition nextVersion(JsonObject newSchema, FieldSpec newRoot, int newMaxDepth, Instant now) {
        return new StructureDefinition(name, newSchema, newRoot, newMaxDepth, version + 1, createdAt, now);
    }
}
