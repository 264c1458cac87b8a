package structdb.engine.catalog;

import java.io.IOException;
import java.io.StringReader;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import structdb.engine.error.DepthExceededException;
import structdb.engine.error.SchemaException;

/**
 * Turns schema text into a {@link FieldSpec} tree.
 *
 * Supported keywords: type, properties, required, additionalProperties, items,
 * minLength, maxLength, pattern, minimum, maximum, exclusiveMinimum,
 * exclusiveMaximum, multipleOf, enum, default, minItems, maxItems, uniqueItems,
 * index, and {"$ref": "#"} as a reference back to the root object.
 * A root-level maxDepth may tighten the engine's nesting limit.
 * title and description are accepted and ignored.
 *
 * The text is read with a streaming reader so duplicated keys are reported
 * instead of silently overwritten.
 */
public class SchemaParser {
    public static final String REF = "$ref";
    public static final String ROOT_REF = "#";
    public static final String MAX_DEPTH = "maxDepth";

    // Top-level document keys the record store owns
    private static final Set<String> RESERVED_FIELDS = Set.of(TableSchema.ID, TableSchema.PARENT_ID);

    private static final Set<String> STRING_KEYWORDS = Set.of("minLength", "maxLength", "pattern");
    private static final Set<String> NUMERIC_KEYWORDS = Set.of("minimum", "maximum", "exclusiveMinimum", "exclusiveMaximum", "multipleOf");
    private static final Set<String> ARRAY_KEYWORDS = Set.of("items", "minItems", "maxItems", "uniqueItems");
    private static final Set<String> OBJECT_KEYWORDS = Set.of("properties", "required", "additionalProperties");

    public record ParsedSchema(JsonObject document, FieldSpec root, int maxDepth) {}

    private final int configMaxDepth;
    private final TypeMapper typeMapper;

    public SchemaParser(int configMaxDepth, TypeMapper typeMapper) {
        this.configMaxDepth = configMaxDepth;
        this.typeMapper = typeMapper;
    }

    public ParsedSchema parse(String schemaJson) {
        if (schemaJson == null || schemaJson.isBlank()) {
            throw new SchemaException("", "schema document is empty");
        }
        JsonElement doc = readStrict(schemaJson);
        if (!doc.isJsonObject()) {
            throw new SchemaException("", "schema root must be a JSON object");
        }
        JsonObject root = doc.getAsJsonObject();
        if (root.has(REF)) {
            throw new SchemaException("", "the root can not be a self-reference");
        }
        JsonElement typeEl = root.get("type");
        if (typeEl == null || !isString(typeEl)) {
            throw new SchemaException("", "root must declare \"type\": \"object\"");
        }
        FieldType rootType = FieldType.fromToken("", typeEl.getAsString());
        if (rootType != FieldType.OBJECT) {
            throw new SchemaException("", "root must be of type object, got " + rootType.token());
        }
        int maxDepth = declaredMaxDepth(root);
        FieldSpec spec = parseNode(root, "", 0, maxDepth);
        checkRootFields(spec);
        return new ParsedSchema(root, spec, maxDepth);
    }

    private int declaredMaxDepth(JsonObject root) {
        JsonElement el = root.get(MAX_DEPTH);
        if (el == null) return configMaxDepth;
        int declared = nonNegativeInt(el, MAX_DEPTH);
        if (declared < 1 || declared > configMaxDepth) {
            throw new SchemaException(MAX_DEPTH, "must be within [1, " + configMaxDepth + "] (got " + declared + ")");
        }
        return declared;
    }

    private void checkRootFields(FieldSpec root) {
        Map<String, String> columns = new HashMap<>();
        for (Map.Entry<String, FieldSpec> e : root.properties().entrySet()) {
            String field = e.getKey();
            if (RESERVED_FIELDS.contains(field)) {
                throw new SchemaException(field, "'" + field + "' is reserved by the record store");
            }
            if (!e.getValue().isScalar()) continue;
            String column = typeMapper.columnName(field);
            String clash = columns.putIfAbsent(column, field);
            if (clash != null) {
                throw new SchemaException(field, "maps to the same column '" + column + "' as field '" + clash + "'");
            }
        }
    }

    private FieldSpec parseNode(JsonObject node, String path, int depth, int maxDepth) {
        if (node.has(REF)) {
            JsonElement ref = node.get(REF);
            if (!isString(ref) || !ROOT_REF.equals(ref.getAsString())) {
                throw new SchemaException(path, "only the root self-reference \"#\" is supported");
            }
            if (node.size() != 1) {
                throw new SchemaException(path, "a self-reference can not carry other keywords");
            }
            if (depth > maxDepth) {
                throw new SchemaException(path, "self-reference below the maximum nesting depth of " + maxDepth);
            }
            return FieldSpec.rootReference();
        }
        if (depth > maxDepth) {
            throw new DepthExceededException(path, maxDepth);
        }
        JsonElement typeEl = node.get("type");
        if (typeEl == null) throw new SchemaException(path, "missing \"type\"");
        if (!isString(typeEl)) throw new SchemaException(path, "\"type\" must be a string");
        FieldType type = FieldType.fromToken(path, typeEl.getAsString());

        checkKeywordsApply(node, path, type);
        FieldConstraints constraints = parseConstraints(node, path, type);
        // "index" must be a boolean when present; no secondary index is built for it
        optBoolean(node, "index", path);

        switch (type) {
            case ARRAY -> {
                JsonElement itemsEl = node.get("items");
                if (itemsEl == null || !itemsEl.isJsonObject()) {
                    throw new SchemaException(path, "array fields must declare an \"items\" object");
                }
                FieldSpec items = parseNode(itemsEl.getAsJsonObject(), path + "[]", depth + 1, maxDepth);
                FieldSpec spec = new FieldSpec(type, constraints, items, Map.of(), Set.of(), false, false);
                checkDefault(spec, path);
                return spec;
            }
            case OBJECT -> {
                Map<String, FieldSpec> props = new LinkedHashMap<>();
                JsonElement propsEl = node.get("properties");
                if (propsEl != null) {
                    if (!propsEl.isJsonObject()) throw new SchemaException(path, "\"properties\" must be an object");
                    for (Map.Entry<String, JsonElement> e : propsEl.getAsJsonObject().entrySet()) {
                        String name = e.getKey();
                        String childPath = childPath(path, name);
                        if (name.isEmpty()) throw new SchemaException(path, "field names can not be empty");
                        if (!e.getValue().isJsonObject()) throw new SchemaException(childPath, "field definition must be an object");
                        props.put(name, parseNode(e.getValue().getAsJsonObject(), childPath, depth + 1, maxDepth));
                    }
                }
                Set<String> required = parseRequired(node, path, props);
                boolean additional = optBoolean(node, "additionalProperties", path);
                FieldSpec spec = new FieldSpec(type, constraints, null, props, required, additional, false);
                checkDefault(spec, path);
                return spec;
            }
            default -> {
                FieldSpec spec = FieldSpec.scalar(type, constraints);
                checkDefault(spec, path);
                return spec;
            }
        }
    }

    private void checkKeywordsApply(JsonObject node, String path, FieldType type) {
        for (String key : node.keySet()) {
            boolean misplaced =
                    (STRING_KEYWORDS.contains(key) && type != FieldType.STRING)
                    || (NUMERIC_KEYWORDS.contains(key) && type != FieldType.NUMBER && type != FieldType.INTEGER)
                    || (ARRAY_KEYWORDS.contains(key) && type != FieldType.ARRAY)
                    || (OBJECT_KEYWORDS.contains(key) && type != FieldType.OBJECT);
            if (misplaced) {
                throw new SchemaException(path, "\"" + key + "\" does not apply to " + type.token() + " fields");
            }
        }
        if (node.has("enum") && !type.isScalar()) {
            throw new SchemaException(path, "\"enum\" applies to scalar fields only");
        }
    }

    private FieldConstraints parseConstraints(JsonObject node, String path, FieldType type) {
        Integer minLength = optInt(node, "minLength", path);
        Integer maxLength = optInt(node, "maxLength", path);
        if (minLength != null && maxLength != null && minLength > maxLength) {
            throw new SchemaException(path, "minLength " + minLength + " exceeds maxLength " + maxLength);
        }
        Pattern pattern = null;
        JsonElement patternEl = node.get("pattern");
        if (patternEl != null) {
            if (!isString(patternEl)) throw new SchemaException(path, "\"pattern\" must be a string");
            try {
                pattern = Pattern.compile(patternEl.getAsString());
            } catch (PatternSyntaxException e) {
                throw new SchemaException(path, "invalid pattern: " + e.getDescription(), e);
            }
        }
        BigDecimal minimum = optNumber(node, "minimum", path);
        BigDecimal maximum = optNumber(node, "maximum", path);
        BigDecimal exclusiveMinimum = optNumber(node, "exclusiveMinimum", path);
        BigDecimal exclusiveMaximum = optNumber(node, "exclusiveMaximum", path);
        BigDecimal lower = max(minimum, exclusiveMinimum);
        BigDecimal upper = min(maximum, exclusiveMaximum);
        if (lower != null && upper != null && lower.compareTo(upper) > 0) {
            throw new SchemaException(path, "lower bound " + lower.toPlainString() + " exceeds upper bound " + upper.toPlainString());
        }
        BigDecimal multipleOf = optNumber(node, "multipleOf", path);
        if (multipleOf != null && multipleOf.signum() <= 0) {
            throw new SchemaException(path, "\"multipleOf\" must be greater than 0");
        }
        Integer minItems = optInt(node, "minItems", path);
        Integer maxItems = optInt(node, "maxItems", path);
        if (minItems != null && maxItems != null && minItems > maxItems) {
            throw new SchemaException(path, "minItems " + minItems + " exceeds maxItems " + maxItems);
        }
        boolean uniqueItems = optBoolean(node, "uniqueItems", path);

        List<JsonElement> enumValues = new ArrayList<>();
        JsonElement enumEl = node.get("enum");
        if (enumEl != null) {
            if (!enumEl.isJsonArray() || enumEl.getAsJsonArray().isEmpty()) {
                throw new SchemaException(path, "\"enum\" must be a non-empty array");
            }
            for (JsonElement v : enumEl.getAsJsonArray()) {
                if (!matchesType(type, v)) {
                    throw new SchemaException(path, "enum value " + v + " is not a " + type.token());
                }
                enumValues.add(v.deepCopy());
            }
        }
        JsonElement defaultValue = node.has("default") ? node.get("default").deepCopy() : null;
        return new FieldConstraints(minLength, maxLength, pattern, minimum, maximum, exclusiveMinimum,
                exclusiveMaximum, multipleOf, enumValues, defaultValue, minItems, maxItems, uniqueItems);
    }

    // A default must satisfy its own field's scalar rules; container defaults only need the right shape
    private void checkDefault(FieldSpec spec, String path) {
        FieldConstraints c = spec.constraints();
        JsonElement d = c.defaultValue();
        if (d == null || d.isJsonNull()) return;
        if (!matchesType(spec.type(), d)) {
            throw new SchemaException(path, "default " + d + " is not a " + spec.type().token());
        }
        if (!c.enumValues().isEmpty() && !c.enumValues().contains(d)) {
            throw new SchemaException(path, "default " + d + " is not one of the enum values");
        }
        if (spec.type() == FieldType.STRING) {
            String s = d.getAsString();
            int len = s.codePointCount(0, s.length());
            if ((c.minLength() != null && len < c.minLength()) || (c.maxLength() != null && len > c.maxLength())) {
                throw new SchemaException(path, "default violates the length bounds");
            }
            if (c.pattern() != null && !c.pattern().matcher(s).find()) {
                throw new SchemaException(path, "default does not match the pattern");
            }
        } else if (spec.type() == FieldType.NUMBER || spec.type() == FieldType.INTEGER) {
            BigDecimal v = d.getAsBigDecimal();
            if ((c.minimum() != null && v.compareTo(c.minimum()) < 0)
                    || (c.maximum() != null && v.compareTo(c.maximum()) > 0)
                    || (c.exclusiveMinimum() != null && v.compareTo(c.exclusiveMinimum()) <= 0)
                    || (c.exclusiveMaximum() != null && v.compareTo(c.exclusiveMaximum()) >= 0)) {
                throw new SchemaException(path, "default violates the numeric bounds");
            }
        }
    }

    private Set<String> parseRequired(JsonObject node, String path, Map<String, FieldSpec> props) {
        JsonElement reqEl = node.get("required");
        if (reqEl == null) return Set.of();
        if (!reqEl.isJsonArray()) throw new SchemaException(path, "\"required\" must be an array of field names");
        Set<String> required = new LinkedHashSet<>();
        for (JsonElement r : reqEl.getAsJsonArray()) {
            if (!isString(r)) throw new SchemaException(path, "\"required\" entries must be strings");
            String name = r.getAsString();
            if (!props.containsKey(name)) {
                throw new SchemaException(path, "required field '" + name + "' is not declared");
            }
            required.add(name);
        }
        return required;
    }

    static boolean matchesType(FieldType type, JsonElement v) {
        return switch (type) {
            case STRING -> isString(v);
            case BOOLEAN -> v.isJsonPrimitive() && v.getAsJsonPrimitive().isBoolean();
            case NUMBER -> v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber();
            case INTEGER -> v.isJsonPrimitive() && v.getAsJsonPrimitive().isNumber() && isIntegral(v.getAsBigDecimal());
            case ARRAY -> v.isJsonArray();
            case OBJECT -> v.isJsonObject();
        };
    }

    public static boolean isIntegral(BigDecimal v) {
        return v.signum() == 0 || v.stripTrailingZeros().scale() <= 0;
    }

    private static boolean isString(JsonElement e) {
        return e != null && e.isJsonPrimitive() && e.getAsJsonPrimitive().isString();
    }

    private static String childPath(String path, String name) {
        return path.isEmpty() ? name : path + "." + name;
    }

    private static Integer optInt(JsonObject node, String key, String path) {
        JsonElement el = node.get(key);
        return el == null ? null : nonNegativeInt(el, path.isEmpty() ? key : path + "." + key);
    }

    private static int nonNegativeInt(JsonElement el, String where) {
        if (!el.isJsonPrimitive() || !el.getAsJsonPrimitive().isNumber() || !isIntegral(el.getAsBigDecimal())) {
            throw new SchemaException(where, "must be an integer");
        }
        BigDecimal v = el.getAsBigDecimal();
        if (v.signum() < 0 || v.compareTo(BigDecimal.valueOf(Integer.MAX_VALUE)) > 0) {
            throw new SchemaException(where, "must be a non-negative integer");
        }
        return v.intValueExact();
    }

    private static BigDecimal optNumber(JsonObject node, String key, String path) {
        JsonElement el = node.get(key);
        if (el == null) return null;
        if (!el.isJsonPrimitive() || !el.getAsJsonPrimitive().isNumber()) {
            throw new SchemaException(path, "\"" + key + "\" must be a number");
        }
        return el.getAsBigDecimal();
    }

    private static boolean optBoolean(JsonObject node, String key, String path) {
        JsonElement el = node.get(key);
        if (el == null) return false;
        if (!el.isJsonPrimitive() || !el.getAsJsonPrimitive().isBoolean()) {
            throw new SchemaException(path, "\"" + key + "\" must be a boolean");
        }
        return el.getAsBoolean();
    }

    private static BigDecimal max(BigDecimal a, BigDecimal b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.max(b);
    }

    private static BigDecimal min(BigDecimal a, BigDecimal b) {
        if (a == null) return b;
        if (b == null) return a;
        return a.min(b);
    }

    // Strict JSON reading with duplicate key detection

    private static JsonElement readStrict(String text) {
        try (JsonReader reader = new JsonReader(new StringReader(text))) {
            reader.setLenient(false);
            JsonElement element = readElement(reader, "");
            if (reader.peek() != JsonToken.END_DOCUMENT) {
                throw new SchemaException("", "trailing content after the schema document");
            }
            return element;
        } catch (IOException | IllegalStateException | NumberFormatException e) {
            throw new SchemaException("", "schema is not valid JSON: " + e.getMessage(), e);
        }
    }

    private static JsonElement readElement(JsonReader reader, String path) throws IOException {
        switch (reader.peek()) {
            case BEGIN_OBJECT -> {
                JsonObject obj = new JsonObject();
                reader.beginObject();
                while (reader.hasNext()) {
                    String name = reader.nextName();
                    String childPath = childPath(path, name);
                    if (obj.has(name)) {
                        throw new SchemaException(childPath, "duplicate key '" + name + "'");
                    }
                    obj.add(name, readElement(reader, childPath));
                }
                reader.endObject();
                return obj;
            }
            case BEGIN_ARRAY -> {
                JsonArray arr = new JsonArray();
                reader.beginArray();
                int i = 0;
                while (reader.hasNext()) {
                    arr.add(readElement(reader, path + "[" + i++ + "]"));
                }
                reader.endArray();
                return arr;
            }
            case STRING -> {
                return new JsonPrimitive(reader.nextString());
            }
            case NUMBER -> {
                return new JsonPrimitive(new BigDecimal(reader.nextString()));
            }
            case BOOLEAN -> {
                return new JsonPrimitive(reader.nextBoolean());
            }
            case NULL -> {
                reader.nextNull();
                return JsonNull.INSTANCE;
            }
            default -> throw new SchemaException(path, "unexpected token " + reader.peek());
        }
    }
}
