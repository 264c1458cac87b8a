package structdb.engine.validation;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import structdb.engine.catalog.FieldConstraints;
import structdb.engine.catalog.FieldSpec;
import structdb.engine.catalog.FieldType;
import structdb.engine.catalog.SchemaParser;
import structdb.engine.catalog.StructureDefinition;
import structdb.engine.error.DepthExceededException;
import structdb.engine.error.ValidationException;
import structdb.engine.error.Violation;

/**
 * Checks instance documents against a structure's schema and returns the
 * normalized document: defaults filled in, nulls dropped, integral numbers
 * given for integer fields rewritten as integers.
 *
 * All violations are collected before failing. Field paths are dotted, array
 * items are written {@code name[i]}.
 */
public class RecordValidator {
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);
    private static final BigDecimal DOUBLE_MAX = new BigDecimal(Double.MAX_VALUE);

    public JsonObject validate(StructureDefinition def, JsonObject candidate) {
        Objects.requireNonNull(candidate, "candidate");
        Context ctx = new Context(def);
        JsonObject normalized = validateObject(ctx, def.root(), candidate, "", 0);
        if (!ctx.violations.isEmpty()) {
            throw new ValidationException(def.name(), ctx.violations);
        }
        return normalized;
    }

    private JsonObject validateObject(Context ctx, FieldSpec spec, JsonObject obj, String path, int depth) {
        JsonObject out = new JsonObject();
        for (Map.Entry<String, FieldSpec> e : spec.properties().entrySet()) {
            String name = e.getKey();
            FieldSpec field = e.getValue();
            String fieldPath = path.isEmpty() ? name : path + "." + name;
            JsonElement value = obj.get(name);
            if (value == null || value.isJsonNull()) {
                FieldConstraints c = field.rootRef() ? FieldConstraints.NONE : field.constraints();
                if (c.hasDefault()) {
                    JsonElement filled = c.defaultValue().deepCopy();
                    out.add(name, field.type() == FieldType.OBJECT && filled.isJsonObject()
                            ? validateValue(ctx, field, filled, fieldPath, depth + 1)
                            : filled);
                } else if (spec.required().contains(name)) {
                    ctx.fail(fieldPath, "required", "is required");
                }
                continue;
            }
            out.add(name, validateValue(ctx, field, value, fieldPath, depth + 1));
        }
        for (Map.Entry<String, JsonElement> e : obj.entrySet()) {
            if (spec.properties().containsKey(e.getKey()) || e.getValue().isJsonNull()) continue;
            if (spec.additionalProperties()) {
                out.add(e.getKey(), e.getValue().deepCopy());
            } else {
                String fieldPath = path.isEmpty() ? e.getKey() : path + "." + e.getKey();
                ctx.fail(fieldPath, "additionalProperties", "is not declared in the schema");
            }
        }
        return out;
    }

    private JsonElement validateValue(Context ctx, FieldSpec spec, JsonElement value, String path, int depth) {
        if (spec.rootRef()) spec = ctx.def.root();
        if (depth > ctx.def.maxDepth()) {
            throw new DepthExceededException(path, ctx.def.maxDepth());
        }
        FieldConstraints c = spec.constraints();
        switch (spec.type()) {
            case STRING -> {
                if (!isString(value)) return typeMismatch(ctx, spec, value, path);
                String s = value.getAsString();
                int len = s.codePointCount(0, s.length());
                if (c.minLength() != null && len < c.minLength()) {
                    ctx.fail(path, "minLength", "length " + len + " is below the minimum of " + c.minLength());
                }
                if (c.maxLength() != null && len > c.maxLength()) {
                    ctx.fail(path, "maxLength", "length " + len + " exceeds the maximum of " + c.maxLength());
                }
                if (c.pattern() != null && !c.pattern().matcher(s).find()) {
                    ctx.fail(path, "pattern", "does not match " + c.pattern().pattern());
                }
                checkEnum(ctx, c, value, path);
                return value.deepCopy();
            }
            case BOOLEAN -> {
                if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean()) return typeMismatch(ctx, spec, value, path);
                checkEnum(ctx, c, value, path);
                return value.deepCopy();
            }
            case NUMBER, INTEGER -> {
                if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) return typeMismatch(ctx, spec, value, path);
                BigDecimal n = value.getAsBigDecimal();
                JsonElement normalized = value.deepCopy();
                // range checks compare BigDecimals only; 1e500000000 must not be expanded
                if (spec.type() == FieldType.INTEGER) {
                    if (!SchemaParser.isIntegral(n)) return typeMismatch(ctx, spec, value, path);
                    if (n.compareTo(LONG_MIN) < 0 || n.compareTo(LONG_MAX) > 0) {
                        ctx.fail(path, "type", "integer " + abbreviate(n) + " is outside the 64-bit range");
                        return value.deepCopy();
                    }
                    normalized = new JsonPrimitive(n.longValueExact());
                } else if (n.abs().compareTo(DOUBLE_MAX) > 0) {
                    ctx.fail(path, "type", "number " + abbreviate(n) + " is outside the double range");
                    return value.deepCopy();
                }
                checkNumber(ctx, c, n, path);
                checkEnum(ctx, c, normalized, path);
                return normalized;
            }
            case ARRAY -> {
                if (!value.isJsonArray()) return typeMismatch(ctx, spec, value, path);
                JsonArray arr = value.getAsJsonArray();
                if (c.minItems() != null && arr.size() < c.minItems()) {
                    ctx.fail(path, "minItems", arr.size() + " item(s), at least " + c.minItems() + " required");
                }
                if (c.maxItems() != null && arr.size() > c.maxItems()) {
                    ctx.fail(path, "maxItems", arr.size() + " item(s), at most " + c.maxItems() + " allowed");
                }
                JsonArray out = new JsonArray();
                for (int i = 0; i < arr.size(); i++) {
                    JsonElement item = arr.get(i);
                    String itemPath = path + "[" + i + "]";
                    if (item.isJsonNull()) {
                        ctx.fail(itemPath, "type", "null is not a " + spec.items().type().token());
                        out.add(item);
                        continue;
                    }
                    out.add(validateValue(ctx, spec.items(), item, itemPath, depth + 1));
                }
                if (c.uniqueItems()) checkUnique(ctx, out, path);
                return out;
            }
            case OBJECT -> {
                if (!value.isJsonObject()) return typeMismatch(ctx, spec, value, path);
                return validateObject(ctx, spec, value.getAsJsonObject(), path, depth);
            }
            default -> throw new IllegalStateException("Unhandled field type " + spec.type());
        }
    }

    private void checkNumber(Context ctx, FieldConstraints c, BigDecimal n, String path) {
        if (c.minimum() != null && n.compareTo(c.minimum()) < 0) {
            ctx.fail(path, "minimum", abbreviate(n) + " is below the minimum of " + c.minimum().toPlainString());
        }
        if (c.maximum() != null && n.compareTo(c.maximum()) > 0) {
            ctx.fail(path, "maximum", abbreviate(n) + " exceeds the maximum of " + c.maximum().toPlainString());
        }
        if (c.exclusiveMinimum() != null && n.compareTo(c.exclusiveMinimum()) <= 0) {
            ctx.fail(path, "exclusiveMinimum", abbreviate(n) + " must be greater than " + c.exclusiveMinimum().toPlainString());
        }
        if (c.exclusiveMaximum() != null && n.compareTo(c.exclusiveMaximum()) >= 0) {
            ctx.fail(path, "exclusiveMaximum", abbreviate(n) + " must be less than " + c.exclusiveMaximum().toPlainString());
        }
        if (c.multipleOf() != null && !isMultiple(n, c.multipleOf())) {
            ctx.fail(path, "multipleOf", abbreviate(n) + " is not a multiple of " + c.multipleOf().toPlainString());
        }
    }

    // k * m never has more fractional digits than m, which rules out most
    // non-multiples before the division
    private static boolean isMultiple(BigDecimal n, BigDecimal m) {
        if (n.signum() == 0) return true;
        if (n.stripTrailingZeros().scale() > m.stripTrailingZeros().scale()) return false;
        return n.remainder(m).signum() == 0;
    }

    private static String abbreviate(BigDecimal n) {
        return n.precision() - n.scale() > 40 || n.scale() > 40 ? n.toString() : n.toPlainString();
    }

    private void checkEnum(Context ctx, FieldConstraints c, JsonElement value, String path) {
        if (c.enumValues().isEmpty()) return;
        for (JsonElement allowed : c.enumValues()) {
            if (sameValue(allowed, value)) return;
        }
        ctx.fail(path, "enum", value + " is not one of " + c.enumValues());
    }

    private void checkUnique(Context ctx, JsonArray items, String path) {
        for (int i = 0; i < items.size(); i++) {
            for (int j = 0; j < i; j++) {
                if (sameValue(items.get(i), items.get(j))) {
                    ctx.fail(path, "uniqueItems", "items " + j + " and " + i + " are equal");
                    return;
                }
            }
        }
    }

    // Numbers compare by value (3 equals 3.0); everything else by JSON equality
    private static boolean sameValue(JsonElement a, JsonElement b) {
        if (a.isJsonPrimitive() && b.isJsonPrimitive()
                && a.getAsJsonPrimitive().isNumber() && b.getAsJsonPrimitive().isNumber()) {
            return a.getAsBigDecimal().compareTo(b.getAsBigDecimal()) == 0;
        }
        return a.equals(b);
    }

    private JsonElement typeMismatch(Context ctx, FieldSpec spec, JsonElement value, String path) {
        ctx.fail(path, "type", "expected " + spec.type().token() + ", got " + describe(value));
        return value.deepCopy();
    }

    private static String describe(JsonElement v) {
        if (v.isJsonObject()) return "object";
        if (v.isJsonArray()) return "array";
        JsonPrimitive p = v.getAsJsonPrimitive();
        if (p.isBoolean()) return "boolean";
        if (p.isNumber()) return "number " + p.getAsString();
        return "string";
    }

    private static boolean isString(JsonElement e) {
        return e.isJsonPrimitive() && e.getAsJsonPrimitive().isString();
    }

    private static final class Context {
        final StructureDefinition def;
        final List<Violation> violations = new ArrayList<>();

        Context(StructureDefinition def) {
            this.def = def;
        }

        void fail(String field, String rule, String message) {
            violations.add(new Violation(field, rule, message));
        }
    }
}
