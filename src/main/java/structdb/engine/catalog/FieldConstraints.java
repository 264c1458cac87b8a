package structdb.engine.catalog;

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;

import com.google.gson.JsonElement;

/**
 * Validation keywords of one field. Absent keywords are null (or empty / false).
 */
public record FieldConstraints(Integer minLength,
                               Integer maxLength,
                               Pattern pattern,
                               BigDecimal minimum,
                               BigDecimal maximum,
                               BigDecimal exclusiveMinimum,
                               BigDecimal exclusiveMaximum,
                               BigDecimal multipleOf,
                               List<JsonElement> enumValues,
                               JsonElement defaultValue,
                               Integer minItems,
                               Integer maxItems,
                               boolean uniqueItems) {

    public static final FieldConstraints NONE =
            new FieldConstraints(null, null, null, null, null, null, null, null, List.of(), null, null, null, false);

    public FieldConstraints {
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    }

    public boolean hasDefault() { return defaultValue != null && !defaultValue.isJsonNull(); }
}
