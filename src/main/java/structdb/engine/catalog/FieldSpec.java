package structdb.engine.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * One node of a parsed schema. Object nodes carry their properties in
 * declaration order, array nodes their item spec. A node with
 * {@code rootRef} set stands for the structure's root object ({"$ref": "#"}).
 */
public record FieldSpec(FieldType type,
                        FieldConstraints constraints,
                        FieldSpec items,
                        Map<String, FieldSpec> properties,
                        Set<String> required,
                        boolean additionalProperties,
                        boolean rootRef) {

    private static final FieldSpec ROOT_REF =
            new FieldSpec(FieldType.OBJECT, FieldConstraints.NONE, null, Map.of(), Set.of(), false, true);

    public FieldSpec {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        required = required == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(required));
        constraints = constraints == null ? FieldConstraints.NONE : constraints;
    }

    public static FieldSpec rootReference() { return ROOT_REF; }

    public static FieldSpec scalar(FieldType type, FieldConstraints constraints) {
        return new FieldSpec(type, constraints, null, Map.of(), Set.of(), false, false);
    }

    public boolean isScalar() { return !rootRef && type.isScalar(); }

    public FieldSpec property(String name) { return properties.get(name); }
}
