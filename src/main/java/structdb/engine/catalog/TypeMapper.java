package structdb.engine.catalog;

import java.util.Locale;

/**
 * Deterministic mapping from schema fields to physical columns.
 */
public class TypeMapper {
    public static final String COLUMN_PREFIX = "f_";

    public PhysicalType mapType(FieldSpec spec) {
        if (spec.rootRef()) return PhysicalType.of(DataType.JSON);
        return switch (spec.type()) {
            case STRING -> {
                Integer max = spec.constraints().maxLength();
                yield max != null ? new PhysicalType(DataType.VARCHAR, max) : PhysicalType.of(DataType.TEXT);
            }
            case NUMBER -> PhysicalType.of(DataType.DOUBLE);
            case INTEGER -> PhysicalType.of(DataType.BIGINT);
            case BOOLEAN -> PhysicalType.of(DataType.BOOLEAN);
            case ARRAY, OBJECT -> PhysicalType.of(DataType.JSON);
        };
    }

    /** Maps a raw type token; fails UnsupportedTypeException for unknown tokens. */
    public PhysicalType mapToken(String token) {
        FieldType ft = FieldType.fromToken("", token);
        return mapType(FieldSpec.scalar(ft, FieldConstraints.NONE));
    }

    /** Projection column for a root-level field. */
    public String columnName(String fieldName) {
        String lower = fieldName.toLowerCase(Locale.ROOT);
        StringBuilder sb = new StringBuilder(COLUMN_PREFIX.length() + lower.length());
        sb.append(COLUMN_PREFIX);
        for (int i = 0; i < lower.length(); i++) {
            char c = lower.charAt(i);
            boolean ok = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_';
            sb.append(ok ? c : '_');
        }
        return sb.toString();
    }

    /**
     * Declared widening conversions: BIGINT -> DOUBLE, VARCHAR(n) -> VARCHAR(m >= n), VARCHAR -> TEXT.
     * Identical types are not a conversion and return false.
     */
    public boolean isWidening(PhysicalType from, PhysicalType to) {
        if (from.equals(to)) return false;
        return switch (from.type()) {
            case BIGINT -> to.type() == DataType.DOUBLE;
            case VARCHAR -> to.type() == DataType.TEXT || (to.type() == DataType.VARCHAR && to.length() >= from.length());
            default -> false;
        };
    }
}
