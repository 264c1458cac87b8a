package structdb.engine.error;

import java.util.List;

/**
 * A document failed validation. Carries every violation found, not just the first.
 */
public class ValidationException extends StructureStoreException {
    private final String structureName;
    private final List<Violation> violations;

    public ValidationException(String structureName, List<Violation> violations) {
        super("Document rejected by structure " + structureName + ": " + violations);
        this.structureName = structureName;
        this.violations = List.copyOf(violations);
    }

    public static ValidationException single(String structureName, String field, String rule, String message) {
        return new ValidationException(structureName, List.of(new Violation(field, rule, message)));
    }

    public String structureName() { return structureName; }
    public List<Violation> violations() { return violations; }

    public boolean hasViolation(String field, String rule) {
        for (Violation v : violations) {
            if (v.field().equals(field) && v.rule().equals(rule)) return true;
        }
        return false;
    }
}
