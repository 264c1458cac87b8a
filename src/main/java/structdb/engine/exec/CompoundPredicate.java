package structdb.engine.exec;

import java.util.List;

/**
 * Conjunction of child predicates, evaluated left to right with short-circuit.
 */
public final class CompoundPredicate implements Predicate {
    /** Matches every row; the result of an empty conjunction. */
    public static final Predicate TRUE = row -> true;

    private final List<Predicate> children;

    private CompoundPredicate(List<Predicate> children) {
        this.children = List.copyOf(children);
    }

    /** AND over the list; an empty list matches everything, a single child is returned as is. */
    public static Predicate allOf(List<Predicate> predicates) {
        if (predicates.isEmpty()) return TRUE;
        if (predicates.size() == 1) return predicates.get(0);
        return new CompoundPredicate(predicates);
    }

    @Override
    public boolean test(Row row) {
        for (Predicate p : children) {
            if (!p.test(row)) return false;
        }
        return true;
    }

    // For debugging
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("(");
        for (int i = 0; i < children.size(); i++) {
            if (i > 0) sb.append(" AND ");
            sb.append(children.get(i));
        }
        return sb.append(')').toString();
    }
}
