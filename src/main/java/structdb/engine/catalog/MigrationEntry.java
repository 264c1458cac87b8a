package structdb.engine.catalog;

import java.time.Instant;
import java.util.List;

// One row of a structure's migration history, kept in the catalog.
public record MigrationEntry(int version,
                             List<String> added,
                             List<String> widened,
                             List<String> deprecated,
                             List<String> restored,
                             List<String> vacuumed,
                             Instant appliedAt) {
    public MigrationEntry {
        added = added == null ? List.of() : List.copyOf(added);
        widened = widened == null ? List.of() : List.copyOf(widened);
        deprecated = deprecated == null ? List.of() : List.copyOf(deprecated);
        restored = restored == null ? List.of() : List.copyOf(restored);
        vacuumed = vacuumed == null ? List.of() : List.copyOf(vacuumed);
    }
}
