package structdb.engine.migration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import structdb.engine.catalog.CatalogManager;
import structdb.engine.catalog.CatalogManager.StructureRow;
import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;
import structdb.engine.catalog.FieldSpec;
import structdb.engine.catalog.MigrationEntry;
import structdb.engine.catalog.PhysicalType;
import structdb.engine.catalog.StructureDefinition;
import structdb.engine.catalog.TableSchema;
import structdb.engine.catalog.TypeMapper;
import structdb.engine.error.IncompatibleMigrationException;
import structdb.engine.error.NotFoundException;
import structdb.engine.index.IndexManager;
import structdb.engine.storage.HeapRecord;
import structdb.engine.storage.StorageManager;

/**
 * Keeps each structure's table layout in line with its schema.
 *
 * Columns are only ever appended or flagged deprecated; a type change is
 * accepted when it is a declared widening. The structure row, the new layout
 * and the history entry reach the catalog in one snapshot write, so a failed
 * migration leaves the previous version in force.
 *
 * Callers hold the structure's schema lock.
 */
public class TableSynchronizer {
    private static final Logger LOG = LoggerFactory.getLogger(TableSynchronizer.class);

    private final CatalogManager catalog;
    private final StorageManager storage;
    private final IndexManager indexes;
    private final TypeMapper typeMapper;
    private final Path tablesDir;
    private final Clock clock;

    public TableSynchronizer(CatalogManager catalog,
                             StorageManager storage,
                             IndexManager indexes,
                             TypeMapper typeMapper,
                             Path tablesDir,
                             Clock clock) {
        this.catalog = catalog;
        this.storage = storage;
        this.indexes = indexes;
        this.typeMapper = typeMapper;
        this.tablesDir = tablesDir;
        this.clock = clock;
    }

    /** Dry run: the changes {@link #synchronize} would apply. */
    public MigrationPlan plan(StructureDefinition def) {
        Map<String, PhysicalType> desired = new LinkedHashMap<>();
        Map<String, String> fieldOf = new LinkedHashMap<>();
        for (Map.Entry<String, FieldSpec> e : def.root().properties().entrySet()) {
            if (!e.getValue().isScalar()) continue;
            String column = typeMapper.columnName(e.getKey());
            desired.put(column, typeMapper.mapType(e.getValue()));
            fieldOf.put(column, e.getKey());
        }

        TableSchema current = catalog.getTableSchema(def.name());
        if (current == null) {
            return new MigrationPlan(def.name(), true, List.copyOf(desired.keySet()), List.of(), List.of(), List.of(),
                    initialLayout(def.name(), desired));
        }

        List<ColumnSchema> columns = new ArrayList<>();
        List<String> widened = new ArrayList<>();
        List<String> deprecated = new ArrayList<>();
        List<String> restored = new ArrayList<>();
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (ColumnSchema col : current.columns()) {
            if (TableSchema.isReserved(col.name())) {
                columns.add(col);
                continue;
            }
            seen.add(col.name());
            PhysicalType want = desired.get(col.name());
            if (want == null) {
                if (!col.deprecated()) deprecated.add(col.name());
                columns.add(col.withDeprecated(true));
                continue;
            }
            ColumnSchema next = col;
            if (!want.equals(col.physicalType())) {
                if (typeMapper.isWidening(col.physicalType(), want)) {
                    widened.add(col.name() + ": " + col.physicalType() + " -> " + want);
                    next = next.withType(want);
                } else {
                    problems.add(fieldOf.get(col.name()) + ": " + col.physicalType() + " -> " + want + " is not a widening conversion");
                }
            }
            if (col.deprecated()) {
                restored.add(col.name());
                next = next.withDeprecated(false);
            }
            columns.add(next);
        }
        if (!problems.isEmpty()) {
            throw new IncompatibleMigrationException(def.name(), problems);
        }

        List<String> added = new ArrayList<>();
        for (Map.Entry<String, PhysicalType> e : desired.entrySet()) {
            if (seen.contains(e.getKey())) continue;
            columns.add(ColumnSchema.of(e.getKey(), e.getValue()));
            added.add(e.getKey());
        }
        return new MigrationPlan(def.name(), false, added, widened, deprecated, restored, current.withColumns(columns));
    }

    /**
     * Apply the plan for this definition and commit the definition with it.
     * On creation the heap file is created first and removed again if the
     * catalog write fails.
     */
    public MigrationPlan synchronize(StructureDefinition def) {
        MigrationPlan plan = plan(def);
        StructureRow row = new StructureRow(def.name(), def.schema().toString(), def.version(), def.createdAt(), def.updatedAt());
        MigrationEntry entry = new MigrationEntry(def.version(), plan.added(), plan.widened(), plan.deprecated(),
                plan.restored(), List.of(), def.updatedAt());

        if (plan.creation()) {
            storage.createTableFile(plan.target());
            try {
                catalog.commit(def.name(), row, plan.target(), entry);
            } catch (RuntimeException e) {
                storage.deleteTableFile(plan.target().filePath());
                throw e;
            }
            indexes.register(def.name());
            LOG.info("Created table for structure {} with {} projection column(s)", def.name(), plan.added().size());
        } else {
            catalog.commit(def.name(), row, plan.target(), entry);
            if (plan.isEmpty()) {
                LOG.info("Structure {} v{}: layout unchanged", def.name(), def.version());
            } else {
                LOG.info("Structure {} v{}: added {}, widened {}, deprecated {}, restored {}", def.name(), def.version(),
                        plan.added(), plan.widened(), plan.deprecated(), plan.restored());
            }
        }
        return plan;
    }

    /** Remove every catalog entry of a structure; returns its last layout for the caller to discard. */
    public TableSchema drop(String name) {
        TableSchema layout = catalog.getTableSchema(name);
        if (layout == null) throw NotFoundException.structure(name);
        catalog.remove(name);
        indexes.drop(name);
        LOG.info("Dropped structure {}", name);
        return layout;
    }

    /**
     * Rewrite the table without its deprecated columns into a new heap file,
     * then switch the layout over. Returns the number of columns dropped.
     */
    public int vacuum(StructureDefinition def) {
        TableSchema layout = catalog.getTableSchema(def.name());
        if (layout == null) throw NotFoundException.structure(def.name());
        List<ColumnSchema> gone = layout.deprecatedColumns();
        if (gone.isEmpty()) return 0;

        List<ColumnSchema> kept = new ArrayList<>();
        List<Integer> keptIdx = new ArrayList<>();
        for (int i = 0; i < layout.columns().size(); i++) {
            ColumnSchema c = layout.columns().get(i);
            if (c.deprecated()) continue;
            kept.add(c);
            keptIdx.add(i);
        }
        TableSchema target = layout.withFile(kept, nextGenerationFile(def.name()).toString());
        Instant now = clock.instant();
        MigrationEntry entry = new MigrationEntry(def.version(), List.of(), List.of(), List.of(), List.of(),
                gone.stream().map(ColumnSchema::name).toList(), now);

        storage.createTableFile(target);
        int[] rows = {0};
        try {
            storage.scan(layout, (rid, rec) -> {
                List<Object> values = new ArrayList<>(keptIdx.size());
                for (int i : keptIdx) values.add(rec.get(i));
                storage.insert(target, new HeapRecord(values));
                rows[0]++;
            });
            catalog.commit(def.name(), null, target, entry);
        } catch (RuntimeException e) {
            storage.deleteTableFile(target.filePath());
            throw e;
        }
        storage.deleteTableFile(layout.filePath());
        indexes.load(target);
        LOG.info("Vacuumed structure {}: dropped columns {}, rewrote {} row(s) into {}",
                def.name(), entry.vacuumed(), rows[0], target.filePath());
        return gone.size();
    }

    /** Migration history of a structure, oldest first. */
    public List<MigrationEntry> history(String name) {
        if (catalog.getStructure(name) == null) throw NotFoundException.structure(name);
        return catalog.history(name);
    }

    private TableSchema initialLayout(String name, Map<String, PhysicalType> projections) {
        List<ColumnSchema> cols = new ArrayList<>();
        cols.add(ColumnSchema.of(TableSchema.ID, PhysicalType.of(DataType.BIGINT)));
        cols.add(ColumnSchema.of(TableSchema.PARENT_ID, PhysicalType.of(DataType.BIGINT)));
        cols.add(ColumnSchema.of(TableSchema.DOCUMENT, PhysicalType.of(DataType.TEXT)));
        projections.forEach((column, type) -> cols.add(ColumnSchema.of(column, type)));
        cols.add(ColumnSchema.of(TableSchema.CREATED_AT, PhysicalType.of(DataType.TIMESTAMP)));
        cols.add(ColumnSchema.of(TableSchema.UPDATED_AT, PhysicalType.of(DataType.TIMESTAMP)));
        return new TableSchema(name, cols, tablesDir.resolve(name + ".tbl").toString());
    }

    private Path nextGenerationFile(String name) {
        long gen = clock.millis();
        Path p = tablesDir.resolve(name + "." + gen + ".tbl");
        while (Files.exists(p)) {
            p = tablesDir.resolve(name + "." + (++gen) + ".tbl");
        }
        return p;
    }
}
