package structdb.engine.catalog;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import structdb.engine.catalog.CatalogManager.StructureRow;
import structdb.engine.catalog.SchemaParser.ParsedSchema;
import structdb.engine.concurrent.StructureLocks;
import structdb.engine.error.ConflictException;
import structdb.engine.error.NotFoundException;
import structdb.engine.error.SchemaException;
import structdb.engine.error.StructureStoreException;
import structdb.engine.error.StorageException;
import structdb.engine.migration.TableSynchronizer;

/**
 * Structure definitions by name, with version numbering.
 *
 * Every change runs under the structure's schema lock and goes through the
 * {@link TableSynchronizer}, which writes the definition and its table layout
 * to the catalog together. The in-memory view is updated only after that
 * write succeeded. Concurrent updates of one name queue on the lock; callers
 * that prefer to fail instead pass the version they based their change on.
 */
public class SchemaRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(SchemaRegistry.class);
    private static final Pattern NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_-]{0,62}");

    private final CatalogManager catalog;
    private final SchemaParser parser;
    private final TableSynchronizer synchronizer;
    private final StructureLocks locks;
    private final Clock clock;
    private final Map<String, StructureDefinition> definitions = new ConcurrentHashMap<>();
    private volatile TableDropHandler dropHandler;

    public SchemaRegistry(CatalogManager catalog,
                          SchemaParser parser,
                          TableSynchronizer synchronizer,
                          StructureLocks locks,
                          Clock clock) {
        this.catalog = catalog;
        this.parser = parser;
        this.synchronizer = synchronizer;
        this.locks = locks;
        this.clock = clock;
        loadDefinitions();
    }

    // Late binding: the record store is built after the registry
    public void attachDropHandler(TableDropHandler handler) {
        this.dropHandler = handler;
    }

    public StructureDefinition define(String name, String schemaJson) {
        checkName(name);
        return locks.withSchemaLock(name, () -> {
            if (definitions.containsKey(name)) {
                throw new ConflictException("Structure already exists: " + name);
            }
            ParsedSchema parsed = parser.parse(schemaJson);
            Instant now = clock.instant();
            StructureDefinition def = new StructureDefinition(name, parsed.document(), parsed.root(), parsed.maxDepth(), 1, now, now);
            synchronizer.synchronize(def);
            definitions.put(name, def);
            LOG.info("Defined structure {} (v1)", name);
            return def;
        });
    }

    public StructureDefinition get(String name) {
        StructureDefinition def = definitions.get(name);
        if (def == null) throw NotFoundException.structure(name);
        return def;
    }

    public boolean exists(String name) {
        return definitions.containsKey(name);
    }

    /** Definitions ordered by name. */
    public List<StructureDefinition> list() {
        List<StructureDefinition> out = new ArrayList<>(definitions.values());
        out.sort(Comparator.comparing(StructureDefinition::name));
        return out;
    }

    public StructureDefinition update(String name, String schemaJson) {
        return update(name, schemaJson, null);
    }

    /**
     * Replace the schema of a structure. With a non-null expectedVersion the
     * update fails with ConflictException unless that is still the current
     * version. An identical schema returns the current definition unchanged.
     */
    public StructureDefinition update(String name, String schemaJson, Integer expectedVersion) {
        return locks.withSchemaLock(name, () -> {
            StructureDefinition current = get(name);
            if (expectedVersion != null && expectedVersion != current.version()) {
                throw new ConflictException("Structure " + name + " is at version " + current.version()
                        + ", update was based on version " + expectedVersion);
            }
            ParsedSchema parsed = parser.parse(schemaJson);
            if (parsed.document().equals(current.schema())) {
                LOG.debug("Update of {} leaves the schema unchanged", name);
                return current;
            }
            StructureDefinition next = current.nextVersion(parsed.document(), parsed.root(), parsed.maxDepth(), clock.instant());
            synchronizer.synchronize(next);
            definitions.put(name, next);
            LOG.info("Updated structure {} to v{}", name, next.version());
            return next;
        });
    }

    /** Remove the definition, its table and all its records. */
    public void drop(String name) {
        locks.withSchemaLock(name, () -> {
            if (!definitions.containsKey(name)) throw NotFoundException.structure(name);
            TableSchema layout = synchronizer.drop(name);
            definitions.remove(name);
            TableDropHandler handler = dropHandler;
            if (handler != null) handler.dropTable(layout);
            return null;
        });
    }

    /** Physically drop deprecated columns; returns how many were dropped. */
    public int vacuum(String name) {
        return locks.withSchemaLock(name, () -> synchronizer.vacuum(get(name)));
    }

    private void checkName(String name) {
        if (name == null || !NAME.matcher(name).matches()) {
            throw new SchemaException("", "invalid structure name '" + name + "': must match " + NAME.pattern());
        }
    }

    private void loadDefinitions() {
        for (StructureRow row : catalog.allStructures().values()) {
            try {
                ParsedSchema parsed = parser.parse(row.schemaJson());
                definitions.put(row.name(), new StructureDefinition(row.name(), parsed.document(), parsed.root(),
                        parsed.maxDepth(), row.version(), row.createdAt(), row.updatedAt()));
            } catch (StructureStoreException e) {
                LOG.error("Stored schema of structure {} does not parse", row.name(), e);
                throw new StorageException("Stored schema of structure " + row.name() + " does not parse", e);
            }
        }
        LOG.info("Loaded {} structure definition(s)", definitions.size());
    }
}
