package structdb.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.GsonBuilder;

import structdb.engine.catalog.CatalogManager;
import structdb.engine.catalog.SchemaParser;
import structdb.engine.catalog.SchemaRegistry;
import structdb.engine.catalog.TableSchema;
import structdb.engine.catalog.TypeMapper;
import structdb.engine.concurrent.StructureLocks;
import structdb.engine.index.IndexManager;
import structdb.engine.migration.TableSynchronizer;
import structdb.engine.notify.ChangeNotifier;
import structdb.engine.query.PredicateCompiler;
import structdb.engine.record.RecordStore;
import structdb.engine.record.RowMapper;
import structdb.engine.storage.BufferManager;
import structdb.engine.storage.StorageManager;
import structdb.engine.validation.RecordValidator;

/**
 * Engine facade: opens one data directory and wires the catalog, storage,
 * indexes, registry, record store and notifier together. There is no global
 * state; two stores on two directories are independent.
 *
 * <pre>
 * try (StructureStore store = StructureStore.open(EngineConfig.defaultConfig(dir))) {
 *     store.registry().define("menu", schemaJson);
 *     store.records().create("menu", document);
 * }
 * </pre>
 */
public final class StructureStore implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StructureStore.class);

    private final EngineConfig config;
    private final CatalogManager catalog;
    private final StorageManager storage;
    private final TableSynchronizer synchronizer;
    private final SchemaRegistry registry;
    private final RecordStore records;
    private final ChangeNotifier notifier;

    private StructureStore(EngineConfig config, CatalogManager catalog) {
        this.config = config;
        this.catalog = catalog;
        TypeMapper typeMapper = new TypeMapper();
        StructureLocks locks = new StructureLocks(config.lockTimeout);
        this.storage = new StorageManager(new BufferManager(config.pageSize, config.bufferPages));
        IndexManager indexes = new IndexManager(storage);
        for (TableSchema layout : catalog.allTables().values()) {
            indexes.load(layout);
        }
        this.synchronizer = new TableSynchronizer(catalog, storage, indexes, typeMapper, config.tablesDir(), config.clock);
        this.registry = new SchemaRegistry(catalog, new SchemaParser(config.maxDepth, typeMapper), synchronizer, locks, config.clock);
        this.notifier = new ChangeNotifier(config.subscriberBuffer);
        RowMapper mapper = new RowMapper(typeMapper, new GsonBuilder().disableHtmlEscaping().create());
        this.records = new RecordStore(catalog, registry, storage, indexes, new RecordValidator(),
                new PredicateCompiler(typeMapper), mapper, notifier, locks, config.clock, config.defaultLimit);
        registry.attachDropHandler(records);
    }

    public static StructureStore open(EngineConfig config) {
        return open(config, new CatalogManager(config.catalogFile()));
    }

    /** Open over a caller-supplied catalog (tests use an in-memory one). */
    public static StructureStore open(EngineConfig config, CatalogManager catalog) {
        StructureStore store = new StructureStore(config, catalog);
        LOG.info("Opened structure store at {} ({} structure(s))", config.dataDir, store.registry.list().size());
        return store;
    }

    public EngineConfig config() { return config; }

    public SchemaRegistry registry() { return registry; }

    public RecordStore records() { return records; }

    public ChangeNotifier notifier() { return notifier; }

    public TableSynchronizer synchronizer() { return synchronizer; }

    public CatalogManager catalog() { return catalog; }

    /** Ends all subscriptions. Every write is already on disk, so nothing else needs flushing. */
    @Override
    public void close() {
        notifier.close();
        LOG.info("Closed structure store at {}", config.dataDir);
    }
}
