package structdb.engine.record;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import structdb.engine.catalog.CatalogManager;
import structdb.engine.catalog.SchemaParser;
import structdb.engine.catalog.SchemaRegistry;
import structdb.engine.catalog.StructureDefinition;
import structdb.engine.catalog.TableDropHandler;
import structdb.engine.catalog.TableSchema;
import structdb.engine.concurrent.StructureLocks;
import structdb.engine.error.NotFoundException;
import structdb.engine.error.ValidationException;
import structdb.engine.exec.FilterOperator;
import structdb.engine.exec.IndexScanOperator;
import structdb.engine.exec.LimitOperator;
import structdb.engine.exec.Operator;
import structdb.engine.exec.Predicate;
import structdb.engine.exec.Row;
import structdb.engine.exec.SeqScanOperator;
import structdb.engine.exec.SortOperator;
import structdb.engine.index.IndexManager;
import structdb.engine.notify.ChangeEvent;
import structdb.engine.notify.ChangeKind;
import structdb.engine.notify.ChangeNotifier;
import structdb.engine.query.FilterCondition;
import structdb.engine.query.ListQuery;
import structdb.engine.query.PredicateCompiler;
import structdb.engine.query.SortOrder;
import structdb.engine.storage.HeapRecord;
import structdb.engine.storage.RID;
import structdb.engine.storage.StorageManager;
import structdb.engine.validation.RecordValidator;

/**
 * Typed CRUD over the instances of a structure.
 *
 * Mutations run under the structure's data write lock: validate, project,
 * write the heap row, update the indexes, then publish the change. Reads run
 * under the data read lock. The schema read lock is held throughout, so a
 * record operation always sees one definition and one table layout.
 */
public class RecordStore implements TableDropHandler {
    private static final Logger LOG = LoggerFactory.getLogger(RecordStore.class);
    private static final BigDecimal LONG_MIN = BigDecimal.valueOf(Long.MIN_VALUE);
    private static final BigDecimal LONG_MAX = BigDecimal.valueOf(Long.MAX_VALUE);

    private final CatalogManager catalog;
    private final SchemaRegistry registry;
    private final StorageManager storage;
    private final IndexManager indexes;
    private final RecordValidator validator;
    private final PredicateCompiler compiler;
    private final RowMapper mapper;
    private final ChangeNotifier notifier;
    private final StructureLocks locks;
    private final Clock clock;
    private final int defaultLimit;

    public RecordStore(CatalogManager catalog,
                       SchemaRegistry registry,
                       StorageManager storage,
                       IndexManager indexes,
                       RecordValidator validator,
                       PredicateCompiler compiler,
                       RowMapper mapper,
                       ChangeNotifier notifier,
                       StructureLocks locks,
                       Clock clock,
                       int defaultLimit) {
        this.catalog = catalog;
        this.registry = registry;
        this.storage = storage;
        this.indexes = indexes;
        this.validator = validator;
        this.compiler = compiler;
        this.mapper = mapper;
        this.notifier = notifier;
        this.locks = locks;
        this.clock = clock;
        this.defaultLimit = defaultLimit;
    }

    /** Create a record; a top-level parent_id in the document becomes the parent link. */
    public StoredRecord create(String name, JsonObject document) {
        Long parentId = parentIdOf(name, document);
        return create(name, parentId, document);
    }

    /**
     * Create a record under parentId (null for a root). A parent_id key in the
     * document is removed; the argument takes precedence.
     */
    public StoredRecord create(String name, Long parentId, JsonObject document) {
        JsonObject doc = document.deepCopy();
        doc.remove(TableSchema.PARENT_ID);
        if (doc.has(TableSchema.ID)) {
            throw ValidationException.single(name, TableSchema.ID, "immutable", "id is assigned by the store");
        }
        return locks.withRecordWrite(name, () -> {
            StructureDefinition def = registry.get(name);
            TableSchema layout = layout(name);
            if (parentId != null && indexes.ridOf(name, parentId) == null) {
                throw NotFoundException.record(name, parentId);
            }
            JsonObject normalized = validator.validate(def, doc);
            Instant now = clock.instant();
            long id = indexes.nextId(name);
            RID rid = storage.insert(layout, encode(name, def, layout, id, parentId, normalized, now, now));
            indexes.onInsert(name, rid, id, parentId);
            StoredRecord stored = new StoredRecord(id, parentId, normalized, now, now);
            publish(name, ChangeKind.CREATED, stored, now);
            LOG.debug("Created {} #{} at {}", name, id, rid);
            return stored;
        });
    }

    public StoredRecord get(String name, long id) {
        return locks.withRecordRead(name, () -> {
            registry.get(name);
            TableSchema layout = layout(name);
            return mapper.fromRow(layout, storage.read(layout, ridOrThrow(name, id)));
        });
    }

    /**
     * Merge partial into the record's document at the top level. A null value
     * removes that field; a parent_id key moves the record; an id key must
     * match the record's id.
     */
    public StoredRecord update(String name, long id, JsonObject partial) {
        JsonObject changes = partial.deepCopy();
        return locks.withRecordWrite(name, () -> {
            StructureDefinition def = registry.get(name);
            TableSchema layout = layout(name);
            RID rid = ridOrThrow(name, id);
            StoredRecord old = mapper.fromRow(layout, storage.read(layout, rid));

            if (changes.has(TableSchema.ID)) {
                JsonElement given = changes.remove(TableSchema.ID);
                if (!isLong(given) || given.getAsLong() != id) {
                    throw ValidationException.single(name, TableSchema.ID, "immutable", "id " + id + " can not be changed to " + given);
                }
            }
            Long parentId = old.parentId();
            if (changes.has(TableSchema.PARENT_ID)) {
                parentId = parentIdOf(name, changes);
                changes.remove(TableSchema.PARENT_ID);
                if (parentId != null && !parentId.equals(old.parentId())) {
                    checkNewParent(name, layout, id, parentId);
                }
            }

            JsonObject merged = old.document();
            for (Map.Entry<String, JsonElement> e : changes.entrySet()) {
                if (e.getValue().isJsonNull()) {
                    merged.remove(e.getKey());
                } else {
                    merged.add(e.getKey(), e.getValue());
                }
            }
            JsonObject normalized = validator.validate(def, merged);
            Instant now = clock.instant();

            // New row first, then tombstone the old one
            RID newRid = storage.insert(layout, encode(name, def, layout, id, parentId, normalized, old.createdAt(), now));
            storage.delete(layout, rid);
            indexes.onDelete(name, rid, id, old.parentId());
            indexes.onInsert(name, newRid, id, parentId);

            StoredRecord stored = new StoredRecord(id, parentId, normalized, old.createdAt(), now);
            publish(name, ChangeKind.UPDATED, stored, now);
            LOG.debug("Updated {} #{} at {}", name, id, newRid);
            return stored;
        });
    }

    /**
     * Delete a record and all its descendants, children before parents.
     * Returns the removed ids in removal order.
     */
    public List<Long> delete(String name, long id) {
        return locks.withRecordWrite(name, () -> {
            registry.get(name);
            TableSchema layout = layout(name);
            ridOrThrow(name, id);

            // Two-stack post-order over the parent index
            Deque<Long> pending = new ArrayDeque<>();
            Deque<Long> order = new ArrayDeque<>();
            pending.push(id);
            while (!pending.isEmpty()) {
                long current = pending.pop();
                order.push(current);
                for (long child : indexes.childrenOf(name, current)) pending.push(child);
            }

            List<Long> removed = new ArrayList<>(order.size());
            Instant now = clock.instant();
            for (long victim : order) {
                RID rid = indexes.ridOf(name, victim);
                if (rid == null) continue;
                StoredRecord old = mapper.fromRow(layout, storage.read(layout, rid));
                storage.delete(layout, rid);
                indexes.onDelete(name, rid, victim, old.parentId());
                removed.add(victim);
                publish(name, ChangeKind.DELETED, old, now);
            }
            LOG.debug("Deleted {} #{} with {} descendant(s)", name, id, removed.size() - 1);
            return removed;
        });
    }

    public List<StoredRecord> list(String name, ListQuery query) {
        return locks.withRecordRead(name, () -> {
            Operator pipeline = pipeline(name, query);
            List<StoredRecord> out = new ArrayList<>();
            TableSchema layout = layout(name);
            pipeline.open();
            try {
                Row row;
                while ((row = pipeline.next()) != null) {
                    out.add(mapper.fromRow(layout, row.record()));
                }
            } finally {
                pipeline.close();
            }
            return out;
        });
    }

    /** Same rows as {@link #list}, produced lazily. Close the cursor when done with it. */
    public RecordCursor cursor(String name, ListQuery query) {
        return locks.withRecordRead(name, () -> {
            Operator pipeline = pipeline(name, query);
            TableSchema layout = layout(name);
            return new RecordCursor(name, pipeline, row -> mapper.fromRow(layout, row.record()), locks);
        });
    }

    /** Number of records matching all filters. */
    public long count(String name, List<FilterCondition> filters) {
        return locks.withRecordRead(name, () -> {
            StructureDefinition def = registry.get(name);
            TableSchema layout = layout(name);
            Operator op = new FilterOperator(new SeqScanOperator(storage, layout), compiler.compile(def, layout, filters));
            long n = 0;
            op.open();
            try {
                while (op.next() != null) n++;
            } finally {
                op.close();
            }
            return n;
        });
    }

    /** Direct children of a record, by id. */
    public List<StoredRecord> children(String name, long id) {
        return locks.withRecordRead(name, () -> {
            registry.get(name);
            TableSchema layout = layout(name);
            ridOrThrow(name, id);
            List<StoredRecord> out = new ArrayList<>();
            for (long child : indexes.childrenOf(name, id)) {
                out.add(mapper.fromRow(layout, storage.read(layout, ridOrThrow(name, child))));
            }
            return out;
        });
    }

    /** Discard a dropped structure's heap file and indexes. */
    @Override
    public void dropTable(TableSchema layout) {
        locks.withRecordWrite(layout.name(), () -> {
            indexes.drop(layout.name());
            storage.deleteTableFile(layout.filePath());
            LOG.info("Removed table file {} of structure {}", layout.filePath(), layout.name());
            return null;
        });
    }

    private Operator pipeline(String name, ListQuery query) {
        StructureDefinition def = registry.get(name);
        TableSchema layout = layout(name);
        Predicate predicate = compiler.compile(def, layout, query.filters());
        int limit = query.effectiveLimit(defaultLimit);
        boolean idOrder = (query.sortField() == null || TableSchema.ID.equals(query.sortField()))
                && query.sortOrder() == SortOrder.ASC;
        Operator op = idOrder
                ? new IndexScanOperator(indexes, storage, layout, IndexScanOperator.DEFAULT_BATCH)
                : new SeqScanOperator(storage, layout);
        if (!query.filters().isEmpty()) op = new FilterOperator(op, predicate);
        if (!idOrder) {
            long keep = (long) query.offset() + limit;
            int maxRows = limit == 0 || keep >= Integer.MAX_VALUE ? 0 : (int) keep;
            op = new SortOperator(op, compiler.comparator(def, layout, query.sortField(), query.sortOrder()), maxRows);
        }
        return new LimitOperator(op, query.offset(), limit);
    }

    // Map to a heap row, rejecting documents whose row would not fit one page
    private HeapRecord encode(String name, StructureDefinition def, TableSchema layout, long id, Long parentId,
                              JsonObject document, Instant createdAt, Instant updatedAt) {
        HeapRecord row = mapper.toRow(def, layout, id, parentId, document, createdAt, updatedAt);
        int size = row.toBytes().length;
        if (size > storage.maxRecordSize()) {
            throw ValidationException.single(name, "", "maxSize",
                    "stored row would take " + size + " bytes, at most " + storage.maxRecordSize() + " fit in a page");
        }
        return row;
    }

    // Walk up from the new parent; reaching the record itself means a cycle
    private void checkNewParent(String name, TableSchema layout, long id, long newParent) {
        int parentCol = layout.indexOf(TableSchema.PARENT_ID);
        Set<Long> seen = new HashSet<>();
        Long current = newParent;
        while (current != null && seen.add(current)) {
            if (current == id) {
                throw ValidationException.single(name, TableSchema.PARENT_ID, "parent_cycle",
                        "record " + newParent + " is " + id + " itself or one of its descendants");
            }
            RID rid = indexes.ridOf(name, current);
            if (rid == null) throw NotFoundException.record(name, current);
            HeapRecord row = storage.read(layout, rid);
            current = (Long) row.get(parentCol);
        }
    }

    private Long parentIdOf(String name, JsonObject document) {
        JsonElement el = document.get(TableSchema.PARENT_ID);
        if (el == null || el.isJsonNull()) return null;
        if (!isLong(el)) {
            throw ValidationException.single(name, TableSchema.PARENT_ID, "type", "parent_id must be an integer, got " + el);
        }
        return el.getAsLong();
    }

    private static boolean isLong(JsonElement el) {
        if (!el.isJsonPrimitive() || !el.getAsJsonPrimitive().isNumber()) return false;
        BigDecimal n = el.getAsBigDecimal();
        return SchemaParser.isIntegral(n) && n.compareTo(LONG_MIN) >= 0 && n.compareTo(LONG_MAX) <= 0;
    }

    private RID ridOrThrow(String name, long id) {
        RID rid = indexes.ridOf(name, id);
        if (rid == null) throw NotFoundException.record(name, id);
        return rid;
    }

    private TableSchema layout(String name) {
        TableSchema layout = catalog.getTableSchema(name);
        if (layout == null) throw NotFoundException.structure(name);
        return layout;
    }

    private void publish(String name, ChangeKind kind, StoredRecord record, Instant at) {
        notifier.publish(new ChangeEvent(name, kind, record.id(), record.toJson(), at));
    }
}
