package structdb.engine.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import structdb.engine.catalog.TableSchema;
import structdb.engine.storage.RID;
import structdb.engine.storage.StorageManager;

/**
 * Per-table in-memory indexes: record id to RID, and parent id to child ids.
 * Indexes are rebuilt from the heap file on open and after vacuum; callers
 * keep them in step with every insert and delete while holding the table's
 * data lock.
 */
public class IndexManager {
    private static final Logger LOG = LoggerFactory.getLogger(IndexManager.class);
    private static final int ORDER = 32;

    private final StorageManager storage;
    private final Map<String, TableIndex> tables = new ConcurrentHashMap<>();

    public IndexManager(StorageManager storage) {
        this.storage = storage;
    }

    /** Rebuild both indexes of a table from a heap scan. A later row of the same id wins. */
    public void load(TableSchema layout) {
        int idCol = layout.indexOf(TableSchema.ID);
        int parentCol = layout.indexOf(TableSchema.PARENT_ID);
        Map<Long, Entry> live = new TreeMap<>();
        storage.scan(layout, (rid, rec) -> {
            long id = (Long) rec.get(idCol);
            Entry previous = live.put(id, new Entry(rid, (Long) rec.get(parentCol)));
            if (previous != null) {
                LOG.warn("Table {} holds more than one row for id {}; keeping {}", layout.name(), id, rid);
            }
        });
        TableIndex idx = new TableIndex();
        live.forEach((id, e) -> {
            idx.byId.insert(id, e.rid());
            if (e.parentId() != null) idx.byParent.insert(e.parentId(), id);
            idx.maxId = Math.max(idx.maxId, id);
        });
        tables.put(layout.name(), idx);
        LOG.debug("Indexed table {}: {} row(s), max id {}", layout.name(), idx.byId.size(), idx.maxId);
    }

    /** Start empty indexes for a freshly created table. */
    public void register(String tableName) {
        tables.put(tableName, new TableIndex());
    }

    public void drop(String tableName) {
        tables.remove(tableName);
    }

    public boolean isLoaded(String tableName) {
        return tables.containsKey(tableName);
    }

    /** RID of the live row with this id, or null. */
    public RID ridOf(String tableName, long id) {
        List<RID> rids = index(tableName).byId.search(id);
        return rids.isEmpty() ? null : rids.get(0);
    }

    /** Ids of direct children, ascending. */
    public List<Long> childrenOf(String tableName, long parentId) {
        List<Long> out = new ArrayList<>(index(tableName).byParent.search(parentId));
        Collections.sort(out);
        return out;
    }

    public int rowCount(String tableName) {
        return index(tableName).byId.size();
    }

    /**
     * Id for the next record: one past the highest id seen by this index. The
     * id is taken only when {@link #onInsert} records it, so a failed write
     * leaves numbering unchanged.
     */
    public long nextId(String tableName) {
        return index(tableName).maxId + 1;
    }

    /** Up to max live ids greater than afterId, ascending. */
    public List<Long> idsAfter(String tableName, long afterId, int max) {
        if (afterId == Long.MAX_VALUE) return List.of();
        return index(tableName).byId.keysFrom(afterId + 1, max);
    }

    public void onInsert(String tableName, RID rid, long id, Long parentId) {
        TableIndex idx = index(tableName);
        idx.byId.insert(id, rid);
        if (parentId != null) idx.byParent.insert(parentId, id);
        idx.maxId = Math.max(idx.maxId, id);
    }

    public void onDelete(String tableName, RID rid, long id, Long parentId) {
        TableIndex idx = index(tableName);
        idx.byId.delete(id, rid);
        if (parentId != null) idx.byParent.delete(parentId, id);
    }

    private TableIndex index(String tableName) {
        TableIndex idx = tables.get(tableName);
        if (idx == null) throw new IllegalStateException("No index loaded for table " + tableName);
        return idx;
    }

    private record Entry(RID rid, Long parentId) {}

    // Runtime index state holder
    private static final class TableIndex {
        final BPlusTree<RID> byId = new BPlusTree<>(ORDER);
        final BPlusTree<Long> byParent = new BPlusTree<>(ORDER);
        long maxId;
    }
}
