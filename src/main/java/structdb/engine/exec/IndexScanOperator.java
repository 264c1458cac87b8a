package structdb.engine.exec;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.TableSchema;
import structdb.engine.error.StorageException;
import structdb.engine.index.IndexManager;
import structdb.engine.storage.RID;
import structdb.engine.storage.StorageManager;

/**
 * Ascending id-order scan over the id index. Ids are fetched batchSize at a
 * time and each RID is looked up only when its row is produced, so rows
 * deleted after the batch was fetched are skipped and ids added behind the
 * scan position are still reached.
 */
public class IndexScanOperator implements Operator {
    public static final int DEFAULT_BATCH = 64;

    private final IndexManager indexes;
    private final StorageManager storage;
    private final TableSchema layout;
    private final int batchSize;

    private final Deque<Long> batch = new ArrayDeque<>();
    private long lastId;
    private boolean opened;

    public IndexScanOperator(IndexManager indexes, StorageManager storage, TableSchema layout, int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1 (got " + batchSize + ")");
        this.indexes = indexes;
        this.storage = storage;
        this.layout = layout;
        this.batchSize = batchSize;
    }

    @Override
    public void open() {
        batch.clear();
        lastId = Long.MIN_VALUE;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened) return null;
        while (true) {
            if (!indexes.isLoaded(layout.name())) {
                throw new StorageException("Table " + layout.name() + " was dropped during the scan");
            }
            if (batch.isEmpty()) {
                List<Long> ids = indexes.idsAfter(layout.name(), lastId, batchSize);
                if (ids.isEmpty()) return null;
                batch.addAll(ids);
                lastId = ids.get(ids.size() - 1);
            }
            long id = batch.poll();
            RID rid = indexes.ridOf(layout.name(), id);
            if (rid == null) continue; // deleted since the batch was fetched
            return Row.of(storage.read(layout, rid), rid, layout.columns());
        }
    }

    @Override
    public void close() {
        batch.clear();
        opened = false;
    }

    @Override
    public List<ColumnSchema> schema() { return layout.columns(); }
}
