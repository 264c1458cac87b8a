package structdb.engine.index;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;
import structdb.engine.catalog.TableSchema;
import structdb.engine.storage.BufferManager;
import structdb.engine.storage.HeapRecord;
import structdb.engine.storage.RID;
import structdb.engine.storage.StorageManager;

public class IndexManagerTest {
    @TempDir
    Path dir;

    private TableSchema layout() {
        return new TableSchema("nodes", List.of(
            new ColumnSchema(TableSchema.ID, DataType.BIGINT, 0, false),
            new ColumnSchema(TableSchema.PARENT_ID, DataType.BIGINT, 0, false)
        ), dir.resolve("nodes.tbl").toString());
    }

    private RID put(StorageManager storage, TableSchema ts, long id, Long parent) {
        return storage.insert(ts, new HeapRecord(Arrays.asList(id, parent)));
    }

    @Test
    void loadRebuildsIdAndParentIndexes() {
        StorageManager storage = new StorageManager(new BufferManager(1024, 8));
        TableSchema ts = layout();
        storage.createTableFile(ts);
        RID r1 = put(storage, ts, 1, null);
        put(storage, ts, 5, 1L);
        put(storage, ts, 3, 1L);
        RID dead = put(storage, ts, 9, null);
        storage.delete(ts, dead);

        IndexManager indexes = new IndexManager(storage);
        indexes.load(ts);
        assertEquals(r1, indexes.ridOf("nodes", 1));
        assertNull(indexes.ridOf("nodes", 9));
        assertEquals(List.of(3L, 5L), indexes.childrenOf("nodes", 1));
        assertEquals(3, indexes.rowCount("nodes"));
        // numbering continues after the highest live id
        assertEquals(6, indexes.nextId("nodes"));
    }

    @Test
    void laterDuplicateRowWins() {
        StorageManager storage = new StorageManager(new BufferManager(1024, 8));
        TableSchema ts = layout();
        storage.createTableFile(ts);
        put(storage, ts, 1, null);
        put(storage, ts, 2, 1L);
        RID moved = put(storage, ts, 2, null);

        IndexManager indexes = new IndexManager(storage);
        indexes.load(ts);
        assertEquals(moved, indexes.ridOf("nodes", 2));
        assertTrue(indexes.childrenOf("nodes", 1).isEmpty());
        assertEquals(2, indexes.rowCount("nodes"));
    }

    @Test
    void tracksInsertsAndDeletes() {
        IndexManager indexes = new IndexManager(new StorageManager(new BufferManager(1024, 8)));
        indexes.register("t");
        long a = indexes.nextId("t");
        assertEquals(1, a);
        // an id is taken only once the insert is recorded
        assertEquals(1, indexes.nextId("t"));
        indexes.onInsert("t", new RID(0, 0), a, null);
        long b = indexes.nextId("t");
        assertEquals(2, b);
        indexes.onInsert("t", new RID(0, 1), b, a);
        assertEquals(List.of(2L), indexes.childrenOf("t", a));
        indexes.onDelete("t", new RID(0, 1), b, a);
        assertTrue(indexes.childrenOf("t", a).isEmpty());
        assertNull(indexes.ridOf("t", b));
        assertEquals(3, indexes.nextId("t"));

        indexes.drop("t");
        assertFalse(indexes.isLoaded("t"));
        assertThrows(IllegalStateException.class, () -> indexes.rowCount("t"));
    }

    @Test
    void idsAfterWalksLiveIdsInBatches() {
        IndexManager indexes = new IndexManager(new StorageManager(new BufferManager(1024, 8)));
        indexes.register("t");
        for (long id = 1; id <= 150; id++) {
            indexes.onInsert("t", new RID((int) (id / 10), (int) (id % 10)), id, null);
        }
        indexes.onDelete("t", new RID(0, 5), 5, null);

        List<Long> first = indexes.idsAfter("t", Long.MIN_VALUE, 64);
        assertEquals(64, first.size());
        assertEquals(1L, first.get(0));
        assertFalse(first.contains(5L));
        assertEquals(65L, first.get(63));
        assertEquals(List.of(149L, 150L), indexes.idsAfter("t", 148, 64));
        assertTrue(indexes.idsAfter("t", 150, 64).isEmpty());
        assertTrue(indexes.idsAfter("t", Long.MAX_VALUE, 64).isEmpty());
    }
}
