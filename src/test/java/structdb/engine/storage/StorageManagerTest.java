package structdb.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;
import structdb.engine.catalog.TableSchema;
import structdb.engine.error.StorageException;

public class StorageManagerTest {
    private static final int PAGE_SIZE = 1024;

    @TempDir
    Path dir;

    private TableSchema people() {
        return new TableSchema("people", List.of(
            new ColumnSchema("id", DataType.BIGINT, 0, false),
            new ColumnSchema("name", DataType.VARCHAR, 10, false),
            new ColumnSchema("active", DataType.BOOLEAN, 0, false)
        ), dir.resolve("people.tbl").toString());
    }

    private StorageManager storage() {
        return new StorageManager(new BufferManager(PAGE_SIZE, 4));
    }

    @Test
    void createInsertScanDeleteLifecycle() {
        StorageManager storage = storage();
        TableSchema ts = people();
        storage.createTableFile(ts);
        RID alice = storage.insert(ts, new HeapRecord(List.of(1L, "Alice", true)));
        RID bob = storage.insert(ts, new HeapRecord(List.of(2L, "Bob", false)));
        assertEquals(new RID(0, 0), alice);
        assertEquals(new RID(0, 1), bob);

        List<Object> ids = new ArrayList<>();
        storage.scan(ts, (rid, rec) -> ids.add(rec.get(0)));
        assertEquals(List.of(1L, 2L), ids);

        assertTrue(storage.delete(ts, bob));
        assertFalse(storage.delete(ts, bob));
        List<TableRow> rows = storage.readPage(ts, 0);
        assertEquals(1, rows.size());
        assertEquals("Alice", rows.get(0).record().get(1));
        assertEquals("Alice", storage.read(ts, alice).get(1));
    }

    @Test
    void spillsOntoNewPagesWhenFull() {
        StorageManager storage = storage();
        TableSchema ts = people();
        storage.createTableFile(ts);
        RID last = null;
        for (long i = 0; i < 200; i++) {
            last = storage.insert(ts, new HeapRecord(List.of(i, "n" + i, i % 2 == 0)));
        }
        assertTrue(last.pageId() > 0);
        assertEquals(last.pageId() + 1, storage.pageCount(ts));
        int[] count = {0};
        storage.scan(ts, (rid, rec) -> count[0]++);
        assertEquals(200, count[0]);
    }

    @Test
    void validatesTypesAndVarcharLengthInCharacters() {
        StorageManager storage = storage();
        TableSchema ts = people();
        storage.createTableFile(ts);
        assertThrows(IllegalArgumentException.class, () -> storage.insert(ts, new HeapRecord(List.of(1L, "x"))));
        assertThrows(IllegalArgumentException.class, () -> storage.insert(ts, new HeapRecord(List.of(1, "x", true))));
        assertThrows(IllegalArgumentException.class, () -> storage.insert(ts, new HeapRecord(List.of(1L, "elevenchars", true))));
        // ten characters, more than ten UTF-8 bytes
        storage.insert(ts, new HeapRecord(List.of(1L, "éééééééééé", true)));
        storage.insert(ts, new HeapRecord(Arrays.asList(2L, null, null)));
    }

    @Test
    void rejectsRecordsLargerThanAPage() {
        StorageManager storage = storage();
        TableSchema ts = new TableSchema("docs", List.of(new ColumnSchema("document", DataType.TEXT, 0, false)),
                dir.resolve("docs.tbl").toString());
        storage.createTableFile(ts);
        assertThrows(StorageException.class, () -> storage.insert(ts, new HeapRecord(List.of("z".repeat(PAGE_SIZE)))));
    }

    @Test
    void cachedPagesAreNotMutatedInPlace() throws Exception {
        StorageManager storage = storage();
        TableSchema ts = people();
        storage.createTableFile(ts);
        RID rid = storage.insert(ts, new HeapRecord(List.of(1L, "Alice", true)));
        storage.readPage(ts, 0); // cache the page
        byte[] cached = storage.getBufferManager().getPage(ts.filePath(), 0).data();
        assertEquals(1, storage.getBufferManager().cachedPages());
        byte[] snapshot = cached.clone();
        storage.delete(ts, rid);
        assertArrayEquals(snapshot, cached);
        assertTrue(storage.readPage(ts, 0).isEmpty());
    }

    @Test
    void createTruncatesLeftoverFileAndDeleteRemovesIt() throws Exception {
        StorageManager storage = storage();
        TableSchema ts = people();
        storage.createTableFile(ts);
        storage.insert(ts, new HeapRecord(List.of(1L, "Alice", true)));
        storage.createTableFile(ts);
        assertEquals(0, storage.pageCount(ts));
        storage.deleteTableFile(ts.filePath());
        assertFalse(Files.exists(Path.of(ts.filePath())));
    }
}
