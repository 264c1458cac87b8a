package structdb.engine.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;

public class HeapPageTest {
    private static final int PAGE_SIZE = 4096;

    private List<ColumnSchema> schema() {
        return List.of(
            new ColumnSchema("id", DataType.BIGINT, 0, false),
            new ColumnSchema("name", DataType.VARCHAR, 50, false),
            new ColumnSchema("active", DataType.BOOLEAN, 0, false)
        );
    }

    @Test
    void insertAndReadRoundTrip() {
        HeapPage page = HeapPage.wrap("heap-test", 0, new byte[PAGE_SIZE], PAGE_SIZE);
        HeapRecord r1 = new HeapRecord(List.of(1L, "Alice", true));
        HeapRecord r2 = new HeapRecord(List.of(2L, "Bob", false));
        int s1 = page.insert(r1.toBytes());
        int s2 = page.insert(r2.toBytes());
        assertEquals(0, s1);
        assertEquals(1, s2);
        assertEquals(r1.getValues(), page.readRecord(s1, schema()).getValues());
        assertEquals(r2.getValues(), page.readRecord(s2, schema()).getValues());
        assertEquals(List.of(0, 1), page.liveSlotIds());
    }

    @Test
    void deleteTombstonesSlotWithoutReusingIt() {
        HeapPage page = HeapPage.wrap("heap-test", 0, new byte[PAGE_SIZE], PAGE_SIZE);
        int s1 = page.insert(new HeapRecord(List.of(1L, "Alice", true)).toBytes());
        page.delete(s1);
        assertTrue(page.liveSlotIds().isEmpty());
        assertFalse(page.isLive(s1));
        assertThrows(IllegalStateException.class, () -> page.readRecord(s1, schema()));

        int s2 = page.insert(new HeapRecord(List.of(2L, "Bob", false)).toBytes());
        assertEquals(1, s2);
        assertEquals(List.of(1), page.liveSlotIds());
    }

    @Test
    void fillsUpAndRefusesOversizedRecords() {
        HeapPage page = HeapPage.wrap("heap-test", 0, new byte[1024], 1024);
        assertFalse(page.canFit(HeapPage.maxRecordSize(1024) + 1));
        assertTrue(page.canFit(HeapPage.maxRecordSize(1024)));
        byte[] payload = new HeapRecord(List.of(1L, "x".repeat(100), true)).toBytes();
        int inserted = 0;
        while (page.canFit(payload.length)) {
            page.insert(payload);
            inserted++;
        }
        assertTrue(inserted > 1);
        assertThrows(IllegalStateException.class, () -> page.insert(payload));
    }

    @Test
    void largestPageTakesNearMaxRecords() {
        int size = 65536;
        HeapPage page = HeapPage.wrap("heap-test", 0, new byte[size], size);
        String big = "y".repeat(65000);
        int s1 = page.insert(new HeapRecord(List.of(1L, big, true)).toBytes());
        int s2 = page.insert(new HeapRecord(List.of(2L, "after", false)).toBytes());
        assertEquals(big, page.readRecord(s1, schema()).get(1));
        assertEquals("after", page.readRecord(s2, schema()).get(1));
    }
}
