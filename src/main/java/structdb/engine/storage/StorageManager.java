package structdb.engine.storage;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.DataType;
import structdb.engine.catalog.TableSchema;
import structdb.engine.error.StorageException;

/**
 * Heap files of structure tables. Every call takes the table layout it should
 * use, so the caller decides which catalog snapshot a row is read against.
 */
public class StorageManager {
    private static final Logger LOG = LoggerFactory.getLogger(StorageManager.class);

    private final BufferManager bufferManager;
    private final int pageSize;

    public StorageManager(BufferManager bufferManager) {
        this.bufferManager = bufferManager;
        this.pageSize = bufferManager.getPageSize();
    }

    public BufferManager getBufferManager() { return bufferManager; }

    public int pageSize() { return pageSize; }

    /** Largest encoded row an insert accepts. */
    public int maxRecordSize() { return Math.min(HeapPage.maxRecordSize(pageSize), 0xFFFE); }

    /** Create an empty heap file; a leftover file at the same path is truncated. */
    public void createTableFile(TableSchema layout) {
        Path path = Path.of(layout.filePath());
        try {
            Files.createDirectories(path.toAbsolutePath().getParent());
            if (Files.exists(path)) {
                LOG.warn("Truncating leftover table file {}", path);
                bufferManager.invalidateFile(layout.filePath());
            }
            Files.write(path, new byte[0]);
            LOG.debug("Created table file {}", path);
        } catch (IOException e) {
            throw new StorageException("Failed creating table file " + path, e);
        }
    }

    public void deleteTableFile(String filePath) {
        bufferManager.invalidateFile(filePath);
        try {
            Files.deleteIfExists(Path.of(filePath));
            LOG.debug("Deleted table file {}", filePath);
        } catch (IOException e) {
            throw new StorageException("Failed deleting table file " + filePath, e);
        }
    }

    public RID insert(TableSchema layout, HeapRecord record) {
        List<ColumnSchema> columns = layout.columns();
        validateRecord(columns, record);

        byte[] payload = record.toBytes();
        if (payload.length > maxRecordSize()) {
            throw new StorageException("Record of " + payload.length + " bytes does not fit a " + pageSize + " byte page");
        }

        File file = new File(layout.filePath());
        long fileLen = file.length();
        int pageCount = (int) ((fileLen + pageSize - 1) / pageSize);
        int targetPageId = Math.max(pageCount - 1, 0); // empty file -> page 0

        HeapPage heapPage = HeapPage.wrap(file.getPath(), targetPageId, copyOf(file.getPath(), targetPageId), pageSize);
        if (!heapPage.canFit(payload.length)) {
            targetPageId = pageCount;
            heapPage = HeapPage.wrap(file.getPath(), targetPageId, new byte[pageSize], pageSize);
        }

        int slotId = heapPage.insert(payload);
        writePage(file, heapPage);
        return new RID(targetPageId, slotId);
    }

    public HeapRecord read(TableSchema layout, RID rid) {
        HeapPage hp = HeapPage.wrap(layout.filePath(), rid.pageId(), load(layout.filePath(), rid.pageId()).data(), pageSize);
        return hp.readRecord(rid.slotId(), layout.columns());
    }

    /**
     * Tombstone the record at rid. Returns false when the slot was already
     * tombstoned or out of range.
     */
    public boolean delete(TableSchema layout, RID rid) {
        File file = new File(layout.filePath());
        HeapPage hp = HeapPage.wrap(file.getPath(), rid.pageId(), copyOf(file.getPath(), rid.pageId()), pageSize);
        if (!hp.isLive(rid.slotId())) return false;
        hp.delete(rid.slotId());
        writePage(file, hp);
        return true;
    }

    // Functional-style scan using callback to avoid building large lists when not needed
    public interface RowConsumer { void accept(RID rid, HeapRecord record); }

    public void scan(TableSchema layout, RowConsumer consumer) {
        int pages = pageCount(layout);
        for (int pid = 0; pid < pages; pid++) {
            for (TableRow row : readPage(layout, pid)) {
                consumer.accept(row.rid(), row.record());
            }
        }
    }

    public int pageCount(TableSchema layout) {
        long fileLen = new File(layout.filePath()).length();
        return (int) ((fileLen + pageSize - 1) / pageSize);
    }

    /** Live rows of one page in slot order. */
    public List<TableRow> readPage(TableSchema layout, int pageId) {
        HeapPage hp = HeapPage.wrap(layout.filePath(), pageId, load(layout.filePath(), pageId).data(), pageSize);
        List<TableRow> out = new ArrayList<>();
        for (int slotId : hp.liveSlotIds()) {
            out.add(new TableRow(new RID(pageId, slotId), hp.readRecord(slotId, layout.columns())));
        }
        return out;
    }

    // Validation: arity, type consistency, VARCHAR length constraint (in characters)
    private void validateRecord(List<ColumnSchema> columns, HeapRecord record) {
        List<Object> vals = record.getValues();
        if (vals.size() != columns.size()) {
            throw new IllegalArgumentException("Arity mismatch: expected " + columns.size() + " values, got " + vals.size());
        }
        for (int i = 0; i < columns.size(); i++) {
            ColumnSchema col = columns.get(i);
            Object v = vals.get(i);
            if (v == null) continue;
            boolean ok = switch (col.type()) {
                case BIGINT -> v instanceof Long;
                case DOUBLE -> v instanceof Double;
                case BOOLEAN -> v instanceof Boolean;
                case TIMESTAMP -> v instanceof Instant;
                case TEXT -> v instanceof String;
                case VARCHAR -> v instanceof String;
                case JSON -> false;
            };
            if (!ok) {
                throw new IllegalArgumentException("Type mismatch for column '" + col.name() + "' expected " + col.physicalType()
                        + ", got " + v.getClass().getSimpleName());
            }
            if (v instanceof String s && col.type() == DataType.VARCHAR) {
                int chars = s.codePointCount(0, s.length());
                if (chars > col.length()) {
                    throw new IllegalArgumentException("Value too long for column '" + col.name() + "' (max=" + col.length() + ", got=" + chars + ")");
                }
            }
        }
    }

    private Page load(String filePath, int pageId) {
        try {
            return bufferManager.getPage(filePath, pageId);
        } catch (IOException e) {
            throw new StorageException("Failed to load page " + pageId + " of " + filePath, e);
        }
    }

    // Cached bytes are shared; mutate a copy and invalidate after the write
    private byte[] copyOf(String filePath, int pageId) {
        return load(filePath, pageId).data().clone();
    }

    private void writePage(File file, HeapPage page) {
        try (RandomAccessFile raf = new RandomAccessFile(file, "rw")) {
            raf.seek((long) page.pageId() * pageSize);
            raf.write(page.rawData());
        } catch (IOException e) {
            throw new StorageException("Failed writing heap page " + page.pageId() + " of " + file, e);
        } finally {
            bufferManager.invalidate(file.getPath(), page.pageId());
        }
    }
}
