package structdb.engine.storage;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import structdb.engine.catalog.ColumnSchema;

/**
 * Slotted heap page over a page-sized byte array.
 *
 * <pre>
 * offset 0   int     end of the record area (next record goes here)
 * offset 4   u16     slots handed out so far
 * offset 6   u16     unused
 * offset 8   ...     record bytes, packed upwards
 *            ...     free gap
 * page end   ...     slot directory, packed downwards: slot n at pageSize - 4 * (n + 1)
 * </pre>
 *
 * A slot is {@code u16 offset, u16 length}; offset 0xFFFF marks a deleted row.
 * Slots are never reused, so a RID stays valid until the file is rewritten.
 */
public final class HeapPage {
    static final int HEADER_SIZE = 8;
    static final int SLOT_ENTRY_SIZE = 4;
    private static final int FREE_END = 0;
    private static final int SLOT_COUNT = 4;
    private static final int TOMBSTONE = 0xFFFF;

    private final String filePath;
    private final int pageId;
    private final byte[] data;
    private final ByteBuffer buf;

    private HeapPage(String filePath, int pageId, byte[] data) {
        this.filePath = filePath;
        this.pageId = pageId;
        this.data = data;
        this.buf = ByteBuffer.wrap(data);
    }

    public static HeapPage wrap(String filePath, int pageId, byte[] data, int pageSize) {
        if (data.length != pageSize) {
            throw new IllegalArgumentException("page buffer is " + data.length + " bytes, expected " + pageSize);
        }
        HeapPage page = new HeapPage(filePath, pageId, data);
        if (page.buf.getInt(FREE_END) == 0) {
            // zeroed buffer: a page that was never written
            page.buf.putInt(FREE_END, HEADER_SIZE);
            page.setSlotCount(0);
        }
        return page;
    }

    /** Largest record an empty page of the given size can take. */
    public static int maxRecordSize(int pageSize) {
        return pageSize - HEADER_SIZE - SLOT_ENTRY_SIZE;
    }

    public boolean canFit(int recordLen) {
        if (recordLen >= TOMBSTONE) return false;
        return recordLen + SLOT_ENTRY_SIZE <= freeBytes();
    }

    /** Appends the record and returns its slot id. */
    public int insert(byte[] recordBytes) {
        if (!canFit(recordBytes.length)) {
            throw new IllegalStateException("Page " + pageId + " has " + freeBytes()
                    + " free bytes, record needs " + (recordBytes.length + SLOT_ENTRY_SIZE));
        }
        int at = buf.getInt(FREE_END);
        int slot = slotCount();
        System.arraycopy(recordBytes, 0, data, at, recordBytes.length);
        writeSlot(slot, at, recordBytes.length);
        buf.putInt(FREE_END, at + recordBytes.length);
        setSlotCount(slot + 1);
        return slot;
    }

    public byte[] readSlot(int slotId) {
        checkSlot(slotId);
        int offset = slotOffset(slotId);
        int len = slotLength(slotId);
        if (offset == TOMBSTONE || len == 0) {
            throw new IllegalStateException("Slot " + slotId + " of page " + pageId + " holds no row");
        }
        byte[] out = new byte[len];
        System.arraycopy(data, offset, out, 0, len);
        return out;
    }

    public HeapRecord readRecord(int slotId, List<ColumnSchema> columns) {
        return HeapRecord.fromBytes(readSlot(slotId), columns);
    }

    public boolean isLive(int slotId) {
        return slotId >= 0 && slotId < slotCount()
                && slotOffset(slotId) != TOMBSTONE && slotLength(slotId) > 0;
    }

    /** Marks the slot deleted. The record bytes stay until vacuum. */
    public void delete(int slotId) {
        if (slotId < 0 || slotId >= slotCount()) return;
        writeSlot(slotId, TOMBSTONE, 0);
    }

    public List<Integer> liveSlotIds() {
        int n = slotCount();
        List<Integer> out = new ArrayList<>(n);
        for (int slot = 0; slot < n; slot++) {
            if (isLive(slot)) out.add(slot);
        }
        return out;
    }

    public byte[] rawData() { return data; }
    public int pageId() { return pageId; }
    public String filePath() { return filePath; }

    private int freeBytes() {
        return directoryStart(slotCount()) - buf.getInt(FREE_END);
    }

    // first byte of the directory once it holds the given number of slots
    private int directoryStart(int slots) {
        return data.length - slots * SLOT_ENTRY_SIZE;
    }

    private void checkSlot(int slotId) {
        if (slotId < 0 || slotId >= slotCount()) {
            throw new IllegalArgumentException("Slot " + slotId + " out of range on page " + pageId);
        }
    }

    private int slotCount() { return Short.toUnsignedInt(buf.getShort(SLOT_COUNT)); }
    private void setSlotCount(int n) { buf.putShort(SLOT_COUNT, (short) n); }

    private int slotOffset(int slot) { return Short.toUnsignedInt(buf.getShort(directoryStart(slot + 1))); }
    private int slotLength(int slot) { return Short.toUnsignedInt(buf.getShort(directoryStart(slot + 1) + 2)); }

    private void writeSlot(int slot, int offset, int length) {
        int pos = directoryStart(slot + 1);
        buf.putShort(pos, (short) offset);
        buf.putShort(pos + 2, (short) length);
    }

    @Override
    public String toString() {
        return "HeapPage{id=" + pageId + ", slots=" + slotCount() + ", free=" + freeBytes() + ", file='" + filePath + "'}";
    }
}
