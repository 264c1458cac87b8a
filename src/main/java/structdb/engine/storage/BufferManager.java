package structdb.engine.storage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * LRU cache of heap pages keyed by file and page number.
 *
 * Cached bytes are shared with every reader and must not be modified; writers
 * work on a copy and call {@link #invalidate} once the page is on disk.
 */
public class BufferManager {
    private final int pageSize;
    private final Map<PageKey, Page> lru;

    public BufferManager(int pageSize, int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("buffer capacity must be at least one page");
        this.pageSize = pageSize;
        this.lru = new LinkedHashMap<>(capacity, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<PageKey, Page> eldest) {
                return size() > capacity;
            }
        };
    }

    public int getPageSize() { return pageSize; }

    /**
     * Page {@code pageId} of the file, read from disk on a miss. A page past
     * the end of the file comes back zeroed and is not cached.
     */
    public synchronized Page getPage(String filePath, int pageId) throws IOException {
        PageKey key = new PageKey(filePath, pageId);
        Page cached = lru.get(key);
        if (cached != null) return cached;

        byte[] bytes = new byte[pageSize];
        long start = (long) pageId * pageSize;
        boolean onDisk;
        try (RandomAccessFile raf = new RandomAccessFile(filePath, "r")) {
            long length = raf.length();
            onDisk = start < length;
            if (onDisk) {
                raf.seek(start);
                raf.readFully(bytes, 0, (int) Math.min(pageSize, length - start));
            }
        }
        Page page = new Page(filePath, pageId, bytes);
        if (onDisk) lru.put(key, page);
        return page;
    }

    public synchronized void invalidate(String filePath, int pageId) {
        lru.remove(new PageKey(filePath, pageId));
    }

    /** Forget every page of a file (drop, vacuum). */
    public synchronized void invalidateFile(String filePath) {
        lru.keySet().removeIf(k -> k.filePath().equals(filePath));
    }

    synchronized int cachedPages() { return lru.size(); }

    private record PageKey(String filePath, int pageId) { }
}
