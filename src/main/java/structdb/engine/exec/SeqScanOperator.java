package structdb.engine.exec;

import java.util.Iterator;
import java.util.List;

import structdb.engine.catalog.ColumnSchema;
import structdb.engine.catalog.TableSchema;
import structdb.engine.storage.StorageManager;
import structdb.engine.storage.TableRow;

/**
 * Physical operator that performs a full table scan, one heap page at a time.
 * Rows are decoded against the layout given at construction.
 */
public class SeqScanOperator implements Operator {
    private final StorageManager storage;
    private final TableSchema layout;

    private int pageCount;
    private int currentPageId;
    private Iterator<TableRow> currentPage;
    private boolean opened;

    public SeqScanOperator(StorageManager storage, TableSchema layout) {
        this.storage = storage;
        this.layout = layout;
    }

    @Override
    public void open() {
        pageCount = storage.pageCount(layout);
        currentPageId = 0;
        currentPage = null;
        opened = true;
    }

    @Override
    public Row next() {
        if (!opened) return null;
        while (currentPage == null || !currentPage.hasNext()) {
            if (currentPageId >= pageCount) return null; // done
            currentPage = storage.readPage(layout, currentPageId++).iterator();
        }
        TableRow row = currentPage.next();
        return Row.of(row.record(), row.rid(), layout.columns());
    }

    @Override
    public void close() {
        opened = false;
        currentPage = null;
    }

    @Override
    public List<ColumnSchema> schema() { return layout.columns(); }
}
