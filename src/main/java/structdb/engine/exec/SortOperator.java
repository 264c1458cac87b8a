package structdb.engine.exec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.PriorityQueue;

import structdb.engine.catalog.ColumnSchema;

/**
 * Blocking sort: drains the child on open. With a positive maxRows only the
 * first maxRows rows in sort order are kept (bounded heap), otherwise all rows.
 * The heap starts small and grows with the rows actually seen.
 */
public class SortOperator implements Operator {
    private final Operator child;
    private final Comparator<Row> comparator;
    private final int maxRows;

    private Iterator<Row> sorted;

    public SortOperator(Operator child, Comparator<Row> comparator, int maxRows) {
        this.child = child;
        this.comparator = comparator;
        this.maxRows = maxRows;
    }

    @Override
    public void open() {
        child.open();
        List<Row> rows;
        try {
            rows = maxRows > 0 ? topRows() : allRows();
        } finally {
            child.close();
        }
        sorted = rows.iterator();
    }

    private List<Row> allRows() {
        List<Row> rows = new ArrayList<>();
        Row r;
        while ((r = child.next()) != null) rows.add(r);
        rows.sort(comparator);
        return rows;
    }

    // Max-heap on the sort order holding the best maxRows rows seen so far
    private List<Row> topRows() {
        PriorityQueue<Row> heap = new PriorityQueue<>(Math.min(maxRows, 1024) + 1, comparator.reversed());
        Row r;
        while ((r = child.next()) != null) {
            heap.add(r);
            if (heap.size() > maxRows) heap.poll();
        }
        List<Row> rows = new ArrayList<>(heap);
        rows.sort(comparator);
        return rows;
    }

    @Override
    public Row next() {
        return sorted != null && sorted.hasNext() ? sorted.next() : null;
    }

    @Override
    public void close() {
        sorted = Collections.emptyIterator();
    }

    @Override
    public List<ColumnSchema> schema() { return child.schema(); }
}
