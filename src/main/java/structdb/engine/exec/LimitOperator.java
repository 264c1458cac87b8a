package structdb.engine.exec;

import java.util.List;

import structdb.engine.catalog.ColumnSchema;

/**
 * Skips offset rows, then passes at most limit rows (0 = no limit).
 */
public class LimitOperator implements Operator {
    private final Operator child;
    private final int offset;
    private final int limit;

    private int skipped;
    private int produced;

    public LimitOperator(Operator child, int offset, int limit) {
        if (offset < 0 || limit < 0) throw new IllegalArgumentException("offset and limit must be >= 0");
        this.child = child;
        this.offset = offset;
        this.limit = limit;
    }

    @Override
    public void open() {
        skipped = 0;
        produced = 0;
        child.open();
    }

    @Override
    public Row next() {
        if (limit > 0 && produced >= limit) return null;
        Row r;
        while ((r = child.next()) != null) {
            if (skipped < offset) {
                skipped++;
                continue;
            }
            produced++;
            return r;
        }
        return null;
    }

    @Override
    public void close() { child.close(); }

    @Override
    public List<ColumnSchema> schema() { return child.schema(); }
}
