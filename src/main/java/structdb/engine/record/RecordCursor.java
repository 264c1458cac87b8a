package structdb.engine.record;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.Function;

import structdb.engine.concurrent.StructureLocks;
import structdb.engine.exec.Operator;
import structdb.engine.exec.Row;

/**
 * Lazy iteration over a listing pipeline. Each step runs under the
 * structure's record read lock and no lock is held between steps, so an
 * abandoned cursor holds nothing but its operator state. Rows committed while
 * iterating may or may not show up.
 *
 * The pipeline is closed on exhaustion or by {@link #close()}.
 */
public class RecordCursor implements Iterator<StoredRecord>, AutoCloseable {
    private final String structureName;
    private final Operator pipeline;
    private final Function<Row, StoredRecord> mapper;
    private final StructureLocks locks;

    private boolean opened;
    private boolean closed;
    private StoredRecord next;

    RecordCursor(String structureName, Operator pipeline, Function<Row, StoredRecord> mapper, StructureLocks locks) {
        this.structureName = structureName;
        this.pipeline = pipeline;
        this.mapper = mapper;
        this.locks = locks;
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (closed) return false;
        next = locks.withRecordRead(structureName, () -> {
            if (!opened) {
                pipeline.open();
                opened = true;
            }
            Row row = pipeline.next();
            return row == null ? null : mapper.apply(row);
        });
        if (next == null) close();
        return next != null;
    }

    @Override
    public StoredRecord next() {
        if (!hasNext()) throw new NoSuchElementException();
        StoredRecord out = next;
        next = null;
        return out;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (opened) pipeline.close();
    }
}
