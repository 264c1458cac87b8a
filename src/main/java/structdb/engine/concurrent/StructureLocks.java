package structdb.engine.concurrent;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import structdb.engine.error.ConcurrencyException;

/**
 * Per-structure locking. Schema operations hold the schema write lock;
 * record operations hold the schema read lock plus the table's data lock
 * (read for queries, write for mutations). Different names never contend.
 *
 * Every acquisition waits at most the configured timeout, retries once,
 * then fails with {@link ConcurrencyException}.
 */
public class StructureLocks {
    private static final Logger LOG = LoggerFactory.getLogger(StructureLocks.class);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final Duration timeout;

    public StructureLocks(Duration timeout) {
        this.timeout = timeout;
    }

    public <T> T withSchemaLock(String name, Supplier<T> action) {
        Lock schema = entry(name).schema.writeLock();
        acquire(schema, name, "schema write");
        try {
            return action.get();
        } finally {
            schema.unlock();
        }
    }

    public <T> T withRecordRead(String name, Supplier<T> action) {
        Entry e = entry(name);
        return withBoth(name, e.schema.readLock(), e.data.readLock(), "data read", action);
    }

    public <T> T withRecordWrite(String name, Supplier<T> action) {
        Entry e = entry(name);
        return withBoth(name, e.schema.readLock(), e.data.writeLock(), "data write", action);
    }

    private <T> T withBoth(String name, Lock schema, Lock data, String what, Supplier<T> action) {
        acquire(schema, name, "schema read");
        try {
            acquire(data, name, what);
            try {
                return action.get();
            } finally {
                data.unlock();
            }
        } finally {
            schema.unlock();
        }
    }

    private void acquire(Lock lock, String name, String what) {
        try {
            if (lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) return;
            LOG.warn("Timed out after {} ms waiting for {} lock on {}; retrying once", timeout.toMillis(), what, name);
            if (lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyException("Interrupted waiting for " + what + " lock on " + name, e);
        }
        throw new ConcurrencyException("Timed out waiting for " + what + " lock on " + name);
    }

    private Entry entry(String name) {
        return entries.computeIfAbsent(name, n -> new Entry());
    }

    private static final class Entry {
        final ReentrantReadWriteLock schema = new ReentrantReadWriteLock(true);
        final ReentrantReadWriteLock data = new ReentrantReadWriteLock(true);
    }
}
