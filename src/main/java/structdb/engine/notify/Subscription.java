package structdb.engine.notify;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * One subscriber's bounded event buffer. When the buffer is full the oldest
 * buffered event is discarded to make room; {@link #dropped()} counts them.
 * Closing unsubscribes and wakes blocked readers.
 */
public final class Subscription implements AutoCloseable {
    private final String structureName;
    private final int capacity;
    private final Consumer<Subscription> onClose;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final ArrayDeque<ChangeEvent> buffer;
    private long dropped;
    private boolean closed;

    Subscription(String structureName, int capacity, Consumer<Subscription> onClose) {
        this.structureName = structureName;
        this.capacity = capacity;
        this.onClose = onClose;
        this.buffer = new ArrayDeque<>(capacity);
    }

    public String structureName() { return structureName; }

    // Never blocks the publisher
    void offer(ChangeEvent event) {
        lock.lock();
        try {
            if (closed) return;
            if (buffer.size() == capacity) {
                buffer.pollFirst();
                dropped++;
            }
            buffer.addLast(event);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    /** Next event, waiting up to timeout; null on timeout or once closed and drained. */
    public ChangeEvent poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lock();
        try {
            while (buffer.isEmpty()) {
                if (closed || nanos <= 0) return null;
                nanos = notEmpty.awaitNanos(nanos);
            }
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /** Next event, waiting as long as needed; null once closed and drained. */
    public ChangeEvent take() throws InterruptedException {
        lock.lock();
        try {
            while (buffer.isEmpty()) {
                if (closed) return null;
                notEmpty.await();
            }
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lazy, blocking stream of events that ends when the subscription is
     * closed. An interrupt ends the stream with the thread's interrupt flag set.
     */
    public Stream<ChangeEvent> stream() {
        Spliterator<ChangeEvent> spliterator = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL) {
            @Override
            public boolean tryAdvance(Consumer<? super ChangeEvent> action) {
                ChangeEvent next;
                try {
                    next = take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
                if (next == null) return false;
                action.accept(next);
                return true;
            }
        };
        return StreamSupport.stream(spliterator, false);
    }

    /** Events discarded because the buffer was full. */
    public long dropped() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }

    public int buffered() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) return;
            closed = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        onClose.accept(this);
    }
}
