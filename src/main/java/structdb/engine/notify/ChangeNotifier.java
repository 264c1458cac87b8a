package structdb.engine.notify;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

/**
 * In-process fan-out of committed record changes to per-structure subscribers.
 *
 * Publishing never blocks: each subscriber owns a bounded buffer that drops
 * its oldest event when full. The record store publishes while holding the
 * structure's write lock, so every subscriber sees one structure's events in
 * commit order. Subscribers only see events published after they subscribed.
 */
public class ChangeNotifier implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(ChangeNotifier.class);

    private final int capacity;
    private final Gson gson = new GsonBuilder().disableHtmlEscaping().create();
    private final Map<String, List<Subscription>> subscribers = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public ChangeNotifier(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1 (got " + capacity + ")");
        this.capacity = capacity;
    }

    public Subscription subscribe(String structureName) {
        if (closed) throw new IllegalStateException("Notifier is closed");
        Subscription sub = new Subscription(structureName, capacity, this::remove);
        subscribers.computeIfAbsent(structureName, n -> new CopyOnWriteArrayList<>()).add(sub);
        LOG.debug("New subscriber for {}", structureName);
        return sub;
    }

    public void publish(ChangeEvent event) {
        List<Subscription> subs = subscribers.get(event.structureName());
        if (subs == null) return;
        for (Subscription sub : subs) {
            long before = sub.dropped();
            sub.offer(event);
            if (sub.dropped() > before) {
                LOG.warn("Subscriber buffer for {} is full; dropped the oldest event", event.structureName());
            }
        }
    }

    /** Transport form: {"type": kind, "structure": name, "data": payload}. */
    public String toMessage(ChangeEvent event) {
        JsonObject msg = new JsonObject();
        msg.addProperty("type", event.kind().wireName());
        msg.addProperty("structure", event.structureName());
        msg.add("data", event.payload());
        return gson.toJson(msg);
    }

    public int subscriberCount(String structureName) {
        List<Subscription> subs = subscribers.get(structureName);
        return subs == null ? 0 : subs.size();
    }

    /** Close every subscription; later subscribe calls fail. */
    @Override
    public void close() {
        closed = true;
        for (List<Subscription> subs : subscribers.values()) {
            for (Subscription sub : subs) sub.close();
        }
        subscribers.clear();
    }

    private void remove(Subscription sub) {
        List<Subscription> subs = subscribers.get(sub.structureName());
        if (subs != null) subs.remove(sub);
    }
}
