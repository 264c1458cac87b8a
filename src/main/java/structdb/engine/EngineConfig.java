package structdb.engine;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine settings. Values come from {@link #defaultConfig(Path)} or from a
 * {@link Properties} set using the {@code structdb.*} keys.
 */
public class EngineConfig {
    public static final String PAGE_SIZE = "structdb.pageSize";
    public static final String BUFFER_PAGES = "structdb.bufferPages";
    public static final String MAX_DEPTH = "structdb.maxDepth";
    public static final String LOCK_TIMEOUT_MILLIS = "structdb.lockTimeoutMillis";
    public static final String SUBSCRIBER_BUFFER = "structdb.subscriberBuffer";
    public static final String DEFAULT_LIMIT = "structdb.defaultLimit";

    // Slot offsets are unsigned shorts below pageSize - 4; 0xFFFF stays free for the tombstone
    static final int MIN_PAGE_SIZE = 1024;
    static final int MAX_PAGE_SIZE = 65536;

    public final Path dataDir;
    public final int pageSize;
    public final int bufferPages;
    public final int maxDepth;
    public final Duration lockTimeout;
    public final int subscriberBuffer;
    public final int defaultLimit;
    public final Clock clock;

    public EngineConfig(Path dataDir,
                        int pageSize,
                        int bufferPages,
                        int maxDepth,
                        Duration lockTimeout,
                        int subscriberBuffer,
                        int defaultLimit,
                        Clock clock) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
        if (pageSize < MIN_PAGE_SIZE || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be within [" + MIN_PAGE_SIZE + ", " + MAX_PAGE_SIZE + "] (got " + pageSize + ")");
        }
        if (bufferPages < 1) throw new IllegalArgumentException("bufferPages must be >= 1 (got " + bufferPages + ")");
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1 (got " + maxDepth + ")");
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        if (subscriberBuffer < 1) throw new IllegalArgumentException("subscriberBuffer must be >= 1 (got " + subscriberBuffer + ")");
        if (defaultLimit < 0) throw new IllegalArgumentException("defaultLimit must be >= 0 (got " + defaultLimit + ")");
        this.pageSize = pageSize;
        this.bufferPages = bufferPages;
        this.maxDepth = maxDepth;
        this.lockTimeout = lockTimeout;
        this.subscriberBuffer = subscriberBuffer;
        this.defaultLimit = defaultLimit;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public static EngineConfig defaultConfig(Path dataDir) {
        return new EngineConfig(
                dataDir,
                16384,                   // page size in bytes
                64,                      // cached pages
                16,                      // max nesting depth
                Duration.ofSeconds(5),   // per-structure lock wait
                256,                     // buffered events per subscriber
                100,                     // list() page size when none is given
                Clock.systemUTC()
        );
    }

    public static EngineConfig fromProperties(Path dataDir, Properties props) {
        EngineConfig d = defaultConfig(dataDir);
        return new EngineConfig(
                dataDir,
                intProp(props, PAGE_SIZE, d.pageSize),
                intProp(props, BUFFER_PAGES, d.bufferPages),
                intProp(props, MAX_DEPTH, d.maxDepth),
                Duration.ofMillis(intProp(props, LOCK_TIMEOUT_MILLIS, (int) d.lockTimeout.toMillis())),
                intProp(props, SUBSCRIBER_BUFFER, d.subscriberBuffer),
                intProp(props, DEFAULT_LIMIT, d.defaultLimit),
                d.clock
        );
    }

    public EngineConfig withClock(Clock clock) {
        return new EngineConfig(dataDir, pageSize, bufferPages, maxDepth, lockTimeout, subscriberBuffer, defaultLimit, clock);
    }

    public EngineConfig withMaxDepth(int maxDepth) {
        return new EngineConfig(dataDir, pageSize, bufferPages, maxDepth, lockTimeout, subscriberBuffer, defaultLimit, clock);
    }

    public EngineConfig withLockTimeout(Duration lockTimeout) {
        return new EngineConfig(dataDir, pageSize, bufferPages, maxDepth, lockTimeout, subscriberBuffer, defaultLimit, clock);
    }

    public EngineConfig withSubscriberBuffer(int subscriberBuffer) {
        return new EngineConfig(dataDir, pageSize, bufferPages, maxDepth, lockTimeout, subscriberBuffer, defaultLimit, clock);
    }

    public Path catalogFile() { return dataDir.resolve("catalog").resolve("catalog.json"); }

    public Path tablesDir() { return dataDir.resolve("tables"); }

    private static int intProp(Properties props, String key, int fallback) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property " + key + " must be an integer (got '" + raw + "')", e);
        }
    }
}
