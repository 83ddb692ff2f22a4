package hle.lifecycle.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A bounded in-memory cache partitioned into independently locked shards.
 *
 * <p>Key features:
 * <ul>
 *   <li>A key always routes to the same shard, so each shard alone enforces
 *       one entry per key</li>
 *   <li>Pluggable eviction: LRU, LFU, oldest-first (TTL) or a custom ranking</li>
 *   <li>Per-entry TTL; expired values are never returned</li>
 *   <li>A background sweep removes expired entries that are never looked up again</li>
 * </ul>
 *
 * <p>There is no ordering guarantee across shards: operations on keys in
 * different shards are not linearizable with each other.
 *
 * <p>Example usage:
 * <pre>{@code
 * ShardedCache<String, String> cache = new ShardedCache<>(
 *     CacheConfig.<String, String>builder()
 *         .maxEntries(1_000)
 *         .defaultTtl(Duration.ofMinutes(5))
 *         .build()
 * );
 *
 * cache.insert(prompt, answer);
 * Optional<String> cached = cache.get(prompt);
 *
 * cache.close();
 * }</pre>
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ShardedCache<K, V> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ShardedCache.class);

    private final CacheConfig<K, V> config;
    private final List<CacheShard<K, V>> shards;
    private final ScheduledExecutorService sweeper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public ShardedCache(CacheConfig<K, V> config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");

        List<CacheShard<K, V>> created = new ArrayList<>(config.getShardCount());
        for (int i = 0; i < config.getShardCount(); i++) {
            created.add(new CacheShard<>(i, config));
        }
        this.shards = Collections.unmodifiableList(created);

        this.sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r);
            thread.setName(config.getThreadName());
            thread.setDaemon(true);
            return thread;
        });
        long intervalMs = config.getCleanupInterval().toMillis();
        sweeper.scheduleWithFixedDelay(this::runScheduledSweep, intervalMs, intervalMs, TimeUnit.MILLISECONDS);

        logger.debug("Created cache with {} shards of {} entries, policy {}",
                config.getShardCount(), config.getShardCapacity(), config.getEvictionPolicy());
    }

    /**
     * Creates a cache with default configuration.
     */
    public ShardedCache() {
        this(CacheConfig.defaultConfig());
    }

    /**
     * Spreads the high bits of the hash code into the low bits so that keys
     * whose hashes differ only in high bits still land in different shards.
     */
    static int spread(int hash) {
        return hash ^ (hash >>> 16);
    }

    CacheShard<K, V> shardFor(Object key) {
        int index = Math.floorMod(spread(key.hashCode()), shards.size());
        return shards.get(index);
    }

    /**
     * Returns the live value for {@code key}. An expired entry counts as a miss
     * and is removed.
     */
    public Optional<V> get(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        return shardFor(key).get(key);
    }

    /**
     * Inserts with the default TTL, if one is configured.
     *
     * @return the value that was replaced, if the key held a live one
     */
    public Optional<V> insert(K key, V value) {
        return insert(key, value, config.getDefaultTtl().orElse(null), -1L);
    }

    /**
     * Inserts with an explicit TTL; {@code null} means the entry never expires.
     */
    public Optional<V> insert(K key, V value, Duration ttl) {
        return insert(key, value, ttl, -1L);
    }

    /**
     * Inserts an entry that counts {@code sizeBytes} against the byte budget.
     * A negative size means the entry is not weighed.
     *
     * @throws IllegalArgumentException if the entry alone exceeds its shard's byte budget
     */
    public Optional<V> insert(K key, V value, Duration ttl, long sizeBytes) {
        Objects.requireNonNull(key, "key cannot be null");
        if (ttl != null && (ttl.isNegative() || ttl.isZero())) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return shardFor(key).insert(key, value, ttl, sizeBytes);
    }

    /**
     * @return the removed value, unless the key was absent or already expired
     */
    public Optional<V> remove(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        return shardFor(key).remove(key);
    }

    /**
     * Whether {@code key} holds a live value. Does not count as an access.
     */
    public boolean containsKey(K key) {
        Objects.requireNonNull(key, "key cannot be null");
        return shardFor(key).containsKey(key);
    }

    public void clear() {
        shards.forEach(CacheShard::clear);
    }

    /**
     * Number of stored entries. Expired entries are included until a lookup
     * or the sweep removes them.
     */
    public int size() {
        int size = 0;
        for (CacheShard<K, V> shard : shards) {
            size += shard.size();
        }
        return size;
    }

    /**
     * Total bytes counted against the byte budget.
     */
    public long weightedSize() {
        long total = 0;
        for (CacheShard<K, V> shard : shards) {
            total += shard.weightedSize();
        }
        return total;
    }

    public int shardCount() {
        return shards.size();
    }

    public CacheStats stats() {
        long hits = 0;
        long misses = 0;
        long evictions = 0;
        long expirations = 0;
        int size = 0;
        for (CacheShard<K, V> shard : shards) {
            hits += shard.hits();
            misses += shard.misses();
            evictions += shard.evictions();
            expirations += shard.expirations();
            size += shard.size();
        }
        return new CacheStats(hits, misses, evictions, expirations, size);
    }

    /**
     * Runs one sweep over every shard.
     *
     * @return number of expired entries removed
     */
    public int sweepExpired() {
        int removed = 0;
        for (CacheShard<K, V> shard : shards) {
            removed += shard.sweepExpired();
        }
        return removed;
    }

    private void runScheduledSweep() {
        try {
            int removed = sweepExpired();
            if (removed > 0) {
                logger.debug("Swept {} expired cache entries", removed);
            }
        } catch (RuntimeException e) {
            logger.error("Cache sweep failed", e);
        }
    }

    /**
     * Stops the background sweep. Entries stay readable.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            sweeper.shutdownNow();
            logger.debug("Cache closed: {}", stats());
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
