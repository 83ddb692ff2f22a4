package hle.lifecycle.cache;

import hle.lifecycle.monitor.Monitor;
import hle.lifecycle.monitor.MonitorEvent;
import hle.lifecycle.monitor.MonitorEventType;
import hle.lifecycle.monitor.Monitors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One partition of a {@link ShardedCache}: a map of entries behind a single
 * read-write lock.
 *
 * <p>Lookups share the read lock and update access metadata atomically. Every
 * structural change (insert, remove, eviction, expiry) takes the write lock.
 *
 * <p>LRU and TTL shards keep their entries in a tick-ordered index, so the next
 * victim is always the first index entry. LFU and custom rankings change on
 * every hit and are found by scanning the shard.
 */
final class CacheShard<K, V> {

    private static final Logger logger = LoggerFactory.getLogger(CacheShard.class);

    private final int index;
    private final int capacity;
    private final long maxSizeBytes;
    private final CustomEvictionPolicy<K, V> customPolicy;
    private final EvictionPolicy policy;
    private final Comparator<CacheEntry<K, V>> victimOrder;
    private final Monitor monitor;

    private final Map<K, CacheEntry<K, V>> entries = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicLong tick = new AtomicLong(0);
    // order tick -> entry, for LRU (last access) and TTL (insertion); null otherwise
    private final ConcurrentSkipListMap<Long, CacheEntry<K, V>> order;
    // guarded by the write lock
    private long weightedSize = 0;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();

    CacheShard(int index, CacheConfig<K, V> config) {
        this.index = index;
        this.capacity = config.getShardCapacity();
        this.maxSizeBytes = config.getShardMaxSizeBytes().orElse(Long.MAX_VALUE);
        this.customPolicy = config.getCustomPolicy().orElse(null);
        this.policy = config.getEvictionPolicy();
        this.victimOrder = victimOrder(policy, customPolicy);
        this.monitor = config.getMonitor();
        this.order = (policy == EvictionPolicy.LRU || policy == EvictionPolicy.TTL)
                ? new ConcurrentSkipListMap<>()
                : null;
    }

    /**
     * Orders entries so that the first one is the next victim. Every order ends
     * with the insertion tick, so ties go to the oldest entry.
     */
    static <K, V> Comparator<CacheEntry<K, V>> victimOrder(EvictionPolicy policy,
                                                            CustomEvictionPolicy<K, V> customPolicy) {
        Comparator<CacheEntry<K, V>> byInsertion = Comparator.comparingLong(CacheEntry::getInsertionTick);
        switch (policy) {
            case LRU:
                return Comparator.<CacheEntry<K, V>>comparingLong(CacheEntry::getLastAccessTick)
                        .thenComparing(byInsertion);
            case LFU:
                return Comparator.<CacheEntry<K, V>>comparingLong(CacheEntry::getAccessCount)
                        .thenComparing(byInsertion);
            case TTL:
                return byInsertion;
            case CUSTOM:
                return Comparator.<CacheEntry<K, V>>comparingLong(customPolicy::evictionPriority)
                        .thenComparing(byInsertion);
            default:
                throw new IllegalArgumentException("Unknown eviction policy: " + policy);
        }
    }

    Optional<V> get(K key) {
        CacheEntry<K, V> entry;
        lock.readLock().lock();
        try {
            entry = entries.get(key);
            if (entry == null) {
                misses.increment();
                return Optional.empty();
            }
            if (!entry.isExpired(System.nanoTime())) {
                long now = tick.incrementAndGet();
                long previous = entry.recordAccess(now);
                if (policy == EvictionPolicy.LRU) {
                    moveInOrder(entry, previous, now);
                }
                if (customPolicy != null) {
                    customPolicy.onAccess(entry);
                }
                hits.increment();
                return Optional.ofNullable(entry.getValue());
            }
        } finally {
            lock.readLock().unlock();
        }

        // Expired: upgrade to the write lock and remove it unless it was replaced meanwhile
        misses.increment();
        removeExpired(key);
        return Optional.empty();
    }

    /**
     * Re-keys an LRU entry under its new access tick. Readers race here under
     * the shared lock; whoever did not set the entry's latest tick drops its
     * own node again, so exactly one node per entry survives.
     */
    private void moveInOrder(CacheEntry<K, V> entry, long previous, long now) {
        if (previous > now) {
            return;
        }
        order.put(now, entry);
        order.remove(previous, entry);
        if (entry.getLastAccessTick() != now) {
            order.remove(now, entry);
        }
    }

    private long orderTick(CacheEntry<K, V> entry) {
        return policy == EvictionPolicy.LRU ? entry.getLastAccessTick() : entry.getInsertionTick();
    }

    // caller holds the write lock
    private void unlink(CacheEntry<K, V> entry) {
        weightedSize -= entry.weight();
        if (order != null) {
            order.remove(orderTick(entry), entry);
        }
    }

    boolean containsKey(K key) {
        lock.readLock().lock();
        try {
            CacheEntry<K, V> entry = entries.get(key);
            return entry != null && !entry.isExpired(System.nanoTime());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores an entry. A new key in a full shard evicts exactly one victim first;
     * replacing a key never evicts for count. With a byte budget, further victims
     * are evicted until the new entry fits.
     *
     * @return the previous live value for the key, if any
     * @throws IllegalArgumentException if the entry alone exceeds the shard's byte budget
     */
    Optional<V> insert(K key, V value, Duration ttl, long sizeBytes) {
        if (sizeBytes > maxSizeBytes) {
            throw new IllegalArgumentException("Entry of " + sizeBytes
                    + " bytes exceeds the shard budget of " + maxSizeBytes + " bytes");
        }
        List<CacheEntry<K, V>> evicted = new ArrayList<>();
        V previous = null;

        lock.writeLock().lock();
        try {
            long now = System.nanoTime();
            CacheEntry<K, V> entry = new CacheEntry<>(key, value, tick.incrementAndGet(), now, ttl, sizeBytes);

            CacheEntry<K, V> existing = entries.remove(key);
            if (existing != null) {
                unlink(existing);
                if (!existing.isExpired(now)) {
                    previous = existing.getValue();
                }
            } else if (entries.size() >= capacity) {
                evicted.add(evictOne());
            }
            while (!entries.isEmpty() && weightedSize + entry.weight() > maxSizeBytes) {
                evicted.add(evictOne());
            }

            entries.put(key, entry);
            weightedSize += entry.weight();
            if (order != null) {
                order.put(entry.getInsertionTick(), entry);
            }
            if (customPolicy != null) {
                customPolicy.onInsert(entry);
            }
        } finally {
            lock.writeLock().unlock();
        }

        for (CacheEntry<K, V> victim : evicted) {
            logger.trace("Shard {} evicted {}", index, victim.getKey());
            emit(MonitorEventType.CACHE_EVICTION, victim);
        }
        return Optional.ofNullable(previous);
    }

    // caller holds the write lock
    private CacheEntry<K, V> evictOne() {
        CacheEntry<K, V> victim = null;
        if (order != null) {
            victim = order.firstEntry().getValue();
        } else {
            for (CacheEntry<K, V> candidate : entries.values()) {
                if (victim == null || victimOrder.compare(candidate, victim) < 0) {
                    victim = candidate;
                }
            }
        }
        entries.remove(victim.getKey());
        unlink(victim);
        evictions.increment();
        return victim;
    }

    Optional<V> remove(K key) {
        lock.writeLock().lock();
        try {
            CacheEntry<K, V> removed = entries.remove(key);
            if (removed == null) {
                return Optional.empty();
            }
            unlink(removed);
            if (removed.isExpired(System.nanoTime())) {
                expirations.increment();
                return Optional.empty();
            }
            return Optional.ofNullable(removed.getValue());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void removeExpired(K key) {
        CacheEntry<K, V> removed = null;
        lock.writeLock().lock();
        try {
            CacheEntry<K, V> entry = entries.get(key);
            if (entry != null && entry.isExpired(System.nanoTime())) {
                entries.remove(key);
                unlink(entry);
                expirations.increment();
                removed = entry;
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            emit(MonitorEventType.CACHE_EXPIRATION, removed);
        }
    }

    /**
     * Removes every expired entry.
     *
     * @return number of entries removed
     */
    int sweepExpired() {
        List<CacheEntry<K, V>> removed = new ArrayList<>();
        lock.writeLock().lock();
        try {
            long now = System.nanoTime();
            Iterator<CacheEntry<K, V>> it = entries.values().iterator();
            while (it.hasNext()) {
                CacheEntry<K, V> entry = it.next();
                if (entry.isExpired(now)) {
                    it.remove();
                    unlink(entry);
                    removed.add(entry);
                }
            }
            expirations.add(removed.size());
        } finally {
            lock.writeLock().unlock();
        }
        removed.forEach(entry -> emit(MonitorEventType.CACHE_EXPIRATION, entry));
        return removed.size();
    }

    void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
            weightedSize = 0;
            if (order != null) {
                order.clear();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Number of stored entries, expired ones included until they are removed.
     */
    int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    long weightedSize() {
        lock.readLock().lock();
        try {
            return weightedSize;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Whether the key is physically stored, whether or not it has expired.
     */
    boolean containsEntry(K key) {
        lock.readLock().lock();
        try {
            return entries.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    int capacity() {
        return capacity;
    }

    long hits() {
        return hits.sum();
    }

    long misses() {
        return misses.sum();
    }

    long evictions() {
        return evictions.sum();
    }

    long expirations() {
        return expirations.sum();
    }

    private void emit(MonitorEventType type, CacheEntry<K, V> entry) {
        Monitors.emit(monitor, MonitorEvent.builder(type)
                .attribute("key", entry.getKey())
                .attribute("shard", index)
                .attribute("accessCount", entry.getAccessCount())
                .build());
    }
}
