package hle.lifecycle.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One cached value with its access metadata.
 *
 * <p>Recency and insertion order are measured in shard ticks, a per-shard
 * counter that increases on every insert and hit, so two entries never
 * compare equal. Wall-clock timestamps are kept for reporting only.
 *
 * @param <K> key type
 * @param <V> value type
 */
public final class CacheEntry<K, V> {

    private final K key;
    private final V value;
    private final Instant insertedAt;
    private final long insertionTick;
    private final long expiresAtNanos;
    private final Instant expiresAt;
    private final long sizeBytes;
    private final AtomicLong lastAccessTick;
    private final AtomicLong accessCount = new AtomicLong(0);
    private volatile Instant lastAccessed;

    CacheEntry(K key, V value, long insertionTick, long nowNanos, Duration ttl, long sizeBytes) {
        this.key = key;
        this.value = value;
        this.insertedAt = Instant.now();
        this.insertionTick = insertionTick;
        this.lastAccessTick = new AtomicLong(insertionTick);
        this.lastAccessed = insertedAt;
        this.sizeBytes = sizeBytes;
        if (ttl != null) {
            this.expiresAtNanos = nowNanos + ttl.toNanos();
            this.expiresAt = insertedAt.plus(ttl);
        } else {
            this.expiresAtNanos = 0L;
            this.expiresAt = null;
        }
    }

    public K getKey() {
        return key;
    }

    public V getValue() {
        return value;
    }

    public Instant getInsertedAt() {
        return insertedAt;
    }

    public Instant getLastAccessed() {
        return lastAccessed;
    }

    /**
     * Number of hits on this entry since it was inserted.
     */
    public long getAccessCount() {
        return accessCount.get();
    }

    /**
     * Shard tick at which the entry was inserted; smaller is older.
     */
    public long getInsertionTick() {
        return insertionTick;
    }

    /**
     * Shard tick of the most recent hit, or of the insertion if there was none.
     */
    public long getLastAccessTick() {
        return lastAccessTick.get();
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public OptionalLong getSizeBytes() {
        return sizeBytes >= 0 ? OptionalLong.of(sizeBytes) : OptionalLong.empty();
    }

    boolean isExpired(long nowNanos) {
        return expiresAt != null && nowNanos - expiresAtNanos >= 0;
    }

    long weight() {
        return Math.max(0L, sizeBytes);
    }

    /**
     * @return the last access tick before this one
     */
    long recordAccess(long tick) {
        long previous = lastAccessTick.getAndAccumulate(tick, Math::max);
        accessCount.incrementAndGet();
        lastAccessed = Instant.now();
        return previous;
    }

    @Override
    public String toString() {
        return "CacheEntry{key=" + key + ", accessCount=" + accessCount.get()
                + ", insertionTick=" + insertionTick + ", expiresAt=" + expiresAt + "}";
    }
}
