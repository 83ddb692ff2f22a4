package hle.lifecycle.cache;

/**
 * Rule a {@link ShardedCache} uses to pick the entry to remove when a shard is full.
 *
 * <p>Ties are always broken by insertion order, oldest first.
 */
public enum EvictionPolicy {
    /** Least recently used: the entry whose last access is oldest */
    LRU,
    /** Least frequently used: the entry with the lowest access count */
    LFU,
    /**
     * Expiry-driven: expired entries are reclaimed by the background sweep and
     * capacity eviction removes the oldest-inserted entry.
     */
    TTL,
    /** Victims are ranked by a caller-supplied {@link CustomEvictionPolicy} */
    CUSTOM
}
