package hle.lifecycle.cache;

/**
 * Caller-supplied ranking for {@link EvictionPolicy#CUSTOM}.
 *
 * <p>{@link #onAccess(CacheEntry)} is called under the shard's read lock and may
 * run on several threads at once; implementations that keep their own state
 * must be thread-safe.
 *
 * @param <K> key type
 * @param <V> value type
 */
public interface CustomEvictionPolicy<K, V> {

    /**
     * Ranks an entry for eviction. The entry with the lowest value is evicted
     * first.
     */
    long evictionPriority(CacheEntry<K, V> entry);

    /**
     * Called after every cache hit on {@code entry}.
     */
    default void onAccess(CacheEntry<K, V> entry) {
    }

    /**
     * Called after {@code entry} has been stored.
     */
    default void onInsert(CacheEntry<K, V> entry) {
    }
}
