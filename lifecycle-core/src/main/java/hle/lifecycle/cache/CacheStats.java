package hle.lifecycle.cache;

/**
 * Point-in-time counters of a {@link ShardedCache}, summed over its shards.
 */
public final class CacheStats {

    private final long hits;
    private final long misses;
    private final long evictions;
    private final long expirations;
    private final int size;

    CacheStats(long hits, long misses, long evictions, long expirations, int size) {
        this.hits = hits;
        this.misses = misses;
        this.evictions = evictions;
        this.expirations = expirations;
        this.size = size;
    }

    public long getHits() {
        return hits;
    }

    /**
     * Lookups that found nothing, including lookups that found an expired entry.
     */
    public long getMisses() {
        return misses;
    }

    /**
     * Entries removed to make room for new ones.
     */
    public long getEvictions() {
        return evictions;
    }

    /**
     * Entries removed because their TTL passed, on lookup or by the sweep.
     */
    public long getExpirations() {
        return expirations;
    }

    public int getSize() {
        return size;
    }

    public long getRequestCount() {
        return hits + misses;
    }

    /**
     * Fraction of lookups that were hits, or 0.0 before the first lookup.
     */
    public double getHitRatio() {
        long requests = getRequestCount();
        return requests == 0 ? 0.0 : (double) hits / requests;
    }

    @Override
    public String toString() {
        return String.format("CacheStats[size=%d, hits=%d, misses=%d, hitRatio=%.2f, evictions=%d, expirations=%d]",
                size, hits, misses, getHitRatio(), evictions, expirations);
    }
}
