package hle.lifecycle.cache;

import hle.lifecycle.monitor.Monitor;
import hle.lifecycle.monitor.Monitors;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Configuration for {@link ShardedCache}.
 * Uses the builder pattern for flexible configuration.
 *
 * <p>Limits are totals for the whole cache and are split evenly across the
 * shards, rounding up.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class CacheConfig<K, V> {

    private final int maxEntries;
    private final int shardCount;
    private final Long maxSizeBytes;
    private final Duration defaultTtl;
    private final EvictionPolicy evictionPolicy;
    private final CustomEvictionPolicy<K, V> customPolicy;
    private final Duration cleanupInterval;
    private final String threadName;
    private final Monitor monitor;

    private CacheConfig(Builder<K, V> builder) {
        this.maxEntries = builder.maxEntries;
        this.shardCount = builder.shardCount != null
                ? builder.shardCount
                : defaultShardCount(builder.maxEntries);
        this.maxSizeBytes = builder.maxSizeBytes;
        this.defaultTtl = builder.defaultTtl;
        this.evictionPolicy = builder.evictionPolicy;
        this.customPolicy = builder.customPolicy;
        this.cleanupInterval = builder.cleanupInterval;
        this.threadName = builder.threadName;
        this.monitor = builder.monitor;
    }

    static int defaultShardCount(int maxEntries) {
        return Math.min(Runtime.getRuntime().availableProcessors(), Math.max(1, maxEntries / 16));
    }

    public static <K, V> Builder<K, V> builder() {
        return new Builder<>();
    }

    /**
     * Creates a default configuration: 10,000 LRU entries, no TTL, swept every minute.
     */
    public static <K, V> CacheConfig<K, V> defaultConfig() {
        return CacheConfig.<K, V>builder().build();
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public int getShardCount() {
        return shardCount;
    }

    /**
     * Entry capacity of each shard.
     */
    public int getShardCapacity() {
        return (maxEntries + shardCount - 1) / shardCount;
    }

    public OptionalLong getMaxSizeBytes() {
        return maxSizeBytes != null ? OptionalLong.of(maxSizeBytes) : OptionalLong.empty();
    }

    /**
     * Byte budget of each shard, if a total budget is configured.
     */
    public OptionalLong getShardMaxSizeBytes() {
        if (maxSizeBytes == null) {
            return OptionalLong.empty();
        }
        return OptionalLong.of((maxSizeBytes + shardCount - 1) / shardCount);
    }

    public Optional<Duration> getDefaultTtl() {
        return Optional.ofNullable(defaultTtl);
    }

    public EvictionPolicy getEvictionPolicy() {
        return evictionPolicy;
    }

    public Optional<CustomEvictionPolicy<K, V>> getCustomPolicy() {
        return Optional.ofNullable(customPolicy);
    }

    public Duration getCleanupInterval() {
        return cleanupInterval;
    }

    public String getThreadName() {
        return threadName;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public static class Builder<K, V> {
        private int maxEntries = 10_000;
        private Integer shardCount;
        private Long maxSizeBytes;
        private Duration defaultTtl;
        private EvictionPolicy evictionPolicy = EvictionPolicy.LRU;
        private CustomEvictionPolicy<K, V> customPolicy;
        private Duration cleanupInterval = Duration.ofSeconds(60);
        private String threadName = "cache-sweeper";
        private Monitor monitor = Monitors.noop();

        private Builder() {}

        /**
         * Total number of entries the cache may hold.
         * Default: 10,000
         */
        public Builder<K, V> maxEntries(int maxEntries) {
            if (maxEntries < 1) {
                throw new IllegalArgumentException("maxEntries must be >= 1");
            }
            this.maxEntries = maxEntries;
            return this;
        }

        /**
         * Number of independently locked shards.
         * Default: min(available processors, max(1, maxEntries / 16))
         */
        public Builder<K, V> shardCount(int shardCount) {
            if (shardCount < 1) {
                throw new IllegalArgumentException("shardCount must be >= 1");
            }
            this.shardCount = shardCount;
            return this;
        }

        /**
         * Total byte budget, counted from the sizes passed to
         * {@link ShardedCache#insert(Object, Object, Duration, long)}.
         * Default: unbounded
         */
        public Builder<K, V> maxSizeBytes(long maxSizeBytes) {
            if (maxSizeBytes < 1) {
                throw new IllegalArgumentException("maxSizeBytes must be >= 1");
            }
            this.maxSizeBytes = maxSizeBytes;
            return this;
        }

        /**
         * TTL applied to entries inserted without one.
         * Default: none (entries live until evicted or removed)
         */
        public Builder<K, V> defaultTtl(Duration defaultTtl) {
            Objects.requireNonNull(defaultTtl, "defaultTtl cannot be null");
            if (defaultTtl.isNegative() || defaultTtl.isZero()) {
                throw new IllegalArgumentException("defaultTtl must be positive");
            }
            this.defaultTtl = defaultTtl;
            return this;
        }

        /**
         * Default: LRU
         */
        public Builder<K, V> evictionPolicy(EvictionPolicy evictionPolicy) {
            this.evictionPolicy = Objects.requireNonNull(evictionPolicy, "evictionPolicy cannot be null");
            return this;
        }

        /**
         * Sets the ranking used by {@link EvictionPolicy#CUSTOM} and selects that policy.
         */
        public Builder<K, V> customPolicy(CustomEvictionPolicy<K, V> customPolicy) {
            this.customPolicy = Objects.requireNonNull(customPolicy, "customPolicy cannot be null");
            this.evictionPolicy = EvictionPolicy.CUSTOM;
            return this;
        }

        /**
         * How often the background sweep removes expired entries.
         * Default: 60 seconds
         */
        public Builder<K, V> cleanupInterval(Duration cleanupInterval) {
            Objects.requireNonNull(cleanupInterval, "cleanupInterval cannot be null");
            if (cleanupInterval.isNegative() || cleanupInterval.isZero()) {
                throw new IllegalArgumentException("cleanupInterval must be positive");
            }
            this.cleanupInterval = cleanupInterval;
            return this;
        }

        /**
         * Name of the background sweep thread.
         * Default: "cache-sweeper"
         */
        public Builder<K, V> threadName(String threadName) {
            this.threadName = Objects.requireNonNull(threadName, "threadName cannot be null");
            return this;
        }

        public Builder<K, V> monitor(Monitor monitor) {
            this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
            return this;
        }

        public CacheConfig<K, V> build() {
            if (evictionPolicy == EvictionPolicy.CUSTOM && customPolicy == null) {
                throw new IllegalArgumentException("CUSTOM eviction requires a customPolicy");
            }
            if (evictionPolicy != EvictionPolicy.CUSTOM && customPolicy != null) {
                throw new IllegalArgumentException("customPolicy is only used with CUSTOM eviction");
            }
            if (shardCount != null && shardCount > maxEntries) {
                throw new IllegalArgumentException("shardCount cannot be greater than maxEntries");
            }
            return new CacheConfig<>(this);
        }
    }
}
