package hle.lifecycle.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CacheConfigTest {

    @Test
    void shouldUseDefaults() {
        CacheConfig<String, String> config = CacheConfig.defaultConfig();

        assertEquals(10_000, config.getMaxEntries());
        assertEquals(EvictionPolicy.LRU, config.getEvictionPolicy());
        assertEquals(Duration.ofSeconds(60), config.getCleanupInterval());
        assertTrue(config.getDefaultTtl().isEmpty());
        assertTrue(config.getMaxSizeBytes().isEmpty());
        assertEquals(Math.min(Runtime.getRuntime().availableProcessors(), 625), config.getShardCount());
    }

    @Test
    void shouldSplitLimitsAcrossShardsRoundingUp() {
        CacheConfig<String, String> config = CacheConfig.<String, String>builder()
                .maxEntries(10)
                .shardCount(3)
                .maxSizeBytes(100)
                .build();

        assertEquals(4, config.getShardCapacity());
        assertEquals(34, config.getShardMaxSizeBytes().getAsLong());
    }

    @Test
    void shouldRequireCustomPolicyForCustomEviction() {
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.<String, String>builder()
                .evictionPolicy(EvictionPolicy.CUSTOM)
                .build());
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().maxEntries(0));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().cleanupInterval(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder().defaultTtl(Duration.ofSeconds(-1)));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.builder()
                .maxEntries(2)
                .shardCount(4)
                .build());
    }
}
