package hle.lifecycle.cache;

import hle.lifecycle.monitor.Monitor;
import hle.lifecycle.monitor.MonitorEvent;
import hle.lifecycle.monitor.MonitorEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ShardedCache.
 */
class ShardedCacheTest {

    private ShardedCache<String, String> cache;

    @AfterEach
    void tearDown() {
        if (cache != null) {
            cache.close();
        }
    }

    private static CacheConfig.Builder<String, String> config(int maxEntries) {
        return CacheConfig.<String, String>builder()
                .maxEntries(maxEntries)
                .shardCount(1);
    }

    @Test
    void shouldEvictLeastRecentlyUsed() {
        cache = new ShardedCache<>(config(2).evictionPolicy(EvictionPolicy.LRU).build());

        cache.insert("a", "1");
        cache.insert("b", "2");
        assertEquals(Optional.of("1"), cache.get("a"));
        cache.insert("c", "3");

        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("a"));
        assertTrue(cache.containsKey("c"));
        assertEquals(2, cache.size());
        assertEquals(1, cache.stats().getEvictions());
    }

    @Test
    @Timeout(10)
    void shouldKeepRecencyOrderAfterConcurrentReads() throws Exception {
        int entries = 100;
        cache = new ShardedCache<>(config(entries).evictionPolicy(EvictionPolicy.LRU).build());
        for (int i = 0; i < entries; i++) {
            cache.insert("k" + i, "v" + i);
        }

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int offset = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 5_000; i++) {
                    assertTrue(cache.get("k" + ((i + offset) % entries)).isPresent());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        for (int i = 0; i < entries; i++) {
            cache.get("k" + i);
        }
        for (int i = 0; i < entries / 2; i++) {
            cache.insert("new" + i, "n" + i);
            assertFalse(cache.containsKey("k" + i), "k" + i + " should be the next victim");
        }

        for (int i = entries / 2; i < entries; i++) {
            assertTrue(cache.containsKey("k" + i));
        }
        assertEquals(entries, cache.size());
    }

    @Test
    void shouldDefaultToSingleShardForTinyCache() {
        cache = new ShardedCache<>(CacheConfig.<String, String>builder().maxEntries(2).build());

        cache.insert("a", "1");
        cache.insert("b", "2");
        cache.get("a");
        cache.insert("c", "3");

        assertEquals(1, cache.shardCount());
        assertEquals(Optional.empty(), cache.get("b"));
        assertEquals(Optional.of("1"), cache.get("a"));
        assertEquals(Optional.of("3"), cache.get("c"));
    }

    @Test
    void shouldEvictLeastFrequentlyUsed() {
        cache = new ShardedCache<>(config(3).evictionPolicy(EvictionPolicy.LFU).build());

        cache.insert("a", "1");
        cache.insert("b", "2");
        cache.insert("c", "3");
        cache.get("a");
        cache.get("a");
        cache.get("c");
        cache.get("b");
        cache.get("b");

        cache.insert("d", "4");

        assertFalse(cache.containsKey("c"));
        assertTrue(cache.containsKey("a"));
        assertTrue(cache.containsKey("b"));
        assertTrue(cache.containsKey("d"));
    }

    @Test
    void shouldBreakLfuTiesByInsertionOrder() {
        cache = new ShardedCache<>(config(2).evictionPolicy(EvictionPolicy.LFU).build());

        cache.insert("a", "1");
        cache.insert("b", "2");
        cache.insert("c", "3");

        assertFalse(cache.containsKey("a"));
        assertTrue(cache.containsKey("b"));
    }

    @Test
    void shouldEvictOldestInsertedUnderTtlPolicy() {
        cache = new ShardedCache<>(config(2).evictionPolicy(EvictionPolicy.TTL).build());

        cache.insert("a", "1");
        cache.insert("b", "2");
        cache.get("a");
        cache.insert("c", "3");

        assertFalse(cache.containsKey("a"));
        assertTrue(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
    }

    @Test
    void shouldEvictByCustomPriority() {
        CustomEvictionPolicy<String, String> longestValueFirst = entry -> -entry.getValue().length();
        cache = new ShardedCache<>(config(2).customPolicy(longestValueFirst).build());

        cache.insert("short", "x");
        cache.insert("long", "xxxxxxxx");
        cache.insert("medium", "xxxx");

        assertFalse(cache.containsKey("long"));
        assertTrue(cache.containsKey("short"));
        assertTrue(cache.containsKey("medium"));
    }

    @Test
    void shouldCallCustomPolicyHooks() {
        ConcurrentMap<String, Integer> accesses = new ConcurrentHashMap<>();
        List<String> inserted = new CopyOnWriteArrayList<>();
        CustomEvictionPolicy<String, String> policy = new CustomEvictionPolicy<>() {
            @Override
            public long evictionPriority(CacheEntry<String, String> entry) {
                return accesses.getOrDefault(entry.getKey(), 0);
            }

            @Override
            public void onAccess(CacheEntry<String, String> entry) {
                accesses.merge(entry.getKey(), 1, Integer::sum);
            }

            @Override
            public void onInsert(CacheEntry<String, String> entry) {
                inserted.add(entry.getKey());
            }
        };
        cache = new ShardedCache<>(config(2).customPolicy(policy).build());

        cache.insert("a", "1");
        cache.insert("b", "2");
        cache.get("a");
        cache.insert("c", "3");

        assertEquals(List.of("a", "b", "c"), inserted);
        assertEquals(1, accesses.get("a"));
        assertFalse(cache.containsKey("b"));
    }

    @Test
    void shouldNotEvictWhenReplacingExistingKey() {
        cache = new ShardedCache<>(config(2).build());

        cache.insert("a", "1");
        cache.insert("b", "2");
        Optional<String> previous = cache.insert("a", "updated");

        assertEquals(Optional.of("1"), previous);
        assertEquals(Optional.of("updated"), cache.get("a"));
        assertTrue(cache.containsKey("b"));
        assertEquals(0, cache.stats().getEvictions());
    }

    @Test
    void shouldNotReturnExpiredEntry() throws Exception {
        cache = new ShardedCache<>(config(10).build());

        cache.insert("k", "v", Duration.ofMillis(10));
        assertEquals(Optional.of("v"), cache.get("k"));

        Thread.sleep(20);

        assertEquals(Optional.empty(), cache.get("k"));
        assertFalse(cache.shardFor("k").containsEntry("k"));
        assertEquals(1, cache.stats().getExpirations());
    }

    @Test
    @Timeout(5)
    void shouldPhysicallyRemoveExpiredEntriesInBackground() throws Exception {
        cache = new ShardedCache<>(config(10).cleanupInterval(Duration.ofMillis(200)).build());

        cache.insert("never-read", "v", Duration.ofMillis(10));
        cache.insert("read", "v", Duration.ofMillis(10));
        Thread.sleep(20);

        assertEquals(Optional.empty(), cache.get("read"));
        assertTrue(cache.shardFor("never-read").containsEntry("never-read"));

        while (cache.shardFor("never-read").containsEntry("never-read")) {
            Thread.sleep(10);
        }
        assertEquals(0, cache.size());
    }

    @Test
    void shouldApplyDefaultTtl() throws Exception {
        cache = new ShardedCache<>(config(10).defaultTtl(Duration.ofMillis(10)).build());

        cache.insert("a", "1");
        cache.insert("b", "2", null);
        Thread.sleep(20);

        assertEquals(1, cache.sweepExpired());
        assertFalse(cache.containsKey("a"));
        assertEquals(Optional.of("2"), cache.get("b"));
    }

    @Test
    void shouldNeverExceedCapacityUnderConcurrentInserts() throws Exception {
        cache = new ShardedCache<>(CacheConfig.<String, String>builder()
                .maxEntries(64)
                .shardCount(4)
                .build());

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean overflow = new AtomicBoolean(false);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 1_000; i++) {
                    String key = thread + "-" + i;
                    cache.insert(key, key);
                    if (cache.shardFor(key).size() > cache.shardFor(key).capacity()) {
                        overflow.set(true);
                    }
                    cache.get(thread + "-" + (i / 2));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertFalse(overflow.get());
        assertTrue(cache.size() <= 64);
    }

    @Test
    void shouldEvictUntilEntryFitsByteBudget() {
        cache = new ShardedCache<>(config(10).maxSizeBytes(100).build());

        cache.insert("a", "1", null, 40);
        cache.insert("b", "2", null, 40);
        cache.insert("c", "3", null, 70);

        assertFalse(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
        assertEquals(70, cache.weightedSize());
        assertEquals(2, cache.stats().getEvictions());
    }

    @Test
    void shouldRejectEntryLargerThanByteBudget() {
        cache = new ShardedCache<>(config(10).maxSizeBytes(100).build());

        assertThrows(IllegalArgumentException.class, () -> cache.insert("big", "v", null, 101));
        assertEquals(0, cache.size());
    }

    @Test
    void shouldRemoveAndClear() {
        cache = new ShardedCache<>(config(10).build());

        cache.insert("a", "1");
        cache.insert("b", "2");

        assertEquals(Optional.of("1"), cache.remove("a"));
        assertEquals(Optional.empty(), cache.remove("a"));

        cache.clear();
        assertEquals(0, cache.size());
        assertEquals(Optional.empty(), cache.get("b"));
    }

    @Test
    void shouldTrackHitsAndMisses() {
        cache = new ShardedCache<>(config(10).build());

        cache.insert("a", "1");
        cache.get("a");
        cache.get("a");
        cache.get("a");
        cache.get("missing");

        CacheStats stats = cache.stats();
        assertEquals(3, stats.getHits());
        assertEquals(1, stats.getMisses());
        assertEquals(0.75, stats.getHitRatio(), 0.0001);
    }

    @Test
    void shouldRouteKeysDeterministically() {
        cache = new ShardedCache<>(CacheConfig.<String, String>builder()
                .maxEntries(1_000)
                .shardCount(8)
                .build());

        for (int i = 0; i < 100; i++) {
            String key = "key-" + i;
            assertSame(cache.shardFor(key), cache.shardFor(new String(key)));
        }
    }

    @Test
    void shouldReportEvictionsAndExpirationsToMonitor() throws Exception {
        List<MonitorEvent> events = new CopyOnWriteArrayList<>();
        Monitor monitor = new Monitor() {
            @Override
            public String name() {
                return "collecting";
            }

            @Override
            public void recordEvent(MonitorEvent event) {
                events.add(event);
            }
        };
        cache = new ShardedCache<>(config(1).monitor(monitor).build());

        cache.insert("a", "1");
        cache.insert("b", "2", Duration.ofMillis(5));
        Thread.sleep(15);
        cache.sweepExpired();

        assertEquals(2, events.size());
        assertEquals(MonitorEventType.CACHE_EVICTION, events.get(0).getType());
        assertEquals(Optional.of("a"), events.get(0).getAttribute("key"));
        assertEquals(MonitorEventType.CACHE_EXPIRATION, events.get(1).getType());
    }

    @Test
    void shouldKeepServingAfterClose() {
        cache = new ShardedCache<>(config(10).build());
        cache.insert("a", "1");

        cache.close();

        assertTrue(cache.isClosed());
        assertEquals(Optional.of("1"), cache.get("a"));
    }
}
