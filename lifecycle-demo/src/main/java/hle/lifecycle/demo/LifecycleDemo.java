package hle.lifecycle.demo;

import hle.lifecycle.cache.CacheConfig;
import hle.lifecycle.cache.EvictionPolicy;
import hle.lifecycle.demo.client.ProviderConnectionManager;
import hle.lifecycle.demo.client.SimulatedProviderConnection;
import hle.lifecycle.demo.service.CachingProviderService;
import hle.lifecycle.demo.service.CompletionResult;
import hle.lifecycle.pool.PoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Runs a batch of prompts through a pooled, cached provider service and logs
 * what the pool, cache and registry did.
 *
 * <p>The batch repeats a small set of distinct prompts so that most of them
 * are answered from the cache.
 */
public class LifecycleDemo {

    private static final Logger logger = LoggerFactory.getLogger(LifecycleDemo.class);

    private static final int TOTAL_PROMPTS = 500;
    private static final int DISTINCT_PROMPTS = 120;
    private static final int POOL_SIZE = 8;
    private static final int CONCURRENCY = 16;

    public static void main(String[] args) {
        logger.info("Resource lifecycle demo: {} prompts ({} distinct), pool size {}, concurrency {}",
                TOTAL_PROMPTS, DISTINCT_PROMPTS, POOL_SIZE, CONCURRENCY);

        SimulatedProviderConnection.resetGlobalCounter();
        ProviderConnectionManager manager = new ProviderConnectionManager(
                SimulatedProviderConnection.builder()
                        .endpoint("https://llm.demo/v1/completions")
                        .latency(20, 80)
                        .failureRate(0.03)
                        .maxRequests(40),
                Duration.ofSeconds(2));

        List<String> prompts = IntStream.range(0, TOTAL_PROMPTS)
                .mapToObj(i -> "prompt-" + (i % DISTINCT_PROMPTS))
                .collect(Collectors.toList());

        long start = System.nanoTime();
        try (CachingProviderService service = new CachingProviderService(
                manager,
                PoolConfig.builder()
                        .minSize(2)
                        .maxSize(POOL_SIZE)
                        .acquireTimeout(Duration.ofSeconds(5))
                        .healthCheckInterval(Duration.ofSeconds(1))
                        .threadNamePrefix("llm-pool")
                        .build(),
                CacheConfig.<String, String>builder()
                        .maxEntries(100)
                        .evictionPolicy(EvictionPolicy.LRU)
                        .defaultTtl(Duration.ofMinutes(5))
                        .build(),
                CONCURRENCY,
                3)) {

            List<CompletionResult> results = service.completeAll(prompts);
            long elapsedMs = Duration.ofNanos(System.nanoTime() - start).toMillis();

            long failures = results.stream().filter(r -> !r.isSuccess()).count();
            LongSummaryStatistics durations = results.stream()
                    .filter(CompletionResult::isSuccess)
                    .mapToLong(r -> r.getDuration().toMillis())
                    .summaryStatistics();

            logger.info("Completed {} prompts in {}ms ({} failed)", results.size(), elapsedMs, failures);
            logger.info("Per-prompt latency: min={}ms avg={}ms max={}ms",
                    durations.getMin(), Math.round(durations.getAverage()), durations.getMax());
            logger.info("Provider calls: {} (connections opened: {}, closed: {})",
                    service.getProviderCallCount(), manager.getOpenedCount(), manager.getClosedCount());
            logger.info("Stats: {}", service.getStats());
        }

        logger.info("Demo complete");
    }
}
