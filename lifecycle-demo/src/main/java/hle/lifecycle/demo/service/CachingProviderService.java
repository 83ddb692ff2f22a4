package hle.lifecycle.demo.service;

import hle.lifecycle.cache.CacheConfig;
import hle.lifecycle.cache.ShardedCache;
import hle.lifecycle.demo.client.ProviderException;
import hle.lifecycle.demo.client.SimulatedProviderConnection;
import hle.lifecycle.error.RecoverableException;
import hle.lifecycle.error.RecoveryStrategy;
import hle.lifecycle.monitor.Monitors;
import hle.lifecycle.pool.ConnectionManager;
import hle.lifecycle.pool.ConnectionPool;
import hle.lifecycle.pool.PoolConfig;
import hle.lifecycle.pool.PooledConnection;
import hle.lifecycle.resource.CleanupException;
import hle.lifecycle.resource.CleanupPriority;
import hle.lifecycle.resource.RegistryConfig;
import hle.lifecycle.resource.ResourceGuard;
import hle.lifecycle.resource.ResourceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Answers prompts through a pool of provider connections, remembering
 * completions in a cache.
 *
 * <p>The service owns every resource it uses: the connection pool, the cache,
 * a {@link ResourceRegistry} and the executor that fans out batches. The
 * executor is held by a {@link ResourceGuard}, so it is shut down even if the
 * service is dropped without {@link #close()}.
 *
 * <p><strong>Sizing:</strong> the batch concurrency should be at least the
 * pool's {@code maxSize} to keep every connection busy; extra threads simply
 * wait in the pool's fair queue.
 *
 * <pre>{@code
 * try (CachingProviderService service = new CachingProviderService(
 *         new ProviderConnectionManager(SimulatedProviderConnection.builder()),
 *         PoolConfig.builder().maxSize(10).build(),
 *         CacheConfig.<String, String>builder().maxEntries(1_000).build(),
 *         10, 3)) {
 *     List<CompletionResult> results = service.completeAll(prompts);
 * }
 * }</pre>
 */
public class CachingProviderService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CachingProviderService.class);

    private final ResourceRegistry registry;
    private final ConnectionPool<SimulatedProviderConnection> pool;
    private final ShardedCache<String, String> cache;
    private final ResourceGuard<ExecutorService> executor;
    private final int maxAttempts;
    private final AtomicInteger providerCalls = new AtomicInteger(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * @param manager     opens connections to the provider
     * @param poolConfig  connection pool settings
     * @param cacheConfig completion cache settings
     * @param concurrency number of threads used by {@link #completeAll(List)}
     * @param maxAttempts attempts per prompt, counting the first one
     */
    public CachingProviderService(ConnectionManager<SimulatedProviderConnection> manager,
                                  PoolConfig poolConfig,
                                  CacheConfig<String, String> cacheConfig,
                                  int concurrency,
                                  int maxAttempts) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.registry = new ResourceRegistry(RegistryConfig.builder()
                .workerThreadName("provider-cleanup")
                .monitor(Monitors.logging())
                .build());
        this.pool = new ConnectionPool<>(manager, poolConfig);
        this.cache = new ShardedCache<>(cacheConfig);
        this.executor = ResourceGuard.builder(registry, newBatchExecutor(concurrency), CachingProviderService::stopExecutor)
                .typeName("completion-executor")
                .dropPriority(CleanupPriority.HIGH)
                .build();
    }

    /**
     * Creates a service with a pool of {@code concurrency} connections, a
     * 1,000-entry LRU cache and up to three attempts per prompt.
     */
    public CachingProviderService(ConnectionManager<SimulatedProviderConnection> manager, int concurrency) {
        this(manager,
             PoolConfig.builder().maxSize(concurrency).build(),
             CacheConfig.<String, String>builder().maxEntries(1_000).build(),
             concurrency,
             3);
    }

    private static ExecutorService newBatchExecutor(int concurrency) {
        ThreadFactory threadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName("completion-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };
        // A full queue runs the task on the submitting thread, which throttles the producer
        return new ThreadPoolExecutor(concurrency, concurrency, 60L, TimeUnit.SECONDS,
                new ArrayBlockingQueue<>(concurrency * 16), threadFactory, new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static void stopExecutor(ExecutorService executor) throws InterruptedException {
        executor.shutdown();
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
            logger.warn("Completion executor did not terminate in time, interrupting workers");
            executor.shutdownNow();
        }
    }

    /**
     * Returns the completion for {@code prompt}, from the cache when possible.
     *
     * @throws ProviderException if the provider keeps failing
     * @throws hle.lifecycle.pool.PoolException if no connection can be obtained
     */
    public String complete(String prompt) {
        Objects.requireNonNull(prompt, "prompt cannot be null");
        if (closed.get()) {
            throw new IllegalStateException("Service is closed");
        }

        Optional<String> cached = cache.get(prompt);
        if (cached.isPresent()) {
            return cached.get();
        }

        RuntimeException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String completion = send(prompt);
                cache.insert(prompt, completion);
                return completion;
            } catch (RuntimeException e) {
                lastFailure = e;
                if (!isRetryable(e)) {
                    break;
                }
                logger.debug("Attempt {}/{} for prompt failed: {}", attempt, maxAttempts, e.getMessage());
            }
        }
        throw lastFailure;
    }

    private String send(String prompt) {
        try (PooledConnection<SimulatedProviderConnection> connection = pool.acquire()) {
            providerCalls.incrementAndGet();
            try {
                return connection.get().send(prompt);
            } catch (ProviderException e) {
                // the connection may be broken; never hand it to another caller
                connection.invalidate();
                throw e;
            }
        }
    }

    private static boolean isRetryable(RuntimeException e) {
        if (e instanceof ProviderException) {
            return ((ProviderException) e).isRetryable();
        }
        if (e instanceof RecoverableException) {
            return ((RecoverableException) e).recoveryStrategy() == RecoveryStrategy.RETRY;
        }
        return false;
    }

    /**
     * Completes every prompt on the service's executor and waits for all of them.
     * Results are returned in the order of {@code prompts}; failures are
     * reported per prompt rather than thrown.
     */
    public List<CompletionResult> completeAll(List<String> prompts) {
        ExecutorService workers = executor.get();
        List<CompletableFuture<CompletionResult>> futures = new ArrayList<>(prompts.size());
        for (String prompt : prompts) {
            futures.add(CompletableFuture.supplyAsync(() -> completeTimed(prompt), workers));
        }

        List<CompletionResult> results = new ArrayList<>(futures.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                results.add(futures.get(i).join());
            } catch (CompletionException e) {
                RuntimeException cause = e.getCause() instanceof RuntimeException
                        ? (RuntimeException) e.getCause()
                        : e;
                results.add(CompletionResult.failure(prompts.get(i), cause, Duration.ZERO));
            }
        }
        return results;
    }

    private CompletionResult completeTimed(String prompt) {
        long start = System.nanoTime();
        try {
            String completion = complete(prompt);
            return CompletionResult.success(prompt, completion, Duration.ofNanos(System.nanoTime() - start));
        } catch (RuntimeException e) {
            logger.warn("Prompt failed after {} attempts: {}", maxAttempts, e.getMessage());
            return CompletionResult.failure(prompt, e, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    /**
     * Number of calls that reached the provider, retries included.
     */
    public int getProviderCallCount() {
        return providerCalls.get();
    }

    public ConnectionPool<SimulatedProviderConnection> getPool() {
        return pool;
    }

    public ShardedCache<String, String> getCache() {
        return cache;
    }

    public ResourceRegistry getRegistry() {
        return registry;
    }

    /**
     * Gets combined statistics from the pool, cache and registry.
     */
    public String getStats() {
        return String.format("%s, %s, %s", pool.stats(), cache.stats(), registry);
    }

    /**
     * Stops the executor, drains the pool and shuts down the cache and registry.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.cleanup();
        } catch (CleanupException e) {
            logger.warn("Failed to stop completion executor: {}", e.getMessage());
        }
        if (!pool.shutdown(Duration.ofSeconds(5))) {
            logger.warn("Connection pool did not drain within 5s");
        }
        cache.close();
        registry.close();
        logger.info("Service closed: {} provider calls", providerCalls.get());
    }
}
