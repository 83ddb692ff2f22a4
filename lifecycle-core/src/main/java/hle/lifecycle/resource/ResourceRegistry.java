package hle.lifecycle.resource;

import hle.lifecycle.monitor.Monitor;
import hle.lifecycle.monitor.MonitorEvent;
import hle.lifecycle.monitor.MonitorEventType;
import hle.lifecycle.monitor.Monitors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Central registry that tracks live resources and runs their cleanup.
 *
 * <p>The registry owns a priority queue of {@link CleanupRequest}s drained by a
 * single background worker thread: {@link CleanupPriority#CRITICAL} requests
 * first, then HIGH, NORMAL and LOW, first-in first-out within a priority.
 * Each action runs under {@link RegistryConfig#getCleanupTimeout()}; a resource
 * is removed from the live map once its action has finished, whether it
 * succeeded, failed or timed out. Failures do not stop the worker.
 *
 * <p>One registry is meant to be created at component startup and handed to
 * everything that creates {@link ResourceGuard}s:
 * <pre>{@code
 * try (ResourceRegistry registry = new ResourceRegistry(RegistryConfig.defaultConfig())) {
 *     ResourceGuard<Socket> guard = ResourceGuard.of(registry, socket, Socket::close);
 *     ...
 * } // close() drains every pending and live cleanup
 * }</pre>
 */
public class ResourceRegistry implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ResourceRegistry.class);

    /**
     * Hook through which {@link #forceCleanupAll()} releases a resource that is
     * still owned by a live guard.
     */
    @FunctionalInterface
    public interface Reclaimer {

        /**
         * Takes ownership of the resource and returns its cleanup, or empty if
         * the owner already released it.
         */
        Optional<CleanupRequest.Task> reclaim();
    }

    private final RegistryConfig config;
    private final Monitor monitor;

    private final ReentrantReadWriteLock liveLock = new ReentrantReadWriteLock();
    private final Map<ResourceId, LiveResource> live = new HashMap<>();

    private final ReentrantLock queueLock = new ReentrantLock();
    private final Condition queueNotEmpty = queueLock.newCondition();
    private final PriorityQueue<CleanupRequest> pending = new PriorityQueue<>(CleanupRequest.SERVICE_ORDER);
    private final AtomicLong sequence = new AtomicLong(0);

    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private volatile boolean workerStopped = false;

    private final AtomicLong cleanupCount = new AtomicLong(0);
    private final AtomicLong failedCleanupCount = new AtomicLong(0);

    private final ExecutorService actionExecutor;
    private final Thread worker;

    /**
     * Creates a registry and starts its background worker.
     */
    public ResourceRegistry(RegistryConfig config) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.monitor = config.getMonitor();

        ThreadFactory actionThreadFactory = new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(config.getWorkerThreadName() + "-action-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };
        this.actionExecutor = Executors.newCachedThreadPool(actionThreadFactory);

        this.worker = new Thread(this::drainLoop, config.getWorkerThreadName());
        this.worker.setDaemon(true);
        this.worker.start();
    }

    /**
     * Creates a registry with default configuration.
     */
    public ResourceRegistry() {
        this(RegistryConfig.defaultConfig());
    }

    /**
     * Registers a live resource.
     *
     * @throws CleanupException with kind SHUTTING_DOWN once {@link #shutdown()} was called
     * @throws IllegalStateException if the id is already live
     */
    public void register(ResourceId resourceId, ResourceInfo info) {
        register(resourceId, info, null);
    }

    /**
     * Registers a live resource together with the hook that
     * {@link #forceCleanupAll()} uses to release it.
     */
    public void register(ResourceId resourceId, ResourceInfo info, Reclaimer reclaimer) {
        Objects.requireNonNull(resourceId, "resourceId cannot be null");
        Objects.requireNonNull(info, "info cannot be null");

        liveLock.writeLock().lock();
        try {
            if (shutdown.get()) {
                throw CleanupException.shuttingDown();
            }
            if (live.containsKey(resourceId)) {
                throw new IllegalStateException("Resource " + resourceId + " is already registered");
            }
            live.put(resourceId, new LiveResource(info, reclaimer));
        } finally {
            liveLock.writeLock().unlock();
        }

        logger.debug("Resource registered: {} (type: {})", resourceId, info.getTypeName());
        Monitors.emit(monitor, MonitorEvent.builder(MonitorEventType.RESOURCE_CREATED)
                .resourceId(resourceId)
                .attribute("type", info.getTypeName())
                .attribute("sizeBytes", info.getSizeBytes().isPresent() ? info.getSizeBytes().getAsLong() : null)
                .build());
    }

    /**
     * Removes a resource from the live map without running any cleanup.
     */
    public Optional<ResourceInfo> unregister(ResourceId resourceId) {
        LiveResource removed;
        liveLock.writeLock().lock();
        try {
            removed = live.remove(resourceId);
        } finally {
            liveLock.writeLock().unlock();
        }
        if (removed != null) {
            logger.debug("Resource unregistered: {}", resourceId);
            return Optional.of(removed.info);
        }
        return Optional.empty();
    }

    public Optional<ResourceInfo> resourceInfo(ResourceId resourceId) {
        liveLock.readLock().lock();
        try {
            LiveResource resource = live.get(resourceId);
            return resource == null ? Optional.empty() : Optional.of(resource.info);
        } finally {
            liveLock.readLock().unlock();
        }
    }

    public boolean isRegistered(ResourceId resourceId) {
        liveLock.readLock().lock();
        try {
            return live.containsKey(resourceId);
        } finally {
            liveLock.readLock().unlock();
        }
    }

    /**
     * Number of live resources.
     */
    public int activeCount() {
        liveLock.readLock().lock();
        try {
            return live.size();
        } finally {
            liveLock.readLock().unlock();
        }
    }

    /**
     * Number of cleanup requests waiting for the worker.
     */
    public int pendingCount() {
        queueLock.lock();
        try {
            return pending.size();
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Number of cleanup actions that completed successfully.
     */
    public long cleanupCount() {
        return cleanupCount.get();
    }

    /**
     * Number of cleanup actions that failed or timed out.
     */
    public long failedCleanupCount() {
        return failedCleanupCount.get();
    }

    /**
     * Returns true until {@link #shutdown()} is called.
     */
    public boolean isHealthy() {
        return !shutdown.get();
    }

    /**
     * Queues a cleanup for the background worker.
     *
     * @return false if the registry is shutting down and the request was not queued
     */
    public boolean scheduleCleanup(ResourceId resourceId, CleanupRequest.Task task, CleanupPriority priority) {
        Objects.requireNonNull(resourceId, "resourceId cannot be null");
        Objects.requireNonNull(task, "task cannot be null");
        Objects.requireNonNull(priority, "priority cannot be null");

        queueLock.lock();
        try {
            if (shutdown.get()) {
                logger.warn("Failed to schedule cleanup of {}: registry is shutting down", resourceId);
                return false;
            }
            pending.add(new CleanupRequest(resourceId, task, priority, sequence.incrementAndGet()));
            queueNotEmpty.signal();
            return true;
        } finally {
            queueLock.unlock();
        }
    }

    /**
     * Runs a cleanup on the calling thread and removes the resource from the
     * live map afterwards, whatever the outcome.
     *
     * @throws CleanupException with kind FAILED if the task throws
     */
    public void runCleanup(ResourceId resourceId, CleanupRequest.Task task, CleanupPriority priority) {
        long start = System.nanoTime();
        CleanupException failure = null;
        try {
            task.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = CleanupException.failed(resourceId, e);
        } catch (Exception e) {
            failure = CleanupException.failed(resourceId, e);
        }
        complete(resourceId, priority, start, failure);
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Synchronously drains the pending queue in priority order, then releases
     * every live resource that still has an owner able to hand it over.
     *
     * @return the number of cleanups processed
     * @throws CleanupException with kind SHUTTING_DOWN once {@link #shutdown()} was called
     */
    public int forceCleanupAll() {
        if (shutdown.get()) {
            throw CleanupException.shuttingDown();
        }
        return drainAll();
    }

    /**
     * Stops accepting work, cleans up everything still pending or live, stops
     * the worker and clears the live map. Calling it again has no effect.
     */
    public void shutdown() {
        queueLock.lock();
        try {
            if (!shutdown.compareAndSet(false, true)) {
                return;
            }
        } finally {
            queueLock.unlock();
        }

        int processed = drainAll();
        stopWorker();
        processed += drainPending();
        actionExecutor.shutdownNow();

        int leftover;
        liveLock.writeLock().lock();
        try {
            leftover = live.size();
            live.clear();
        } finally {
            liveLock.writeLock().unlock();
        }
        logger.info("Resource registry shut down: {} cleanups processed, {} untracked resources dropped",
                processed, leftover);
    }

    @Override
    public void close() {
        shutdown();
    }

    private int drainAll() {
        int processed = drainPending();

        List<Map.Entry<ResourceId, Reclaimer>> reclaimable = new ArrayList<>();
        liveLock.readLock().lock();
        try {
            for (Map.Entry<ResourceId, LiveResource> entry : live.entrySet()) {
                if (entry.getValue().reclaimer != null) {
                    reclaimable.add(Map.entry(entry.getKey(), entry.getValue().reclaimer));
                }
            }
        } finally {
            liveLock.readLock().unlock();
        }

        for (Map.Entry<ResourceId, Reclaimer> entry : reclaimable) {
            Optional<CleanupRequest.Task> task = entry.getValue().reclaim();
            if (task.isPresent()) {
                process(new CleanupRequest(entry.getKey(), task.get(), CleanupPriority.HIGH,
                        sequence.incrementAndGet()));
                processed++;
            }
        }
        // owners that raced us into the queue
        return processed + drainPending();
    }

    private int drainPending() {
        int processed = 0;
        CleanupRequest request;
        while ((request = poll()) != null) {
            process(request);
            processed++;
        }
        return processed;
    }

    private CleanupRequest poll() {
        queueLock.lock();
        try {
            return pending.poll();
        } finally {
            queueLock.unlock();
        }
    }

    private void stopWorker() {
        queueLock.lock();
        try {
            workerStopped = true;
            queueNotEmpty.signalAll();
        } finally {
            queueLock.unlock();
        }
        try {
            worker.join(config.getShutdownGracePeriod().toMillis() + 1);
            if (worker.isAlive()) {
                logger.warn("Cleanup worker did not stop within {}ms, interrupting",
                        config.getShutdownGracePeriod().toMillis());
                worker.interrupt();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.interrupt();
        }
    }

    private void drainLoop() {
        while (true) {
            CleanupRequest request;
            queueLock.lock();
            try {
                while (pending.isEmpty() && !workerStopped) {
                    queueNotEmpty.await();
                }
                if (workerStopped) {
                    return;
                }
                request = pending.poll();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                queueLock.unlock();
            }
            process(request);
        }
    }

    private void process(CleanupRequest request) {
        ResourceId resourceId = request.getResourceId();
        Duration timeout = config.getCleanupTimeout();
        long start = System.nanoTime();
        CleanupException failure = null;

        Future<?> future = null;
        try {
            future = actionExecutor.submit(() -> {
                request.getTask().run();
                return null;
            });
            future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            failure = CleanupException.timeout(resourceId, timeout);
        } catch (ExecutionException e) {
            failure = CleanupException.failed(resourceId, e.getCause() != null ? e.getCause() : e);
        } catch (RejectedExecutionException e) {
            failure = CleanupException.shuttingDown();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            failure = new CleanupException(CleanupException.Kind.SHUTTING_DOWN,
                    "Interrupted while cleaning up resource " + resourceId, e);
        }
        complete(resourceId, request.getPriority(), start, failure);
    }

    private void complete(ResourceId resourceId, CleanupPriority priority, long startNanos,
                          CleanupException failure) {
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        String typeName = unregister(resourceId).map(ResourceInfo::getTypeName).orElse("unknown");

        if (failure == null) {
            cleanupCount.incrementAndGet();
            logger.debug("Resource cleanup completed: {} (type: {}, priority: {}, duration: {}ms)",
                    resourceId, typeName, priority, durationMs);
        } else {
            failedCleanupCount.incrementAndGet();
            logger.error("Resource cleanup failed: {} (type: {}, priority: {}, duration: {}ms)",
                    resourceId, typeName, priority, durationMs, failure);
        }

        Monitors.emit(monitor, MonitorEvent.builder(MonitorEventType.RESOURCE_CLEANUP)
                .resourceId(resourceId)
                .attribute("type", typeName)
                .attribute("success", failure == null)
                .attribute("durationMs", durationMs)
                .attribute("priority", priority)
                .attribute("error", failure == null ? null : failure.getKind())
                .build());
    }

    @Override
    public String toString() {
        return String.format("ResourceRegistry[live=%d, pending=%d, cleaned=%d, failed=%d, shutdown=%s]",
                activeCount(), pendingCount(), cleanupCount(), failedCleanupCount(), shutdown.get());
    }

    private static final class LiveResource {
        private final ResourceInfo info;
        private final Reclaimer reclaimer;

        private LiveResource(ResourceInfo info, Reclaimer reclaimer) {
            this.info = info;
            this.reclaimer = reclaimer;
        }
    }
}
