package hle.lifecycle.pool;

import hle.lifecycle.monitor.Monitor;
import hle.lifecycle.monitor.MonitorEvent;
import hle.lifecycle.monitor.MonitorEventType;
import hle.lifecycle.monitor.Monitors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A bounded, thread-safe pool of resources created by a {@link ConnectionManager}.
 *
 * <p>Key features:
 * <ul>
 *   <li>Hard capacity: {@code active + idle <= maxSize} at all times</li>
 *   <li>Fair scheduling: once the pool is exhausted, callers are served strictly
 *       in arrival order and a returned resource goes straight to the oldest waiter</li>
 *   <li>Validation on return: invalid resources are destroyed, never recycled</li>
 *   <li>Background health check of idle resources, idle timeout and pre-warming
 *       to {@code minSize}</li>
 *   <li>Graceful shutdown that waits for checked-out resources to come back</li>
 * </ul>
 *
 * <p>A single lock guards the idle queue, the waiter queue and the counters.
 * Creating, validating and destroying resources always happens outside it.
 *
 * <p>Example usage:
 * <pre>{@code
 * ConnectionPool<LlmConnection> pool = new ConnectionPool<>(
 *     new LlmConnectionManager(endpoint),
 *     PoolConfig.builder()
 *         .maxSize(10)
 *         .acquireTimeout(Duration.ofSeconds(2))
 *         .build()
 * );
 *
 * try (PooledConnection<LlmConnection> connection = pool.acquire()) {
 *     connection.get().send(prompt);
 * }
 *
 * pool.close();
 * }</pre>
 *
 * @param <T> the type of resource managed by this pool
 */
public class ConnectionPool<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionPool.class);

    private final ConnectionManager<T> manager;
    private final PoolConfig config;
    private final Monitor monitor;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private final Deque<PoolSlot<T>> idle = new ArrayDeque<>();
    private final Deque<CompletableFuture<PoolSlot<T>>> waiters = new ArrayDeque<>();
    // checked out, being created, being validated or being probed
    private int active = 0;

    private final AtomicReference<PoolState> state = new AtomicReference<>(PoolState.RUNNING);
    private final AtomicLong createdCount = new AtomicLong(0);
    private final AtomicLong discardedCount = new AtomicLong(0);

    private final ExecutorService creator;
    private final ScheduledExecutorService healthChecker;

    /**
     * Creates a new pool and starts its health check.
     *
     * @param manager creates, validates and recycles the pooled resources
     * @param config  pool configuration
     */
    public ConnectionPool(ConnectionManager<T> manager, PoolConfig config) {
        this.manager = Objects.requireNonNull(manager, "manager cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.monitor = config.getMonitor();

        this.creator = Executors.newCachedThreadPool(namedDaemonThreads(config.getThreadNamePrefix() + "-create"));
        this.healthChecker = Executors.newSingleThreadScheduledExecutor(
                namedDaemonThreads(config.getThreadNamePrefix() + "-health"));

        long intervalMs = config.getHealthCheckInterval().toMillis();
        healthChecker.scheduleWithFixedDelay(this::runScheduledHealthCheck, intervalMs, intervalMs,
                TimeUnit.MILLISECONDS);
        if (config.getMinSize() > 0) {
            creator.execute(this::ensureMinimum);
        }
    }

    /**
     * Creates a new pool with default configuration.
     */
    public ConnectionPool(ConnectionManager<T> manager) {
        this(manager, PoolConfig.defaultConfig());
    }

    private static ThreadFactory namedDaemonThreads(String prefix) {
        return new ThreadFactory() {
            private final AtomicInteger counter = new AtomicInteger(0);

            @Override
            public Thread newThread(Runnable r) {
                Thread thread = new Thread(r);
                thread.setName(prefix + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        };
    }

    /**
     * Acquires a resource, waiting up to the configured acquire timeout.
     *
     * @throws PoolException if the pool is shutting down, the manager fails or the wait times out
     */
    public PooledConnection<T> acquire() {
        return acquire(config.getAcquireTimeout());
    }

    /**
     * Acquires a resource, waiting up to {@code timeout} when the pool is exhausted.
     *
     * <p>An idle resource is handed out immediately. Otherwise, if the pool has
     * spare capacity, a new resource is created on the calling thread's behalf,
     * bounded by {@link ConnectionManager#connectTimeout()}. Otherwise the caller
     * joins the tail of the waiter queue.
     *
     * @param timeout maximum time to wait for a resource to be returned
     * @return the checked-out resource; close it to return it
     * @throws PoolException with kind SHUTTING_DOWN, MANAGER, VALIDATION_FAILED or TIMEOUT
     */
    public PooledConnection<T> acquire(Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        long deadline = System.nanoTime() + timeout.toNanos();

        List<PoolSlot<T>> expired = new ArrayList<>();
        PoolSlot<T> slot = null;
        boolean create = false;
        CompletableFuture<PoolSlot<T>> waiter = null;

        lock.lock();
        try {
            if (state.get() != PoolState.RUNNING) {
                throw PoolException.shuttingDown();
            }
            if (!config.isFairQueue() || waiters.isEmpty()) {
                // expired slots stay counted as active until they are destroyed
                while ((slot = idle.pollLast()) != null && isIdleExpired(slot)) {
                    expired.add(slot);
                    active++;
                }
            }
            if (slot != null) {
                slot.pooled().allocate();
                active++;
            } else if (waiters.isEmpty() || !config.isFairQueue()) {
                if (active + idle.size() < config.getMaxSize()) {
                    active++;
                    create = true;
                }
            }
            if (slot == null && !create) {
                waiter = new CompletableFuture<>();
                waiters.addLast(waiter);
            }
        } finally {
            lock.unlock();
        }

        for (PoolSlot<T> stale : expired) {
            destroy(stale, "idle timeout");
            releaseCapacity();
        }

        if (slot != null) {
            return new PooledConnection<>(this, slot);
        }
        if (create) {
            return new PooledConnection<>(this, createReserved());
        }
        return awaitHandoff(waiter, timeout, deadline);
    }

    private PoolSlot<T> createReserved() {
        try {
            PoolSlot<T> slot = new PoolSlot<>(createResource());
            slot.pooled().allocate();
            return slot;
        } catch (PoolException e) {
            lock.lock();
            try {
                active--;
                signalIfDrained();
            } finally {
                lock.unlock();
            }
            replenishForWaiters();
            throw e;
        }
    }

    private PooledConnection<T> awaitHandoff(CompletableFuture<PoolSlot<T>> waiter, Duration timeout, long deadline) {
        try {
            long remaining = deadline - System.nanoTime();
            return new PooledConnection<>(this, waiter.get(Math.max(0L, remaining), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            if (removeWaiter(waiter)) {
                throw PoolException.timeout(timeout);
            }
            // handed a resource (or an error) just as the timeout fired
            return new PooledConnection<>(this, join(waiter));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (!removeWaiter(waiter)) {
                waiter.thenAccept(this::offer);
            }
            throw PoolException.interrupted(e);
        } catch (ExecutionException e) {
            throw asPoolException(e.getCause());
        }
    }

    private boolean removeWaiter(CompletableFuture<PoolSlot<T>> waiter) {
        lock.lock();
        try {
            return waiters.remove(waiter);
        } finally {
            lock.unlock();
        }
    }

    private PoolSlot<T> join(CompletableFuture<PoolSlot<T>> waiter) {
        try {
            return waiter.join();
        } catch (CompletionException e) {
            throw asPoolException(e.getCause());
        }
    }

    private static PoolException asPoolException(Throwable cause) {
        if (cause instanceof PoolException) {
            return (PoolException) cause;
        }
        return PoolException.manager(cause);
    }

    private T createResource() {
        CompletableFuture<T> creation;
        try {
            creation = CompletableFuture.supplyAsync(() -> {
                try {
                    return Objects.requireNonNull(manager.create(), "manager created a null resource");
                } catch (Exception e) {
                    throw new CompletionException(e);
                }
            }, creator);
        } catch (RejectedExecutionException e) {
            throw PoolException.shuttingDown();
        }

        Duration connectTimeout = manager.connectTimeout();
        try {
            T resource = creation.get(connectTimeout.toNanos(), TimeUnit.NANOSECONDS);
            createdCount.incrementAndGet();
            if (!isValidQuietly(resource)) {
                discardedCount.incrementAndGet();
                logger.warn("Discarding pooled resource {}: failed validation on create", resource);
                Monitors.emit(monitor, MonitorEvent.builder(MonitorEventType.POOL_RESOURCE_DISCARDED)
                        .attribute("type", resource.getClass().getSimpleName())
                        .attribute("reason", "failed validation on create")
                        .build());
                destroyQuietly(resource);
                throw PoolException.validationFailed("Newly created resource failed validation");
            }
            logger.debug("Created pooled resource {}", resource);
            Monitors.emit(monitor, MonitorEvent.builder(MonitorEventType.POOL_RESOURCE_CREATED)
                    .attribute("type", resource.getClass().getSimpleName())
                    .build());
            return resource;
        } catch (TimeoutException e) {
            holdCapacityUntilSettled(creation);
            throw PoolException.manager(new TimeoutException(
                    "Resource creation timed out after " + connectTimeout.toMillis() + "ms"));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Failed to create pooled resource: {}", cause.getMessage());
            throw PoolException.manager(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            holdCapacityUntilSettled(creation);
            throw PoolException.interrupted(e);
        }
    }

    /**
     * Keeps one unit of capacity reserved for an abandoned creation until it
     * finishes, then destroys whatever it produced. The caller gives up its own
     * reservation as usual.
     */
    private void holdCapacityUntilSettled(CompletableFuture<T> creation) {
        lock.lock();
        try {
            active++;
        } finally {
            lock.unlock();
        }
        creation.whenComplete((late, failure) -> {
            if (late != null) {
                logger.warn("Resource created after the pool stopped waiting for it, destroying it");
                destroyQuietly(late);
            }
            releaseCapacity();
        });
    }

    /**
     * Called by {@link PooledConnection} when a resource comes back.
     */
    void release(PoolSlot<T> slot, boolean invalidate) {
        if (invalidate || state.get() != PoolState.RUNNING) {
            destroy(slot, invalidate ? "invalidated by caller" : "pool shutting down");
            releaseCapacity();
            return;
        }

        PoolSlot<T> returned = slot;
        boolean valid;
        try {
            T recycled = manager.recycle(slot.resource());
            if (recycled != slot.resource()) {
                returned = new PoolSlot<>(Objects.requireNonNull(recycled, "manager recycled into null"));
                returned.pooled().allocate();
            }
            valid = manager.isValid(returned.resource());
        } catch (Exception e) {
            logger.warn("Failed to recycle pooled resource: {}", e.getMessage());
            valid = false;
        }

        if (!valid) {
            destroy(returned, "failed validation on return");
            releaseCapacity();
            return;
        }
        returned.markChecked();
        offer(returned);
    }

    /**
     * Called by {@link PooledConnection#detach()}: the resource leaves the pool.
     */
    void detach(PoolSlot<T> slot) {
        slot.pooled().invalidate();
        releaseCapacity();
    }

    /**
     * Hands a checked-out, valid resource to the next waiter or back to the idle queue.
     */
    private void offer(PoolSlot<T> slot) {
        boolean destroy = false;
        lock.lock();
        try {
            if (state.get() != PoolState.RUNNING) {
                destroy = true;
            } else {
                CompletableFuture<PoolSlot<T>> waiter = nextWaiter();
                if (waiter != null) {
                    slot.pooled().deallocate();
                    slot.pooled().allocate();
                    waiter.complete(slot);
                    return;
                }
                slot.pooled().deallocate();
                idle.addLast(slot);
                active--;
            }
        } finally {
            lock.unlock();
        }
        if (destroy) {
            destroy(slot, "pool shutting down");
            releaseCapacity();
        }
    }

    private CompletableFuture<PoolSlot<T>> nextWaiter() {
        return config.isFairQueue() ? waiters.pollFirst() : waiters.pollLast();
    }

    /**
     * Gives up one unit of active capacity and, if callers are waiting, starts
     * a replacement for them.
     */
    private void releaseCapacity() {
        lock.lock();
        try {
            active--;
            signalIfDrained();
        } finally {
            lock.unlock();
        }
        replenishForWaiters();
    }

    /**
     * Starts background creations while callers are waiting and capacity is free.
     * A created resource goes to whichever waiter is first in line when it is
     * ready; a failed creation is reported to the oldest waiter and the rest
     * get a fresh attempt.
     */
    private void replenishForWaiters() {
        while (true) {
            lock.lock();
            try {
                if (state.get() != PoolState.RUNNING || waiters.isEmpty()
                        || active + idle.size() >= config.getMaxSize()) {
                    return;
                }
                active++;
            } finally {
                lock.unlock();
            }
            try {
                creator.execute(this::createForWaiters);
            } catch (RejectedExecutionException e) {
                releaseReservation();
                return;
            }
        }
    }

    private void createForWaiters() {
        PoolSlot<T> slot;
        try {
            slot = new PoolSlot<>(createResource());
            slot.pooled().allocate();
        } catch (PoolException e) {
            CompletableFuture<PoolSlot<T>> waiter;
            lock.lock();
            try {
                active--;
                waiter = nextWaiter();
                signalIfDrained();
            } finally {
                lock.unlock();
            }
            if (waiter != null) {
                waiter.completeExceptionally(e);
            }
            replenishForWaiters();
            return;
        }
        offer(slot);
    }

    private void releaseReservation() {
        lock.lock();
        try {
            active--;
            signalIfDrained();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void signalIfDrained() {
        if (active != 0) {
            return;
        }
        drained.signalAll();
        if (state.compareAndSet(PoolState.DRAINING, PoolState.CLOSED)) {
            creator.shutdown();
            logger.info("Pool closed: {} resources created, {} discarded", createdCount.get(), discardedCount.get());
        }
    }

    private boolean isIdleExpired(PoolSlot<T> slot) {
        return slot.pooled().getIdleDuration().compareTo(config.getIdleTimeout()) >= 0;
    }

    private void destroy(PoolSlot<T> slot, String reason) {
        slot.pooled().invalidate();
        discardedCount.incrementAndGet();
        logger.debug("Discarding pooled resource {}: {}", slot.resource(), reason);
        Monitors.emit(monitor, MonitorEvent.builder(MonitorEventType.POOL_RESOURCE_DISCARDED)
                .attribute("type", slot.resource().getClass().getSimpleName())
                .attribute("reason", reason)
                .build());
        destroyQuietly(slot.resource());
    }

    private boolean isValidQuietly(T resource) {
        try {
            return manager.isValid(resource);
        } catch (RuntimeException e) {
            logger.warn("Validation of pooled resource threw: {}", e.getMessage());
            return false;
        }
    }

    private void destroyQuietly(T resource) {
        try {
            manager.destroy(resource);
        } catch (Exception e) {
            // Best effort - the resource is gone from the pool either way
            logger.warn("Failed to destroy pooled resource: {}", e.getMessage());
        }
    }

    private void runScheduledHealthCheck() {
        try {
            runHealthCheck();
        } catch (RuntimeException e) {
            logger.error("Pool health check failed", e);
        }
    }

    /**
     * Runs one health-check pass: destroys resources idle for longer than the
     * idle timeout (down to {@code minSize}), probes idle resources that were
     * not validated within the health-check interval, and tops the pool up to
     * {@code minSize}.
     */
    void runHealthCheck() {
        if (state.get() != PoolState.RUNNING) {
            return;
        }
        long intervalNanos = config.getHealthCheckInterval().toNanos();
        long now = System.nanoTime();
        List<PoolSlot<T>> expired = new ArrayList<>();
        List<PoolSlot<T>> probes = new ArrayList<>();

        lock.lock();
        try {
            int remaining = active + idle.size();
            Iterator<PoolSlot<T>> it = idle.iterator();
            while (it.hasNext()) {
                PoolSlot<T> slot = it.next();
                if (isIdleExpired(slot) && remaining > config.getMinSize()) {
                    it.remove();
                    expired.add(slot);
                    active++;
                    remaining--;
                } else if (now - slot.lastCheckedNanos() >= intervalNanos) {
                    it.remove();
                    slot.pooled().allocate();
                    probes.add(slot);
                    active++;
                }
            }
        } finally {
            lock.unlock();
        }

        for (PoolSlot<T> slot : expired) {
            destroy(slot, "idle timeout");
            releaseCapacity();
        }

        for (PoolSlot<T> slot : probes) {
            boolean valid = isValidQuietly(slot.resource());
            slot.markChecked();
            if (valid) {
                offer(slot);
            } else {
                destroy(slot, "failed health check");
                releaseCapacity();
            }
        }

        ensureMinimum();
    }

    /**
     * Creates idle resources until the pool holds {@code minSize}.
     */
    void ensureMinimum() {
        while (true) {
            lock.lock();
            try {
                if (state.get() != PoolState.RUNNING || active + idle.size() >= config.getMinSize()) {
                    return;
                }
                active++;
            } finally {
                lock.unlock();
            }
            PoolSlot<T> slot;
            try {
                slot = new PoolSlot<>(createResource());
                slot.pooled().allocate();
            } catch (PoolException e) {
                logger.warn("Failed to pre-warm pool to minSize {}: {}", config.getMinSize(), e.getMessage());
                releaseReservation();
                return;
            }
            offer(slot);
        }
    }

    /**
     * Stops accepting acquisitions, fails every waiter, destroys idle resources
     * and waits until every checked-out resource has been returned. If the wait
     * times out, the pool still moves to {@link PoolState#CLOSED} as soon as the
     * last resource comes back.
     *
     * @param timeout how long to wait for checked-out resources
     * @return true if the pool reached {@link PoolState#CLOSED} within the timeout
     */
    public boolean shutdown(Duration timeout) {
        List<PoolSlot<T>> idleSlots = new ArrayList<>();
        List<CompletableFuture<PoolSlot<T>>> pendingWaiters = new ArrayList<>();

        if (state.compareAndSet(PoolState.RUNNING, PoolState.DRAINING)) {
            healthChecker.shutdownNow();
            lock.lock();
            try {
                pendingWaiters.addAll(waiters);
                waiters.clear();
                idleSlots.addAll(idle);
                idle.clear();
            } finally {
                lock.unlock();
            }
            logger.info("Pool draining: {} waiters rejected, {} idle resources destroyed",
                    pendingWaiters.size(), idleSlots.size());
        }

        PoolException shuttingDown = PoolException.shuttingDown();
        pendingWaiters.forEach(waiter -> waiter.completeExceptionally(shuttingDown));
        idleSlots.forEach(slot -> destroy(slot, "pool shutting down"));

        boolean closed;
        lock.lock();
        try {
            signalIfDrained();
            long remaining = timeout.toNanos();
            while (active > 0 && remaining > 0) {
                remaining = drained.awaitNanos(remaining);
            }
            closed = active == 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closed = false;
        } finally {
            lock.unlock();
        }

        if (!closed) {
            logger.warn("Pool shutdown timed out with {} resources still checked out; "
                    + "the pool closes when the last one comes back", activeCount());
        }
        return closed;
    }

    /**
     * Shuts the pool down, waiting up to the acquire timeout for checked-out resources.
     */
    @Override
    public void close() {
        shutdown(config.getAcquireTimeout());
    }

    /**
     * Gets the number of resources checked out or in transit (being created,
     * validated or probed).
     */
    public int activeCount() {
        lock.lock();
        try {
            return active;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of idle resources in the pool.
     */
    public int idleCount() {
        lock.lock();
        try {
            return idle.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the number of callers waiting for a resource.
     */
    public int waitingCount() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Gets the total number of resources (active + idle).
     */
    public int totalCount() {
        lock.lock();
        try {
            return active + idle.size();
        } finally {
            lock.unlock();
        }
    }

    public int maxSize() {
        return config.getMaxSize();
    }

    public PoolState state() {
        return state.get();
    }

    /**
     * Number of resources the manager has created over the pool's lifetime.
     */
    public long createdCount() {
        return createdCount.get();
    }

    /**
     * Number of resources the pool has destroyed over its lifetime.
     */
    public long discardedCount() {
        return discardedCount.get();
    }

    /**
     * Returns pool statistics as a formatted string.
     */
    public String stats() {
        lock.lock();
        try {
            return String.format("ConnectionPool[state=%s, active=%d, idle=%d, waiting=%d, max=%d, created=%d, discarded=%d]",
                    state.get(), active, idle.size(), waiters.size(), config.getMaxSize(),
                    createdCount.get(), discardedCount.get());
        } finally {
            lock.unlock();
        }
    }
}
