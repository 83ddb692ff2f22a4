package hle.lifecycle.pool;

import hle.lifecycle.error.RecoveryStrategy;
import hle.lifecycle.monitor.Monitor;
import hle.lifecycle.monitor.MonitorEvent;
import hle.lifecycle.monitor.MonitorEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the ConnectionPool implementation.
 */
class ConnectionPoolTest {

    private ConnectionPool<TestConnection> pool;
    private TestConnectionManager manager;

    @BeforeEach
    void setUp() {
        manager = new TestConnectionManager();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdown(Duration.ofMillis(100));
        }
    }

    private static PoolConfig.Builder config(int maxSize) {
        return PoolConfig.builder()
                .maxSize(maxSize)
                .acquireTimeout(Duration.ofSeconds(2));
    }

    @Test
    void shouldAcquireAndReuseConnections() {
        pool = new ConnectionPool<>(manager, config(5).build());

        for (int i = 0; i < 10; i++) {
            try (PooledConnection<TestConnection> connection = pool.acquire()) {
                assertEquals("conn-1", connection.get().getId());
            }
        }

        assertEquals(1, manager.created.get());
        assertEquals(0, pool.activeCount());
        assertEquals(1, pool.idleCount());
    }

    @Test
    @Timeout(5)
    void shouldHandReleasedConnectionToBlockedCaller() throws Exception {
        pool = new ConnectionPool<>(manager, config(2).acquireTimeout(Duration.ofMillis(100)).build());
        PooledConnection<TestConnection> first = pool.acquire();
        PooledConnection<TestConnection> second = pool.acquire();
        TestConnection released = first.get();

        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<TestConnection> third = executor.submit(() -> {
            try (PooledConnection<TestConnection> connection = pool.acquire()) {
                return connection.get();
            }
        });

        awaitWaiters(1);
        assertFalse(third.isDone());
        first.close();

        assertSame(released, third.get(1, TimeUnit.SECONDS));
        assertEquals(2, manager.created.get());
        second.close();
        executor.shutdown();
    }

    @Test
    @Timeout(5)
    void shouldTimeOutWhenNothingIsReleased() {
        pool = new ConnectionPool<>(manager, config(2).acquireTimeout(Duration.ofMillis(100)).build());
        PooledConnection<TestConnection> first = pool.acquire();
        PooledConnection<TestConnection> second = pool.acquire();

        long start = System.nanoTime();
        PoolException e = assertThrows(PoolException.class, () -> pool.acquire());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(PoolException.Kind.TIMEOUT, e.getKind());
        assertTrue(elapsedMs >= 90, "returned after " + elapsedMs + "ms");
        assertEquals(0, pool.waitingCount());
        assertEquals(2, pool.activeCount());
        first.close();
        second.close();
    }

    @Test
    @Timeout(10)
    void shouldServeWaitersInArrivalOrder() throws Exception {
        pool = new ConnectionPool<>(manager, config(1).acquireTimeout(Duration.ofSeconds(5)).build());
        PooledConnection<TestConnection> holder = pool.acquire();

        int waiterCount = 5;
        List<Integer> served = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(waiterCount);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < waiterCount; i++) {
            int waiter = i;
            futures.add(executor.submit(() -> {
                try (PooledConnection<TestConnection> connection = pool.acquire()) {
                    served.add(waiter);
                }
            }));
            awaitWaiters(i + 1);
        }

        holder.close();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(List.of(0, 1, 2, 3, 4), served);
        assertEquals(1, manager.created.get());
    }

    @Test
    @Timeout(10)
    void shouldKeepHandedOffConnectionAwayFromNewCallers() throws Exception {
        pool = new ConnectionPool<>(manager, config(1).acquireTimeout(Duration.ofSeconds(5)).build());
        PooledConnection<TestConnection> holder = pool.acquire();

        CountDownLatch waiterServed = new CountDownLatch(1);
        CountDownLatch releaseWaiter = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<?> waiter = executor.submit(() -> {
            try (PooledConnection<TestConnection> connection = pool.acquire()) {
                waiterServed.countDown();
                releaseWaiter.await();
            }
            return null;
        });
        awaitWaiters(1);

        holder.close();
        assertTrue(waiterServed.await(2, TimeUnit.SECONDS));
        assertThrows(PoolException.class, () -> pool.acquire(Duration.ofMillis(20)));

        releaseWaiter.countDown();
        waiter.get(2, TimeUnit.SECONDS);
        executor.shutdown();
    }

    @Test
    @Timeout(10)
    void shouldServeNewestWaiterFirstWhenUnfair() throws Exception {
        pool = new ConnectionPool<>(manager, config(1)
                .fairQueue(false)
                .acquireTimeout(Duration.ofSeconds(5))
                .build());
        PooledConnection<TestConnection> holder = pool.acquire();

        List<Integer> served = new CopyOnWriteArrayList<>();
        ExecutorService executor = Executors.newFixedThreadPool(3);
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            int waiter = i;
            futures.add(executor.submit(() -> {
                try (PooledConnection<TestConnection> connection = pool.acquire()) {
                    served.add(waiter);
                }
            }));
            awaitWaiters(i + 1);
        }

        holder.close();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertEquals(List.of(2, 1, 0), served);
    }

    @Test
    @Timeout(20)
    void shouldNeverExceedMaxSize() throws Exception {
        int maxSize = 3;
        pool = new ConnectionPool<>(manager, config(maxSize).acquireTimeout(Duration.ofSeconds(10)).build());

        int threads = 12;
        AtomicBoolean exceeded = new AtomicBoolean(false);
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    PooledConnection<TestConnection> connection = pool.acquire();
                    if (manager.live.get() > maxSize || pool.totalCount() > maxSize) {
                        exceeded.set(true);
                    }
                    if ((thread + i) % 7 == 0) {
                        connection.invalidate();
                    } else {
                        connection.close();
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(15, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertFalse(exceeded.get());
        assertTrue(manager.maxLive.get() <= maxSize, "peak live resources " + manager.maxLive.get());
        assertEquals(0, pool.activeCount());
    }

    @Test
    void shouldDiscardConnectionThatFailsValidationOnReturn() {
        pool = new ConnectionPool<>(manager, config(2).build());

        PooledConnection<TestConnection> connection = pool.acquire();
        TestConnection first = connection.get();
        first.healthy.set(false);
        connection.close();

        assertEquals(0, pool.activeCount());
        assertEquals(0, pool.idleCount());
        assertEquals(1, pool.discardedCount());
        assertTrue(first.closed.get());

        try (PooledConnection<TestConnection> next = pool.acquire()) {
            assertNotSame(first, next.get());
        }
        assertEquals(2, manager.created.get());
    }

    @Test
    void shouldDestroyInvalidatedConnection() {
        pool = new ConnectionPool<>(manager, config(2).build());

        PooledConnection<TestConnection> connection = pool.acquire();
        TestConnection resource = connection.get();
        connection.invalidate();
        connection.close();

        assertTrue(resource.closed.get());
        assertEquals(0, pool.totalCount());
        assertEquals(1, pool.discardedCount());
        assertThrows(IllegalStateException.class, connection::get);
    }

    @Test
    void shouldDetachConnectionWithoutDestroyingIt() {
        pool = new ConnectionPool<>(manager, config(1).build());

        PooledConnection<TestConnection> connection = pool.acquire();
        TestConnection detached = connection.detach();

        assertFalse(detached.closed.get());
        assertEquals(0, pool.totalCount());
        assertThrows(IllegalStateException.class, connection::detach);

        try (PooledConnection<TestConnection> next = pool.acquire()) {
            assertNotSame(detached, next.get());
        }
    }

    @Test
    void shouldReportManagerFailure() {
        manager.failCreates.set(true);
        pool = new ConnectionPool<>(manager, config(2).build());

        PoolException e = assertThrows(PoolException.class, () -> pool.acquire());

        assertEquals(PoolException.Kind.MANAGER, e.getKind());
        assertInstanceOf(IllegalStateException.class, e.getCause());
        assertEquals(0, pool.activeCount());

        manager.failCreates.set(false);
        try (PooledConnection<TestConnection> connection = pool.acquire()) {
            assertNotNull(connection.get());
        }
    }

    @Test
    @Timeout(10)
    void shouldKeepServingWaitersAfterReplacementCreationFails() throws Exception {
        pool = new ConnectionPool<>(manager, config(1).acquireTimeout(Duration.ofSeconds(3)).build());
        PooledConnection<TestConnection> holder = pool.acquire();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        Future<String> first = executor.submit(() -> {
            try (PooledConnection<TestConnection> connection = pool.acquire()) {
                return connection.get().getId();
            }
        });
        awaitWaiters(1);
        Future<String> second = executor.submit(() -> {
            try (PooledConnection<TestConnection> connection = pool.acquire()) {
                return connection.get().getId();
            }
        });
        awaitWaiters(2);

        manager.failNextCreates.set(1);
        holder.invalidate();

        ExecutionException e = assertThrows(ExecutionException.class, () -> first.get(2, TimeUnit.SECONDS));
        assertEquals(PoolException.Kind.MANAGER, ((PoolException) e.getCause()).getKind());
        assertEquals("conn-2", second.get(2, TimeUnit.SECONDS));
        assertEquals(0, pool.waitingCount());
        assertEquals(0, pool.activeCount());
        executor.shutdown();
    }

    @Test
    void shouldRejectNewConnectionThatFailsValidation() {
        manager.createUnhealthy.set(true);
        pool = new ConnectionPool<>(manager, config(2).build());

        PoolException e = assertThrows(PoolException.class, () -> pool.acquire());

        assertEquals(PoolException.Kind.VALIDATION_FAILED, e.getKind());
        assertEquals(RecoveryStrategy.RETRY, e.recoveryStrategy());
        assertEquals(0, pool.activeCount());
        assertEquals(1, pool.discardedCount());
        assertEquals(1, manager.destroyed.get());

        manager.createUnhealthy.set(false);
        try (PooledConnection<TestConnection> connection = pool.acquire()) {
            assertEquals("conn-2", connection.get().getId());
        }
    }

    @Test
    @Timeout(10)
    void shouldReclaimConnectionThatWasNeverReleased() throws Exception {
        pool = new ConnectionPool<>(manager, config(1).acquireTimeout(Duration.ofMillis(200)).build());
        TestConnection lost = acquireWithoutReleasing();

        while (pool.activeCount() > 0) {
            System.gc();
            Thread.sleep(20);
        }

        assertTrue(lost.closed.get());
        assertEquals(1, pool.discardedCount());
        try (PooledConnection<TestConnection> next = pool.acquire()) {
            assertNotSame(lost, next.get());
        }
    }

    private TestConnection acquireWithoutReleasing() {
        return pool.acquire().get();
    }

    @Test
    @Timeout(5)
    void shouldFailSlowCreationAndDestroyLateResource() throws Exception {
        manager.createDelayMs = 300;
        manager.connectTimeout = Duration.ofMillis(50);
        pool = new ConnectionPool<>(manager, config(2).build());

        PoolException e = assertThrows(PoolException.class, () -> pool.acquire());

        assertEquals(PoolException.Kind.MANAGER, e.getKind());
        assertInstanceOf(TimeoutException.class, e.getCause());
        assertEquals(1, pool.activeCount());

        // the abandoned creation keeps its slot until it finishes and is destroyed
        while (pool.activeCount() > 0) {
            Thread.sleep(10);
        }
        assertEquals(1, manager.destroyed.get());
        assertEquals(0, manager.live.get());
    }

    @Test
    @Timeout(5)
    void shouldProbeIdleConnectionsAndDiscardUnhealthyOnes() throws Exception {
        pool = new ConnectionPool<>(manager, config(2).healthCheckInterval(Duration.ofMillis(20)).build());

        PooledConnection<TestConnection> connection = pool.acquire();
        TestConnection resource = connection.get();
        connection.close();
        resource.healthy.set(false);

        while (pool.discardedCount() == 0) {
            Thread.sleep(10);
        }
        assertEquals(0, pool.idleCount());
        assertTrue(resource.closed.get());
    }

    @Test
    @Timeout(5)
    void shouldExpireIdleConnectionsDownToMinSize() throws Exception {
        pool = new ConnectionPool<>(manager, config(3)
                .minSize(1)
                .idleTimeout(Duration.ofMillis(50))
                .healthCheckInterval(Duration.ofMillis(20))
                .build());

        PooledConnection<TestConnection> a = pool.acquire();
        PooledConnection<TestConnection> b = pool.acquire();
        PooledConnection<TestConnection> c = pool.acquire();
        a.close();
        b.close();
        c.close();

        while (pool.idleCount() > 1) {
            Thread.sleep(10);
        }
        Thread.sleep(100);
        assertEquals(1, pool.totalCount());
    }

    @Test
    @Timeout(5)
    void shouldPreWarmToMinSize() throws Exception {
        pool = new ConnectionPool<>(manager, config(5).minSize(2).build());

        while (pool.idleCount() < 2) {
            Thread.sleep(10);
        }
        assertEquals(2, manager.created.get());
    }

    @Test
    void shouldRunHealthCheckOnDemand() {
        pool = new ConnectionPool<>(manager, config(5)
                .minSize(2)
                .healthCheckInterval(Duration.ofHours(1))
                .build());

        pool.runHealthCheck();

        assertEquals(2, pool.totalCount());
    }

    @Test
    @Timeout(5)
    void shouldDrainOnShutdown() throws Exception {
        pool = new ConnectionPool<>(manager, config(1).acquireTimeout(Duration.ofSeconds(5)).build());
        PooledConnection<TestConnection> held = pool.acquire();

        ExecutorService executor = Executors.newFixedThreadPool(2);
        Future<?> waiter = executor.submit(() -> pool.acquire());
        awaitWaiters(1);

        Future<Boolean> shutdown = executor.submit(() -> pool.shutdown(Duration.ofSeconds(2)));
        while (pool.state() == PoolState.RUNNING) {
            Thread.sleep(5);
        }

        ExecutionException e = assertThrows(ExecutionException.class, () -> waiter.get(1, TimeUnit.SECONDS));
        assertEquals(PoolException.Kind.SHUTTING_DOWN, ((PoolException) e.getCause()).getKind());
        PoolException rejected = assertThrows(PoolException.class, () -> pool.acquire());
        assertEquals(PoolException.Kind.SHUTTING_DOWN, rejected.getKind());
        assertFalse(shutdown.isDone());

        TestConnection resource = held.get();
        held.close();

        assertTrue(shutdown.get(2, TimeUnit.SECONDS));
        assertEquals(PoolState.CLOSED, pool.state());
        assertTrue(resource.closed.get());
        executor.shutdown();
    }

    @Test
    void shouldCloseWhenLastConnectionReturnsAfterShutdownTimedOut() {
        pool = new ConnectionPool<>(manager, config(1).build());
        PooledConnection<TestConnection> held = pool.acquire();

        assertFalse(pool.shutdown(Duration.ofMillis(50)));
        assertEquals(PoolState.DRAINING, pool.state());

        held.close();
        assertEquals(PoolState.CLOSED, pool.state());
        assertEquals(0, pool.activeCount());
        assertTrue(pool.shutdown(Duration.ofMillis(50)));
    }

    @Test
    void shouldEmitPoolEvents() {
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
        pool = new ConnectionPool<>(manager, config(1).monitor(monitor).build());

        pool.acquire().invalidate();

        assertEquals(MonitorEventType.POOL_RESOURCE_CREATED, events.get(0).getType());
        assertEquals(MonitorEventType.POOL_RESOURCE_DISCARDED, events.get(1).getType());
        assertEquals("invalidated by caller", events.get(1).getAttribute("reason").orElseThrow());
    }

    @Test
    void shouldFormatStats() {
        pool = new ConnectionPool<>(manager, config(4).build());
        PooledConnection<TestConnection> connection = pool.acquire();

        String stats = pool.stats();

        assertTrue(stats.contains("active=1"), stats);
        assertTrue(stats.contains("max=4"), stats);
        connection.close();
    }

    private void awaitWaiters(int count) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (pool.waitingCount() < count) {
            if (System.nanoTime() > deadline) {
                fail("expected " + count + " waiters but saw " + pool.waitingCount());
            }
            Thread.sleep(5);
        }
    }

    /**
     * Connection stand-in that can be marked unhealthy.
     */
    static class TestConnection implements AutoCloseable {
        private final String id;
        final AtomicBoolean healthy = new AtomicBoolean(true);
        final AtomicBoolean closed = new AtomicBoolean(false);

        TestConnection(int number) {
            this.id = "conn-" + number;
        }

        String getId() {
            return id;
        }

        @Override
        public void close() {
            closed.set(true);
        }
    }

    static class TestConnectionManager implements ConnectionManager<TestConnection> {
        final AtomicInteger created = new AtomicInteger(0);
        final AtomicInteger destroyed = new AtomicInteger(0);
        final AtomicInteger live = new AtomicInteger(0);
        final AtomicInteger maxLive = new AtomicInteger(0);
        final AtomicBoolean failCreates = new AtomicBoolean(false);
        final AtomicInteger failNextCreates = new AtomicInteger(0);
        final AtomicBoolean createUnhealthy = new AtomicBoolean(false);
        volatile long createDelayMs = 0;
        volatile Duration connectTimeout = Duration.ofSeconds(5);

        @Override
        public TestConnection create() throws Exception {
            if (failCreates.get() || failNextCreates.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
                throw new IllegalStateException("provider unavailable");
            }
            if (createDelayMs > 0) {
                Thread.sleep(createDelayMs);
            }
            maxLive.accumulateAndGet(live.incrementAndGet(), Math::max);
            TestConnection connection = new TestConnection(created.incrementAndGet());
            connection.healthy.set(!createUnhealthy.get());
            return connection;
        }

        @Override
        public boolean isValid(TestConnection resource) {
            return resource.healthy.get() && !resource.closed.get();
        }

        @Override
        public Duration connectTimeout() {
            return connectTimeout;
        }

        @Override
        public void destroy(TestConnection resource) {
            resource.close();
            live.decrementAndGet();
            destroyed.incrementAndGet();
        }
    }
}
