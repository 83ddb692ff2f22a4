package hle.lifecycle.pool;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A resource checked out of a {@link ConnectionPool}.
 *
 * <p>Exactly one of {@link #close()}, {@link #invalidate()} or {@link #detach()}
 * takes effect; later calls are ignored (or rejected, for {@code detach}).
 * Use it with try-with-resources:
 * <pre>{@code
 * try (PooledConnection<LlmConnection> connection = pool.acquire()) {
 *     return connection.get().send(prompt);
 * }
 * }</pre>
 *
 * <p>A connection that becomes unreachable without being released is
 * invalidated by a {@link Cleaner}, so its capacity returns to the pool. This
 * is a safety net only: it runs whenever the garbage collector gets to it.
 *
 * @param <T> the type of the pooled resource
 */
public final class PooledConnection<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PooledConnection.class);
    private static final Cleaner CLEANER = Cleaner.create();

    private final ConnectionPool<T> pool;
    private final PoolSlot<T> slot;
    private final AtomicBoolean released = new AtomicBoolean(false);
    private final Cleaner.Cleanable cleanable;

    PooledConnection(ConnectionPool<T> pool, PoolSlot<T> slot) {
        this.pool = pool;
        this.slot = slot;
        this.cleanable = CLEANER.register(this, new LostConnection<>(pool, slot, released));
    }

    /**
     * Returns the pooled resource.
     *
     * @throws IllegalStateException if this connection was already released
     */
    public T get() {
        if (released.get()) {
            throw new IllegalStateException("Connection was released");
        }
        return slot.resource();
    }

    /**
     * Returns the resource to the pool. It is validated first and discarded if
     * {@link ConnectionManager#isValid(Object)} rejects it.
     */
    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            cleanable.clean();
            pool.release(slot, false);
        }
    }

    /**
     * Returns the resource to the pool for destruction, for example after
     * the caller saw it fail.
     */
    public void invalidate() {
        if (released.compareAndSet(false, true)) {
            cleanable.clean();
            pool.release(slot, true);
        }
    }

    /**
     * Removes the resource from the pool and hands its ownership to the
     * caller, who becomes responsible for tearing it down.
     *
     * @throws IllegalStateException if this connection was already released
     */
    public T detach() {
        if (!released.compareAndSet(false, true)) {
            throw new IllegalStateException("Connection was released");
        }
        cleanable.clean();
        pool.detach(slot);
        return slot.resource();
    }

    public boolean isReleased() {
        return released.get();
    }

    /**
     * Number of times this resource has been handed out, including this one.
     */
    public long getBorrowCount() {
        return slot.pooled().getBorrowedCount();
    }

    /**
     * Invalidates the slot of a connection that was never released. Holds no
     * reference to the connection itself.
     */
    private static final class LostConnection<T> implements Runnable {
        private final ConnectionPool<T> pool;
        private final PoolSlot<T> slot;
        private final AtomicBoolean released;

        private LostConnection(ConnectionPool<T> pool, PoolSlot<T> slot, AtomicBoolean released) {
            this.pool = pool;
            this.slot = slot;
            this.released = released;
        }

        @Override
        public void run() {
            if (released.compareAndSet(false, true)) {
                logger.warn("Pooled resource {} became unreachable without being released, invalidating it",
                        slot.resource());
                pool.release(slot, true);
            }
        }
    }
}
