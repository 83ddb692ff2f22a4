package hle.lifecycle.pool;

import java.time.Duration;

/**
 * Creates, validates and recycles one type of pooled resource.
 * Implementations hold no pool state; they are supplied once when the
 * {@link ConnectionPool} is constructed and may be called from any thread.
 *
 * <p>Implementations might wrap, for example, HTTP connections to an LLM
 * provider, gRPC channels or database sessions.
 *
 * @param <T> the type of resource this manager creates
 */
public interface ConnectionManager<T> {

    /**
     * Creates a new resource. The pool bounds this call with
     * {@link #connectTimeout()}.
     *
     * @return a new, non-null resource
     * @throws Exception if the resource cannot be created
     */
    T create() throws Exception;

    /**
     * Checks whether a resource is still usable. Called when a resource is
     * returned and by the periodic health check.
     */
    boolean isValid(T resource);

    /**
     * Prepares a returned resource for its next user, for instance by
     * clearing per-request state. The returned object goes back into the pool
     * in place of the argument.
     */
    default T recycle(T resource) throws Exception {
        return resource;
    }

    /**
     * Maximum time a single {@link #create()} call may take.
     * Default: 10 seconds
     */
    default Duration connectTimeout() {
        return Duration.ofSeconds(10);
    }

    /**
     * Tears down a resource that the pool discards. By default closes
     * resources that implement {@link AutoCloseable}.
     */
    default void destroy(T resource) throws Exception {
        if (resource instanceof AutoCloseable) {
            ((AutoCloseable) resource).close();
        }
    }
}
