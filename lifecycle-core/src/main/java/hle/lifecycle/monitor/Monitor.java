package hle.lifecycle.monitor;

/**
 * Observability sink that receives lifecycle events from pools, registries
 * and caches. Implementations live outside this library; see {@link Monitors}
 * for the trivial ones shipped here.
 *
 * <p>Implementations must be thread-safe. They are called from worker threads
 * and from caller threads alike.
 */
public interface Monitor {

    /**
     * Name used when logging monitor failures.
     */
    String name();

    /**
     * Records one event. Exceptions thrown here are logged by the caller and
     * otherwise ignored.
     */
    void recordEvent(MonitorEvent event);
}
