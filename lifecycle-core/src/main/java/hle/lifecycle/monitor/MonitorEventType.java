package hle.lifecycle.monitor;

/**
 * Kinds of structured events emitted to a {@link Monitor}.
 */
public enum MonitorEventType {
    RESOURCE_CREATED,
    RESOURCE_CLEANUP,
    POOL_RESOURCE_CREATED,
    POOL_RESOURCE_DISCARDED,
    CACHE_EVICTION,
    CACHE_EXPIRATION
}
