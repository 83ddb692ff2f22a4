package hle.lifecycle.pool;

/**
 * Lifecycle of a {@link ConnectionPool}.
 */
public enum PoolState {
    /** Accepting acquisitions */
    RUNNING,
    /** Shutting down: acquisitions are rejected, returned resources are destroyed */
    DRAINING,
    /** Every resource has been returned and destroyed */
    CLOSED
}
