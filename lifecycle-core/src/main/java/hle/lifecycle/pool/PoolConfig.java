package hle.lifecycle.pool;

import hle.lifecycle.monitor.Monitor;
import hle.lifecycle.monitor.Monitors;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link ConnectionPool}.
 * Uses the builder pattern for flexible configuration.
 *
 * <p>Values are validated once when {@link Builder#build()} is called and
 * never re-checked at runtime.
 */
public class PoolConfig {

    private final int minSize;
    private final int maxSize;
    private final Duration acquireTimeout;
    private final Duration idleTimeout;
    private final Duration healthCheckInterval;
    private final boolean fairQueue;
    private final String threadNamePrefix;
    private final Monitor monitor;

    private PoolConfig(Builder builder) {
        this.minSize = builder.minSize;
        this.maxSize = builder.maxSize;
        this.acquireTimeout = builder.acquireTimeout;
        this.idleTimeout = builder.idleTimeout;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.fairQueue = builder.fairQueue;
        this.threadNamePrefix = builder.threadNamePrefix;
        this.monitor = builder.monitor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a default configuration suitable for most use cases.
     */
    public static PoolConfig defaultConfig() {
        return builder().build();
    }

    public int getMinSize() {
        return minSize;
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getAcquireTimeout() {
        return acquireTimeout;
    }

    public Duration getIdleTimeout() {
        return idleTimeout;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public boolean isFairQueue() {
        return fairQueue;
    }

    public String getThreadNamePrefix() {
        return threadNamePrefix;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public static class Builder {
        private int minSize = 0;
        private int maxSize = 10;
        private Duration acquireTimeout = Duration.ofSeconds(30);
        private Duration idleTimeout = Duration.ofMinutes(5);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private boolean fairQueue = true;
        private String threadNamePrefix = "connection-pool";
        private Monitor monitor = Monitors.noop();

        private Builder() {}

        /**
         * Number of resources the health check keeps pre-warmed.
         * This is a target, not a guarantee.
         * Default: 0
         */
        public Builder minSize(int minSize) {
            if (minSize < 0) {
                throw new IllegalArgumentException("minSize must be >= 0");
            }
            this.minSize = minSize;
            return this;
        }

        /**
         * Maximum number of resources that may exist at once, idle or in use.
         * Default: 10
         */
        public Builder maxSize(int maxSize) {
            if (maxSize < 1) {
                throw new IllegalArgumentException("maxSize must be >= 1");
            }
            this.maxSize = maxSize;
            return this;
        }

        /**
         * How long {@link ConnectionPool#acquire()} waits when the pool is exhausted.
         * Default: 30 seconds
         */
        public Builder acquireTimeout(Duration acquireTimeout) {
            Objects.requireNonNull(acquireTimeout, "acquireTimeout cannot be null");
            if (acquireTimeout.isNegative()) {
                throw new IllegalArgumentException("acquireTimeout must be >= 0");
            }
            this.acquireTimeout = acquireTimeout;
            return this;
        }

        /**
         * How long a resource may stay idle before it is destroyed.
         * Default: 5 minutes
         */
        public Builder idleTimeout(Duration idleTimeout) {
            Objects.requireNonNull(idleTimeout, "idleTimeout cannot be null");
            if (idleTimeout.isNegative() || idleTimeout.isZero()) {
                throw new IllegalArgumentException("idleTimeout must be positive");
            }
            this.idleTimeout = idleTimeout;
            return this;
        }

        /**
         * How often idle resources are probed with
         * {@link ConnectionManager#isValid(Object)}.
         * Default: 30 seconds
         */
        public Builder healthCheckInterval(Duration healthCheckInterval) {
            Objects.requireNonNull(healthCheckInterval, "healthCheckInterval cannot be null");
            if (healthCheckInterval.isNegative() || healthCheckInterval.isZero()) {
                throw new IllegalArgumentException("healthCheckInterval must be positive");
            }
            this.healthCheckInterval = healthCheckInterval;
            return this;
        }

        /**
         * Whether waiters are served strictly in arrival order (true) or
         * newest first with idle resources open to any caller (false).
         * Default: true
         */
        public Builder fairQueue(boolean fairQueue) {
            this.fairQueue = fairQueue;
            return this;
        }

        /**
         * Prefix for the pool's background thread names.
         * Default: "connection-pool"
         */
        public Builder threadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = Objects.requireNonNull(threadNamePrefix, "threadNamePrefix cannot be null");
            return this;
        }

        public Builder monitor(Monitor monitor) {
            this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
            return this;
        }

        public PoolConfig build() {
            if (minSize > maxSize) {
                throw new IllegalArgumentException("minSize cannot be greater than maxSize");
            }
            return new PoolConfig(this);
        }
    }
}
