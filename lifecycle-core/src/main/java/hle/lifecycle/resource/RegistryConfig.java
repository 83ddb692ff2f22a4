package hle.lifecycle.resource;

import hle.lifecycle.monitor.Monitor;
import hle.lifecycle.monitor.Monitors;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for {@link ResourceRegistry}.
 * Use {@link #builder()} to create instances.
 */
public final class RegistryConfig {

    private final Duration cleanupTimeout;
    private final Duration shutdownGracePeriod;
    private final String workerThreadName;
    private final Monitor monitor;

    private RegistryConfig(Builder builder) {
        this.cleanupTimeout = builder.cleanupTimeout;
        this.shutdownGracePeriod = builder.shutdownGracePeriod;
        this.workerThreadName = builder.workerThreadName;
        this.monitor = builder.monitor;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RegistryConfig defaultConfig() {
        return builder().build();
    }

    public Duration getCleanupTimeout() {
        return cleanupTimeout;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public String getWorkerThreadName() {
        return workerThreadName;
    }

    public Monitor getMonitor() {
        return monitor;
    }

    public static final class Builder {
        private Duration cleanupTimeout = Duration.ofSeconds(30);
        private Duration shutdownGracePeriod = Duration.ofSeconds(5);
        private String workerThreadName = "resource-cleanup";
        private Monitor monitor = Monitors.noop();

        private Builder() {
        }

        /**
         * Upper bound for a single background cleanup action.
         * Default: 30 seconds
         */
        public Builder cleanupTimeout(Duration cleanupTimeout) {
            Objects.requireNonNull(cleanupTimeout, "cleanupTimeout cannot be null");
            if (cleanupTimeout.isNegative() || cleanupTimeout.isZero()) {
                throw new IllegalArgumentException("cleanupTimeout must be positive");
            }
            this.cleanupTimeout = cleanupTimeout;
            return this;
        }

        /**
         * How long shutdown waits for the worker thread to stop.
         * Default: 5 seconds
         */
        public Builder shutdownGracePeriod(Duration shutdownGracePeriod) {
            Objects.requireNonNull(shutdownGracePeriod, "shutdownGracePeriod cannot be null");
            if (shutdownGracePeriod.isNegative()) {
                throw new IllegalArgumentException("shutdownGracePeriod must be >= 0");
            }
            this.shutdownGracePeriod = shutdownGracePeriod;
            return this;
        }

        /**
         * Name of the background worker thread.
         * Default: "resource-cleanup"
         */
        public Builder workerThreadName(String workerThreadName) {
            this.workerThreadName = Objects.requireNonNull(workerThreadName, "workerThreadName cannot be null");
            return this;
        }

        public Builder monitor(Monitor monitor) {
            this.monitor = Objects.requireNonNull(monitor, "monitor cannot be null");
            return this;
        }

        public RegistryConfig build() {
            return new RegistryConfig(this);
        }
    }
}
