package hle.lifecycle.demo.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Random;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A simulated connection to an LLM provider for demos and tests.
 * Each call blocks for a configurable latency and fails at a configurable rate.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable response time (simulates network and inference latency)</li>
 *   <li>Configurable failure rate (simulates provider errors)</li>
 *   <li>Optional request budget after which the connection goes stale</li>
 *   <li>Thread-safe request counter</li>
 * </ul>
 */
public class SimulatedProviderConnection implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedProviderConnection.class);

    private static final AtomicInteger GLOBAL_REQUEST_COUNT = new AtomicInteger(0);

    private final String id;
    private final String endpoint;
    private final String model;
    private final long minLatencyMs;
    private final long maxLatencyMs;
    private final double failureRate;
    private final int maxRequests;
    private final Random random;
    private final AtomicBoolean open = new AtomicBoolean(true);
    private final AtomicInteger requestCount = new AtomicInteger(0);

    private SimulatedProviderConnection(Builder builder) {
        this.id = "llm-conn-" + UUID.randomUUID().toString().substring(0, 8);
        this.endpoint = builder.endpoint;
        this.model = builder.model;
        this.minLatencyMs = builder.minLatencyMs;
        this.maxLatencyMs = builder.maxLatencyMs;
        this.failureRate = builder.failureRate;
        this.maxRequests = builder.maxRequests;
        this.random = builder.seed != null ? new Random(builder.seed) : new Random();
        logger.debug("[{}] Opened connection to {}", id, endpoint);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Sends a prompt and blocks until the completion arrives.
     *
     * @throws ProviderException if the connection is closed, the call is
     *                           interrupted or the provider fails
     */
    public String send(String prompt) {
        if (!open.get()) {
            throw new ProviderException("Connection " + id + " is closed", true);
        }

        int globalCount = GLOBAL_REQUEST_COUNT.incrementAndGet();
        int localCount = requestCount.incrementAndGet();
        logger.trace("[{}] Sending request #{} (global: #{}) on {}", id, localCount, globalCount,
                Thread.currentThread().getName());

        long latency = minLatencyMs + (long) (nextDouble() * (maxLatencyMs - minLatencyMs));
        try {
            Thread.sleep(latency);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Request interrupted", e, true);
        }

        if (nextDouble() < failureRate) {
            logger.debug("[{}] Simulated provider error for request #{}", id, localCount);
            throw new ProviderException("Simulated provider error for prompt: " + prompt, true);
        }

        return String.format("Completion[model=%s, connection=%s, prompt=%s, latency=%dms]",
                model, id, prompt, latency);
    }

    private double nextDouble() {
        synchronized (random) {
            return random.nextDouble();
        }
    }

    /**
     * A connection is healthy while it is open and has not used up its request budget.
     */
    public boolean isHealthy() {
        return open.get() && (maxRequests <= 0 || requestCount.get() < maxRequests);
    }

    public boolean isOpen() {
        return open.get();
    }

    @Override
    public void close() {
        if (open.compareAndSet(true, false)) {
            logger.debug("[{}] Closed after {} requests", id, requestCount.get());
        }
    }

    public String getId() {
        return id;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public int getRequestCount() {
        return requestCount.get();
    }

    /**
     * Gets the request count across all connections.
     */
    public static int getGlobalRequestCount() {
        return GLOBAL_REQUEST_COUNT.get();
    }

    /**
     * Resets the global request counter (for testing).
     */
    public static void resetGlobalCounter() {
        GLOBAL_REQUEST_COUNT.set(0);
    }

    @Override
    public String toString() {
        return id;
    }

    /**
     * Builder for creating SimulatedProviderConnection with fluent API.
     * A builder can be reused to open any number of connections.
     */
    public static class Builder {
        private String endpoint = "https://llm.local/v1/completions";
        private String model = "sim-small";
        private long minLatencyMs = 50;
        private long maxLatencyMs = 200;
        private double failureRate = 0.05;
        private int maxRequests = 0;
        private Long seed;

        private Builder() {}

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder latency(long minMs, long maxMs) {
            if (minMs < 0 || maxMs < minMs) {
                throw new IllegalArgumentException("latency range must satisfy 0 <= min <= max");
            }
            this.minLatencyMs = minMs;
            this.maxLatencyMs = maxMs;
            return this;
        }

        public Builder failureRate(double rate) {
            if (rate < 0.0 || rate > 1.0) {
                throw new IllegalArgumentException("failureRate must be between 0.0 and 1.0");
            }
            this.failureRate = rate;
            return this;
        }

        /**
         * Number of requests after which the connection reports itself unhealthy.
         * Default: 0 (unlimited)
         */
        public Builder maxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
            return this;
        }

        /**
         * Seed for latency and failure draws, for reproducible runs.
         */
        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public SimulatedProviderConnection build() {
            return new SimulatedProviderConnection(this);
        }
    }
}
