package hle.lifecycle.demo.client;

import hle.lifecycle.pool.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Opens and health-checks {@link SimulatedProviderConnection}s for a
 * {@link hle.lifecycle.pool.ConnectionPool}.
 */
public class ProviderConnectionManager implements ConnectionManager<SimulatedProviderConnection> {

    private static final Logger logger = LoggerFactory.getLogger(ProviderConnectionManager.class);

    private final SimulatedProviderConnection.Builder connections;
    private final Duration connectTimeout;
    private final AtomicInteger opened = new AtomicInteger(0);
    private final AtomicInteger closed = new AtomicInteger(0);

    /**
     * @param connections    template for every connection this manager opens
     * @param connectTimeout bound on opening a single connection
     */
    public ProviderConnectionManager(SimulatedProviderConnection.Builder connections, Duration connectTimeout) {
        this.connections = Objects.requireNonNull(connections, "connections cannot be null");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
    }

    public ProviderConnectionManager(SimulatedProviderConnection.Builder connections) {
        this(connections, Duration.ofSeconds(5));
    }

    @Override
    public SimulatedProviderConnection create() {
        SimulatedProviderConnection connection = connections.build();
        opened.incrementAndGet();
        logger.debug("Opened provider connection {} to {}", connection.getId(), connection.getEndpoint());
        return connection;
    }

    @Override
    public boolean isValid(SimulatedProviderConnection connection) {
        return connection.isHealthy();
    }

    @Override
    public Duration connectTimeout() {
        return connectTimeout;
    }

    @Override
    public void destroy(SimulatedProviderConnection connection) {
        connection.close();
        closed.incrementAndGet();
    }

    /**
     * Number of connections opened so far.
     */
    public int getOpenedCount() {
        return opened.get();
    }

    /**
     * Number of connections closed by the pool so far.
     */
    public int getClosedCount() {
        return closed.get();
    }
}
