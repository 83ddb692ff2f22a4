package hle.lifecycle.pool;

import org.apache.commons.pool2.PooledObject;
import org.apache.commons.pool2.PooledObjectFactory;
import org.apache.commons.pool2.impl.DefaultPooledObject;

import java.time.Duration;
import java.util.Objects;

/**
 * Adapts an Apache Commons Pool2 {@link PooledObjectFactory} to a
 * {@link ConnectionManager}, so factories written for commons-pool2 can back
 * a {@link ConnectionPool}.
 *
 * <p>Mapping:
 * <ul>
 *   <li>{@code create} → {@code makeObject} then {@code activateObject}</li>
 *   <li>{@code isValid} → {@code validateObject}</li>
 *   <li>{@code recycle} → {@code passivateObject} then {@code activateObject}</li>
 *   <li>{@code destroy} → {@code destroyObject}</li>
 * </ul>
 *
 * @param <T> the type of object the factory produces
 */
public class PooledObjectFactoryManager<T> implements ConnectionManager<T> {

    private final PooledObjectFactory<T> factory;
    private final Duration connectTimeout;

    public PooledObjectFactoryManager(PooledObjectFactory<T> factory, Duration connectTimeout) {
        this.factory = Objects.requireNonNull(factory, "factory cannot be null");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout cannot be null");
    }

    public PooledObjectFactoryManager(PooledObjectFactory<T> factory) {
        this(factory, Duration.ofSeconds(10));
    }

    @Override
    public T create() throws Exception {
        PooledObject<T> pooled = factory.makeObject();
        factory.activateObject(pooled);
        return pooled.getObject();
    }

    @Override
    public boolean isValid(T resource) {
        return factory.validateObject(new DefaultPooledObject<>(resource));
    }

    @Override
    public T recycle(T resource) throws Exception {
        PooledObject<T> pooled = new DefaultPooledObject<>(resource);
        factory.passivateObject(pooled);
        factory.activateObject(pooled);
        return resource;
    }

    @Override
    public Duration connectTimeout() {
        return connectTimeout;
    }

    @Override
    public void destroy(T resource) throws Exception {
        factory.destroyObject(new DefaultPooledObject<>(resource));
    }
}
