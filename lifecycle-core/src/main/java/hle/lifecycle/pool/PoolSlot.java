package hle.lifecycle.pool;

import org.apache.commons.pool2.impl.DefaultPooledObject;

/**
 * One pooled resource with its allocation bookkeeping.
 */
final class PoolSlot<T> {

    private final DefaultPooledObject<T> pooled;
    private volatile long lastCheckedNanos;

    PoolSlot(T resource) {
        this.pooled = new DefaultPooledObject<>(resource);
        this.lastCheckedNanos = System.nanoTime();
    }

    T resource() {
        return pooled.getObject();
    }

    DefaultPooledObject<T> pooled() {
        return pooled;
    }

    long lastCheckedNanos() {
        return lastCheckedNanos;
    }

    void markChecked() {
        lastCheckedNanos = System.nanoTime();
    }
}
