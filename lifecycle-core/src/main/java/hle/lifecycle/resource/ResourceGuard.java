package hle.lifecycle.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.Cleaner;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Exclusively owns one resource together with the action that releases it,
 * and guarantees that the action runs at most once.
 *
 * <p>A guard ends in exactly one of these ways:
 * <ul>
 *   <li>{@link #cleanup()}: the preferred path. The action runs on the calling
 *       thread and any failure is thrown to the caller as a
 *       {@link CleanupException}. Use it whenever the outcome matters.</li>
 *   <li>{@link #close()}: scope exit, typically through try-with-resources.
 *       The action is handed to the registry's background worker at the
 *       guard's drop priority. <strong>The caller cannot observe the
 *       outcome</strong>: failures and timeouts are logged and reported to
 *       the registry's monitor, never retried and never thrown.</li>
 *   <li>{@link #intoInner()}: the caller takes the resource back and the
 *       action never runs.</li>
 *   <li>Garbage collection of a guard that was never closed: a
 *       {@link Cleaner} schedules the action exactly like {@link #close()}.
 *       This is a safety net only and logs a warning; it may run late or,
 *       if the JVM exits first, not at all.</li>
 * </ul>
 *
 * <pre>{@code
 * ResourceGuard<HttpClient> guard = ResourceGuard.builder(registry, client, HttpClient::shutdown)
 *         .typeName("openai-client")
 *         .build();
 * try {
 *     guard.get().send(request);
 * } finally {
 *     guard.cleanup();
 * }
 * }</pre>
 *
 * @param <T> the type of the guarded resource
 */
public final class ResourceGuard<T> implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ResourceGuard.class);

    private static final Cleaner CLEANER = Cleaner.create();

    private final State<T> state;
    private final Cleaner.Cleanable cleanable;

    private ResourceGuard(Builder<T> builder) {
        ResourceId resourceId = ResourceId.generate();
        ResourceInfo.Builder info = ResourceInfo.builder(builder.typeName).metadata(builder.metadata);
        if (builder.sizeHint != null) {
            info.sizeBytes(builder.sizeHint);
        }

        this.state = new State<>(resourceId, builder.typeName, builder.registry, builder.action,
                builder.dropPriority, builder.resource);
        builder.registry.register(resourceId, info.build(), state::reclaim);
        this.cleanable = CLEANER.register(this, state);
    }

    /**
     * Guards a resource with default settings: the type name is the resource's
     * simple class name and implicit releases run at NORMAL priority.
     *
     * @throws CleanupException with kind SHUTTING_DOWN if the registry is shut down
     */
    public static <T> ResourceGuard<T> of(ResourceRegistry registry, T resource, CleanupAction<? super T> action) {
        return builder(registry, resource, action).build();
    }

    public static <T> Builder<T> builder(ResourceRegistry registry, T resource, CleanupAction<? super T> action) {
        return new Builder<>(registry, resource, action);
    }

    /**
     * Returns the guarded resource.
     *
     * @throws IllegalStateException if the guard was already consumed
     */
    public T get() {
        T resource = state.resource.get();
        if (resource == null) {
            throw new IllegalStateException("Resource was consumed");
        }
        return resource;
    }

    /**
     * Gives the resource back to the caller without running the cleanup
     * action. The resource is no longer tracked by the registry.
     *
     * @throws IllegalStateException if the guard was already consumed
     */
    public T intoInner() {
        T resource = state.take();
        if (resource == null) {
            throw new IllegalStateException("Resource was consumed");
        }
        cleanable.clean();
        state.registry.unregister(state.resourceId);
        return resource;
    }

    /**
     * Runs the cleanup action on the calling thread and removes the resource
     * from the registry.
     *
     * @throws CleanupException with kind FAILED if the action throws, or
     *                          ALREADY_CLEANED_UP if the guard was already consumed
     */
    public void cleanup() {
        T resource = state.take();
        if (resource == null) {
            throw CleanupException.alreadyCleanedUp(state.resourceId);
        }
        cleanable.clean();
        state.registry.runCleanup(state.resourceId, () -> state.action.cleanup(resource), state.dropPriority);
    }

    /**
     * Hands the cleanup action to the registry's background worker.
     * Does nothing if the guard was already consumed. See the class
     * documentation for why failures are not reported here.
     */
    @Override
    public void close() {
        T resource = state.take();
        if (resource != null) {
            cleanable.clean();
            state.scheduleRelease(resource);
        }
    }

    public ResourceId resourceId() {
        return state.resourceId;
    }

    public boolean isConsumed() {
        return state.resource.get() == null;
    }

    public CleanupPriority dropPriority() {
        return state.dropPriority;
    }

    @Override
    public String toString() {
        return String.format("ResourceGuard[id=%s, type=%s, consumed=%s]",
                state.resourceId, state.typeName, isConsumed());
    }

    /**
     * Everything the cleaner needs, held apart from the guard so that the guard
     * itself can become unreachable.
     */
    private static final class State<T> implements Runnable {
        private final ResourceId resourceId;
        private final String typeName;
        private final ResourceRegistry registry;
        private final CleanupAction<? super T> action;
        private final CleanupPriority dropPriority;
        private final AtomicReference<T> resource;

        private State(ResourceId resourceId, String typeName, ResourceRegistry registry,
                      CleanupAction<? super T> action, CleanupPriority dropPriority, T resource) {
            this.resourceId = resourceId;
            this.typeName = typeName;
            this.registry = registry;
            this.action = action;
            this.dropPriority = dropPriority;
            this.resource = new AtomicReference<>(resource);
        }

        private T take() {
            return resource.getAndSet(null);
        }

        private Optional<CleanupRequest.Task> reclaim() {
            T taken = take();
            if (taken == null) {
                return Optional.empty();
            }
            return Optional.of(() -> action.cleanup(taken));
        }

        private void scheduleRelease(T taken) {
            CleanupRequest.Task task = () -> action.cleanup(taken);
            if (!registry.scheduleCleanup(resourceId, task, dropPriority)) {
                try {
                    registry.runCleanup(resourceId, task, dropPriority);
                } catch (CleanupException e) {
                    // already logged and reported by the registry
                    logger.debug("Inline release of {} failed after registry shutdown", resourceId);
                }
            }
        }

        @Override
        public void run() {
            T taken = take();
            if (taken != null) {
                logger.warn("ResourceGuard {} (type: {}) became unreachable without being released, "
                        + "scheduling cleanup", resourceId, typeName);
                scheduleRelease(taken);
            }
        }
    }

    public static final class Builder<T> {
        private final ResourceRegistry registry;
        private final T resource;
        private final CleanupAction<? super T> action;
        private String typeName;
        private Long sizeHint;
        private final Map<String, String> metadata = new LinkedHashMap<>();
        private CleanupPriority dropPriority = CleanupPriority.defaultPriority();

        private Builder(ResourceRegistry registry, T resource, CleanupAction<? super T> action) {
            this.registry = Objects.requireNonNull(registry, "registry cannot be null");
            this.resource = Objects.requireNonNull(resource, "resource cannot be null");
            this.action = Objects.requireNonNull(action, "action cannot be null");
            this.typeName = resource.getClass().getSimpleName();
        }

        public Builder<T> typeName(String typeName) {
            this.typeName = Objects.requireNonNull(typeName, "typeName cannot be null");
            return this;
        }

        public Builder<T> sizeHint(long sizeBytes) {
            if (sizeBytes < 0) {
                throw new IllegalArgumentException("sizeHint must be >= 0");
            }
            this.sizeHint = sizeBytes;
            return this;
        }

        public Builder<T> metadata(String key, String value) {
            metadata.put(key, value);
            return this;
        }

        /**
         * Priority used when the guard is released through {@link ResourceGuard#close()}
         * or garbage collection.
         * Default: NORMAL
         */
        public Builder<T> dropPriority(CleanupPriority dropPriority) {
            this.dropPriority = Objects.requireNonNull(dropPriority, "dropPriority cannot be null");
            return this;
        }

        /**
         * Registers the resource and returns its guard.
         *
         * @throws CleanupException with kind SHUTTING_DOWN if the registry is shut down
         */
        public ResourceGuard<T> build() {
            return new ResourceGuard<>(this);
        }
    }
}
