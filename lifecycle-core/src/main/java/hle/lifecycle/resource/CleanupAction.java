package hle.lifecycle.resource;

/**
 * Teardown logic bound to one guarded resource.
 *
 * @param <T> the type of resource released by this action
 */
@FunctionalInterface
public interface CleanupAction<T> {

    /**
     * Releases the resource. Any exception is reported as a failed cleanup.
     */
    void cleanup(T resource) throws Exception;
}
