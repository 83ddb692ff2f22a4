package hle.lifecycle.error;

/**
 * Unified error type of the hosting agent framework.
 * Every error raised by the pool, registry and guard can be converted into
 * this type through {@link RecoverableException#toFrameworkException()}.
 */
public class FrameworkException extends RuntimeException {

    /**
     * Coarse error categories understood by the host framework.
     */
    public enum Category {
        /** A pooled or guarded resource could not be obtained or released */
        RESOURCE_EXHAUSTED,
        /** Any other execution failure */
        EXECUTION
    }

    private final Category category;
    private final RecoveryStrategy recoveryStrategy;

    public FrameworkException(Category category, String message, Throwable cause,
                              RecoveryStrategy recoveryStrategy) {
        super(message, cause);
        this.category = category;
        this.recoveryStrategy = recoveryStrategy;
    }

    public static FrameworkException resourceExhausted(String message, Throwable cause,
                                                       RecoveryStrategy recoveryStrategy) {
        return new FrameworkException(Category.RESOURCE_EXHAUSTED, message, cause, recoveryStrategy);
    }

    public Category getCategory() {
        return category;
    }

    public RecoveryStrategy getRecoveryStrategy() {
        return recoveryStrategy;
    }
}
