package hle.lifecycle.error;

/**
 * Base class for the pool and cleanup error taxonomies.
 * Subclasses map each of their error kinds onto a {@link RecoveryStrategy}.
 */
public abstract class RecoverableException extends RuntimeException {

    protected RecoverableException(String message) {
        super(message);
    }

    protected RecoverableException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns how callers are expected to recover from this error.
     */
    public abstract RecoveryStrategy recoveryStrategy();

    /**
     * Converts this error into the host framework's unified error type.
     */
    public FrameworkException toFrameworkException() {
        return FrameworkException.resourceExhausted(getMessage(), this, recoveryStrategy());
    }
}
