package hle.lifecycle.pool;

import hle.lifecycle.error.RecoverableException;
import hle.lifecycle.error.RecoveryStrategy;

import java.time.Duration;

/**
 * Exception thrown when a resource cannot be acquired from a {@link ConnectionPool}.
 */
public class PoolException extends RecoverableException {

    /**
     * Reason for the failure.
     */
    public enum Kind {
        /** The pool stayed exhausted for the whole acquire timeout */
        TIMEOUT(RecoveryStrategy.RETRY),
        /** The pool is draining or closed */
        SHUTTING_DOWN(RecoveryStrategy.FAIL),
        /** The connection manager failed to create a resource */
        MANAGER(RecoveryStrategy.FALLBACK),
        /** A freshly created resource failed validation */
        VALIDATION_FAILED(RecoveryStrategy.RETRY);

        private final RecoveryStrategy recoveryStrategy;

        Kind(RecoveryStrategy recoveryStrategy) {
            this.recoveryStrategy = recoveryStrategy;
        }

        public RecoveryStrategy getRecoveryStrategy() {
            return recoveryStrategy;
        }
    }

    private final Kind kind;

    public PoolException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PoolException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static PoolException timeout(Duration timeout) {
        return new PoolException(Kind.TIMEOUT,
                "Timed out after " + timeout.toMillis() + "ms waiting for a pooled resource");
    }

    public static PoolException interrupted(InterruptedException cause) {
        return new PoolException(Kind.TIMEOUT, "Interrupted while waiting for a pooled resource", cause);
    }

    public static PoolException shuttingDown() {
        return new PoolException(Kind.SHUTTING_DOWN, "Pool is shutting down");
    }

    public static PoolException manager(Throwable cause) {
        return new PoolException(Kind.MANAGER, "Connection manager failed: " + cause.getMessage(), cause);
    }

    public static PoolException validationFailed(String message) {
        return new PoolException(Kind.VALIDATION_FAILED, message);
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public RecoveryStrategy recoveryStrategy() {
        return kind.getRecoveryStrategy();
    }
}
