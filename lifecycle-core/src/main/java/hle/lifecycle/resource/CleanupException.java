package hle.lifecycle.resource;

import hle.lifecycle.error.RecoverableException;
import hle.lifecycle.error.RecoveryStrategy;

import java.time.Duration;

/**
 * Exception thrown when a resource cleanup cannot be performed or fails.
 */
public class CleanupException extends RecoverableException {

    /**
     * Reason for the failure.
     */
    public enum Kind {
        /** The cleanup action did not finish within the configured timeout */
        TIMEOUT(RecoveryStrategy.RETRY),
        /** The guard was already consumed */
        ALREADY_CLEANED_UP(RecoveryStrategy.FAIL),
        /** The cleanup action threw */
        FAILED(RecoveryStrategy.FALLBACK),
        /** The registry no longer accepts work */
        SHUTTING_DOWN(RecoveryStrategy.FAIL);

        private final RecoveryStrategy recoveryStrategy;

        Kind(RecoveryStrategy recoveryStrategy) {
            this.recoveryStrategy = recoveryStrategy;
        }

        public RecoveryStrategy getRecoveryStrategy() {
            return recoveryStrategy;
        }
    }

    private final Kind kind;

    public CleanupException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CleanupException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static CleanupException timeout(ResourceId resourceId, Duration timeout) {
        return new CleanupException(Kind.TIMEOUT,
                "Cleanup of resource " + resourceId + " timed out after " + timeout.toMillis() + "ms");
    }

    public static CleanupException alreadyCleanedUp(ResourceId resourceId) {
        return new CleanupException(Kind.ALREADY_CLEANED_UP,
                "Resource " + resourceId + " was already cleaned up");
    }

    public static CleanupException failed(ResourceId resourceId, Throwable cause) {
        return new CleanupException(Kind.FAILED,
                "Cleanup of resource " + resourceId + " failed: " + cause.getMessage(), cause);
    }

    public static CleanupException shuttingDown() {
        return new CleanupException(Kind.SHUTTING_DOWN, "Registry is shutting down");
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public RecoveryStrategy recoveryStrategy() {
        return kind.getRecoveryStrategy();
    }
}
