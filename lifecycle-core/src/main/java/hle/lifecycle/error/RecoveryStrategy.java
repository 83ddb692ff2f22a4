package hle.lifecycle.error;

/**
 * Hint attached to every error raised by this library telling the caller how
 * to react to it.
 */
public enum RecoveryStrategy {
    /** Retry the operation after a delay */
    RETRY,
    /** Try an alternative resource or code path */
    FALLBACK,
    /** Fail immediately with no recovery */
    FAIL
}
