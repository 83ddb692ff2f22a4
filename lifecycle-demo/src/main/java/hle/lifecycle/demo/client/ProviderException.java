package hle.lifecycle.demo.client;

/**
 * Exception thrown when a call to an LLM provider fails.
 */
public class ProviderException extends RuntimeException {

    private final boolean retryable;

    public ProviderException(String message) {
        this(message, false);
    }

    public ProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ProviderException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    /**
     * Returns true if the call may succeed when repeated (rate limit, dropped
     * connection, provider hiccup).
     */
    public boolean isRetryable() {
        return retryable;
    }
}
