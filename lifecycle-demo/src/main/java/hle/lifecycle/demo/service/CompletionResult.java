package hle.lifecycle.demo.service;

import java.time.Duration;
import java.util.Optional;

/**
 * Outcome of one prompt submitted through {@link CachingProviderService#completeAll}.
 */
public final class CompletionResult {

    private final String prompt;
    private final String completion;
    private final RuntimeException failure;
    private final Duration duration;

    private CompletionResult(String prompt, String completion, RuntimeException failure, Duration duration) {
        this.prompt = prompt;
        this.completion = completion;
        this.failure = failure;
        this.duration = duration;
    }

    static CompletionResult success(String prompt, String completion, Duration duration) {
        return new CompletionResult(prompt, completion, null, duration);
    }

    static CompletionResult failure(String prompt, RuntimeException failure, Duration duration) {
        return new CompletionResult(prompt, null, failure, duration);
    }

    public String getPrompt() {
        return prompt;
    }

    public Optional<String> getCompletion() {
        return Optional.ofNullable(completion);
    }

    public Optional<RuntimeException> getFailure() {
        return Optional.ofNullable(failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Duration getDuration() {
        return duration;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? String.format("CompletionResult[prompt=%s, ok, %dms]", prompt, duration.toMillis())
                : String.format("CompletionResult[prompt=%s, failed: %s]", prompt, failure.getMessage());
    }
}
