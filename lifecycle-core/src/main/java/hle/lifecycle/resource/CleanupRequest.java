package hle.lifecycle.resource;

import java.util.Comparator;

/**
 * A queued cleanup waiting for the registry's background worker.
 * Requests are served highest priority first and in submission order within
 * one priority.
 */
public final class CleanupRequest {

    /**
     * Runs the bound cleanup action.
     */
    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    static final Comparator<CleanupRequest> SERVICE_ORDER =
            Comparator.comparing(CleanupRequest::getPriority).reversed()
                    .thenComparingLong(CleanupRequest::getSequence);

    private final ResourceId resourceId;
    private final Task task;
    private final CleanupPriority priority;
    private final long sequence;
    private final long enqueuedAtNanos;

    CleanupRequest(ResourceId resourceId, Task task, CleanupPriority priority, long sequence) {
        this.resourceId = resourceId;
        this.task = task;
        this.priority = priority;
        this.sequence = sequence;
        this.enqueuedAtNanos = System.nanoTime();
    }

    public ResourceId getResourceId() {
        return resourceId;
    }

    public Task getTask() {
        return task;
    }

    public CleanupPriority getPriority() {
        return priority;
    }

    public long getSequence() {
        return sequence;
    }

    public long getEnqueuedAtNanos() {
        return enqueuedAtNanos;
    }

    @Override
    public String toString() {
        return String.format("CleanupRequest[resourceId=%s, priority=%s, sequence=%d]",
                resourceId, priority, sequence);
    }
}
