package io.rota4j.core;

/**
 * Outcome of an enqueue. {@code duplicate} means a non-discarded job with the same
 * (kind, uniqueKey) already existed and nothing was written.
 */
public record EnqueueResult(
        boolean created,
        String jobId
) {
    public static EnqueueResult createdResult(String jobId) {
        return new EnqueueResult(true, jobId);
    }

    public static EnqueueResult duplicate() {
        return new EnqueueResult(false, null);
    }

    public boolean isDuplicate() {
        return !created;
    }
}
