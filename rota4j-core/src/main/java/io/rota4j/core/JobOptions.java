package io.rota4j.core;

import java.util.Objects;

/**
 * Queue, priority and attempt ceiling declared by a worker for its kind.
 */
public record JobOptions(
        String queue,
        int priority,
        int maxAttempts
) {
    public static final String DEFAULT_QUEUE = "default";

    public JobOptions {
        Objects.requireNonNull(queue, "queue must not be null");
        if (queue.isBlank()) {
            throw new IllegalArgumentException("queue must not be blank");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
    }

    public static JobOptions of(String queue, Priority priority, int maxAttempts) {
        Objects.requireNonNull(priority, "priority must not be null");
        return new JobOptions(queue, priority.value(), maxAttempts);
    }

    public static JobOptions defaults() {
        return new JobOptions(DEFAULT_QUEUE, Priority.NORMAL.value(), 25);
    }
}
