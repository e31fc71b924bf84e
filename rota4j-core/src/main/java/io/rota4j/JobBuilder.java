package io.rota4j;

import io.rota4j.core.EnqueueResult;
import io.rota4j.core.JobSpec;
import io.rota4j.core.Priority;

import java.time.Instant;

/**
 * Fluent builder for configuring a job before persisting it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory job spec</li>
 *   <li>save(): build() + enqueue; a duplicate unique key is reported, not thrown</li>
 * </ul>
 */
public interface JobBuilder<T> {

    /**
     * Set the dedup key. At most one non-discarded job exists per (kind, uniqueKey).
     */
    JobBuilder<T> uniqueKey(String uniqueKey);

    /**
     * Override the worker's default queue.
     */
    JobBuilder<T> queue(String queue);

    JobBuilder<T> priority(Priority priority);

    JobBuilder<T> priority(int priority);

    JobBuilder<T> maxAttempts(int maxAttempts);

    /**
     * Do not run before {@code time}.
     */
    JobBuilder<T> schedule(Instant time);

    JobSpec<T> build();

    EnqueueResult save();
}
