package io.rota4j;

import io.rota4j.core.EnqueueResult;

import java.time.Instant;

/**
 * Main job queue API.
 *
 * <p>Jobs are addressed by {@code kind}; the registered {@link Worker} for that kind supplies the
 * default queue, priority and attempt ceiling. Enqueueing a kind with no registered worker fails
 * immediately with {@link io.rota4j.core.UnknownJobKindException}.
 */
public interface Rota {
    void start();

    void stop();

    /**
     * Create a job builder. This does not persist until save() is called.
     */
    <T> JobBuilder<T> create(String kind, T args);

    /**
     * Schedule a one-time job at an absolute time.
     */
    <T> JobBuilder<T> schedule(String kind, Instant time, T args);

    /**
     * Create and persist a job that is due immediately.
     */
    <T> EnqueueResult now(String kind, T args);
}
