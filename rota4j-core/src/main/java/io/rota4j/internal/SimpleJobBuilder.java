package io.rota4j.internal;

import io.rota4j.JobBuilder;
import io.rota4j.core.EnqueueResult;
import io.rota4j.core.JobOptions;
import io.rota4j.core.JobSpec;
import io.rota4j.core.Priority;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation, seeded with the worker's {@link JobOptions}.
 */
public class SimpleJobBuilder<T> implements JobBuilder<T> {

    private final String kind;
    private final T args;
    private final Function<JobSpec<T>, EnqueueResult> persister;

    private String uniqueKey;
    private String queue;
    private int priority;
    private int maxAttempts;
    private Instant scheduledAt;

    public SimpleJobBuilder(String kind, T args, JobOptions defaults, Function<JobSpec<T>, EnqueueResult> persister) {
        this.kind = Objects.requireNonNull(kind, "job kind must not be null");
        Objects.requireNonNull(defaults, "defaults must not be null");
        this.args = args;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        this.queue = defaults.queue();
        this.priority = defaults.priority();
        this.maxAttempts = defaults.maxAttempts();
    }

    @Override
    public JobBuilder<T> uniqueKey(String uniqueKey) {
        Objects.requireNonNull(uniqueKey, "uniqueKey must not be null");
        if (uniqueKey.isBlank()) throw new IllegalArgumentException("uniqueKey must not be blank");

        this.uniqueKey = uniqueKey;
        return this;
    }

    @Override
    public JobBuilder<T> queue(String queue) {
        Objects.requireNonNull(queue, "queue must not be null");
        if (queue.isBlank()) throw new IllegalArgumentException("queue must not be blank");

        this.queue = queue;
        return this;
    }

    @Override
    public JobBuilder<T> priority(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        this.priority = priority.value();
        return this;
    }

    @Override
    public JobBuilder<T> priority(int priority) {
        this.priority = priority;
        return this;
    }

    @Override
    public JobBuilder<T> maxAttempts(int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        return this;
    }

    @Override
    public JobBuilder<T> schedule(Instant time) {
        this.scheduledAt = Objects.requireNonNull(time, "time must not be null");
        return this;
    }

    @Override
    public JobSpec<T> build() {
        Instant at = scheduledAt != null ? scheduledAt : Instant.now();
        return new JobSpec<>(kind, uniqueKey, queue, priority, maxAttempts, at, args);
    }

    @Override
    public EnqueueResult save() {
        return persister.apply(build());
    }
}
