package io.rota4j.support;

import io.rota4j.JobBuilder;
import io.rota4j.Rota;
import io.rota4j.core.EnqueueResult;
import io.rota4j.core.JobOptions;
import io.rota4j.core.JobSpec;
import io.rota4j.core.UnknownJobKindException;
import io.rota4j.internal.SimpleJobBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link Rota} that records enqueued specs and enforces (kind, uniqueKey) dedup.
 * Shared between "instances" to simulate several processes writing to one store.
 */
public class RecordingRota implements Rota {

    private final Map<String, JobOptions> optionsByKind;
    private final List<JobSpec<?>> enqueued = new CopyOnWriteArrayList<>();
    private final Set<String> keys = ConcurrentHashMap.newKeySet();
    private final AtomicInteger ids = new AtomicInteger();
    private volatile RuntimeException failure;

    public RecordingRota(Map<String, JobOptions> optionsByKind) {
        this.optionsByKind = Map.copyOf(optionsByKind);
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    @Override
    public void start() {
    }

    @Override
    public void stop() {
    }

    @Override
    public <T> JobBuilder<T> create(String kind, T args) {
        JobOptions options = optionsByKind.get(kind);
        if (options == null) {
            throw new UnknownJobKindException(kind);
        }
        return new SimpleJobBuilder<>(kind, args, options, this::persist);
    }

    @Override
    public <T> JobBuilder<T> schedule(String kind, Instant time, T args) {
        return create(kind, args).schedule(time);
    }

    @Override
    public <T> EnqueueResult now(String kind, T args) {
        return create(kind, args).save();
    }

    public List<JobSpec<?>> enqueued() {
        return new ArrayList<>(enqueued);
    }

    @SuppressWarnings("unchecked")
    public <T> List<JobSpec<T>> enqueued(String kind, Class<T> argsType) {
        List<JobSpec<T>> out = new ArrayList<>();
        for (JobSpec<?> spec : enqueued) {
            if (spec.kind().equals(kind) && argsType.isInstance(spec.args())) {
                out.add((JobSpec<T>) spec);
            }
        }
        return out;
    }

    private <T> EnqueueResult persist(JobSpec<T> spec) {
        RuntimeException f = failure;
        if (f != null) {
            throw f;
        }
        if (spec.uniqueKey() != null && !keys.add(spec.kind() + "|" + spec.uniqueKey())) {
            return EnqueueResult.duplicate();
        }
        enqueued.add(spec);
        return EnqueueResult.createdResult("job-" + ids.incrementAndGet());
    }
}
