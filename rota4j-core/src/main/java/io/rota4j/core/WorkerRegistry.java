package io.rota4j.core;

import io.rota4j.Worker;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed mapping from job kind to its worker. Built once; unknown kinds are rejected.
 */
public class WorkerRegistry {

    private final Map<String, Worker<?>> workersByKind;

    public WorkerRegistry(List<Worker<?>> workers) {
        this.workersByKind = workers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        Worker::kind,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate Worker kind: " + a.kind());
                        }
                ));
    }

    public Worker<?> getRequired(String kind) {
        Worker<?> worker = workersByKind.get(kind);
        if (worker == null) {
            throw new UnknownJobKindException(kind);
        }
        return worker;
    }

    public Optional<Worker<?>> find(String kind) {
        return Optional.ofNullable(workersByKind.get(kind));
    }

    /**
     * Queues declared by the registered workers, sorted by name.
     */
    public Set<String> queues() {
        return workersByKind.values().stream()
                .map(w -> w.options().queue())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public Set<String> kinds() {
        return new TreeSet<>(workersByKind.keySet());
    }
}
