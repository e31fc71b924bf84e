package io.rota4j.schedule;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

public class ScheduledTaskRegistry {

    private final Map<String, ScheduledTask> tasksByTarget;

    public ScheduledTaskRegistry(List<ScheduledTask> tasks) {
        this.tasksByTarget = tasks.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ScheduledTask::target,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate ScheduledTask target: " + a.target());
                        }
                ));
    }

    public Optional<ScheduledTask> find(String target) {
        return Optional.ofNullable(tasksByTarget.get(target));
    }

    public boolean contains(String target) {
        return tasksByTarget.containsKey(target);
    }
}
