package io.rota4j.schedule;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

class InMemoryScheduleStore implements ScheduleRepository, ScheduleRunRepository {

    private final Map<String, ScheduleDefinition> schedules = new ConcurrentHashMap<>();
    private final Map<String, ScheduleRun> runs = new ConcurrentHashMap<>();
    private final AtomicInteger runIds = new AtomicInteger();

    void put(ScheduleDefinition definition) {
        schedules.put(definition.id(), definition);
    }

    ScheduleDefinition get(String id) {
        return schedules.get(id);
    }

    @Override
    public List<ScheduleDefinition> findEnabled() {
        return schedules.values().stream()
                .filter(ScheduleDefinition::enabled)
                .sorted(Comparator.comparing(ScheduleDefinition::id))
                .toList();
    }

    @Override
    public Optional<ScheduleDefinition> findById(String id) {
        return Optional.ofNullable(schedules.get(id));
    }

    @Override
    public boolean advanceLastRunAt(String id, Instant runAt) {
        boolean[] moved = {false};
        schedules.computeIfPresent(id, (k, s) -> {
            if (s.lastRunAt() != null && !runAt.isAfter(s.lastRunAt())) {
                return s;
            }
            moved[0] = true;
            return new ScheduleDefinition(s.id(), s.name(), s.target(), s.cronExpression(), s.timezone(),
                    s.enabled(), runAt, s.createdAt());
        });
        return moved[0];
    }

    @Override
    public String start(ScheduleRun run) {
        String id = "run-" + runIds.incrementAndGet();
        runs.put(id, new ScheduleRun(id, run.scheduleId(), run.startedAt(), null, null, null, null,
                run.scheduledFor(), run.triggeredBy()));
        return id;
    }

    @Override
    public void complete(String runId, Instant completedAt, long durationMs, boolean success, String message) {
        runs.computeIfPresent(runId, (k, r) -> r.isCompleted() ? r : new ScheduleRun(r.id(), r.scheduleId(),
                r.startedAt(), completedAt, durationMs, success, message, r.scheduledFor(), r.triggeredBy()));
    }

    @Override
    public List<ScheduleRun> findBySchedule(String scheduleId, int limit) {
        List<ScheduleRun> out = new ArrayList<>();
        for (ScheduleRun r : runs.values()) {
            if (r.scheduleId().equals(scheduleId)) {
                out.add(r);
            }
        }
        out.sort(Comparator.comparing(ScheduleRun::startedAt).thenComparing(ScheduleRun::id).reversed());
        return out.size() > limit ? out.subList(0, limit) : out;
    }
}
