package io.rota4j.schedule;

import java.time.Instant;
import java.util.List;

/**
 * Append-only run history.
 */
public interface ScheduleRunRepository {

    /**
     * @return id of the new run record
     */
    String start(ScheduleRun run);

    void complete(String runId, Instant completedAt, long durationMs, boolean success, String message);

    /**
     * Most recent first.
     */
    List<ScheduleRun> findBySchedule(String scheduleId, int limit);
}
