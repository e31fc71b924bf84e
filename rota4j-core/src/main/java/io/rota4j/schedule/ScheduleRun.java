package io.rota4j.schedule;

import java.time.Instant;

/**
 * One execution attempt of a {@link ScheduleDefinition}. Created when the attempt starts,
 * completed once, never modified afterwards.
 */
public record ScheduleRun(
        String id,
        String scheduleId,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        Boolean success,
        String message,
        Instant scheduledFor,
        TriggerReason triggeredBy
) {
    public static ScheduleRun started(String scheduleId, Instant startedAt, Instant scheduledFor, TriggerReason triggeredBy) {
        return new ScheduleRun(null, scheduleId, startedAt, null, null, null, null, scheduledFor, triggeredBy);
    }

    public boolean isCompleted() {
        return completedAt != null;
    }
}
