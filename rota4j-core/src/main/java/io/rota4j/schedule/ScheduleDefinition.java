package io.rota4j.schedule;

import java.time.Instant;

/**
 * A task executed on a cron cadence.
 *
 * @param target         identifier of the {@link ScheduledTask} to run
 * @param cronExpression standard 5-field cron (6-field with seconds also accepted)
 * @param timezone       IANA zone the cron expression is evaluated in; invalid values fall back to UTC
 * @param lastRunAt      occurrence time of the latest executed run, null if never run
 */
public record ScheduleDefinition(
        String id,
        String name,
        String target,
        String cronExpression,
        String timezone,
        boolean enabled,
        Instant lastRunAt,
        Instant createdAt
) {
}
