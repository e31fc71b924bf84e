package io.rota4j.schedule;

import java.time.Instant;

/**
 * Code run by a {@link ScheduleDefinition}, looked up by {@link #target()}.
 */
public interface ScheduledTask {

    String target();

    TaskOutcome run(ScheduleDefinition schedule, Instant scheduledFor) throws Exception;
}
