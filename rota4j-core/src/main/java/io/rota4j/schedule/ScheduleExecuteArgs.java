package io.rota4j.schedule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Payload of a {@code scheduled_job_execute} job. Timestamps travel as ISO-8601 strings.
 */
public record ScheduleExecuteArgs(
        @JsonProperty("job_id") String scheduleId,
        @JsonProperty("job_name") String scheduleName,
        @JsonProperty("function_name") String target,
        @JsonProperty("scheduled_for") String scheduledFor,
        @JsonProperty("triggered_by") String triggeredBy
) {
    public static ScheduleExecuteArgs of(ScheduleDefinition schedule, Instant scheduledFor, TriggerReason reason) {
        return new ScheduleExecuteArgs(
                schedule.id(),
                schedule.name(),
                schedule.target(),
                scheduledFor.toString(),
                reason.value()
        );
    }

    @JsonIgnore
    public Instant scheduledForInstant() {
        return scheduledFor == null ? null : Instant.parse(scheduledFor);
    }

    @JsonIgnore
    public TriggerReason trigger() {
        return triggeredBy == null ? TriggerReason.SCHEDULED : TriggerReason.fromValue(triggeredBy);
    }
}
