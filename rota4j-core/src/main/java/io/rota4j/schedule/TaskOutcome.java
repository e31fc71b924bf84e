package io.rota4j.schedule;

import java.util.Map;

/**
 * Result reported by a {@link ScheduledTask}. A reported failure is recorded on the run
 * but does not fail the job; throw to request a retry.
 */
public record TaskOutcome(
        boolean success,
        String message,
        Map<String, Object> details
) {
    public TaskOutcome {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static TaskOutcome success(String message) {
        return new TaskOutcome(true, message, Map.of());
    }

    public static TaskOutcome failure(String message) {
        return new TaskOutcome(false, message, Map.of());
    }
}
