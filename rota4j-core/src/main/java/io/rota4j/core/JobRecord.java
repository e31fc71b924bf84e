package io.rota4j.core;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted view of a job as returned by a {@link JobStore}.
 * {@code attempt} is already incremented for the attempt in progress when the job was claimed.
 */
public record JobRecord(
        String id,
        String kind,
        String queue,
        int priority,
        int attempt,
        int maxAttempts,
        String uniqueKey,
        Instant scheduledAt,
        JobState state,
        Map<String, Object> args,
        List<AttemptError> errors,
        String lockedBy,
        Instant leaseUntil
) {
    public JobRecord {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
