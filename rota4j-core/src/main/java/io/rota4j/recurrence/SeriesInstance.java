package io.rota4j.recurrence;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One materialized occurrence. Unique per (seriesId, occurrenceDate).
 * {@code entityId} is null while reserved and for skipped exceptions.
 */
public record SeriesInstance(
        String id,
        String seriesId,
        LocalDate occurrenceDate,
        Instant occurrenceStart,
        String entityTable,
        String entityId,
        boolean exception,
        InstanceExceptionType exceptionType,
        Instant createdAt
) {
}
