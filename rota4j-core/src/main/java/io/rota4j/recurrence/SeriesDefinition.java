package io.rota4j.recurrence;

import java.time.Instant;
import java.util.Map;

/**
 * A recurrence rule that materializes entity records.
 *
 * @param recurrenceRule  RRULE body, e.g. {@code FREQ=WEEKLY;BYDAY=MO;COUNT=4}
 * @param dtstart         first occurrence; its wall-clock time in {@code timezone} is kept for every occurrence
 * @param duration        occurrence length, e.g. {@code 01:30:00}, {@code PT90M}, {@code 90 minutes}
 * @param entityTemplate  field values copied into every materialized record
 * @param timeRangeColumn field receiving the occurrence's {@link TimeRange}
 * @param expandedUntil   watermark; never moves backwards
 */
public record SeriesDefinition(
        String id,
        String recurrenceRule,
        Instant dtstart,
        String duration,
        String timezone,
        String entityTable,
        Map<String, Object> entityTemplate,
        String timeRangeColumn,
        Instant expandedUntil,
        SeriesStatus status,
        String statusReason,
        String createdBy
) {
    public SeriesDefinition {
        entityTemplate = entityTemplate == null ? Map.of() : entityTemplate;
    }

    public boolean isActive() {
        return status == SeriesStatus.ACTIVE;
    }
}
