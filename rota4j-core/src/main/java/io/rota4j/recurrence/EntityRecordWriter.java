package io.rota4j.recurrence;

import java.util.Map;

/**
 * Inserts materialized entity records into their target table.
 */
public interface EntityRecordWriter {

    /**
     * @param record field values; the time-range column holds a {@link TimeRange}
     * @return id of the inserted record
     * @throws OverlapConflictException if the record violates an overlap/exclusion rule
     */
    String insert(String entityTable, Map<String, Object> record) throws OverlapConflictException;
}
