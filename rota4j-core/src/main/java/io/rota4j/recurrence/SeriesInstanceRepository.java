package io.rota4j.recurrence;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Instance rows, unique per (seriesId, occurrenceDate) at the storage level.
 */
public interface SeriesInstanceRepository {

    /**
     * Dates that are linked, marked as exceptions, or reserved recently. Stale reservations are left out.
     */
    Set<LocalDate> findOccurrenceDates(String seriesId);

    /**
     * Claims the (series, date) slot with no entity linked yet. A reservation that never got an entity or
     * an exception and is older than the store's stale window is taken over.
     *
     * @return false if the slot is held
     */
    boolean reserve(String seriesId, LocalDate occurrenceDate, Instant occurrenceStart, String entityTable);

    void linkEntity(String seriesId, LocalDate occurrenceDate, String entityId);

    void markException(String seriesId, LocalDate occurrenceDate, InstanceExceptionType type);

    /**
     * Drops a reservation whose entity insert failed, so a later expansion can retry the date.
     */
    void release(String seriesId, LocalDate occurrenceDate);

    List<SeriesInstance> findBySeries(String seriesId);
}
