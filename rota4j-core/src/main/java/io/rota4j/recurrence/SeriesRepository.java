package io.rota4j.recurrence;

import java.time.Instant;
import java.util.Optional;

public interface SeriesRepository {

    Optional<SeriesDefinition> findById(String seriesId);

    void markNeedsAttention(String seriesId, String reason);

    /**
     * Moves expandedUntil forward to {@code until}; a smaller value is ignored.
     *
     * @return true if the watermark moved
     */
    boolean advanceWatermark(String seriesId, Instant until);
}
