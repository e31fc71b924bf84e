package io.rota4j.recurrence;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Payload of an {@code expand_recurring_series} job.
 *
 * @param expandUntil ISO-8601 instant; null means "now + configured horizon"
 */
public record ExpandSeriesArgs(
        @JsonProperty("series_id") String seriesId,
        @JsonProperty("expand_until") String expandUntil
) {
    public static ExpandSeriesArgs of(String seriesId, Instant expandUntil) {
        return new ExpandSeriesArgs(seriesId, expandUntil == null ? null : expandUntil.toString());
    }

    @JsonIgnore
    public Instant expandUntilInstant() {
        return expandUntil == null || expandUntil.isBlank() ? null : Instant.parse(expandUntil);
    }
}
