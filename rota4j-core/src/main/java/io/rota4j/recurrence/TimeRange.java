package io.rota4j.recurrence;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)}.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start must not be null");
        Objects.requireNonNull(end, "end must not be null");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("time range end must be after start: [" + start + "," + end + ")");
        }
    }

    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")";
    }
}
