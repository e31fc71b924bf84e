package io.rota4j.recurrence;

import java.util.Arrays;

/**
 * Why an instance departs from its rule. Only {@link #CONFLICT_SKIPPED} is produced by expansion;
 * the others are set by users editing single occurrences.
 */
public enum InstanceExceptionType {
    MODIFIED("modified"),
    RESCHEDULED("rescheduled"),
    CANCELLED("cancelled"),
    CONFLICT_SKIPPED("conflict_skipped");

    private final String value;

    InstanceExceptionType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static InstanceExceptionType fromValue(String value) {
        return Arrays.stream(values())
                .filter(t -> t.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown instance exception type: " + value));
    }
}
