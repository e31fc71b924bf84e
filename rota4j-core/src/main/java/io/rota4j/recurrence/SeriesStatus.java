package io.rota4j.recurrence;

import java.util.Arrays;

public enum SeriesStatus {
    ACTIVE("active"),
    NEEDS_ATTENTION("needs_attention"),
    PAUSED("paused");

    private final String value;

    SeriesStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static SeriesStatus fromValue(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown series status: " + value));
    }
}
