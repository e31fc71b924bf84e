package io.rota4j.schedule;

import java.util.Arrays;

public enum TriggerReason {
    SCHEDULED("scheduler"),
    CATCH_UP("catchup"),
    MANUAL("manual");

    private final String value;

    TriggerReason(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static TriggerReason fromValue(String value) {
        return Arrays.stream(values())
                .filter(r -> r.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown trigger reason: " + value));
    }
}
