package io.rota4j.core;

/**
 * Named priority levels. Within a queue, higher values are claimed first.
 */
public enum Priority {

    CRITICAL(20),
    HIGH(10),
    NORMAL(0),
    LOW(-10),
    BACKGROUND(-20);

    private final int value;

    Priority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
