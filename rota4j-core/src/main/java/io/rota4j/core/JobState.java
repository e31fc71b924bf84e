package io.rota4j.core;

/**
 * Lifecycle of a queued job.
 *
 * <pre>
 * AVAILABLE -> RUNNING -> COMPLETED
 *                      -> RETRYABLE -> RUNNING ...
 *                      -> DISCARDED
 * </pre>
 */
public enum JobState {
    AVAILABLE,
    RUNNING,
    RETRYABLE,
    COMPLETED,
    DISCARDED;

    public boolean isTerminal() {
        return this == COMPLETED || this == DISCARDED;
    }
}
