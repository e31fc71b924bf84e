package io.rota4j.failure;

/**
 * How a failed attempt is treated by the runner.
 */
public enum FailureKind {
    /**
     * Retry until the job's max-attempt ceiling is reached.
     */
    TRANSIENT,

    /**
     * Terminal. The job is discarded after this attempt.
     */
    PERMANENT
}
