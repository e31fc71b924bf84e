package io.rota4j.core;

import io.rota4j.failure.FailureKind;

import java.time.Instant;

/**
 * One failed attempt, appended to the job's error history.
 */
public record AttemptError(
        int attempt,
        Instant at,
        String message,
        FailureKind classification
) {
}
