package io.rota4j.core;

import java.time.Duration;
import java.time.Instant;

/**
 * Per-attempt execution context handed to a worker.
 *
 * <p>The runner interrupts the worker thread once {@code deadline} passes, so blocking calls
 * should either honour interruption or use {@link #remaining()} as their own timeout.
 */
public record JobContext(
        String jobId,
        String kind,
        int attempt,
        int maxAttempts,
        Instant deadline,
        String workerId
) {
    public boolean isFinalAttempt() {
        return attempt >= maxAttempts;
    }

    public Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
