package io.rota4j.core;

import java.time.Instant;

/**
 * Immutable job definition produced by JobBuilder.build().
 * This is a pure data object with no persistence logic.
 */
public record JobSpec<T>(

        // identity
        String kind,
        String uniqueKey,

        // routing
        String queue,
        int priority,
        int maxAttempts,

        // scheduling
        Instant scheduledAt,

        // payload
        T args
) {
}
