package io.rota4j.failure;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry policy using exponential backoff with jitter.
 *
 * <p>Delay formula: {@code baseDelay * 2^(attempt-1)}, capped at {@code maxDelay},
 * with random jitter in the range [0.5, 1.5).
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;

    public ExponentialBackoffRetryPolicy(long baseDelayMs, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be > 0, got: " + baseDelayMs);
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs, got: " + maxDelayMs);
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    @Override
    public long computeDelayMs(int attempt) {
        if (attempt <= 0) {
            return 0L;
        }
        long expDelay;
        if (attempt >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempt - 1);
            expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
        }
        long capped = Math.min(maxDelayMs, expDelay);
        double jitter = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
        long withJitter = (long) (capped * jitter);
        return Math.min(maxDelayMs, Math.max(0L, withJitter));
    }
}
