package io.rota4j.failure;

/**
 * Strategy for computing the delay before a failed job becomes available again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

    /**
     * @param attempt the attempt that just failed (1-based)
     * @return delay in milliseconds (non-negative)
     */
    long computeDelayMs(int attempt);
}
