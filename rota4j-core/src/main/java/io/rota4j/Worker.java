package io.rota4j;

import io.rota4j.core.JobContext;
import io.rota4j.core.JobOptions;

import java.time.Duration;

/**
 * Handles every job of one kind.
 *
 * <p>Outcome contract:
 * <ul>
 *   <li>returning normally completes the job</li>
 *   <li>{@link io.rota4j.failure.PermanentJobException} discards it without retry</li>
 *   <li>any other exception is classified by the runner's failure policy and retried
 *       until {@link JobOptions#maxAttempts()} is reached</li>
 * </ul>
 */
public interface Worker<T> {
    String kind();

    Class<T> argsClass();

    /**
     * Defaults applied when a job of this kind is enqueued.
     */
    JobOptions options();

    /**
     * Per-attempt deadline; null means the runner default.
     */
    default Duration timeout() {
        return null;
    }

    void work(JobContext context, T args) throws Exception;
}
