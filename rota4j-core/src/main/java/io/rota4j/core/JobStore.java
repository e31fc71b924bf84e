package io.rota4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable queue storage.
 *
 * <p>Implementations must guarantee:
 * <ul>
 *   <li>at most one non-discarded job per (kind, uniqueKey) when uniqueKey is set</li>
 *   <li>a job is handed to at most one claimer until its lease expires</li>
 *   <li>state writes after a claim only apply while the caller still holds the lease</li>
 * </ul>
 */
public interface JobStore {

    EnqueueResult enqueue(JobSpec<?> spec);

    /**
     * Atomically leases up to {@code limit} jobs of {@code queue} that are due at {@code now}:
     * available or retryable jobs with {@code scheduledAt <= now}, and running jobs whose lease expired.
     * Higher priority first, then earliest scheduledAt. Each claim increments the attempt counter.
     */
    List<JobRecord> claim(String queue, int limit, Duration lease, String workerId, Instant now);

    boolean complete(String jobId, String workerId, Instant finishedAt);

    boolean retry(String jobId, String workerId, AttemptError error, Instant nextRunAt);

    /**
     * Terminal failure. Releases the unique key so the same logical work can be enqueued again.
     */
    boolean discard(String jobId, String workerId, AttemptError error);

    Optional<JobRecord> findById(String jobId);
}
