package io.rota4j.schedule;

/**
 * Counters for one scheduler tick.
 *
 * @param evaluated  enabled definitions looked at
 * @param enqueued   new execution jobs written
 * @param duplicates occurrences already enqueued (by this or another instance)
 * @param skipped    definitions skipped for a configuration error
 * @param failed     definitions whose enqueue failed; retried on the next tick
 */
public record SchedulerTickResult(
        int evaluated,
        int enqueued,
        int duplicates,
        int skipped,
        int failed
) {
}
