package io.rota4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rota4j.JobBuilder;
import io.rota4j.Rota;
import io.rota4j.Worker;
import io.rota4j.config.RotaProperties;
import io.rota4j.core.AttemptError;
import io.rota4j.core.EnqueueResult;
import io.rota4j.core.JobContext;
import io.rota4j.core.JobRecord;
import io.rota4j.core.JobStore;
import io.rota4j.core.UnknownJobKindException;
import io.rota4j.core.WorkerRegistry;
import io.rota4j.failure.ExponentialBackoffRetryPolicy;
import io.rota4j.failure.FailureClassifier;
import io.rota4j.failure.FailureKind;
import io.rota4j.failure.JobTimeoutException;
import io.rota4j.failure.KeywordFailureClassifier;
import io.rota4j.failure.PermanentJobException;
import io.rota4j.failure.RetryPolicy;
import io.rota4j.internal.SimpleJobBuilder;
import io.rota4j.utils.DaemonThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Rota is a Mongo-backed job queue &amp; runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>One pool per queue, each with its own concurrency limit; queues never block each other</li>
 *   <li>Distributed-safe execution via atomic claim with a lease</li>
 *   <li>Per-attempt deadline, failure classification, retry with backoff, discard on permanent failure</li>
 *   <li>Graceful stop: in-flight jobs get a grace period before they are interrupted</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * rota.start();
 *
 * rota.create("send_notification", args)
 *     .uniqueKey("reminder:42")
 *     .schedule(Instant.parse("2026-01-20T09:30:00Z"))
 *     .save();
 *
 * rota.now("expand_recurring_series", ExpandSeriesArgs.of(seriesId, null));
 * rota.stop();
 * }</pre>
 */
public class MongoRota implements Rota {
    private static final Logger log = LoggerFactory.getLogger(MongoRota.class);

    private final RotaProperties props;
    private final JobStore jobStore;
    private final WorkerRegistry registry;
    private final ObjectMapper objectMapper;
    private final FailureClassifier classifier;
    private final RetryPolicy retryPolicy;
    private final String workerId;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Map<String, QueueRunner> runners = new LinkedHashMap<>();
    private ScheduledExecutorService watchdog;

    /**
     * Poller, pool and slot counter of one queue.
     */
    private final class QueueRunner {
        private final String queue;
        private final int maxWorkers;
        private final Semaphore slots;
        private final Semaphore refillSignal = new Semaphore(0);
        private final ExecutorService pool;
        private final Thread poller;
        private int systemErrorCount = 0;

        private QueueRunner(String queue, int maxWorkers) {
            this.queue = queue;
            this.maxWorkers = maxWorkers;
            this.slots = new Semaphore(maxWorkers);
            this.pool = Executors.newFixedThreadPool(maxWorkers, new DaemonThreadFactory("rota-" + queue + "-"));
            this.poller = new Thread(this::pollerLoop, "rota.poller." + queue);
            this.poller.setDaemon(true);
        }

        private void pollerLoop() {
            while (started.get()) {
                int claimed;
                try {
                    claimed = pollOnce();
                    systemErrorCount = 0;
                } catch (Exception e) {
                    systemErrorCount++;
                    // keeps polling at the capped backoff until the store recovers or stop() is called
                    log.error("rota poll failed queue={} failures={} retryIn={} msg={}",
                            queue, systemErrorCount, backoff(systemErrorCount), e.getMessage(), e);
                    try {
                        Thread.sleep(backoff(systemErrorCount).toMillis());
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                    continue;
                }

                if (!started.get()) {
                    break;
                }

                try {
                    if (claimed > 0 && slots.availablePermits() == 0) {
                        // full: wake up as soon as a slot frees, or at the next interval
                        refillSignal.tryAcquire(props.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
                        refillSignal.drainPermits();
                    } else if (claimed == 0) {
                        Thread.sleep(props.getPollInterval().toMillis());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }

        private int pollOnce() {
            int free = slots.availablePermits();
            if (free == 0) {
                return 1;
            }
            int take = Math.min(Math.max(1, props.getBatchSize()), free);

            List<JobRecord> jobs = jobStore.claim(queue, take, props.getLeaseDuration(), workerId, nowInstant());
            if (!jobs.isEmpty()) {
                log.debug("rota claimed jobs queue={} count={} free={}", queue, jobs.size(), free);
            }

            for (JobRecord job : jobs) {
                slots.acquireUninterruptibly();
                try {
                    pool.submit(() -> {
                        try {
                            execute(job);
                        } finally {
                            slots.release();
                            refillSignal.release();
                        }
                    });
                } catch (RuntimeException e) {
                    slots.release();
                    throw e;
                }
            }
            return jobs.size();
        }
    }

    public MongoRota(RotaProperties props, JobStore jobStore, WorkerRegistry registry, ObjectMapper objectMapper) {
        this(props, jobStore, registry, objectMapper, new KeywordFailureClassifier(), new ExponentialBackoffRetryPolicy(
                props.getRetry().getBaseDelay().toMillis(),
                props.getRetry().getMaxDelay().toMillis()));
    }

    public MongoRota(RotaProperties props,
                     JobStore jobStore,
                     WorkerRegistry registry,
                     ObjectMapper objectMapper,
                     FailureClassifier classifier,
                     RetryPolicy retryPolicy) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
        this.workerId = resolveWorkerId(props.getWorkerId());
    }

    /**
     * Start one poller and pool per queue. Idempotent.
     */
    @Override
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        requirePositive(props.getPollInterval(), "rota.poll-interval");
        requirePositive(props.getLeaseDuration(), "rota.lease-duration");
        requirePositive(props.getDefaultJobTimeout(), "rota.default-job-timeout");

        watchdog = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("rota-watchdog-"));

        for (String queue : queues()) {
            QueueRunner runner = new QueueRunner(queue, props.maxWorkersFor(queue));
            runners.put(queue, runner);
            runner.poller.start();
            log.info("rota queue started queue={} maxWorkers={}", queue, runner.maxWorkers);
        }

        log.info("rota started workerId={} queues={} pollInterval={} lease={} batchSize={}",
                workerId, runners.keySet(), props.getPollInterval(), props.getLeaseDuration(), props.getBatchSize());
    }

    /**
     * Stop claiming, let in-flight jobs finish within the grace period, then interrupt the rest.
     * Idempotent.
     */
    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("rota stopping gracePeriod={}", props.getShutdownGracePeriod());

        for (QueueRunner runner : runners.values()) {
            runner.poller.interrupt();
            runner.pool.shutdown();
        }

        long deadline = System.nanoTime() + props.getShutdownGracePeriod().toNanos();
        for (QueueRunner runner : runners.values()) {
            try {
                long left = Math.max(0, deadline - System.nanoTime());
                if (!runner.pool.awaitTermination(left, TimeUnit.NANOSECONDS)) {
                    List<Runnable> dropped = runner.pool.shutdownNow();
                    log.warn("rota queue did not drain within grace period queue={} interrupted={} notStarted={}",
                            runner.queue, runner.maxWorkers - runner.slots.availablePermits(), dropped.size());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                runner.pool.shutdownNow();
            }
        }
        runners.clear();

        if (watchdog != null) {
            watchdog.shutdownNow();
            watchdog = null;
        }
        log.info("rota stopped");
    }

    public boolean isStarted() {
        return started.get();
    }

    public String workerId() {
        return workerId;
    }

    /**
     * Queues with a registered worker plus any queue configured explicitly.
     */
    Set<String> queues() {
        Set<String> queues = new TreeSet<>(registry.queues());
        queues.addAll(props.getQueues().keySet());
        return queues;
    }

    /**
     * Create a job builder seeded with the worker's queue, priority and attempt ceiling.
     * This does not persist until save() is called.
     */
    @Override
    public <T> JobBuilder<T> create(String kind, T args) {
        Worker<?> worker = registry.find(kind).orElseThrow(() -> new UnknownJobKindException(kind));
        return new SimpleJobBuilder<>(kind, args, worker.options(), jobStore::enqueue);
    }

    @Override
    public <T> JobBuilder<T> schedule(String kind, Instant time, T args) {
        return this.create(kind, args)
                .schedule(time);
    }

    /**
     * Create and persist a job that is due immediately.
     * Callers do not need to call {@code save()}.
     */
    @Override
    public <T> EnqueueResult now(String kind, T args) {
        return this.create(kind, args)
                .schedule(this.nowInstant())
                .save();
    }

    /**
     * Utility: current runner time source (useful for tests).
     */
    protected Instant nowInstant() {
        return Instant.now();
    }

    /**
     * Run one claimed job to completion and write the outcome back. Never throws.
     */
    void execute(JobRecord job) {
        Worker<?> worker = registry.find(job.kind()).orElse(null);
        if (worker == null) {
            log.warn("rota job discarded, no worker registered kind={} id={}", job.kind(), job.id());
            discard(job, new AttemptError(job.attempt(), nowInstant(),
                    new UnknownJobKindException(job.kind()).getMessage(), FailureKind.PERMANENT));
            return;
        }

        if (job.attempt() > job.maxAttempts()) {
            // leased by a process that died during the final attempt
            log.warn("rota job discarded, lease expired after final attempt kind={} id={} attempt={} maxAttempts={}",
                    job.kind(), job.id(), job.attempt(), job.maxAttempts());
            discard(job, new AttemptError(job.attempt(), nowInstant(),
                    "lease expired after final attempt", FailureKind.PERMANENT));
            return;
        }

        Duration timeout = worker.timeout() != null ? worker.timeout() : props.getDefaultJobTimeout();
        Instant startedAt = nowInstant();
        JobContext context = new JobContext(job.id(), job.kind(), job.attempt(), job.maxAttempts(),
                startedAt.plus(timeout), workerId);

        AtomicBoolean timedOut = new AtomicBoolean(false);
        Thread current = Thread.currentThread();
        ScheduledFuture<?> guard = scheduleInterrupt(current, timedOut, timeout);

        log.debug("rota job started kind={} id={} attempt={}/{}", job.kind(), job.id(), job.attempt(), job.maxAttempts());
        try {
            invoke(worker, context, job.args());
            cancel(guard);
            Instant finishedAt = nowInstant();
            if (!jobStore.complete(job.id(), workerId, finishedAt)) {
                log.warn("rota job completed after losing its lease kind={} id={}", job.kind(), job.id());
            }
            log.debug("rota job completed kind={} id={} tookMs={}", job.kind(), job.id(),
                    Duration.between(startedAt, finishedAt).toMillis());
        } catch (Exception e) {
            cancel(guard);
            Exception failure = timedOut.get() ? new JobTimeoutException(job.kind(), timeout) : e;
            handleFailure(job, failure);
        } catch (Error t) {
            // not recorded; the job is claimed again once its lease expires
            cancel(guard);
            log.error("rota job aborted kind={} id={} msg={}", job.kind(), job.id(), t.getMessage(), t);
            throw t;
        } finally {
            // clear a late interrupt so the pool thread can be reused
            Thread.interrupted();
        }
    }

    private ScheduledFuture<?> scheduleInterrupt(Thread target, AtomicBoolean timedOut, Duration timeout) {
        ScheduledExecutorService w = watchdog;
        if (w == null) {
            return null;
        }
        return w.schedule(() -> {
            timedOut.set(true);
            target.interrupt();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static void cancel(ScheduledFuture<?> guard) {
        if (guard != null) {
            guard.cancel(false);
        }
    }

    @SuppressWarnings("unchecked")
    private <T> void invoke(Worker<?> worker, JobContext context, Map<String, Object> rawArgs) throws Exception {
        Worker<T> w = (Worker<T>) worker;
        T args;
        try {
            args = rawArgs == null ? null : objectMapper.convertValue(rawArgs, w.argsClass());
        } catch (IllegalArgumentException e) {
            throw new PermanentJobException("invalid args for kind " + w.kind() + ": " + e.getMessage(), e);
        }
        w.work(context, args);
    }

    private void handleFailure(JobRecord job, Exception e) {
        FailureKind kind = classifier.classify(e);
        Instant failedAt = nowInstant();
        AttemptError error = new AttemptError(job.attempt(), failedAt, describe(e), kind);

        if (kind == FailureKind.PERMANENT) {
            log.warn("rota job failed permanently kind={} id={} attempt={} msg={}",
                    job.kind(), job.id(), job.attempt(), error.message());
            discard(job, error);
            return;
        }

        if (job.attempt() >= job.maxAttempts()) {
            log.warn("rota job reached max attempts; discarding kind={} id={} attempts={} msg={}",
                    job.kind(), job.id(), job.attempt(), error.message());
            discard(job, error);
            return;
        }

        Instant nextRunAt = failedAt.plusMillis(retryPolicy.computeDelayMs(job.attempt()));
        log.warn("rota job failed, retrying kind={} id={} attempt={}/{} nextRunAt={} msg={}",
                job.kind(), job.id(), job.attempt(), job.maxAttempts(), nextRunAt, error.message());
        try {
            if (!jobStore.retry(job.id(), workerId, error, nextRunAt)) {
                log.warn("rota job retry not recorded, lease lost kind={} id={}", job.kind(), job.id());
            }
        } catch (Exception storeEx) {
            log.error("rota retry write failed kind={} id={} msg={}", job.kind(), job.id(), storeEx.getMessage(), storeEx);
        }
    }

    private void discard(JobRecord job, AttemptError error) {
        try {
            if (!jobStore.discard(job.id(), workerId, error)) {
                log.warn("rota job discard not recorded, lease lost kind={} id={}", job.kind(), job.id());
            }
        } catch (Exception storeEx) {
            log.error("rota discard write failed kind={} id={} msg={}", job.kind(), job.id(), storeEx.getMessage(), storeEx);
        }
    }

    private static String describe(Throwable e) {
        String msg = e.getMessage();
        return msg == null || msg.isBlank() ? e.getClass().getSimpleName() : msg;
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }

    private String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "rota4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("rota could not resolve host name msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());

        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }

    // 1s after the first failure, doubling up to one minute.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 16));
        long ms = Math.min(1000L << exp, 60_000L);
        return Duration.ofMillis(ms);
    }
}
