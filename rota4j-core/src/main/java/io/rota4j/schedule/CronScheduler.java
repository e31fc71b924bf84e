package io.rota4j.schedule;

import io.rota4j.Rota;
import io.rota4j.core.EnqueueResult;
import io.rota4j.utils.CronSupport;
import io.rota4j.utils.DaemonThreadFactory;
import io.rota4j.utils.Zones;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Periodic loop turning enabled {@link ScheduleDefinition}s into {@code scheduled_job_execute} jobs.
 *
 * <p>There is no leader election. Every due occurrence is enqueued with the dedup key
 * {@code scheduled_job:<scheduleId>:<occurrence>}, so any number of instances ticking at the same
 * time still produce one job per occurrence.
 *
 * <p>Base time for the next occurrence is the later of lastRunAt and {@code now - catchUpWindow};
 * a schedule that never ran starts from {@code max(createdAt, now - catchUpWindow)}. Occurrences
 * more than {@code catchUpThreshold} overdue are tagged {@link TriggerReason#CATCH_UP}.
 *
 * <p>Typical usage:
 * <pre>{@code
 * CronScheduler scheduler = new CronScheduler(scheduleRepository, rota, CronScheduler.Settings.defaults());
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 */
public class CronScheduler {
    private static final Logger log = LoggerFactory.getLogger(CronScheduler.class);

    public static final String DEDUP_PREFIX = "scheduled_job:";

    private final ScheduleRepository scheduleRepository;
    private final Rota rota;
    private final Settings settings;
    private final Clock clock;

    private ScheduledExecutorService executor;
    private ScheduledFuture<?> tickTask;

    /**
     * @param tickInterval             delay between ticks
     * @param catchUpWindow            maximum lookback for missed occurrences
     * @param catchUpThreshold         overdue age above which an occurrence counts as catch-up
     * @param maxEnqueuesPerSchedule   cap on occurrences enqueued for one definition in one tick
     */
    public record Settings(
            Duration tickInterval,
            Duration catchUpWindow,
            Duration catchUpThreshold,
            int maxEnqueuesPerSchedule
    ) {
        public Settings {
            Objects.requireNonNull(tickInterval, "tickInterval must not be null");
            Objects.requireNonNull(catchUpWindow, "catchUpWindow must not be null");
            Objects.requireNonNull(catchUpThreshold, "catchUpThreshold must not be null");
            if (tickInterval.isZero() || tickInterval.isNegative()) {
                throw new IllegalArgumentException("tickInterval must be a positive duration");
            }
            if (catchUpWindow.isNegative()) {
                throw new IllegalArgumentException("catchUpWindow must not be negative");
            }
            if (maxEnqueuesPerSchedule < 1) {
                throw new IllegalArgumentException("maxEnqueuesPerSchedule must be >= 1");
            }
        }

        public static Settings defaults() {
            return new Settings(Duration.ofMinutes(1), Duration.ofHours(24), Duration.ofHours(1), 100);
        }
    }

    public CronScheduler(ScheduleRepository scheduleRepository, Rota rota, Settings settings) {
        this(scheduleRepository, rota, settings, Clock.systemUTC());
    }

    public CronScheduler(ScheduleRepository scheduleRepository, Rota rota, Settings settings, Clock clock) {
        this.scheduleRepository = Objects.requireNonNull(scheduleRepository, "scheduleRepository must not be null");
        this.rota = Objects.requireNonNull(rota, "rota must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Starts the tick loop on its own thread. Subsequent calls are no-ops while running.
     */
    public synchronized void start() {
        if (tickTask != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("rota-scheduler-"));
        long intervalMs = settings.tickInterval().toMillis();
        tickTask = executor.scheduleWithFixedDelay(this::runOnce, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("rota scheduler started tickInterval={} catchUpWindow={}", settings.tickInterval(), settings.catchUpWindow());
    }

    public synchronized void stop() {
        if (tickTask == null) {
            return;
        }
        tickTask.cancel(false);
        tickTask = null;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("rota scheduler thread did not terminate within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            executor = null;
        }
        log.info("rota scheduler stopped");
    }

    public synchronized boolean isRunning() {
        return tickTask != null;
    }

    /**
     * One tick. Never throws; safe to call directly.
     */
    public void runOnce() {
        try {
            tick();
        } catch (Throwable t) {
            log.error("rota scheduler tick failed msg={}", t.getMessage(), t);
        }
    }

    public SchedulerTickResult tick() {
        return tick(clock.instant());
    }

    public SchedulerTickResult tick(Instant now) {
        Objects.requireNonNull(now, "now must not be null");

        List<ScheduleDefinition> definitions = scheduleRepository.findEnabled();
        int enqueued = 0, duplicates = 0, skipped = 0, failed = 0;

        for (ScheduleDefinition def : definitions) {
            if (!def.enabled()) {
                continue;
            }
            if (!CronSupport.isValid(def.cronExpression())) {
                log.warn("rota scheduler skipping schedule with invalid cron id={} name={} cron={}",
                        def.id(), def.name(), def.cronExpression());
                skipped++;
                continue;
            }

            ZoneId zone = Zones.resolveOrUtc(def.timezone());
            Instant next = null;
            int count = 0;

            try {
                next = CronSupport.nextAfter(def.cronExpression(), zone, baseTime(def, now));
                while (next != null && !next.isAfter(now) && count < settings.maxEnqueuesPerSchedule()) {
                    TriggerReason reason = Duration.between(next, now).compareTo(settings.catchUpThreshold()) > 0
                            ? TriggerReason.CATCH_UP
                            : TriggerReason.SCHEDULED;

                    EnqueueResult result = rota.create(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.of(def, next, reason))
                            .uniqueKey(dedupKey(def.id(), next))
                            .save();

                    if (result.created()) {
                        enqueued++;
                        log.info("rota scheduler enqueued schedule id={} name={} scheduledFor={} triggeredBy={}",
                                def.id(), def.name(), next, reason.value());
                    } else {
                        duplicates++;
                    }
                    count++;
                    next = CronSupport.nextAfter(def.cronExpression(), zone, next);
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("rota scheduler enqueue failed id={} name={} msg={}", def.id(), def.name(), e.getMessage(), e);
                continue;
            }

            if (count == 0) {
                log.debug("rota scheduler schedule not due id={} name={} next={}", def.id(), def.name(), next);
            } else if (count >= settings.maxEnqueuesPerSchedule()) {
                log.warn("rota scheduler per-tick cap reached id={} name={} cap={}",
                        def.id(), def.name(), settings.maxEnqueuesPerSchedule());
            }
        }

        return new SchedulerTickResult(definitions.size(), enqueued, duplicates, skipped, failed);
    }

    /**
     * Enqueues an immediate run tagged {@link TriggerReason#MANUAL}, without a dedup key.
     */
    public EnqueueResult triggerNow(String scheduleId) {
        ScheduleDefinition def = scheduleRepository.findById(scheduleId)
                .orElseThrow(() -> new IllegalArgumentException("Schedule not found: " + scheduleId));
        Instant now = clock.instant();
        log.info("rota scheduler manual trigger id={} name={}", def.id(), def.name());
        return rota.now(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.of(def, now, TriggerReason.MANUAL));
    }

    public static String dedupKey(String scheduleId, Instant occurrence) {
        return DEDUP_PREFIX + scheduleId + ":" + occurrence;
    }

    private Instant baseTime(ScheduleDefinition def, Instant now) {
        Instant floor = now.minus(settings.catchUpWindow());
        if (def.lastRunAt() != null) {
            return later(def.lastRunAt(), floor);
        }
        return def.createdAt() == null ? floor : later(def.createdAt(), floor);
    }

    private static Instant later(Instant a, Instant b) {
        return a.isAfter(b) ? a : b;
    }
}
