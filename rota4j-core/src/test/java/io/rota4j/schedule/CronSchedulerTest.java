package io.rota4j.schedule;

import io.rota4j.core.EnqueueResult;
import io.rota4j.core.JobSpec;
import io.rota4j.support.RecordingRota;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronSchedulerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:30:00Z");

    private InMemoryScheduleStore store;
    private RecordingRota rota;
    private CronScheduler scheduler;

    @BeforeEach
    void setUp() {
        store = new InMemoryScheduleStore();
        rota = new RecordingRota(Map.of(ScheduleExecuteWorker.KIND, ScheduleExecuteWorker.OPTIONS));
        scheduler = new CronScheduler(store, rota, CronScheduler.Settings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void missedOccurrencesShouldBeCaughtUpOnce() {
        store.put(schedule("s-1", "0 * * * *", "UTC", NOW.minus(Duration.ofHours(3)).minus(Duration.ofMinutes(30))));

        SchedulerTickResult first = scheduler.tick(NOW);
        SchedulerTickResult second = scheduler.tick(NOW);

        assertEquals(3, first.enqueued());
        assertEquals(0, second.enqueued());
        assertEquals(3, second.duplicates());

        List<JobSpec<ScheduleExecuteArgs>> jobs = rota.enqueued(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.class);
        assertEquals(List.of("2026-03-10T10:00:00Z", "2026-03-10T11:00:00Z", "2026-03-10T12:00:00Z"),
                jobs.stream().map(j -> j.args().scheduledFor()).toList());
        assertEquals(List.of("catchup", "catchup", "scheduler"),
                jobs.stream().map(j -> j.args().triggeredBy()).toList());
        assertEquals("scheduled_job:s-1:2026-03-10T10:00:00Z", jobs.get(0).uniqueKey());
        assertEquals(ScheduleExecuteWorker.QUEUE, jobs.get(0).queue());
    }

    @Test
    void concurrentSchedulersShouldEnqueueEachOccurrenceOnce() throws Exception {
        store.put(schedule("s-1", "0 * * * *", "UTC", Instant.parse("2026-03-10T09:00:00Z")));
        CronScheduler other = new CronScheduler(store, rota, CronScheduler.Settings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch go = new CountDownLatch(1);
        try {
            Future<SchedulerTickResult> a = pool.submit(() -> {
                go.await();
                return scheduler.tick(NOW);
            });
            Future<SchedulerTickResult> b = pool.submit(() -> {
                go.await();
                return other.tick(NOW);
            });
            go.countDown();
            int created = a.get(10, TimeUnit.SECONDS).enqueued() + b.get(10, TimeUnit.SECONDS).enqueued();
            assertEquals(3, created);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(3, rota.enqueued().size());
    }

    @Test
    void neverRunScheduleShouldStartFromCreation() {
        store.put(new ScheduleDefinition("s-1", "cleanup", "cleanup", "*/5 * * * *", "UTC", true, null,
                Instant.parse("2026-03-10T12:20:00Z")));

        SchedulerTickResult result = scheduler.tick(NOW);

        assertEquals(2, result.enqueued());
        List<JobSpec<ScheduleExecuteArgs>> jobs = rota.enqueued(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.class);
        assertEquals("2026-03-10T12:25:00Z", jobs.get(0).args().scheduledFor());
        assertEquals("2026-03-10T12:30:00Z", jobs.get(1).args().scheduledFor());
    }

    @Test
    void lookbackShouldBeLimitedToCatchUpWindow() {
        store.put(schedule("s-1", "0 * * * *", "UTC", NOW.minus(Duration.ofDays(3))));

        SchedulerTickResult result = scheduler.tick(NOW);

        assertEquals(24, result.enqueued());
        assertEquals("2026-03-09T13:00:00Z",
                rota.enqueued(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.class).get(0).args().scheduledFor());
    }

    @Test
    void perTickCapShouldLimitEnqueues() {
        CronScheduler capped = new CronScheduler(store, rota,
                new CronScheduler.Settings(Duration.ofMinutes(1), Duration.ofHours(24), Duration.ofHours(1), 5),
                Clock.fixed(NOW, ZoneOffset.UTC));
        store.put(schedule("s-1", "0 * * * *", "UTC", NOW.minus(Duration.ofDays(1))));

        assertEquals(5, capped.tick(NOW).enqueued());
    }

    @Test
    void notDueScheduleShouldEnqueueNothing() {
        store.put(schedule("s-1", "0 3 * * *", "UTC", Instant.parse("2026-03-10T03:00:00Z")));

        SchedulerTickResult result = scheduler.tick(NOW);

        assertEquals(1, result.evaluated());
        assertEquals(0, result.enqueued());
        assertTrue(rota.enqueued().isEmpty());
    }

    @Test
    void invalidCronShouldBeSkippedWithoutBlockingOthers() {
        store.put(schedule("a-bad", "not a cron", "UTC", NOW.minus(Duration.ofHours(2))));
        store.put(schedule("b-good", "0 * * * *", "UTC", Instant.parse("2026-03-10T11:00:00Z")));

        SchedulerTickResult result = scheduler.tick(NOW);

        assertEquals(1, result.skipped());
        assertEquals(1, result.enqueued());
        assertEquals("b-good", rota.enqueued(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.class).get(0).args().scheduleId());
    }

    @Test
    void invalidTimezoneShouldEvaluateInUtc() {
        store.put(schedule("s-1", "0 12 * * *", "Mars/Olympus", Instant.parse("2026-03-09T12:00:00Z")));

        scheduler.tick(NOW);

        assertEquals("2026-03-10T12:00:00Z",
                rota.enqueued(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.class).get(0).args().scheduledFor());
    }

    @Test
    void scheduleTimezoneShouldBeHonoured() {
        store.put(schedule("s-1", "0 8 * * *", "Europe/Berlin", Instant.parse("2026-03-09T12:00:00Z")));

        scheduler.tick(NOW);

        // 08:00 CET
        assertEquals("2026-03-10T07:00:00Z",
                rota.enqueued(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.class).get(0).args().scheduledFor());
    }

    @Test
    void enqueueFailureShouldBeCountedAndTickShouldContinue() {
        store.put(schedule("s-1", "0 * * * *", "UTC", Instant.parse("2026-03-10T11:00:00Z")));
        rota.failWith(new IllegalStateException("store unavailable"));

        SchedulerTickResult result = scheduler.tick(NOW);

        assertEquals(1, result.failed());
        assertEquals(0, result.enqueued());
    }

    @Test
    void triggerNowShouldEnqueueManualRun() {
        store.put(schedule("s-1", "0 3 * * *", "UTC", null));

        EnqueueResult result = scheduler.triggerNow("s-1");
        EnqueueResult again = scheduler.triggerNow("s-1");

        assertTrue(result.created());
        assertTrue(again.created());
        List<JobSpec<ScheduleExecuteArgs>> jobs = rota.enqueued(ScheduleExecuteWorker.KIND, ScheduleExecuteArgs.class);
        assertEquals(2, jobs.size());
        assertEquals("manual", jobs.get(0).args().triggeredBy());
        assertNull(jobs.get(0).uniqueKey());
        assertThrows(IllegalArgumentException.class, () -> scheduler.triggerNow("missing"));
    }

    @Test
    void startAndStopShouldToggleRunningState() {
        CronScheduler looping = new CronScheduler(store, rota,
                new CronScheduler.Settings(Duration.ofMillis(50), Duration.ofHours(24), Duration.ofHours(1), 100));

        looping.start();
        looping.start();
        assertTrue(looping.isRunning());
        looping.stop();
        assertFalse(looping.isRunning());
    }

    private static ScheduleDefinition schedule(String id, String cron, String timezone, Instant lastRunAt) {
        return new ScheduleDefinition(id, id + "-name", "report", cron, timezone, true, lastRunAt,
                Instant.parse("2026-01-01T00:00:00Z"));
    }
}
