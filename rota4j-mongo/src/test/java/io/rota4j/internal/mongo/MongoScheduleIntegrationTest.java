package io.rota4j.internal.mongo;

import com.mongodb.client.MongoClients;
import io.rota4j.schedule.ScheduleDefinition;
import io.rota4j.schedule.ScheduleRun;
import io.rota4j.schedule.TriggerReason;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoScheduleIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-03-10T10:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoScheduleRepository schedules;
    private MongoScheduleRunRepository runs;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "rota4j_test");
        mongoTemplate.dropCollection(ScheduleDocument.class);
        mongoTemplate.dropCollection(ScheduleRunDocument.class);
        schedules = new MongoScheduleRepository(mongoTemplate);
        runs = new MongoScheduleRunRepository(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(ScheduleDocument.class);
        mongoTemplate.dropCollection(ScheduleRunDocument.class);
    }

    @Test
    void findEnabledShouldSkipDisabledSchedules() {
        schedules.save(new ScheduleDefinition("s-1", "hourly report", "report", "0 * * * *", "UTC", true, null, T0));
        schedules.save(new ScheduleDefinition("s-2", "paused report", "report", "0 * * * *", "UTC", false, null, T0));

        List<ScheduleDefinition> enabled = schedules.findEnabled();

        assertEquals(1, enabled.size());
        assertEquals("s-1", enabled.get(0).id());
        assertEquals("0 * * * *", enabled.get(0).cronExpression());
    }

    @Test
    void lastRunAtShouldOnlyAdvance() {
        schedules.save(new ScheduleDefinition("s-1", "hourly report", "report", "0 * * * *", "UTC", true, null, T0));

        assertTrue(schedules.advanceLastRunAt("s-1", T0.plusSeconds(3600)));
        assertFalse(schedules.advanceLastRunAt("s-1", T0));
        assertFalse(schedules.advanceLastRunAt("s-1", T0.plusSeconds(3600)));
        assertTrue(schedules.advanceLastRunAt("s-1", T0.plusSeconds(7200)));

        assertEquals(T0.plusSeconds(7200), schedules.findById("s-1").orElseThrow().lastRunAt());
    }

    @Test
    void runShouldBeCompletedOnce() {
        String runId = runs.start(ScheduleRun.started("s-1", T0, T0, TriggerReason.CATCH_UP));
        assertNotNull(runId);

        runs.complete(runId, T0.plusSeconds(2), 2000, true, "ok");
        runs.complete(runId, T0.plusSeconds(9), 9000, false, "late write");

        ScheduleRun run = runs.findBySchedule("s-1", 10).get(0);
        assertTrue(run.isCompleted());
        assertEquals(2000L, run.durationMs());
        assertEquals(Boolean.TRUE, run.success());
        assertEquals("ok", run.message());
        assertEquals(TriggerReason.CATCH_UP, run.triggeredBy());
    }

    @Test
    void historyShouldBeNewestFirstAndLimited() {
        for (int i = 0; i < 5; i++) {
            runs.start(ScheduleRun.started("s-1", T0.plusSeconds(i * 60L), T0.plusSeconds(i * 60L), TriggerReason.SCHEDULED));
        }
        runs.start(ScheduleRun.started("s-2", T0, null, TriggerReason.MANUAL));

        List<ScheduleRun> history = runs.findBySchedule("s-1", 3);

        assertEquals(3, history.size());
        assertEquals(T0.plusSeconds(240), history.get(0).startedAt());
        assertEquals(T0.plusSeconds(120), history.get(2).startedAt());
        assertNull(history.get(0).completedAt());
    }
}
