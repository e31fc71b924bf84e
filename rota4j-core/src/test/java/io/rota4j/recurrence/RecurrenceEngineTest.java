package io.rota4j.recurrence;

import io.rota4j.failure.PermanentJobException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecurrenceEngineTest {

    private static final String TABLE = "bookings";
    private static final String RANGE = "time_range";

    private InMemorySeriesStore store;
    private InMemoryEntityWriter writer;
    private Map<String, EntitySchema> schemas;
    private List<List<SchemaDriftIssue>> notified;
    private RecurrenceEngine engine;

    @BeforeEach
    void setUp() {
        store = new InMemorySeriesStore();
        writer = new InMemoryEntityWriter("room_id", RANGE);
        schemas = new HashMap<>();
        schemas.put(TABLE, new EntitySchema(TABLE, Map.of(
                "room_id", new EntityColumn("room_id", Set.of("string"), true, false),
                "title", new EntityColumn("title", Set.of("string"), false, false),
                RANGE, new EntityColumn(RANGE, Set.of("object"), true, false),
                "_id", new EntityColumn("_id", Set.of("objectId"), true, false)
        ), true));
        notified = new ArrayList<>();
        engine = newEngine((series, issues) -> notified.add(issues));
    }

    private RecurrenceEngine newEngine(SeriesOwnerNotifier notifier) {
        EntitySchemaInspector inspector = table -> Optional.ofNullable(schemas.get(table));
        return new RecurrenceEngine(store, store, writer, new SchemaDriftDetector(inspector), notifier, new RecurrenceExpander());
    }

    @Test
    void expandShouldMaterializeEachOccurrenceOnce() {
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=4"));
        Instant until = Instant.parse("2026-03-01T00:00:00Z");

        ExpansionResult first = engine.expand("s-1", until);
        ExpansionResult second = engine.expand("s-1", until);

        assertEquals(ExpansionResult.Outcome.EXPANDED, first.outcome());
        assertEquals(4, first.created());
        assertTrue(first.exhausted());
        assertEquals(0, second.created());
        assertEquals(4, second.skipped());
        assertEquals(4, writer.rows().size());

        List<SeriesInstance> instances = store.findBySeries("s-1");
        assertEquals(4, instances.size());
        assertEquals(LocalDate.of(2026, 1, 5), instances.get(0).occurrenceDate());
        instances.forEach(i -> assertNotNull(i.entityId()));

        Map<String, Object> row = writer.rows().get(0);
        assertEquals("room-1", row.get("room_id"));
        assertEquals(new TimeRange(Instant.parse("2026-01-05T09:00:00Z"), Instant.parse("2026-01-05T10:00:00Z")), row.get(RANGE));
        assertEquals(until, store.get("s-1").expandedUntil());
    }

    @Test
    void concurrentExpansionsShouldNotDuplicateInstances() throws Exception {
        store.put(weekly("s-1", "FREQ=DAILY;COUNT=30"));
        Instant until = Instant.parse("2026-03-01T00:00:00Z");

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<ExpansionResult>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                Callable<ExpansionResult> call = () -> {
                    go.await();
                    return engine.expand("s-1", until);
                };
                futures.add(pool.submit(call));
            }
            go.countDown();
            int created = 0;
            for (Future<ExpansionResult> f : futures) {
                created += f.get(10, TimeUnit.SECONDS).created();
            }
            assertEquals(30, created);
        } finally {
            pool.shutdownNow();
        }
        assertEquals(30, store.findBySeries("s-1").size());
        assertEquals(30, writer.rows().size());
    }

    @Test
    void overlappingOccurrenceShouldBeRecordedAsConflictSkipped() {
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=3"));
        writer.seed(Map.of("room_id", "room-1",
                RANGE, new TimeRange(Instant.parse("2026-01-12T09:30:00Z"), Instant.parse("2026-01-12T11:00:00Z"))));

        ExpansionResult result = engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));

        assertEquals(2, result.created());
        assertEquals(1, result.conflicts());
        SeriesInstance skipped = store.findBySeries("s-1").get(1);
        assertEquals(LocalDate.of(2026, 1, 12), skipped.occurrenceDate());
        assertTrue(skipped.exception());
        assertEquals(InstanceExceptionType.CONFLICT_SKIPPED, skipped.exceptionType());
        assertNull(skipped.entityId());

        ExpansionResult again = engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));
        assertEquals(0, again.conflicts());
        assertEquals(3, again.skipped());
    }

    @Test
    void schemaDriftShouldPauseSeriesAndNotifyOwner() {
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=4"));
        schemas.put(TABLE, new EntitySchema(TABLE, Map.of(
                "title", new EntityColumn("title", Set.of("string"), false, false),
                "capacity", new EntityColumn("capacity", Set.of("int"), true, false),
                RANGE, new EntityColumn(RANGE, Set.of("object"), true, false)
        ), true));

        ExpansionResult result = engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));

        assertEquals(ExpansionResult.Outcome.SCHEMA_DRIFT, result.outcome());
        assertEquals(2, result.driftIssues().size());
        SeriesDefinition paused = store.get("s-1");
        assertEquals(SeriesStatus.NEEDS_ATTENTION, paused.status());
        assertTrue(paused.statusReason().startsWith("Schema drift detected: "));
        assertTrue(paused.statusReason().contains("room_id"));
        assertTrue(paused.statusReason().contains("capacity"));
        assertNull(paused.expandedUntil());
        assertTrue(writer.rows().isEmpty());
        assertEquals(1, notified.size());

        ExpansionResult next = engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));
        assertEquals(ExpansionResult.Outcome.INACTIVE, next.outcome());
        assertEquals(1, notified.size());
    }

    @Test
    void failedDriftNotificationShouldNotFailExpansion() {
        engine = newEngine((series, issues) -> {
            throw new IllegalStateException("mail queue down");
        });
        schemas.remove(TABLE);
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=4"));

        ExpansionResult result = engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));

        assertEquals(ExpansionResult.Outcome.SCHEMA_DRIFT, result.outcome());
        assertEquals(SchemaDriftIssue.TABLE_MISSING, result.driftIssues().get(0).issue());
        assertEquals(SeriesStatus.NEEDS_ATTENTION, store.get("s-1").status());
    }

    @Test
    void pausedSeriesShouldBeLeftAlone() {
        SeriesDefinition s = weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=4");
        store.put(new SeriesDefinition(s.id(), s.recurrenceRule(), s.dtstart(), s.duration(), s.timezone(),
                s.entityTable(), s.entityTemplate(), s.timeRangeColumn(), null, SeriesStatus.PAUSED, null, s.createdBy()));

        ExpansionResult result = engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));

        assertEquals(ExpansionResult.Outcome.INACTIVE, result.outcome());
        assertTrue(store.findBySeries("s-1").isEmpty());
        assertNull(store.get("s-1").expandedUntil());
    }

    @Test
    void watermarkShouldNeverMoveBackwards() {
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO"));

        engine.expand("s-1", Instant.parse("2026-02-01T00:00:00Z"));
        engine.expand("s-1", Instant.parse("2026-01-15T00:00:00Z"));

        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), store.get("s-1").expandedUntil());
        assertEquals(4, store.findBySeries("s-1").size());
    }

    @Test
    void unexpectedInsertFailureShouldReleaseReservation() {
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=2"));
        writer.failWith(new IllegalStateException("connection reset"));

        assertThrows(IllegalStateException.class, () -> engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z")));
        assertTrue(store.findBySeries("s-1").isEmpty());
        assertNull(store.get("s-1").expandedUntil());

        writer.failWith(null);
        ExpansionResult retried = engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));
        assertEquals(2, retried.created());
    }

    @Test
    void linkFailureAfterInsertShouldNotDuplicateEntity() {
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=1"));
        FlakyLinkRepository links = new FlakyLinkRepository(store, 1);
        RecurrenceEngine flaky = new RecurrenceEngine(store, links, writer,
                new SchemaDriftDetector(table -> Optional.ofNullable(schemas.get(table))),
                (series, issues) -> { }, new RecurrenceExpander());

        ExpansionResult first = flaky.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));
        ExpansionResult second = flaky.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));

        assertEquals(1, first.created());
        assertEquals(0, second.created());
        assertEquals(1, writer.rows().size());
        List<SeriesInstance> instances = store.findBySeries("s-1");
        assertEquals(1, instances.size());
        assertNotNull(instances.get(0).entityId());
    }

    @Test
    void persistentLinkFailureShouldKeepReservation() {
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=1"));
        FlakyLinkRepository links = new FlakyLinkRepository(store, Integer.MAX_VALUE);
        RecurrenceEngine flaky = new RecurrenceEngine(store, links, writer,
                new SchemaDriftDetector(table -> Optional.ofNullable(schemas.get(table))),
                (series, issues) -> { }, new RecurrenceExpander());

        assertThrows(IllegalStateException.class, () -> flaky.expand("s-1", Instant.parse("2026-03-01T00:00:00Z")));
        ExpansionResult rerun = flaky.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));

        assertEquals(0, rerun.created());
        assertEquals(1, rerun.skipped());
        assertEquals(1, writer.rows().size());
        assertEquals(1, store.findBySeries("s-1").size());
        assertNull(store.findBySeries("s-1").get(0).entityId());
    }

    @Test
    void staleReservationShouldBeTakenOver() {
        store.put(weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=2"));
        store.seedReservation("s-1", LocalDate.of(2026, 1, 5), Instant.parse("2026-01-05T09:00:00Z"), TABLE,
                Instant.now().minusSeconds(3600));
        store.seedReservation("s-1", LocalDate.of(2026, 1, 12), Instant.parse("2026-01-12T09:00:00Z"), TABLE,
                Instant.now());

        ExpansionResult result = engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z"));

        assertEquals(1, result.created());
        assertEquals(1, result.skipped());
        assertEquals(1, writer.rows().size());
        List<SeriesInstance> instances = store.findBySeries("s-1");
        assertNotNull(instances.get(0).entityId());
        assertNull(instances.get(1).entityId());
    }

    @Test
    void missingSeriesAndBadDurationShouldBePermanent() {
        assertThrows(PermanentJobException.class, () -> engine.expand("nope", Instant.now()));

        SeriesDefinition s = weekly("s-1", "FREQ=WEEKLY;BYDAY=MO;COUNT=2");
        store.put(new SeriesDefinition(s.id(), s.recurrenceRule(), s.dtstart(), "soon", s.timezone(),
                s.entityTable(), s.entityTemplate(), s.timeRangeColumn(), null, SeriesStatus.ACTIVE, null, s.createdBy()));

        PermanentJobException e = assertThrows(PermanentJobException.class,
                () -> engine.expand("s-1", Instant.parse("2026-03-01T00:00:00Z")));
        assertTrue(e.getMessage().contains("invalid series duration"));
        assertFalse(store.findBySeries("s-1").iterator().hasNext());
    }

    private static SeriesDefinition weekly(String id, String rule) {
        return new SeriesDefinition(
                id,
                rule,
                Instant.parse("2026-01-05T09:00:00Z"),
                "01:00:00",
                "UTC",
                TABLE,
                Map.of("room_id", "room-1", "title", "Standup"),
                RANGE,
                null,
                SeriesStatus.ACTIVE,
                null,
                "user-7"
        );
    }

    private static final class FlakyLinkRepository implements SeriesInstanceRepository {
        private final SeriesInstanceRepository delegate;
        private int failuresLeft;

        FlakyLinkRepository(SeriesInstanceRepository delegate, int failures) {
            this.delegate = delegate;
            this.failuresLeft = failures;
        }

        @Override
        public Set<LocalDate> findOccurrenceDates(String seriesId) {
            return delegate.findOccurrenceDates(seriesId);
        }

        @Override
        public boolean reserve(String seriesId, LocalDate occurrenceDate, Instant occurrenceStart, String entityTable) {
            return delegate.reserve(seriesId, occurrenceDate, occurrenceStart, entityTable);
        }

        @Override
        public void linkEntity(String seriesId, LocalDate occurrenceDate, String entityId) {
            if (failuresLeft > 0) {
                failuresLeft--;
                throw new IllegalStateException("write concern timeout");
            }
            delegate.linkEntity(seriesId, occurrenceDate, entityId);
        }

        @Override
        public void markException(String seriesId, LocalDate occurrenceDate, InstanceExceptionType type) {
            delegate.markException(seriesId, occurrenceDate, type);
        }

        @Override
        public void release(String seriesId, LocalDate occurrenceDate) {
            delegate.release(seriesId, occurrenceDate);
        }

        @Override
        public List<SeriesInstance> findBySeries(String seriesId) {
            return delegate.findBySeries(seriesId);
        }
    }
}
