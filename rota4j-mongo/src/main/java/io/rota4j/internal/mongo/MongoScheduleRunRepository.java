package io.rota4j.internal.mongo;

import io.rota4j.schedule.ScheduleRun;
import io.rota4j.schedule.ScheduleRunRepository;
import io.rota4j.schedule.TriggerReason;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Run history in {@code rota_schedule_runs}. A run is completed at most once.
 */
public class MongoScheduleRunRepository implements ScheduleRunRepository {

    private final MongoTemplate mongoTemplate;

    public MongoScheduleRunRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public String start(ScheduleRun run) {
        Objects.requireNonNull(run, "run must not be null");
        ScheduleRunDocument doc = new ScheduleRunDocument();
        doc.setScheduleId(run.scheduleId());
        doc.setStartedAt(run.startedAt());
        doc.setScheduledFor(run.scheduledFor());
        doc.setTriggeredBy(run.triggeredBy() == null ? null : run.triggeredBy().value());
        return mongoTemplate.insert(doc).getId();
    }

    @Override
    public void complete(String runId, Instant completedAt, long durationMs, boolean success, String message) {
        Objects.requireNonNull(runId, "runId must not be null");
        Objects.requireNonNull(completedAt, "completedAt must not be null");

        Query q = new Query(Criteria.where("_id").is(runId).and("completedAt").is(null));
        Update u = new Update()
                .set("completedAt", completedAt)
                .set("durationMs", durationMs)
                .set("success", success)
                .set("message", message);
        mongoTemplate.updateFirst(q, u, ScheduleRunDocument.class);
    }

    @Override
    public List<ScheduleRun> findBySchedule(String scheduleId, int limit) {
        Query q = new Query(Criteria.where("scheduleId").is(scheduleId));
        q.with(Sort.by(Sort.Order.desc("startedAt"), Sort.Order.desc("_id")));
        q.limit(Math.max(1, limit));
        return mongoTemplate.find(q, ScheduleRunDocument.class).stream()
                .map(MongoScheduleRunRepository::toRun)
                .toList();
    }

    private static ScheduleRun toRun(ScheduleRunDocument doc) {
        return new ScheduleRun(
                doc.getId(),
                doc.getScheduleId(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getDurationMs(),
                doc.getSuccess(),
                doc.getMessage(),
                doc.getScheduledFor(),
                doc.getTriggeredBy() == null ? null : TriggerReason.fromValue(doc.getTriggeredBy())
        );
    }
}
