package io.rota4j.config;

import io.rota4j.internal.mongo.JobDocument;
import io.rota4j.internal.mongo.ScheduleDocument;
import io.rota4j.internal.mongo.ScheduleRunDocument;
import io.rota4j.internal.mongo.SeriesInstanceDocument;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.PartialIndexFilter;

/**
 * MongoDB index definitions for Rota.
 *
 * <p>The two unique indexes are always created at startup through {@link #ensureRequiredIndexes()}:
 * without {@code ux_kind_uniqueKey} dedup keys are not enforced, and without
 * {@code ux_series_occurrence} concurrent expansions can materialize the same date twice.
 * The remaining indexes only serve query speed and are created when
 * {@code rota.ensure-indexes-on-startup=true}; otherwise manage them with migrations or ops scripts.
 *
 * <h3>Indexes</h3>
 * <ul>
 *   <li><b>idx_queue_claim</b> on {@code rota_jobs}: { queue: 1, state: 1, priority: -1, scheduledAt: 1 }
 *       <br/>Used by claiming due jobs per queue in priority order.</li>
 *   <li><b>ux_kind_uniqueKey</b> (unique + partial) on {@code rota_jobs}: { kind: 1, uniqueKey: 1 }
 *       with partialFilterExpression { uniqueKey: { $type: "string" } }
 *       <br/>At most one non-discarded job per dedup key.</li>
 *   <li><b>ux_series_occurrence</b> (unique) on {@code rota_series_instances}: { seriesId: 1, occurrenceDate: 1 }</li>
 *   <li><b>idx_schedule_runs</b> on {@code rota_schedule_runs}: { scheduleId: 1, startedAt: -1 }</li>
 *   <li><b>idx_schedules_enabled</b> on {@code rota_schedules}: { enabled: 1 }</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.rota_jobs.createIndex({ queue: 1, state: 1, priority: -1, scheduledAt: 1 }, { name: "idx_queue_claim" });
 * db.rota_jobs.createIndex(
 *   { kind: 1, uniqueKey: 1 },
 *   { name: "ux_kind_uniqueKey", unique: true, partialFilterExpression: { uniqueKey: { $type: "string" } } }
 * );
 * db.rota_series_instances.createIndex({ seriesId: 1, occurrenceDate: 1 }, { name: "ux_series_occurrence", unique: true });
 * db.rota_schedule_runs.createIndex({ scheduleId: 1, startedAt: -1 }, { name: "idx_schedule_runs" });
 * db.rota_schedules.createIndex({ enabled: 1 }, { name: "idx_schedules_enabled" });
 * </pre>
 */
public class RotaMongoIndexConfig {

    public static final String IDX_QUEUE_CLAIM = "idx_queue_claim";
    public static final String UX_KIND_UNIQUE_KEY = "ux_kind_uniqueKey";
    public static final String UX_SERIES_OCCURRENCE = "ux_series_occurrence";
    public static final String IDX_SCHEDULE_RUNS = "idx_schedule_runs";
    public static final String IDX_SCHEDULES_ENABLED = "idx_schedules_enabled";

    private final MongoTemplate mongoTemplate;

    public RotaMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create every index listed above. Safe to call repeatedly.
     */
    public void ensureIndexes() {
        ensureRequiredIndexes();
        mongoTemplate.indexOps(JobDocument.class).createIndex(queueClaimIndex());
        mongoTemplate.indexOps(ScheduleRunDocument.class).createIndex(scheduleRunsIndex());
        mongoTemplate.indexOps(ScheduleDocument.class).createIndex(schedulesEnabledIndex());
    }

    /**
     * Create the unique indexes that dedup keys and occurrence reservations rely on.
     */
    public void ensureRequiredIndexes() {
        mongoTemplate.indexOps(JobDocument.class).createIndex(kindUniqueKeyIndex());
        mongoTemplate.indexOps(SeriesInstanceDocument.class).createIndex(seriesOccurrenceIndex());
    }

    public static Index queueClaimIndex() {
        return new Index()
                .on("queue", Sort.Direction.ASC)
                .on("state", Sort.Direction.ASC)
                .on("priority", Sort.Direction.DESC)
                .on("scheduledAt", Sort.Direction.ASC)
                .named(IDX_QUEUE_CLAIM);
    }

    /**
     * Dedup index. Discarded jobs keep their key under {@code discardedUniqueKey}, outside this index.
     */
    public static Index kindUniqueKeyIndex() {
        return new Index()
                .on("kind", Sort.Direction.ASC)
                .on("uniqueKey", Sort.Direction.ASC)
                .unique()
                .partial(PartialIndexFilter.of(new Document("uniqueKey", new Document("$type", "string"))))
                .named(UX_KIND_UNIQUE_KEY);
    }

    public static Index seriesOccurrenceIndex() {
        return new Index()
                .on("seriesId", Sort.Direction.ASC)
                .on("occurrenceDate", Sort.Direction.ASC)
                .unique()
                .named(UX_SERIES_OCCURRENCE);
    }

    public static Index scheduleRunsIndex() {
        return new Index()
                .on("scheduleId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_SCHEDULE_RUNS);
    }

    public static Index schedulesEnabledIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .named(IDX_SCHEDULES_ENABLED);
    }
}
