package io.rota4j.internal.mongo;

import io.rota4j.recurrence.SeriesDefinition;
import io.rota4j.recurrence.SeriesRepository;
import io.rota4j.recurrence.SeriesStatus;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public class MongoSeriesRepository implements SeriesRepository {

    private final MongoTemplate mongoTemplate;

    public MongoSeriesRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<SeriesDefinition> findById(String seriesId) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(seriesId, SeriesDocument.class))
                .map(MongoSeriesRepository::toDefinition);
    }

    @Override
    public void markNeedsAttention(String seriesId, String reason) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Update u = new Update()
                .set("status", SeriesStatus.NEEDS_ATTENTION.value())
                .set("statusReason", reason);
        mongoTemplate.updateFirst(new Query(Criteria.where("_id").is(seriesId)), u, SeriesDocument.class);
    }

    @Override
    public boolean advanceWatermark(String seriesId, Instant until) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Objects.requireNonNull(until, "until must not be null");

        Query q = new Query(
                Criteria.where("_id").is(seriesId)
                        .orOperator(
                                Criteria.where("expandedUntil").is(null),
                                Criteria.where("expandedUntil").lt(until)
                        )
        );
        return mongoTemplate.updateFirst(q, new Update().set("expandedUntil", until), SeriesDocument.class)
                .getModifiedCount() > 0;
    }

    /**
     * Insert or replace a series. A missing status is stored as active.
     */
    public SeriesDefinition save(SeriesDefinition series) {
        Objects.requireNonNull(series, "series must not be null");
        SeriesDocument doc = new SeriesDocument();
        doc.setId(series.id());
        doc.setRecurrenceRule(series.recurrenceRule());
        doc.setDtstart(series.dtstart());
        doc.setDuration(series.duration());
        doc.setTimezone(series.timezone());
        doc.setEntityTable(series.entityTable());
        doc.setEntityTemplate(series.entityTemplate());
        doc.setTimeRangeColumn(series.timeRangeColumn());
        doc.setExpandedUntil(series.expandedUntil());
        doc.setStatus((series.status() == null ? SeriesStatus.ACTIVE : series.status()).value());
        doc.setStatusReason(series.statusReason());
        doc.setCreatedBy(series.createdBy());
        return toDefinition(mongoTemplate.save(doc));
    }

    static SeriesDefinition toDefinition(SeriesDocument doc) {
        return new SeriesDefinition(
                doc.getId(),
                doc.getRecurrenceRule(),
                doc.getDtstart(),
                doc.getDuration(),
                doc.getTimezone(),
                doc.getEntityTable(),
                doc.getEntityTemplate(),
                doc.getTimeRangeColumn(),
                doc.getExpandedUntil(),
                doc.getStatus() == null ? SeriesStatus.ACTIVE : SeriesStatus.fromValue(doc.getStatus()),
                doc.getStatusReason(),
                doc.getCreatedBy()
        );
    }
}
