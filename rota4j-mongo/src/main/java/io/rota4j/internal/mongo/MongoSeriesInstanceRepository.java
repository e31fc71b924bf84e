package io.rota4j.internal.mongo;

import io.rota4j.recurrence.InstanceExceptionType;
import io.rota4j.recurrence.SeriesInstance;
import io.rota4j.recurrence.SeriesInstanceRepository;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Instance rows in {@code rota_series_instances}.
 * Requires the unique (seriesId, occurrenceDate) index; without it {@link #reserve} cannot detect a taken slot.
 * A reservation left without entity or exception for longer than {@code staleAfter} (a crash between
 * reserve and insert) is ignored by {@link #findOccurrenceDates} and taken over by {@link #reserve}.
 */
public class MongoSeriesInstanceRepository implements SeriesInstanceRepository {

    private final MongoTemplate mongoTemplate;
    private final Duration staleAfter;

    public MongoSeriesInstanceRepository(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Duration.ofMinutes(10));
    }

    public MongoSeriesInstanceRepository(MongoTemplate mongoTemplate, Duration staleAfter) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.staleAfter = Objects.requireNonNull(staleAfter, "staleAfter must not be null");
        if (staleAfter.isNegative()) {
            throw new IllegalArgumentException("staleAfter must not be negative");
        }
    }

    @Override
    public Set<LocalDate> findOccurrenceDates(String seriesId) {
        Instant cutoff = Instant.now().minus(staleAfter);
        Query q = new Query(Criteria.where("seriesId").is(seriesId).orOperator(
                Criteria.where("entityId").ne(null),
                Criteria.where("exception").is(true),
                Criteria.where("reservedAt").gte(cutoff),
                Criteria.where("reservedAt").exists(false)));
        q.fields().include("occurrenceDate");
        Set<LocalDate> dates = new HashSet<>();
        for (SeriesInstanceDocument doc : mongoTemplate.find(q, SeriesInstanceDocument.class)) {
            dates.add(LocalDate.parse(doc.getOccurrenceDate()));
        }
        return dates;
    }

    @Override
    public boolean reserve(String seriesId, LocalDate occurrenceDate, Instant occurrenceStart, String entityTable) {
        Objects.requireNonNull(seriesId, "seriesId must not be null");
        Objects.requireNonNull(occurrenceDate, "occurrenceDate must not be null");

        SeriesInstanceDocument doc = new SeriesInstanceDocument();
        doc.setSeriesId(seriesId);
        doc.setOccurrenceDate(occurrenceDate.toString());
        doc.setOccurrenceStart(occurrenceStart);
        doc.setEntityTable(entityTable);
        Instant now = Instant.now();
        doc.setCreatedAt(now);
        doc.setReservedAt(now);
        try {
            mongoTemplate.insert(doc);
            return true;
        } catch (DuplicateKeyException e) {
            return takeOverStale(seriesId, occurrenceDate, occurrenceStart, entityTable, now);
        }
    }

    private boolean takeOverStale(String seriesId, LocalDate occurrenceDate, Instant occurrenceStart,
                                  String entityTable, Instant now) {
        Query q = slot(seriesId, occurrenceDate);
        q.addCriteria(Criteria.where("entityId").is(null)
                .and("exception").is(false)
                .and("reservedAt").lt(now.minus(staleAfter)));
        Update u = new Update()
                .set("reservedAt", now)
                .set("occurrenceStart", occurrenceStart)
                .set("entityTable", entityTable);
        return mongoTemplate.updateFirst(q, u, SeriesInstanceDocument.class).getModifiedCount() > 0;
    }

    @Override
    public void linkEntity(String seriesId, LocalDate occurrenceDate, String entityId) {
        mongoTemplate.updateFirst(slot(seriesId, occurrenceDate), new Update().set("entityId", entityId),
                SeriesInstanceDocument.class);
    }

    @Override
    public void markException(String seriesId, LocalDate occurrenceDate, InstanceExceptionType type) {
        Objects.requireNonNull(type, "type must not be null");
        Update u = new Update()
                .set("exception", true)
                .set("exceptionType", type.value())
                .set("entityId", null);
        mongoTemplate.updateFirst(slot(seriesId, occurrenceDate), u, SeriesInstanceDocument.class);
    }

    @Override
    public void release(String seriesId, LocalDate occurrenceDate) {
        Query q = slot(seriesId, occurrenceDate);
        q.addCriteria(Criteria.where("entityId").is(null).and("exception").is(false));
        mongoTemplate.remove(q, SeriesInstanceDocument.class);
    }

    @Override
    public List<SeriesInstance> findBySeries(String seriesId) {
        Query q = new Query(Criteria.where("seriesId").is(seriesId));
        q.with(Sort.by(Sort.Order.asc("occurrenceDate")));
        return mongoTemplate.find(q, SeriesInstanceDocument.class).stream()
                .map(MongoSeriesInstanceRepository::toInstance)
                .toList();
    }

    private static Query slot(String seriesId, LocalDate occurrenceDate) {
        return new Query(Criteria.where("seriesId").is(seriesId).and("occurrenceDate").is(occurrenceDate.toString()));
    }

    private static SeriesInstance toInstance(SeriesInstanceDocument doc) {
        return new SeriesInstance(
                doc.getId(),
                doc.getSeriesId(),
                LocalDate.parse(doc.getOccurrenceDate()),
                doc.getOccurrenceStart(),
                doc.getEntityTable(),
                doc.getEntityId(),
                doc.isException(),
                doc.getExceptionType() == null ? null : InstanceExceptionType.fromValue(doc.getExceptionType()),
                doc.getCreatedAt()
        );
    }
}
