package io.rota4j.internal.mongo;

import io.rota4j.schedule.ScheduleDefinition;
import io.rota4j.schedule.ScheduleRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Schedules in {@code rota_schedules}.
 */
public class MongoScheduleRepository implements ScheduleRepository {

    private final MongoTemplate mongoTemplate;

    public MongoScheduleRepository(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public List<ScheduleDefinition> findEnabled() {
        Query q = new Query(Criteria.where("enabled").is(true));
        q.with(Sort.by(Sort.Order.asc("name")));
        return mongoTemplate.find(q, ScheduleDocument.class).stream()
                .map(MongoScheduleRepository::toDefinition)
                .toList();
    }

    @Override
    public Optional<ScheduleDefinition> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return Optional.ofNullable(mongoTemplate.findById(id, ScheduleDocument.class))
                .map(MongoScheduleRepository::toDefinition);
    }

    @Override
    public boolean advanceLastRunAt(String id, Instant runAt) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(runAt, "runAt must not be null");

        Query q = new Query(
                Criteria.where("_id").is(id)
                        .orOperator(
                                Criteria.where("lastRunAt").is(null),
                                Criteria.where("lastRunAt").lt(runAt)
                        )
        );
        return mongoTemplate.updateFirst(q, new Update().set("lastRunAt", runAt), ScheduleDocument.class)
                .getModifiedCount() > 0;
    }

    /**
     * Insert or replace a schedule. A null id is generated; a null createdAt is set to now.
     */
    public ScheduleDefinition save(ScheduleDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        ScheduleDocument doc = new ScheduleDocument();
        doc.setId(definition.id());
        doc.setName(definition.name());
        doc.setTarget(definition.target());
        doc.setCronExpression(definition.cronExpression());
        doc.setTimezone(definition.timezone());
        doc.setEnabled(definition.enabled());
        doc.setLastRunAt(definition.lastRunAt());
        doc.setCreatedAt(definition.createdAt() != null ? definition.createdAt() : Instant.now());
        return toDefinition(mongoTemplate.save(doc));
    }

    static ScheduleDefinition toDefinition(ScheduleDocument doc) {
        return new ScheduleDefinition(
                doc.getId(),
                doc.getName(),
                doc.getTarget(),
                doc.getCronExpression(),
                doc.getTimezone(),
                doc.isEnabled(),
                doc.getLastRunAt(),
                doc.getCreatedAt()
        );
    }
}
