package io.rota4j.internal.mongo;

import io.rota4j.recurrence.EntityRecordWriter;
import io.rota4j.recurrence.OverlapConflictException;
import io.rota4j.recurrence.TimeRange;
import org.bson.Document;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Inserts materialized records as plain documents into the series' entity collection.
 *
 * <p>A {@link TimeRange} value is stored as an embedded {@code {start, end}} pair of dates.
 * Mongo has no exclusion constraint, so overlap is checked with a query before the insert:
 * a table listed in {@code exclusionKeys} rejects a record whose range intersects an existing
 * record with equal values on every key field. The check and the insert are not atomic;
 * a unique index on the entity collection still surfaces as a conflict.</p>
 */
public class MongoEntityRecordWriter implements EntityRecordWriter {

    private final MongoTemplate mongoTemplate;
    private final Map<String, List<String>> exclusionKeys;

    public MongoEntityRecordWriter(MongoTemplate mongoTemplate, Map<String, List<String>> exclusionKeys) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.exclusionKeys = exclusionKeys == null ? Map.of() : Map.copyOf(exclusionKeys);
    }

    @Override
    public String insert(String entityTable, Map<String, Object> record) throws OverlapConflictException {
        Objects.requireNonNull(entityTable, "entityTable must not be null");
        Objects.requireNonNull(record, "record must not be null");

        Document doc = new Document();
        String rangeField = null;
        TimeRange range = null;
        for (Map.Entry<String, Object> e : record.entrySet()) {
            if (e.getValue() instanceof TimeRange r) {
                rangeField = e.getKey();
                range = r;
                doc.put(e.getKey(), new Document("start", Date.from(r.start())).append("end", Date.from(r.end())));
            } else {
                doc.put(e.getKey(), e.getValue());
            }
        }

        List<String> keys = exclusionKeys.get(entityTable);
        if (range != null && keys != null && !keys.isEmpty()) {
            checkOverlap(entityTable, keys, record, rangeField, range);
        }

        try {
            Document saved = mongoTemplate.insert(doc, entityTable);
            return String.valueOf(saved.get("_id"));
        } catch (DuplicateKeyException e) {
            throw new OverlapConflictException("duplicate key on " + entityTable + ": " + e.getMessage(), e);
        }
    }

    private void checkOverlap(String entityTable,
                              List<String> keys,
                              Map<String, Object> record,
                              String rangeField,
                              TimeRange range) throws OverlapConflictException {
        Criteria c = Criteria.where(rangeField + ".start").lt(Date.from(range.end()))
                .and(rangeField + ".end").gt(Date.from(range.start()));
        for (String key : keys) {
            c = c.and(key).is(record.get(key));
        }
        if (mongoTemplate.exists(new Query(c), entityTable)) {
            throw new OverlapConflictException(
                    "record overlaps existing " + rangeField + " " + range + " in " + entityTable + " on " + keys);
        }
    }
}
