package io.rota4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.rota4j.core.AttemptError;
import io.rota4j.core.EnqueueResult;
import io.rota4j.core.JobRecord;
import io.rota4j.core.JobSpec;
import io.rota4j.core.JobState;
import io.rota4j.core.JobStore;
import io.rota4j.failure.FailureKind;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for jobs.
 *
 * <p>Dedup relies on the partial unique index {@code (kind, uniqueKey)} from
 * {@code RotaMongoIndexConfig}: a second insert with the same key fails with a duplicate key error
 * and is reported as {@link EnqueueResult#duplicate()}. Discarding a job moves its key to
 * {@code discardedUniqueKey}, which frees it for a new enqueue.
 */
public class MongoJobStore implements JobStore {

    private static final List<JobState> CLAIMABLE = List.of(JobState.AVAILABLE, JobState.RETRYABLE);

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public EnqueueResult enqueue(JobSpec<?> spec) {
        Objects.requireNonNull(spec, "spec must not be null");

        JobDocument doc = toDocument(spec);
        try {
            mongoTemplate.insert(doc);
        } catch (DuplicateKeyException e) {
            return EnqueueResult.duplicate();
        }
        return EnqueueResult.createdResult(doc.getId());
    }

    private JobDocument toDocument(JobSpec<?> spec) {
        JobDocument doc = new JobDocument();
        doc.setKind(spec.kind());
        doc.setQueue(spec.queue());
        doc.setPriority(spec.priority());
        doc.setUniqueKey(isBlank(spec.uniqueKey()) ? null : spec.uniqueKey());
        doc.setMaxAttempts(spec.maxAttempts());
        doc.setScheduledAt(spec.scheduledAt() != null ? spec.scheduledAt() : Instant.now());
        doc.setState(JobState.AVAILABLE);
        doc.setAttempt(0);
        doc.setCreatedAt(Instant.now());

        if (spec.args() != null) {
            doc.setArgs(objectMapper.convertValue(spec.args(), new TypeReference<Map<String, Object>>() {
            }));
        }
        return doc;
    }

    /**
     * Atomically claims (leases) at most {@code limit} due jobs of one queue.
     *
     * <p>A job is claimable when:
     * <ul>
     *   <li>it is available or retryable and {@code scheduledAt <= now}</li>
     *   <li>or it is running and its lease expired: {@code leaseUntil <= now}</li>
     * </ul>
     *
     * <p>Each claim is a single {@code findAndModify}, so concurrent claimers in other processes
     * never receive the same job while its lease is valid.
     */
    @Override
    public List<JobRecord> claim(String queue, int limit, Duration lease, String workerId, Instant now) {
        Objects.requireNonNull(queue, "queue must not be null");
        Objects.requireNonNull(lease, "lease must not be null");
        Objects.requireNonNull(now, "now must not be null");
        if (limit <= 0) {
            return List.of();
        }
        if (lease.isZero() || lease.isNegative()) {
            throw new IllegalArgumentException("lease must be a positive duration");
        }
        if (isBlank(workerId)) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query due = new Query(
                Criteria.where("queue").is(queue)
                        .orOperator(
                                Criteria.where("state").in(CLAIMABLE).and("scheduledAt").lte(now),
                                Criteria.where("state").is(JobState.RUNNING).and("leaseUntil").lte(now)
                        )
        );
        due.with(Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("scheduledAt")));

        Update leaseUpdate = new Update()
                .set("state", JobState.RUNNING)
                .set("lockedAt", now)
                .set("leaseUntil", now.plus(lease))
                .set("lockedBy", workerId)
                .inc("attempt", 1);

        FindAndModifyOptions options = FindAndModifyOptions.options().returnNew(true);

        List<JobRecord> claimed = new ArrayList<>(Math.min(limit, 64));
        for (int i = 0; i < limit; i++) {
            JobDocument doc = mongoTemplate.findAndModify(due, leaseUpdate, options, JobDocument.class);
            if (doc == null) {
                break;
            }
            claimed.add(toRecord(doc));
        }
        return claimed;
    }

    @Override
    public boolean complete(String jobId, String workerId, Instant finishedAt) {
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");

        Update u = releaseLease(new Update())
                .set("state", JobState.COMPLETED)
                .set("finishedAt", finishedAt);
        return heldBy(jobId, workerId, u).getModifiedCount() > 0;
    }

    @Override
    public boolean retry(String jobId, String workerId, AttemptError error, Instant nextRunAt) {
        Objects.requireNonNull(error, "error must not be null");
        Objects.requireNonNull(nextRunAt, "nextRunAt must not be null");

        Update u = releaseLease(new Update())
                .set("state", JobState.RETRYABLE)
                .set("scheduledAt", nextRunAt)
                .push("errors", toEntry(error));
        return heldBy(jobId, workerId, u).getModifiedCount() > 0;
    }

    @Override
    public boolean discard(String jobId, String workerId, AttemptError error) {
        Objects.requireNonNull(error, "error must not be null");

        Update u = releaseLease(new Update())
                .set("state", JobState.DISCARDED)
                .set("finishedAt", error.at())
                .push("errors", toEntry(error))
                .rename("uniqueKey", "discardedUniqueKey");
        return heldBy(jobId, workerId, u).getModifiedCount() > 0;
    }

    @Override
    public Optional<JobRecord> findById(String jobId) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(jobId, JobDocument.class)).map(this::toRecord);
    }

    // Prevent stale write-back if another worker already re-claimed this job.
    private UpdateResult heldBy(String jobId, String workerId, Update update) {
        Objects.requireNonNull(jobId, "jobId must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Query q = new Query(
                Criteria.where("_id").is(jobId)
                        .and("lockedBy").is(workerId)
                        .and("state").is(JobState.RUNNING)
        );
        return mongoTemplate.updateFirst(q, update, JobDocument.class);
    }

    private static Update releaseLease(Update u) {
        return u.unset("lockedAt")
                .unset("leaseUntil")
                .unset("lockedBy");
    }

    private static JobDocument.ErrorEntry toEntry(AttemptError error) {
        return new JobDocument.ErrorEntry(
                error.attempt(),
                error.at(),
                error.message(),
                error.classification() == null ? null : error.classification().name()
        );
    }

    JobRecord toRecord(JobDocument doc) {
        List<AttemptError> errors = new ArrayList<>();
        if (doc.getErrors() != null) {
            for (JobDocument.ErrorEntry e : doc.getErrors()) {
                errors.add(new AttemptError(
                        e.getAttempt(),
                        e.getAt(),
                        e.getMessage(),
                        e.getClassification() == null ? null : FailureKind.valueOf(e.getClassification())
                ));
            }
        }
        String uniqueKey = doc.getUniqueKey() != null ? doc.getUniqueKey() : doc.getDiscardedUniqueKey();
        return new JobRecord(
                doc.getId(),
                doc.getKind(),
                doc.getQueue(),
                doc.getPriority(),
                doc.getAttempt(),
                doc.getMaxAttempts(),
                uniqueKey,
                doc.getScheduledAt(),
                doc.getState(),
                doc.getArgs(),
                errors,
                doc.getLockedBy(),
                doc.getLeaseUntil()
        );
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
