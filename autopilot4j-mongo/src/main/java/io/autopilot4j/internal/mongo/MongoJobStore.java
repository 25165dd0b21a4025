package io.autopilot4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.result.UpdateResult;
import io.autopilot4j.core.EnqueueResult;
import io.autopilot4j.core.FailureReason;
import io.autopilot4j.core.JobFailure;
import io.autopilot4j.core.JobRecord;
import io.autopilot4j.core.JobSpec;
import io.autopilot4j.core.JobStatus;
import io.autopilot4j.core.ReclaimResult;
import io.autopilot4j.spi.JobStore;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * MongoDB persistence layer for jobs (collection {@code jobs}).
 *
 * <p>Semantics:
 * <ul>
 *   <li>enqueue: upsert on {@code {_id, status in [completed, failed]}}; when a live job holds the id the
 *       upsert collides on {@code _id} and the call is a no-op</li>
 *   <li>claim: one {@code findAndModify} per job, pending to processing, highest priority then oldest first</li>
 *   <li>complete/fail: conditional on {@code status=processing} and {@code lockedBy} to prevent stale write-back</li>
 * </ul>
 */
public class MongoJobStore implements JobStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this(mongoTemplate, objectMapper, Clock.systemUTC());
    }

    public MongoJobStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public EnqueueResult enqueue(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        Instant now = clock.instant();
        Map<String, Object> data = objectMapper.convertValue(spec.payload(), MAP_TYPE);

        if (spec.id() == null) {
            JobDocument doc = new JobDocument();
            doc.setId(UUID.randomUUID().toString());
            doc.setType(spec.type());
            doc.setData(data);
            doc.setStatus(JobStatus.PENDING.value());
            doc.setPriority(spec.priority());
            doc.setCreatedAt(now);
            mongoTemplate.insert(doc);
            return EnqueueResult.createdResult(doc.getId());
        }

        Query query = new Query(Criteria.where("_id").is(spec.id())
                .and("status").in(JobStatus.COMPLETED.value(), JobStatus.FAILED.value()));

        Update update = new Update()
                .set("type", spec.type())
                .set("data", data)
                .set("status", JobStatus.PENDING.value())
                .set("priority", spec.priority())
                .set("createdAt", now)
                .set("attempts", 0)
                .unset("result")
                .unset("error")
                .unset("failureReason")
                .unset("processedAt")
                .unset("finishedAt")
                .unset("lockedBy");

        try {
            UpdateResult result = mongoTemplate.upsert(query, update, JobDocument.class);
            return result.getUpsertedId() != null
                    ? EnqueueResult.createdResult(spec.id())
                    : EnqueueResult.requeuedResult(spec.id());
        } catch (DuplicateKeyException e) {
            // a pending or processing job already owns this id
            return EnqueueResult.noop(spec.id());
        }
    }

    @Override
    public Optional<JobRecord> claimNext(String workerId) {
        if (workerId == null || workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }

        Query query = new Query(Criteria.where("status").is(JobStatus.PENDING.value()));
        query.with(Sort.by(Sort.Order.desc("priority"), Sort.Order.asc("createdAt")));

        Update claim = new Update()
                .set("status", JobStatus.PROCESSING.value())
                .set("processedAt", clock.instant())
                .set("lockedBy", workerId)
                .inc("attempts", 1);

        JobDocument doc = mongoTemplate.findAndModify(query, claim,
                FindAndModifyOptions.options().returnNew(true), JobDocument.class);
        return Optional.ofNullable(doc).map(this::toRecord);
    }

    @Override
    public boolean markStarted(String id, String workerId) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Update u = new Update().set("processedAt", clock.instant());
        // matched, not modified: the timestamp may be unchanged within the same millisecond
        return mongoTemplate.updateFirst(heldBy(id, workerId), u, JobDocument.class).getMatchedCount() > 0;
    }

    @Override
    public boolean complete(String id, String workerId, Map<String, Object> result) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");

        Update u = new Update()
                .set("status", JobStatus.COMPLETED.value())
                .set("finishedAt", clock.instant())
                .unset("lockedBy");
        if (result != null) {
            u.set("result", result);
        }
        return mongoTemplate.updateFirst(heldBy(id, workerId), u, JobDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean fail(String id, String workerId, JobFailure failure) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(workerId, "workerId must not be null");
        Objects.requireNonNull(failure, "failure must not be null");

        Update u = new Update()
                .set("status", JobStatus.FAILED.value())
                .set("error", failure.message())
                .set("failureReason", failure.reason().name())
                .set("finishedAt", clock.instant())
                .unset("lockedBy");
        return mongoTemplate.updateFirst(heldBy(id, workerId), u, JobDocument.class).getModifiedCount() > 0;
    }

    @Override
    public Optional<JobRecord> findById(String id) {
        return Optional.ofNullable(mongoTemplate.findById(id, JobDocument.class)).map(this::toRecord);
    }

    @Override
    public List<JobRecord> findRecent(JobStatus status, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        Query q = status == null
                ? new Query()
                : new Query(Criteria.where("status").is(status.value()));
        q.with(Sort.by(Sort.Order.desc("finishedAt"), Sort.Order.desc("processedAt"), Sort.Order.desc("createdAt")));
        q.limit(limit);
        return mongoTemplate.find(q, JobDocument.class).stream().map(this::toRecord).toList();
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, mongoTemplate.count(new Query(Criteria.where("status").is(s.value())), JobDocument.class));
        }
        return counts;
    }

    @Override
    public ReclaimResult reclaimStale(Instant processingBefore, int maxAttempts) {
        Objects.requireNonNull(processingBefore, "processingBefore must not be null");

        Update requeue = new Update()
                .set("status", JobStatus.PENDING.value())
                .unset("processedAt")
                .unset("lockedBy");
        long requeued = mongoTemplate.updateMulti(
                stale(processingBefore, Criteria.where("attempts").lt(maxAttempts)), requeue, JobDocument.class
        ).getModifiedCount();

        Update exhaust = new Update()
                .set("status", JobStatus.FAILED.value())
                .set("error", "processing exceeded stale threshold after " + maxAttempts + " attempts")
                .set("failureReason", FailureReason.STALE.name())
                .set("finishedAt", clock.instant())
                .unset("lockedBy");
        long failed = mongoTemplate.updateMulti(
                stale(processingBefore, Criteria.where("attempts").gte(maxAttempts)), exhaust, JobDocument.class
        ).getModifiedCount();

        return new ReclaimResult(requeued, failed);
    }

    private static Query stale(Instant processingBefore, Criteria attempts) {
        return new Query(new Criteria().andOperator(
                Criteria.where("status").is(JobStatus.PROCESSING.value()),
                Criteria.where("processedAt").lt(processingBefore),
                attempts
        ));
    }

    private static Query heldBy(String id, String workerId) {
        return new Query(Criteria.where("_id").is(id)
                .and("status").is(JobStatus.PROCESSING.value())
                // Prevent stale write-back if the job was reclaimed in the meantime.
                .and("lockedBy").is(workerId));
    }

    JobRecord toRecord(JobDocument doc) {
        JobStatus status = JobStatus.fromValue(doc.getStatus())
                .orElseThrow(() -> new IllegalStateException("unknown job status '" + doc.getStatus() + "' on job " + doc.getId()));
        FailureReason reason = null;
        if (doc.getFailureReason() != null) {
            try {
                reason = FailureReason.valueOf(doc.getFailureReason());
            } catch (IllegalArgumentException e) {
                reason = FailureReason.EXECUTION_ERROR;
            }
        }
        return new JobRecord(
                doc.getId(),
                doc.getType(),
                doc.getData(),
                status,
                doc.getPriority(),
                doc.getResult(),
                doc.getError(),
                reason,
                doc.getCreatedAt(),
                doc.getProcessedAt(),
                doc.getFinishedAt(),
                doc.getAttempts(),
                doc.getLockedBy()
        );
    }
}
