package io.autopilot4j.internal.memory;

import io.autopilot4j.core.EnqueueResult;
import io.autopilot4j.core.FailureReason;
import io.autopilot4j.core.JobFailure;
import io.autopilot4j.core.JobRecord;
import io.autopilot4j.core.JobSpec;
import io.autopilot4j.core.JobStatus;
import io.autopilot4j.core.ReclaimResult;
import io.autopilot4j.spi.JobStore;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link JobStore} over a {@link ConcurrentHashMap}; every transition is a {@code replace} CAS.
 */
public class InMemoryJobStore implements JobStore {

    private final ConcurrentHashMap<String, JobRecord> jobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> insertionOrder = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryJobStore() {
        this(Clock.systemUTC());
    }

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public EnqueueResult enqueue(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        String id = spec.id() != null ? spec.id() : UUID.randomUUID().toString();
        while (true) {
            JobRecord fresh = pending(id, spec);
            JobRecord existing = jobs.get(id);
            if (existing == null) {
                if (jobs.putIfAbsent(id, fresh) == null) {
                    insertionOrder.put(id, sequence.incrementAndGet());
                    return EnqueueResult.createdResult(id);
                }
                continue;
            }
            if (!existing.status().isTerminal()) {
                return EnqueueResult.noop(id);
            }
            if (jobs.replace(id, existing, fresh)) {
                insertionOrder.put(id, sequence.incrementAndGet());
                return EnqueueResult.requeuedResult(id);
            }
        }
    }

    @Override
    public Optional<JobRecord> claimNext(String workerId) {
        while (true) {
            List<JobRecord> candidates = jobs.values().stream()
                    .filter(j -> j.status() == JobStatus.PENDING)
                    .sorted(Comparator.comparingInt(JobRecord::priority).reversed()
                            .thenComparing(JobRecord::createdAt)
                            .thenComparing(j -> insertionOrder.getOrDefault(j.id(), Long.MAX_VALUE)))
                    .toList();
            if (candidates.isEmpty()) {
                return Optional.empty();
            }
            for (JobRecord c : candidates) {
                JobRecord claimed = new JobRecord(c.id(), c.type(), c.payload(), JobStatus.PROCESSING, c.priority(),
                        null, null, null, c.createdAt(), now(), null, c.attempts() + 1, workerId);
                if (jobs.replace(c.id(), c, claimed)) {
                    return Optional.of(claimed);
                }
            }
        }
    }

    @Override
    public boolean markStarted(String id, String workerId) {
        while (true) {
            JobRecord j = jobs.get(id);
            if (!heldBy(j, workerId)) {
                return false;
            }
            JobRecord started = new JobRecord(j.id(), j.type(), j.payload(), j.status(), j.priority(),
                    null, null, null, j.createdAt(), now(), null, j.attempts(), j.lockedBy());
            if (jobs.replace(id, j, started)) {
                return true;
            }
        }
    }

    @Override
    public boolean complete(String id, String workerId, Map<String, Object> result) {
        while (true) {
            JobRecord j = jobs.get(id);
            if (!heldBy(j, workerId)) {
                return false;
            }
            JobRecord done = new JobRecord(j.id(), j.type(), j.payload(), JobStatus.COMPLETED, j.priority(),
                    result, null, null, j.createdAt(), j.processedAt(), now(), j.attempts(), null);
            if (jobs.replace(id, j, done)) {
                return true;
            }
        }
    }

    @Override
    public boolean fail(String id, String workerId, JobFailure failure) {
        while (true) {
            JobRecord j = jobs.get(id);
            if (!heldBy(j, workerId)) {
                return false;
            }
            if (jobs.replace(id, j, failed(j, failure.reason(), failure.message()))) {
                return true;
            }
        }
    }

    @Override
    public Optional<JobRecord> findById(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    @Override
    public List<JobRecord> findRecent(JobStatus status, int limit) {
        return jobs.values().stream()
                .filter(j -> status == null || j.status() == status)
                .sorted(Comparator.comparing(InMemoryJobStore::lastTouched).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus s : JobStatus.values()) {
            counts.put(s, 0L);
        }
        for (JobRecord j : jobs.values()) {
            counts.merge(j.status(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public ReclaimResult reclaimStale(Instant processingBefore, int maxAttempts) {
        long requeued = 0;
        long failed = 0;
        for (JobRecord j : jobs.values()) {
            if (j.status() != JobStatus.PROCESSING || j.processedAt() == null || !j.processedAt().isBefore(processingBefore)) {
                continue;
            }
            if (j.attempts() < maxAttempts) {
                JobRecord back = new JobRecord(j.id(), j.type(), j.payload(), JobStatus.PENDING, j.priority(),
                        null, null, null, j.createdAt(), null, null, j.attempts(), null);
                if (jobs.replace(j.id(), j, back)) {
                    requeued++;
                }
            } else if (jobs.replace(j.id(), j, failed(j, FailureReason.STALE, "processing exceeded stale threshold"))) {
                failed++;
            }
        }
        return new ReclaimResult(requeued, failed);
    }

    private JobRecord pending(String id, JobSpec spec) {
        return new JobRecord(id, spec.type(), spec.payload(), JobStatus.PENDING, spec.priority(),
                null, null, null, now(), null, null, 0, null);
    }

    private JobRecord failed(JobRecord j, FailureReason reason, String message) {
        return new JobRecord(j.id(), j.type(), j.payload(), JobStatus.FAILED, j.priority(),
                null, message, reason, j.createdAt(), j.processedAt(), now(), j.attempts(), null);
    }

    private static boolean heldBy(JobRecord j, String workerId) {
        return j != null && j.status() == JobStatus.PROCESSING && Objects.equals(j.lockedBy(), workerId);
    }

    private static Instant lastTouched(JobRecord j) {
        if (j.finishedAt() != null) return j.finishedAt();
        if (j.processedAt() != null) return j.processedAt();
        return j.createdAt();
    }

    private Instant now() {
        return clock.instant();
    }
}
