package io.autopilot4j.spi;

import io.autopilot4j.core.EnqueueResult;
import io.autopilot4j.core.JobFailure;
import io.autopilot4j.core.JobRecord;
import io.autopilot4j.core.JobSpec;
import io.autopilot4j.core.JobStatus;
import io.autopilot4j.core.ReclaimResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable job queue. Every state transition is a single atomic operation in the backing store.
 */
public interface JobStore {

    /**
     * Upsert keyed by {@link JobSpec#id()}.
     *
     * <p>No-op when a pending or processing job with the same id exists; a completed or
     * failed one is replaced and reset to pending. A spec without id always inserts.
     */
    EnqueueResult enqueue(JobSpec spec);

    /**
     * Atomically moves the best pending job (highest priority, then oldest) to processing.
     * Concurrent callers never receive the same job.
     */
    Optional<JobRecord> claimNext(String workerId);

    /**
     * Re-stamps the processing start of a claimed job to now. Workers call this once they hold
     * the job's session, so time spent queued behind another job on that session does not count
     * toward the stale threshold.
     *
     * @return false when the job is no longer processing under {@code workerId}; the caller must
     *         not execute it
     */
    boolean markStarted(String id, String workerId);

    /**
     * @return false when the job is no longer processing under {@code workerId}
     */
    boolean complete(String id, String workerId, Map<String, Object> result);

    /**
     * @return false when the job is no longer processing under {@code workerId}
     */
    boolean fail(String id, String workerId, JobFailure failure);

    Optional<JobRecord> findById(String id);

    /**
     * Most recently touched jobs, optionally filtered by status (null for all).
     */
    List<JobRecord> findRecent(JobStatus status, int limit);

    Map<JobStatus, Long> countByStatus();

    /**
     * Jobs stuck in processing since before {@code processingBefore} go back to pending,
     * or to failed with reason STALE once {@code maxAttempts} claims were used.
     *
     * <p>The processing start is the claim time until {@link #markStarted} moves it. A worker
     * whose claim is taken here while it still waits for a session sees {@code markStarted}
     * return false and skips the job.
     */
    ReclaimResult reclaimStale(Instant processingBefore, int maxAttempts);
}
