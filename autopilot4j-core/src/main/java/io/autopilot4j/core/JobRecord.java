package io.autopilot4j.core;

import java.time.Instant;
import java.util.Map;

/**
 * Read view of a persisted job.
 */
public record JobRecord(
        String id,
        String type,
        Map<String, Object> payload,
        JobStatus status,
        int priority,
        Map<String, Object> result,
        String error,
        FailureReason failureReason,
        Instant createdAt,
        Instant processedAt,
        Instant finishedAt,
        int attempts,
        String lockedBy
) {
    public JobRecord {
        payload = payload == null ? Map.of() : payload;
    }
}
