package io.autopilot4j.core;

/**
 * Result of a stale-job sweep.
 *
 * <p>{@code requeued}: jobs put back to pending.
 * {@code failed}: jobs that ran out of attempts and were marked failed.
 */
public record ReclaimResult(long requeued, long failed) {

    public static ReclaimResult empty() {
        return new ReclaimResult(0, 0);
    }

    public long total() {
        return requeued + failed;
    }
}
