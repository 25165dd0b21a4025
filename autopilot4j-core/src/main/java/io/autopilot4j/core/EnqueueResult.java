package io.autopilot4j.core;

/**
 * Outcome of {@link io.autopilot4j.spi.JobStore#enqueue(JobSpec)}.
 *
 * <p>{@code created}: no job with this id existed. {@code requeued}: a terminal job with
 * this id was replaced. Neither: a live job already existed and nothing changed.
 */
public record EnqueueResult(String id, boolean created, boolean requeued) {

    public static EnqueueResult createdResult(String id) {
        return new EnqueueResult(id, true, false);
    }

    public static EnqueueResult requeuedResult(String id) {
        return new EnqueueResult(id, false, true);
    }

    public static EnqueueResult noop(String id) {
        return new EnqueueResult(id, false, false);
    }

    public boolean accepted() {
        return created || requeued;
    }
}
