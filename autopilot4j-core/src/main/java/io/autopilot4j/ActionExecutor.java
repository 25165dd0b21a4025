package io.autopilot4j;

import io.autopilot4j.core.ActionException;
import io.autopilot4j.core.ActionResult;
import io.autopilot4j.core.JobKind;
import io.autopilot4j.core.Platform;
import io.autopilot4j.session.AutomationSession;

/**
 * Performs one platform action against an automation session.
 *
 * <p>The job payload is converted to {@link #payloadClass()} with Jackson before the call.
 * Slot-originated payloads carry {@code account}, {@code activity}, {@code platform},
 * {@code slotId} and {@code scheduledFor}; POJO payload classes should ignore unknown properties.
 *
 * <p>Throw {@link ActionException} to record a specific {@link io.autopilot4j.core.FailureReason};
 * anything else is recorded as an execution error.
 */
public interface ActionExecutor<T> {

    String jobType();

    Class<T> payloadClass();

    ActionResult execute(AutomationSession session, T payload) throws Exception;

    /**
     * Platform whose session the action runs in. Derived from {@link #jobType()} for built-in kinds.
     */
    default Platform platform() {
        return JobKind.fromType(jobType())
                .map(JobKind::platform)
                .orElseThrow(() -> new IllegalStateException(
                        "ActionExecutor for custom job type must override platform(): " + jobType()));
    }
}
