package io.autopilot4j.core;

import java.util.Objects;

/**
 * Typed failure raised by an action executor. The worker records {@link #reason()} on the job.
 */
public class ActionException extends Exception {

    private final FailureReason reason;

    public ActionException(FailureReason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public ActionException(FailureReason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "reason must not be null");
    }

    public FailureReason reason() {
        return reason;
    }
}
