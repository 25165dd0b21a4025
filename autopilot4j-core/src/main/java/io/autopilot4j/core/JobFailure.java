package io.autopilot4j.core;

import java.util.Objects;

public record JobFailure(FailureReason reason, String message) {

    public JobFailure {
        Objects.requireNonNull(reason, "reason must not be null");
    }

    /**
     * Maps an arbitrary execution error onto a failure record.
     */
    public static JobFailure of(Throwable error) {
        if (error instanceof ActionException ae) {
            return new JobFailure(ae.reason(), ae.getMessage());
        }
        if (error instanceof ResourceBusyException) {
            return new JobFailure(FailureReason.RESOURCE_BUSY, error.getMessage());
        }
        String msg = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        return new JobFailure(FailureReason.EXECUTION_ERROR, msg);
    }
}
