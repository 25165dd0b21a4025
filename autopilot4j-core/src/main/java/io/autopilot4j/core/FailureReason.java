package io.autopilot4j.core;

/**
 * Why a job ended up {@link JobStatus#FAILED}.
 *
 * <p>The first four are raised by action executors; the rest are recorded by the runtime.
 */
public enum FailureReason {
    LOGIN_REQUIRED,
    TARGET_NOT_FOUND,
    RATE_LIMITED,
    NETWORK_ERROR,

    NO_EXECUTOR,
    RESOURCE_BUSY,
    EXECUTION_ERROR,
    STALE
}
