package io.autopilot4j.core;

import java.util.Optional;

public enum SlotStatus {
    PENDING("pending"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    SKIPPED("skipped");

    private final String value;

    SlotStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Slots in these states survive a fill-missing regeneration.
     */
    public boolean isRetainedOnFill() {
        return this == COMPLETED || this == IN_PROGRESS;
    }

    public static Optional<SlotStatus> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (SlotStatus s : values()) {
            if (s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    /**
     * Slot status that mirrors a terminal job status.
     */
    public static SlotStatus reflecting(JobStatus jobStatus) {
        return switch (jobStatus) {
            case COMPLETED -> COMPLETED;
            case FAILED -> FAILED;
            case PENDING, PROCESSING -> IN_PROGRESS;
        };
    }
}
