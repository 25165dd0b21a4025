package io.autopilot4j.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One fixed-length window of a {@link DailySchedule}.
 *
 * <p>{@code activityType} is kept as the raw catalog key so that a schedule persisted by an
 * older catalog still loads; resolution to {@link ActivityType} happens at dispatch time.
 */
public record ScheduleSlot(
        String id,
        String activityType,
        Instant startTime,
        Instant endTime,
        SlotStatus status,
        int priority
) {
    public ScheduleSlot {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(startTime, "startTime must not be null");
        Objects.requireNonNull(endTime, "endTime must not be null");
        Objects.requireNonNull(status, "status must not be null");
        if (!endTime.isAfter(startTime)) {
            throw new IllegalArgumentException("endTime must be after startTime");
        }
    }

    public ScheduleSlot withStatus(SlotStatus next) {
        return new ScheduleSlot(id, activityType, startTime, endTime, next, priority);
    }

    /**
     * Due when {@code startTime <= now <= endTime}.
     */
    public boolean isDue(Instant now) {
        return !now.isBefore(startTime) && !now.isAfter(endTime);
    }

    public boolean hasEnded(Instant now) {
        return now.isAfter(endTime);
    }
}
