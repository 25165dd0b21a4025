package io.autopilot4j.schedule;

import io.autopilot4j.core.ActivityType;
import io.autopilot4j.core.DailySchedule;
import io.autopilot4j.core.ScheduleSlot;
import io.autopilot4j.core.SlotStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Lays enabled activities round-robin over the 96 quarter-hour slots of a day.
 *
 * <p>Slot {@code i} starts at {@code startOfDay(date, zone) + i * 15min}. On days with a
 * DST shift the 96 slots therefore end an hour early or run an hour into the next day.
 */
public class ScheduleGenerator {

    public static final Duration SLOT_DURATION = Duration.ofMinutes(15);
    public static final int SLOTS_PER_DAY = 96;

    private static final DateTimeFormatter SLOT_TIME = DateTimeFormatter.ofPattern("HHmm");

    private final ZoneId zone;
    private final Clock clock;

    public ScheduleGenerator(ZoneId zone, Clock clock) {
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public ZoneId zone() {
        return zone;
    }

    public DailySchedule generate(LocalDate date, TaskEnablement enablement) {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(enablement, "enablement must not be null");

        List<ActivityType> candidates = candidates(enablement);
        Instant dayStart = date.atStartOfDay(zone).toInstant();

        List<ScheduleSlot> slots = new ArrayList<>(SLOTS_PER_DAY);
        for (int i = 0; i < SLOTS_PER_DAY; i++) {
            slots.add(newSlot(date, slotStart(dayStart, i), candidates.get(i % candidates.size())));
        }
        return new DailySchedule(date, slots, clock.instant());
    }

    /**
     * Overlays {@code distributions} on {@code configuration} and generates from the result.
     */
    public DailySchedule generate(LocalDate date, Map<String, ?> configuration, Distribution... distributions) {
        TaskEnablement enablement = TaskEnablement.from(configuration);
        for (Distribution d : distributions) {
            enablement = enablement.overlay(d);
        }
        return generate(date, enablement);
    }

    /**
     * Keeps completed and in-progress slots of {@code existing} and regenerates the rest.
     *
     * <p>Slots are matched by start time, so a partial schedule is completed to the full day.
     */
    public DailySchedule fillMissing(DailySchedule existing, TaskEnablement enablement) {
        Objects.requireNonNull(existing, "existing must not be null");
        Objects.requireNonNull(enablement, "enablement must not be null");

        LocalDate date = existing.date();
        Map<Instant, ScheduleSlot> retained = new HashMap<>();
        for (ScheduleSlot s : existing.slots()) {
            if (s.status().isRetainedOnFill()) {
                retained.put(s.startTime(), s);
            }
        }

        List<ActivityType> candidates = candidates(enablement);
        Instant dayStart = date.atStartOfDay(zone).toInstant();

        List<ScheduleSlot> slots = new ArrayList<>(SLOTS_PER_DAY);
        int cursor = 0;
        for (int i = 0; i < SLOTS_PER_DAY; i++) {
            Instant start = slotStart(dayStart, i);
            ScheduleSlot kept = retained.get(start);
            if (kept != null) {
                slots.add(kept);
            } else {
                slots.add(newSlot(date, start, candidates.get(cursor++ % candidates.size())));
            }
        }
        return new DailySchedule(date, slots, clock.instant());
    }

    static List<ActivityType> candidates(TaskEnablement enablement) {
        List<ActivityType> enabled = enablement.enabledActivities();
        return enabled.isEmpty() ? List.of(ActivityType.IDLE) : enabled;
    }

    private static Instant slotStart(Instant dayStart, int index) {
        return dayStart.plus(SLOT_DURATION.multipliedBy(index));
    }

    private ScheduleSlot newSlot(LocalDate date, Instant start, ActivityType activity) {
        String id = "slot_" + date.format(DateTimeFormatter.BASIC_ISO_DATE)
                + "_" + SLOT_TIME.format(start.atZone(zone))
                + "_" + UUID.randomUUID().toString().substring(0, 8);
        return new ScheduleSlot(
                id,
                activity.key(),
                start,
                start.plus(SLOT_DURATION),
                SlotStatus.PENDING,
                activity.priority()
        );
    }
}
