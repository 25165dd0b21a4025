package io.autopilot4j.core;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record DailySchedule(LocalDate date, List<ScheduleSlot> slots, Instant generatedAt) {

    public DailySchedule {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(generatedAt, "generatedAt must not be null");
        slots = slots == null ? List.of() : List.copyOf(slots);
    }

    public Optional<ScheduleSlot> slot(String slotId) {
        return slots.stream().filter(s -> s.id().equals(slotId)).findFirst();
    }

    public long countByStatus(SlotStatus status) {
        return slots.stream().filter(s -> s.status() == status).count();
    }
}
