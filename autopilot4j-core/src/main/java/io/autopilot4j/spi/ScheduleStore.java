package io.autopilot4j.spi;

import io.autopilot4j.core.DailySchedule;
import io.autopilot4j.core.SlotStatus;

import java.time.LocalDate;
import java.util.Optional;

public interface ScheduleStore {

    Optional<DailySchedule> load(LocalDate date);

    /**
     * Replaces the whole schedule for {@link DailySchedule#date()}.
     */
    void save(DailySchedule schedule);

    /**
     * Sets the slot status only if it currently equals {@code expected}.
     *
     * @return true when the slot was updated
     */
    boolean compareAndSetSlotStatus(LocalDate date, String slotId, SlotStatus expected, SlotStatus next);

    /**
     * Unconditional status change for operator overrides.
     *
     * @return false when the slot does not exist
     */
    boolean overrideSlotStatus(LocalDate date, String slotId, SlotStatus status);

    boolean delete(LocalDate date);
}
