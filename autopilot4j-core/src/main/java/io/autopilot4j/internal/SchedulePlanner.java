package io.autopilot4j.internal;

import io.autopilot4j.core.DailySchedule;
import io.autopilot4j.core.GenerationMode;
import io.autopilot4j.core.SlotStatus;
import io.autopilot4j.schedule.DefaultDistributions;
import io.autopilot4j.schedule.ScheduleGenerator;
import io.autopilot4j.schedule.TaskEnablement;
import io.autopilot4j.spi.ScheduleStore;
import io.autopilot4j.spi.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds and persists daily schedules from the stored task configuration.
 */
public class SchedulePlanner {
    private static final Logger log = LoggerFactory.getLogger(SchedulePlanner.class);

    private final ScheduleStore scheduleStore;
    private final SettingsStore settingsStore;
    private final ScheduleGenerator generator;

    public SchedulePlanner(ScheduleStore scheduleStore, SettingsStore settingsStore, ScheduleGenerator generator) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.settingsStore = Objects.requireNonNull(settingsStore, "settingsStore must not be null");
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
    }

    /**
     * Stored task configuration, or the built-in defaults when none was saved yet.
     */
    public Map<String, Object> taskConfiguration() {
        return settingsStore.loadTaskConfiguration().orElseGet(DefaultDistributions::taskConfiguration);
    }

    public TaskEnablement currentEnablement() {
        return TaskEnablement.from(taskConfiguration());
    }

    public DailySchedule regenerate(LocalDate date, GenerationMode mode) {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(mode, "mode must not be null");

        TaskEnablement enablement = currentEnablement();
        DailySchedule schedule = switch (mode) {
            case FULL -> generator.generate(date, enablement);
            case FILL_MISSING -> scheduleStore.load(date)
                    .map(existing -> generator.fillMissing(existing, enablement))
                    .orElseGet(() -> generator.generate(date, enablement));
        };
        scheduleStore.save(schedule);

        log.info("autopilot schedule generated date={} mode={} slots={} kept={} activities={}",
                date, mode, schedule.slots().size(),
                schedule.countByStatus(SlotStatus.COMPLETED) + schedule.countByStatus(SlotStatus.IN_PROGRESS),
                enablement.enabledActivities().size());
        return schedule;
    }

    /**
     * Loads the schedule for {@code date}, generating it when missing.
     */
    public DailySchedule ensureSchedule(LocalDate date) {
        Optional<DailySchedule> existing = scheduleStore.load(date);
        return existing.orElseGet(() -> regenerate(date, GenerationMode.FULL));
    }
}
