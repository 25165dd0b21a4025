package io.autopilot4j.internal;

import io.autopilot4j.core.ActivityType;
import io.autopilot4j.core.DailySchedule;
import io.autopilot4j.core.EnqueueResult;
import io.autopilot4j.core.GenerationMode;
import io.autopilot4j.core.JobKind;
import io.autopilot4j.core.JobRecord;
import io.autopilot4j.core.JobSpec;
import io.autopilot4j.core.ScheduleSlot;
import io.autopilot4j.core.SlotStatus;
import io.autopilot4j.core.TickReport;
import io.autopilot4j.spi.JobStore;
import io.autopilot4j.spi.ScheduleStore;
import io.autopilot4j.spi.SettingsStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns due schedule slots into jobs and mirrors finished jobs back onto their slots.
 *
 * <p>A slot's job uses the slot id as job id, so running {@link #tick()} any number of
 * times within one slot window leaves exactly one job. Every slot transition is a
 * compare-and-set in the {@link ScheduleStore}; a store failure aborts the tick and the
 * next tick picks up where it stopped.
 *
 * <p>Not thread-safe by itself: callers run ticks on a single lane.
 */
public class ScheduleDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ScheduleDispatcher.class);

    private final ScheduleStore scheduleStore;
    private final JobStore jobStore;
    private final SettingsStore settingsStore;
    private final SchedulePlanner planner;
    private final Clock clock;
    private final ZoneId zone;
    private final Options options;

    /**
     * @param defaultAccount           account written into slot job payloads
     * @param dispatchEnabledByDefault used while no dispatch flag was stored
     * @param autoGenerateSchedule     generate today's schedule on a tick that finds none
     * @param skipMissedSlots          mark pending slots whose window has closed as skipped
     */
    public record Options(
            String defaultAccount,
            boolean dispatchEnabledByDefault,
            boolean autoGenerateSchedule,
            boolean skipMissedSlots
    ) {
        public Options {
            Objects.requireNonNull(defaultAccount, "defaultAccount must not be null");
        }

        public static Options defaults() {
            return new Options("default", true, true, true);
        }
    }

    public ScheduleDispatcher(
            ScheduleStore scheduleStore,
            JobStore jobStore,
            SettingsStore settingsStore,
            SchedulePlanner planner,
            Clock clock,
            ZoneId zone,
            Options options
    ) {
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.settingsStore = Objects.requireNonNull(settingsStore, "settingsStore must not be null");
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public boolean isDispatchEnabled() {
        return settingsStore.loadDispatchEnabled().orElse(options.dispatchEnabledByDefault());
    }

    public LocalDate today() {
        return LocalDate.ofInstant(clock.instant(), zone);
    }

    public TickReport tick() {
        if (!isDispatchEnabled()) {
            log.debug("autopilot tick skipped; dispatch is paused");
            return TickReport.pausedReport();
        }

        Instant now = clock.instant();
        LocalDate date = LocalDate.ofInstant(now, zone);

        DailySchedule schedule;
        Optional<DailySchedule> loaded = scheduleStore.load(date);
        if (loaded.isPresent()) {
            schedule = loaded.get();
        } else if (options.autoGenerateSchedule()) {
            log.info("autopilot no schedule for date={}; generating", date);
            schedule = planner.regenerate(date, GenerationMode.FULL);
        } else {
            log.debug("autopilot no schedule for date={}; nothing to dispatch", date);
            return TickReport.empty(date);
        }

        int enqueued = 0;
        int reflected = 0;
        int skipped = 0;
        int missed = 0;

        for (ScheduleSlot slot : schedule.slots()) {
            switch (slot.status()) {
                case IN_PROGRESS -> {
                    if (reflectJob(date, slot, SlotStatus.IN_PROGRESS)) {
                        reflected++;
                    }
                }
                case PENDING -> {
                    if (slot.isDue(now)) {
                        switch (dispatch(date, slot)) {
                            case ENQUEUED -> enqueued++;
                            case REFLECTED -> reflected++;
                            case SKIPPED -> skipped++;
                            case UNCHANGED -> {
                            }
                        }
                    } else if (options.skipMissedSlots() && slot.hasEnded(now)) {
                        if (scheduleStore.compareAndSetSlotStatus(date, slot.id(), SlotStatus.PENDING, SlotStatus.SKIPPED)) {
                            log.debug("autopilot slot missed slotId={} activity={} end={}", slot.id(), slot.activityType(), slot.endTime());
                            missed++;
                        }
                    }
                }
                default -> {
                }
            }
        }

        TickReport report = new TickReport(false, date, enqueued, reflected, skipped, missed);
        if (report.changedAnything()) {
            log.info("autopilot tick date={} enqueued={} reflected={} skipped={} missed={}",
                    date, enqueued, reflected, skipped, missed);
        } else {
            log.debug("autopilot tick date={} no changes", date);
        }
        return report;
    }

    private enum Outcome {ENQUEUED, REFLECTED, SKIPPED, UNCHANGED}

    private Outcome dispatch(LocalDate date, ScheduleSlot slot) {
        Optional<ActivityType> activity = ActivityType.fromKey(slot.activityType());
        Optional<JobKind> kind = activity.flatMap(ActivityType::jobKind);

        if (kind.isEmpty()) {
            if (activity.isPresent()) {
                log.debug("autopilot slot has no job to run slotId={} activity={}", slot.id(), slot.activityType());
            } else {
                log.warn("autopilot unknown activity in schedule; skipping slot slotId={} activity={}",
                        slot.id(), slot.activityType());
            }
            boolean changed = scheduleStore.compareAndSetSlotStatus(date, slot.id(), SlotStatus.PENDING, SlotStatus.SKIPPED);
            return changed ? Outcome.SKIPPED : Outcome.UNCHANGED;
        }

        Optional<JobRecord> existing = jobStore.findById(slot.id());
        if (existing.isPresent() && existing.get().status().isTerminal()) {
            // job already ran for this slot; never run it twice
            return reflectJob(date, slot, SlotStatus.PENDING) ? Outcome.REFLECTED : Outcome.UNCHANGED;
        }

        JobSpec spec = new JobSpec(slot.id(), kind.get().type(), payloadFor(slot, activity.get()), slot.priority());
        EnqueueResult result = jobStore.enqueue(spec);
        scheduleStore.compareAndSetSlotStatus(date, slot.id(), SlotStatus.PENDING, SlotStatus.IN_PROGRESS);

        if (result.accepted()) {
            log.debug("autopilot slot dispatched slotId={} type={} priority={}", slot.id(), spec.type(), spec.priority());
            return Outcome.ENQUEUED;
        }
        return Outcome.UNCHANGED;
    }

    private boolean reflectJob(LocalDate date, ScheduleSlot slot, SlotStatus expected) {
        Optional<JobRecord> job = jobStore.findById(slot.id());
        if (job.isEmpty() || !job.get().status().isTerminal()) {
            return false;
        }
        SlotStatus next = SlotStatus.reflecting(job.get().status());
        boolean changed = scheduleStore.compareAndSetSlotStatus(date, slot.id(), expected, next);
        if (changed) {
            log.debug("autopilot slot reflected slotId={} status={}", slot.id(), next.value());
        }
        return changed;
    }

    private Map<String, Object> payloadFor(ScheduleSlot slot, ActivityType activity) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("account", options.defaultAccount());
        payload.put("activity", activity.key());
        payload.put("platform", activity.platform().value());
        payload.put("slotId", slot.id());
        payload.put("scheduledFor", slot.startTime().toString());
        if (activity.variant() != null) {
            payload.put("variant", activity.variant());
        }
        return payload;
    }
}
