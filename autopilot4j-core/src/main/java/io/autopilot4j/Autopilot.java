package io.autopilot4j;

import io.autopilot4j.core.DailySchedule;
import io.autopilot4j.core.EnqueueResult;
import io.autopilot4j.core.GenerationMode;
import io.autopilot4j.core.JobRecord;
import io.autopilot4j.core.JobSpec;
import io.autopilot4j.core.JobStatus;
import io.autopilot4j.core.Platform;
import io.autopilot4j.core.SlotStatus;
import io.autopilot4j.core.TickReport;
import io.autopilot4j.schedule.Distribution;
import io.autopilot4j.session.AutomationSession;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Control surface of the scheduling and dispatch pipeline.
 *
 * <p>Schedule generation, ticks and slot overrides are serialized on one dispatch lane;
 * the remaining operations are safe to call from any thread.
 */
public interface Autopilot {
    void start();

    void stop();

    /**
     * Regenerate today's schedule.
     */
    DailySchedule regenerateSchedule(GenerationMode mode);

    DailySchedule regenerateSchedule(LocalDate date, GenerationMode mode);

    /**
     * Run one dispatcher tick now, in addition to the periodic ones.
     */
    TickReport tick();

    /**
     * Enqueue a job directly, bypassing the schedule.
     */
    EnqueueResult enqueue(JobSpec spec);

    Optional<JobRecord> job(String id);

    /**
     * @param status filter, or null for every status
     */
    List<JobRecord> recentJobs(JobStatus status, int limit);

    Map<JobStatus, Long> jobCounts();

    Optional<DailySchedule> schedule(LocalDate date);

    boolean overrideSlot(LocalDate date, String slotId, SlotStatus status);

    boolean isDispatchEnabled();

    void setDispatchEnabled(boolean enabled);

    /**
     * Current task enablement map (stored or default).
     */
    Map<String, Object> taskConfiguration();

    /**
     * Sets one activity weight of a platform and rebalances the others so the platform sums to 100.
     */
    Distribution updateWeight(Platform platform, String activityKey, int weight);

    Distribution distribution(Platform platform);

    void setActivityEnabled(String activityKey, boolean enabled);

    /**
     * @return the new enabled state
     */
    boolean toggleActivity(String activityKey);

    /**
     * Enables or disables every catalog activity in one write and remembers the choice.
     * Distributions are left untouched.
     */
    void setAllActivitiesEnabled(boolean enabled);

    /**
     * State last set through {@link #setAllActivitiesEnabled}; false when it was never used.
     */
    boolean isAllActivitiesEnabled();

    /**
     * @return the new state
     */
    boolean toggleAllActivities();

    /**
     * Restores default task configuration and distributions and drops today's schedule.
     */
    void resetConfiguration();

    /**
     * Opens (or returns the open) session for an account.
     */
    AutomationSession connect(String account, Platform platform) throws Exception;

    /**
     * Closes the session and erases its profile.
     *
     * @throws io.autopilot4j.core.ResourceBusyException when the session is in use
     */
    boolean disconnect(String account, Platform platform) throws IOException;
}
