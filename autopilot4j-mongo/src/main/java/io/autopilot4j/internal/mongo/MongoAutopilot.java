package io.autopilot4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.autopilot4j.Autopilot;
import io.autopilot4j.config.AutopilotProperties;
import io.autopilot4j.core.ActionExecutorRegistry;
import io.autopilot4j.core.ActivityType;
import io.autopilot4j.core.DailySchedule;
import io.autopilot4j.core.EnqueueResult;
import io.autopilot4j.core.GenerationMode;
import io.autopilot4j.core.JobRecord;
import io.autopilot4j.core.JobSpec;
import io.autopilot4j.core.JobStatus;
import io.autopilot4j.core.Platform;
import io.autopilot4j.core.ReclaimResult;
import io.autopilot4j.core.SlotStatus;
import io.autopilot4j.core.TickReport;
import io.autopilot4j.internal.JobWorkerPool;
import io.autopilot4j.internal.ScheduleDispatcher;
import io.autopilot4j.internal.SchedulePlanner;
import io.autopilot4j.schedule.DefaultDistributions;
import io.autopilot4j.schedule.Distribution;
import io.autopilot4j.schedule.DistributionBalancer;
import io.autopilot4j.schedule.ScheduleGenerator;
import io.autopilot4j.schedule.TaskEnablement;
import io.autopilot4j.session.AutomationSession;
import io.autopilot4j.session.SessionKey;
import io.autopilot4j.session.SessionManager;
import io.autopilot4j.spi.JobStore;
import io.autopilot4j.spi.ScheduleStore;
import io.autopilot4j.spi.SettingsStore;
import io.autopilot4j.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Autopilot is a Mongo-backed engagement scheduler &amp; runner.
 *
 * <p>Core capabilities:
 * <ul>
 *   <li>Daily schedules of 15-minute slots generated from the task configuration</li>
 *   <li>A dispatch lane that turns due slots into jobs and reflects finished jobs back</li>
 *   <li>A worker pool that executes jobs inside per-account automation sessions</li>
 * </ul>
 *
 * <p>Typical usage:
 * <pre>{@code
 * autopilot.start();
 *
 * autopilot.updateWeight(Platform.TWITTER, "tweet", 40);
 * autopilot.regenerateSchedule(GenerationMode.FILL_MISSING);
 *
 * autopilot.enqueue(JobSpec.of(JobKind.TWITTER_POST, Map.of("account", "main")));
 * autopilot.stop();
 * }</pre>
 */
public class MongoAutopilot implements Autopilot, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MongoAutopilot.class);

    private final AutopilotProperties props;
    private final JobStore jobStore;
    private final ScheduleStore scheduleStore;
    private final SettingsStore settingsStore;
    private final SessionManager sessionManager;
    private final Clock clock;
    private final ZoneId zone;

    private final SchedulePlanner planner;
    private final ScheduleDispatcher dispatcher;
    private final JobWorkerPool workerPool;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final ScheduledExecutorService lane;
    private volatile Thread laneThread;

    private ScheduledFuture<?> tickTask;
    private ScheduledFuture<?> reapTask;
    private volatile ScheduledFuture<?> rolloverTask;

    // Serializes read-modify-write of the task configuration.
    private final Object settingsLock = new Object();

    private final String workerId;

    public MongoAutopilot(
            AutopilotProperties props,
            JobStore jobStore,
            ScheduleStore scheduleStore,
            SettingsStore settingsStore,
            SessionManager sessionManager,
            ActionExecutorRegistry registry,
            ObjectMapper objectMapper
    ) {
        this(props, jobStore, scheduleStore, settingsStore, sessionManager, registry, objectMapper, Clock.systemUTC());
    }

    public MongoAutopilot(
            AutopilotProperties props,
            JobStore jobStore,
            ScheduleStore scheduleStore,
            SettingsStore settingsStore,
            SessionManager sessionManager,
            ActionExecutorRegistry registry,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.props = Objects.requireNonNull(props, "props must not be null");
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.scheduleStore = Objects.requireNonNull(scheduleStore, "scheduleStore must not be null");
        this.settingsStore = Objects.requireNonNull(settingsStore, "settingsStore must not be null");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager must not be null");
        Objects.requireNonNull(registry, "registry must not be null");
        Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.zone = props.zoneId();
        this.workerId = resolveWorkerId(props.getWorkerId());

        this.planner = new SchedulePlanner(scheduleStore, settingsStore, new ScheduleGenerator(zone, clock));
        this.dispatcher = new ScheduleDispatcher(
                scheduleStore,
                jobStore,
                settingsStore,
                planner,
                clock,
                zone,
                new ScheduleDispatcher.Options(
                        props.getDefaultAccount(),
                        props.isDispatchEnabledByDefault(),
                        props.isAutoGenerateSchedule(),
                        props.isSkipMissedSlots()
                )
        );
        this.workerPool = new JobWorkerPool(
                jobStore,
                sessionManager,
                registry,
                objectMapper,
                new JobWorkerPool.Options(
                        props.getWorkerConcurrency(),
                        props.getPollEvery(),
                        workerId,
                        props.getDefaultAccount()
                )
        );
        this.lane = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("autopilot.dispatcher");
            t.setDaemon(true);
            laneThread = t;
            return t;
        });
    }

    /**
     * Start ticking, sweeping and executing. Should be idempotent.
     */
    @Override
    public synchronized void start() {
        if (started.get()) {
            return;
        }

        Duration dispatchEvery = requirePositive(props.getDispatchEvery(), "autopilot.dispatchEvery");
        Duration reapEvery = requirePositive(props.getReapEvery(), "autopilot.reapEvery");
        requirePositive(props.getStaleJobThreshold(), "autopilot.staleJobThreshold");
        if (!IntervalParser.isValidSpec(props.getRolloverAt())) {
            throw new IllegalArgumentException("autopilot.rolloverAt is not a valid cron or 'AT HH:mm' spec: " + props.getRolloverAt());
        }
        started.set(true);

        log.info("autopilot starting dispatchEvery={} pollEvery={} workerId={} concurrency={} timezone={} rolloverAt={}",
                dispatchEvery,
                props.getPollEvery(),
                workerId,
                props.getWorkerConcurrency(),
                zone,
                props.getRolloverAt());

        workerPool.start();
        tickTask = lane.scheduleWithFixedDelay(this::safeTick, 0, dispatchEvery.toMillis(), TimeUnit.MILLISECONDS);
        reapTask = lane.scheduleWithFixedDelay(this::safeReap, reapEvery.toMillis(), reapEvery.toMillis(), TimeUnit.MILLISECONDS);
        scheduleRollover();

        log.info("autopilot started successfully.");
    }

    /**
     * Stop ticking and wait for running jobs. Should be idempotent.
     */
    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("autopilot stopping...");
        cancel(tickTask);
        cancel(reapTask);
        cancel(rolloverTask);
        tickTask = null;
        reapTask = null;
        rolloverTask = null;

        workerPool.stop(props.getShutdownGrace());
        log.info("autopilot stopped successfully.");
    }

    @Override
    public void close() {
        stop();
        lane.shutdown();
        try {
            if (!lane.awaitTermination(props.getShutdownGrace().toSeconds(), TimeUnit.SECONDS)) {
                lane.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            lane.shutdownNow();
        }
    }

    public boolean isStarted() {
        return started.get();
    }

    public ZoneId zone() {
        return zone;
    }

    @Override
    public DailySchedule regenerateSchedule(GenerationMode mode) {
        return regenerateSchedule(dispatcher.today(), mode);
    }

    @Override
    public DailySchedule regenerateSchedule(LocalDate date, GenerationMode mode) {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        return onLane(() -> planner.regenerate(date, mode));
    }

    @Override
    public TickReport tick() {
        TickReport report = onLane(dispatcher::tick);
        if (report.enqueued() > 0) {
            workerPool.wakeUp();
        }
        return report;
    }

    @Override
    public EnqueueResult enqueue(JobSpec spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        EnqueueResult result = jobStore.enqueue(spec);
        log.debug("autopilot enqueue type={} id={} created={} requeued={}",
                spec.type(), result.id(), result.created(), result.requeued());
        if (result.accepted()) {
            workerPool.wakeUp();
        }
        return result;
    }

    @Override
    public Optional<JobRecord> job(String id) {
        Objects.requireNonNull(id, "id must not be null");
        return jobStore.findById(id);
    }

    @Override
    public List<JobRecord> recentJobs(JobStatus status, int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be a positive number");
        }
        return jobStore.findRecent(status, limit);
    }

    @Override
    public Map<JobStatus, Long> jobCounts() {
        return jobStore.countByStatus();
    }

    @Override
    public Optional<DailySchedule> schedule(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return scheduleStore.load(date);
    }

    @Override
    public boolean overrideSlot(LocalDate date, String slotId, SlotStatus status) {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(slotId, "slotId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        boolean changed = onLane(() -> scheduleStore.overrideSlotStatus(date, slotId, status));
        log.info("autopilot slot override date={} slotId={} status={} changed={}", date, slotId, status.value(), changed);
        return changed;
    }

    @Override
    public boolean isDispatchEnabled() {
        return dispatcher.isDispatchEnabled();
    }

    @Override
    public void setDispatchEnabled(boolean enabled) {
        settingsStore.saveDispatchEnabled(enabled);
        log.info("autopilot dispatch {}", enabled ? "resumed" : "paused");
    }

    @Override
    public Map<String, Object> taskConfiguration() {
        return planner.taskConfiguration();
    }

    @Override
    public Distribution distribution(Platform platform) {
        Objects.requireNonNull(platform, "platform must not be null");
        return settingsStore.loadDistribution(platform).orElseGet(() -> DefaultDistributions.forPlatform(platform));
    }

    @Override
    public Distribution updateWeight(Platform platform, String activityKey, int weight) {
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(activityKey, "activityKey must not be null");

        synchronized (settingsLock) {
            Distribution previous = distribution(platform);
            Distribution next = DistributionBalancer.rebalance(previous, activityKey, weight);
            settingsStore.saveDistribution(platform, next);

            ensureStoredConfiguration();
            for (String key : next.keys()) {
                settingsStore.setTaskFlag(key, next.weight(key));
            }
            log.info("autopilot weights updated platform={} key={} weight={} distribution={}",
                    platform.value(), activityKey, weight, next.asMap());
            return next;
        }
    }

    @Override
    public void setActivityEnabled(String activityKey, boolean enabled) {
        ActivityType activity = requireActivity(activityKey);
        synchronized (settingsLock) {
            ensureStoredConfiguration();
            settingsStore.setTaskFlag(activity.key(), enabled);
        }
        log.info("autopilot activity {} key={}", enabled ? "enabled" : "disabled", activity.key());
    }

    @Override
    public boolean toggleActivity(String activityKey) {
        ActivityType activity = requireActivity(activityKey);
        boolean next;
        synchronized (settingsLock) {
            next = !TaskEnablement.from(planner.taskConfiguration()).isEnabled(activity);
            ensureStoredConfiguration();
            settingsStore.setTaskFlag(activity.key(), next);
        }
        log.info("autopilot activity toggled key={} enabled={}", activity.key(), next);
        return next;
    }

    @Override
    public void setAllActivitiesEnabled(boolean enabled) {
        synchronized (settingsLock) {
            writeAllActivities(enabled);
        }
        log.info("autopilot all activities {}", enabled ? "enabled" : "disabled");
    }

    @Override
    public boolean isAllActivitiesEnabled() {
        return settingsStore.loadAllActivitiesEnabled().orElse(false);
    }

    @Override
    public boolean toggleAllActivities() {
        boolean next;
        synchronized (settingsLock) {
            next = !isAllActivitiesEnabled();
            writeAllActivities(next);
        }
        log.info("autopilot all activities toggled enabled={}", next);
        return next;
    }

    @Override
    public void resetConfiguration() {
        synchronized (settingsLock) {
            settingsStore.clearConfiguration();
        }
        LocalDate today = dispatcher.today();
        boolean dropped = onLane(() -> scheduleStore.delete(today));
        log.info("autopilot configuration reset to defaults date={} scheduleDropped={}", today, dropped);
    }

    @Override
    public AutomationSession connect(String account, Platform platform) throws Exception {
        return sessionManager.get(new SessionKey(account, platform));
    }

    @Override
    public boolean disconnect(String account, Platform platform) throws IOException {
        return sessionManager.disconnect(new SessionKey(account, platform));
    }

    /**
     * Utility: current scheduler time source (useful for tests).
     */
    protected Instant nowInstant() {
        return clock.instant();
    }

    private void ensureStoredConfiguration() {
        if (settingsStore.loadTaskConfiguration().isEmpty()) {
            settingsStore.saveTaskConfiguration(DefaultDistributions.taskConfiguration());
        }
    }

    private void writeAllActivities(boolean enabled) {
        ensureStoredConfiguration();
        Map<String, Object> flags = new LinkedHashMap<>();
        for (ActivityType t : ActivityType.values()) {
            if (t != ActivityType.IDLE) {
                flags.put(t.key(), enabled);
            }
        }
        settingsStore.setTaskFlags(flags);
        settingsStore.saveAllActivitiesEnabled(enabled);
    }

    private static ActivityType requireActivity(String activityKey) {
        return ActivityType.fromKey(activityKey)
                .orElseThrow(() -> new IllegalArgumentException("unknown activity type: " + activityKey));
    }

    private void safeTick() {
        try {
            TickReport report = dispatcher.tick();
            if (report.enqueued() > 0) {
                workerPool.wakeUp();
            }
        } catch (Exception e) {
            log.error("autopilot tick failed msg={}", e.getMessage(), e);
        }
    }

    private void safeReap() {
        try {
            Instant cutoff = nowInstant().minus(props.getStaleJobThreshold());
            ReclaimResult result = jobStore.reclaimStale(cutoff, props.getMaxAttempts());
            if (result.total() > 0) {
                log.warn("autopilot reclaimed stale jobs requeued={} failed={} cutoff={}",
                        result.requeued(), result.failed(), cutoff);
                if (result.requeued() > 0) {
                    workerPool.wakeUp();
                }
            }
        } catch (Exception e) {
            log.error("autopilot stale sweep failed msg={}", e.getMessage(), e);
        }
    }

    private void scheduleRollover() {
        if (!started.get()) {
            return;
        }
        Instant now = nowInstant();
        Instant next = IntervalParser.nextOccurrence(props.getRolloverAt(), zone, now);
        long delay = Math.max(0L, Duration.between(now, next).toMillis());
        rolloverTask = lane.schedule(this::rollover, delay, TimeUnit.MILLISECONDS);
        log.debug("autopilot next rollover at={}", next);
    }

    private void rollover() {
        try {
            LocalDate today = dispatcher.today();
            planner.ensureSchedule(today);
            planner.ensureSchedule(today.plusDays(1));
            log.info("autopilot rollover done date={}", today);
        } catch (Exception e) {
            log.error("autopilot rollover failed msg={}", e.getMessage(), e);
        } finally {
            scheduleRollover();
        }
    }

    private <T> T onLane(Callable<T> task) {
        if (Thread.currentThread() == laneThread) {
            try {
                return task.call();
            } catch (RuntimeException e) {
                throw e;
            } catch (Exception e) {
                throw new IllegalStateException(e.getMessage(), e);
            }
        }
        try {
            return lane.submit(task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while waiting for the dispatch lane", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause.getMessage(), cause);
        }
    }

    private static void cancel(ScheduledFuture<?> future) {
        if (future != null) {
            future.cancel(false);
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name + " must not be null");
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
        return d;
    }

    private static String resolveWorkerId(String configuredWorkerId) {
        if (configuredWorkerId != null && !configuredWorkerId.isBlank()) {
            return configuredWorkerId;
        }

        String host = "autopilot4j";
        try {
            host = java.net.InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.debug("autopilot could not resolve host name msg={}", e.getMessage());
        }

        String pid = String.valueOf(ProcessHandle.current().pid());

        String generated = host + "-" + pid + "-" + java.util.UUID.randomUUID();
        if (generated.length() > 120) {
            return generated.substring(0, 120);
        }
        return generated;
    }
}
