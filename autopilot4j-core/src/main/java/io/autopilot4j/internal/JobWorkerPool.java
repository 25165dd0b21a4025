package io.autopilot4j.internal;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.autopilot4j.ActionExecutor;
import io.autopilot4j.core.ActionExecutorRegistry;
import io.autopilot4j.core.ActionResult;
import io.autopilot4j.core.FailureReason;
import io.autopilot4j.core.JobFailure;
import io.autopilot4j.core.JobRecord;
import io.autopilot4j.session.AutomationSession;
import io.autopilot4j.session.SessionKey;
import io.autopilot4j.session.SessionManager;
import io.autopilot4j.spi.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of consumer threads that claim jobs from the {@link JobStore} and run them.
 *
 * <p>Each thread loops independently: claim one job, execute it inside the session for its
 * (account, platform), write the outcome back. After a job it polls again right away; when the
 * queue is empty it waits up to {@code pollEvery} or until {@link #wakeUp()} is called.
 */
public class JobWorkerPool {
    private static final Logger log = LoggerFactory.getLogger(JobWorkerPool.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final JobStore jobStore;
    private final SessionManager sessionManager;
    private final ActionExecutorRegistry registry;
    private final ObjectMapper objectMapper;
    private final Options options;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Semaphore wakeSignal = new Semaphore(0);
    private ExecutorService threads;

    /**
     * @param concurrency    number of consumer threads
     * @param pollEvery      idle wait between polls
     * @param workerId       prefix of the per-thread claim owner id
     * @param defaultAccount account used when a payload names none
     */
    public record Options(int concurrency, Duration pollEvery, String workerId, String defaultAccount) {
        public Options {
            if (concurrency <= 0) {
                throw new IllegalArgumentException("concurrency must be a positive number");
            }
            Objects.requireNonNull(pollEvery, "pollEvery must not be null");
            if (pollEvery.isZero() || pollEvery.isNegative()) {
                throw new IllegalArgumentException("pollEvery must be a positive duration");
            }
            if (workerId == null || workerId.isBlank()) {
                throw new IllegalArgumentException("workerId must not be blank");
            }
            Objects.requireNonNull(defaultAccount, "defaultAccount must not be null");
        }
    }

    public JobWorkerPool(
            JobStore jobStore,
            SessionManager sessionManager,
            ActionExecutorRegistry registry,
            ObjectMapper objectMapper,
            Options options
    ) {
        this.jobStore = Objects.requireNonNull(jobStore, "jobStore must not be null");
        this.sessionManager = Objects.requireNonNull(sessionManager, "sessionManager must not be null");
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        AtomicInteger seq = new AtomicInteger();
        threads = Executors.newFixedThreadPool(options.concurrency(), r -> {
            Thread t = new Thread(r);
            t.setName("autopilot.worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        for (int i = 1; i <= options.concurrency(); i++) {
            String id = options.workerId() + "-" + i;
            threads.submit(() -> workerLoop(id));
        }
        log.info("autopilot workers started count={} workerId={}", options.concurrency(), options.workerId());
    }

    /**
     * Stops claiming new jobs and waits up to {@code grace} for running ones.
     */
    public void stop(Duration grace) {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        wakeSignal.release(options.concurrency());
        threads.shutdown();
        try {
            if (!threads.awaitTermination(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("autopilot workers still busy after grace={}; interrupting", grace);
                threads.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            threads.shutdownNow();
        } finally {
            threads = null;
            wakeSignal.drainPermits();
        }
        log.info("autopilot workers stopped");
    }

    public boolean isRunning() {
        return started.get();
    }

    /**
     * Cuts the idle wait short for every sleeping worker.
     */
    public void wakeUp() {
        int missing = options.concurrency() - wakeSignal.availablePermits();
        if (missing > 0) {
            wakeSignal.release(missing);
        }
    }

    /**
     * Claims and runs at most one job.
     *
     * @return true when a job was claimed
     */
    public boolean pollOnce(String workerId) {
        Optional<JobRecord> claimed = jobStore.claimNext(workerId);
        if (claimed.isEmpty()) {
            return false;
        }
        execute(claimed.get(), workerId);
        return true;
    }

    private void workerLoop(String workerId) {
        int errorCount = 0;
        while (started.get()) {
            boolean worked;
            try {
                worked = pollOnce(workerId);
                errorCount = 0;
            } catch (Exception e) {
                errorCount++;
                log.error("autopilot poll failed workerId={} attempt={} msg={}", workerId, errorCount, e.getMessage(), e);
                try {
                    Thread.sleep(backoff(errorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
                continue;
            }

            if (worked) {
                continue;
            }

            try {
                wakeSignal.tryAcquire(options.pollEvery().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    // Exponential backoff for repeated store failures: 1s, 2s, 4s ... capped at 60s.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount - 1, 15));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }

    private void execute(JobRecord job, String workerId) {
        Optional<ActionExecutor<?>> executor = registry.find(job.type());
        if (executor.isEmpty()) {
            log.error("autopilot no executor registered type={} id={}", job.type(), job.id());
            recordFailure(job, workerId, new JobFailure(FailureReason.NO_EXECUTOR,
                    "No ActionExecutor registered for job type: " + job.type()));
            return;
        }

        Instant startedAt = Instant.now();
        try {
            SessionKey key = new SessionKey(accountOf(job), executor.get().platform());
            log.debug("autopilot job started type={} id={} session={} attempt={}", job.type(), job.id(), key, job.attempts());

            Executed executed = sessionManager.withSession(key, session -> {
                // the stale sweep may have taken the claim while this worker waited for the session
                if (!jobStore.markStarted(job.id(), workerId)) {
                    return null;
                }
                return new Executed(invoke(executor.get(), session, job.payload()));
            });
            if (executed == null) {
                log.warn("autopilot job skipped; claim lost while waiting for session type={} id={} workerId={}",
                        job.type(), job.id(), workerId);
                return;
            }

            ActionResult result = executed.result();
            Map<String, Object> resultMap = result == null ? Map.of() : objectMapper.convertValue(result, MAP_TYPE);
            if (jobStore.complete(job.id(), workerId, resultMap)) {
                log.info("autopilot job completed type={} id={} tookMs={}",
                        job.type(), job.id(), Duration.between(startedAt, Instant.now()).toMillis());
            } else {
                log.warn("autopilot job result discarded; claim no longer held type={} id={} workerId={}",
                        job.type(), job.id(), workerId);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(job, workerId, new JobFailure(FailureReason.EXECUTION_ERROR, "interrupted"));
        } catch (Exception e) {
            JobFailure failure = JobFailure.of(e);
            if (failure.reason() == FailureReason.EXECUTION_ERROR) {
                log.error("autopilot job failed type={} id={} reason={} msg={}",
                        job.type(), job.id(), failure.reason(), failure.message(), e);
            } else {
                log.warn("autopilot job failed type={} id={} reason={} msg={}",
                        job.type(), job.id(), failure.reason(), failure.message());
            }
            recordFailure(job, workerId, failure);
        }
    }

    private record Executed(ActionResult result) {
    }

    private void recordFailure(JobRecord job, String workerId, JobFailure failure) {
        try {
            if (!jobStore.fail(job.id(), workerId, failure)) {
                log.warn("autopilot job failure discarded; claim no longer held type={} id={} workerId={}",
                        job.type(), job.id(), workerId);
            }
        } catch (Exception storeEx) {
            log.error("autopilot fail() write failed type={} id={} msg={}", job.type(), job.id(), storeEx.getMessage(), storeEx);
        }
    }

    private String accountOf(JobRecord job) {
        Object account = job.payload().get("account");
        if (account instanceof String s && !s.isBlank()) {
            return s;
        }
        return options.defaultAccount();
    }

    @SuppressWarnings("unchecked")
    private <T> ActionResult invoke(ActionExecutor<?> executor, AutomationSession session, Map<String, Object> payload) throws Exception {
        var typed = (ActionExecutor<T>) executor;
        T data = payload == null ? null : objectMapper.convertValue(payload, typed.payloadClass());
        return typed.execute(session, data);
    }
}
