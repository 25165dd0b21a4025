package io.autopilot4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.autopilot4j.ActionExecutor;
import io.autopilot4j.core.ActionException;
import io.autopilot4j.core.ActionExecutorRegistry;
import io.autopilot4j.core.ActionResult;
import io.autopilot4j.core.FailureReason;
import io.autopilot4j.core.JobKind;
import io.autopilot4j.core.JobRecord;
import io.autopilot4j.core.JobSpec;
import io.autopilot4j.core.JobStatus;
import io.autopilot4j.core.Platform;
import io.autopilot4j.internal.memory.InMemoryJobStore;
import io.autopilot4j.session.AutomationSession;
import io.autopilot4j.session.ProfileMarkerSessionDriver;
import io.autopilot4j.session.SessionKey;
import io.autopilot4j.session.SessionManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobWorkerPoolTest {

    @TempDir
    Path profiles;

    private InMemoryJobStore jobStore;
    private SessionManager sessions;
    private JobWorkerPool pool;

    @BeforeEach
    void setUp() {
        jobStore = new InMemoryJobStore();
        sessions = new SessionManager(new ProfileMarkerSessionDriver(), profiles);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.stop(Duration.ofSeconds(5));
        }
        sessions.close();
    }

    @Test
    void claimedJobShouldRunInItsAccountSessionAndStoreTheResult() {
        AtomicReference<AutomationSession> seen = new AtomicReference<>();
        pool = newPool(1, Duration.ofSeconds(30), executor(JobKind.TWITTER_POST, (session, payload) -> {
            seen.set(session);
            return ActionResult.of("posted", Map.of("chars", ((String) payload.get("text")).length()));
        }));
        jobStore.enqueue(JobSpec.of(JobKind.TWITTER_POST, Map.of("account", "acme", "text", "hello")));

        assertTrue(pool.pollOnce("w-1"));

        JobRecord job = jobStore.findRecent(JobStatus.COMPLETED, 1).get(0);
        assertEquals("posted", job.result().get("summary"));
        assertEquals(Map.of("chars", 5), job.result().get("data"));
        assertEquals(1, job.attempts());
        assertEquals("acme", seen.get().account());
        assertEquals(Platform.TWITTER, seen.get().platform());
    }

    @Test
    void payloadWithoutAccountShouldUseTheDefaultAccount() {
        AtomicReference<String> account = new AtomicReference<>();
        pool = newPool(1, Duration.ofSeconds(30), executor(JobKind.LINKEDIN_CONNECT, (session, payload) -> {
            account.set(session.account());
            return null;
        }));
        jobStore.enqueue(JobSpec.of(JobKind.LINKEDIN_CONNECT, Map.of()));

        pool.pollOnce("w-1");

        assertEquals("fallback", account.get());
        assertEquals(1L, jobStore.countByStatus().get(JobStatus.COMPLETED));
    }

    @Test
    void actionExceptionShouldRecordItsReason() {
        pool = newPool(1, Duration.ofSeconds(30), executor(JobKind.TWITTER_ENGAGE, (session, payload) -> {
            throw new ActionException(FailureReason.LOGIN_REQUIRED, "session is logged out");
        }));
        String id = jobStore.enqueue(JobSpec.of(JobKind.TWITTER_ENGAGE, Map.of())).id();

        pool.pollOnce("w-1");

        JobRecord job = jobStore.findById(id).orElseThrow();
        assertEquals(JobStatus.FAILED, job.status());
        assertEquals(FailureReason.LOGIN_REQUIRED, job.failureReason());
        assertEquals("session is logged out", job.error());
    }

    @Test
    void unexpectedExceptionShouldBeRecordedAsExecutionError() {
        pool = newPool(1, Duration.ofSeconds(30), executor(JobKind.TWITTER_ENGAGE, (session, payload) -> {
            throw new IllegalStateException("selector changed");
        }));
        String id = jobStore.enqueue(JobSpec.of(JobKind.TWITTER_ENGAGE, Map.of())).id();

        pool.pollOnce("w-1");

        JobRecord job = jobStore.findById(id).orElseThrow();
        assertEquals(FailureReason.EXECUTION_ERROR, job.failureReason());
        assertEquals("selector changed", job.error());
    }

    @Test
    void jobWithoutExecutorShouldFail() {
        pool = newPool(1, Duration.ofSeconds(30));
        String id = jobStore.enqueue(JobSpec.of(JobKind.INSTAGRAM_POST, Map.of())).id();

        assertTrue(pool.pollOnce("w-1"));

        assertEquals(FailureReason.NO_EXECUTOR, jobStore.findById(id).orElseThrow().failureReason());
    }

    @Test
    void emptyQueueShouldReportNoWork() {
        pool = newPool(1, Duration.ofSeconds(30));

        assertFalse(pool.pollOnce("w-1"));
    }

    @Test
    void workersShouldDrainBacklogWithoutWaitingForThePollInterval() throws Exception {
        pool = newPool(1, Duration.ofMinutes(5), executor(JobKind.TWITTER_POST, (session, payload) -> ActionResult.of("ok")));
        for (int i = 0; i < 5; i++) {
            jobStore.enqueue(JobSpec.of(JobKind.TWITTER_POST, Map.of("n", i)));
        }

        pool.start();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> jobStore.countByStatus().get(JobStatus.COMPLETED) == 5L));
    }

    @Test
    void wakeUpShouldCutTheIdleWaitShort() throws Exception {
        pool = newPool(2, Duration.ofMinutes(5), executor(JobKind.TWITTER_POST, (session, payload) -> ActionResult.of("ok")));
        pool.start();
        Thread.sleep(200);

        jobStore.enqueue(JobSpec.of(JobKind.TWITTER_POST, Map.of()));
        pool.wakeUp();

        assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> jobStore.countByStatus().get(JobStatus.COMPLETED) == 1L));
    }

    @Test
    void jobsForOneSessionShouldNeverOverlapAcrossWorkers() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        pool = newPool(4, Duration.ofMillis(50), executor(JobKind.TWITTER_ENGAGE, (session, payload) -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            Thread.sleep(20);
            active.decrementAndGet();
            return ActionResult.of("engaged");
        }));
        for (int i = 0; i < 12; i++) {
            jobStore.enqueue(JobSpec.of(JobKind.TWITTER_ENGAGE, Map.of("account", "acme")));
        }

        pool.start();

        assertTrue(waitUntil(10, TimeUnit.SECONDS, () -> jobStore.countByStatus().get(JobStatus.COMPLETED) == 12L));
        assertEquals(1, maxActive.get());
    }

    @Test
    void jobsForDistinctAccountsShouldRunInParallel() throws Exception {
        CountDownLatch bothRunning = new CountDownLatch(2);
        pool = newPool(2, Duration.ofMillis(50), executor(JobKind.TWITTER_POST, (session, payload) -> {
            bothRunning.countDown();
            if (!bothRunning.await(5, TimeUnit.SECONDS)) {
                throw new ActionException(FailureReason.NETWORK_ERROR, "peer never started");
            }
            return ActionResult.of("ok");
        }));
        jobStore.enqueue(JobSpec.of(JobKind.TWITTER_POST, Map.of("account", "alpha")));
        jobStore.enqueue(JobSpec.of(JobKind.TWITTER_POST, Map.of("account", "beta")));

        pool.start();

        assertTrue(waitUntil(10, TimeUnit.SECONDS, () -> jobStore.countByStatus().get(JobStatus.COMPLETED) == 2L));
    }

    @Test
    void claimReclaimedWhileWaitingForTheSessionShouldNotRun() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        pool = newPool(1, Duration.ofSeconds(30), executor(JobKind.TWITTER_POST, (session, payload) -> {
            runs.incrementAndGet();
            return ActionResult.of("posted");
        }));
        String id = jobStore.enqueue(JobSpec.of(JobKind.TWITTER_POST, Map.of("account", "acme"))).id();
        SessionKey acme = new SessionKey("acme", Platform.TWITTER);
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService side = Executors.newFixedThreadPool(2);
        try {
            Future<Object> holder = side.submit(() -> sessions.withSession(acme, s -> {
                held.countDown();
                release.await(5, TimeUnit.SECONDS);
                return null;
            }));
            assertTrue(held.await(5, TimeUnit.SECONDS));

            Future<Boolean> worker = side.submit(() -> pool.pollOnce("w-1"));
            assertTrue(waitUntil(5, TimeUnit.SECONDS, () -> jobStore.countByStatus().get(JobStatus.PROCESSING) == 1L));
            assertEquals(1L, jobStore.reclaimStale(Instant.now().plusSeconds(60), 3).requeued());

            release.countDown();
            holder.get(5, TimeUnit.SECONDS);
            assertTrue(worker.get(5, TimeUnit.SECONDS));
        } finally {
            side.shutdownNow();
        }

        assertEquals(0, runs.get());
        assertEquals(JobStatus.PENDING, jobStore.findById(id).orElseThrow().status());

        assertTrue(pool.pollOnce("w-2"));
        assertEquals(1, runs.get());
        assertEquals(JobStatus.COMPLETED, jobStore.findById(id).orElseThrow().status());
    }

    @Test
    void backoffShouldDoubleAndCap() {
        assertEquals(Duration.ofSeconds(1), JobWorkerPool.backoff(1));
        assertEquals(Duration.ofSeconds(4), JobWorkerPool.backoff(3));
        assertEquals(Duration.ofSeconds(60), JobWorkerPool.backoff(30));
    }

    @FunctionalInterface
    interface Body {
        ActionResult run(AutomationSession session, Map<String, Object> payload) throws Exception;
    }

    private static ActionExecutor<Map<String, Object>> executor(JobKind kind, Body body) {
        return new ActionExecutor<>() {
            @Override
            public String jobType() {
                return kind.type();
            }

            @Override
            @SuppressWarnings("unchecked")
            public Class<Map<String, Object>> payloadClass() {
                return (Class<Map<String, Object>>) (Class<?>) Map.class;
            }

            @Override
            public ActionResult execute(AutomationSession session, Map<String, Object> payload) throws Exception {
                return body.run(session, payload);
            }
        };
    }

    private JobWorkerPool newPool(int concurrency, Duration pollEvery, ActionExecutor<?>... executors) {
        return new JobWorkerPool(
                jobStore,
                sessions,
                new ActionExecutorRegistry(List.of(executors)),
                new ObjectMapper(),
                new JobWorkerPool.Options(concurrency, pollEvery, "test-worker", "fallback")
        );
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(50);
        }
        return false;
    }
}
