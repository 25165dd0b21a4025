package io.autopilot4j.session;

import io.autopilot4j.core.ResourceBusyException;
import io.autopilot4j.spi.AutomationContext;
import io.autopilot4j.spi.SessionDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Owns every automation session in the process.
 *
 * <p>Each {@link SessionKey} maps to an entry with its own fair lock. The lock is held while a
 * session is opened and for the whole duration of a {@link #withSession} callback, so work on
 * one (account, platform) is strictly sequential while distinct keys proceed in parallel.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ActionResult r = sessions.withSession(new SessionKey("acme", Platform.TWITTER),
 *         session -> executor.execute(session, payload));
 * }</pre>
 */
public class SessionManager implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SessionManager.class);

    private static final Duration CLOSE_WAIT = Duration.ofSeconds(30);

    private final SessionDriver driver;
    private final Path profilesRoot;
    private final ConcurrentHashMap<SessionKey, SessionEntry> sessions = new ConcurrentHashMap<>();

    private static final class SessionEntry {
        private final ReentrantLock lock = new ReentrantLock(true);
        // written under lock; volatile so isOpen and openSessions can read without it
        private volatile AutomationSession session;
        // guarded by lock
        private boolean retired;
    }

    public SessionManager(SessionDriver driver, Path profilesRoot) {
        this.driver = Objects.requireNonNull(driver, "driver must not be null");
        this.profilesRoot = Objects.requireNonNull(profilesRoot, "profilesRoot must not be null");
    }

    /**
     * Returns the session for {@code key}, opening it on first use.
     *
     * <p>The returned handle is not locked; use {@link #withSession} to act on it.
     */
    public AutomationSession get(SessionKey key) throws Exception {
        return withSession(key, s -> s);
    }

    /**
     * Runs {@code callback} with exclusive use of the session for {@code key}.
     */
    public <R> R withSession(SessionKey key, SessionCallback<R> callback) throws Exception {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(callback, "callback must not be null");

        while (true) {
            SessionEntry entry = sessions.computeIfAbsent(key, k -> new SessionEntry());
            entry.lock.lockInterruptibly();
            try {
                if (entry.retired) {
                    // disconnected while we were waiting; go again with a fresh entry
                    continue;
                }
                if (entry.session == null) {
                    entry.session = open(key);
                }
                return callback.apply(entry.session);
            } finally {
                entry.lock.unlock();
            }
        }
    }

    /**
     * Closes the session, releases the profile and erases the profile directory.
     *
     * @return true when a session or a profile directory existed
     * @throws ResourceBusyException when the session is currently in use
     */
    public boolean disconnect(SessionKey key) throws IOException {
        Objects.requireNonNull(key, "key must not be null");

        SessionEntry entry = sessions.computeIfAbsent(key, k -> new SessionEntry());
        if (!entry.lock.tryLock()) {
            throw new ResourceBusyException("session " + key + " is in use");
        }
        try {
            boolean existed = entry.session != null;
            if (existed) {
                closeSession(entry.session);
                entry.session = null;
            }
            entry.retired = true;
            sessions.remove(key, entry);

            boolean erased = eraseProfile(profilesRoot.resolve(key.profileName()));
            log.info("autopilot session disconnected key={} hadSession={} profileErased={}", key, existed, erased);
            return existed || erased;
        } finally {
            entry.lock.unlock();
        }
    }

    public boolean isOpen(SessionKey key) {
        SessionEntry entry = sessions.get(key);
        return entry != null && entry.session != null;
    }

    public boolean isBusy(SessionKey key) {
        SessionEntry entry = sessions.get(key);
        return entry != null && entry.lock.isLocked();
    }

    public Set<SessionKey> openSessions() {
        return sessions.entrySet().stream()
                .filter(e -> e.getValue().session != null)
                .map(java.util.Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    public Path profileDir(SessionKey key) {
        return profilesRoot.resolve(key.profileName());
    }

    /**
     * Closes every session. Profiles stay on disk.
     */
    @Override
    public void close() {
        for (var e : List.copyOf(sessions.entrySet())) {
            SessionKey key = e.getKey();
            SessionEntry entry = e.getValue();
            boolean locked;
            try {
                locked = entry.lock.tryLock(CLOSE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("autopilot session close interrupted; remaining sessions left open");
                return;
            }
            if (!locked) {
                log.warn("autopilot session still busy at shutdown; leaving it open key={}", key);
                continue;
            }
            try {
                if (entry.session != null) {
                    closeSession(entry.session);
                    entry.session = null;
                }
                entry.retired = true;
                sessions.remove(key, entry);
            } finally {
                entry.lock.unlock();
            }
        }
    }

    private AutomationSession open(SessionKey key) throws Exception {
        Path dir = profilesRoot.resolve(key.profileName());
        Files.createDirectories(dir);

        ProfileLock profileLock = ProfileLock.acquire(dir);
        AutomationContext context;
        try {
            context = driver.open(key, dir);
        } catch (Exception e) {
            try {
                profileLock.close();
            } catch (IOException closeEx) {
                e.addSuppressed(closeEx);
            }
            throw e;
        }

        AutomationSession session = new AutomationSession(key, dir, context, profileLock, Instant.now());
        try {
            if (session.verifyLogin()) {
                log.info("autopilot session opened key={} profile={} authenticated=true", key, dir);
            } else {
                log.warn("autopilot session opened without login key={} profile={}", key, dir);
            }
        } catch (Exception e) {
            log.warn("autopilot login check failed key={} msg={}", key, e.getMessage(), e);
        }
        return session;
    }

    private void closeSession(AutomationSession session) {
        try {
            session.close();
        } catch (Exception e) {
            log.error("autopilot session close failed key={} msg={}", session.key(), e.getMessage(), e);
        }
    }

    private static boolean eraseProfile(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return false;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(p);
            }
        }
        return true;
    }
}
