package io.autopilot4j.session;

import io.autopilot4j.core.Platform;
import io.autopilot4j.spi.AutomationContext;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * A live automation context bound to one (account, platform) profile.
 *
 * <p>Instances are owned by {@link SessionManager} and only handed out while the caller holds
 * the session's lock, so executors may use the context without further synchronization.
 */
public final class AutomationSession {

    private final SessionKey key;
    private final Path profileDir;
    private final AutomationContext context;
    private final ProfileLock profileLock;
    private final Instant openedAt;
    private volatile boolean authenticated;

    AutomationSession(SessionKey key, Path profileDir, AutomationContext context, ProfileLock profileLock, Instant openedAt) {
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.profileDir = Objects.requireNonNull(profileDir, "profileDir must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.profileLock = Objects.requireNonNull(profileLock, "profileLock must not be null");
        this.openedAt = Objects.requireNonNull(openedAt, "openedAt must not be null");
    }

    public SessionKey key() {
        return key;
    }

    public String account() {
        return key.account();
    }

    public Platform platform() {
        return key.platform();
    }

    public Path profileDir() {
        return profileDir;
    }

    public Instant openedAt() {
        return openedAt;
    }

    /**
     * Result of the most recent login check.
     */
    public boolean isAuthenticated() {
        return authenticated;
    }

    public AutomationContext context() {
        return context;
    }

    public <C extends AutomationContext> C context(Class<C> type) {
        if (!type.isInstance(context)) {
            throw new IllegalStateException("session " + key + " context is " + context.getClass().getName()
                    + ", not " + type.getName());
        }
        return type.cast(context);
    }

    /**
     * Re-checks the authenticated-only marker and caches the outcome.
     */
    public boolean verifyLogin() throws Exception {
        authenticated = context.isAuthenticated();
        return authenticated;
    }

    void close() throws Exception {
        try {
            context.close();
        } finally {
            profileLock.close();
        }
    }
}
