package io.autopilot4j.session;

import io.autopilot4j.spi.AutomationContext;
import io.autopilot4j.spi.SessionDriver;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Driver without an automation backend. A profile counts as logged in when it contains an
 * {@value #AUTH_MARKER} file, which an external login flow writes after a manual sign-in.
 */
public class ProfileMarkerSessionDriver implements SessionDriver {

    public static final String AUTH_MARKER = "authenticated";

    @Override
    public AutomationContext open(SessionKey key, Path profileDir) {
        return new MarkerContext(profileDir);
    }

    static final class MarkerContext implements AutomationContext {
        private final Path profileDir;

        MarkerContext(Path profileDir) {
            this.profileDir = profileDir;
        }

        @Override
        public boolean isAuthenticated() {
            return Files.isRegularFile(profileDir.resolve(AUTH_MARKER));
        }

        @Override
        public void close() {
        }
    }
}
