package io.autopilot4j.session;

import io.autopilot4j.core.Platform;

import java.util.Objects;
import java.util.regex.Pattern;

public record SessionKey(String account, Platform platform) {

    private static final Pattern ACCOUNT = Pattern.compile("[A-Za-z0-9._@-]+");

    public SessionKey {
        Objects.requireNonNull(account, "account must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
        if (!ACCOUNT.matcher(account).matches() || account.startsWith(".")) {
            throw new IllegalArgumentException("account must be a plain identifier: " + account);
        }
        if (platform == Platform.SYSTEM) {
            throw new IllegalArgumentException("no sessions exist for platform " + platform);
        }
    }

    /**
     * Directory name of the persistent profile, {@code <account>_<platform>}.
     */
    public String profileName() {
        return account + "_" + platform.value();
    }

    @Override
    public String toString() {
        return account + "/" + platform.value();
    }
}
